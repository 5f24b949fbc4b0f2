/*-
 * #%L
 * Software for exploring how modifications of raw k-space data
 * affect reconstructed magnetic resonance images.
 * %%
 * Copyright (C) 2019 - 2021 K-space Explorer developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package app.kspace.explorer.process.modifier;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * Adds complex white Gaussian noise so that the k-space reaches a target signal-to-noise ratio,
 * SNR [dB] = 20 * log10( S / N ), where S is the mean magnitude of the k-space and N the standard
 * deviation of the noise (of the real and of the imaginary part, which are drawn independently).
 * <p>
 * The noise is fully determined by the seed, so repeated recomputes with the same seed are identical.
 */
public class NoiseInjection implements KSpaceModifier
{
	private static final Logger LOG = LoggerFactory.getLogger( NoiseInjection.class );

	/**
	 * SNR at and above which no noise is added
	 */
	public static double noiseFreeSNR = 30;

	/**
	 * @return the noise standard deviation for the mean signal and the SNR in dB
	 */
	public static double noiseSigma( final double meanSignal, final double snrDB )
	{
		return meanSignal / FastMath.pow( 10.0, snrDB / 20.0 );
	}

	public static double meanMagnitude( final ComplexGrid kspace )
	{
		final double[] data = kspace.storage();

		double sum = 0;

		for ( int i = 0; i < data.length; i += 2 )
			sum += Math.sqrt( data[ i ] * data[ i ] + data[ i + 1 ] * data[ i + 1 ] );

		return sum / ( data.length / 2 );
	}

	/**
	 * @param kspace - modified in place
	 * @param snrDB - target SNR in dB, -30...30
	 * @param seed - seed of the noise generator
	 * @return false if no noise was added (noise-free SNR, or an all-zero k-space for which the SNR is undefined)
	 */
	public static boolean apply( final ComplexGrid kspace, final double snrDB, final long seed )
	{
		ModifierTools.checkRange( "SNR", snrDB, -30, 30 );

		if ( snrDB >= noiseFreeSNR )
			return false;

		final double meanSignal = meanMagnitude( kspace );

		if ( !( meanSignal > 0 ) || Double.isInfinite( meanSignal ) )
		{
			LOG.warn( "Mean signal of {} is {}, SNR is undefined, skipping noise injection.", kspace, meanSignal );
			return false;
		}

		final double sigma = noiseSigma( meanSignal, snrDB );
		final RandomGenerator rnd = new Well19937c( seed );
		final double[] data = kspace.storage();

		for ( int i = 0; i < data.length; ++i )
			data[ i ] += sigma * rnd.nextGaussian();

		LOG.debug( "Added noise with sigma={} (mean signal={}, SNR={}dB)", sigma, meanSignal, snrDB );

		return true;
	}

	@Override
	public boolean isActive( final ModifierParameters parameters )
	{
		return parameters.noiseSNR() < noiseFreeSNR;
	}

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		apply( kspace, parameters.noiseSNR(), parameters.noiseSeed() );
		return kspace;
	}

	@Override
	public String getName() { return "noise"; }
}
