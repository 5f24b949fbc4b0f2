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

import org.apache.commons.math3.util.FastMath;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * Multiplies every phase-encode line with the symmetric Hamming coefficient of its row, which tapers
 * the periphery of k-space and reduces Gibbs ringing in the image.
 */
public class HammingWindow implements KSpaceModifier
{
	/**
	 * @param n - window length
	 * @return the symmetric Hamming window 0.54 - 0.46 * cos( 2 pi i / ( n - 1 ) )
	 */
	public static double[] coefficients( final int n )
	{
		final double[] w = new double[ n ];

		if ( n == 1 )
		{
			w[ 0 ] = 1;
			return w;
		}

		for ( int i = 0; i < n; ++i )
			w[ i ] = 0.54 - 0.46 * FastMath.cos( 2 * Math.PI * i / ( n - 1 ) );

		return w;
	}

	public static void apply( final ComplexGrid kspace )
	{
		final double[] w = coefficients( kspace.rows() );

		for ( int r = 0; r < kspace.rows(); ++r )
			kspace.scaleRow( r, w[ r ] );
	}

	@Override
	public boolean isActive( final ModifierParameters parameters ) { return parameters.hamming(); }

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		apply( kspace );
		return kspace;
	}

	@Override
	public String getName() { return "hamming"; }
}
