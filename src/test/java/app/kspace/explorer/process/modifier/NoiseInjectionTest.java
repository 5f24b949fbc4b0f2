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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import app.kspace.explorer.data.ComplexGrid;

public class NoiseInjectionTest
{
	@Test
	public void testSigma()
	{
		assertEquals( 1.0, NoiseInjection.noiseSigma( 1.0, 0 ), 1e-12 );
		assertEquals( 0.1, NoiseInjection.noiseSigma( 1.0, 20 ), 1e-12 );
		assertEquals( 20.0, NoiseInjection.noiseSigma( 2.0, -20 ), 1e-9 );
	}

	@Test
	public void testSameSeedSameNoise()
	{
		final ComplexGrid a = ScanPercentageTest.ones( 16, 16 );
		final ComplexGrid b = ScanPercentageTest.ones( 16, 16 );
		final ComplexGrid c = ScanPercentageTest.ones( 16, 16 );

		assertTrue( NoiseInjection.apply( a, 10, 1234 ) );
		assertTrue( NoiseInjection.apply( b, 10, 1234 ) );
		assertTrue( NoiseInjection.apply( c, 10, 4321 ) );

		assertArrayEquals( a.storage(), b.storage(), 0 );
		assertFalse( Arrays.equals( a.storage(), c.storage() ) );
	}

	@Test
	public void testNoiseLevelFollowsSNR()
	{
		final ComplexGrid kspace = ScanPercentageTest.ones( 128, 128 );

		// mean magnitude is 1, so 0dB means a standard deviation of 1 per component
		NoiseInjection.apply( kspace, 0, 17 );

		final double[] data = kspace.storage();
		double sum = 0, sumSq = 0;

		for ( int i = 0; i < data.length; i += 2 )
		{
			final double re = data[ i ] - 1;
			final double im = data[ i + 1 ];
			sum += re + im;
			sumSq += re * re + im * im;
		}

		final double n = data.length;
		final double std = Math.sqrt( sumSq / n - ( sum / n ) * ( sum / n ) );

		assertEquals( 1.0, std, 0.05 );
	}

	@Test
	public void testNoiseFreeSNR()
	{
		final ComplexGrid kspace = ScanPercentageTest.ones( 4, 4 );
		assertFalse( NoiseInjection.apply( kspace, 30, 1 ) );
		assertEquals( 16, FrequencyFilterTest.countNonZero( kspace ) );
	}

	@Test
	public void testZeroSignalIsSkipped()
	{
		final ComplexGrid kspace = new ComplexGrid( 4, 4 );
		assertFalse( NoiseInjection.apply( kspace, 0, 1 ) );
		assertEquals( 0, FrequencyFilterTest.countNonZero( kspace ) );
	}
}
