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

import java.util.Random;

import org.junit.Test;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.fft.SpectralTransform;
import app.kspace.explorer.process.parameters.InvalidParameterException;

public class PartialFourierTest
{
	@Test
	public void testMissingLines()
	{
		assertEquals( 64, PartialFourier.missingLines( 256, 50 ) );
		assertEquals( 3, PartialFourier.missingLines( 8, 0 ) );
		assertEquals( 2, PartialFourier.missingLines( 8, 50 ) );
		assertEquals( 0, PartialFourier.missingLines( 8, 100 ) );
		assertEquals( 0, PartialFourier.missingLines( 1, 0 ) );
	}

	@Test
	public void testZeroFill()
	{
		final ComplexGrid kspace = SpectralTransform.forward( realImage( 8, 6, 3 ) );
		final ComplexGrid original = kspace.copy();

		PartialFourier.apply( kspace, 50, true );

		for ( int r = 0; r < 8; ++r )
			for ( int c = 0; c < 6; ++c )
			{
				final double expected = r >= 6 ? 0 : original.getReal( r, c );
				assertEquals( expected, kspace.getReal( r, c ), 0 );
			}
	}

	@Test
	public void testConjugateFillRestoresRealImage()
	{
		// the k-space of a real image is conjugate point symmetric, so the mirrored lines equal the removed ones
		for ( final int[] size : new int[][] { { 8, 8 }, { 9, 6 }, { 10, 7 } } )
		{
			final ComplexGrid kspace = SpectralTransform.forward( realImage( size[ 0 ], size[ 1 ], 11 ) );
			final ComplexGrid original = kspace.copy();

			PartialFourier.apply( kspace, 0, false );

			assertArrayEquals( original.storage(), kspace.storage(), 1e-9 );
		}
	}

	@Test
	public void testConjugateFillOverwritesMissingLines()
	{
		final ComplexGrid kspace = new ComplexGrid( 8, 4 );
		kspace.set( 1, 1, 2, 3 );
		kspace.set( 7, 3, 100, 100 );

		PartialFourier.apply( kspace, 0, false );

		// (7,3) mirrors (8-7, 4-3)
		assertEquals( 2.0, kspace.getReal( 7, 3 ), 0 );
		assertEquals( -3.0, kspace.getImaginary( 7, 3 ), 0 );
	}

	@Test( expected = InvalidParameterException.class )
	public void testOutOfRange()
	{
		PartialFourier.apply( new ComplexGrid( 4, 4 ), 120, false );
	}

	static ComplexGrid realImage( final int rows, final int cols, final long seed )
	{
		final Random rnd = new Random( seed );
		final ComplexGrid image = new ComplexGrid( rows, cols );

		for ( int r = 0; r < rows; ++r )
			for ( int c = 0; c < cols; ++c )
				image.set( r, c, rnd.nextDouble(), 0 );

		return image;
	}
}
