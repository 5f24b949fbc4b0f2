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
package app.kspace.explorer.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;

import app.kspace.explorer.process.parameters.InvalidParameterException;

public class ComplexGridTest
{
	@Test
	public void testSetGetAndImgView()
	{
		final ComplexGrid grid = new ComplexGrid( 3, 4, 2 );
		grid.set( 2, 1, 1, 5.0, -2.0 );

		assertEquals( 5.0, grid.getReal( 2, 1, 1 ), 0 );
		assertEquals( -2.0, grid.getImaginary( 2, 1, 1 ), 0 );
		assertEquals( 0.0, grid.getReal( 2, 1, 0 ), 0 );

		// imglib2 axes are x=col, y=row, z=channel
		final RandomAccess< ComplexDoubleType > ra = grid.img().randomAccess();
		ra.setPosition( new long[] { 1, 2, 1 } );
		assertEquals( 5.0, ra.get().getRealDouble(), 0 );
		assertEquals( -2.0, ra.get().getImaginaryDouble(), 0 );

		final RandomAccess< ComplexDoubleType > slice = grid.channel( 1 ).randomAccess();
		slice.setPosition( new long[] { 3, 0 } );
		slice.get().setComplexNumber( 1.5, 0.5 );
		assertEquals( 1.5, grid.getReal( 0, 3, 1 ), 0 );
	}

	@Test
	public void testOutOfBounds()
	{
		final ComplexGrid grid = new ComplexGrid( 3, 4 );

		for ( final int[] p : new int[][] { { -1, 0 }, { 3, 0 }, { 0, 4 }, { 0, -1 } } )
		{
			try
			{
				grid.getReal( p[ 0 ], p[ 1 ] );
				fail( "expected GridOutOfBoundsException for " + p[ 0 ] + "," + p[ 1 ] );
			}
			catch ( final GridOutOfBoundsException e )
			{
				// expected
			}
		}

		try
		{
			grid.addAt( 0, 0, 1, 1.0, 0.0 );
			fail( "channel 1 does not exist" );
		}
		catch ( final GridOutOfBoundsException e )
		{
			// expected
		}
	}

	@Test( expected = UnsupportedShapeException.class )
	public void testRaggedInput()
	{
		ComplexGrid.fromReal( new double[][] { { 1, 2, 3 }, { 4, 5 } } );
	}

	@Test( expected = UnsupportedShapeException.class )
	public void testMismatchingImaginaryPart()
	{
		ComplexGrid.fromArrays( new double[][][] { { { 1, 2 } } }, new double[][][] { { { 1, 2, 3 } } } );
	}

	@Test( expected = UnsupportedShapeException.class )
	public void testEmptyGrid()
	{
		new ComplexGrid( 0, 4 );
	}

	@Test
	public void testMagnitudeAndLogMagnitude()
	{
		final ComplexGrid grid = new ComplexGrid( 2, 2 );
		grid.set( 0, 1, 3, 4 );
		grid.set( 1, 0, -1, 0 );

		final Raster magnitude = grid.magnitude();
		assertEquals( 5.0, magnitude.get( 0, 1 ), 1e-12 );
		assertEquals( 1.0, magnitude.get( 1, 0 ), 1e-12 );
		assertEquals( 0.0, magnitude.min(), 0 );
		assertEquals( 5.0, magnitude.max(), 1e-12 );

		final Raster log = grid.logMagnitude();
		assertEquals( Math.log( 6 ), log.get( 0, 1 ), 1e-12 );
		assertEquals( 0.0, log.get( 0, 0 ), 0 );
	}

	@Test
	public void testRasterAsImg()
	{
		final ComplexGrid grid = new ComplexGrid( 2, 3 );
		grid.set( 1, 2, 0, -7 );

		assertEquals( -7.0, grid.get( 1, 2 ).getImaginaryDouble(), 0 );

		final RandomAccess< DoubleType > ra = grid.magnitude().toImg().randomAccess();
		ra.setPosition( new long[] { 2, 1 } );
		assertEquals( 7.0, ra.get().get(), 1e-12 );
	}

	@Test
	public void testZeroDiskIsClippedAtTheBorder()
	{
		final ComplexGrid grid = ones( 5, 5 );
		grid.zeroDisk( 0, 0, 1 );

		assertEquals( 0.0, grid.getReal( 0, 0 ), 0 );
		assertEquals( 0.0, grid.getReal( 1, 0 ), 0 );
		assertEquals( 0.0, grid.getReal( 0, 1 ), 0 );
		assertEquals( 1.0, grid.getReal( 1, 1 ), 0 ); // distance sqrt(2) > 1
		assertEquals( 22, countNonZero( grid ) );
	}

	@Test( expected = InvalidParameterException.class )
	public void testNegativeDiskRadius()
	{
		ones( 3, 3 ).zeroDisk( 1, 1, -1 );
	}

	@Test
	public void testScaledByAndCopyAreIndependent()
	{
		final ComplexGrid grid = ones( 2, 3 );
		final ComplexGrid scaled = grid.scaledBy( 2.5 );

		assertNotSame( grid.storage(), scaled.storage() );
		assertEquals( 2.5, scaled.getReal( 1, 2 ), 0 );
		assertEquals( 1.0, grid.getReal( 1, 2 ), 0 );
	}

	@Test
	public void testSelectRows()
	{
		final ComplexGrid grid = new ComplexGrid( 4, 2, 2 );
		for ( int c = 0; c < 2; ++c )
			for ( int r = 0; r < 4; ++r )
				grid.set( r, 1, c, r + 10 * c, 0 );

		final ComplexGrid selected = grid.selectRows( new int[] { 1, 3 } );

		assertTrue( selected.rows() == 2 && selected.cols() == 2 && selected.channels() == 2 );
		assertEquals( 3.0, selected.getReal( 1, 1, 0 ), 0 );
		assertEquals( 11.0, selected.getReal( 0, 1, 1 ), 0 );
	}

	static ComplexGrid ones( final int rows, final int cols )
	{
		final ComplexGrid grid = new ComplexGrid( rows, cols );
		for ( int r = 0; r < rows; ++r )
			for ( int c = 0; c < cols; ++c )
				grid.set( r, c, 1, 0 );
		return grid;
	}

	static int countNonZero( final ComplexGrid grid )
	{
		int n = 0;
		for ( int i = 0; i < grid.storage().length; i += 2 )
			if ( grid.storage()[ i ] != 0 || grid.storage()[ i + 1 ] != 0 )
				++n;
		return n;
	}
}
