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

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.view.IntervalView;
import net.imglib2.view.Views;

import app.kspace.explorer.process.parameters.InvalidParameterException;

/**
 * A fixed-size grid of complex samples, rows x cols, optionally stacked over a channel dimension.
 * <p>
 * The samples live in one interleaved (real, imaginary) double array that also backs an imglib2
 * {@link ArrayImg} with the axes x=column, y=row, z=channel. Within a channel the layout is row-major,
 * which is the layout JTransforms expects for its in-place complex transforms.
 * <p>
 * All coordinate based accessors are bounds-checked and throw {@link GridOutOfBoundsException}.
 *
 * @author K-space Explorer developers
 */
public class ComplexGrid
{
	final int rows, cols, channels;

	// interleaved re/im, index = ( ( channel * rows + row ) * cols + col ) * 2
	final double[] data;

	final ArrayImg< ComplexDoubleType, DoubleArray > img;

	/**
	 * Creates an all-zero grid.
	 *
	 * @param rows - number of rows (phase-encode lines), &gt;0
	 * @param cols - number of columns (readout samples), &gt;0
	 * @param channels - number of channels (coils), &gt;0
	 */
	public ComplexGrid( final int rows, final int cols, final int channels )
	{
		this( rows, cols, channels, new double[ 2 * numSamples( rows, cols, channels ) ] );
	}

	public ComplexGrid( final int rows, final int cols )
	{
		this( rows, cols, 1 );
	}

	ComplexGrid( final int rows, final int cols, final int channels, final double[] data )
	{
		this.rows = rows;
		this.cols = cols;
		this.channels = channels;
		this.data = data;
		this.img = ArrayImgs.complexDoubles( data, cols, rows, channels );
	}

	/**
	 * @param real - real parts indexed [channel][row][col]
	 * @param imaginary - imaginary parts with the same shape, or null for purely real data
	 * @return a new grid holding a copy of the values
	 * @throws UnsupportedShapeException if the arrays are empty, ragged or differ in shape
	 */
	public static ComplexGrid fromArrays( final double[][][] real, final double[][][] imaginary )
	{
		if ( real == null || real.length == 0 || real[ 0 ] == null || real[ 0 ].length == 0 || real[ 0 ][ 0 ] == null )
			throw new UnsupportedShapeException( "k-space data must have at least one channel, row and column" );

		final int channels = real.length;
		final int rows = real[ 0 ].length;
		final int cols = real[ 0 ][ 0 ].length;

		if ( imaginary != null && imaginary.length != channels )
			throw new UnsupportedShapeException( "real part has " + channels + " channels, imaginary part " + imaginary.length );

		final ComplexGrid grid = new ComplexGrid( rows, cols, channels );

		for ( int c = 0; c < channels; ++c )
		{
			checkShape( real[ c ], rows, cols, "channel " + c + " (real)" );

			if ( imaginary != null )
				checkShape( imaginary[ c ], rows, cols, "channel " + c + " (imaginary)" );

			for ( int r = 0; r < rows; ++r )
				for ( int x = 0; x < cols; ++x )
				{
					final int i = grid.index( r, x, c );
					grid.data[ i ] = real[ c ][ r ][ x ];
					grid.data[ i + 1 ] = imaginary == null ? 0 : imaginary[ c ][ r ][ x ];
				}
		}

		return grid;
	}

	/**
	 * @param real - a single-channel, purely real grid indexed [row][col]
	 * @return a new single-channel grid
	 */
	public static ComplexGrid fromReal( final double[][] real )
	{
		return fromArrays( new double[][][] { real }, null );
	}

	public int rows() { return rows; }
	public int cols() { return cols; }
	public int channels() { return channels; }

	/**
	 * @return the backing imglib2 image (x=column, y=row, z=channel), changes write through
	 */
	public ArrayImg< ComplexDoubleType, DoubleArray > img() { return img; }

	/**
	 * @param channel - the channel index
	 * @return a 2-D view (x=column, y=row) on one channel, changes write through
	 */
	public IntervalView< ComplexDoubleType > channel( final int channel )
	{
		checkChannel( channel );
		return Views.hyperSlice( img, 2, channel );
	}

	/**
	 * @return the interleaved (real, imaginary) storage, row-major within each channel, channels consecutive
	 */
	public double[] storage() { return data; }

	public double getReal( final int row, final int col, final int channel ) { return data[ checkedIndex( row, col, channel ) ]; }
	public double getImaginary( final int row, final int col, final int channel ) { return data[ checkedIndex( row, col, channel ) + 1 ]; }
	public double getReal( final int row, final int col ) { return getReal( row, col, 0 ); }
	public double getImaginary( final int row, final int col ) { return getImaginary( row, col, 0 ); }

	public ComplexDoubleType get( final int row, final int col, final int channel )
	{
		final int i = checkedIndex( row, col, channel );
		return new ComplexDoubleType( data[ i ], data[ i + 1 ] );
	}

	public ComplexDoubleType get( final int row, final int col ) { return get( row, col, 0 ); }

	public void set( final int row, final int col, final int channel, final double real, final double imaginary )
	{
		final int i = checkedIndex( row, col, channel );
		data[ i ] = real;
		data[ i + 1 ] = imaginary;
	}

	public void set( final int row, final int col, final double real, final double imaginary )
	{
		set( row, col, 0, real, imaginary );
	}

	/**
	 * Superimposes a complex value onto one sample.
	 */
	public void addAt( final int row, final int col, final int channel, final double real, final double imaginary )
	{
		final int i = checkedIndex( row, col, channel );
		data[ i ] += real;
		data[ i + 1 ] += imaginary;
	}

	public void addAt( final int row, final int col, final double real, final double imaginary )
	{
		addAt( row, col, 0, real, imaginary );
	}

	/**
	 * Sets all samples within the given euclidean distance of (row, col) to zero. The center must lie
	 * inside the grid, the disk itself is clipped at the grid border.
	 *
	 * @param row - center row
	 * @param col - center column
	 * @param channel - the channel
	 * @param radius - radius in samples, &gt;=0 (0 erases only the center sample)
	 * @throws InvalidParameterException if the radius is negative
	 */
	public void zeroDisk( final int row, final int col, final int channel, final int radius )
	{
		checkedIndex( row, col, channel );

		if ( radius < 0 )
			throw new InvalidParameterException( "radius must be >= 0, but was " + radius );

		final long r2 = (long)radius * radius;

		for ( int r = Math.max( 0, row - radius ); r <= Math.min( rows - 1, row + radius ); ++r )
			for ( int x = Math.max( 0, col - radius ); x <= Math.min( cols - 1, col + radius ); ++x )
			{
				final long dr = r - row;
				final long dc = x - col;

				if ( dr * dr + dc * dc <= r2 )
				{
					final int i = index( r, x, channel );
					data[ i ] = 0;
					data[ i + 1 ] = 0;
				}
			}
	}

	public void zeroDisk( final int row, final int col, final int radius )
	{
		zeroDisk( row, col, 0, radius );
	}

	/**
	 * Sets one row to zero in all channels.
	 */
	public void zeroRow( final int row )
	{
		checkedIndex( row, 0, 0 );

		for ( int c = 0; c < channels; ++c )
		{
			final int start = index( row, 0, c );
			Arrays.fill( data, start, start + 2 * cols, 0 );
		}
	}

	/**
	 * Multiplies one row by a real factor in all channels.
	 */
	public void scaleRow( final int row, final double factor )
	{
		checkedIndex( row, 0, 0 );

		for ( int c = 0; c < channels; ++c )
		{
			final int start = index( row, 0, c );
			for ( int i = start; i < start + 2 * cols; ++i )
				data[ i ] *= factor;
		}
	}

	/**
	 * @return a new grid with every sample multiplied by a real factor
	 */
	public ComplexGrid scaledBy( final double factor )
	{
		final ComplexGrid scaled = copy();

		for ( int i = 0; i < scaled.data.length; ++i )
			scaled.data[ i ] *= factor;

		return scaled;
	}

	/**
	 * @param rowIndices - rows to keep, in the order they should appear
	 * @return a new grid made of the given rows (all channels), e.g. for a reduced field of view
	 */
	public ComplexGrid selectRows( final int[] rowIndices )
	{
		if ( rowIndices.length == 0 )
			throw new UnsupportedShapeException( "cannot select zero rows" );

		final ComplexGrid selected = new ComplexGrid( rowIndices.length, cols, channels );

		for ( int c = 0; c < channels; ++c )
			for ( int r = 0; r < rowIndices.length; ++r )
				System.arraycopy( data, checkedIndex( rowIndices[ r ], 0, c ), selected.data, selected.index( r, 0, c ), 2 * cols );

		return selected;
	}

	public ComplexGrid copy()
	{
		return new ComplexGrid( rows, cols, channels, data.clone() );
	}

	/**
	 * @return |z| of one channel
	 */
	public Raster magnitude( final int channel )
	{
		checkChannel( channel );

		final double[] values = new double[ rows * cols ];
		final Cursor< ComplexDoubleType > cursor = channel( channel ).cursor();

		// flat iteration order of an ArrayImg hyperslice is row-major
		for ( int i = 0; i < values.length; ++i )
		{
			final ComplexDoubleType z = cursor.next();
			final double re = z.getRealDouble();
			final double im = z.getImaginaryDouble();
			values[ i ] = Math.sqrt( re * re + im * im );
		}

		return new Raster( rows, cols, values );
	}

	public Raster magnitude() { return magnitude( 0 ); }

	/**
	 * @return log(1+|z|) of one channel, compresses the dynamic range of k-space for display
	 */
	public Raster logMagnitude( final int channel )
	{
		final Raster magnitude = magnitude( channel );
		final double[] values = magnitude.values;

		for ( int i = 0; i < values.length; ++i )
			values[ i ] = Math.log1p( values[ i ] );

		return new Raster( rows, cols, values );
	}

	public Raster logMagnitude() { return logMagnitude( 0 ); }

	@Override
	public String toString()
	{
		return "ComplexGrid[" + rows + "x" + cols + "x" + channels + "]";
	}

	final int index( final int row, final int col, final int channel )
	{
		return ( ( channel * rows + row ) * cols + col ) * 2;
	}

	final int checkedIndex( final int row, final int col, final int channel )
	{
		if ( row < 0 || row >= rows || col < 0 || col >= cols || channel < 0 || channel >= channels )
			throw new GridOutOfBoundsException( row, col, channel, this );

		return index( row, col, channel );
	}

	private void checkChannel( final int channel )
	{
		if ( channel < 0 || channel >= channels )
			throw new GridOutOfBoundsException( "channel " + channel + " outside of " + this );
	}

	private static void checkShape( final double[][] plane, final int rows, final int cols, final String name )
	{
		if ( plane == null || plane.length != rows )
			throw new UnsupportedShapeException( name + " does not have " + rows + " rows" );

		for ( int r = 0; r < rows; ++r )
			if ( plane[ r ] == null || plane[ r ].length != cols )
				throw new UnsupportedShapeException( name + ", row " + r + " does not have " + cols + " columns" );
	}

	private static int numSamples( final int rows, final int cols, final int channels )
	{
		if ( rows <= 0 || cols <= 0 || channels <= 0 )
			throw new UnsupportedShapeException( "invalid grid dimensions " + rows + "x" + cols + "x" + channels );

		final long n = (long)rows * cols * channels;

		if ( 2 * n > Integer.MAX_VALUE - 8 )
			throw new UnsupportedShapeException( "grid of " + rows + "x" + cols + "x" + channels + " is too large" );

		return (int)n;
	}
}
