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

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * A 2-D raster of real, non-negative intensities as handed to the display, together with its own
 * min/max range. Read-only once created.
 *
 * @author K-space Explorer developers
 */
public class Raster
{
	final int rows, cols;
	final double[] values;
	final double min, max;

	/**
	 * Takes ownership of the given row-major array.
	 */
	Raster( final int rows, final int cols, final double[] values )
	{
		if ( values.length != rows * cols )
			throw new UnsupportedShapeException( "raster of " + rows + "x" + cols + " cannot hold " + values.length + " values" );

		this.rows = rows;
		this.cols = cols;
		this.values = values;

		double min = Double.MAX_VALUE;
		double max = -Double.MAX_VALUE;

		for ( final double v : values )
		{
			min = Math.min( min, v );
			max = Math.max( max, v );
		}

		this.min = min;
		this.max = max;
	}

	/**
	 * @param rows - number of rows
	 * @param cols - number of columns
	 * @param values - row-major values, copied
	 * @return a new raster
	 */
	public static Raster of( final int rows, final int cols, final double[] values )
	{
		return new Raster( rows, cols, values.clone() );
	}

	public int rows() { return rows; }
	public int cols() { return cols; }
	public double min() { return min; }
	public double max() { return max; }

	public double get( final int row, final int col )
	{
		if ( row < 0 || row >= rows || col < 0 || col >= cols )
			throw new GridOutOfBoundsException( "(" + row + ", " + col + ") outside of raster " + rows + "x" + cols );

		return values[ row * cols + col ];
	}

	/**
	 * @return a copy of the row-major values
	 */
	public double[] values() { return values.clone(); }

	/**
	 * @return an imglib2 image (x=column, y=row) on a copy of the values
	 */
	public ArrayImg< DoubleType, DoubleArray > toImg()
	{
		return ArrayImgs.doubles( values.clone(), cols, rows );
	}

	/**
	 * @return true if both rasters have the same shape and bit-identical values
	 */
	public boolean identical( final Raster other )
	{
		return rows == other.rows && cols == other.cols && Arrays.equals( values, other.values );
	}

	@Override
	public String toString()
	{
		return "Raster[" + rows + "x" + cols + ", min=" + min + ", max=" + max + "]";
	}
}
