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
package app.kspace.explorer.process.acquisition;

import app.kspace.explorer.data.GridOutOfBoundsException;

/**
 * Which k-space samples have been acquired so far in a simulated acquisition.
 *
 * @author K-space Explorer developers
 */
public class AcquisitionMask
{
	final int rows, cols;
	final boolean[] acquired; // row-major
	final long numAcquired;

	AcquisitionMask( final int rows, final int cols, final boolean[] acquired, final long numAcquired )
	{
		this.rows = rows;
		this.cols = cols;
		this.acquired = acquired;
		this.numAcquired = numAcquired;
	}

	public int rows() { return rows; }
	public int cols() { return cols; }

	/**
	 * @return number of acquired samples
	 */
	public long numAcquired() { return numAcquired; }

	public boolean isComplete() { return numAcquired == (long)rows * cols; }

	public boolean isAcquired( final int row, final int col )
	{
		if ( row < 0 || row >= rows || col < 0 || col >= cols )
			throw new GridOutOfBoundsException( "(" + row + ", " + col + ") outside of mask " + rows + "x" + cols );

		return acquired[ row * cols + col ];
	}

	/**
	 * @return true if the readout of this line has started (at least one sample acquired)
	 */
	public boolean isLineAcquired( final int row )
	{
		if ( row < 0 || row >= rows )
			throw new GridOutOfBoundsException( "row " + row + " outside of mask " + rows + "x" + cols );

		for ( int c = 0; c < cols; ++c )
			if ( acquired[ row * cols + c ] )
				return true;

		return false;
	}

	/**
	 * @return the line mask over all phase-encode lines, see {@link #isLineAcquired(int)}
	 */
	public boolean[] lineMask()
	{
		final boolean[] lines = new boolean[ rows ];

		for ( int r = 0; r < rows; ++r )
			lines[ r ] = isLineAcquired( r );

		return lines;
	}
}
