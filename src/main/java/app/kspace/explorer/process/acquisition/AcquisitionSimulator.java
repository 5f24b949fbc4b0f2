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

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.modifier.ModifierTools;

/**
 * Simulates the progressive filling of k-space. The traversal is given by a {@link FillOrder}, the
 * progress by the fill percentage: at p percent the first floor( rows * cols * p / 100 ) samples of
 * the traversal are acquired. Coverage therefore never shrinks when p grows.
 *
 * @author K-space Explorer developers
 */
public class AcquisitionSimulator
{
	/**
	 * @param rows - number of phase-encode lines
	 * @param cols - number of samples per line
	 * @param fillPercentage - acquisition progress, 0...100
	 * @param order - the traversal
	 * @return the mask of acquired samples
	 */
	public static AcquisitionMask mask( final int rows, final int cols, final double fillPercentage, final FillOrder order )
	{
		ModifierTools.checkRange( "fill percentage", fillPercentage, 0, 100 );

		final long total = (long)rows * cols;
		final long numAcquired = Math.min( total, (long)Math.floor( total * fillPercentage / 100.0 ) );

		final boolean[] acquired = new boolean[ rows * cols ];
		final int[] lines = order.lineOrder( rows );

		long remaining = numAcquired;

		for ( int step = 0; step < lines.length && remaining > 0; ++step )
		{
			final int row = lines[ step ];
			final boolean reversed = order.isReversed( step );

			for ( int i = 0; i < cols && remaining > 0; ++i, --remaining )
			{
				final int col = reversed ? cols - 1 - i : i;
				acquired[ row * cols + col ] = true;
			}
		}

		return new AcquisitionMask( rows, cols, acquired, numAcquired );
	}

	public static AcquisitionMask mask( final int rows, final int cols, final double fillPercentage, final FillOrder.Type type )
	{
		return mask( rows, cols, fillPercentage, FillOrder.create( type ) );
	}

	/**
	 * Zeroes all samples that are not acquired yet, in every channel.
	 */
	public static void apply( final ComplexGrid kspace, final AcquisitionMask mask )
	{
		if ( mask.rows() != kspace.rows() || mask.cols() != kspace.cols() )
			throw new IllegalArgumentException( "mask " + mask.rows() + "x" + mask.cols() + " does not match " + kspace );

		if ( mask.isComplete() )
			return;

		final double[] data = kspace.storage();
		final int channelSize = kspace.rows() * kspace.cols();

		for ( int c = 0; c < kspace.channels(); ++c )
			for ( int i = 0; i < channelSize; ++i )
				if ( !mask.acquired[ i ] )
				{
					final int j = 2 * ( c * channelSize + i );
					data[ j ] = 0;
					data[ j + 1 ] = 0;
				}
	}
}
