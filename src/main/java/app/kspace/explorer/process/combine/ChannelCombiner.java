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
package app.kspace.explorer.process.combine;

import java.util.ArrayList;
import java.util.List;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.data.Raster;

/**
 * Combines the reconstructed images of a multi-channel (multi-coil) acquisition into one magnitude
 * image by root-sum-of-squares, composite = sqrt( sum_ch |image_ch|^2 ).
 *
 * @author K-space Explorer developers
 */
public class ChannelCombiner
{
	/**
	 * @param images - image space data, one channel per coil
	 * @return the root-sum-of-squares composite; for a single channel its magnitude
	 */
	public static Raster rootSumOfSquares( final ComplexGrid images )
	{
		if ( images.channels() == 1 )
			return images.magnitude( 0 );

		final int size = images.rows() * images.cols();
		final double[] data = images.storage();
		final double[] sumSq = new double[ size ];

		for ( int c = 0; c < images.channels(); ++c )
		{
			final int offset = 2 * c * size;

			for ( int i = 0; i < size; ++i )
			{
				final double re = data[ offset + 2 * i ];
				final double im = data[ offset + 2 * i + 1 ];
				sumSq[ i ] += re * re + im * im;
			}
		}

		for ( int i = 0; i < size; ++i )
			sumSq[ i ] = Math.sqrt( sumSq[ i ] );

		return Raster.of( images.rows(), images.cols(), sumSq );
	}

	/**
	 * @return the magnitude image of every channel
	 */
	public static List< Raster > channelMagnitudes( final ComplexGrid images )
	{
		final ArrayList< Raster > magnitudes = new ArrayList<>();

		for ( int c = 0; c < images.channels(); ++c )
			magnitudes.add( images.magnitude( c ) );

		return magnitudes;
	}
}
