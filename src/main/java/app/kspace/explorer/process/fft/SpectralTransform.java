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
package app.kspace.explorer.process.fft;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.DoubleFFT_2D;

import app.kspace.explorer.Threads;
import app.kspace.explorer.data.ComplexGrid;

/**
 * Centered 2-D discrete Fourier transform between image space and k-space, applied independently
 * to every channel of a {@link ComplexGrid}.
 * <p>
 * Centered means the zero frequency sits at index (rows/2, cols/2), so that the center of the k-space
 * display shows the low spatial frequencies. This corresponds to fftshift( fft2( ifftshift( x ) ) ).
 * The forward transform is unnormalized, the inverse scales by 1/(rows*cols), hence
 * inverse( forward( x ) ) == x up to floating point precision.
 *
 * @author K-space Explorer developers
 */
public class SpectralTransform
{
	// JTransforms plans are not shared between threads
	private static final ThreadLocal< Map< Long, DoubleFFT_2D > > PLANS = ThreadLocal.withInitial( HashMap::new );
	private static final ThreadLocal< Map< Integer, DoubleFFT_1D > > PLANS_1D = ThreadLocal.withInitial( HashMap::new );

	/**
	 * @param image - image space data
	 * @return the centered k-space of every channel as a new grid
	 */
	public static ComplexGrid forward( final ComplexGrid image )
	{
		final ComplexGrid kspace = image.copy();
		transformInPlace( kspace, true, null );
		return kspace;
	}

	/**
	 * @param kspace - centered k-space data
	 * @return the image of every channel as a new grid
	 */
	public static ComplexGrid inverse( final ComplexGrid kspace )
	{
		final ComplexGrid image = kspace.copy();
		transformInPlace( image, false, null );
		return image;
	}

	/**
	 * Transforms all channels in place.
	 *
	 * @param grid - the data, overwritten by its transform
	 * @param forward - true for image to k-space, false for k-space to image
	 * @param service - channels are transformed in parallel on this service, or sequentially if null or single-channel
	 */
	public static void transformInPlace( final ComplexGrid grid, final boolean forward, final ExecutorService service )
	{
		final int rows = grid.rows();
		final int cols = grid.cols();
		final double[] data = grid.storage();
		final int channelSize = 2 * rows * cols;

		if ( service == null || grid.channels() == 1 )
		{
			for ( int c = 0; c < grid.channels(); ++c )
				transformChannel( data, c * channelSize, rows, cols, forward );

			return;
		}

		final ArrayList< Callable< Void > > tasks = new ArrayList<>();

		for ( int c = 0; c < grid.channels(); ++c )
		{
			final int offset = c * channelSize;

			tasks.add( () ->
			{
				transformChannel( data, offset, rows, cols, forward );
				return null;
			});
		}

		Threads.execTasks( tasks, service, ( forward ? "forward" : "inverse" ) + " transform " + grid );
	}

	/*
	 * Transforms one channel stored at data[ offset ... offset + 2*rows*cols ). The ifftshift is folded
	 * into copying the channel into the transform buffer, the fftshift into copying it back.
	 */
	private static void transformChannel( final double[] data, final int offset, final int rows, final int cols, final boolean forward )
	{
		final double[] buffer = new double[ 2 * rows * cols ];

		for ( int r = 0; r < rows; ++r )
		{
			final int tr = ( r + rows - rows / 2 ) % rows;

			for ( int c = 0; c < cols; ++c )
			{
				final int tc = ( c + cols - cols / 2 ) % cols;
				final int source = offset + 2 * ( r * cols + c );
				final int target = 2 * ( tr * cols + tc );

				buffer[ target ] = data[ source ];
				buffer[ target + 1 ] = data[ source + 1 ];
			}
		}

		if ( rows > 1 && cols > 1 )
		{
			final DoubleFFT_2D fft = plan( rows, cols );

			if ( forward )
				fft.complexForward( buffer );
			else
				fft.complexInverse( buffer, true );
		}
		else if ( rows * cols > 1 )
		{
			// DoubleFFT_2D needs at least two rows and columns, a single line is contiguous in the buffer
			final DoubleFFT_1D fft = PLANS_1D.get().computeIfAbsent( rows * cols, n -> new DoubleFFT_1D( n ) );

			if ( forward )
				fft.complexForward( buffer );
			else
				fft.complexInverse( buffer, true );
		}

		for ( int r = 0; r < rows; ++r )
		{
			final int tr = ( r + rows / 2 ) % rows;

			for ( int c = 0; c < cols; ++c )
			{
				final int tc = ( c + cols / 2 ) % cols;
				final int source = 2 * ( r * cols + c );
				final int target = offset + 2 * ( tr * cols + tc );

				data[ target ] = buffer[ source ];
				data[ target + 1 ] = buffer[ source + 1 ];
			}
		}
	}

	private static DoubleFFT_2D plan( final int rows, final int cols )
	{
		return PLANS.get().computeIfAbsent( ( (long)rows << 32 ) | cols, k -> new DoubleFFT_2D( rows, cols ) );
	}
}
