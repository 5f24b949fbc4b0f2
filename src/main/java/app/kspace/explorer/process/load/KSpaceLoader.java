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
package app.kspace.explorer.process.load;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.data.UnsupportedShapeException;
import app.kspace.explorer.process.fft.SpectralTransform;
import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ImageProcessor;

/**
 * Opens images with ImageJ (PNG, TIFF, DICOM, ... anything {@link IJ#openImage(String)} can read) and
 * turns them into k-space. Every slice of a stack becomes one channel.
 *
 * @author K-space Explorer developers
 */
public class KSpaceLoader
{
	private static final Logger LOG = LoggerFactory.getLogger( KSpaceLoader.class );

	/**
	 * @param path - image file
	 * @return the centered k-space of the image
	 * @throws IOException if the file does not exist or cannot be read as image
	 */
	public static ComplexGrid open( final String path ) throws IOException
	{
		if ( !Files.isRegularFile( Paths.get( path ) ) )
			throw new FileNotFoundException( "File '" + path + "' does not exist." );

		final ImagePlus imp = IJ.openImage( path );

		if ( imp == null )
			throw new IOException( "Could not open '" + path + "' as image." );

		LOG.info( "Opened '{}' ({}x{}, {} slice(s))", path, imp.getWidth(), imp.getHeight(), imp.getStackSize() );

		return fromImagePlus( imp );
	}

	/**
	 * @return the centered k-space of the image, one channel per slice
	 */
	public static ComplexGrid fromImagePlus( final ImagePlus imp )
	{
		return SpectralTransform.forward( imageGrid( imp ) );
	}

	/**
	 * @return the (real valued) pixels of the image as image space grid, one channel per slice
	 */
	public static ComplexGrid imageGrid( final ImagePlus imp )
	{
		final ImageStack stack = imp.getStack();
		final int cols = stack.getWidth();
		final int rows = stack.getHeight();
		final int channels = stack.getSize();

		if ( cols <= 0 || rows <= 0 || channels <= 0 )
			throw new UnsupportedShapeException( "image '" + imp.getTitle() + "' is empty" );

		final ComplexGrid grid = new ComplexGrid( rows, cols, channels );

		for ( int c = 0; c < channels; ++c )
		{
			// ImageJ slices are 1-based
			final ImageProcessor ip = stack.getProcessor( c + 1 ).convertToFloatProcessor();
			final float[] pixels = (float[])ip.getPixels();

			for ( int r = 0; r < rows; ++r )
				for ( int x = 0; x < cols; ++x )
					grid.set( r, x, c, pixels[ r * cols + x ], 0 );
		}

		return grid;
	}
}
