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
package app.kspace.explorer.process.export;

import java.io.IOException;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import app.kspace.explorer.data.Raster;
import app.kspace.explorer.process.pipeline.Reconstruction;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

/**
 * Saves the rasters of a {@link Reconstruction} with ImageJ. For "name.ext" the k-space is written to
 * "name_k.ext" and the image to "name_i.ext". TIFF keeps the 32-bit float values, PNG is 8-bit,
 * stretched between the min and max of each raster.
 *
 * @author K-space Explorer developers
 */
public class RasterExport
{
	private static final Logger LOG = LoggerFactory.getLogger( RasterExport.class );

	public enum Format { TIFF, PNG };

	/**
	 * @param reconstruction - what to save
	 * @param path - the base file name, its extension (.tif, .tiff or .png) selects the format
	 * @throws IOException if writing fails
	 */
	public static void save( final Reconstruction reconstruction, final String path ) throws IOException
	{
		final int dot = path.lastIndexOf( '.' );
		final int sep = Math.max( path.lastIndexOf( '/' ), path.lastIndexOf( '\\' ) );

		if ( dot <= sep + 1 )
			throw new IllegalArgumentException( "No file extension in '" + path + "', expected .tif, .tiff or .png" );

		final String name = path.substring( 0, dot );
		final String ext = path.substring( dot );
		final Format format = format( ext );

		save( reconstruction.kspace(), name + "_k" + ext, format );
		save( reconstruction.image(), name + "_i" + ext, format );
	}

	public static void save( final Raster raster, final String path, final Format format ) throws IOException
	{
		final boolean success;

		if ( format == Format.TIFF )
			success = new FileSaver( new ImagePlus( "raster", toFloatProcessor( raster ) ) ).saveAsTiff( path );
		else
			success = new FileSaver( new ImagePlus( "raster", toByteProcessor( raster ) ) ).saveAsPng( path );

		if ( !success )
			throw new IOException( "Could not save " + raster + " to '" + path + "'." );

		LOG.info( "Saved {} to '{}'", raster, path );
	}

	public static Format format( final String extension )
	{
		final String ext = extension.toLowerCase( Locale.ROOT );

		if ( ext.equals( ".tif" ) || ext.equals( ".tiff" ) )
			return Format.TIFF;
		else if ( ext.equals( ".png" ) )
			return Format.PNG;
		else
			throw new IllegalArgumentException( "Unsupported file format '" + extension + "', expected .tif, .tiff or .png" );
	}

	public static FloatProcessor toFloatProcessor( final Raster raster )
	{
		final double[] values = raster.values();
		final float[] pixels = new float[ values.length ];

		for ( int i = 0; i < values.length; ++i )
			pixels[ i ] = (float)values[ i ];

		return new FloatProcessor( raster.cols(), raster.rows(), pixels );
	}

	/**
	 * @return 8-bit version, min maps to 0 and max to 255; a constant raster becomes all 0
	 */
	public static ByteProcessor toByteProcessor( final Raster raster )
	{
		final double[] values = raster.values();
		final byte[] pixels = new byte[ values.length ];
		final double min = raster.min();
		final double range = raster.max() - min;

		if ( range > 0 )
			for ( int i = 0; i < values.length; ++i )
				pixels[ i ] = (byte)Math.min( 255, (int)Math.floor( ( values[ i ] - min ) / range * 255.0 ) );

		return new ByteProcessor( raster.cols(), raster.rows(), pixels );
	}
}
