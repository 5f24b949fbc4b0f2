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
package app.kspace.explorer.process.pipeline;

import java.util.Collections;
import java.util.List;

import app.kspace.explorer.data.Raster;

/**
 * The rasters produced by one recompute: the k-space view (scaled log-magnitude of the displayed
 * channel), the reconstructed image (channel composite) and the magnitude image of every channel.
 */
public class Reconstruction
{
	final Raster kspace, image;
	final List< Raster > channelImages;

	public Reconstruction( final Raster kspace, final Raster image, final List< Raster > channelImages )
	{
		this.kspace = kspace;
		this.image = image;
		this.channelImages = Collections.unmodifiableList( channelImages );
	}

	public Raster kspace() { return kspace; }
	public Raster image() { return image; }
	public List< Raster > channelImages() { return channelImages; }

	/**
	 * @return true if all rasters are bit-identical
	 */
	public boolean identical( final Reconstruction other )
	{
		if ( !kspace.identical( other.kspace ) || !image.identical( other.image ) || channelImages.size() != other.channelImages.size() )
			return false;

		for ( int i = 0; i < channelImages.size(); ++i )
			if ( !channelImages.get( i ).identical( other.channelImages.get( i ) ) )
				return false;

		return true;
	}
}
