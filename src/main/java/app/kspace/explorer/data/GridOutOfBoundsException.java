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

/**
 * Thrown when a coordinate lies outside of a {@link ComplexGrid} or {@link Raster}.
 *
 * @author K-space Explorer developers
 */
public class GridOutOfBoundsException extends IndexOutOfBoundsException
{
	private static final long serialVersionUID = 6412303347112093617L;

	public GridOutOfBoundsException( final String message )
	{
		super( message );
	}

	public GridOutOfBoundsException( final int row, final int col, final int channel, final ComplexGrid grid )
	{
		super( "(row=" + row + ", col=" + col + ", channel=" + channel + ") outside of " + grid );
	}
}
