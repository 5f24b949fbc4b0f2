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
 * Thrown when k-space data handed to the pipeline has inconsistent or empty channel/row/column
 * dimensions. The load that caused it is rejected, the previously loaded data stays in place.
 *
 * @author K-space Explorer developers
 */
public class UnsupportedShapeException extends IllegalArgumentException
{
	private static final long serialVersionUID = -2911480530541766290L;

	public UnsupportedShapeException( final String message )
	{
		super( message );
	}
}
