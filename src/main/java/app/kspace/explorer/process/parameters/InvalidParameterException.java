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
package app.kspace.explorer.process.parameters;

/**
 * Thrown when a parameter value lies outside of its domain. The previous value is retained.
 *
 * @author K-space Explorer developers
 */
public class InvalidParameterException extends IllegalArgumentException
{
	private static final long serialVersionUID = 3057817950322542019L;

	public InvalidParameterException( final String message )
	{
		super( message );
	}

	public InvalidParameterException( final Parameter parameter, final Object value, final String reason )
	{
		super( "invalid value '" + value + "' for " + parameter.getKey() + ": " + reason );
	}
}
