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
package app.kspace.explorer.process.modifier;

import app.kspace.explorer.process.parameters.InvalidParameterException;

public class ModifierTools
{
	/**
	 * @throws InvalidParameterException if value is NaN or outside of [min, max]
	 */
	public static void checkRange( final String name, final double value, final double min, final double max )
	{
		if ( Double.isNaN( value ) || value < min || value > max )
			throw new InvalidParameterException( name + " must be within [" + min + ", " + max + "], but was " + value );
	}

	/**
	 * @return ( value mod n ) within [0, n)
	 */
	public static int wrap( final int value, final int n )
	{
		return ( ( value % n ) + n ) % n;
	}
}
