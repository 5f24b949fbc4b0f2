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

/**
 * Starts with the center line, then alternates one line above and one below the center
 * (rows/2, rows/2-1, rows/2+1, rows/2-2, ...). Lines are read left to right.
 */
public class CentricFillOrder implements FillOrder
{
	@Override
	public int[] lineOrder( final int rows )
	{
		final int[] order = new int[ rows ];
		final int center = rows / 2;

		int step = 0;

		for ( int d = 0; step < rows; ++d )
		{
			if ( center - d >= 0 && d > 0 )
				order[ step++ ] = center - d;

			if ( center + d < rows && step < rows )
				order[ step++ ] = center + d;
		}

		return order;
	}

	@Override
	public boolean isReversed( final int step ) { return false; }
}
