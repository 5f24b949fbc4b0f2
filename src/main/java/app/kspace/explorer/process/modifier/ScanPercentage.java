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

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * Reduced scan percentage: removes the same number of lines at the top and the bottom of k-space so
 * that only the given percentage of central lines remains. E.g. 256 lines at 50% keep the central 128.
 */
public class ScanPercentage implements KSpaceModifier
{
	/**
	 * @return number of lines removed at each edge
	 */
	public static int linesPerEdge( final int rows, final double percentage )
	{
		return (int)Math.round( ( 1 - percentage / 100.0 ) * rows / 2.0 );
	}

	public static void apply( final ComplexGrid kspace, final double percentage )
	{
		ModifierTools.checkRange( "scan percentage", percentage, 0, 100 );

		final int rows = kspace.rows();
		final int lines = Math.min( rows, linesPerEdge( rows, percentage ) );

		for ( int r = 0; r < lines; ++r )
		{
			kspace.zeroRow( r );
			kspace.zeroRow( rows - 1 - r );
		}
	}

	@Override
	public boolean isActive( final ModifierParameters parameters )
	{
		return parameters.isScanPercentageEnabled() && parameters.scanPercentage() < 100;
	}

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		apply( kspace, parameters.scanPercentage() );
		return kspace;
	}

	@Override
	public String getName() { return "scan percentage"; }
}
