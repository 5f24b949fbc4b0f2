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

import java.util.Arrays;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * Acquires only every n-th phase-encode line (n = acceleration factor), starting at the center line
 * and going outwards in both directions, as used by parallel imaging.
 * <p>
 * Without compression the skipped lines stay in place as zeros (full field of view, aliasing shows as
 * ghosts). With compression the kept lines are packed together into a smaller grid, which simulates an
 * acquisition with a reduced (rectangular) field of view.
 */
public class Undersampling implements KSpaceModifier
{
	/**
	 * @return the kept rows in ascending order
	 */
	public static int[] keptLines( final int rows, final int factor )
	{
		final int mid = rows / 2;
		final int[] kept = new int[ rows ];
		int n = 0;

		for ( int r = mid % factor; r < rows; r += factor )
			kept[ n++ ] = r;

		return Arrays.copyOf( kept, n );
	}

	/**
	 * @param kspace - the working k-space, modified in place unless compressed
	 * @param factor - acceleration factor 1...16
	 * @param compress - pack the kept lines into a smaller grid
	 * @return the undersampled k-space (a new grid if compressed)
	 */
	public static ComplexGrid apply( final ComplexGrid kspace, final int factor, final boolean compress )
	{
		ModifierTools.checkRange( "undersampling factor", factor, 1, 16 );

		if ( factor == 1 )
			return kspace;

		final int[] kept = keptLines( kspace.rows(), factor );

		if ( compress )
			return kspace.selectRows( kept );

		final boolean[] keep = new boolean[ kspace.rows() ];
		for ( final int r : kept )
			keep[ r ] = true;

		for ( int r = 0; r < kspace.rows(); ++r )
			if ( !keep[ r ] )
				kspace.zeroRow( r );

		return kspace;
	}

	@Override
	public boolean isActive( final ModifierParameters parameters ) { return parameters.undersampleFactor() > 1; }

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		return apply( kspace, parameters.undersampleFactor(), parameters.compress() );
	}

	@Override
	public String getName() { return "undersampling"; }
}
