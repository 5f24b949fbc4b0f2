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
package app.kspace.explorer.process.edit;

import java.util.List;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.data.GridOutOfBoundsException;
import app.kspace.explorer.process.parameters.InvalidParameterException;

/**
 * Validates edits against a grid and replays them onto a working copy of the k-space.
 *
 * @author K-space Explorer developers
 */
public class EditReplay
{
	/**
	 * @throws GridOutOfBoundsException if the spike lies outside of the grid
	 * @throws InvalidParameterException if the amplitude is not finite
	 */
	public static void validate( final Spike spike, final int rows, final int cols )
	{
		checkBounds( spike.row, spike.col, rows, cols );

		if ( Double.isNaN( spike.amplitude ) || Double.isInfinite( spike.amplitude ) )
			throw new InvalidParameterException( "spike amplitude must be finite, but was " + spike.amplitude );
	}

	/**
	 * @throws GridOutOfBoundsException if the patch center lies outside of the grid
	 * @throws InvalidParameterException if the radius is negative
	 */
	public static void validate( final Patch patch, final int rows, final int cols )
	{
		checkBounds( patch.row, patch.col, rows, cols );

		if ( patch.radius < 0 )
			throw new InvalidParameterException( "patch radius must be >= 0, but was " + patch.radius );
	}

	/**
	 * Applies the spikes (additive, real valued) and then the patches (zeroing) in insertion order to
	 * every channel.
	 *
	 * @param kspace - modified in place
	 * @param spikes - the spikes
	 * @param patches - the patches
	 */
	public static void replay( final ComplexGrid kspace, final List< Spike > spikes, final List< Patch > patches )
	{
		for ( final Spike spike : spikes )
			for ( int c = 0; c < kspace.channels(); ++c )
				kspace.addAt( spike.row, spike.col, c, spike.amplitude, 0 );

		for ( final Patch patch : patches )
			for ( int c = 0; c < kspace.channels(); ++c )
				kspace.zeroDisk( patch.row, patch.col, c, patch.radius );
	}

	private static void checkBounds( final int row, final int col, final int rows, final int cols )
	{
		if ( row < 0 || row >= rows || col < 0 || col >= cols )
			throw new GridOutOfBoundsException( "edit at (" + row + ", " + col + ") outside of k-space " + rows + "x" + cols );
	}
}
