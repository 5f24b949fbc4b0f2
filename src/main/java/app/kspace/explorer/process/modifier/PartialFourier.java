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
 * Partial Fourier (half scan): only a little more than half of the phase-encode lines is acquired,
 * the lines missing at the high-index edge are either zero-filled or synthesized from the conjugate
 * symmetry of k-space of a real-valued object, k(-ky, -kx) = conj( k(ky, kx) ).
 */
public class PartialFourier implements KSpaceModifier
{
	/**
	 * @param rows - number of phase-encode lines
	 * @param percentage - 0...100
	 * @return number of missing lines at the bottom edge; 100% means none, 0% means all but rows/2+1
	 */
	public static int missingLines( final int rows, final double percentage )
	{
		final long skip = Math.round( ( 1 - percentage / 100.0 ) * ( rows / 2.0 - 1 ) );
		return (int)Math.max( 0, skip );
	}

	/**
	 * @param kspace - centered k-space, modified in place
	 * @param percentage - fraction of the optional half of the lines that is acquired, 0...100
	 * @param zeroFill - true to leave the missing lines empty instead of using conjugate symmetry
	 */
	public static void apply( final ComplexGrid kspace, final double percentage, final boolean zeroFill )
	{
		ModifierTools.checkRange( "partial Fourier percentage", percentage, 0, 100 );

		final int rows = kspace.rows();
		final int cols = kspace.cols();
		final int skip = missingLines( rows, percentage );

		if ( skip == 0 )
			return;

		if ( zeroFill )
		{
			for ( int r = rows - skip; r < rows; ++r )
				kspace.zeroRow( r );

			return;
		}

		// point mirror around the k-space center (rows/2, cols/2); for even sizes the mirror of index 0
		// wraps around to itself
		final int mirrorRow = 2 * ( rows / 2 );
		final int mirrorCol = 2 * ( cols / 2 );

		for ( int c = 0; c < kspace.channels(); ++c )
			for ( int r = rows - skip; r < rows; ++r )
			{
				final int sr = ModifierTools.wrap( mirrorRow - r, rows );

				for ( int x = 0; x < cols; ++x )
				{
					final int sx = ModifierTools.wrap( mirrorCol - x, cols );
					kspace.set( r, x, c, kspace.getReal( sr, sx, c ), -kspace.getImaginary( sr, sx, c ) );
				}
			}
	}

	@Override
	public boolean isActive( final ModifierParameters parameters )
	{
		return parameters.isPartialFourierEnabled() && parameters.partialFourier() < 100;
	}

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		apply( kspace, parameters.partialFourier(), parameters.zeroFill() );
		return kspace;
	}

	@Override
	public String getName() { return "partial fourier"; }
}
