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
 * Decreases the highest peak of k-space (the DC signal, normally at the center) by a percentage.
 */
public class DcAttenuation implements KSpaceModifier
{
	/**
	 * @return the row-major sample index (within the channel) of the first highest-magnitude sample
	 */
	public static int peakIndex( final ComplexGrid kspace, final int channel )
	{
		final double[] data = kspace.storage();
		final int size = kspace.rows() * kspace.cols();
		final int offset = 2 * channel * size;

		int peak = 0;
		double max = -1;

		for ( int i = 0; i < size; ++i )
		{
			final double re = data[ offset + 2 * i ];
			final double im = data[ offset + 2 * i + 1 ];
			final double m = re * re + im * im;

			if ( m > max )
			{
				max = m;
				peak = i;
			}
		}

		return peak;
	}

	/**
	 * @param kspace - modified in place, every channel has its own peak
	 * @param decrease - 0...100, the peak is scaled by ( 1 - decrease/100 )
	 */
	public static void apply( final ComplexGrid kspace, final double decrease )
	{
		ModifierTools.checkRange( "DC decrease", decrease, 0, 100 );

		final double factor = 1 - decrease / 100.0;

		for ( int c = 0; c < kspace.channels(); ++c )
		{
			final int peak = peakIndex( kspace, c );
			final int row = peak / kspace.cols();
			final int col = peak % kspace.cols();

			kspace.set( row, col, c, kspace.getReal( row, col, c ) * factor, kspace.getImaginary( row, col, c ) * factor );
		}
	}

	@Override
	public boolean isActive( final ModifierParameters parameters ) { return parameters.decreaseDC() > 0; }

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		apply( kspace, parameters.decreaseDC() );
		return kspace;
	}

	@Override
	public String getName() { return "DC decrease"; }
}
