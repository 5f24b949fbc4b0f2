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

import net.imglib2.Cursor;
import net.imglib2.type.numeric.complex.ComplexDoubleType;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * Binary circular k-space masks. The circle is centered on the k-space center (rows/2, cols/2), its
 * radius is given in percent of half the k-space diagonal, so 100% covers every sample.
 * <ul>
 * <li>high-pass: removes the samples inside the circle (the contrast carrying low frequencies)</li>
 * <li>low-pass: removes the samples outside the circle (the detail carrying high frequencies)</li>
 * </ul>
 * Samples are either kept untouched or zeroed, so the phase of the kept samples is preserved.
 */
public class FrequencyFilter implements KSpaceModifier
{
	public enum Mode { HIGH_PASS, LOW_PASS };

	final Mode mode;

	public FrequencyFilter( final Mode mode )
	{
		this.mode = mode;
	}

	public static double radius( final int rows, final int cols, final double percentage )
	{
		return Math.hypot( rows, cols ) / 2.0 * percentage / 100.0;
	}

	public static void highPass( final ComplexGrid kspace, final double percentage )
	{
		ModifierTools.checkRange( "high-pass radius", percentage, 0, 100 );

		if ( percentage >= 100 )
			Arrays.fill( kspace.storage(), 0 ); // the corners lie exactly on the full radius
		else if ( percentage > 0 )
			mask( kspace, radius( kspace.rows(), kspace.cols(), percentage ), true );
	}

	public static void lowPass( final ComplexGrid kspace, final double percentage )
	{
		ModifierTools.checkRange( "low-pass radius", percentage, 0, 100 );

		if ( percentage < 100 )
			mask( kspace, radius( kspace.rows(), kspace.cols(), percentage ), false );
	}

	/*
	 * zeroes every sample whose distance to the center is <= radius (inside == true) or > radius (inside == false)
	 */
	private static void mask( final ComplexGrid kspace, final double radius, final boolean inside )
	{
		final long centerRow = kspace.rows() / 2;
		final long centerCol = kspace.cols() / 2;
		final double r2 = radius * radius;

		final Cursor< ComplexDoubleType > cursor = kspace.img().localizingCursor();

		while ( cursor.hasNext() )
		{
			cursor.fwd();

			final double x = cursor.getLongPosition( 0 ) - centerCol;
			final double y = cursor.getLongPosition( 1 ) - centerRow;

			if ( ( x * x + y * y <= r2 ) == inside )
				cursor.get().setZero();
		}
	}

	@Override
	public boolean isActive( final ModifierParameters parameters )
	{
		return mode == Mode.HIGH_PASS ? parameters.highPass() > 0 : parameters.lowPass() < 100;
	}

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		if ( mode == Mode.HIGH_PASS )
			highPass( kspace, parameters.highPass() );
		else
			lowPass( kspace, parameters.lowPass() );

		return kspace;
	}

	@Override
	public String getName() { return mode == Mode.HIGH_PASS ? "high-pass" : "low-pass"; }
}
