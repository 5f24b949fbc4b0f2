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

import java.util.Locale;

/**
 * The named parameters of the k-space modifier chain, their types and domains.
 *
 * @author K-space Explorer developers
 */
public enum Parameter
{
	HAMMING( "hamming", Kind.BOOLEAN, 0, 1 ),
	PARTIAL_FOURIER( "partial_fourier", Kind.DOUBLE, 0, 100 ),
	ZERO_FILL( "zero_fill", Kind.BOOLEAN, 0, 1 ),
	NOISE_SNR( "noise_snr", Kind.DOUBLE, -30, 30 ),
	SCAN_PERCENTAGE( "scan_percentage", Kind.DOUBLE, 0, 100 ),
	HIGH_PASS( "high_pass", Kind.DOUBLE, 0, 100 ),
	LOW_PASS( "low_pass", Kind.DOUBLE, 0, 100 ),
	UNDERSAMPLE_FACTOR( "undersample_factor", Kind.INTEGER, 1, 16 ),
	COMPRESS( "compress", Kind.BOOLEAN, 0, 1 ),
	DECREASE_DC( "decrease_dc", Kind.DOUBLE, 0, 100 ),
	KSPACE_SCALING( "kspace_scaling", Kind.INTEGER, -10, 10 ),
	FILL_PERCENTAGE( "fill_percentage", Kind.DOUBLE, 0, 100 ),
	FILL_ORDER( "fill_order", Kind.FILL_ORDER, 0, 2 ),
	DISPLAY_CHANNEL( "display_channel", Kind.INTEGER, 0, Integer.MAX_VALUE );

	public enum Kind { BOOLEAN, INTEGER, DOUBLE, FILL_ORDER };

	private final String key;
	private final Kind kind;
	private final double min, max;

	private Parameter( final String key, final Kind kind, final double min, final double max )
	{
		this.key = key;
		this.kind = kind;
		this.min = min;
		this.max = max;
	}

	public String getKey() { return key; }
	public Kind getKind() { return kind; }
	public double getMin() { return min; }
	public double getMax() { return max; }

	/**
	 * @param name - the key (e.g. "partial_fourier") or the enum name, case-insensitive
	 * @return the matching parameter
	 * @throws InvalidParameterException if there is none
	 */
	public static Parameter forName( final String name )
	{
		if ( name != null )
		{
			final String lower = name.trim().toLowerCase( Locale.ROOT );

			for ( final Parameter p : values() )
				if ( p.key.equals( lower ) || p.name().toLowerCase( Locale.ROOT ).equals( lower ) )
					return p;
		}

		throw new InvalidParameterException( "unknown parameter '" + name + "'" );
	}

	@Override
	public String toString()
	{
		return key;
	}
}
