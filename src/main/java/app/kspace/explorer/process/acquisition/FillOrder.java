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
 * The order in which k-space is sampled during a simulated acquisition. Lines (rows, phase-encode
 * direction) are acquired one after the other, each line is read out either left to right or reversed.
 *
 * @author K-space Explorer developers
 */
public interface FillOrder
{
	public enum Type { LINEAR, CENTRIC, SINGLE_SHOT_EPI_BLIPPED };

	/**
	 * @param rows - number of phase-encode lines
	 * @return a permutation of 0...rows-1, the row acquired at each step
	 */
	public int[] lineOrder( final int rows );

	/**
	 * @param step - the acquisition step (index into {@link #lineOrder(int)})
	 * @return true if the line acquired at this step is read out from the last column to the first
	 */
	public boolean isReversed( final int step );

	public static FillOrder create( final Type type )
	{
		switch ( type )
		{
			case LINEAR:
				return new LinearFillOrder();
			case CENTRIC:
				return new CentricFillOrder();
			case SINGLE_SHOT_EPI_BLIPPED:
				return new EpiBlippedFillOrder();
			default:
				throw new IllegalArgumentException( "unknown fill order " + type );
		}
	}
}
