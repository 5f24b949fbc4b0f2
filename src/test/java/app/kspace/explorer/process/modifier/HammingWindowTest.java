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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import app.kspace.explorer.data.ComplexGrid;

public class HammingWindowTest
{
	@Test
	public void testCoefficients()
	{
		assertArrayEquals( new double[] { 0.08, 0.54, 1.0, 0.54, 0.08 }, HammingWindow.coefficients( 5 ), 1e-12 );
		assertArrayEquals( new double[] { 1.0 }, HammingWindow.coefficients( 1 ), 0 );
	}

	@Test
	public void testRowsAreWeighted()
	{
		final ComplexGrid kspace = new ComplexGrid( 5, 2, 2 );
		for ( int c = 0; c < 2; ++c )
			for ( int r = 0; r < 5; ++r )
				kspace.set( r, 1, c, 2, -2 );

		HammingWindow.apply( kspace );

		assertEquals( 0.16, kspace.getReal( 0, 1, 1 ), 1e-12 );
		assertEquals( -0.16, kspace.getImaginary( 4, 1, 0 ), 1e-12 );
		assertEquals( 2.0, kspace.getReal( 2, 1, 1 ), 1e-12 );
		assertEquals( 0.0, kspace.getReal( 2, 0, 1 ), 0 );
	}
}
