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

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.parameters.ModifierParameters;
import app.kspace.explorer.process.parameters.Parameter;

public class ModifierChainTest
{
	@Test
	public void testStandardOrder()
	{
		final List< String > names = new ArrayList<>();
		for ( final KSpaceModifier modifier : ModifierChain.standard().getModifiers() )
			names.add( modifier.getName() );

		assertArrayEquals(
				new String[] { "acquisition fill", "hamming", "partial fourier", "scan percentage", "high-pass", "low-pass", "noise", "undersampling", "DC decrease" },
				names.toArray() );
	}

	@Test
	public void testDefaultsChangeNothing()
	{
		final ComplexGrid kspace = PartialFourierTest.realImage( 6, 6, 5 );
		final ComplexGrid original = kspace.copy();

		final ComplexGrid result = ModifierChain.standard().apply( kspace, new ModifierParameters( 1 ) );

		assertArrayEquals( original.storage(), result.storage(), 0 );
	}

	@Test
	public void testUndersamplingRunsAfterFilters()
	{
		final ModifierParameters parameters = new ModifierParameters( 1 );
		parameters.set( Parameter.LOW_PASS, 0.0 );
		parameters.set( Parameter.UNDERSAMPLE_FACTOR, 2 );
		parameters.set( Parameter.COMPRESS, true );

		final ComplexGrid result = ModifierChain.standard().apply( ScanPercentageTest.ones( 8, 8 ), parameters );

		assertEquals( 4, result.rows() );
		assertEquals( 1, FrequencyFilterTest.countNonZero( result ) );
		assertEquals( 1.0, result.getReal( 2, 4 ), 0 );
	}
}
