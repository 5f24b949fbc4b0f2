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
import app.kspace.explorer.process.acquisition.AcquisitionSimulator;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * Zeroes the samples that are not acquired yet at the current fill percentage.
 */
public class AcquisitionFill implements KSpaceModifier
{
	@Override
	public boolean isActive( final ModifierParameters parameters )
	{
		return parameters.fillPercentage() < 100;
	}

	@Override
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters )
	{
		AcquisitionSimulator.apply(
				kspace,
				AcquisitionSimulator.mask( kspace.rows(), kspace.cols(), parameters.fillPercentage(), parameters.fillOrder() ) );

		return kspace;
	}

	@Override
	public String getName() { return "acquisition fill"; }
}
