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
 * One stage of the k-space modifier chain. A stage works on the working copy of the k-space that is
 * rebuilt for every recompute, it may change it in place or return a new grid (e.g. when the number of
 * lines changes). The raw k-space never reaches a modifier.
 *
 * @author K-space Explorer developers
 */
public interface KSpaceModifier
{
	/**
	 * @param parameters - the current parameter snapshot
	 * @return false if the stage would not change the data with these parameters
	 */
	public boolean isActive( final ModifierParameters parameters );

	/**
	 * @param kspace - the working k-space
	 * @param parameters - the current parameter snapshot
	 * @return the modified k-space, which is either the input or a new grid
	 */
	public ComplexGrid apply( final ComplexGrid kspace, final ModifierParameters parameters );

	public String getName();
}
