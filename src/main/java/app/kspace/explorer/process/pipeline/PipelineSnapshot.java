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
package app.kspace.explorer.process.pipeline;

import java.util.List;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.edit.Patch;
import app.kspace.explorer.process.edit.Spike;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * A consistent view of everything a recompute depends on. The raw k-space is shared (it is never
 * modified), edits and parameters are copies.
 */
public class PipelineSnapshot
{
	final ComplexGrid raw;
	final List< Spike > spikes;
	final List< Patch > patches;
	final ModifierParameters parameters;

	PipelineSnapshot( final ComplexGrid raw, final List< Spike > spikes, final List< Patch > patches, final ModifierParameters parameters )
	{
		this.raw = raw;
		this.spikes = spikes;
		this.patches = patches;
		this.parameters = parameters;
	}

	public List< Spike > getSpikes() { return spikes; }
	public List< Patch > getPatches() { return patches; }
	public ModifierParameters getParameters() { return parameters; }
	public int rows() { return raw.rows(); }
	public int cols() { return raw.cols(); }
	public int channels() { return raw.channels(); }
}
