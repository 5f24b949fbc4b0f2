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
package app.kspace.explorer.process.edit;

/**
 * A patch: a disk of k-space samples that is erased (set to zero).
 */
public class Patch
{
	final int row, col, radius;

	public Patch( final int row, final int col, final int radius )
	{
		this.row = row;
		this.col = col;
		this.radius = radius;
	}

	public int getRow() { return row; }
	public int getCol() { return col; }
	public int getRadius() { return radius; }

	@Override
	public String toString()
	{
		return "Patch[row=" + row + ", col=" + col + ", radius=" + radius + "]";
	}
}
