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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Insertion-ordered list of edits with undo (remove the last one) and clear.
 * Not thread-safe, guarded by the pipeline.
 *
 * @param <E> edit type
 */
public class EditList< E >
{
	private final ArrayList< E > edits = new ArrayList<>();

	public void add( final E edit )
	{
		edits.add( edit );
	}

	/**
	 * @return the removed edit, or null if the list was empty
	 */
	public E undo()
	{
		if ( edits.isEmpty() )
			return null;

		return edits.remove( edits.size() - 1 );
	}

	public void clear()
	{
		edits.clear();
	}

	public int size() { return edits.size(); }
	public boolean isEmpty() { return edits.isEmpty(); }

	/**
	 * @return an unmodifiable copy in insertion order
	 */
	public List< E > snapshot()
	{
		return Collections.unmodifiableList( new ArrayList<>( edits ) );
	}
}
