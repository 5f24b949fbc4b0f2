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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.process.modifier.FrequencyFilter.Mode;
import app.kspace.explorer.process.parameters.ModifierParameters;

/**
 * The k-space modifiers in the order they are applied. Later stages see the cumulative effect of the
 * earlier ones, so the order is part of the result.
 *
 * @author K-space Explorer developers
 */
public class ModifierChain
{
	private static final Logger LOG = LoggerFactory.getLogger( ModifierChain.class );

	final List< KSpaceModifier > modifiers;

	public ModifierChain( final List< KSpaceModifier > modifiers )
	{
		this.modifiers = Collections.unmodifiableList( new ArrayList<>( modifiers ) );
	}

	/**
	 * @return acquisition fill, hamming, partial Fourier, scan percentage, high-pass, low-pass, noise,
	 * undersampling, DC decrease
	 */
	public static ModifierChain standard()
	{
		final ArrayList< KSpaceModifier > modifiers = new ArrayList<>();

		modifiers.add( new AcquisitionFill() );
		modifiers.add( new HammingWindow() );
		modifiers.add( new PartialFourier() );
		modifiers.add( new ScanPercentage() );
		modifiers.add( new FrequencyFilter( Mode.HIGH_PASS ) );
		modifiers.add( new FrequencyFilter( Mode.LOW_PASS ) );
		modifiers.add( new NoiseInjection() );
		modifiers.add( new Undersampling() );
		modifiers.add( new DcAttenuation() );

		return new ModifierChain( modifiers );
	}

	public List< KSpaceModifier > getModifiers() { return modifiers; }

	/**
	 * @param kspace - the working k-space
	 * @param parameters - parameter snapshot
	 * @return the modified working k-space
	 */
	public ComplexGrid apply( ComplexGrid kspace, final ModifierParameters parameters )
	{
		for ( final KSpaceModifier modifier : modifiers )
		{
			if ( modifier.isActive( parameters ) )
			{
				LOG.debug( "Applying {} to {}", modifier.getName(), kspace );
				kspace = modifier.apply( kspace, parameters );
			}
		}

		return kspace;
	}
}
