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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import app.kspace.explorer.data.ComplexGrid;
import app.kspace.explorer.data.Raster;
import app.kspace.explorer.data.UnsupportedShapeException;
import app.kspace.explorer.process.combine.ChannelCombiner;
import app.kspace.explorer.process.edit.EditList;
import app.kspace.explorer.process.edit.EditReplay;
import app.kspace.explorer.process.edit.Patch;
import app.kspace.explorer.process.edit.Spike;
import app.kspace.explorer.process.fft.SpectralTransform;
import app.kspace.explorer.process.modifier.ModifierChain;
import app.kspace.explorer.process.parameters.InvalidParameterException;
import app.kspace.explorer.process.parameters.ModifierParameters;
import app.kspace.explorer.process.parameters.Parameter;

/**
 * Owns the raw k-space, the spike and patch lists and the current parameters, and turns them into the
 * k-space and image rasters on every {@link #recompute()}.
 * <p>
 * The working k-space is rebuilt from the raw k-space for every recompute: edits are replayed, the
 * {@link ModifierChain} is applied, every channel is inverse transformed and the channels are combined.
 * Identical inputs give bit-identical rasters.
 * <p>
 * Setters and snapshots share one lock, so a recompute always sees a consistent set of edits and
 * parameters. Recomputes are serialized, at most one runs at a time; use a {@link RecomputeScheduler}
 * to run them off the UI thread and to coalesce requests.
 *
 * @author K-space Explorer developers
 */
public class KSpacePipeline
{
	private static final Logger LOG = LoggerFactory.getLogger( KSpacePipeline.class );

	private final Object lock = new Object();
	private final ReentrantLock recomputeLock = new ReentrantLock();

	private final ModifierChain chain;
	private final ExecutorService service;

	// guarded by lock
	private ComplexGrid raw = null;
	private final EditList< Spike > spikes = new EditList<>();
	private final EditList< Patch > patches = new EditList<>();
	private ModifierParameters parameters;
	private Long pinnedNoiseSeed = null;

	/**
	 * @param chain - the modifiers to apply
	 * @param service - executor for transforming channels in parallel, or null to work sequentially
	 */
	public KSpacePipeline( final ModifierChain chain, final ExecutorService service )
	{
		this.chain = chain;
		this.service = service;
		this.parameters = new ModifierParameters();
	}

	public KSpacePipeline( final ExecutorService service )
	{
		this( ModifierChain.standard(), service );
	}

	public KSpacePipeline()
	{
		this( null );
	}

	/**
	 * Replaces the raw k-space and resets all edits and parameters to their defaults.
	 *
	 * @param kspace - centered k-space, copied
	 * @throws UnsupportedShapeException if kspace is null; the previous state is kept
	 */
	public void loadRawKSpace( final ComplexGrid kspace )
	{
		if ( kspace == null )
			throw new UnsupportedShapeException( "no k-space data given" );

		final ComplexGrid copy = kspace.copy();

		synchronized ( lock )
		{
			raw = copy;
			spikes.clear();
			patches.clear();
			parameters = newParameters();
		}

		LOG.info( "Loaded raw k-space {}", copy );
	}

	/**
	 * Transforms image space data into k-space and loads it, see {@link #loadRawKSpace(ComplexGrid)}.
	 */
	public void loadImage( final ComplexGrid image )
	{
		if ( image == null )
			throw new UnsupportedShapeException( "no image data given" );

		final ComplexGrid kspace = image.copy();
		SpectralTransform.transformInPlace( kspace, true, service );
		loadRawKSpace( kspace );
	}

	public boolean isLoaded()
	{
		synchronized ( lock )
		{
			return raw != null;
		}
	}

	/**
	 * @param parameter - which parameter
	 * @param value - the new value, see {@link ModifierParameters#set(Parameter, Object)}
	 * @throws InvalidParameterException if the value is out of its domain, the previous value is kept
	 */
	public void setParameter( final Parameter parameter, final Object value )
	{
		synchronized ( lock )
		{
			if ( parameter == Parameter.DISPLAY_CHANNEL && raw != null && value instanceof Number
					&& ( (Number)value ).doubleValue() >= raw.channels() )
				throw new InvalidParameterException( parameter, value, "only " + raw.channels() + " channel(s) loaded" );

			parameters.set( parameter, value );
		}

		LOG.debug( "Set {} to {}", parameter, value );
	}

	/**
	 * @param name - parameter key (e.g. "low_pass"), see {@link Parameter#forName(String)}
	 * @param value - the new value
	 */
	public void setParameter( final String name, final Object value )
	{
		setParameter( Parameter.forName( name ), value );
	}

	public Object getParameter( final Parameter parameter )
	{
		synchronized ( lock )
		{
			return parameters.get( parameter );
		}
	}

	/**
	 * @return a copy of the current parameters
	 */
	public ModifierParameters getParameters()
	{
		synchronized ( lock )
		{
			return parameters.copy();
		}
	}

	/**
	 * Fixes the seed of the noise generator (also for future loads), so results are reproducible.
	 */
	public void setNoiseSeed( final long seed )
	{
		synchronized ( lock )
		{
			pinnedNoiseSeed = seed;
			parameters.pinNoiseSeed( seed );
		}
	}

	public void addSpike( final int row, final int col, final double amplitude )
	{
		final Spike spike = new Spike( row, col, amplitude );

		synchronized ( lock )
		{
			final ComplexGrid kspace = requireLoaded();
			EditReplay.validate( spike, kspace.rows(), kspace.cols() );
			spikes.add( spike );
		}

		LOG.debug( "Added {}", spike );
	}

	/**
	 * @return the removed spike or null if there was none
	 */
	public Spike undoSpike()
	{
		synchronized ( lock )
		{
			return spikes.undo();
		}
	}

	public void clearSpikes()
	{
		synchronized ( lock )
		{
			spikes.clear();
		}
	}

	public List< Spike > getSpikes()
	{
		synchronized ( lock )
		{
			return spikes.snapshot();
		}
	}

	public void addPatch( final int row, final int col, final int radius )
	{
		final Patch patch = new Patch( row, col, radius );

		synchronized ( lock )
		{
			final ComplexGrid kspace = requireLoaded();
			EditReplay.validate( patch, kspace.rows(), kspace.cols() );
			patches.add( patch );
		}

		LOG.debug( "Added {}", patch );
	}

	/**
	 * @return the removed patch or null if there was none
	 */
	public Patch undoPatch()
	{
		synchronized ( lock )
		{
			return patches.undo();
		}
	}

	public void clearPatches()
	{
		synchronized ( lock )
		{
			patches.clear();
		}
	}

	public List< Patch > getPatches()
	{
		synchronized ( lock )
		{
			return patches.snapshot();
		}
	}

	/**
	 * @return a consistent copy of everything a recompute depends on
	 * @throws IllegalStateException if no k-space was loaded
	 */
	public PipelineSnapshot snapshot()
	{
		synchronized ( lock )
		{
			return new PipelineSnapshot( requireLoaded(), spikes.snapshot(), patches.snapshot(), parameters.copy() );
		}
	}

	/**
	 * Rebuilds the working k-space from the raw k-space and computes both rasters.
	 *
	 * @return the k-space and image rasters
	 * @throws IllegalStateException if no k-space was loaded
	 */
	public Reconstruction recompute()
	{
		recomputeLock.lock();

		try
		{
			return reconstruct( snapshot() );
		}
		finally
		{
			recomputeLock.unlock();
		}
	}

	/**
	 * @param snapshot - the inputs
	 * @return the rasters for these inputs, does not touch the state of the pipeline
	 */
	public Reconstruction reconstruct( final PipelineSnapshot snapshot )
	{
		final long time = System.currentTimeMillis();
		final ModifierParameters p = snapshot.parameters;

		ComplexGrid working = snapshot.raw.copy();

		EditReplay.replay( working, snapshot.spikes, snapshot.patches );
		working = chain.apply( working, p );

		final int displayChannel = Math.min( p.displayChannel(), working.channels() - 1 );
		final Raster kspaceRaster = working.scaledBy( Math.pow( 10.0, p.kspaceScaling() ) ).logMagnitude( displayChannel );

		SpectralTransform.transformInPlace( working, false, service );

		final Raster image = ChannelCombiner.rootSumOfSquares( working );
		final List< Raster > channelImages;

		if ( working.channels() == 1 )
		{
			channelImages = new ArrayList<>();
			channelImages.add( image );
		}
		else
		{
			channelImages = ChannelCombiner.channelMagnitudes( working );
		}

		LOG.debug( "Recomputed {} in {} ms", working, System.currentTimeMillis() - time );

		return new Reconstruction( kspaceRaster, image, channelImages );
	}

	private ModifierParameters newParameters()
	{
		return pinnedNoiseSeed == null ? new ModifierParameters() : new ModifierParameters( pinnedNoiseSeed );
	}

	private ComplexGrid requireLoaded()
	{
		if ( raw == null )
			throw new IllegalStateException( "No k-space loaded." );

		return raw;
	}
}
