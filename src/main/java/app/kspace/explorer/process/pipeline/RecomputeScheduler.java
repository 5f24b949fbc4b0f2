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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link KSpacePipeline#recompute()} on a single worker thread so that the caller (typically the
 * UI event thread) never blocks. Only the latest request matters: a request that has not started yet
 * is cancelled by a newer one, and the result of a recompute that was overtaken by a newer request is
 * dropped instead of being handed to the consumer.
 *
 * @author K-space Explorer developers
 */
public class RecomputeScheduler implements AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger( RecomputeScheduler.class );

	private final KSpacePipeline pipeline;
	private final Consumer< Reconstruction > consumer;
	private final Consumer< RuntimeException > onError;

	private final ExecutorService worker = Executors.newSingleThreadExecutor( r ->
	{
		final Thread t = new Thread( r, "kspace-recompute" );
		t.setDaemon( true );
		return t;
	});

	private final AtomicLong generation = new AtomicLong();
	private Future< ? > pending = null;

	/**
	 * @param pipeline - the pipeline to recompute
	 * @param consumer - receives the up-to-date results, called on the worker thread
	 * @param onError - receives failed recomputes, called on the worker thread
	 */
	public RecomputeScheduler( final KSpacePipeline pipeline, final Consumer< Reconstruction > consumer, final Consumer< RuntimeException > onError )
	{
		this.pipeline = pipeline;
		this.consumer = consumer;
		this.onError = onError;
	}

	public RecomputeScheduler( final KSpacePipeline pipeline, final Consumer< Reconstruction > consumer )
	{
		this( pipeline, consumer, e -> LOG.error( "Recompute failed: " + e, e ) );
	}

	/**
	 * Requests a recompute with the parameters and edits that are current when it starts.
	 *
	 * @return the future of this request, completes once its result was delivered, dropped or it was cancelled
	 */
	public synchronized Future< ? > request()
	{
		final long id = generation.incrementAndGet();

		if ( pending != null && pending.cancel( false ) )
			LOG.debug( "Cancelled stale recompute request" );

		pending = worker.submit( () ->
		{
			if ( id != generation.get() )
				return;

			try
			{
				final Reconstruction result = pipeline.recompute();

				if ( id == generation.get() )
					consumer.accept( result );
				else
					LOG.debug( "Dropping superseded recompute #{}", id );
			}
			catch ( final RuntimeException e )
			{
				onError.accept( e );
			}
		});

		return pending;
	}

	@Override
	public void close()
	{
		worker.shutdown();

		try
		{
			if ( !worker.awaitTermination( 10, TimeUnit.SECONDS ) )
				worker.shutdownNow();
		}
		catch ( final InterruptedException e )
		{
			worker.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
