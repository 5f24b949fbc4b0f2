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
package app.kspace.explorer;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.Prefs;

public class Threads
{
	private static final Logger LOG = LoggerFactory.getLogger( Threads.class );

	/**
	 * @return num threads for per-channel work, as configured in the ImageJ preferences
	 */
	public static int numThreads() { return Math.max( 1, Prefs.getThreads() ); }

	public static ExecutorService createFixedExecutorService( final int nThreads ) { return Executors.newFixedThreadPool( nThreads ); }
	public static ExecutorService createFixedExecutorService() { return createFixedExecutorService( numThreads() ); }

	/**
	 * Runs all tasks and waits for them. A failing task is rethrown as unchecked exception, an interrupt
	 * re-sets the interrupted flag and aborts.
	 *
	 * @param tasks - the tasks
	 * @param service - executor to run on
	 * @param jobDescription - for the log
	 */
	public static void execTasks( final List< Callable< Void > > tasks, final ExecutorService service, final String jobDescription )
	{
		try
		{
			// invokeAll() returns when all tasks are complete
			for ( final Future< Void > future : service.invokeAll( tasks ) )
				future.get();
		}
		catch ( final InterruptedException e )
		{
			LOG.warn( "Interrupted while trying to " + jobDescription );
			Thread.currentThread().interrupt();
			throw new IllegalStateException( "interrupted while trying to " + jobDescription, e );
		}
		catch ( final ExecutionException e )
		{
			final Throwable cause = e.getCause();

			if ( cause instanceof RuntimeException )
				throw (RuntimeException)cause;

			throw new IllegalStateException( "Failed to " + jobDescription + ": " + cause, cause );
		}
	}
}
