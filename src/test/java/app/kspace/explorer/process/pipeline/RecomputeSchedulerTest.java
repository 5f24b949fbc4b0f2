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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import app.kspace.explorer.process.parameters.Parameter;

public class RecomputeSchedulerTest
{
	@Test
	public void testLatestRequestIsDelivered() throws Exception
	{
		final KSpacePipeline pipeline = new KSpacePipeline();
		pipeline.loadImage( KSpacePipelineTest.randomImage( 32, 32, 3 ) );

		final AtomicReference< Reconstruction > latest = new AtomicReference<>();
		final AtomicInteger delivered = new AtomicInteger();

		Future< ? > last = null;

		try ( final RecomputeScheduler scheduler = new RecomputeScheduler( pipeline, r ->
		{
			latest.set( r );
			delivered.incrementAndGet();
		} ) )
		{
			for ( int i = 0; i <= 10; ++i )
			{
				pipeline.setParameter( Parameter.LOW_PASS, 100 - 5 * i );
				last = scheduler.request();
			}

			last.get( 30, TimeUnit.SECONDS );
		}

		assertTrue( delivered.get() >= 1 && delivered.get() <= 11 );
		assertTrue( latest.get().identical( pipeline.recompute() ) );
	}

	@Test
	public void testErrorsAreReported() throws Exception
	{
		final KSpacePipeline pipeline = new KSpacePipeline();
		final AtomicReference< RuntimeException > error = new AtomicReference<>();
		final CountDownLatch latch = new CountDownLatch( 1 );

		try ( final RecomputeScheduler scheduler = new RecomputeScheduler( pipeline, r -> {}, e ->
		{
			error.set( e );
			latch.countDown();
		} ) )
		{
			scheduler.request();
			assertTrue( latch.await( 30, TimeUnit.SECONDS ) );
		}

		assertEquals( IllegalStateException.class, error.get().getClass() );
	}
}
