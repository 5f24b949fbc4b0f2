package app.kspace.explorer.process.acquisition;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import app.kspace.explorer.process.acquisition.AcquisitionPlayer.State;

public class AcquisitionPlayerTest
{
	@Test
	public void testPlayUntilComplete()
	{
		final List< Double > updates = new ArrayList<>();
		final AcquisitionPlayer player = new AcquisitionPlayer( updates::add );

		assertEquals( State.IDLE, player.getState() );
		assertEquals( 100, player.getPercentage(), 0 );

		// a complete acquisition restarts from zero
		player.play();
		assertEquals( State.FILLING, player.getState() );
		assertEquals( 0, player.getPercentage(), 0 );

		assertTrue( player.advance( 30 ) );
		assertTrue( player.advance( 30 ) );
		assertTrue( player.advance( 30 ) );
		assertFalse( player.advance( 30 ) );

		assertEquals( State.IDLE, player.getState() );
		assertEquals( 100, player.getPercentage(), 0 );
		assertEquals( 5, updates.size() );
		assertEquals( 100, updates.get( 4 ), 0 );
	}

	@Test
	public void testPauseFreezes()
	{
		final AcquisitionPlayer player = new AcquisitionPlayer( 10, v -> {} );

		player.play();
		assertEquals( 10, player.getPercentage(), 0 );

		player.advance( 5 );
		player.pause();

		assertFalse( player.advance( 5 ) );
		assertEquals( 15, player.getPercentage(), 0 );
	}

	@Test
	public void testResetAndSeek()
	{
		final AtomicReference< AcquisitionPlayer > holder = new AtomicReference<>();
		final List< State > statesSeen = new ArrayList<>();
		final AcquisitionPlayer player = new AcquisitionPlayer( 40, v -> statesSeen.add( holder.get().getState() ) );
		holder.set( player );

		player.play();
		player.advance( 10 );
		player.reset();

		// RESET while 0 is pushed, idle at 0 afterwards
		assertEquals( State.RESET, statesSeen.get( statesSeen.size() - 1 ) );
		assertEquals( State.IDLE, player.getState() );
		assertEquals( 0, player.getPercentage(), 0 );
		assertFalse( player.advance( 10 ) );
		assertEquals( 0, player.getPercentage(), 0 );

		player.seek( 70 );
		assertEquals( State.IDLE, player.getState() );
		assertEquals( 70, player.getPercentage(), 0 );

		player.play();
		assertEquals( 70, player.getPercentage(), 0 );
		assertTrue( player.advance( 10 ) );
	}
}
