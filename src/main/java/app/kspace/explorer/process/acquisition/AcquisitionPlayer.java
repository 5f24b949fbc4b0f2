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
package app.kspace.explorer.process.acquisition;

import java.util.function.DoubleConsumer;

import app.kspace.explorer.process.modifier.ModifierTools;

/**
 * Play/pause/reset control of the acquisition simulation. The player holds no timer: the UI calls
 * {@link #advance(double)} from its animation timer while the player is {@link State#FILLING}, every
 * change of the fill percentage is pushed to the listener (usually the pipeline's fill percentage
 * setter followed by a recompute request).
 *
 * @author K-space Explorer developers
 */
public class AcquisitionPlayer
{
	public enum State { IDLE, FILLING, RESET };

	private final DoubleConsumer listener;

	private State state = State.IDLE;
	private double percentage;

	/**
	 * @param percentage - the initial fill percentage
	 * @param listener - receives every new fill percentage
	 */
	public AcquisitionPlayer( final double percentage, final DoubleConsumer listener )
	{
		ModifierTools.checkRange( "fill percentage", percentage, 0, 100 );

		this.percentage = percentage;
		this.listener = listener;
	}

	public AcquisitionPlayer( final DoubleConsumer listener )
	{
		this( 100, listener );
	}

	public synchronized State getState() { return state; }
	public synchronized double getPercentage() { return percentage; }

	/**
	 * Starts filling from the current percentage, or from 0 if the acquisition is complete.
	 */
	public synchronized void play()
	{
		if ( percentage >= 100 )
			update( 0 );

		state = State.FILLING;
	}

	/**
	 * Freezes the current percentage.
	 */
	public synchronized void pause()
	{
		state = State.IDLE;
	}

	/**
	 * Cancels a running animation and forces the percentage to 0. The player is {@link State#RESET}
	 * while 0 is pushed to the listener and {@link State#IDLE} afterwards.
	 */
	public synchronized void reset()
	{
		state = State.RESET;
		update( 0 );
		state = State.IDLE;
	}

	/**
	 * Sets the percentage directly (e.g. the user drags the slider), stops the animation.
	 */
	public synchronized void seek( final double value )
	{
		ModifierTools.checkRange( "fill percentage", value, 0, 100 );

		state = State.IDLE;
		update( value );
	}

	/**
	 * One animation tick.
	 *
	 * @param delta - percentage points to add, &gt;0
	 * @return true if still filling afterwards
	 */
	public synchronized boolean advance( final double delta )
	{
		if ( !( delta > 0 ) )
			throw new IllegalArgumentException( "delta must be > 0, but was " + delta );

		if ( state != State.FILLING )
			return false;

		update( Math.min( 100, percentage + delta ) );

		if ( percentage >= 100 )
			state = State.IDLE;

		return state == State.FILLING;
	}

	private void update( final double value )
	{
		percentage = value;
		listener.accept( value );
	}
}
