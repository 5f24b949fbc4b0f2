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
package app.kspace.explorer.process.parameters;

import java.util.Locale;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import app.kspace.explorer.process.acquisition.FillOrder;

/**
 * The current values of all {@link Parameter}s plus the noise seed. Values are validated when set,
 * an out-of-domain value throws {@link InvalidParameterException} and leaves the previous value untouched.
 * <p>
 * Partial Fourier and scan percentage are mutually exclusive: each one can only be lowered below 100
 * while the other one is at 100, setting either one back to 100 re-enables the other.
 * <p>
 * Not thread-safe, the pipeline guards it and hands {@link #copy()}s to the recompute.
 *
 * @author K-space Explorer developers
 */
public class ModifierParameters
{
	public static boolean defaultHamming = false;
	public static double defaultPartialFourier = 100;
	public static boolean defaultZeroFill = false;
	public static double defaultNoiseSNR = 30; // 30dB is treated as noise-free
	public static double defaultScanPercentage = 100;
	public static double defaultHighPass = 0;
	public static double defaultLowPass = 100;
	public static int defaultUndersampleFactor = 1;
	public static boolean defaultCompress = false;
	public static double defaultDecreaseDC = 0;
	public static int defaultKSpaceScaling = -3;
	public static double defaultFillPercentage = 100;
	public static FillOrder.Type defaultFillOrder = FillOrder.Type.LINEAR;

	private boolean hamming = defaultHamming;
	private double partialFourier = defaultPartialFourier;
	private boolean zeroFill = defaultZeroFill;
	private double noiseSNR = defaultNoiseSNR;
	private double scanPercentage = defaultScanPercentage;
	private double highPass = defaultHighPass;
	private double lowPass = defaultLowPass;
	private int undersampleFactor = defaultUndersampleFactor;
	private boolean compress = defaultCompress;
	private double decreaseDC = defaultDecreaseDC;
	private int kspaceScaling = defaultKSpaceScaling;
	private double fillPercentage = defaultFillPercentage;
	private FillOrder.Type fillOrder = defaultFillOrder;
	private int displayChannel = 0;

	private final RandomGenerator seedSource;
	private long noiseSeed;
	private boolean pinnedSeed = false;

	public ModifierParameters()
	{
		this.seedSource = new Well19937c();
		this.noiseSeed = seedSource.nextLong();
	}

	/**
	 * @param noiseSeed - fixed seed for the noise generator, it will not change when the SNR changes
	 */
	public ModifierParameters( final long noiseSeed )
	{
		this();
		pinNoiseSeed( noiseSeed );
	}

	private ModifierParameters( final ModifierParameters other )
	{
		// own generator, derived from the current seed, so copies never advance the original's
		this.seedSource = new Well19937c( other.noiseSeed );
		this.noiseSeed = other.noiseSeed;
		this.pinnedSeed = other.pinnedSeed;

		this.hamming = other.hamming;
		this.partialFourier = other.partialFourier;
		this.zeroFill = other.zeroFill;
		this.noiseSNR = other.noiseSNR;
		this.scanPercentage = other.scanPercentage;
		this.highPass = other.highPass;
		this.lowPass = other.lowPass;
		this.undersampleFactor = other.undersampleFactor;
		this.compress = other.compress;
		this.decreaseDC = other.decreaseDC;
		this.kspaceScaling = other.kspaceScaling;
		this.fillPercentage = other.fillPercentage;
		this.fillOrder = other.fillOrder;
		this.displayChannel = other.displayChannel;
	}

	/**
	 * @return an independent snapshot of all values
	 */
	public ModifierParameters copy()
	{
		return new ModifierParameters( this );
	}

	/**
	 * Validates and sets a parameter.
	 *
	 * @param parameter - which parameter
	 * @param value - Boolean for boolean parameters, a Number for numerical ones, a {@link FillOrder.Type},
	 * its name or its index for the fill order
	 * @throws InvalidParameterException if the value is of the wrong type, outside of the domain, or the
	 * parameter is currently disabled
	 */
	public void set( final Parameter parameter, final Object value )
	{
		final Object v = convert( parameter, value );

		switch ( parameter )
		{
		case HAMMING: hamming = (Boolean)v; break;
		case ZERO_FILL: zeroFill = (Boolean)v; break;
		case COMPRESS: compress = (Boolean)v; break;
		case PARTIAL_FOURIER:
			if ( (Double)v < 100 && !isPartialFourierEnabled() )
				throw new InvalidParameterException( parameter, value, "partial Fourier is disabled while the scan percentage is below 100" );
			partialFourier = (Double)v;
			break;
		case SCAN_PERCENTAGE:
			if ( (Double)v < 100 && !isScanPercentageEnabled() )
				throw new InvalidParameterException( parameter, value, "scan percentage is disabled while partial Fourier is below 100" );
			scanPercentage = (Double)v;
			break;
		case NOISE_SNR:
			if ( (Double)v != noiseSNR && !pinnedSeed )
				noiseSeed = seedSource.nextLong();
			noiseSNR = (Double)v;
			break;
		case HIGH_PASS: highPass = (Double)v; break;
		case LOW_PASS: lowPass = (Double)v; break;
		case DECREASE_DC: decreaseDC = (Double)v; break;
		case FILL_PERCENTAGE: fillPercentage = (Double)v; break;
		case UNDERSAMPLE_FACTOR: undersampleFactor = (Integer)v; break;
		case KSPACE_SCALING: kspaceScaling = (Integer)v; break;
		case DISPLAY_CHANNEL: displayChannel = (Integer)v; break;
		case FILL_ORDER: fillOrder = (FillOrder.Type)v; break;
		default:
			throw new InvalidParameterException( "unsupported parameter " + parameter );
		}
	}

	/**
	 * Checks a value against the kind and domain of a parameter.
	 *
	 * @return the value as Boolean, Double, Integer or {@link FillOrder.Type}, depending on {@link Parameter#getKind()}
	 * @throws InvalidParameterException if the value is of the wrong type or outside of the domain
	 */
	public static Object convert( final Parameter parameter, final Object value )
	{
		switch ( parameter.getKind() )
		{
		case BOOLEAN: return toBoolean( parameter, value );
		case INTEGER: return toInt( parameter, value );
		case DOUBLE: return toDouble( parameter, value );
		case FILL_ORDER: return toFillOrder( parameter, value );
		default:
			throw new InvalidParameterException( "unsupported kind of parameter " + parameter );
		}
	}

	/**
	 * @return the current value, boxed (Boolean, Double, Integer or {@link FillOrder.Type})
	 */
	public Object get( final Parameter parameter )
	{
		switch ( parameter )
		{
		case HAMMING: return hamming;
		case ZERO_FILL: return zeroFill;
		case COMPRESS: return compress;
		case PARTIAL_FOURIER: return partialFourier;
		case SCAN_PERCENTAGE: return scanPercentage;
		case NOISE_SNR: return noiseSNR;
		case HIGH_PASS: return highPass;
		case LOW_PASS: return lowPass;
		case DECREASE_DC: return decreaseDC;
		case FILL_PERCENTAGE: return fillPercentage;
		case UNDERSAMPLE_FACTOR: return undersampleFactor;
		case KSPACE_SCALING: return kspaceScaling;
		case DISPLAY_CHANNEL: return displayChannel;
		case FILL_ORDER: return fillOrder;
		default:
			throw new InvalidParameterException( "unsupported parameter " + parameter );
		}
	}

	public boolean isPartialFourierEnabled() { return scanPercentage >= 100; }
	public boolean isScanPercentageEnabled() { return partialFourier >= 100; }

	public boolean hamming() { return hamming; }
	public double partialFourier() { return partialFourier; }
	public boolean zeroFill() { return zeroFill; }
	public double noiseSNR() { return noiseSNR; }
	public double scanPercentage() { return scanPercentage; }
	public double highPass() { return highPass; }
	public double lowPass() { return lowPass; }
	public int undersampleFactor() { return undersampleFactor; }
	public boolean compress() { return compress; }
	public double decreaseDC() { return decreaseDC; }
	public int kspaceScaling() { return kspaceScaling; }
	public double fillPercentage() { return fillPercentage; }
	public FillOrder.Type fillOrder() { return fillOrder; }
	public int displayChannel() { return displayChannel; }
	public long noiseSeed() { return noiseSeed; }

	/**
	 * Fixes the noise seed, it will no longer be re-drawn when the SNR changes.
	 */
	public void pinNoiseSeed( final long seed )
	{
		this.noiseSeed = seed;
		this.pinnedSeed = true;
	}

	private static boolean toBoolean( final Parameter p, final Object value )
	{
		if ( value instanceof Boolean )
			return (Boolean)value;

		throw new InvalidParameterException( p, value, "expected true or false" );
	}

	private static double toDouble( final Parameter p, final Object value )
	{
		if ( !( value instanceof Number ) )
			throw new InvalidParameterException( p, value, "expected a number" );

		final double v = ( (Number)value ).doubleValue();

		if ( Double.isNaN( v ) || v < p.getMin() || v > p.getMax() )
			throw new InvalidParameterException( p, value, "must be within [" + p.getMin() + ", " + p.getMax() + "]" );

		return v;
	}

	private static int toInt( final Parameter p, final Object value )
	{
		final double v = toDouble( p, value );

		if ( v != Math.rint( v ) )
			throw new InvalidParameterException( p, value, "expected an integer" );

		return (int)v;
	}

	private static FillOrder.Type toFillOrder( final Parameter p, final Object value )
	{
		if ( value instanceof FillOrder.Type )
			return (FillOrder.Type)value;

		if ( value instanceof Number )
			return FillOrder.Type.values()[ toInt( p, value ) ];

		if ( value instanceof String )
		{
			final String name = ( (String)value ).trim().toUpperCase( Locale.ROOT ).replace( ' ', '_' ).replace( '-', '_' );

			for ( final FillOrder.Type type : FillOrder.Type.values() )
				if ( type.name().equals( name ) )
					return type;
		}

		throw new InvalidParameterException( p, value, "expected one of LINEAR, CENTRIC, SINGLE_SHOT_EPI_BLIPPED" );
	}
}
