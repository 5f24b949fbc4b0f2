package app.kspace.explorer.process.parameters;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import app.kspace.explorer.process.acquisition.FillOrder;

public class ModifierParametersTest
{
	@Test
	public void testDefaults()
	{
		final ModifierParameters p = new ModifierParameters();

		assertFalse( p.hamming() );
		assertEquals( 100, p.partialFourier(), 0 );
		assertEquals( 30, p.noiseSNR(), 0 );
		assertEquals( 100, p.lowPass(), 0 );
		assertEquals( 0, p.highPass(), 0 );
		assertEquals( 1, p.undersampleFactor() );
		assertEquals( -3, p.kspaceScaling() );
		assertEquals( 100, p.fillPercentage(), 0 );
		assertSame( FillOrder.Type.LINEAR, p.fillOrder() );
		assertTrue( p.isPartialFourierEnabled() );
		assertTrue( p.isScanPercentageEnabled() );
	}

	@Test
	public void testForName()
	{
		assertSame( Parameter.PARTIAL_FOURIER, Parameter.forName( "partial_fourier" ) );
		assertSame( Parameter.NOISE_SNR, Parameter.forName( "NOISE_SNR" ) );
		assertSame( Parameter.KSPACE_SCALING, Parameter.forName( " kspace_scaling " ) );
	}

	@Test( expected = InvalidParameterException.class )
	public void testUnknownName()
	{
		Parameter.forName( "gamma" );
	}

	@Test
	public void testInvalidValuesAreRejected()
	{
		final ModifierParameters p = new ModifierParameters();

		expectInvalid( p, Parameter.LOW_PASS, 150 );
		expectInvalid( p, Parameter.NOISE_SNR, -31 );
		expectInvalid( p, Parameter.UNDERSAMPLE_FACTOR, 0 );
		expectInvalid( p, Parameter.UNDERSAMPLE_FACTOR, 2.5 );
		expectInvalid( p, Parameter.HAMMING, "yes" );
		expectInvalid( p, Parameter.HIGH_PASS, Double.NaN );
		expectInvalid( p, Parameter.FILL_ORDER, "spiral" );

		// previous values survive
		assertEquals( 100, p.lowPass(), 0 );
		assertEquals( 1, p.undersampleFactor() );
	}

	@Test
	public void testPartialFourierAndScanPercentageExcludeEachOther()
	{
		final ModifierParameters p = new ModifierParameters();

		p.set( Parameter.PARTIAL_FOURIER, 60 );
		assertFalse( p.isScanPercentageEnabled() );
		expectInvalid( p, Parameter.SCAN_PERCENTAGE, 80 );

		// 100 is always accepted
		p.set( Parameter.SCAN_PERCENTAGE, 100 );

		p.set( Parameter.PARTIAL_FOURIER, 100 );
		p.set( Parameter.SCAN_PERCENTAGE, 80 );
		assertFalse( p.isPartialFourierEnabled() );
		expectInvalid( p, Parameter.PARTIAL_FOURIER, 50 );

		assertEquals( 100, p.partialFourier(), 0 );
		assertEquals( 80, p.scanPercentage(), 0 );
	}

	@Test
	public void testFillOrderParsing()
	{
		final ModifierParameters p = new ModifierParameters();

		p.set( Parameter.FILL_ORDER, "centric" );
		assertSame( FillOrder.Type.CENTRIC, p.fillOrder() );

		p.set( Parameter.FILL_ORDER, 2 );
		assertSame( FillOrder.Type.SINGLE_SHOT_EPI_BLIPPED, p.fillOrder() );

		p.set( Parameter.FILL_ORDER, "single-shot epi blipped" );
		assertSame( FillOrder.Type.SINGLE_SHOT_EPI_BLIPPED, p.fillOrder() );

		p.set( Parameter.FILL_ORDER, FillOrder.Type.LINEAR );
		assertSame( FillOrder.Type.LINEAR, p.get( Parameter.FILL_ORDER ) );
	}

	@Test
	public void testNoiseSeedIsRedrawnWhenSNRChanges()
	{
		final ModifierParameters p = new ModifierParameters();
		final long seed = p.noiseSeed();

		p.set( Parameter.LOW_PASS, 50 );
		assertEquals( seed, p.noiseSeed() );

		p.set( Parameter.NOISE_SNR, 10 );
		assertNotEquals( seed, p.noiseSeed() );
	}

	@Test
	public void testPinnedNoiseSeed()
	{
		final ModifierParameters p = new ModifierParameters( 99 );

		p.set( Parameter.NOISE_SNR, 10 );
		p.set( Parameter.NOISE_SNR, 0 );

		assertEquals( 99, p.noiseSeed() );
	}

	@Test
	public void testCopyIsIndependent()
	{
		final ModifierParameters p = new ModifierParameters( 5 );
		p.set( Parameter.HAMMING, true );

		final ModifierParameters copy = p.copy();
		p.set( Parameter.HAMMING, false );

		assertTrue( copy.hamming() );
		assertEquals( 5, copy.noiseSeed() );
	}

	@Test
	public void testCopiesDoNotShareTheSeedSource()
	{
		final ModifierParameters live = new ModifierParameters();
		final long seed = live.noiseSeed();

		final ModifierParameters a = live.copy();
		final ModifierParameters b = live.copy();

		a.set( Parameter.NOISE_SNR, 5 );
		b.set( Parameter.NOISE_SNR, 5 );

		// both copies start from the same state and draw the same seed
		assertNotEquals( seed, a.noiseSeed() );
		assertEquals( a.noiseSeed(), b.noiseSeed() );

		// the original neither changed nor advanced its generator
		assertEquals( seed, live.noiseSeed() );

		final ModifierParameters c = live.copy();
		c.set( Parameter.NOISE_SNR, 5 );
		assertEquals( a.noiseSeed(), c.noiseSeed() );
	}

	@Test
	public void testConvertFollowsKind()
	{
		assertEquals( Parameter.Kind.INTEGER, Parameter.UNDERSAMPLE_FACTOR.getKind() );
		assertEquals( 4, ModifierParameters.convert( Parameter.UNDERSAMPLE_FACTOR, 4.0 ) );
		assertEquals( 12.5, ModifierParameters.convert( Parameter.LOW_PASS, 12.5f ) );
		assertEquals( true, ModifierParameters.convert( Parameter.COMPRESS, true ) );
		assertSame( FillOrder.Type.CENTRIC, ModifierParameters.convert( Parameter.FILL_ORDER, 1 ) );

		try
		{
			ModifierParameters.convert( Parameter.KSPACE_SCALING, 0.5 );
			fail( "kspace_scaling is integral" );
		}
		catch ( final InvalidParameterException e )
		{
			// expected
		}
	}

	private static void expectInvalid( final ModifierParameters p, final Parameter parameter, final Object value )
	{
		try
		{
			p.set( parameter, value );
			fail( parameter + "=" + value + " should have been rejected" );
		}
		catch ( final InvalidParameterException e )
		{
			// expected
		}
	}
}
