/*
 * Copyright (c) 2025 Tada AB and other contributors, as listed below.
 *
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the The BSD 3-Clause License
 * which accompanies this distribution, and is available at
 * http://opensource.org/licenses/BSD-3-Clause
 *
 * Contributors:
 *   Tada AB
 */
package org.postgresql.pgtypes.adt;

import java.time.Duration;

import junit.framework.TestCase;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;

import org.postgresql.pgtypes.DatatypeException;
import org.postgresql.pgtypes.DatatypeException.Kind;

import static org.postgresql.pgtypes.adt.Ticks.TICKS_PER_DAY;
import static org.postgresql.pgtypes.adt.Ticks.TICKS_PER_SECOND;

public class TicksTest extends TestCase
{
	public TicksTest(String name) { super(name); }

	public void testTruncationTowardZero() throws Exception
	{
		assertEquals(1L, Ticks.of(Duration.ofNanos(150)));
		assertEquals(-1L, Ticks.of(Duration.ofNanos(-150)));
		assertEquals(-TICKS_PER_SECOND - 1,
			Ticks.of(Duration.ofSeconds(-1).minusNanos(199)));
		assertEquals(Duration.ofNanos(-100), Ticks.toDuration(-1));
		assertEquals(Duration.ofDays(1), Ticks.toDuration(TICKS_PER_DAY));
	}

	public void testFromUnits() throws Exception
	{
		assertEquals(15_000_000L, Ticks.fromUnits(1.5, TICKS_PER_SECOND));
		assertEquals(-TICKS_PER_DAY / 4, Ticks.fromUnits(-0.25, TICKS_PER_DAY));

		try
		{
			Ticks.fromUnits(Double.NaN, TICKS_PER_SECOND);
			fail("converted NaN");
		}
		catch ( IllegalArgumentException e )
		{
			assertThat(e.getMessage(), containsString("NaN"));
		}

		try
		{
			Ticks.fromUnits(1e300, TICKS_PER_DAY);
			fail("converted 1e300 days");
		}
		catch ( ArithmeticException e )
		{
			assertThat(e.getMessage(), containsString("too long"));
		}
	}

	public void testFormat() throws Exception
	{
		assertEquals("00:00:00", Ticks.format(Duration.ZERO));
		assertEquals("13:30:00",
			Ticks.format(Duration.ofHours(13).plusMinutes(30)));
		assertEquals("13:30:00.0000010",
			Ticks.format(Duration.ofHours(13).plusMinutes(30).plusNanos(1000)));
		assertEquals("-01:00:00", Ticks.format(Duration.ofHours(-1)));
		assertEquals("1.02:00:00", Ticks.format(Duration.ofHours(26)));
	}

	public void testParse() throws Exception
	{
		assertEquals(Duration.ofHours(10).plusMinutes(15), Ticks.parse("10:15"));
		assertEquals(Duration.ofDays(5), Ticks.parse("5"));
		assertEquals(
			Duration.ofDays(1).plusHours(2).plusMinutes(3).plusMillis(4500),
			Ticks.parse("1.02:03:04.5"));
		assertEquals(Duration.ofHours(-1), Ticks.parse("-01:00:00"));
		assertEquals(Duration.ofNanos(100), Ticks.parse("00:00:00.0000001"));

		Duration d = Duration.ofDays(3).plusSeconds(7).plusNanos(1234500);
		assertEquals(d, Ticks.parse(Ticks.format(d)));
	}

	public void testParseFailures() throws Exception
	{
		String[][] cases =
		{
			{ "OVERFLOW",     "24:00" },
			{ "OVERFLOW",     "12:60" },
			{ "OVERFLOW",     "12:00:60" },
			{ "OVERFLOW",     "99999999999" },
			{ "FORMAT_ERROR", "abc" },
			{ "FORMAT_ERROR", "12:00:00.12345678" },
			{ "FORMAT_ERROR", "12:" }
		};

		for ( String[] c : cases )
		{
			try
			{
				Ticks.parse(c[1]);
				fail("parsed \"" + c[1] + "\"");
			}
			catch ( DatatypeException e )
			{
				assertEquals(c[1], Kind.valueOf(c[0]), e.kind());
			}
		}
	}
}
