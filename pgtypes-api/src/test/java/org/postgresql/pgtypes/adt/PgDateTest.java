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

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;

import junit.framework.TestCase;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;

import org.postgresql.pgtypes.DatatypeException;
import org.postgresql.pgtypes.DatatypeException.Kind;

public class PgDateTest extends TestCase
{
	public PgDateTest(String name) { super(name); }

	public void testYearNumbering() throws Exception
	{
		PgDate oneBC = PgDate.of(-1, 6, 1);
		assertTrue(oneBC.isBC());
		assertEquals(-1, oneBC.year());
		assertEquals(0, oneBC.toLocalDate().getYear());
		assertTrue("1 BC is a leap year", oneBC.isLeapYear());
		assertFalse(PgDate.of(-2, 1, 1).isLeapYear());

		assertEquals(PgDate.of(1, 1, 1), oneBC.plusYears(1).plusMonths(-5));

		try
		{
			PgDate.of(0, 1, 1);
			fail("accepted year 0");
		}
		catch ( DateTimeException e )
		{
			assertThat(e.getMessage(), containsString("year 0"));
		}
	}

	public void testDaysSinceEra() throws Exception
	{
		assertEquals(0L, PgDate.ERA.daysSinceEra());
		assertEquals(719162L, PgDate.EPOCH.daysSinceEra());
		assertEquals(PgDate.EPOCH, PgDate.ofDaysSinceEra(719162L));

		PgDate before = PgDate.ofDaysSinceEra(-1);
		assertEquals(-1, before.year());
		assertEquals(12, before.month());
		assertEquals(31, before.day());
		assertEquals(366, before.dayOfYear());

		try
		{
			PgDate.ofDaysSinceEra(Long.MIN_VALUE);
			fail("accepted an absurd day count");
		}
		catch ( DateTimeException e )
		{
			assertThat(e.getCause(), is(instanceOf(ArithmeticException.class)));
		}
	}

	public void testArithmetic() throws Exception
	{
		assertEquals(PgDate.of(2023, 2, 28), PgDate.of(2023, 1, 31).plusMonths(1));
		assertEquals(PgDate.of(2024, 2, 29), PgDate.of(2024, 1, 31).plusMonths(1));
		assertEquals(PgDate.of(2025, 2, 28), PgDate.of(2024, 2, 29).plusYears(1));
		assertEquals(PgDate.of(2000, 3, 1), PgDate.of(2000, 2, 28).plusDays(2));
		assertEquals(DayOfWeek.SATURDAY, PgDate.POSTGRES_EPOCH.dayOfWeek());
		assertTrue(PgDate.EPOCH.compareTo(PgDate.POSTGRES_EPOCH) < 0);
	}

	public void testText() throws Exception
	{
		assertEquals("2024-01-05", PgDate.of(2024, 1, 5).toString());
		assertEquals("0044-03-15 BC", PgDate.of(-44, 3, 15).toString());
		assertEquals("12345-06-07",
			PgDate.fromLocalDate(LocalDate.of(12345, 6, 7)).toString());

		assertEquals(PgDate.of(-44, 3, 15), PgDate.parse("0044-03-15 BC"));
		assertEquals(PgDate.of(-1, 1, 1), PgDate.parse(" 1-1-1 bc "));
		assertEquals(PgDate.of(2024, 1, 5), PgDate.parse("2024-01-05 AD"));

		PgDate d = PgDate.of(-4713, 11, 24);
		assertEquals(d, PgDate.parse(d.toString()));
	}

	public void testParseFailures() throws Exception
	{
		String[][] cases =
		{
			{ "FORMAT_ERROR", "2024/01/05" },
			{ "FORMAT_ERROR", "2024-01" },
			{ "FORMAT_ERROR", "2024-01-05 CE" },
			{ "OVERFLOW",     "2024-02-30" },
			{ "OVERFLOW",     "2024-13-01" },
			{ "OVERFLOW",     "0000-01-01" },
			{ "OVERFLOW",     "99999999999-01-01" }
		};

		for ( String[] c : cases )
		{
			try
			{
				PgDate.parse(c[1]);
				fail("parsed \"" + c[1] + "\"");
			}
			catch ( DatatypeException e )
			{
				assertEquals(c[1], Kind.valueOf(c[0]), e.kind());
			}
		}

		try
		{
			PgDate.parse(null);
			fail("parsed null");
		}
		catch ( DatatypeException e )
		{
			assertEquals(Kind.NULL_ARGUMENT, e.kind());
		}
	}
}
