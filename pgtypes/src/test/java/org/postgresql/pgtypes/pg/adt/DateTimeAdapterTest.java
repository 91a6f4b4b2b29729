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
package org.postgresql.pgtypes.pg.adt;

import java.nio.ByteBuffer;

import java.sql.SQLException;

import java.time.Duration;
import java.time.LocalDateTime;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.postgresql.pgtypes.Adapter;
import org.postgresql.pgtypes.DatatypeException;
import org.postgresql.pgtypes.DatatypeException.Kind;
import org.postgresql.pgtypes.adt.Datetime;
import org.postgresql.pgtypes.adt.PgDate;
import org.postgresql.pgtypes.adt.PgTimestamp;
import org.postgresql.pgtypes.adt.PgTimestamp.Disposition;
import org.postgresql.pgtypes.model.RegType;

import static
	org.postgresql.pgtypes.pg.adt.DateTimeAdapter.PgTypes.TIMESTAMPTZ_INSTANCE;
import static
	org.postgresql.pgtypes.pg.adt.DateTimeAdapter.PgTypes.TIMESTAMP_INSTANCE;

public class DateTimeAdapterTest
{
	private static final String TIMEZONE = "org.postgresql.pgtypes.timezone";

	private String m_savedTimezone;

	@Before
	public void saveTimezone()
	{
		m_savedTimezone = System.getProperty(TIMEZONE);
	}

	@After
	public void restoreTimezone()
	{
		if ( null == m_savedTimezone )
			System.clearProperty(TIMEZONE);
		else
			System.setProperty(TIMEZONE, m_savedTimezone);
	}

	private static long micros(Adapter<?> a, Object value) throws SQLException
	{
		ByteBuffer bb = ByteBuffer.allocate(8);
		a.store(value, bb);
		assertEquals(8, bb.position());
		return bb.getLong(0);
	}

	private static ByteBuffer wire(long micros)
	{
		return ByteBuffer.allocate(8).putLong(0, micros);
	}

	@Test
	public void testPostgresEpochIsZero() throws Exception
	{
		assertEquals(0L,
			micros(TIMESTAMP_INSTANCE, PgTimestamp.of(2000, 1, 1, 0, 0, 0)));
		assertEquals(PgTimestamp.of(PgDate.POSTGRES_EPOCH),
			TIMESTAMP_INSTANCE.fetch(wire(0L), 8));
	}

	@Test
	public void testInfinities() throws Exception
	{
		assertEquals(Long.MAX_VALUE,
			micros(TIMESTAMP_INSTANCE, PgTimestamp.INFINITY));
		assertEquals(Long.MIN_VALUE,
			micros(TIMESTAMP_INSTANCE, PgTimestamp.NEGATIVE_INFINITY));
		assertEquals(Long.MAX_VALUE, micros(TIMESTAMPTZ_INSTANCE, "infinity"));

		assertSame(PgTimestamp.INFINITY,
			TIMESTAMP_INSTANCE.fetch(wire(Datetime.DT_NOEND), 8));
		assertSame(PgTimestamp.NEGATIVE_INFINITY,
			TIMESTAMPTZ_INSTANCE.fetch(wire(Datetime.DT_NOBEGIN), 8));
	}

	@Test
	public void testFetch() throws Exception
	{
		PgTimestamp t =
			TIMESTAMP_INSTANCE.fetch(wire(Datetime.USECS_PER_DAY + 1), 8);
		assertEquals(Disposition.UNSPECIFIED, t.disposition());
		assertEquals(
			PgTimestamp.of(PgDate.of(2000, 1, 2), Duration.ofNanos(1000)), t);

		PgTimestamp before = TIMESTAMP_INSTANCE.fetch(wire(-1L), 8);
		assertEquals(PgTimestamp.of(PgDate.of(1999, 12, 31),
			Duration.ofDays(1).minusNanos(1000)), before);

		PgTimestamp tz = TIMESTAMPTZ_INSTANCE.fetch(wire(0L), 8);
		assertEquals(Disposition.UTC, tz.disposition());
	}

	@Test
	public void testStoreAcceptedValues() throws Exception
	{
		long expected =
			micros(TIMESTAMP_INSTANCE, PgTimestamp.of(2024, 1, 15, 13, 30, 0));
		assertEquals(expected, micros(TIMESTAMP_INSTANCE, "2024-01-15 13:30:00"));
		assertEquals(expected,
			micros(TIMESTAMP_INSTANCE, LocalDateTime.of(2024, 1, 15, 13, 30)));
		assertEquals(PgTimestamp.of(2024, 1, 15, 13, 30, 0),
			TIMESTAMP_INSTANCE.fetch(wire(expected), 8));

		PgTimestamp bc = PgTimestamp.of(-4713, 11, 24, 0, 0, 0);
		assertEquals(bc,
			TIMESTAMP_INSTANCE.fetch(wire(micros(TIMESTAMP_INSTANCE, bc)), 8));
	}

	@Test
	public void testTimestampIgnoresDisposition() throws Exception
	{
		System.setProperty(TIMEZONE, "+02:00");
		assertEquals(0L, micros(TIMESTAMP_INSTANCE,
			PgTimestamp.of(2000, 1, 1, 0, 0, 0, Disposition.LOCAL)));
		assertEquals(0L, micros(TIMESTAMP_INSTANCE,
			PgTimestamp.of(2000, 1, 1, 0, 0, 0, Disposition.UTC)));
	}

	@Test
	public void testTimestampTZStoresUniversalTime() throws Exception
	{
		System.setProperty(TIMEZONE, "+02:00");
		assertEquals(0L, micros(TIMESTAMPTZ_INSTANCE,
			PgTimestamp.of(2000, 1, 1, 2, 0, 0, Disposition.LOCAL)));
		assertEquals(0L, micros(TIMESTAMPTZ_INSTANCE,
			PgTimestamp.of(2000, 1, 1, 2, 0, 0, Disposition.UNSPECIFIED)));
		assertEquals(0L, micros(TIMESTAMPTZ_INSTANCE,
			PgTimestamp.of(2000, 1, 1, 0, 0, 0, Disposition.UTC)));
	}

	@Test
	public void testSubMicrosecondTruncatesTowardPast() throws Exception
	{
		PgTimestamp epoch = PgTimestamp.of(2000, 1, 1, 0, 0, 0);
		assertEquals(0L, micros(TIMESTAMP_INSTANCE, epoch.addTicks(5)));
		assertEquals(-1L, micros(TIMESTAMP_INSTANCE, epoch.addTicks(-5)));
		assertEquals(1L, micros(TIMESTAMP_INSTANCE, epoch.addTicks(19)));
	}

	@Test
	public void testOverflow() throws Exception
	{
		try
		{
			micros(TIMESTAMP_INSTANCE, PgTimestamp.of(PgDate.of(300000, 1, 1)));
			fail("stored a timestamp in the year 300000");
		}
		catch ( DatatypeException e )
		{
			assertEquals(Kind.OVERFLOW, e.kind());
			assertEquals("22008", e.getSQLState());
		}
	}

	@Test
	public void testStoreRejects() throws Exception
	{
		Object[][] cases =
		{
			{ Kind.FORMAT_ERROR,     "yesterday" },
			{ Kind.INVALID_ARGUMENT, Long.valueOf(0L) },
			{ Kind.NULL_ARGUMENT,    null }
		};
		for ( Object[] c : cases )
		{
			try
			{
				micros(TIMESTAMPTZ_INSTANCE, c[1]);
				fail("stored " + c[1]);
			}
			catch ( DatatypeException e )
			{
				assertEquals(c[0], e.kind());
			}
		}
	}

	@Test
	public void testOtherRepresentation() throws Exception
	{
		DateTimeAdapter.Timestamp<Long> raw =
			new DateTimeAdapter.Timestamp<>(micros -> micros, Long.class);
		assertEquals(Long.valueOf(123456789L), raw.fetch(wire(123456789L), 8));
		assertEquals("123456789", raw.fetchAsText(wire(123456789L), 8));
	}

	@Test
	public void testCanFetch() throws Exception
	{
		assertTrue(TIMESTAMP_INSTANCE.canFetch(RegType.TIMESTAMP));
		assertFalse(TIMESTAMP_INSTANCE.canFetch(RegType.TIMESTAMPTZ));
		assertTrue(TIMESTAMPTZ_INSTANCE.canFetch(RegType.TIMESTAMPTZ));
		assertFalse(TIMESTAMPTZ_INSTANCE.canFetch(RegType.CIRCLE));
		assertEquals(8, TIMESTAMP_INSTANCE.width());
	}
}
