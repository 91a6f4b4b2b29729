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

import java.time.LocalDateTime;

import org.postgresql.pgtypes.Adapter;
import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.INVALID_ARGUMENT;
import static org.postgresql.pgtypes.DatatypeException.Kind.NULL_ARGUMENT;
import org.postgresql.pgtypes.adt.Datetime;
import org.postgresql.pgtypes.adt.PgTimestamp;
import org.postgresql.pgtypes.model.RegType;

/**
 * PostgreSQL timestamp types, available in various representations by
 * implementing the corresponding functional interfaces to construct them.
 */
public abstract class DateTimeAdapter extends Adapter.Container
{
	private DateTimeAdapter() // no instances
	{
	}

	/**
	 * Instances of the timestamp adapters producing
	 * {@link PgTimestamp PgTimestamp}.
	 *<p>
	 * A holder interface so these won't be instantiated unless wanted.
	 */
	public interface PgTypes
	{
		Timestamp<PgTimestamp>   TIMESTAMP_INSTANCE = new Timestamp<>(
			Datetime.Timestamp.AsPgTimestamp.INSTANCE, PgTimestamp.class);

		TimestampTZ<PgTimestamp> TIMESTAMPTZ_INSTANCE = new TimestampTZ<>(
			Datetime.TimestampTZ.AsPgTimestamp.INSTANCE, PgTimestamp.class);
	}

	/**
	 * Width of the wire form of both timestamp types: one {@code int8}.
	 */
	public static final int WIDTH = Long.BYTES;

	/**
	 * Adapter for the {@code TIMESTAMP} type to the functional
	 * interface {@link Datetime.Timestamp Datetime.Timestamp}.
	 *<p>
	 * For output, accepts a {@link PgTimestamp PgTimestamp}, its text form,
	 * or a {@link LocalDateTime LocalDateTime}. The disposition of a
	 * {@code PgTimestamp} is ignored.
	 */
	public static class Timestamp<T> extends Adapter.FixedWidth<T>
	{
		private final Datetime.Timestamp<T> m_ctor;

		public Timestamp(Datetime.Timestamp<T> ctor, Class<T> witness)
		{
			super(ctor, witness, WIDTH);
			m_ctor = ctor;
		}

		@Override
		public boolean canFetch(RegType pgType)
		{
			return RegType.TIMESTAMP == pgType;
		}

		@Override
		protected T fetchFixed(ByteBuffer in)
		{
			return m_ctor.construct(in.getLong());
		}

		@Override
		protected void storeFixed(Object value, ByteBuffer out)
		throws SQLException
		{
			Datetime.Timestamp.AsPgTimestamp.INSTANCE.store(
				toPgTimestamp(value, RegType.TIMESTAMP), out::putLong);
		}
	}

	/**
	 * Adapter for the {@code TIMESTAMP WITH TIME ZONE} type to the functional
	 * interface {@link Datetime.TimestampTZ Datetime.TimestampTZ}.
	 *<p>
	 * For output, accepts what {@link Timestamp Timestamp} does; a value that
	 * is not already {@code UTC} is converted with
	 * {@link PgTimestamp#toUniversalTime toUniversalTime}.
	 */
	public static class TimestampTZ<T> extends Adapter.FixedWidth<T>
	{
		private final Datetime.TimestampTZ<T> m_ctor;

		public TimestampTZ(Datetime.TimestampTZ<T> ctor, Class<T> witness)
		{
			super(ctor, witness, WIDTH);
			m_ctor = ctor;
		}

		@Override
		public boolean canFetch(RegType pgType)
		{
			return RegType.TIMESTAMPTZ == pgType;
		}

		@Override
		protected T fetchFixed(ByteBuffer in)
		{
			return m_ctor.construct(in.getLong());
		}

		@Override
		protected void storeFixed(Object value, ByteBuffer out)
		throws SQLException
		{
			Datetime.TimestampTZ.AsPgTimestamp.INSTANCE.store(
				toPgTimestamp(value, RegType.TIMESTAMPTZ), out::putLong);
		}
	}

	private static PgTimestamp toPgTimestamp(Object value, RegType pgType)
	throws SQLException
	{
		if ( value instanceof PgTimestamp )
			return (PgTimestamp)value;
		if ( value instanceof String )
			return PgTimestamp.parse((String)value);
		if ( value instanceof LocalDateTime )
			return PgTimestamp.of((LocalDateTime)value);
		if ( null == value )
			throw new DatatypeException(NULL_ARGUMENT,
				"null " + pgType.typeName());
		throw new DatatypeException(INVALID_ARGUMENT,
			"cannot store " + value.getClass().getName() + " as " +
			pgType.typeName());
	}
}
