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

import org.postgresql.pgtypes.Adapter.Contract;
import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.OVERFLOW;

import org.postgresql.pgtypes.adt.PgTimestamp.Disposition;
import org.postgresql.pgtypes.adt.PgTimestamp.Finite;

/**
 * Container for abstract-type functional interfaces in PostgreSQL's
 * {@code DATETIME} type category.
 */
public interface Datetime
{
	/**
	 * PostgreSQL "infinitely early" timestamp, as a value of what would
	 * otherwise be microseconds from the PostgreSQL epoch.
	 */
	long DT_NOBEGIN          = Long.MIN_VALUE;

	/**
	 * PostgreSQL "infinitely late" timestamp, as a value of what would
	 * otherwise be microseconds from the PostgreSQL epoch.
	 */
	long DT_NOEND            = Long.MAX_VALUE;

	/**
	 * The PostgreSQL "epoch", 1 January 2000, as a Julian day; the date
	 * represented by a {@code TIMESTAMP} or {@code TIMESTAMPTZ} with a stored
	 * value of zero.
	 */
	int POSTGRES_EPOCH_JDATE = 2451545;

	long USECS_PER_DAY       = 86400000000L;

	/**
	 * The {@code TIMESTAMP} type's PostgreSQL semantics: microseconds since
	 * midnight of the PostgreSQL epoch, without an assumed time zone.
	 */
	@FunctionalInterface
	public interface Timestamp<T> extends Contract.Scalar<T>
	{
		/**
		 * Constructs a representation <var>T</var> from the components
		 * of the PostgreSQL data type.
		 *<p>
		 * The argument represents microseconds since midnight on
		 * 1 January 2000, unless it is one of the special values
		 * {@link #DT_NOBEGIN DT_NOBEGIN} or {@link #DT_NOEND DT_NOEND}.
		 *<p>
		 * Because no particular time zone is understood to apply, the exact
		 * corresponding point on a standard timeline cannot be identified,
		 * absent outside information.
		 */
		T construct(long microsecondsSincePostgresEpoch);

		/**
		 * A reference implementation that maps to
		 * {@link PgTimestamp PgTimestamp}, with disposition
		 * {@code UNSPECIFIED}.
		 *<p>
		 * The PostgreSQL "-infinity" and "+infinity" values are mapped to
		 * {@link PgTimestamp#NEGATIVE_INFINITY NEGATIVE_INFINITY} and
		 * {@link PgTimestamp#INFINITY INFINITY}.
		 */
		static class AsPgTimestamp implements Timestamp<PgTimestamp>
		{
			private AsPgTimestamp() // I am a singleton
			{
			}

			public static final AsPgTimestamp INSTANCE = new AsPgTimestamp();

			private static final long TICKS_PER_MICROSECOND = 10L;

			@Override
			public PgTimestamp construct(long microsecondsSincePostgresEpoch)
			{
				return fromMicros(
					microsecondsSincePostgresEpoch, Disposition.UNSPECIFIED);
			}

			/**
			 * Passes <var>t</var> to <var>f</var> as microseconds since the
			 * PostgreSQL epoch, ignoring its disposition. Ticks finer than
			 * a microsecond are truncated toward the past.
			 * @throws DatatypeException {@code OVERFLOW} if <var>t</var> is
			 * too far from the epoch to be represented
			 */
			public <T> T store(PgTimestamp t, Timestamp<T> f)
			throws DatatypeException
			{
				return f.construct(toMicros(t));
			}

			static PgTimestamp fromMicros(long micros, Disposition disposition)
			{
				if ( DT_NOBEGIN == micros )
					return PgTimestamp.NEGATIVE_INFINITY;
				if ( DT_NOEND == micros )
					return PgTimestamp.INFINITY;

				long days = Math.floorDiv(micros, USECS_PER_DAY);
				long usecs = Math.floorMod(micros, USECS_PER_DAY);
				return PgTimestamp.of(
					PgDate.POSTGRES_EPOCH.plusDays(days),
					Ticks.toDuration(usecs * TICKS_PER_MICROSECOND),
					disposition);
			}

			static long toMicros(PgTimestamp t) throws DatatypeException
			{
				if ( t.isInfinity() )
					return DT_NOEND;
				if ( t.isNegativeInfinity() )
					return DT_NOBEGIN;

				Finite f = t.asFinite().normalize();
				long days = f.date().daysSinceEra()
					- PgDate.POSTGRES_EPOCH.daysSinceEra();
				long usecs = Ticks.of(f.time()) / TICKS_PER_MICROSECOND;
				try
				{
					long micros = Math.addExact(
						Math.multiplyExact(days, USECS_PER_DAY), usecs);
					if ( DT_NOBEGIN != micros  &&  DT_NOEND != micros )
						return micros;
				}
				catch ( ArithmeticException e )
				{
					throw new DatatypeException(OVERFLOW,
						"timestamp out of range: \"" + t + "\"", e);
				}
				throw new DatatypeException(OVERFLOW,
					"timestamp out of range: \"" + t + "\"");
			}
		}
	}

	/**
	 * The {@code TIMESTAMPTZ} type's PostgreSQL semantics: microseconds since
	 * midnight UTC of the PostgreSQL epoch.
	 */
	@FunctionalInterface
	public interface TimestampTZ<T> extends Contract.Scalar<T>
	{
		/**
		 * Constructs a representation <var>T</var> from the components
		 * of the PostgreSQL data type.
		 *<p>
		 * The argument represents microseconds since midnight UTC on
		 * 1 January 2000, unless it is one of the special values
		 * {@link #DT_NOBEGIN DT_NOBEGIN} or {@link #DT_NOEND DT_NOEND}.
		 */
		T construct(long microsecondsSincePostgresEpochUTC);

		/**
		 * A reference implementation that maps to
		 * {@link PgTimestamp PgTimestamp}.
		 *<p>
		 * A value from PostgreSQL is always understood to be at UTC, and
		 * is mapped to a {@code UTC} value. A value from Java is converted
		 * with {@link PgTimestamp#toUniversalTime toUniversalTime} before it
		 * is passed on, so an {@code UNSPECIFIED} one is taken as local.
		 */
		static class AsPgTimestamp implements TimestampTZ<PgTimestamp>
		{
			private AsPgTimestamp() // I am a singleton
			{
			}

			public static final AsPgTimestamp INSTANCE = new AsPgTimestamp();

			@Override
			public PgTimestamp construct(long microsecondsSincePostgresEpochUTC)
			{
				return Timestamp.AsPgTimestamp.fromMicros(
					microsecondsSincePostgresEpochUTC, Disposition.UTC);
			}

			public <T> T store(PgTimestamp t, TimestampTZ<T> f)
			throws DatatypeException
			{
				return f.construct(
					Timestamp.AsPgTimestamp.toMicros(t.toUniversalTime()));
			}
		}
	}
}
