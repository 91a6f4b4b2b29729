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
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import static java.time.ZoneOffset.UTC;

import java.util.Comparator;
import java.util.Locale;
import static java.util.Objects.requireNonNull;
import java.util.Optional;

import java.util.logging.Logger;
import static java.util.logging.Level.WARNING;

import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.FORMAT_ERROR;
import static org.postgresql.pgtypes.DatatypeException.Kind.INVALID_ARGUMENT;
import static org.postgresql.pgtypes.DatatypeException.Kind.INVALID_CAST;
import static org.postgresql.pgtypes.DatatypeException.Kind.INVALID_OPERATION;
import static org.postgresql.pgtypes.DatatypeException.Kind.NULL_ARGUMENT;
import static org.postgresql.pgtypes.DatatypeException.Kind.OVERFLOW;

import static org.postgresql.pgtypes.adt.Ticks.NANOS_PER_TICK;
import static org.postgresql.pgtypes.adt.Ticks.TICKS_PER_DAY;
import static org.postgresql.pgtypes.adt.Ticks.TICKS_PER_HOUR;
import static org.postgresql.pgtypes.adt.Ticks.TICKS_PER_MILLISECOND;
import static org.postgresql.pgtypes.adt.Ticks.TICKS_PER_MINUTE;
import static org.postgresql.pgtypes.adt.Ticks.TICKS_PER_SECOND;

/**
 * A PostgreSQL {@code timestamp} or {@code timestamptz} value, including the
 * "infinity" and "-infinity" values that Java's own date/time types cannot
 * express.
 *<p>
 * A {@code PgTimestamp} is exactly one of:
 *<ul>
 *<li>a {@link Finite Finite} value: a {@link PgDate PgDate}, a time of day
 * as a {@link Duration Duration} since midnight, and a
 * {@link Disposition Disposition} saying how the clock reading is anchored;
 *<li>{@link #INFINITY INFINITY}, later than every finite value; or
 *<li>{@link #NEGATIVE_INFINITY NEGATIVE_INFINITY}, earlier than every
 * finite value.
 *</ul>
 *<p>
 * Calendar and clock accessors are declared only on {@code Finite}, so they
 * cannot be applied to an infinite value. Arithmetic is declared here: adding
 * anything to an infinite value returns it unchanged.
 *<p>
 * Instances are immutable. Equality, hashing and ordering ignore the
 * disposition, which matters only to {@link #toUniversalTime toUniversalTime}
 * and {@link #toLocalTime toLocalTime}.
 *<p>
 * Internally, linear arithmetic is done in ticks of 100 nanoseconds, finer
 * than PostgreSQL's microsecond resolution.
 */
public abstract class PgTimestamp implements Comparable<PgTimestamp>
{
	/**
	 * How the clock reading of a finite value is anchored.
	 */
	public enum Disposition
	{
		/**
		 * Not anchored to any zone, like PostgreSQL's {@code timestamp}.
		 */
		UNSPECIFIED,

		/**
		 * A reading of the UTC clock.
		 */
		UTC,

		/**
		 * A reading of the host's local civil clock.
		 */
		LOCAL
	}

	private static final String s_property = "org.postgresql.pgtypes.timezone";

	private static final Logger s_logger =
		Logger.getLogger("org.postgresql.pgtypes.adt");

	/**
	 * The last unusable timezone setting warned about, so a bad setting is
	 * reported once rather than on every conversion.
	 */
	private static volatile String s_unusable;

	public static final Infinite INFINITY = new Infinite(false);

	public static final Infinite NEGATIVE_INFINITY = new Infinite(true);

	/**
	 * Midnight, 1 January 1970.
	 */
	public static final Finite EPOCH =
		new Finite(PgDate.EPOCH, Duration.ZERO, Disposition.UNSPECIFIED);

	/**
	 * Midnight, 1 January 1 AD, tick zero.
	 */
	public static final Finite ERA =
		new Finite(PgDate.ERA, Duration.ZERO, Disposition.UNSPECIFIED);

	/**
	 * The natural ordering, for use where a {@code Comparator} is wanted.
	 */
	public static final Comparator<PgTimestamp> COMPARATOR =
		Comparator.naturalOrder();

	private PgTimestamp() // only the two nested subclasses
	{
	}

	public static Finite of(PgDate date)
	{
		return of(date, Duration.ZERO, Disposition.UNSPECIFIED);
	}

	public static Finite of(PgDate date, Duration time)
	{
		return of(date, time, Disposition.UNSPECIFIED);
	}

	/**
	 * A finite value from its components, as given.
	 *<p>
	 * <var>time</var> is not required to lie within one day; a value built
	 * with a negative time or one of 24 hours or more keeps that split until
	 * {@link #normalize normalize} or any arithmetic is applied.
	 */
	public static Finite of(PgDate date, Duration time, Disposition disposition)
	{
		return new Finite(
			requireNonNull(date), requireNonNull(time),
			requireNonNull(disposition));
	}

	public static Finite of(
		int year, int month, int day, int hour, int minute, int second)
	{
		return of(year, month, day, hour, minute, second, 0,
			Disposition.UNSPECIFIED);
	}

	public static Finite of(
		int year, int month, int day, int hour, int minute, int second,
		Disposition disposition)
	{
		return of(year, month, day, hour, minute, second, 0, disposition);
	}

	/**
	 * A finite value from calendar and clock fields.
	 * @param year negative for BC, as in {@link PgDate#of PgDate.of}
	 * @throws DateTimeException if the date fields are out of range
	 */
	public static Finite of(
		int year, int month, int day, int hour, int minute, int second,
		int millisecond, Disposition disposition)
	{
		Duration time = Duration.ofHours(hour)
			.plusMinutes(minute)
			.plusSeconds(second)
			.plusMillis(millisecond);
		return of(PgDate.of(year, month, day), time, disposition);
	}

	public static Finite ofTicks(long ticks)
	{
		return ofTicks(ticks, Disposition.UNSPECIFIED);
	}

	/**
	 * The value <var>ticks</var> 100-nanosecond ticks after
	 * {@link #ERA ERA}, or before it if negative.
	 */
	public static Finite ofTicks(long ticks, Disposition disposition)
	{
		return new Finite(
			PgDate.ofDaysSinceEra(Math.floorDiv(ticks, TICKS_PER_DAY)),
			Ticks.toDuration(Math.floorMod(ticks, TICKS_PER_DAY)),
			requireNonNull(disposition));
	}

	/**
	 * A value from a {@code LocalDateTime}, which has no zone and so gives
	 * {@link Disposition#UNSPECIFIED UNSPECIFIED}. Nanoseconds beyond whole
	 * ticks are dropped.
	 */
	public static Finite of(LocalDateTime dateTime)
	{
		return of(dateTime, Disposition.UNSPECIFIED);
	}

	public static Finite of(LocalDateTime dateTime, Disposition disposition)
	{
		return new Finite(
			PgDate.fromLocalDate(dateTime.toLocalDate()),
			Ticks.toDuration(
				dateTime.toLocalTime().toNanoOfDay() / NANOS_PER_TICK),
			requireNonNull(disposition));
	}

	/**
	 * A {@link Disposition#UTC UTC} value at the same instant as
	 * <var>dateTime</var>.
	 */
	public static Finite of(OffsetDateTime dateTime)
	{
		return of(
			dateTime.withOffsetSameInstant(UTC).toLocalDateTime(),
			Disposition.UTC);
	}

	/**
	 * A {@link Disposition#UTC UTC} value at <var>instant</var>.
	 */
	public static Finite of(Instant instant)
	{
		return of(LocalDateTime.ofInstant(instant, UTC), Disposition.UTC);
	}

	/**
	 * The current reading of the local clock, as a
	 * {@link Disposition#LOCAL LOCAL} value.
	 */
	public static Finite now()
	{
		return of(LocalDateTime.now(), Disposition.LOCAL);
	}

	/**
	 * The host's offset from UTC used by {@link #toUniversalTime} and
	 * {@link #toLocalTime}.
	 *<p>
	 * This is the <em>standard</em> offset of the local zone at the present
	 * instant; daylight saving adjustments are not applied. The local zone is
	 * the one named by the system property
	 * {@code org.postgresql.pgtypes.timezone} if set, otherwise the JVM's
	 * default zone. The property is consulted on every call; an unusable
	 * setting is logged at {@code WARNING} the first time it is seen.
	 */
	public static ZoneOffset localOffset()
	{
		ZoneId zone = ZoneId.systemDefault();
		String configured = System.getProperty(s_property);
		if ( null != configured )
		{
			try
			{
				zone = ZoneId.of(configured);
			}
			catch ( DateTimeException e )
			{
				if ( ! configured.equals(s_unusable) )
				{
					s_unusable = configured;
					s_logger.log(WARNING,
						"unusable " + s_property + " setting \"" + configured +
						"\", using " + zone, e);
				}
			}
		}
		return zone.getRules().getStandardOffset(Instant.now());
	}

	public abstract boolean isFinite();

	public abstract boolean isInfinity();

	public abstract boolean isNegativeInfinity();

	/**
	 * The disposition of a finite value; {@code UNSPECIFIED} for either
	 * infinity.
	 */
	public abstract Disposition disposition();

	/**
	 * This value as {@code Finite}, if it is.
	 */
	public abstract Optional<Finite> finite();

	/**
	 * This value as {@code Finite}.
	 * @throws DatatypeException {@code INVALID_OPERATION} if it is infinite
	 */
	public Finite asFinite() throws DatatypeException
	{
		return finite().orElseThrow(() -> new DatatypeException(
			INVALID_OPERATION, "timestamp \"" + this + "\" is not finite"));
	}

	/**
	 * The same instant as a {@code UTC} value.
	 *<p>
	 * A {@code LOCAL} value is converted by subtracting
	 * {@link #localOffset localOffset()}. An {@code UNSPECIFIED} value is, by
	 * policy, treated as {@code LOCAL}. A {@code UTC} value, or an infinite
	 * one, is returned unchanged.
	 */
	public abstract PgTimestamp toUniversalTime();

	/**
	 * The same instant as a {@code LOCAL} value.
	 *<p>
	 * A {@code UTC} value is converted by adding
	 * {@link #localOffset localOffset()}. An {@code UNSPECIFIED} value is, by
	 * policy, treated as {@code UTC}. A {@code LOCAL} value, or an infinite
	 * one, is returned unchanged.
	 */
	public abstract PgTimestamp toLocalTime();

	/**
	 * Projection to {@code LocalDateTime}, dropping the disposition.
	 * @throws DatatypeException {@code INVALID_CAST} if this value is infinite
	 * or its year is outside 1 to 9999
	 */
	public abstract LocalDateTime toLocalDateTime() throws DatatypeException;

	public abstract PgTimestamp addYears(int years);

	public abstract PgTimestamp addMonths(int months);

	public abstract PgTimestamp addDays(double days);

	public abstract PgTimestamp addHours(double hours);

	public abstract PgTimestamp addMinutes(double minutes);

	public abstract PgTimestamp addSeconds(double seconds);

	public abstract PgTimestamp addMilliseconds(double milliseconds);

	public abstract PgTimestamp addTicks(long ticks);

	/**
	 * This value moved by <var>span</var>, which is first truncated toward
	 * zero to whole ticks.
	 */
	public abstract PgTimestamp plus(Duration span);

	public abstract PgTimestamp minus(Duration span);

	/**
	 * The span from <var>other</var> to this value.
	 * @throws DatatypeException {@code INVALID_OPERATION} if either value is
	 * infinite
	 */
	public abstract Duration minus(PgTimestamp other) throws DatatypeException;

	/**
	 * This value with its time of day brought within [00:00, 24:00), any
	 * excess carried into the date.
	 */
	public abstract PgTimestamp normalize();

	/**
	 * -1, 0, or 1 for negative infinity, finite, or infinity.
	 */
	abstract int rank();

	/**
	 * Orders {@code NEGATIVE_INFINITY} before every finite value and
	 * {@code INFINITY} after; finite values by date, then by time of day.
	 */
	@Override
	public int compareTo(PgTimestamp other)
	{
		int cmp = Integer.compare(rank(), other.rank());
		if ( 0 != cmp  ||  0 != rank() )
			return cmp;

		Finite a = (Finite)this;
		Finite b = (Finite)other;
		cmp = a.m_date.compareTo(b.m_date);
		return 0 != cmp ? cmp : a.m_time.compareTo(b.m_time);
	}

	/**
	 * Untyped comparison: null sorts before any value, and two
	 * {@code PgTimestamp}s compare by their natural order.
	 * @throws IllegalArgumentException if a non-null operand is not a
	 * {@code PgTimestamp}; its cause is a {@link DatatypeException} of kind
	 * {@code INVALID_ARGUMENT}
	 */
	public static int compare(Object x, Object y)
	{
		if ( null == x )
			return null == y ? 0 : -1;
		if ( null == y )
			return 1;

		if ( x instanceof PgTimestamp  &&  y instanceof PgTimestamp )
			return ((PgTimestamp)x).compareTo((PgTimestamp)y);

		String msg = "cannot compare " + x.getClass().getName() + " with " +
			y.getClass().getName() + " as timestamps";
		throw new IllegalArgumentException(
			msg, new DatatypeException(INVALID_ARGUMENT, msg));
	}

	/**
	 * Parses the text produced by {@link #toString toString}.
	 *<p>
	 * Leading and trailing space is ignored, and case does not matter.
	 * {@code infinity} and {@code -infinity} give the infinite values.
	 * Otherwise, the text before the first space is the date; if the text
	 * contains {@code bc} anywhere, the date is taken as BC. The text after
	 * that space, up to another space or the end, is the time of day, in the
	 * form {@link Ticks#parse Ticks.parse} accepts; a {@code bc} marker
	 * directly after the date is skipped first. Anything after the time is
	 * ignored. The result is {@code UNSPECIFIED}.
	 * @throws DatatypeException {@code NULL_ARGUMENT} for null input,
	 * {@code OVERFLOW} if a component is recognizable but out of range,
	 * otherwise {@code FORMAT_ERROR}
	 */
	public static PgTimestamp parse(String s) throws DatatypeException
	{
		if ( null == s )
			throw new DatatypeException(NULL_ARGUMENT, "null timestamp");

		String str = s.trim().toLowerCase(Locale.ROOT);
		switch ( str )
		{
		case "infinity":
			return INFINITY;
		case "-infinity":
			return NEGATIVE_INFINITY;
		default:
			break;
		}

		int firstSpace = str.indexOf(' ');
		if ( -1 == firstSpace )
			throw new DatatypeException(FORMAT_ERROR,
				"invalid input syntax for type timestamp: \"" + s + "\"");

		String datePart = str.substring(0, firstSpace);
		if ( str.contains("bc") )
			datePart += " BC";

		int timeStart = firstSpace + 1;
		if ( str.startsWith("bc ", timeStart) ) // as toString places it
			timeStart += 3;

		int timeEnd = str.indexOf(' ', timeStart);
		if ( -1 == timeEnd )
			timeEnd = str.length();
		String timePart = str.substring(timeStart, timeEnd);

		try
		{
			return of(PgDate.parse(datePart), Ticks.parse(timePart));
		}
		catch ( DatatypeException e )
		{
			if ( OVERFLOW == e.kind() )
				throw e;
			throw new DatatypeException(FORMAT_ERROR,
				"invalid input syntax for type timestamp: \"" + s + "\"", e);
		}
	}

	/**
	 * A calendar date and time of day, with a disposition.
	 */
	public static final class Finite extends PgTimestamp
	{
		private final PgDate m_date;
		private final Duration m_time;
		private final Disposition m_disposition;

		private Finite(PgDate date, Duration time, Disposition disposition)
		{
			m_date = date;
			m_time = time;
			m_disposition = disposition;
		}

		public PgDate date()
		{
			return m_date;
		}

		/**
		 * Time of day, as the span since midnight.
		 */
		public Duration time()
		{
			return m_time;
		}

		public int year()
		{
			return m_date.year();
		}

		public int month()
		{
			return m_date.month();
		}

		public int day()
		{
			return m_date.day();
		}

		public int dayOfYear()
		{
			return m_date.dayOfYear();
		}

		public DayOfWeek dayOfWeek()
		{
			return m_date.dayOfWeek();
		}

		public boolean isLeapYear()
		{
			return m_date.isLeapYear();
		}

		public int hours()
		{
			return m_time.toHoursPart();
		}

		public int minutes()
		{
			return m_time.toMinutesPart();
		}

		public int seconds()
		{
			return m_time.toSecondsPart();
		}

		public int milliseconds()
		{
			return m_time.toMillisPart();
		}

		/**
		 * Ticks since {@link #ERA ERA}: days since the era times
		 * ticks per day, plus the ticks of the time of day.
		 * @throws ArithmeticException if the count does not fit in a long,
		 * which happens for dates more than about 29000 years from the era
		 */
		public long ticks()
		{
			return Math.addExact(
				Math.multiplyExact(m_date.daysSinceEra(), TICKS_PER_DAY),
				Ticks.of(m_time));
		}

		@Override
		public boolean isFinite()
		{
			return true;
		}

		@Override
		public boolean isInfinity()
		{
			return false;
		}

		@Override
		public boolean isNegativeInfinity()
		{
			return false;
		}

		@Override
		public Disposition disposition()
		{
			return m_disposition;
		}

		@Override
		public Optional<Finite> finite()
		{
			return Optional.of(this);
		}

		@Override
		public Finite toUniversalTime()
		{
			if ( Disposition.UTC == m_disposition )
				return this;
			Finite shifted =
				plus(Duration.ofSeconds(- localOffset().getTotalSeconds()));
			return new Finite(shifted.m_date, shifted.m_time, Disposition.UTC);
		}

		@Override
		public Finite toLocalTime()
		{
			if ( Disposition.LOCAL == m_disposition )
				return this;
			Finite shifted =
				plus(Duration.ofSeconds(localOffset().getTotalSeconds()));
			return new Finite(
				shifted.m_date, shifted.m_time, Disposition.LOCAL);
		}

		@Override
		public LocalDateTime toLocalDateTime() throws DatatypeException
		{
			int year = year();
			if ( year < 1  ||  year > 9999 )
				throw new DatatypeException(INVALID_CAST,
					"timestamp \"" + this + "\" out of the range of " +
					"LocalDateTime conversion (year must be between 1 and 9999)");
			return m_date.toLocalDate().atStartOfDay().plus(m_time);
		}

		@Override
		public Finite addYears(int years)
		{
			return new Finite(m_date.plusYears(years), m_time, m_disposition);
		}

		@Override
		public Finite addMonths(int months)
		{
			return new Finite(m_date.plusMonths(months), m_time, m_disposition);
		}

		@Override
		public Finite addDays(double days)
		{
			return addTicks(Ticks.fromUnits(days, TICKS_PER_DAY));
		}

		@Override
		public Finite addHours(double hours)
		{
			return addTicks(Ticks.fromUnits(hours, TICKS_PER_HOUR));
		}

		@Override
		public Finite addMinutes(double minutes)
		{
			return addTicks(Ticks.fromUnits(minutes, TICKS_PER_MINUTE));
		}

		@Override
		public Finite addSeconds(double seconds)
		{
			return addTicks(Ticks.fromUnits(seconds, TICKS_PER_SECOND));
		}

		@Override
		public Finite addMilliseconds(double milliseconds)
		{
			return addTicks(
				Ticks.fromUnits(milliseconds, TICKS_PER_MILLISECOND));
		}

		@Override
		public Finite addTicks(long ticks)
		{
			return shift(0L, ticks);
		}

		@Override
		public Finite plus(Duration span)
		{
			long seconds = span.getSeconds();
			long nanos = span.getNano();
			if ( seconds < 0  &&  nanos > 0 )
			{
				seconds += 1;
				nanos -= 1_000_000_000L;
			}
			long secondsPerDay = TICKS_PER_DAY / TICKS_PER_SECOND;
			return shift(seconds / secondsPerDay,
				(seconds % secondsPerDay) * TICKS_PER_SECOND +
				nanos / NANOS_PER_TICK);
		}

		@Override
		public Finite minus(Duration span)
		{
			return plus(span.negated());
		}

		@Override
		public Duration minus(PgTimestamp other) throws DatatypeException
		{
			if ( ! other.isFinite() )
				throw new DatatypeException(INVALID_OPERATION,
					"cannot subtract infinite timestamps");

			Finite o = (Finite)other;
			return Duration.ofDays(m_date.daysSinceEra() - o.m_date.daysSinceEra())
				.plus(m_time.minus(o.m_time));
		}

		@Override
		public Finite normalize()
		{
			return plus(Duration.ZERO);
		}

		/*
		 * Moves by a count of days and a count of ticks, carrying whole days
		 * out of the time of day so it ends in [0, TICKS_PER_DAY). Days and
		 * ticks are never combined into one tick total.
		 */
		private Finite shift(long days, long ticks)
		{
			long timeTicks = Ticks.of(m_time);
			long carry = Math.floorDiv(timeTicks, TICKS_PER_DAY)
				+ Math.floorDiv(ticks, TICKS_PER_DAY);
			long rest = Math.floorMod(timeTicks, TICKS_PER_DAY)
				+ Math.floorMod(ticks, TICKS_PER_DAY);
			carry += Math.floorDiv(rest, TICKS_PER_DAY);
			rest = Math.floorMod(rest, TICKS_PER_DAY);
			return new Finite(
				m_date.plusDays(Math.addExact(days, carry)),
				Ticks.toDuration(rest), m_disposition);
		}

		@Override
		int rank()
		{
			return 0;
		}

		@Override
		public boolean equals(Object other)
		{
			if ( this == other )
				return true;
			if ( ! (other instanceof Finite) )
				return false;
			Finite o = (Finite)other;
			return m_date.equals(o.m_date)  &&  m_time.equals(o.m_time);
		}

		@Override
		public int hashCode()
		{
			return m_date.hashCode() ^ Integer.rotateLeft(m_time.hashCode(), 16);
		}

		/**
		 * The date as {@link PgDate#toString PgDate} formats it, a space, and
		 * the time of day as {@link Ticks#format Ticks} formats it.
		 */
		@Override
		public String toString()
		{
			return m_date + " " + Ticks.format(m_time);
		}
	}

	/**
	 * One of the two infinite values. Every operation that would move the
	 * value returns it unchanged.
	 */
	public static final class Infinite extends PgTimestamp
	{
		private final boolean m_negative;

		private Infinite(boolean negative)
		{
			m_negative = negative;
		}

		@Override
		public boolean isFinite()
		{
			return false;
		}

		@Override
		public boolean isInfinity()
		{
			return ! m_negative;
		}

		@Override
		public boolean isNegativeInfinity()
		{
			return m_negative;
		}

		@Override
		public Disposition disposition()
		{
			return Disposition.UNSPECIFIED;
		}

		@Override
		public Optional<Finite> finite()
		{
			return Optional.empty();
		}

		@Override
		public Infinite toUniversalTime()
		{
			return this;
		}

		@Override
		public Infinite toLocalTime()
		{
			return this;
		}

		@Override
		public LocalDateTime toLocalDateTime() throws DatatypeException
		{
			throw new DatatypeException(INVALID_CAST,
				"cannot convert infinite timestamp to LocalDateTime");
		}

		@Override
		public Infinite addYears(int years)
		{
			return this;
		}

		@Override
		public Infinite addMonths(int months)
		{
			return this;
		}

		@Override
		public Infinite addDays(double days)
		{
			return this;
		}

		@Override
		public Infinite addHours(double hours)
		{
			return this;
		}

		@Override
		public Infinite addMinutes(double minutes)
		{
			return this;
		}

		@Override
		public Infinite addSeconds(double seconds)
		{
			return this;
		}

		@Override
		public Infinite addMilliseconds(double milliseconds)
		{
			return this;
		}

		@Override
		public Infinite addTicks(long ticks)
		{
			return this;
		}

		@Override
		public Infinite plus(Duration span)
		{
			return this;
		}

		@Override
		public Infinite minus(Duration span)
		{
			return this;
		}

		@Override
		public Duration minus(PgTimestamp other) throws DatatypeException
		{
			throw new DatatypeException(INVALID_OPERATION,
				"cannot subtract infinite timestamps");
		}

		@Override
		public Infinite normalize()
		{
			return this;
		}

		@Override
		int rank()
		{
			return m_negative ? -1 : 1;
		}

		@Override
		public boolean equals(Object other)
		{
			if ( ! (other instanceof Infinite) )
				return false;
			return m_negative == ((Infinite)other).m_negative;
		}

		@Override
		public int hashCode()
		{
			return m_negative ? Integer.MIN_VALUE : Integer.MAX_VALUE;
		}

		@Override
		public String toString()
		{
			return m_negative ? "-infinity" : "infinity";
		}
	}
}
