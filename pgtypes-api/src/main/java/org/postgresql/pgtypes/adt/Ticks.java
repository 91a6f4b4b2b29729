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

import java.util.Locale;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.FORMAT_ERROR;
import static org.postgresql.pgtypes.DatatypeException.Kind.NULL_ARGUMENT;
import static org.postgresql.pgtypes.DatatypeException.Kind.OVERFLOW;

/**
 * Conversions between {@link Duration Duration} and a linear count of
 * 100-nanosecond ticks, and the text form used for the time-of-day part of
 * a {@link PgTimestamp PgTimestamp}.
 *<p>
 * The text form is {@code [-][d.]hh:mm[:ss[.fffffff]]}, or a bare count of
 * days. Up to seven fraction digits are accepted, one per tick.
 */
public final class Ticks
{
	private Ticks() // no instances
	{
	}

	public static final long TICKS_PER_MILLISECOND = 10_000L;
	public static final long TICKS_PER_SECOND      = 1000L * TICKS_PER_MILLISECOND;
	public static final long TICKS_PER_MINUTE      =   60L * TICKS_PER_SECOND;
	public static final long TICKS_PER_HOUR        =   60L * TICKS_PER_MINUTE;
	public static final long TICKS_PER_DAY         =   24L * TICKS_PER_HOUR;

	static final long NANOS_PER_TICK = 100L;

	private static final int NANOS_PER_SECOND = 1_000_000_000;

	private static final Pattern s_timeSpan = Pattern.compile(
		"(-)?+(?:(\\d++)|(?:(\\d++)\\.)?+(\\d++):(\\d++)" +
		"(?::(\\d++)(?:\\.(\\d{1,7}+))?+)?+)");

	/**
	 * The number of whole ticks in <var>d</var>, truncated toward zero so
	 * that {@code of(d.negated()) == -of(d)}.
	 * @throws ArithmeticException if the count does not fit in a long
	 */
	public static long of(Duration d)
	{
		long seconds = d.getSeconds();
		long nanos = d.getNano();
		if ( seconds < 0  &&  nanos > 0 )
		{
			seconds += 1;
			nanos -= NANOS_PER_SECOND;
		}
		return Math.addExact(
			Math.multiplyExact(seconds, TICKS_PER_SECOND),
			nanos / NANOS_PER_TICK);
	}

	/**
	 * A {@code Duration} of exactly <var>ticks</var> ticks.
	 */
	public static Duration toDuration(long ticks)
	{
		return Duration.ofSeconds(
			Math.floorDiv(ticks, TICKS_PER_SECOND),
			Math.floorMod(ticks, TICKS_PER_SECOND) * NANOS_PER_TICK);
	}

	/**
	 * Converts a possibly fractional count of some unit to ticks, rounding
	 * to the nearest tick.
	 * @param value count of the unit, positive or negative
	 * @param ticksPerUnit width of the unit in ticks
	 * @throws IllegalArgumentException if <var>value</var> is NaN
	 * @throws ArithmeticException if the result does not fit in a long
	 */
	public static long fromUnits(double value, long ticksPerUnit)
	{
		if ( Double.isNaN(value) )
			throw new IllegalArgumentException("NaN is not a time span");

		double product = value * ticksPerUnit;
		if ( ! (Math.abs(product) < 0x1p63) )
			throw new ArithmeticException(
				"time span too long: " + value + " * " + ticksPerUnit +
				" ticks");

		return Math.round(product);
	}

	/**
	 * Formats <var>d</var> as {@code [-][d.]hh:mm:ss[.fffffff]}, the
	 * fraction appearing only when nonzero.
	 */
	public static String format(Duration d)
	{
		StringBuilder sb = new StringBuilder();
		if ( d.isNegative() )
		{
			sb.append('-');
			d = d.negated();
		}

		long days = d.toDays();
		if ( 0 != days )
			sb.append(days).append('.');

		sb.append(String.format(Locale.ROOT, "%02d:%02d:%02d",
			d.toHoursPart(), d.toMinutesPart(), d.toSecondsPart()));

		long fraction = d.toNanosPart() / NANOS_PER_TICK;
		if ( 0 != fraction )
			sb.append('.')
				.append(String.format(Locale.ROOT, "%07d", fraction));

		return sb.toString();
	}

	/**
	 * Parses the text form described for this class.
	 * @throws DatatypeException {@code FORMAT_ERROR} if the text is not of
	 * that form, {@code OVERFLOW} if a component is out of range (hours past
	 * 23, minutes or seconds past 59, or a number too large), or
	 * {@code NULL_ARGUMENT} for null input
	 */
	public static Duration parse(String s) throws DatatypeException
	{
		if ( null == s )
			throw new DatatypeException(NULL_ARGUMENT, "null time span");

		Matcher m = s_timeSpan.matcher(s.trim());
		if ( ! m.matches() )
			throw new DatatypeException(FORMAT_ERROR,
				"invalid input syntax for time span: \"" + s + "\"");

		boolean negative = null != m.group(1);

		Duration result;
		if ( null != m.group(2) )
			result = Duration.ofDays(component(m.group(2), Integer.MAX_VALUE));
		else
		{
			long days    = component(m.group(3), Integer.MAX_VALUE);
			long hours   = component(m.group(4), 23);
			long minutes = component(m.group(5), 59);
			long seconds = component(m.group(6), 59);

			long fraction = 0;
			String f = m.group(7);
			if ( null != f )
				fraction = Long.parseLong((f + "000000").substring(0, 7));

			result = Duration.ofDays(days)
				.plusHours(hours)
				.plusMinutes(minutes)
				.plusSeconds(seconds)
				.plusNanos(fraction * NANOS_PER_TICK);
		}

		return negative ? result.negated() : result;
	}

	private static long component(String digits, int max)
	throws DatatypeException
	{
		if ( null == digits )
			return 0;

		int value;
		try
		{
			value = Integer.parseInt(digits);
		}
		catch ( NumberFormatException e )
		{
			throw new DatatypeException(OVERFLOW,
				"time span field value out of range: \"" + digits + "\"", e);
		}

		if ( value > max )
			throw new DatatypeException(OVERFLOW,
				"time span field value out of range: \"" + digits + "\"");

		return value;
	}
}
