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

import static java.util.Objects.requireNonNull;

import java.util.Locale;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import static java.util.regex.Pattern.CASE_INSENSITIVE;

import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.FORMAT_ERROR;
import static org.postgresql.pgtypes.DatatypeException.Kind.NULL_ARGUMENT;
import static org.postgresql.pgtypes.DatatypeException.Kind.OVERFLOW;

/**
 * A calendar date as PostgreSQL presents one: proleptic Gregorian, with years
 * numbered AD and BC and no year zero.
 *<p>
 * Where this class accepts or returns a year as an {@code int}, a negative
 * value denotes a year BC: -1 is 1 BC, the year immediately preceding 1 AD.
 * That differs from the ISO proleptic year of {@link LocalDate LocalDate},
 * in which 1 BC is year 0.
 *<p>
 * The range is that of {@code LocalDate}, which comfortably includes
 * PostgreSQL's own range of 4713 BC to 5874897 AD.
 */
public final class PgDate implements Comparable<PgDate>
{
	private static final long ERA_EPOCH_DAY = LocalDate.of(1, 1, 1).toEpochDay();

	/**
	 * 1 January 1 AD, the date from which {@link #daysSinceEra daysSinceEra}
	 * counts.
	 */
	public static final PgDate ERA = new PgDate(LocalDate.of(1, 1, 1));

	/**
	 * 1 January 1970.
	 */
	public static final PgDate EPOCH = new PgDate(LocalDate.EPOCH);

	/**
	 * 1 January 2000, the origin of PostgreSQL's stored date and timestamp
	 * values.
	 */
	public static final PgDate POSTGRES_EPOCH =
		new PgDate(LocalDate.of(2000, 1, 1));

	private static final Pattern s_date = Pattern.compile(
		"(\\d++)-(\\d++)-(\\d++)(?:\\s++(BC|AD))?+", CASE_INSENSITIVE);

	private final LocalDate m_date;

	private PgDate(LocalDate date)
	{
		m_date = date;
	}

	/**
	 * The date with the given year (negative for BC), month and day.
	 * @throws DateTimeException if year is zero or any field is out of range
	 */
	public static PgDate of(int year, int month, int day)
	{
		if ( 0 == year )
			throw new DateTimeException(
				"there is no year 0; 1 BC is represented as -1");
		return new PgDate(LocalDate.of(toProleptic(year), month, day));
	}

	public static PgDate fromLocalDate(LocalDate date)
	{
		return new PgDate(requireNonNull(date));
	}

	/**
	 * The date <var>days</var> days after {@link #ERA ERA}, or before it if
	 * negative.
	 * @throws DateTimeException if the result is out of range
	 */
	public static PgDate ofDaysSinceEra(long days)
	{
		try
		{
			return new PgDate(
				LocalDate.ofEpochDay(Math.addExact(ERA_EPOCH_DAY, days)));
		}
		catch ( ArithmeticException e )
		{
			throw new DateTimeException("date out of range: " + days, e);
		}
	}

	/**
	 * Year, negative for BC.
	 */
	public int year()
	{
		int proleptic = m_date.getYear();
		return proleptic > 0 ? proleptic : proleptic - 1;
	}

	public int month()
	{
		return m_date.getMonthValue();
	}

	public int day()
	{
		return m_date.getDayOfMonth();
	}

	public int dayOfYear()
	{
		return m_date.getDayOfYear();
	}

	public DayOfWeek dayOfWeek()
	{
		return m_date.getDayOfWeek();
	}

	/**
	 * Whether the year is a leap year. In the proleptic calendar, 1 BC, 5 BC,
	 * and so on are leap years.
	 */
	public boolean isLeapYear()
	{
		return m_date.isLeapYear();
	}

	public boolean isBC()
	{
		return m_date.getYear() <= 0;
	}

	/**
	 * Signed count of days from {@link #ERA ERA} to this date.
	 */
	public long daysSinceEra()
	{
		return m_date.toEpochDay() - ERA_EPOCH_DAY;
	}

	/**
	 * This date shifted by whole years. February 29 becomes February 28 when
	 * the target year is not a leap year.
	 */
	public PgDate plusYears(int years)
	{
		return new PgDate(m_date.plusYears(years));
	}

	/**
	 * This date shifted by whole months, the day clamped to the last day of
	 * the target month when that month is shorter.
	 */
	public PgDate plusMonths(int months)
	{
		return new PgDate(m_date.plusMonths(months));
	}

	public PgDate plusDays(long days)
	{
		return new PgDate(m_date.plusDays(days));
	}

	public LocalDate toLocalDate()
	{
		return m_date;
	}

	@Override
	public int compareTo(PgDate other)
	{
		return m_date.compareTo(other.m_date);
	}

	@Override
	public boolean equals(Object other)
	{
		if ( this == other )
			return true;
		if ( ! (other instanceof PgDate) )
			return false;
		return m_date.equals(((PgDate)other).m_date);
	}

	@Override
	public int hashCode()
	{
		return m_date.hashCode();
	}

	/**
	 * The date as {@code yyyy-MM-dd}, the year at least four digits, followed
	 * by {@code " BC"} for a date before 1 AD.
	 */
	@Override
	public String toString()
	{
		int year = year();
		String s = String.format(Locale.ROOT, "%04d-%02d-%02d",
			Math.abs((long)year), month(), day());
		return year < 0 ? s + " BC" : s;
	}

	/**
	 * Parses {@code y-m-d}, optionally followed by {@code BC} or {@code AD}
	 * in any case.
	 * @throws DatatypeException {@code FORMAT_ERROR} for unrecognized text,
	 * {@code OVERFLOW} for year zero or a field out of range, or
	 * {@code NULL_ARGUMENT} for null input
	 */
	public static PgDate parse(String s) throws DatatypeException
	{
		if ( null == s )
			throw new DatatypeException(NULL_ARGUMENT, "null date");

		Matcher m = s_date.matcher(s.trim());
		if ( ! m.matches() )
			throw new DatatypeException(FORMAT_ERROR,
				"invalid input syntax for type date: \"" + s + "\"");

		try
		{
			int year  = Integer.parseInt(m.group(1));
			int month = Integer.parseInt(m.group(2));
			int day   = Integer.parseInt(m.group(3));
			if ( "bc".equalsIgnoreCase(m.group(4)) )
				year = -year;
			return of(year, month, day);
		}
		catch ( NumberFormatException | DateTimeException e )
		{
			throw new DatatypeException(OVERFLOW,
				"date/time field value out of range: \"" + s + "\"", e);
		}
	}

	private static int toProleptic(int year)
	{
		return year < 0 ? year + 1 : year;
	}
}
