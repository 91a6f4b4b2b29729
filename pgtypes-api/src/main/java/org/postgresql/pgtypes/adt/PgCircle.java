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

import java.util.Locale;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import static java.util.regex.Pattern.CASE_INSENSITIVE;

import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.FORMAT_ERROR;
import static org.postgresql.pgtypes.DatatypeException.Kind.NULL_ARGUMENT;

/**
 * A PostgreSQL {@code circle}: a center point and a radius, all
 * {@code float8}.
 *<p>
 * Two circles are equal when their three components are, as compared by
 * {@link Double#compare Double.compare}.
 */
public final class PgCircle
{
	private static final String s_number =
		"([-+]?+(?:(?:\\d++(?:\\.\\d*+)?+|\\.\\d++)(?:e[-+]?+\\d++)?+" +
		"|infinity|nan))";

	/*
	 * The center pair and radius, inside any outer delimiters. Groups 1 and 4
	 * capture the pair's own parentheses, which must both be present or both
	 * absent.
	 */
	private static final Pattern s_circle = Pattern.compile(
		"(\\(?+)\\s*+" + s_number + "\\s*+,\\s*+" + s_number +
		"\\s*+(\\)?+)\\s*+,\\s*+" + s_number,
		CASE_INSENSITIVE);

	private final double m_x;
	private final double m_y;
	private final double m_radius;

	public PgCircle(double x, double y, double radius)
	{
		m_x = x;
		m_y = y;
		m_radius = radius;
	}

	public double x()
	{
		return m_x;
	}

	public double y()
	{
		return m_y;
	}

	public double radius()
	{
		return m_radius;
	}

	@Override
	public boolean equals(Object other)
	{
		if ( this == other )
			return true;
		if ( ! (other instanceof PgCircle) )
			return false;
		PgCircle o = (PgCircle)other;
		return 0 == Double.compare(m_x, o.m_x)
			&& 0 == Double.compare(m_y, o.m_y)
			&& 0 == Double.compare(m_radius, o.m_radius);
	}

	@Override
	public int hashCode()
	{
		int h = Double.hashCode(m_x);
		h = 31 * h + Double.hashCode(m_y);
		return 31 * h + Double.hashCode(m_radius);
	}

	/**
	 * PostgreSQL's output form, {@code <(x,y),r>}.
	 */
	@Override
	public String toString()
	{
		return "<(" + m_x + "," + m_y + ")," + m_radius + ">";
	}

	/**
	 * Parses {@code <(x,y),r>}, or any of the looser forms PostgreSQL also
	 * accepts: {@code ((x,y),r)}, {@code (x,y),r}, {@code <x,y,r>}, or
	 * {@code x,y,r}. Each opening delimiter must have its matching closing
	 * one.
	 * @throws DatatypeException {@code FORMAT_ERROR} if the text is not of one
	 * of those forms or the radius is negative, {@code NULL_ARGUMENT} for
	 * null input
	 */
	public static PgCircle parse(String s) throws DatatypeException
	{
		if ( null == s )
			throw new DatatypeException(NULL_ARGUMENT, "null circle");

		String body = s.trim();
		if ( body.startsWith("<") )
			body = unwrap(body, '>', s);
		else if ( body.startsWith("(") && body.substring(1).trim()
			.startsWith("(") )
			body = unwrap(body, ')', s);

		Matcher m = s_circle.matcher(body);
		if ( ! m.matches() || m.group(1).length() != m.group(4).length() )
			throw syntaxError(s, "");

		double radius = number(m.group(5));
		if ( radius < 0 )
			throw syntaxError(s, " (negative radius)");

		return new PgCircle(number(m.group(2)), number(m.group(3)), radius);
	}

	/**
	 * Strips the opening delimiter of <var>text</var>, which must end with
	 * the matching <var>close</var>, and that closing delimiter.
	 */
	private static String unwrap(String text, char close, String input)
	throws DatatypeException
	{
		if ( text.length() < 2 || close != text.charAt(text.length() - 1) )
			throw syntaxError(input, " (unbalanced delimiters)");
		return text.substring(1, text.length() - 1).trim();
	}

	private static DatatypeException syntaxError(String input, String detail)
	{
		return new DatatypeException(FORMAT_ERROR,
			"invalid input syntax for type circle: \"" + input + "\"" + detail);
	}

	private static double number(String s)
	{
		switch ( s.toLowerCase(Locale.ROOT) )
		{
		case "infinity":
		case "+infinity":
			return Double.POSITIVE_INFINITY;
		case "-infinity":
			return Double.NEGATIVE_INFINITY;
		case "nan":
		case "+nan":
		case "-nan":
			return Double.NaN;
		default:
			return Double.parseDouble(s);
		}
	}
}
