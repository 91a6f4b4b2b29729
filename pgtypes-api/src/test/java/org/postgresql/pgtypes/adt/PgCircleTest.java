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

import junit.framework.TestCase;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;

import org.postgresql.pgtypes.DatatypeException;
import org.postgresql.pgtypes.DatatypeException.Kind;

public class PgCircleTest extends TestCase
{
	public PgCircleTest(String name) { super(name); }

	public void testText() throws Exception
	{
		PgCircle c = new PgCircle(1.5, -2.25, 3.0);
		assertEquals("<(1.5,-2.25),3.0>", c.toString());
		assertEquals(c, PgCircle.parse(c.toString()));
	}

	public void testLooseForms() throws Exception
	{
		PgCircle expected = new PgCircle(1, 2, 3);
		String[] forms =
		{
			"<(1,2),3>",
			"((1,2),3)",
			"(1,2),3",
			"1,2,3",
			"<1,2,3>",
			" < ( 1 , 2 ) , 3 > ",
			"<(1.0,2e0),+3>"
		};

		for ( String s : forms )
			assertEquals(s, expected, PgCircle.parse(s));
	}

	public void testSpecialValues() throws Exception
	{
		PgCircle c = PgCircle.parse("<(Infinity,-infinity),NaN>");
		assertEquals(Double.POSITIVE_INFINITY, c.x(), 0.0);
		assertEquals(Double.NEGATIVE_INFINITY, c.y(), 0.0);
		assertTrue(Double.isNaN(c.radius()));
		assertEquals(c, new PgCircle(
			Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NaN));
		assertEquals(c.hashCode(), new PgCircle(
			Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NaN)
			.hashCode());
		assertThat(new PgCircle(0.0, 0.0, 1.0),
			not(equalTo(new PgCircle(-0.0, 0.0, 1.0))));
	}

	public void testParseFailures() throws Exception
	{
		String[] bad =
		{
			"<(1,2),-3>", "1,2", "<(a,b),c>", "", "<", "<>",
			"<(1,2),3)", "(1,2,3>", "((1,2),3>", "<(1,2,3>", "(1,2,3)",
			"1,2),3", "((1,2,3)"
		};
		for ( String s : bad )
		{
			try
			{
				PgCircle.parse(s);
				fail("parsed \"" + s + "\"");
			}
			catch ( DatatypeException e )
			{
				assertEquals(s, Kind.FORMAT_ERROR, e.kind());
			}
		}

		try
		{
			PgCircle.parse(null);
			fail("parsed null");
		}
		catch ( DatatypeException e )
		{
			assertEquals(Kind.NULL_ARGUMENT, e.kind());
		}
	}
}
