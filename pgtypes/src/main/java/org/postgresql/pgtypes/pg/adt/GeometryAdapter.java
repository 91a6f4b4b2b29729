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

import org.postgresql.pgtypes.Adapter;
import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.INVALID_ARGUMENT;
import static org.postgresql.pgtypes.DatatypeException.Kind.NULL_ARGUMENT;
import org.postgresql.pgtypes.adt.Geometric;
import org.postgresql.pgtypes.adt.PgCircle;
import org.postgresql.pgtypes.model.RegType;

/**
 * PostgreSQL geometric types, available in various representations by
 * implementing the corresponding functional interfaces to construct them.
 */
public abstract class GeometryAdapter extends Adapter.Container
{
	private GeometryAdapter() // no instances
	{
	}

	/**
	 * Instance of the circle adapter producing {@link PgCircle PgCircle}.
	 */
	public static final Circle<PgCircle> CIRCLE_INSTANCE =
		new Circle<>(Geometric.Circle.AsPgCircle.INSTANCE, PgCircle.class);

	/**
	 * Adapter for the {@code CIRCLE} type to the functional interface
	 * {@link Geometric.Circle Geometric.Circle}.
	 *<p>
	 * The wire form is three {@code float8} values: the x and y of the center,
	 * then the radius.
	 *<p>
	 * For output, accepts a {@link PgCircle PgCircle}, or a {@code String} in
	 * any form {@link PgCircle#parse PgCircle.parse} accepts.
	 */
	public static class Circle<T> extends Adapter.FixedWidth<T>
	{
		public static final int WIDTH = 3 * Double.BYTES;

		private final Geometric.Circle<T> m_ctor;

		public Circle(Geometric.Circle<T> ctor, Class<T> witness)
		{
			super(ctor, witness, WIDTH);
			m_ctor = ctor;
		}

		@Override
		public boolean canFetch(RegType pgType)
		{
			return RegType.CIRCLE == pgType;
		}

		@Override
		protected T fetchFixed(ByteBuffer in)
		{
			double x = in.getDouble();
			double y = in.getDouble();
			double radius = in.getDouble();
			return m_ctor.construct(x, y, radius);
		}

		/**
		 * The value in PostgreSQL's text form, {@code <(x,y),r>}, whatever
		 * this adapter's own representation is.
		 */
		@Override
		public String fetchAsText(ByteBuffer in, int length) throws SQLException
		{
			return CIRCLE_INSTANCE.fetch(in, length).toString();
		}

		@Override
		protected void storeFixed(Object value, ByteBuffer out)
		throws SQLException
		{
			Geometric.Circle.AsPgCircle.INSTANCE.store(toPgCircle(value),
				(x, y, radius) ->
				{
					out.putDouble(x).putDouble(y).putDouble(radius);
					return null;
				});
		}

		private static PgCircle toPgCircle(Object value) throws SQLException
		{
			if ( value instanceof PgCircle )
				return (PgCircle)value;
			if ( value instanceof String )
				return PgCircle.parse((String)value);
			if ( null == value )
				throw new DatatypeException(NULL_ARGUMENT, "null circle");
			throw new DatatypeException(INVALID_ARGUMENT,
				"cannot store " + value.getClass().getName() + " as circle");
		}
	}
}
