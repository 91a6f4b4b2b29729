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

/**
 * Container for abstract-type functional interfaces in PostgreSQL's
 * {@code GEOMETRIC} type category.
 */
public interface Geometric
{
	/**
	 * The {@code CIRCLE} type's PostgreSQL semantics: a center point and
	 * a radius.
	 */
	@FunctionalInterface
	public interface Circle<T> extends Contract.Scalar<T>
	{
		/**
		 * Constructs a representation <var>T</var> from the components
		 * of the PostgreSQL data type.
		 *<p>
		 * PostgreSQL does not reject a stored circle with a NaN or infinite
		 * component, so an implementation should be prepared for either.
		 * @param x the x coordinate of the center
		 * @param y the y coordinate of the center
		 * @param radius the radius
		 */
		T construct(double x, double y, double radius);

		/**
		 * A reference implementation that maps to
		 * {@link PgCircle PgCircle}.
		 */
		static class AsPgCircle implements Circle<PgCircle>
		{
			private AsPgCircle() // I am a singleton
			{
			}

			public static final AsPgCircle INSTANCE = new AsPgCircle();

			@Override
			public PgCircle construct(double x, double y, double radius)
			{
				return new PgCircle(x, y, radius);
			}

			/**
			 * Passes the components of <var>c</var> to <var>f</var>, in
			 * wire order.
			 */
			public <T> T store(PgCircle c, Circle<T> f)
			{
				return f.construct(c.x(), c.y(), c.radius());
			}
		}
	}
}
