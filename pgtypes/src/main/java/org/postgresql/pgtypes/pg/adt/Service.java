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

import java.sql.SQLException;

import static java.util.Collections.unmodifiableMap;
import java.util.EnumMap;
import java.util.Map;

import java.util.logging.Logger;
import static java.util.logging.Level.CONFIG;
import static java.util.logging.Level.FINE;

import org.postgresql.pgtypes.Adapter;
import org.postgresql.pgtypes.DatatypeException;
import static org.postgresql.pgtypes.DatatypeException.Kind.INVALID_ARGUMENT;
import org.postgresql.pgtypes.model.RegType;

/**
 * Implementation of a service defined by {@link Adapter} for data types.
 *<p>
 * Holds one adapter for each {@link RegType RegType} it was given an adapter
 * for, chosen by the adapter's {@link Adapter#canFetch canFetch}. The
 * instance found by {@code ServiceLoader} registers the built-in adapters
 * producing the reference representations.
 */
public final class Service extends Adapter.Service
{
	private static final Logger s_logger =
		Logger.getLogger("org.postgresql.pgtypes.pg.adt");

	private final Map<RegType,Adapter<?>> m_adapters;

	public Service()
	{
		this(
			GeometryAdapter.CIRCLE_INSTANCE,
			DateTimeAdapter.PgTypes.TIMESTAMP_INSTANCE,
			DateTimeAdapter.PgTypes.TIMESTAMPTZ_INSTANCE);
	}

	/**
	 * A registry of the given adapters. Where more than one can fetch the same
	 * type, the first given wins.
	 */
	Service(Adapter<?>... adapters)
	{
		Map<RegType,Adapter<?>> m = new EnumMap<>(RegType.class);
		for ( Adapter<?> a : adapters )
		{
			for ( RegType t : RegType.values() )
			{
				if ( ! a.canFetch(t)  ||  m.containsKey(t) )
					continue;
				m.put(t, a);
				s_logger.log(CONFIG, "registered " + a + " for " + t);
			}
		}
		m_adapters = unmodifiableMap(m);
	}

	@Override
	protected Adapter<?> forTypeImpl(RegType pgType) throws SQLException
	{
		Adapter<?> a = m_adapters.get(pgType);
		if ( null != a )
			return a;
		s_logger.log(FINE, "no adapter registered for " + pgType);
		throw new DatatypeException(INVALID_ARGUMENT,
			"no adapter registered for " + pgType);
	}
}
