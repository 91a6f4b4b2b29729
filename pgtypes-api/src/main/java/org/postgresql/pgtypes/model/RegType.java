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
package org.postgresql.pgtypes.model;

import java.util.Optional;

/**
 * PostgreSQL data types known to this library, identified as the server
 * identifies them, by type OID.
 *<p>
 * The OIDs are those assigned in PostgreSQL's {@code pg_type.dat} and are
 * stable across server versions.
 */
public enum RegType
{
	CIRCLE      ( 718, "circle",      24),
	TIMESTAMP   (1114, "timestamp",    8),
	TIMESTAMPTZ (1184, "timestamptz",  8);

	/**
	 * Value of {@link #length length()} for a type whose values do not all
	 * have the same width.
	 */
	public static final int VARLENA = -1;

	private final int m_oid;
	private final String m_name;
	private final int m_length;

	RegType(int oid, String name, int length)
	{
		m_oid = oid;
		m_name = name;
		m_length = length;
	}

	public int oid()
	{
		return m_oid;
	}

	/**
	 * The type's name in {@code pg_catalog}.
	 */
	public String typeName()
	{
		return m_name;
	}

	/**
	 * The type's {@code typlen}: its fixed width in bytes, or
	 * {@link #VARLENA VARLENA}.
	 */
	public int length()
	{
		return m_length;
	}

	/**
	 * The {@code RegType} with the given OID, if it is one known here.
	 */
	public static Optional<RegType> fromOid(int oid)
	{
		for ( RegType t : values() )
			if ( t.m_oid == oid )
				return Optional.of(t);
		return Optional.empty();
	}

	@Override
	public String toString()
	{
		return m_name + " (oid " + m_oid + ")";
	}
}
