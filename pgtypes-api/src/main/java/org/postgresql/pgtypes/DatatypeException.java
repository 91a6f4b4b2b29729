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
package org.postgresql.pgtypes;

import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/**
 * Exception signalling that a data type operation could not be carried out
 * for the given input.
 *<p>
 * Every instance carries one {@link Kind Kind} from a closed set, so a caller
 * can tell, for example, an unrecognizable input (a {@code FORMAT_ERROR})
 * from one that was recognizable but out of range (an {@code OVERFLOW})
 * without inspecting messages. The {@code SQLSTATE} is derived from the kind.
 */
public class DatatypeException extends SQLException
{
	private static final long serialVersionUID = 1L;

	/**
	 * The closed set of failure kinds a data type operation can report.
	 */
	public enum Kind
	{
		/**
		 * The value cannot be represented in the requested Java type.
		 */
		INVALID_CAST      ("42846"),

		/**
		 * The operation has no defined result for the operand(s), as when
		 * subtracting an infinite timestamp.
		 */
		INVALID_OPERATION ("22000"),

		/**
		 * Text input did not have a recognizable structure.
		 */
		FORMAT_ERROR      ("22007"),

		/**
		 * Input was structurally valid but a component was out of range.
		 */
		OVERFLOW          ("22008"),

		/**
		 * A null was supplied where a value is required.
		 */
		NULL_ARGUMENT     ("22004"),

		/**
		 * An argument was of a type or value the operation does not accept.
		 */
		INVALID_ARGUMENT  ("22023");

		private final String m_sqlState;

		Kind(String sqlState)
		{
			m_sqlState = sqlState;
		}

		/**
		 * The five-character {@code SQLSTATE} reported for this kind.
		 */
		public String sqlState()
		{
			return m_sqlState;
		}
	}

	private final Kind m_kind;

	public DatatypeException(Kind kind, String message)
	{
		this(kind, message, null);
	}

	public DatatypeException(Kind kind, String message, Throwable cause)
	{
		super(message, requireNonNull(kind).sqlState(), cause);
		m_kind = kind;
	}

	/**
	 * The kind of failure this exception reports.
	 */
	public Kind kind()
	{
		return m_kind;
	}
}
