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

import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import static java.nio.ByteOrder.BIG_ENDIAN;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;

import static java.util.Objects.requireNonNull;
import static java.util.ServiceLoader.load;

import java.util.logging.Logger;
import static java.util.logging.Level.WARNING;

import org.postgresql.pgtypes.model.RegType;

/**
 * Base for classes that convert between the binary wire form of a PostgreSQL
 * data type and a Java representation.
 *<p>
 * An adapter has a "top" type T, the Java type it presents to client code.
 * A leaf adapter does not build its T directly; it decodes the wire fields
 * and passes them to a {@link Contract Contract}, a functional interface that
 * documents the PostgreSQL semantics of those fields and constructs the T.
 * The contracts for the supported types are found in the
 * {@code org.postgresql.pgtypes.adt} package, each with a reference
 * implementation.
 *<p>
 * An adapter should be stateless and thread-safe. There should be no need to
 * instantiate more than one instance of an adapter for a given type mapping.
 * Buffers passed to an adapter belong to the caller; an adapter reads or
 * writes sequentially from the buffer's current position and leaves the
 * buffer's byte order as it found it.
 *<p>
 * Code that only needs to move values to or from the wire can use the static
 * {@link #read read} and {@link #write write} methods, which find the right
 * adapter for a {@link RegType RegType} through the {@link Service Service}.
 */
public abstract class Adapter<T>
{
	/**
	 * SQLSTATE for a violation of the wire protocol, such as a declared
	 * length that does not match the type.
	 */
	public static final String PROTOCOL_VIOLATION = "08P01";

	private static final Logger s_logger =
		Logger.getLogger("org.postgresql.pgtypes");

	private final Class<T> m_topType;

	private Adapter(Class<T> witness)
	{
		m_topType = requireNonNull(witness,
			() -> getClass() + " instantiated without a witness class");
	}

	/**
	 * The Java class this adapter produces.
	 */
	public Class<T> topType()
	{
		return m_topType;
	}

	@Override
	public String toString()
	{
		Class<?> c = getClass();
		String name = c.getCanonicalName();
		if ( null == name ) // anonymous or local
			name = c.getName();
		String pkg = c.getPackageName();
		if ( ! pkg.isEmpty() )
			name = name.substring(1 + pkg.length());
		return name + " to produce " + m_topType.getName();
	}

	/**
	 * Method that an {@code Adapter} must implement to indicate whether it
	 * is capable of fetching a given PostgreSQL type.
	 */
	public abstract boolean canFetch(RegType pgType);

	/**
	 * Reads one value from <var>in</var>, whose wire form has been declared
	 * to be <var>length</var> bytes long.
	 */
	public abstract T fetch(ByteBuffer in, int length) throws SQLException;

	/**
	 * Reads one value from <var>in</var> and presents it as text.
	 *<p>
	 * This implementation returns the {@code toString} of the fetched value.
	 */
	public String fetchAsText(ByteBuffer in, int length) throws SQLException
	{
		return String.valueOf(fetch(in, length));
	}

	/**
	 * Returns the number of bytes {@link #store store} will write for
	 * <var>value</var>.
	 */
	public abstract int validateAndGetLength(Object value) throws SQLException;

	/**
	 * Writes <var>value</var> to <var>out</var>, exactly as many bytes as
	 * {@link #validateAndGetLength validateAndGetLength} reported.
	 */
	public abstract void store(Object value, ByteBuffer out)
	throws SQLException;

	/**
	 * Returns the adapter the {@link Service Service} has registered for
	 * <var>pgType</var>.
	 * @throws DatatypeException {@code INVALID_ARGUMENT} if there is none
	 */
	public static Adapter<?> forType(RegType pgType) throws SQLException
	{
		return Service.instance().forTypeImpl(requireNonNull(pgType));
	}

	/**
	 * Reads one value of <var>pgType</var> whose wire form has been declared
	 * to be <var>declaredLength</var> bytes long.
	 *<p>
	 * For a {@link FixedWidth FixedWidth} adapter, the declared length is
	 * checked before anything is read.
	 */
	public static Object read(RegType pgType, int declaredLength, ByteBuffer in)
	throws SQLException
	{
		Adapter<?> adapter = forType(pgType);
		if ( adapter instanceof FixedWidth<?> )
			((FixedWidth<?>)adapter).validateLength(declaredLength);
		return adapter.fetch(in, declaredLength);
	}

	/**
	 * Writes <var>value</var> as a value of <var>pgType</var>, and returns the
	 * number of bytes written.
	 * @throws SQLException with SQLSTATE {@code 08P01} if the adapter wrote
	 * a number of bytes different from the length it announced
	 * @throws BufferOverflowException if <var>out</var> has fewer bytes
	 * remaining than the value needs; nothing is written
	 */
	public static int write(RegType pgType, Object value, ByteBuffer out)
	throws SQLException
	{
		Adapter<?> adapter = forType(pgType);
		int length = adapter.validateAndGetLength(value);
		if ( out.remaining() < length )
			throw new BufferOverflowException();
		int start = out.position();
		adapter.store(value, out);
		checkWritten(adapter, length, start, out);
		return length;
	}

	/**
	 * Confirms that <var>adapter</var> wrote exactly <var>length</var> bytes
	 * since <var>start</var>, restoring the buffer's position if it did not.
	 */
	private static void checkWritten(
		Adapter<?> adapter, int length, int start, ByteBuffer out)
	throws SQLException
	{
		int written = out.position() - start;
		if ( written == length )
			return;
		out.position(start);
		throw new SQLNonTransientConnectionException(
			adapter + " announced " + length + " bytes but wrote " + written,
			PROTOCOL_VIOLATION);
	}

	/**
	 * Ancestor of a class that groups related adapters as nested classes,
	 * and is never itself instantiated.
	 */
	public static abstract class Container
	{
		protected Container()
		{
		}
	}

	/**
	 * Superclass for adapters that fetch something and return it as
	 * a reference type T, using a {@link Contract Contract} to construct it.
	 */
	public abstract static class As<T> extends Adapter<T>
	{
		/**
		 * Constructor for a leaf {@code Adapter} that is based on
		 * a {@code Contract}.
		 * @param using the scalar Contract that will be used to produce
		 * the value returned
		 * @param witness the class of the value the contract produces
		 */
		protected As(Contract.Scalar<T> using, Class<T> witness)
		{
			super(witness);
			requireNonNull(using,
				() -> getClass() + " instantiated without a Contract");
		}
	}

	/**
	 * Superclass for adapters of types whose wire form always has the same
	 * width.
	 *<p>
	 * Such an adapter is fully determined by the order and widths of its
	 * fields. The wire length is the static {@link #width width()} whatever
	 * the value, and any other declared length is a protocol violation.
	 * Fields are read and written in network byte order.
	 */
	public abstract static class FixedWidth<T> extends As<T>
	{
		private final int m_width;

		protected FixedWidth(Contract.Scalar<T> using, Class<T> witness, int width)
		{
			super(using, witness);
			if ( width <= 0 )
				throw new IllegalArgumentException(
					getClass() + " instantiated with width " + width);
			m_width = width;
		}

		/**
		 * The width in bytes of every value's wire form.
		 */
		public final int width()
		{
			return m_width;
		}

		/**
		 * Confirms that a declared wire length matches {@link #width width()}.
		 * @throws SQLException with SQLSTATE {@code 08P01} if it does not
		 */
		public final void validateLength(int declaredLength) throws SQLException
		{
			if ( declaredLength == m_width )
				return;
			String msg = "declared length " + declaredLength + " for " + this +
				", which requires " + m_width;
			s_logger.log(WARNING, msg);
			throw new SQLNonTransientConnectionException(msg, PROTOCOL_VIOLATION);
		}

		@Override
		public final T fetch(ByteBuffer in, int length) throws SQLException
		{
			ByteOrder order = in.order();
			try
			{
				in.order(BIG_ENDIAN);
				return fetchFixed(in);
			}
			finally
			{
				in.order(order);
			}
		}

		/**
		 * Returns {@link #width width()}, whatever the value.
		 */
		@Override
		public final int validateAndGetLength(Object value)
		{
			return m_width;
		}

		/**
		 * Writes <var>value</var> in network byte order, exactly
		 * {@link #width width()} bytes.
		 *<p>
		 * If <var>out</var> has fewer than {@code width()} bytes remaining,
		 * {@code BufferOverflowException} is thrown before anything is
		 * written. If {@link #storeFixed storeFixed} fails, or writes some
		 * other number of bytes, the buffer's position is restored.
		 * @throws SQLException with SQLSTATE {@code 08P01} if
		 * {@code storeFixed} wrote other than {@code width()} bytes
		 */
		@Override
		public final void store(Object value, ByteBuffer out)
		throws SQLException
		{
			if ( out.remaining() < m_width )
				throw new BufferOverflowException();
			ByteOrder order = out.order();
			int start = out.position();
			boolean stored = false;
			try
			{
				out.order(BIG_ENDIAN);
				storeFixed(value, out);
				stored = true;
			}
			finally
			{
				out.order(order);
				if ( ! stored )
					out.position(start);
			}
			checkWritten(this, m_width, start, out);
		}

		/**
		 * Reads the fields, in order, from a buffer already set to network
		 * byte order.
		 */
		protected abstract T fetchFixed(ByteBuffer in) throws SQLException;

		/**
		 * Writes the fields of <var>value</var>, in order, to a buffer already
		 * set to network byte order; exactly {@link #width width()} bytes.
		 */
		protected abstract void storeFixed(Object value, ByteBuffer out)
		throws SQLException;
	}

	/**
	 * A marker interface to be extended by functional interfaces that
	 * serve as ADT contracts.
	 * @param <T> the type to be returned by an instance of the contract
	 */
	public interface Contract<T>
	{
		/**
		 * Marker interface for contracts for simple scalar types.
		 */
		interface Scalar<T> extends Contract<T>
		{
		}
	}

	/**
	 * Registry of the available adapters, located with
	 * {@link java.util.ServiceLoader ServiceLoader}.
	 *<p>
	 * An implementation is provided by the {@code pgtypes} module and
	 * registered in its {@code META-INF/services}.
	 */
	public static abstract class Service
	{
		static Service instance() throws SQLException
		{
			try
			{
				return Holder.s_service;
			}
			catch ( ExceptionInInitializerError e )
			{
				Throwable c = e.getCause();
				if ( c instanceof SQLException )
					throw (SQLException)c;
				throw e;
			}
		}

		/**
		 * Returns the adapter registered for <var>pgType</var>.
		 * @throws DatatypeException {@code INVALID_ARGUMENT} if there is none
		 */
		protected abstract Adapter<?> forTypeImpl(RegType pgType)
		throws SQLException;

		private static class Holder
		{
			private static final Service s_service;

			static {
				try
				{
					s_service =
						load(Service.class, Service.class.getClassLoader())
						.findFirst().orElseThrow(() -> new SQLException(
							"could not load an Adapter.Service"));
				}
				catch ( SQLException e )
				{
					throw new ExceptionInInitializerError(e);
				}
			}
		}
	}
}
