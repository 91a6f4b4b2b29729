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
/**
 * Java representations of PostgreSQL data types, and the functional
 * interfaces that document how each type's stored form is to be understood.
 *<p>
 * The interfaces ({@link Datetime Datetime}, {@link Geometric Geometric})
 * sit between an {@link Adapter Adapter}, which knows the wire form, and
 * whatever Java class an application wants. An adapter decodes the fields of
 * a value and hands them to an implementation of the interface, often just
 * a lambda, which builds the wanted object. Each interface has a reference
 * implementation producing one of the classes in this package:
 *<ul>
 *<li>{@link PgTimestamp PgTimestamp} for {@code timestamp} and
 * {@code timestamptz}, covering the "infinity" and "-infinity" values and
 * dates BC;
 *<li>{@link PgCircle PgCircle} for {@code circle}.
 *</ul>
 *<p>
 * {@link PgDate PgDate} and {@link Ticks Ticks} support {@code PgTimestamp}
 * with the calendar and clock conventions of PostgreSQL's text forms.
 */
package org.postgresql.pgtypes.adt;

import org.postgresql.pgtypes.Adapter;
