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
 * Encoding and decoding of PostgreSQL values between their binary wire form
 * and Java objects.
 *<p>
 * {@link Adapter Adapter} is the starting point; failures of the data type
 * operations themselves are reported as
 * {@link DatatypeException DatatypeException}.
 */
package org.postgresql.pgtypes;
