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
 * Built-in implementations of {@link Adapter Adapter} for the supported
 * PostgreSQL data types.
 */
package org.postgresql.pgtypes.pg.adt;

import org.postgresql.pgtypes.Adapter;
