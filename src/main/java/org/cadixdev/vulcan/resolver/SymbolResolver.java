/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.resolver;

/**
 * Answers whether an unqualified type name denotes an aliased delegate type.
 *
 * <p>Lookups are by name only, not by scope: two unrelated aliases sharing a
 * name are indistinguishable. Implementations must be safe for concurrent
 * reads once populated.</p>
 */
@FunctionalInterface
public interface SymbolResolver {

    SymbolResolver NONE = name -> AliasResolution.UNKNOWN;

    AliasResolution resolve(String name);
}
