/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.ast;

import java.util.List;

/**
 * A declared type: the base {@code type2} followed by its suffixes, e.g.
 * {@code int} and {@code delegate()} for {@code int delegate()}.
 */
public record Type(Type2 type2, List<TypeSuffix> typeSuffixes) {

    public Type {
        typeSuffixes = List.copyOf(typeSuffixes);
    }

    public Type(Type2 type2) {
        this(type2, List.of());
    }
}
