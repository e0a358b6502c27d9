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

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A {@code static this()} declaration. {@code location} is the global index
 * of its {@code static} token; the body is absent for the header-only form.
 */
public record StaticConstructor(int location, @Nullable FunctionBody functionBody) implements Node {

    @Override
    public List<Node> children() {
        return Children.of(functionBody);
    }
}
