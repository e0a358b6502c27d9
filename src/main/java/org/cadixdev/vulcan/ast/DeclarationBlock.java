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
 * A braced group of declarations under an attribute or a conditional
 * compilation condition, e.g. {@code version (Posix) { ... }}.
 */
public record DeclarationBlock(List<Node> declarations) implements Node {

    public DeclarationBlock {
        declarations = List.copyOf(declarations);
    }

    @Override
    public List<Node> children() {
        return declarations;
    }
}
