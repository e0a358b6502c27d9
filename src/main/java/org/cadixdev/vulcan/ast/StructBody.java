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
 * The braced body of an aggregate. {@code startLocation} is the global index
 * of the opening brace, {@code endLocation} that of the closing brace.
 */
public record StructBody(int startLocation, int endLocation, List<Node> declarations) implements Node {

    public StructBody {
        declarations = List.copyOf(declarations);
    }

    @Override
    public List<Node> children() {
        return declarations;
    }
}
