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
 * A braced statement block. Only the statements that can hold declarations
 * matter for mapping, so {@code statements} may omit plain expressions.
 */
public record BlockStatement(int startLocation, int endLocation, List<Node> statements) implements Node {

    public BlockStatement {
        statements = List.copyOf(statements);
    }

    @Override
    public List<Node> children() {
        return statements;
    }
}
