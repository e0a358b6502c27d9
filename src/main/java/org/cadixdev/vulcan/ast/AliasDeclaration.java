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

import org.cadixdev.vulcan.lexer.Token;

import java.util.List;

public record AliasDeclaration(Token name, Type type) implements Node {

    @Override
    public List<Node> children() {
        return List.of();
    }
}
