/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.lexer;

/**
 * A single lexed token. {@code index} is the token's global position in the
 * source file, which is what AST locations and token mappings refer to.
 *
 * @param type the token kind as the lexer spells it, e.g. {@code "int"}, {@code "delegate"},
 *             {@code "."} or {@code "identifier"}
 * @param text the source text of the token
 * @param index the global index of the token
 * @param line 1-based source line
 * @param column 1-based source column
 */
public record Token(String type, String text, int index, int line, int column) {

    public static final String IDENTIFIER = "identifier";

    public boolean is(String type) {
        return this.type.equals(type);
    }

    @Override
    public String toString() {
        return "'" + text + "' (" + type + ") at " + line + ":" + column;
    }
}
