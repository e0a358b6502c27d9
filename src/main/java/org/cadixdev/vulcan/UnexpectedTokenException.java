/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan;

import org.cadixdev.vulcan.lexer.Token;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a computed insertion point does not land on the kind of token
 * the mapping expects there.
 */
public class UnexpectedTokenException extends MappingException {

    private final String expected;
    private final Token actual;

    public UnexpectedTokenException(String expected, Token actual, @Nullable String fileName) {
        super("Expected " + expected + " but found " + actual.text() + " (" + actual.type() + ")",
                fileName, actual.line(), actual.column());
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return this.expected;
    }

    public Token getActual() {
        return this.actual;
    }
}
