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
 * Thrown when the token array, the AST and the mapping visitor disagree with
 * each other. Mappings computed from such input cannot be trusted, so
 * processing of the current file stops.
 */
public class MappingException extends RuntimeException {

    @Nullable
    private final String fileName;
    private final int line;
    private final int column;

    public MappingException(String message) {
        this(message, null, 0, 0, null);
    }

    public MappingException(String message, @Nullable String fileName, int line, int column) {
        this(message, fileName, line, column, null);
    }

    public MappingException(String message, @Nullable String fileName, int line, int column, @Nullable Throwable cause) {
        super(format(message, fileName, line, column), cause);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public static MappingException at(String message, @Nullable String fileName, Token token) {
        return new MappingException(message, fileName, token.line(), token.column());
    }

    private static String format(String message, @Nullable String fileName, int line, int column) {
        if (fileName == null) {
            return message;
        }
        return message + " (" + fileName + ":" + line + "," + column + ")";
    }

    @Nullable
    public String getFileName() {
        return this.fileName;
    }

    public int getLine() {
        return this.line;
    }

    public int getColumn() {
        return this.column;
    }
}
