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

import org.cadixdev.vulcan.ast.CompilationUnit;
import org.cadixdev.vulcan.lexer.Token;

import java.util.List;

/**
 * One source file as handed over by the lexer and parser front end.
 *
 * @param fileName the name used in diagnostics and for the mappings output
 * @param tokens the lexed tokens, in source order
 * @param compilationUnit the parsed AST
 */
public record ParsedModule(String fileName, List<Token> tokens, CompilationUnit compilationUnit) {

    public ParsedModule {
        tokens = List.copyOf(tokens);
    }
}
