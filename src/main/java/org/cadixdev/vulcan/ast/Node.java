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
 * A node of the parsed module. The hierarchy is closed: anything the mapping
 * visitor does not handle specially is still one of these kinds and is
 * walked through its {@link #children()}.
 */
public sealed interface Node permits CompilationUnit, DeclarationBlock, StructBody, StructDeclaration, UnionDeclaration,
        ClassDeclaration, StaticConstructor, StaticDestructor, FunctionDeclaration, Constructor, FunctionBody,
        BodyStatement, BlockStatement, VariableDeclaration, AliasDeclaration {

    /**
     * @return the direct child nodes, in source order
     */
    List<Node> children();
}
