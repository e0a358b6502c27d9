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
 * A function body, either a plain {@code blockStatement} or the contract
 * form {@code in { } out { } body { }}, where the implementation sits inside
 * {@code bodyStatement}.
 */
public record FunctionBody(@Nullable BlockStatement blockStatement, @Nullable BlockStatement inStatement,
                           @Nullable BlockStatement outStatement, @Nullable BodyStatement bodyStatement) implements Node {

    public static FunctionBody of(BlockStatement blockStatement) {
        return new FunctionBody(blockStatement, null, null, null);
    }

    public static FunctionBody contract(@Nullable BlockStatement inStatement, @Nullable BlockStatement outStatement,
                                        BodyStatement bodyStatement) {
        return new FunctionBody(null, inStatement, outStatement, bodyStatement);
    }

    @Override
    public List<Node> children() {
        return Children.of(blockStatement, inStatement, outStatement, bodyStatement);
    }
}
