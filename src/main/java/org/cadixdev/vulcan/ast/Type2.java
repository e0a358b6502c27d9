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
import org.jetbrains.annotations.Nullable;

/**
 * The base of a type. Exactly one of {@code builtinType} and {@code symbol}
 * is set for the forms the mapper understands; both are absent for
 * {@code typeof(...)} and type constructor forms.
 */
public record Type2(@Nullable Token builtinType, @Nullable Symbol symbol) {

    public static Type2 builtin(Token builtinType) {
        return new Type2(builtinType, null);
    }

    public static Type2 symbol(Symbol symbol) {
        return new Type2(null, symbol);
    }
}
