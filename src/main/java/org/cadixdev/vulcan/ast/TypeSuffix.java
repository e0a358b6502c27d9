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
import org.cadixdev.vulcan.lexer.TokenTypes;
import org.jetbrains.annotations.Nullable;

/**
 * One type suffix: a pointer star, an array, or a {@code delegate} /
 * {@code function} suffix with its parameter list.
 */
public record TypeSuffix(Kind kind, @Nullable Token delegateOrFunction, @Nullable Parameters parameters) {

    public static TypeSuffix pointer() {
        return new TypeSuffix(Kind.POINTER, null, null);
    }

    public static TypeSuffix array() {
        return new TypeSuffix(Kind.ARRAY, null, null);
    }

    public static TypeSuffix callable(Token delegateOrFunction, Parameters parameters) {
        Kind kind = delegateOrFunction.is(TokenTypes.DELEGATE) ? Kind.DELEGATE : Kind.FUNCTION;
        return new TypeSuffix(kind, delegateOrFunction, parameters);
    }

    public boolean isDelegate() {
        return kind == Kind.DELEGATE;
    }

    public enum Kind {
        POINTER,
        ARRAY,
        DELEGATE,
        FUNCTION
    }
}
