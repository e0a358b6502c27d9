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

import java.util.Set;

public final class TokenTypes {

    public static final String DELEGATE = "delegate";
    public static final String DOT = ".";

    private static final Set<String> BASIC_TYPES = Set.of(
            "bool", "byte", "ubyte", "short", "ushort", "int", "uint", "long", "ulong",
            "cent", "ucent", "char", "wchar", "dchar", "float", "double", "real",
            "ifloat", "idouble", "ireal", "cfloat", "cdouble", "creal", "void"
    );

    private TokenTypes() {
    }

    public static boolean isBasicType(String type) {
        return BASIC_TYPES.contains(type);
    }
}
