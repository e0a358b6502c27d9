/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.resolver;

/**
 * The outcome of looking up an alias by its unqualified name.
 */
public enum AliasResolution {

    /**
     * An alias with that name is known and it aliases a delegate type.
     */
    DELEGATE_ALIAS,

    /**
     * An alias with that name is known, but it does not alias a delegate.
     */
    OTHER_ALIAS,

    /**
     * Nothing is known about the name.
     */
    UNKNOWN;

    public boolean isDelegate() {
        return this == DELEGATE_ALIAS;
    }
}
