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
 * A possibly qualified symbol reference such as {@code .pkg.mod.Name} or
 * {@code Foo!(int).Bar}. {@code dot} records a leading module scope dot.
 */
public record Symbol(boolean dot, List<IdentifierOrTemplateInstance> identifiersOrTemplateInstances) {

    public Symbol {
        identifiersOrTemplateInstances = List.copyOf(identifiersOrTemplateInstances);
    }

    public IdentifierOrTemplateInstance first() {
        return identifiersOrTemplateInstances.get(0);
    }

    public IdentifierOrTemplateInstance last() {
        return identifiersOrTemplateInstances.get(identifiersOrTemplateInstances.size() - 1);
    }
}
