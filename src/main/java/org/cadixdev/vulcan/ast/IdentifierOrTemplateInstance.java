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

public record IdentifierOrTemplateInstance(@Nullable Token identifier, @Nullable TemplateInstance templateInstance) {

    public static IdentifierOrTemplateInstance identifier(Token identifier) {
        return new IdentifierOrTemplateInstance(identifier, null);
    }

    public static IdentifierOrTemplateInstance template(Token identifier) {
        return new IdentifierOrTemplateInstance(null, new TemplateInstance(identifier));
    }

    /**
     * @return the identifier token, or the template's identifier token for template instances
     */
    public Token nameToken() {
        if (identifier != null) {
            return identifier;
        }
        if (templateInstance == null) {
            throw new IllegalStateException("Neither identifier nor template instance is set");
        }
        return templateInstance.identifier();
    }
}
