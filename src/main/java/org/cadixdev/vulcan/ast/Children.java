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

import java.util.ArrayList;
import java.util.List;

final class Children {

    private Children() {
    }

    static List<Node> of(@Nullable Node... nodes) {
        List<Node> result = new ArrayList<>(nodes.length);
        for (Node node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return List.copyOf(result);
    }
}
