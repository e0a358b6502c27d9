/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.visitor;

import org.cadixdev.vulcan.util.Interval;
import org.cadixdev.vulcan.util.OrderedIntervals;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything {@link TokenMappingVisitor} found in one file. Both interval
 * sets are read-only.
 *
 * @param scopeDelegates the global indices before which {@code scope} is
 *                       inserted so that a delegate parameter
 *                       {@code [.]Type delegate} becomes {@code scope Type delegate}
 * @param valueAggregates the struct and union body ranges in which
 *                        {@code this} is converted, with nested class bodies
 *                        and static constructors/destructors left out
 */
public record TokenMappings(OrderedIntervals scopeDelegates, OrderedIntervals valueAggregates) {

    public TokenMappings {
        scopeDelegates = scopeDelegates.isFrozen() ? scopeDelegates : scopeDelegates.frozenCopy();
        valueAggregates = valueAggregates.isFrozen() ? valueAggregates : valueAggregates.frozenCopy();
    }

    public static TokenMappings empty() {
        return new TokenMappings(new OrderedIntervals(), new OrderedIntervals());
    }

    public List<Integer> scopeInsertionPoints() {
        List<Integer> points = new ArrayList<>(this.scopeDelegates.size());
        for (Interval interval : this.scopeDelegates) {
            points.add(interval.start());
        }
        return points;
    }

    public boolean isScopeInsertionPoint(int index) {
        return this.scopeDelegates.contains(index);
    }

    public boolean isInValueAggregate(int index) {
        return this.valueAggregates.contains(index);
    }
}
