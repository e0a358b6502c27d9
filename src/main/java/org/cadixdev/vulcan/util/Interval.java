/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.vulcan.util;

/**
 * A half-open range {@code [start, end)} of global token indices. A point is
 * represented as {@code [index, index)}.
 */
public record Interval(int start, int end) implements Comparable<Interval> {

    public Interval {
        if (start > end) {
            throw new IllegalArgumentException("Interval start " + start + " is after its end " + end);
        }
    }

    public static Interval point(int index) {
        return new Interval(index, index);
    }

    public boolean isPoint() {
        return this.start == this.end;
    }

    public boolean contains(int index) {
        return isPoint() ? index == this.start : index >= this.start && index < this.end;
    }

    @Override
    public int compareTo(Interval o) {
        int cmp = Integer.compare(this.start, o.start);
        return cmp != 0 ? cmp : Integer.compare(this.end, o.end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
