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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A set of disjoint intervals kept sorted by start index.
 *
 * <p>Adding an interval unions it with every interval it overlaps or abuts.
 * A point is only absorbed by a range that contains it. Removing an interval punches it out of the set, truncating or splitting
 * the intervals it overlaps.</p>
 */
public final class OrderedIntervals implements Iterable<Interval> {

    private final List<Interval> intervals;
    private final boolean frozen;

    public OrderedIntervals() {
        this(new ArrayList<>(), false);
    }

    private OrderedIntervals(List<Interval> intervals, boolean frozen) {
        this.intervals = intervals;
        this.frozen = frozen;
    }

    public void add(int index) {
        add(index, index);
    }

    public void add(int start, int end) {
        checkMutable();
        Interval merged = new Interval(start, end);

        // Repeat until stable, a grown range may now cover a point passed over earlier
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Iterator<Interval> it = this.intervals.iterator(); it.hasNext(); ) {
                Interval existing = it.next();
                if (touches(existing, merged)) {
                    it.remove();
                    merged = new Interval(Math.min(existing.start(), merged.start()), Math.max(existing.end(), merged.end()));
                    changed = true;
                }
            }
        }

        int insertAt = 0;
        while (insertAt < this.intervals.size() && this.intervals.get(insertAt).compareTo(merged) < 0) {
            insertAt++;
        }
        this.intervals.add(insertAt, merged);
    }

    /**
     * Ranges touch when they overlap or abut. A point only touches a range
     * that contains it, so a point on a range's exclusive end stays separate.
     */
    private static boolean touches(Interval a, Interval b) {
        if (a.isPoint() && b.isPoint()) {
            return a.start() == b.start();
        }
        if (a.isPoint()) {
            return b.contains(a.start());
        }
        if (b.isPoint()) {
            return a.contains(b.start());
        }
        return a.start() <= b.end() && a.end() >= b.start();
    }

    public void remove(int start, int end) {
        checkMutable();
        Interval removed = new Interval(start, end);
        if (removed.isPoint()) {
            return;
        }

        List<Interval> result = new ArrayList<>(this.intervals.size() + 1);
        for (Interval interval : this.intervals) {
            if (interval.isPoint()) {
                if (!removed.contains(interval.start())) {
                    result.add(interval);
                }
                continue;
            }

            if (interval.end() <= removed.start() || interval.start() >= removed.end()) {
                result.add(interval);
                continue;
            }

            if (interval.start() < removed.start()) {
                result.add(new Interval(interval.start(), removed.start()));
            }
            if (interval.end() > removed.end()) {
                result.add(new Interval(removed.end(), interval.end()));
            }
        }

        this.intervals.clear();
        this.intervals.addAll(result);
    }

    public boolean contains(int index) {
        for (Interval interval : this.intervals) {
            if (interval.start() > index) {
                return false;
            }
            if (interval.contains(index)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return this.intervals.size();
    }

    public boolean isEmpty() {
        return this.intervals.isEmpty();
    }

    public List<Interval> toList() {
        return Collections.unmodifiableList(this.intervals);
    }

    /**
     * Returns a read-only snapshot of this set. Any attempt to add to or
     * remove from the snapshot throws {@link IllegalStateException}.
     */
    public OrderedIntervals frozenCopy() {
        return new OrderedIntervals(new ArrayList<>(this.intervals), true);
    }

    public boolean isFrozen() {
        return this.frozen;
    }

    private void checkMutable() {
        if (this.frozen) {
            throw new IllegalStateException("Intervals are read-only");
        }
    }

    @Override
    public Iterator<Interval> iterator() {
        return toList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderedIntervals)) return false;
        return this.intervals.equals(((OrderedIntervals) o).intervals);
    }

    @Override
    public int hashCode() {
        return this.intervals.hashCode();
    }

    @Override
    public String toString() {
        return this.intervals.toString();
    }
}
