/**
 * Copyright (C) 2010 Orbeon, Inc.
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the
 * GNU Lesser General Public License as published by the Free Software Foundation; either version
 * 2.1 of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY;
 * without even the implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 * See the GNU Lesser General Public License for more details.
 *
 * The full text of the license is available at http://www.gnu.org/copyleft/lesser.html
 */
package org.orbeon.xmltree.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Immutable, memoized, lazily realized sequence.
 *
 * A LazySeq is either a realized cell (empty, or a first item followed by another LazySeq), or a deferred computation
 * producing a LazySeq. The computation runs at most once, the first time the sequence is inspected, and its result is
 * remembered. A computation may itself return an unrealized LazySeq: realization then continues in a loop rather than
 * by recursion, so long chains of deferred sequences can be realized without growing the stack.
 *
 * Sequences wrapping a {@link Cursor} realize at most one cursor item per cell, so consuming a prefix only ever pulls
 * that prefix from the cursor.
 *
 * NOTE: A LazySeq is not thread-safe. Realizing the same sequence concurrently from several threads is undefined
 * behavior; sequences must be consumed from a single thread.
 */
public final class LazySeq<T> implements Iterable<T> {

    private static final LazySeq<Object> EMPTY = new LazySeq<Object>(null, null, true);

    private Supplier<LazySeq<T>> thunk;
    private boolean realizing;
    private boolean realized;

    private boolean empty;
    private T first;
    private LazySeq<T> rest;

    private LazySeq(Supplier<LazySeq<T>> thunk) {
        this.thunk = thunk;
    }

    private LazySeq(T first, LazySeq<T> rest, boolean empty) {
        this.first = first;
        this.rest = rest;
        this.empty = empty;
        this.realized = true;
    }

    @SuppressWarnings("unchecked")
    public static <T> LazySeq<T> empty() {
        return (LazySeq<T>) EMPTY;
    }

    public static <T> LazySeq<T> cons(T first, LazySeq<T> rest) {
        return new LazySeq<T>(first, rest == null ? LazySeq.<T>empty() : rest, false);
    }

    /**
     * Defer the computation of a sequence until it is first inspected. The supplier may return null for the empty
     * sequence.
     */
    public static <T> LazySeq<T> lazy(Supplier<LazySeq<T>> thunk) {
        if (thunk == null)
            throw new IllegalArgumentException("Null thunk");
        return new LazySeq<T>(thunk);
    }

    @SafeVarargs
    public static <T> LazySeq<T> of(T... items) {
        return fromIterable(Arrays.asList(items));
    }

    /**
     * Wrap an iterable. A LazySeq is returned as is; other iterables are iterated lazily, once.
     */
    @SuppressWarnings("unchecked")
    public static <T> LazySeq<T> fromIterable(Iterable<? extends T> iterable) {
        if (iterable == null)
            return empty();
        else if (iterable instanceof LazySeq)
            return (LazySeq<T>) iterable;
        else
            return fromIterator(iterable.iterator());
    }

    public static <T> LazySeq<T> fromIterator(final Iterator<? extends T> iterator) {
        return lazy(() -> iterator.hasNext() ? LazySeq.<T>cons(iterator.next(), fromIterator(iterator)) : null);
    }

    /**
     * Wrap a cursor. The cursor is advanced once per realized cell, never ahead of demand.
     */
    public static <T> LazySeq<T> fromCursor(final Cursor<? extends T> cursor) {
        return lazy(() -> {
            final T item = cursor.advance();
            return item == null ? null : cons(item, fromCursor(cursor));
        });
    }

    /**
     * Lazily concatenate two sequences.
     */
    public static <T> LazySeq<T> concat(final LazySeq<T> head, final LazySeq<T> tail) {
        return lazy(() -> head.isEmpty() ? tail : cons(head.first(), concat(head.rest(), tail)));
    }

    /**
     * Lazily drop null items.
     */
    public static <T> LazySeq<T> removeNulls(final LazySeq<T> seq) {
        return lazy(() -> {
            LazySeq<T> current = seq;
            while (!current.isEmpty() && current.first() == null)
                current = current.rest();
            return current.isEmpty() ? null : cons(current.first(), removeNulls(current.rest()));
        });
    }

    public boolean isEmpty() {
        realize();
        return empty;
    }

    /**
     * @return the first item, or null if the sequence is empty
     */
    public T first() {
        realize();
        return first;
    }

    /**
     * @return the sequence after the first item, the empty sequence if this sequence is empty
     */
    public LazySeq<T> rest() {
        realize();
        return empty ? this : rest;
    }

    public boolean isRealized() {
        return realized;
    }

    /**
     * Realize the whole sequence into a list.
     */
    public List<T> toList() {
        final List<T> result = new ArrayList<T>();
        for (final T item : this)
            result.add(item);
        return result;
    }

    public Iterator<T> iterator() {
        return new Iterator<T>() {
            private LazySeq<T> current = LazySeq.this;

            public boolean hasNext() {
                return !current.isEmpty();
            }

            public T next() {
                if (current.isEmpty())
                    throw new NoSuchElementException();
                final T result = current.first();
                current = current.rest();
                return result;
            }

            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    private void realize() {
        if (realized)
            return;

        final List<LazySeq<T>> pending = new ArrayList<LazySeq<T>>();
        LazySeq<T> current = this;
        boolean success = false;
        try {
            while (!current.realized) {
                if (current.realizing)
                    throw new IllegalStateException("Lazy sequence depends on its own realization");
                current.realizing = true;
                pending.add(current);

                final LazySeq<T> next = current.thunk.get();
                current = next == null ? LazySeq.<T>empty() : next;
            }
            success = true;
        } finally {
            // On failure, leave the sequences unrealized so the failure is reported again on the next attempt
            if (!success)
                for (final LazySeq<T> seq : pending)
                    seq.realizing = false;
        }

        for (final LazySeq<T> seq : pending) {
            seq.empty = current.empty;
            seq.first = current.first;
            seq.rest = current.rest;
            seq.thunk = null;
            seq.realizing = false;
            seq.realized = true;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LazySeq))
            return false;

        final Iterator<T> i1 = iterator();
        final Iterator<?> i2 = ((LazySeq<?>) o).iterator();
        while (i1.hasNext() && i2.hasNext()) {
            final Object o1 = i1.next();
            final Object o2 = i2.next();
            if (o1 == null ? o2 != null : !o1.equals(o2))
                return false;
        }
        return !i1.hasNext() && !i2.hasNext();
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (final T item : this)
            hash = 31 * hash + (item == null ? 0 : item.hashCode());
        return hash;
    }

    @Override
    public String toString() {
        return toList().toString();
    }
}
