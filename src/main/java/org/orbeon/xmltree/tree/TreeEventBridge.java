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
package org.orbeon.xmltree.tree;

import org.orbeon.xmltree.util.LazySeq;

import java.util.function.Supplier;

/**
 * Lazily rebuilds a tree from a flat sequence of events, where each event either enters a subtree, exits the current
 * subtree, or is a leaf.
 *
 * The result of {@link #seqTree(Handler, LazySeq)} is a {@link Split}: the nodes at the current level, and the events
 * left after the exit event closing that level. Both are lazy: events are only pulled from the input as the caller
 * consumes nodes, so reading the first subtree of a huge or unbounded stream reads no further than that subtree's
 * exit event.
 *
 * Example, with <code>&lt;</code> entering a subtree (built as a list of its children), <code>&gt;</code> exiting
 * it, and other events turned into strings:
 *
 * <pre>
 * 1 2 &lt; 3 &lt; 4 &gt; &gt; 5 &gt; 6   =&gt;   siblings: "1" "2" ["3" ["4"]] "5"   remainder: 6
 * </pre>
 */
public class TreeEventBridge {

    /**
     * Callbacks interpreting events.
     */
    public interface Handler<E, N> {

        /**
         * @return true if the event closes the current subtree
         */
        boolean isExit(E event);

        /**
         * Build a subtree node if the event opens one.
         *
         * @param event     current event
         * @param children  lazy sequence of the subtree's children, which must not be consumed by this method
         * @return          the subtree node, or null if the event doesn't open a subtree
         */
        N tryOpen(E event, LazySeq<N> children);

        /**
         * Build a leaf node from an event which neither opens nor closes a subtree.
         */
        N toLeaf(E event);
    }

    /**
     * Nodes at one level of the tree, and the events following that level.
     */
    public static final class Split<E, N> {

        private Supplier<Split<E, N>> thunk;
        private LazySeq<N> siblings;
        private LazySeq<E> remainder;

        private Split(Supplier<Split<E, N>> thunk) {
            this.thunk = thunk;
        }

        private Split(LazySeq<N> siblings, LazySeq<E> remainder) {
            this.siblings = siblings;
            this.remainder = remainder;
        }

        /**
         * Nodes at this level, in order.
         */
        public LazySeq<N> siblings() {
            realize();
            return siblings;
        }

        /**
         * Events after the exit event closing this level. Empty if the input ended first.
         */
        public LazySeq<E> remainder() {
            realize();
            return remainder;
        }

        private void realize() {
            if (thunk != null) {
                final Split<E, N> result = thunk.get();
                siblings = result.siblings;
                remainder = result.remainder;
                // Release the input captured by the computation
                thunk = null;
            }
        }
    }

    private TreeEventBridge() {
    }

    public static <E, N> Split<E, N> seqTree(final Handler<E, N> handler, final LazySeq<E> events) {
        return new Split<E, N>(() -> {
            if (events.isEmpty())
                return new Split<E, N>(LazySeq.<N>empty(), LazySeq.<E>empty());

            final E event = events.first();
            final LazySeq<E> more = events.rest();
            if (handler.isExit(event))
                return new Split<E, N>(LazySeq.<N>empty(), more);

            // Level below this event, used as children if the event opens a subtree, and as siblings otherwise
            final Split<E, N> tree = seqTree(handler, more);
            final N parent = handler.tryOpen(event, LazySeq.lazy(tree::siblings));
            if (parent != null) {
                // Continue after the exit event closing the subtree
                final Split<E, N> following = seqTree(handler, LazySeq.lazy(tree::remainder));
                return new Split<E, N>(
                        LazySeq.cons(parent, LazySeq.lazy(following::siblings)),
                        LazySeq.lazy(following::remainder));
            } else {
                return new Split<E, N>(
                        LazySeq.cons(handler.toLeaf(event), LazySeq.lazy(tree::siblings)),
                        LazySeq.lazy(tree::remainder));
            }
        });
    }
}
