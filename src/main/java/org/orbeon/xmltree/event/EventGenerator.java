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
package org.orbeon.xmltree.event;

import org.orbeon.xmltree.node.CData;
import org.orbeon.xmltree.node.Comment;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.util.LazySeq;

/**
 * Flattens a forest of heterogeneous content into an ordered, lazy stream of events, in document pre-order: an
 * element's start event, then its content, then its end event, then the following siblings.
 *
 * Flattening works off a work list of pending items. Each step emits the first event of the head item, then replaces
 * the work list with what must be processed after that item: for an element, its content followed by its end event;
 * for a sequence, the rest of its first item followed by its remaining items; for atomic items, nothing.
 *
 * The resulting stream is realized on demand and is meant to be consumed once, from a single thread.
 */
public class EventGenerator {

    private EventGenerator() {
    }

    /**
     * Flatten root items into events. The work list is only realized as the events are consumed.
     */
    public static LazySeq<Event> flattenToEvents(Iterable<?> roots) {
        return flatten(LazySeq.<Object>fromIterable(roots));
    }

    private static LazySeq<Event> flatten(final LazySeq<Object> work) {
        return LazySeq.lazy(() -> {
            if (work.isEmpty())
                return null;
            final Object head = work.first();
            return LazySeq.cons(firstEvent(head), flatten(restEvents(head, work.rest())));
        });
    }

    /**
     * The event opening an item, or the item's single event for atomic items.
     *
     * An absent item, and an empty sequence, produce an empty characters event.
     */
    public static Event firstEvent(Object item) {
        switch (Content.kindOf(item)) {
            case CONTAINER: {
                final Element element = (Element) item;
                return Event.startElement(element.getTag(), element.getAttributes());
            }
            case EVENT:
                return (Event) item;
            case SEQUENCE: {
                final LazySeq<Object> sequence = Content.asSequence(item);
                return sequence.isEmpty() ? Event.characters("") : firstEvent(sequence.first());
            }
            case TEXT:
                return Event.characters(item.toString());
            case BOOLEAN:
            case NUMBER:
                return Event.characters(String.valueOf(item));
            case CDATA:
                return Event.cdata(((CData) item).getContent());
            case COMMENT:
                return Event.comment(((Comment) item).getContent());
            case ABSENT:
                return Event.characters("");
            default:
                throw new IllegalStateException();
        }
    }

    /**
     * What must be processed after an item's first event, given the pending work list.
     */
    public static LazySeq<Object> restEvents(Object item, LazySeq<Object> continuation) {
        switch (Content.kindOf(item)) {
            case CONTAINER: {
                final Element element = (Element) item;
                return LazySeq.concat(element.getContent(),
                        LazySeq.<Object>cons(Event.endElement(element.getTag()), continuation));
            }
            case SEQUENCE: {
                final LazySeq<Object> sequence = Content.asSequence(item);
                if (sequence.isEmpty())
                    return continuation;
                // The remaining items come right after the first item's own subtree
                return restEvents(sequence.first(), LazySeq.concat(sequence.rest(), continuation));
            }
            case EVENT:
            case TEXT:
            case BOOLEAN:
            case NUMBER:
            case CDATA:
            case COMMENT:
            case ABSENT:
                return continuation;
            default:
                throw new IllegalStateException();
        }
    }
}
