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

import org.orbeon.xmltree.event.Event;
import org.orbeon.xmltree.event.EventType;
import org.orbeon.xmltree.node.CData;
import org.orbeon.xmltree.node.Comment;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.util.LazySeq;

/**
 * Builds lazy trees of {@link Element}s from XML events.
 *
 * Start events open elements, end events close them, characters events become text, and CDATA and comment events
 * become {@link CData} and {@link Comment} nodes.
 */
public class EventTree {

    public static final TreeEventBridge.Handler<Event, Object> HANDLER = new TreeEventBridge.Handler<Event, Object>() {

        public boolean isExit(Event event) {
            return event.getType() == EventType.END_ELEMENT;
        }

        public Object tryOpen(Event event, LazySeq<Object> children) {
            return event.getType() == EventType.START_ELEMENT
                    ? new Element(event.getName(), event.getAttributes(), children)
                    : null;
        }

        public Object toLeaf(Event event) {
            switch (event.getType()) {
                case CDATA:
                    return new CData(event.getText());
                case COMMENT:
                    return new Comment(event.getText());
                default:
                    return event.getText();
            }
        }
    };

    private EventTree() {
    }

    /**
     * All top-level nodes of the events, lazily.
     */
    public static LazySeq<Object> fragment(Iterable<Event> events) {
        return TreeEventBridge.seqTree(HANDLER, LazySeq.<Event>fromIterable(events)).siblings();
    }

    /**
     * The first top-level element of the events, or null if there is none. Top-level text, comments and CDATA
     * before it are skipped. Nothing is read past that element's end event, and its content is only read as it is
     * consumed.
     */
    public static Element firstElement(Iterable<Event> events) {
        for (LazySeq<Object> nodes = fragment(events); !nodes.isEmpty(); nodes = nodes.rest()) {
            if (nodes.first() instanceof Element)
                return (Element) nodes.first();
        }
        return null;
    }
}
