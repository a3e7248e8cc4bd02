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

import java.util.Arrays;

/**
 * The fixed set of content items that can be flattened into events.
 */
public class Content {

    public enum Kind {
        /** {@link Element} */
        CONTAINER,
        /** {@link Event}, passed through as is */
        EVENT,
        /** any {@link Iterable}, or an object array */
        SEQUENCE,
        /** any {@link CharSequence} */
        TEXT,
        BOOLEAN,
        NUMBER,
        /** {@link CData} */
        CDATA,
        /** {@link Comment} */
        COMMENT,
        /** null */
        ABSENT
    }

    private Content() {
    }

    /**
     * @throws IllegalArgumentException if the item is of none of the supported kinds
     */
    public static Kind kindOf(Object item) {
        if (item == null)
            return Kind.ABSENT;
        else if (item instanceof Element)
            return Kind.CONTAINER;
        else if (item instanceof Event)
            return Kind.EVENT;
        else if (item instanceof CharSequence)
            return Kind.TEXT;
        else if (item instanceof Boolean)
            return Kind.BOOLEAN;
        else if (item instanceof Number)
            return Kind.NUMBER;
        else if (item instanceof CData)
            return Kind.CDATA;
        else if (item instanceof Comment)
            return Kind.COMMENT;
        else if (item instanceof Iterable || item instanceof Object[])
            return Kind.SEQUENCE;
        else
            throw new IllegalArgumentException("Unsupported content item of class " + item.getClass().getName() + ": " + item);
    }

    /**
     * View a SEQUENCE item as a lazy sequence.
     */
    public static LazySeq<Object> asSequence(Object item) {
        if (item instanceof Object[])
            return LazySeq.<Object>fromIterable(Arrays.asList((Object[]) item));
        else
            return LazySeq.<Object>fromIterable((Iterable<?>) item);
    }
}
