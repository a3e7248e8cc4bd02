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

import org.orbeon.xmltree.xml.QualifiedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of a flattened document: the start or end of an element, text, a CDATA section or a comment.
 *
 * Start events carry a name and attributes, end events a name, and the other events text.
 */
public final class Event {

    private final EventType type;
    private final QualifiedName name;
    private final Map<QualifiedName, String> attributes;
    private final String text;

    private Event(EventType type, QualifiedName name, Map<QualifiedName, String> attributes, String text) {
        this.type = type;
        this.name = name;
        this.attributes = attributes;
        this.text = text;
    }

    public static Event startElement(QualifiedName name, Map<QualifiedName, String> attributes) {
        if (name == null)
            throw new IllegalArgumentException("Null element name");
        final Map<QualifiedName, String> copy = (attributes == null || attributes.isEmpty())
                ? Collections.<QualifiedName, String>emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<QualifiedName, String>(attributes));
        return new Event(EventType.START_ELEMENT, name, copy, null);
    }

    public static Event endElement(QualifiedName name) {
        if (name == null)
            throw new IllegalArgumentException("Null element name");
        return new Event(EventType.END_ELEMENT, name, null, null);
    }

    public static Event characters(String text) {
        return new Event(EventType.CHARACTERS, null, null, text == null ? "" : text);
    }

    public static Event cdata(String text) {
        return new Event(EventType.CDATA, null, null, text == null ? "" : text);
    }

    public static Event comment(String text) {
        return new Event(EventType.COMMENT, null, null, text == null ? "" : text);
    }

    public EventType getType() {
        return type;
    }

    /**
     * @return the element name for start and end events, null otherwise
     */
    public QualifiedName getName() {
        return name;
    }

    /**
     * @return the attributes for start events, null otherwise
     */
    public Map<QualifiedName, String> getAttributes() {
        return attributes;
    }

    /**
     * @return the text for characters, CDATA and comment events, null otherwise
     */
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event))
            return false;
        final Event other = (Event) o;
        return type == other.type
                && (name == null ? other.name == null : name.equals(other.name))
                && (attributes == null ? other.attributes == null : attributes.equals(other.attributes))
                && (text == null ? other.text == null : text.equals(other.text));
    }

    @Override
    public int hashCode() {
        int result = type.hashCode();
        result = 31 * result + (name != null ? name.hashCode() : 0);
        result = 31 * result + (attributes != null ? attributes.hashCode() : 0);
        result = 31 * result + (text != null ? text.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        switch (type) {
            case START_ELEMENT:
                return "start " + name + (attributes.isEmpty() ? "" : " " + attributes);
            case END_ELEMENT:
                return "end " + name;
            default:
                return type.name().toLowerCase() + " \"" + text + "\"";
        }
    }
}
