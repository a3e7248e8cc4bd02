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
package org.orbeon.xmltree.node;

import org.orbeon.xmltree.util.LazySeq;
import org.orbeon.xmltree.xml.QualifiedName;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable XML element: a tag, attributes, and ordered content.
 *
 * Attributes keep their insertion order. Content is a lazy sequence: an element built by the parser doesn't read its
 * children from the input until they are consumed. Null content items are dropped when the element is built.
 */
public final class Element extends Node {

    private final QualifiedName tag;
    private final Map<QualifiedName, String> attributes;
    private final LazySeq<Object> content;

    public Element(QualifiedName tag, Map<QualifiedName, String> attributes, Iterable<?> content) {
        if (tag == null)
            throw new IllegalArgumentException("Null tag");
        this.tag = tag;
        this.attributes = copyAttributes(attributes);
        this.content = LazySeq.removeNulls(LazySeq.<Object>fromIterable(content));
    }

    public static Element create(QualifiedName tag) {
        return new Element(tag, null, null);
    }

    public static Element create(QualifiedName tag, Map<QualifiedName, String> attributes, Object... content) {
        return new Element(tag, attributes, content == null ? null : Arrays.asList(content));
    }

    private static Map<QualifiedName, String> copyAttributes(Map<QualifiedName, String> attributes) {
        if (attributes == null || attributes.isEmpty())
            return Collections.emptyMap();

        final Map<QualifiedName, String> copy = new LinkedHashMap<QualifiedName, String>();
        for (final Map.Entry<QualifiedName, String> entry : attributes.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null)
                throw new IllegalArgumentException("Null attribute name or value: " + entry.getKey());
            copy.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(copy);
    }

    public Type getType() {
        return Type.ELEMENT;
    }

    public QualifiedName getTag() {
        return tag;
    }

    public Map<QualifiedName, String> getAttributes() {
        return attributes;
    }

    /**
     * @return the value of the attribute with exactly this name, or null
     */
    public String getAttribute(QualifiedName name) {
        return attributes.get(name);
    }

    public LazySeq<Object> getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Element))
            return false;
        final Element other = (Element) o;
        return tag.equals(other.tag) && attributes.equals(other.attributes) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        int result = tag.hashCode();
        result = 31 * result + attributes.hashCode();
        result = 31 * result + content.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Element{tag=" + tag + ", attributes=" + attributes + ", content=" + content + "}";
    }
}
