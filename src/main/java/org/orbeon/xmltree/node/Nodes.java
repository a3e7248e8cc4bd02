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

import org.orbeon.xmltree.xml.NamespaceResolver;
import org.orbeon.xmltree.xml.QualifiedName;

import java.util.Iterator;
import java.util.Map;

public class Nodes {

    private Nodes() {
    }

    /**
     * Test whether an item can be interpreted as an element.
     */
    public static boolean isElement(Object item) {
        return item instanceof Element;
    }

    /**
     * Structural equality using namespace-aware name equality for tags and attribute names.
     *
     * Text, CData and comment content must be exactly equal. Attributes are compared regardless of order.
     */
    public static boolean deepEquals(Object o1, Object o2) {
        if (o1 == o2)
            return true;
        if (o1 == null || o2 == null)
            return false;

        if (o1 instanceof Element && o2 instanceof Element) {
            final Element e1 = (Element) o1;
            final Element e2 = (Element) o2;
            if (!NamespaceResolver.nameEquals(e1.getTag(), e2.getTag()))
                return false;
            if (!attributesEqual(e1.getAttributes(), e2.getAttributes()))
                return false;

            final Iterator<Object> i1 = e1.getContent().iterator();
            final Iterator<Object> i2 = e2.getContent().iterator();
            while (i1.hasNext() && i2.hasNext()) {
                if (!deepEquals(i1.next(), i2.next()))
                    return false;
            }
            return !i1.hasNext() && !i2.hasNext();
        } else {
            return o1.equals(o2);
        }
    }

    private static boolean attributesEqual(Map<QualifiedName, String> a1, Map<QualifiedName, String> a2) {
        if (a1.size() != a2.size())
            return false;
        for (final Map.Entry<QualifiedName, String> entry1 : a1.entrySet()) {
            boolean found = false;
            for (final Map.Entry<QualifiedName, String> entry2 : a2.entrySet()) {
                if (NamespaceResolver.nameEquals(entry1.getKey(), entry2.getKey())) {
                    if (!entry1.getValue().equals(entry2.getValue()))
                        return false;
                    found = true;
                    break;
                }
            }
            if (!found)
                return false;
        }
        return true;
    }
}
