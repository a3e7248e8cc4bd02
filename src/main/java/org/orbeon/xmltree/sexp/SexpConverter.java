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
package org.orbeon.xmltree.sexp;

import org.orbeon.xmltree.common.InvalidStructureException;
import org.orbeon.xmltree.node.CData;
import org.orbeon.xmltree.node.Comment;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.node.Node;
import org.orbeon.xmltree.xml.QualifiedName;
import org.orbeon.xmltree.xml.XMLConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts the compact literal notation into elements.
 *
 * The notation is:
 *
 * <ul>
 * <li>an object array <code>{tag, attributes?, content...}</code> is an element, where the tag is a
 * {@link QualifiedName} and attributes an optional {@link Map} whose keys are names or <code>prefix:local</code>
 * strings, and whose values are converted to strings</li>
 * <li>any other {@link Iterable} is a group of items inserted into the parent, without opening an element</li>
 * <li>a bare {@link QualifiedName} is an empty element</li>
 * <li>the reserved tags <code>-cdata</code> and <code>-comment</code> produce a CDATA section or a comment from their
 * first content item</li>
 * <li>a {@link Node} is used as is, null is dropped, and any other value becomes text</li>
 * </ul>
 *
 * For example <code>{a, {b, "x"}, "y"}</code> converts to an element <code>a</code> containing an element
 * <code>b</code>, itself containing the text <code>x</code>, followed by the text <code>y</code>.
 */
public class SexpConverter {

    private SexpConverter() {
    }

    /**
     * Convert expressions into the sequence of nodes and text they represent. The result may hold any number of
     * roots.
     */
    public static List<Object> asFragment(Object... expressions) {
        final List<Object> result = new ArrayList<Object>();
        if (expressions != null)
            for (final Object expression : expressions)
                addElements(expression, result);
        return result;
    }

    /**
     * Convert an expression which must represent exactly one element.
     *
     * A single root which is not an element, such as text, is rejected too: the result is always an element.
     *
     * @throws InvalidStructureException if the expression represents no root, several roots, or a root which is
     *                                   not an element
     */
    public static Element toSingleRoot(Object expression) {
        final List<Object> roots = asFragment(expression);
        if (roots.isEmpty())
            throw new InvalidStructureException("Expression doesn't contain any root element", 0);
        if (roots.size() > 1)
            throw new InvalidStructureException("Cannot have multiple root elements; try creating a fragment instead", roots.size());
        if (!(roots.get(0) instanceof Element))
            throw new InvalidStructureException("Root is not an element: " + roots.get(0), 1);
        return (Element) roots.get(0);
    }

    /**
     * Convert one expression, in order, into the destination list.
     */
    public static void addElements(Object expression, List<Object> destination) {
        if (expression == null)
            return;

        if (expression instanceof Object[]) {
            destination.add(convertForm((Object[]) expression));
        } else if (expression instanceof QualifiedName) {
            destination.add(Element.create((QualifiedName) expression));
        } else if (expression instanceof Node) {
            destination.add(expression);
        } else if (expression instanceof Iterable) {
            for (final Object item : (Iterable<?>) expression)
                addElements(item, destination);
        } else {
            destination.add(String.valueOf(expression));
        }
    }

    private static Node convertForm(Object[] form) {
        if (form.length == 0)
            throw new IllegalArgumentException("Empty element form");
        if (!(form[0] instanceof QualifiedName))
            throw new IllegalArgumentException("Element form must start with a tag name, found: " + form[0]);

        final QualifiedName tag = (QualifiedName) form[0];
        final boolean hasAttributes = form.length > 1 && form[1] instanceof Map;
        final Map<QualifiedName, String> attributes = hasAttributes
                ? convertAttributes((Map<?, ?>) form[1])
                : Collections.<QualifiedName, String>emptyMap();
        final int contentStart = hasAttributes ? 2 : 1;

        if (XMLConstants.CDATA_TAG.equals(tag)) {
            return new CData(getFirstText(form, contentStart));
        } else if (XMLConstants.COMMENT_TAG.equals(tag)) {
            return new Comment(getFirstText(form, contentStart));
        } else {
            final List<Object> content = new ArrayList<Object>();
            for (int i = contentStart; i < form.length; i++)
                addElements(form[i], content);
            return new Element(tag, attributes, content);
        }
    }

    /**
     * Text of the first content item of a form, the empty string if there is none or if it is null.
     */
    private static String getFirstText(Object[] form, int contentStart) {
        if (contentStart >= form.length || form[contentStart] == null)
            return "";
        return String.valueOf(form[contentStart]);
    }

    private static Map<QualifiedName, String> convertAttributes(Map<?, ?> attributes) {
        final Map<QualifiedName, String> result = new LinkedHashMap<QualifiedName, String>();
        for (final Map.Entry<?, ?> entry : attributes.entrySet()) {
            final Object key = entry.getKey();
            final QualifiedName name;
            if (key instanceof QualifiedName)
                name = (QualifiedName) key;
            else if (key instanceof String)
                name = QualifiedName.valueOf((String) key);
            else
                throw new IllegalArgumentException("Invalid attribute name: " + key);
            result.put(name, entry.getValue() == null ? "" : String.valueOf(entry.getValue()));
        }
        return result;
    }
}
