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
package org.orbeon.xmltree.xml;

public class XMLConstants {

    public static final String NULL_NS_URI = "";
    public static final String DEFAULT_NS_PREFIX = "";

    public static final String XML_PREFIX = "xml";
    public static final String XML_URI = "http://www.w3.org/XML/1998/namespace";

    public static final String XMLNS_PREFIX = "xmlns";
    public static final String XMLNS_URI = "http://www.w3.org/2000/xmlns/";

    public static final String XML_VERSION = "1.0";

    // Reserved tags of the literal notation
    public static final QualifiedName CDATA_TAG = new QualifiedName("-cdata");
    public static final QualifiedName COMMENT_TAG = new QualifiedName("-comment");

    private XMLConstants() {
    }

    /**
     * Whether the attribute name is a default namespace declaration, i.e. <code>xmlns</code>.
     */
    public static boolean isDefaultNamespaceDeclaration(QualifiedName name) {
        return !name.hasPrefix() && XMLNS_PREFIX.equals(name.getLocalName())
                && (name.getURI() == null || XMLNS_URI.equals(name.getURI()) || NULL_NS_URI.equals(name.getURI()));
    }

    /**
     * Whether the attribute name is a prefixed namespace declaration, i.e. <code>xmlns:prefix</code>.
     */
    public static boolean isPrefixDeclaration(QualifiedName name) {
        return XMLNS_PREFIX.equals(name.getPrefix()) || (!name.hasPrefix() && XMLNS_URI.equals(name.getURI()));
    }

    public static boolean isNamespaceDeclaration(QualifiedName name) {
        return isDefaultNamespaceDeclaration(name) || isPrefixDeclaration(name);
    }
}
