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
package org.orbeon.xmltree.common;

import org.orbeon.xmltree.xml.QualifiedName;

/**
 * A tag or attribute name refers to a namespace prefix, or a namespace URI, that has no binding in scope.
 */
public class UnresolvedPrefixException extends XMLTreeException {

    private final QualifiedName name;
    private final String prefix;
    private final String uri;

    private UnresolvedPrefixException(String message, QualifiedName name, String prefix, String uri) {
        super(message);
        this.name = name;
        this.prefix = prefix;
        this.uri = uri;
    }

    public static UnresolvedPrefixException forPrefix(QualifiedName name, String prefix) {
        return new UnresolvedPrefixException("Unresolved namespace prefix: " + prefix + " (name: " + name + ")", name, prefix, null);
    }

    public static UnresolvedPrefixException forTagURI(QualifiedName name, String uri) {
        return new UnresolvedPrefixException("No prefix for URI: " + uri + " (name: " + name + ")", name, null, uri);
    }

    public static UnresolvedPrefixException forAttributeURI(QualifiedName name, String uri) {
        return new UnresolvedPrefixException("No prefix for attribute URI: " + uri + " (name: " + name + ")", name, null, uri);
    }

    public QualifiedName getName() {
        return name;
    }

    /**
     * @return the unbound prefix, or null if the failure is about a URI
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * @return the URI no prefix was found for, or null if the failure is about a prefix
     */
    public String getURI() {
        return uri;
    }
}
