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

import org.orbeon.xmltree.common.UnresolvedPrefixException;

/**
 * Resolution of prefixed names against the namespace bindings in scope.
 *
 * Tags and attributes don't resolve the same way: an unprefixed tag is in the default namespace in scope, while an
 * unprefixed attribute is in no namespace at all.
 */
public class NamespaceResolver {

    private NamespaceResolver() {
    }

    /**
     * Resolve an element name. A name which already has a URI is returned as is.
     *
     * @throws UnresolvedPrefixException if the name's prefix is not bound in the scope
     */
    public static QualifiedName resolveTag(QualifiedName name, NamespaceScope scope) {
        if (name.isResolved())
            return name;

        final String uri = scope.lookup(name.getPrefix());
        if (uri == null)
            throw UnresolvedPrefixException.forPrefix(name, name.getPrefix());
        return name.withURI(uri);
    }

    /**
     * Resolve an attribute name. Only prefixed names are resolved: an unprefixed attribute doesn't inherit the default
     * namespace and is returned unchanged.
     *
     * @throws UnresolvedPrefixException if the name's prefix is not bound in the scope
     */
    public static QualifiedName resolveAttribute(QualifiedName name, NamespaceScope scope) {
        if (!name.hasPrefix() || name.isResolved())
            return name;

        final String uri = scope.lookup(name.getPrefix());
        if (uri == null)
            throw UnresolvedPrefixException.forPrefix(name, name.getPrefix());
        return name.withURI(uri);
    }

    /**
     * Namespace-aware name equality. Local names must be equal. If both names are resolved, their URIs are compared
     * and prefixes are ignored. Otherwise the URI of at least one side is unknown, and the prefixes are compared
     * instead.
     *
     * This makes an unresolved name equal to a resolved one as long as both spell the same prefix, which holds when
     * both come from under the same namespace declaration.
     */
    public static boolean nameEquals(QualifiedName n1, QualifiedName n2) {
        if (n1 == n2)
            return true;
        if (n1 == null || n2 == null)
            return false;
        if (!n1.getLocalName().equals(n2.getLocalName()))
            return false;

        if (n1.isResolved() && n2.isResolved())
            return n1.getURI().equals(n2.getURI());
        else
            return n1.getPrefix() == null ? n2.getPrefix() == null : n1.getPrefix().equals(n2.getPrefix());
    }
}
