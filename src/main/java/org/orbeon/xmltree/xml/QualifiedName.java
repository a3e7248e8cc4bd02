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

import org.apache.commons.lang.StringUtils;

import java.io.Serializable;

/**
 * XML name made of a local name, an optional prefix and an optional namespace URI.
 *
 * A name is <em>resolved</em> when its URI is known, and <em>unresolved</em> otherwise. Unresolved names are what the
 * parser produces and what literal notation usually contains: the prefix is only meaningful relative to the namespace
 * declarations in scope. {@link #equals(Object)} compares all three parts exactly; see
 * {@link NamespaceResolver#nameEquals(QualifiedName, QualifiedName)} for the namespace-aware comparison.
 *
 * An empty prefix is the same as no prefix. An empty URI is a resolved name in no namespace.
 */
public final class QualifiedName implements Serializable {

    private final String localName;
    private final String prefix;
    private final String uri;

    public QualifiedName(String localName) {
        this(localName, null, null);
    }

    public QualifiedName(String localName, String prefix) {
        this(localName, prefix, null);
    }

    private QualifiedName(String localName, String prefix, String uri) {
        if (StringUtils.isEmpty(localName))
            throw new IllegalArgumentException("Empty local name");
        this.localName = localName;
        this.prefix = StringUtils.isBlank(prefix) ? null : prefix;
        this.uri = uri;
    }

    public static QualifiedName resolved(String uri, String localName, String prefix) {
        if (uri == null)
            throw new IllegalArgumentException("Null URI for resolved name: " + localName);
        return new QualifiedName(localName, prefix, uri);
    }

    /**
     * Parse either a <code>prefix:local</code> or <code>local</code> name, which is returned unresolved, or an
     * exploded <code>{uri}local</code> name, which is returned resolved and without prefix.
     */
    public static QualifiedName valueOf(String name) {
        if (name == null)
            throw new IllegalArgumentException("Null name");
        if (name.startsWith("{")) {
            final int closing = name.indexOf('}');
            if (closing == -1)
                throw new IllegalArgumentException("Invalid exploded name: " + name);
            return resolved(name.substring(1, closing), name.substring(closing + 1), null);
        } else {
            final int colon = name.indexOf(':');
            return colon == -1
                    ? new QualifiedName(name)
                    : new QualifiedName(name.substring(colon + 1), name.substring(0, colon));
        }
    }

    public String getLocalName() {
        return localName;
    }

    /**
     * @return the prefix, or null
     */
    public String getPrefix() {
        return prefix;
    }

    /**
     * @return the namespace URI, or null if the name is unresolved
     */
    public String getURI() {
        return uri;
    }

    public boolean hasPrefix() {
        return prefix != null;
    }

    public boolean isResolved() {
        return uri != null;
    }

    public QualifiedName withURI(String uri) {
        return resolved(uri, localName, prefix);
    }

    /**
     * @return the name as written in a document, <code>prefix:local</code> or <code>local</code>
     */
    public String getQualifiedName() {
        return prefix == null ? localName : prefix + ':' + localName;
    }

    /**
     * Convert to a JAXP name. An unresolved name gets the empty URI.
     */
    public javax.xml.namespace.QName toQName() {
        return new javax.xml.namespace.QName(uri == null ? XMLConstants.NULL_NS_URI : uri, localName,
                prefix == null ? XMLConstants.DEFAULT_NS_PREFIX : prefix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QualifiedName))
            return false;
        final QualifiedName other = (QualifiedName) o;
        return localName.equals(other.localName)
                && (prefix == null ? other.prefix == null : prefix.equals(other.prefix))
                && (uri == null ? other.uri == null : uri.equals(other.uri));
    }

    @Override
    public int hashCode() {
        int result = localName.hashCode();
        result = 31 * result + (prefix != null ? prefix.hashCode() : 0);
        result = 31 * result + (uri != null ? uri.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return uri == null ? getQualifiedName() : "{" + uri + "}" + getQualifiedName();
    }
}
