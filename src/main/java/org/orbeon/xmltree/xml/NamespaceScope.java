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

import javax.xml.namespace.NamespaceContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable prefix to namespace URI bindings visible at a given point of a tree or event stream.
 *
 * Scopes form a chain: a nested element's scope inherits the bindings of its parent's scope and may shadow them. The
 * <code>xml</code> and <code>xmlns</code> prefixes are always bound, and the default prefix is bound to no namespace
 * unless declared otherwise. A root scope may delegate to a JAXP {@link NamespaceContext}, for example the context
 * of an <code>XMLStreamWriter</code>.
 *
 * Binding a non-default prefix to the empty URI, as XML 1.1 allows, removes the binding.
 */
public final class NamespaceScope implements NamespaceContext {

    public static final NamespaceScope ROOT = new NamespaceScope(null, null, Collections.<String, String>emptyMap());

    private final NamespaceScope parent;
    private final NamespaceContext delegate;
    private final Map<String, String> bindings;

    private NamespaceScope(NamespaceScope parent, NamespaceContext delegate, Map<String, String> bindings) {
        this.parent = parent;
        this.delegate = delegate;
        this.bindings = bindings;
    }

    public static NamespaceScope of(Map<String, String> bindings) {
        return ROOT.with(bindings);
    }

    /**
     * Root scope answering from a JAXP namespace context for prefixes it doesn't bind itself.
     */
    public static NamespaceScope wrap(NamespaceContext context) {
        return context == null ? ROOT : new NamespaceScope(null, context, Collections.<String, String>emptyMap());
    }

    /**
     * Nested scope with the given bindings, using the empty string for the default prefix.
     */
    public NamespaceScope with(Map<String, String> newBindings) {
        if (newBindings == null || newBindings.isEmpty())
            return this;

        final Map<String, String> copy = new LinkedHashMap<String, String>();
        for (final Map.Entry<String, String> entry : newBindings.entrySet()) {
            if (entry.getValue() == null)
                throw new IllegalArgumentException("Null URI for prefix: " + entry.getKey());
            copy.put(entry.getKey() == null ? XMLConstants.DEFAULT_NS_PREFIX : entry.getKey(), entry.getValue());
        }
        return new NamespaceScope(this, null, Collections.unmodifiableMap(copy));
    }

    public NamespaceScope with(String prefix, String uri) {
        return with(Collections.singletonMap(prefix, uri));
    }

    /**
     * Nested scope with the namespace declarations found among an element's attributes.
     */
    public NamespaceScope declare(Map<QualifiedName, String> attributes) {
        return with(getDeclarations(attributes));
    }

    /**
     * Extract the namespace declarations from attributes, in order, keyed by prefix (the empty string for the
     * default namespace).
     */
    public static Map<String, String> getDeclarations(Map<QualifiedName, String> attributes) {
        if (attributes == null || attributes.isEmpty())
            return Collections.emptyMap();

        final Map<String, String> declarations = new LinkedHashMap<String, String>();
        for (final Map.Entry<QualifiedName, String> entry : attributes.entrySet()) {
            final QualifiedName name = entry.getKey();
            if (XMLConstants.isDefaultNamespaceDeclaration(name))
                declarations.put(XMLConstants.DEFAULT_NS_PREFIX, entry.getValue());
            else if (XMLConstants.isPrefixDeclaration(name))
                declarations.put(name.getLocalName(), entry.getValue());
        }
        return declarations;
    }

    /**
     * @return the URI bound to the prefix, or null if the prefix is unbound. A null prefix stands for the default
     *         prefix, which is always bound.
     */
    public String lookup(String prefix) {
        final String p = prefix == null ? XMLConstants.DEFAULT_NS_PREFIX : prefix;
        if (XMLConstants.XML_PREFIX.equals(p))
            return XMLConstants.XML_URI;
        if (XMLConstants.XMLNS_PREFIX.equals(p))
            return XMLConstants.XMLNS_URI;

        for (NamespaceScope scope = this; scope != null; scope = scope.parent) {
            final String uri = scope.bindings.get(p);
            if (uri != null)
                return isUnbinding(p, uri) ? null : uri;
            if (scope.delegate != null) {
                final String delegated = scope.delegate.getNamespaceURI(p);
                if (delegated != null && !isUnbinding(p, delegated))
                    return delegated;
            }
        }
        return p.length() == 0 ? XMLConstants.NULL_NS_URI : null;
    }

    public String getDefaultNamespace() {
        return lookup(XMLConstants.DEFAULT_NS_PREFIX);
    }

    /**
     * @return a non-default prefix currently bound to the URI, innermost declarations first, or null if there is none
     */
    public String lookupPrefix(String uri) {
        for (final String prefix : getBoundPrefixes(uri))
            if (prefix.length() > 0)
                return prefix;
        return null;
    }

    private List<String> getBoundPrefixes(String uri) {
        final Set<String> candidates = new LinkedHashSet<String>();
        if (XMLConstants.XML_URI.equals(uri))
            candidates.add(XMLConstants.XML_PREFIX);
        if (XMLConstants.XMLNS_URI.equals(uri))
            candidates.add(XMLConstants.XMLNS_PREFIX);
        if (XMLConstants.NULL_NS_URI.equals(uri))
            candidates.add(XMLConstants.DEFAULT_NS_PREFIX);
        for (NamespaceScope scope = this; scope != null; scope = scope.parent) {
            for (final Map.Entry<String, String> entry : scope.bindings.entrySet())
                if (entry.getValue().equals(uri))
                    candidates.add(entry.getKey());
            if (scope.delegate != null) {
                for (final Iterator<?> i = scope.delegate.getPrefixes(uri); i != null && i.hasNext();)
                    candidates.add((String) i.next());
            }
        }

        // Keep only prefixes that aren't shadowed by a nested declaration
        final List<String> result = new ArrayList<String>();
        for (final String prefix : candidates)
            if (uri.equals(lookup(prefix)))
                result.add(prefix);
        return result;
    }

    private static boolean isUnbinding(String prefix, String uri) {
        return prefix.length() > 0 && uri.length() == 0;
    }

    // JAXP NamespaceContext

    public String getNamespaceURI(String prefix) {
        if (prefix == null)
            throw new IllegalArgumentException("Null prefix");
        final String uri = lookup(prefix);
        return uri == null ? XMLConstants.NULL_NS_URI : uri;
    }

    public String getPrefix(String namespaceURI) {
        if (namespaceURI == null)
            throw new IllegalArgumentException("Null namespace URI");
        final List<String> prefixes = getBoundPrefixes(namespaceURI);
        return prefixes.isEmpty() ? null : prefixes.get(0);
    }

    public Iterator<String> getPrefixes(String namespaceURI) {
        if (namespaceURI == null)
            throw new IllegalArgumentException("Null namespace URI");
        return Collections.unmodifiableList(getBoundPrefixes(namespaceURI)).iterator();
    }
}
