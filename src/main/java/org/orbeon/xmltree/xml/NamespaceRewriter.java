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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pre-processing pass over a literal tree: every unresolved {@link QualifiedName} whose prefix appears in a fixed
 * prefix table is replaced by the corresponding resolved name, so that statically known bindings don't have to be
 * looked up again when the tree is emitted.
 *
 * The walk rebuilds arrays, iterables and maps and leaves every other object as is.
 */
public class NamespaceRewriter {

    private final Map<String, String> prefixes;

    /**
     * @param prefixes  prefix to URI table; keys and values must be non-null strings
     */
    public NamespaceRewriter(Map<String, String> prefixes) {
        if (prefixes == null)
            throw new IllegalArgumentException("Null prefix table");
        for (final Map.Entry<?, ?> entry : prefixes.entrySet()) {
            if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String))
                throw new IllegalArgumentException("Non-string namespace binding: " + entry.getKey() + " -> " + entry.getValue());
        }
        this.prefixes = new LinkedHashMap<String, String>(prefixes);
    }

    public static Object rewrite(Map<String, String> prefixes, Object form) {
        return new NamespaceRewriter(prefixes).rewrite(form);
    }

    public Object rewrite(Object form) {
        if (form instanceof QualifiedName) {
            return rewriteName((QualifiedName) form);
        } else if (form instanceof Object[]) {
            final Object[] array = (Object[]) form;
            final Object[] result = new Object[array.length];
            for (int i = 0; i < array.length; i++)
                result[i] = rewrite(array[i]);
            return result;
        } else if (form instanceof Map) {
            final Map<Object, Object> result = new LinkedHashMap<Object, Object>();
            for (final Map.Entry<?, ?> entry : ((Map<?, ?>) form).entrySet())
                result.put(rewrite(entry.getKey()), rewrite(entry.getValue()));
            return result;
        } else if (form instanceof Iterable) {
            final List<Object> result = new ArrayList<Object>();
            for (final Object item : (Iterable<?>) form)
                result.add(rewrite(item));
            return result;
        } else {
            return form;
        }
    }

    private QualifiedName rewriteName(QualifiedName name) {
        if (name.isResolved())
            return name;
        final String prefix = name.getPrefix() == null ? XMLConstants.DEFAULT_NS_PREFIX : name.getPrefix();
        final String uri = prefixes.get(prefix);
        return uri == null ? name : name.withURI(uri);
    }
}
