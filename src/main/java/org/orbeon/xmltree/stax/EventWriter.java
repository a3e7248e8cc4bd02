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
package org.orbeon.xmltree.stax;

import org.apache.log4j.Logger;
import org.orbeon.xmltree.common.UnresolvedPrefixException;
import org.orbeon.xmltree.common.XMLTreeException;
import org.orbeon.xmltree.event.Event;
import org.orbeon.xmltree.util.LoggerFactory;
import org.orbeon.xmltree.xml.NamespaceResolver;
import org.orbeon.xmltree.xml.NamespaceScope;
import org.orbeon.xmltree.xml.QualifiedName;
import org.orbeon.xmltree.xml.XMLConstants;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Stack;

/**
 * Writes events to a StAX stream writer, resolving names against the namespace declarations in scope.
 *
 * Namespace declarations found among a start event's attributes are written as declarations. Unresolved names are
 * resolved, and resolved names get a prefix bound to their URI, declaring it when needed. All names of an element are
 * checked before anything is written for it, so that an unbound prefix fails without partial output for that
 * element.
 */
public class EventWriter {

    private static final Logger logger = LoggerFactory.createLogger(EventWriter.class);

    private static final String GENERATED_PREFIX = "ns";

    private final XMLStreamWriter writer;
    private final Stack<NamespaceScope> scopes = new Stack<NamespaceScope>();

    private static class AttributeInfo {
        public final String prefix;
        public final String uri;
        public final String localName;
        public final String value;

        private AttributeInfo(String prefix, String uri, String localName, String value) {
            this.prefix = prefix;
            this.uri = uri;
            this.localName = localName;
            this.value = value;
        }
    }

    public EventWriter(XMLStreamWriter writer) {
        this.writer = writer;
        this.scopes.push(NamespaceScope.wrap(writer.getNamespaceContext()));
    }

    /**
     * Namespace bindings in scope at the write cursor.
     */
    public NamespaceScope getScope() {
        return scopes.peek();
    }

    public void writeAll(Iterable<Event> events) {
        for (final Event event : events)
            write(event);
    }

    public void write(Event event) {
        try {
            switch (event.getType()) {
                case START_ELEMENT:
                    writeStartElement(event);
                    break;
                case END_ELEMENT:
                    if (scopes.size() == 1)
                        throw new XMLTreeException("End element without matching start element: " + event.getName());
                    writer.writeEndElement();
                    scopes.pop();
                    break;
                case CHARACTERS:
                    writer.writeCharacters(event.getText());
                    break;
                case CDATA:
                    writeCData(event.getText());
                    break;
                case COMMENT:
                    writer.writeComment(event.getText());
                    break;
            }
        } catch (XMLStreamException e) {
            throw new XMLTreeException(e);
        }
    }

    private void writeStartElement(Event event) throws XMLStreamException {

        final Map<String, String> declarations = new LinkedHashMap<String, String>(NamespaceScope.getDeclarations(event.getAttributes()));
        NamespaceScope scope = scopes.peek().with(declarations);

        // Element name
        final QualifiedName tag = NamespaceResolver.resolveTag(event.getName(), scope);
        final String tagPrefix;
        if (tag.hasPrefix()) {
            tagPrefix = choosePrefix(tag.getPrefix(), tag.getURI(), scope, declarations);
            if (!tag.getURI().equals(scope.lookup(tagPrefix))) {
                // Resolved name whose binding is not in scope
                declarations.put(tagPrefix, tag.getURI());
                scope = scope.with(tagPrefix, tag.getURI());
            }
        } else if (tag.getURI().equals(scope.getDefaultNamespace())) {
            tagPrefix = XMLConstants.DEFAULT_NS_PREFIX;
        } else if (tag.getURI().length() == 0) {
            // Leave the default namespace in scope
            tagPrefix = XMLConstants.DEFAULT_NS_PREFIX;
            declarations.put(XMLConstants.DEFAULT_NS_PREFIX, XMLConstants.NULL_NS_URI);
            scope = scope.with(XMLConstants.DEFAULT_NS_PREFIX, XMLConstants.NULL_NS_URI);
        } else {
            final String prefix = scope.lookupPrefix(tag.getURI());
            if (prefix == null)
                throw UnresolvedPrefixException.forTagURI(event.getName(), tag.getURI());
            tagPrefix = prefix;
        }

        // Attributes
        final List<AttributeInfo> attributes = new ArrayList<AttributeInfo>();
        for (final Map.Entry<QualifiedName, String> entry : event.getAttributes().entrySet()) {
            final QualifiedName name = entry.getKey();
            if (XMLConstants.isNamespaceDeclaration(name))
                continue;

            final QualifiedName resolved = NamespaceResolver.resolveAttribute(name, scope);
            if (!resolved.isResolved() || resolved.getURI().length() == 0) {
                attributes.add(new AttributeInfo(null, null, resolved.getLocalName(), entry.getValue()));
            } else if (resolved.hasPrefix()) {
                final String prefix = choosePrefix(resolved.getPrefix(), resolved.getURI(), scope, declarations);
                if (!resolved.getURI().equals(scope.lookup(prefix))) {
                    declarations.put(prefix, resolved.getURI());
                    scope = scope.with(prefix, resolved.getURI());
                }
                attributes.add(new AttributeInfo(prefix, resolved.getURI(), resolved.getLocalName(), entry.getValue()));
            } else {
                // Unprefixed attributes are in no namespace, so a prefix is needed for the URI
                final String prefix = scope.lookupPrefix(resolved.getURI());
                if (prefix == null)
                    throw UnresolvedPrefixException.forAttributeURI(name, resolved.getURI());
                attributes.add(new AttributeInfo(prefix, resolved.getURI(), resolved.getLocalName(), entry.getValue()));
            }
        }

        // Everything resolved, write
        writer.writeStartElement(tagPrefix, tag.getLocalName(), tag.getURI());
        for (final Map.Entry<String, String> declaration : declarations.entrySet()) {
            final String prefix = declaration.getKey();
            final String uri = declaration.getValue();
            if (prefix.length() == 0) {
                writer.setDefaultNamespace(uri);
                writer.writeDefaultNamespace(uri);
            } else if (uri.length() == 0) {
                // Prefix undeclarations are not allowed in XML 1.0
                if (logger.isDebugEnabled())
                    logger.debug("Not writing undeclaration of namespace prefix " + prefix);
            } else {
                writer.setPrefix(prefix, uri);
                writer.writeNamespace(prefix, uri);
            }
        }
        for (final AttributeInfo attribute : attributes) {
            if (attribute.prefix == null)
                writer.writeAttribute(attribute.localName, attribute.value);
            else
                writer.writeAttribute(attribute.prefix, attribute.uri, attribute.localName, attribute.value);
        }

        scopes.push(scope);
    }

    /**
     * Choose the prefix under which a resolved name is written. The name's own prefix is kept unless this element
     * already binds it to another URI, or it is reserved. In that case another prefix bound to the URI is used, or
     * else a new prefix not bound in scope.
     */
    private static String choosePrefix(String prefix, String uri, NamespaceScope scope, Map<String, String> declarations) {
        if (uri.equals(scope.lookup(prefix)))
            return prefix;

        final boolean reserved = XMLConstants.XML_PREFIX.equals(prefix) || XMLConstants.XMLNS_PREFIX.equals(prefix);
        if (!reserved && !declarations.containsKey(prefix))
            return prefix;

        final String existing = scope.lookupPrefix(uri);
        if (existing != null)
            return existing;

        int index = 0;
        String generated;
        do {
            generated = GENERATED_PREFIX + index++;
        } while (scope.lookup(generated) != null || declarations.containsKey(generated));

        if (logger.isDebugEnabled())
            logger.debug("Prefix " + prefix + " already bound on element, using " + generated + " for namespace " + uri);
        return generated;
    }

    /**
     * Write a CDATA section, splitting it where its text contains <code>]]&gt;</code>. Empty text writes nothing.
     */
    private void writeCData(String text) throws XMLStreamException {
        String remaining = text;
        while (remaining.length() > 0) {
            final int index = remaining.indexOf("]]>");
            if (index == -1) {
                writer.writeCData(remaining);
                break;
            }
            writer.writeCData(remaining.substring(0, index + 2));
            remaining = remaining.substring(index + 2);
        }
    }
}
