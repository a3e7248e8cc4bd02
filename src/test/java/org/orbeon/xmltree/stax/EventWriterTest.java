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

import org.junit.Test;
import org.orbeon.xmltree.common.UnresolvedPrefixException;
import org.orbeon.xmltree.common.XMLTreeException;
import org.orbeon.xmltree.event.Event;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.xml.NamespaceResolver;
import org.orbeon.xmltree.xml.NamespaceScope;
import org.orbeon.xmltree.xml.QualifiedName;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class EventWriterTest {

    private static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    @Test
    public void testParsedNamespaces() {
        final String xml = "<p:a xmlns:p=\"urn:p\" p:x=\"1\"><p:b></p:b></p:a>";
        assertEquals(DECLARATION + xml, XMLEmitter.emitString(XMLParsing.parseString(xml)));
    }

    @Test
    public void testParsedDefaultNamespace() {
        final String xml = "<a xmlns=\"urn:d\"><b y=\"2\"></b></a>";
        assertEquals(DECLARATION + xml, XMLEmitter.emitString(XMLParsing.parseString(xml)));
    }

    @Test
    public void testResolvedNameIsDeclared() {
        final Element element = Element.create(QualifiedName.resolved("urn:p", "a", "p"), null,
                Element.create(QualifiedName.resolved("urn:p", "b", "p")));
        assertEquals(DECLARATION + "<p:a xmlns:p=\"urn:p\"><p:b></p:b></p:a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testResolvedAttributeIsDeclared() {
        final Map<QualifiedName, String> attributes = new LinkedHashMap<QualifiedName, String>();
        attributes.put(QualifiedName.resolved("urn:q", "x", "q"), "1");
        attributes.put(QualifiedName.resolved("", "y", null), "2");
        final Element element = Element.create(new QualifiedName("a"), attributes);
        assertEquals(DECLARATION + "<a xmlns:q=\"urn:q\" q:x=\"1\" y=\"2\"></a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testUnprefixedNameInDeclaredDefaultNamespace() {
        final Element element = Element.create(QualifiedName.resolved("urn:d", "a", null),
                Collections.singletonMap(new QualifiedName("xmlns"), "urn:d"));
        assertEquals(DECLARATION + "<a xmlns=\"urn:d\"></a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testUnprefixedNameFindsPrefix() {
        final Element element = Element.create(new QualifiedName("a", "p"),
                Collections.singletonMap(new QualifiedName("p", "xmlns"), "urn:p"),
                Element.create(QualifiedName.resolved("urn:p", "b", null)));
        assertEquals(DECLARATION + "<p:a xmlns:p=\"urn:p\"><p:b></p:b></p:a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testNoNamespaceUnderDefaultNamespace() {
        final Element element = Element.create(new QualifiedName("a"),
                Collections.singletonMap(new QualifiedName("xmlns"), "urn:d"),
                Element.create(QualifiedName.resolved("", "b", null)));
        assertEquals(DECLARATION + "<a xmlns=\"urn:d\"><b xmlns=\"\"></b></a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testAttributePrefixBoundToOtherURIOnElement() {
        final Element element = Element.create(QualifiedName.resolved("urn:a", "a", "p"),
                Collections.singletonMap(QualifiedName.resolved("urn:b", "x", "p"), "v"));
        final String xml = XMLEmitter.emitString(element);
        assertEquals(DECLARATION + "<p:a xmlns:p=\"urn:a\" xmlns:ns0=\"urn:b\" ns0:x=\"v\"></p:a>", xml);

        // Names keep their namespaces once parsed back
        final Element parsed = XMLParsing.parseString(xml);
        final NamespaceScope scope = NamespaceScope.ROOT.declare(parsed.getAttributes());
        assertEquals("urn:a", NamespaceResolver.resolveTag(parsed.getTag(), scope).getURI());
        assertEquals("v", parsed.getAttribute(new QualifiedName("x", "ns0")));
        assertEquals("urn:b", NamespaceResolver.resolveAttribute(new QualifiedName("x", "ns0"), scope).getURI());
    }

    @Test
    public void testAttributesSharingPrefixWithDifferentURIs() {
        final Map<QualifiedName, String> attributes = new LinkedHashMap<QualifiedName, String>();
        attributes.put(QualifiedName.resolved("urn:b", "x", "q"), "1");
        attributes.put(QualifiedName.resolved("urn:c", "y", "q"), "2");
        final Element element = Element.create(new QualifiedName("a"), attributes);
        assertEquals(DECLARATION + "<a xmlns:q=\"urn:b\" xmlns:ns0=\"urn:c\" q:x=\"1\" ns0:y=\"2\"></a>",
                XMLEmitter.emitString(element));
    }

    @Test
    public void testTagPrefixDeclaredWithOtherURI() {
        final Element element = Element.create(QualifiedName.resolved("urn:2", "a", "p"),
                Collections.singletonMap(new QualifiedName("p", "xmlns"), "urn:1"));
        assertEquals(DECLARATION + "<ns0:a xmlns:p=\"urn:1\" xmlns:ns0=\"urn:2\"></ns0:a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testPrefixInScopeIsReused() {
        final Element child = Element.create(QualifiedName.resolved("urn:a", "a", "p"),
                Collections.singletonMap(QualifiedName.resolved("urn:b", "x", "p"), "v"));
        final Element element = Element.create(new QualifiedName("r"),
                Collections.singletonMap(new QualifiedName("q", "xmlns"), "urn:b"), child);
        assertEquals(DECLARATION + "<r xmlns:q=\"urn:b\"><p:a xmlns:p=\"urn:a\" q:x=\"v\"></p:a></r>",
                XMLEmitter.emitString(element));
    }

    @Test
    public void testNoPrefixForURI() {
        try {
            XMLEmitter.emitString(Element.create(QualifiedName.resolved("urn:d", "a", null)));
            fail();
        } catch (UnresolvedPrefixException e) {
            assertEquals("urn:d", e.getURI());
        }
    }

    @Test
    public void testNothingWrittenForFailingElement() {
        final StringWriter writer = new StringWriter();
        final Element element = Element.create(new QualifiedName("a"), null,
                Element.create(new QualifiedName("b"), Collections.singletonMap(new QualifiedName("x", "p"), "1")));
        try {
            XMLEmitter.emit(element, writer);
            fail();
        } catch (UnresolvedPrefixException e) {
            assertEquals("p", e.getPrefix());
        }
        assertFalse(writer.toString().contains("<b"));
    }

    @Test
    public void testUnbalancedEndElement() throws XMLStreamException {
        final XMLStreamWriter streamWriter = XMLOutputFactory.newInstance().createXMLStreamWriter(new StringWriter());
        final EventWriter eventWriter = new EventWriter(streamWriter);
        try {
            eventWriter.write(Event.endElement(new QualifiedName("a")));
            fail();
        } catch (XMLTreeException e) {
            assertTrue(e.getMessage().contains("a"));
        }
    }

    @Test
    public void testScopeFollowsElements() throws XMLStreamException {
        final XMLStreamWriter streamWriter = XMLOutputFactory.newInstance().createXMLStreamWriter(new StringWriter());
        final EventWriter eventWriter = new EventWriter(streamWriter);

        eventWriter.write(Event.startElement(new QualifiedName("a", "p"),
                Collections.singletonMap(new QualifiedName("p", "xmlns"), "urn:p")));
        assertEquals("urn:p", eventWriter.getScope().lookup("p"));

        eventWriter.write(Event.endElement(new QualifiedName("a", "p")));
        assertNull(eventWriter.getScope().lookup("p"));
    }
}
