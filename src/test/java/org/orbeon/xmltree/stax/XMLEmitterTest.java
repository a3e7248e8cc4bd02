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
import org.orbeon.xmltree.common.EncodingMismatchException;
import org.orbeon.xmltree.common.UnresolvedPrefixException;
import org.orbeon.xmltree.node.CData;
import org.orbeon.xmltree.node.Comment;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.sexp.SexpConverter;
import org.orbeon.xmltree.xml.QualifiedName;

import java.io.ByteArrayOutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UnsupportedEncodingException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class XMLEmitterTest {

    private static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private static final QualifiedName A = new QualifiedName("a");

    @Test
    public void testDefaults() {
        final Element deepTree = XMLParsing.parseString("<a h=\"1\" i='2' j=\"3\">"
                + "  t1<b k=\"4\">t2</b>"
                + "  t3<c>t4</c>"
                + "  t5<d>t6</d>"
                + "  t7<e l=\"5\" m=\"6\">"
                + "    t8<f>t10</f>t11</e>"
                + "  t12<g>t13</g>t14"
                + "</a>");

        assertEquals(DECLARATION
                + "<a h=\"1\" i=\"2\" j=\"3\">"
                + "  t1<b k=\"4\">t2</b>"
                + "  t3<c>t4</c>"
                + "  t5<d>t6</d>"
                + "  t7<e l=\"5\" m=\"6\">"
                + "    t8<f>t10</f>t11</e>"
                + "  t12<g>t13</g>t14"
                + "</a>", XMLEmitter.emitString(deepTree));
    }

    @Test
    public void testMixedQuotes() {
        final Map<QualifiedName, String> attributes = new LinkedHashMap<QualifiedName, String>();
        attributes.put(new QualifiedName("double"), "\"double\"quotes\"here\"");
        attributes.put(new QualifiedName("single"), "'single'quotes'here");

        assertEquals(DECLARATION
                + "<mixed double=\"&quot;double&quot;quotes&quot;here&quot;\" single=\"'single'quotes'here\"></mixed>",
                XMLEmitter.emitString(Element.create(new QualifiedName("mixed"), attributes)));
    }

    @Test
    public void testEmptyElement() {
        assertEquals(DECLARATION + "<a></a>", XMLEmitter.emitString(Element.create(A)));
    }

    @Test
    public void testCommentAndCData() {
        assertEquals(DECLARATION + "<a><!--c--><![CDATA[x]]></a>",
                XMLEmitter.emitString(Element.create(A, null, new Comment("c"), new CData("x"))));
        assertEquals(DECLARATION + "<a></a>",
                XMLEmitter.emitString(Element.create(A, null, new CData(""))));
    }

    @Test
    public void testCDataSplit() {
        assertEquals(DECLARATION + "<a><![CDATA[a]]]]><![CDATA[>b]]></a>",
                XMLEmitter.emitString(Element.create(A, null, new CData("a]]>b"))));
    }

    @Test
    public void testEscaping() {
        final Element element = Element.create(A, null, "x < y & z");
        assertEquals(DECLARATION + "<a>x &lt; y &amp; z</a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testLiteralNotation() {
        final Map<String, Object> attributes = new LinkedHashMap<String, Object>();
        attributes.put("x", 1);
        final Element element = SexpConverter.toSingleRoot(new Object[] { A, attributes,
                new Object[] { new QualifiedName("b"), "t" }, 2 });
        assertEquals(DECLARATION + "<a x=\"1\"><b>t</b>2</a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testEncoding() throws UnsupportedEncodingException {
        final Element element = Element.create(new QualifiedName("how-cool"), null, "\u00DCbercool");

        final ByteArrayOutputStream utf8 = new ByteArrayOutputStream();
        XMLEmitter.emit(element, utf8, "UTF-8");
        assertEquals(DECLARATION + "<how-cool>\u00DCbercool</how-cool>", utf8.toString("UTF-8"));

        final ByteArrayOutputStream latin1 = new ByteArrayOutputStream();
        XMLEmitter.emit(element, latin1, "ISO-8859-1");
        final byte[] bytes = latin1.toByteArray();
        final String prefix = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><how-cool>";
        assertEquals(prefix + "\u00DCbercool</how-cool>", new String(bytes, "ISO-8859-1"));
        assertEquals((byte) 0xDC, bytes[prefix.length()]);
    }

    @Test
    public void testEncodingMismatch() throws UnsupportedEncodingException {
        final ByteArrayOutputStream stream = new ByteArrayOutputStream();
        try {
            XMLEmitter.emit(Element.create(A), new OutputStreamWriter(stream, "UTF-8"), "ISO-8859-1");
            fail();
        } catch (EncodingMismatchException e) {
            assertEquals("ISO-8859-1", e.getDeclaredEncoding());
        }
        assertEquals(0, stream.size());
    }

    @Test
    public void testEncodingAliases() throws UnsupportedEncodingException {
        final ByteArrayOutputStream stream = new ByteArrayOutputStream();
        final OutputStreamWriter writer = new OutputStreamWriter(stream, "UTF8");
        XMLEmitter.emit(Element.create(A), writer, "utf-8");
        assertTrue(stream.toString("UTF-8").endsWith("<a></a>"));
    }

    @Test
    public void testWriterIsNotClosed() {
        final StringWriter writer = new StringWriter();
        XMLEmitter.emit(Element.create(A), writer);
        writer.write("!");
        assertEquals(DECLARATION + "<a></a>!", writer.toString());
    }

    @Test(expected = UnresolvedPrefixException.class)
    public void testUnboundPrefix() {
        XMLEmitter.emitString(Element.create(new QualifiedName("a", "p")));
    }
}
