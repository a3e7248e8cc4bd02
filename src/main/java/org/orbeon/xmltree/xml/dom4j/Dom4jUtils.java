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
package org.orbeon.xmltree.xml.dom4j;

import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.io.OutputFormat;
import org.dom4j.io.SAXReader;
import org.dom4j.io.XMLWriter;
import org.orbeon.xmltree.common.XMLTreeException;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.stax.XMLEmitter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Indentation of emitted XML through dom4j, for formatting/debugging purposes only.
 */
public class Dom4jUtils {

    private Dom4jUtils() {
    }

    public static Document readDom4j(String xmlString) {
        try {
            return SAXReader.createDefault().read(new StringReader(xmlString));
        } catch (DocumentException e) {
            throw new XMLTreeException(e);
        }
    }

    /**
     * Convert a dom4j document to a pretty string, for formatting/debugging purposes only.
     *
     * @param document  document to convert
     * @return          resulting string
     */
    public static String domToPrettyString(Document document) {
        final StringWriter writer = new StringWriter();
        writePretty(document, writer);
        return writer.toString();
    }

    /**
     * Emit the element and write it indented to the writer, with its XML declaration.
     */
    public static void indent(Element element, Writer writer) {
        writePretty(readDom4j(XMLEmitter.emitString(element)), writer);
    }

    public static String indentString(Element element) {
        final StringWriter writer = new StringWriter();
        indent(element, writer);
        return writer.toString();
    }

    private static void writePretty(Document document, Writer writer) {
        final OutputFormat format = new OutputFormat();
        format.setIndentSize(2);
        format.setNewlines(true);
        format.setTrimText(true);
        try {
            final XMLWriter xmlWriter = new XMLWriter(writer, format);
            xmlWriter.write(document);
            xmlWriter.flush();
        } catch (IOException e) {
            throw new XMLTreeException(e);
        }
    }
}
