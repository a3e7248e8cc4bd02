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
import org.orbeon.xmltree.common.EncodingMismatchException;
import org.orbeon.xmltree.common.XMLTreeException;
import org.orbeon.xmltree.event.EventGenerator;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.util.LoggerFactory;
import org.orbeon.xmltree.xml.XMLConstants;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.Collections;

/**
 * Serialization of element trees as XML documents.
 */
public class XMLEmitter {

    private static final Logger logger = LoggerFactory.createLogger(XMLEmitter.class);

    public static final String DEFAULT_ENCODING = "UTF-8";

    private static XMLOutputFactory outputFactory;

    private XMLEmitter() {
    }

    private static synchronized XMLOutputFactory getOutputFactory() {
        if (outputFactory == null)
            outputFactory = XMLOutputFactory.newInstance();
        return outputFactory;
    }

    public static void emit(Element element, Writer writer) {
        emit(element, writer, DEFAULT_ENCODING);
    }

    /**
     * Write the element as a document to the writer, declaring the given encoding. The writer is flushed but not
     * closed.
     *
     * @throws EncodingMismatchException if the writer is an OutputStreamWriter with another encoding
     */
    public static void emit(Element element, Writer writer, String encoding) {
        if (writer instanceof OutputStreamWriter)
            checkStreamEncoding((OutputStreamWriter) writer, encoding);

        if (logger.isDebugEnabled())
            logger.debug("Emitting element " + element.getTag() + " with encoding " + encoding);

        final XMLStreamWriter streamWriter;
        try {
            streamWriter = getOutputFactory().createXMLStreamWriter(writer);
        } catch (XMLStreamException e) {
            throw new XMLTreeException(e);
        }
        try {
            streamWriter.writeStartDocument(encoding, XMLConstants.XML_VERSION);
            new EventWriter(streamWriter).writeAll(EventGenerator.flattenToEvents(Collections.singletonList(element)));
            streamWriter.writeEndDocument();
            streamWriter.flush();
        } catch (XMLStreamException e) {
            throw new XMLTreeException(e);
        } finally {
            try {
                streamWriter.close();
            } catch (XMLStreamException e) {
                logger.warn("Error closing XML stream writer", e);
            }
        }
    }

    /**
     * Write the element as a document to the stream, encoding characters with the given encoding. The stream is
     * flushed but not closed.
     */
    public static void emit(Element element, OutputStream outputStream, String encoding) {
        final Writer writer;
        try {
            writer = new OutputStreamWriter(outputStream, encoding);
        } catch (UnsupportedEncodingException e) {
            throw new XMLTreeException(e);
        }
        emit(element, writer, encoding);
        try {
            writer.flush();
        } catch (IOException e) {
            throw new XMLTreeException(e);
        }
    }

    public static String emitString(Element element) {
        final StringWriter writer = new StringWriter();
        emit(element, writer, DEFAULT_ENCODING);
        return writer.toString();
    }

    /**
     * Check that the encoding of the writer matches the encoding declared in the document.
     */
    public static void checkStreamEncoding(OutputStreamWriter writer, String encoding) {
        final String streamEncoding = writer.getEncoding();
        if (streamEncoding == null)
            throw new XMLTreeException("Writer is closed");
        if (!Charset.forName(encoding).equals(Charset.forName(streamEncoding)))
            throw new EncodingMismatchException(encoding, streamEncoding);
    }
}
