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

import org.apache.commons.lang.StringUtils;
import org.apache.log4j.Logger;
import org.orbeon.xmltree.common.XMLTreeException;
import org.orbeon.xmltree.event.Event;
import org.orbeon.xmltree.event.EventCursor;
import org.orbeon.xmltree.util.LoggerFactory;
import org.orbeon.xmltree.xml.QualifiedName;
import org.orbeon.xmltree.xml.XMLConstants;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event cursor pulling from a StAX stream reader.
 *
 * Names are reported as written, unresolved. Namespace declarations are reported as <code>xmlns</code> and
 * <code>xmlns:prefix</code> attributes following the element's other attributes. Processing instructions, DTDs and,
 * unless configured otherwise, comments are skipped. The stream reader is closed when the end of the document is
 * reached.
 *
 * The cursor mutates the underlying stream reader: it must have a single consumer.
 */
public class StaxEventCursor implements EventCursor {

    private static final Logger logger = LoggerFactory.createLogger(StaxEventCursor.class);

    private final XMLStreamReader reader;
    private final ParserConfiguration configuration;
    private boolean closed;

    public StaxEventCursor(XMLStreamReader reader, ParserConfiguration configuration) {
        this.reader = reader;
        this.configuration = configuration;
    }

    public Event advance() {
        if (closed)
            return null;
        try {
            while (true) {
                switch (reader.next()) {
                    case XMLStreamConstants.START_ELEMENT:
                        return Event.startElement(getName(), getAttributes());
                    case XMLStreamConstants.END_ELEMENT:
                        return Event.endElement(getName());
                    case XMLStreamConstants.CHARACTERS:
                    case XMLStreamConstants.SPACE:
                        if (configuration.skipWhitespace && reader.isWhiteSpace())
                            continue;
                        return Event.characters(reader.getText());
                    case XMLStreamConstants.CDATA:
                        return configuration.reportCData ? Event.cdata(reader.getText()) : Event.characters(reader.getText());
                    case XMLStreamConstants.COMMENT:
                        if (!configuration.reportComments)
                            continue;
                        return Event.comment(reader.getText());
                    case XMLStreamConstants.END_DOCUMENT:
                        close();
                        return null;
                    default:
                        // Processing instructions, DTD, entity references
                        continue;
                }
            }
        } catch (XMLStreamException e) {
            throw new XMLTreeException(e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the stream reader. The underlying character or byte stream is not closed.
     */
    public void close() {
        if (!closed) {
            closed = true;
            if (logger.isDebugEnabled())
                logger.debug("Closing stream reader");
            try {
                reader.close();
            } catch (XMLStreamException e) {
                throw new XMLTreeException(e);
            }
        }
    }

    private QualifiedName getName() {
        final String prefix = reader.getPrefix();
        return StringUtils.isBlank(prefix) ? new QualifiedName(reader.getLocalName()) : new QualifiedName(reader.getLocalName(), prefix);
    }

    private Map<QualifiedName, String> getAttributes() {
        final int attributeCount = reader.getAttributeCount();
        final int namespaceCount = reader.getNamespaceCount();
        if (attributeCount == 0 && namespaceCount == 0)
            return Collections.emptyMap();

        final Map<QualifiedName, String> attributes = new LinkedHashMap<QualifiedName, String>();
        for (int i = 0; i < attributeCount; i++) {
            final String prefix = reader.getAttributePrefix(i);
            final String localName = reader.getAttributeLocalName(i);
            attributes.put(StringUtils.isBlank(prefix) ? new QualifiedName(localName) : new QualifiedName(localName, prefix),
                    reader.getAttributeValue(i));
        }
        for (int i = 0; i < namespaceCount; i++) {
            final String prefix = reader.getNamespacePrefix(i);
            final String uri = reader.getNamespaceURI(i);
            attributes.put(StringUtils.isEmpty(prefix)
                    ? new QualifiedName(XMLConstants.XMLNS_PREFIX)
                    : new QualifiedName(prefix, XMLConstants.XMLNS_PREFIX),
                    uri == null ? XMLConstants.NULL_NS_URI : uri);
        }
        return attributes;
    }
}
