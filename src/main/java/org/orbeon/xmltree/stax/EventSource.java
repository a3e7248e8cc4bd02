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
import org.orbeon.xmltree.common.XMLTreeException;
import org.orbeon.xmltree.event.Event;
import org.orbeon.xmltree.util.LazySeq;
import org.orbeon.xmltree.util.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.Closeable;
import java.io.InputStream;
import java.io.Reader;
import java.util.HashMap;
import java.util.Map;

/**
 * Owner of a StAX tokenizer over a character or byte stream, exposing its events as a lazy sequence.
 *
 * The events are pulled from the tokenizer as the sequence is consumed, and each realized event is remembered by the
 * sequence. The tokenizer is released when the end of the document is reached, or when {@link #close()} is called,
 * whichever comes first. Callers should close the source in a <code>finally</code> block so that the tokenizer is
 * released on every exit path, including when they stop consuming events early.
 *
 * The stream given to the source is not closed by it: it remains owned by the caller.
 *
 * NOTE: A source and its sequence must be consumed from a single thread. There is no replay: once the source is
 * closed, events not yet realized can't be read anymore.
 */
public class EventSource implements Closeable {

    private static final Logger logger = LoggerFactory.createLogger(EventSource.class);

    private static final Map<String, XMLInputFactory> inputFactories = new HashMap<String, XMLInputFactory>();

    private final StaxEventCursor cursor;
    private final LazySeq<Event> events;

    private EventSource(XMLStreamReader streamReader, ParserConfiguration configuration) {
        this.cursor = new StaxEventCursor(streamReader, configuration);
        this.events = LazySeq.fromCursor(cursor);
    }

    public static EventSource open(Reader reader, ParserConfiguration configuration) {
        try {
            return new EventSource(getInputFactory(configuration).createXMLStreamReader(reader), configuration);
        } catch (XMLStreamException e) {
            throw new XMLTreeException(e);
        }
    }

    public static EventSource open(InputStream inputStream, ParserConfiguration configuration) {
        try {
            return new EventSource(getInputFactory(configuration).createXMLStreamReader(inputStream), configuration);
        } catch (XMLStreamException e) {
            throw new XMLTreeException(e);
        }
    }

    /**
     * Get a shared input factory for the configuration's tokenizer options.
     */
    public static synchronized XMLInputFactory getInputFactory(ParserConfiguration configuration) {
        final String key = configuration.getKey();

        final XMLInputFactory existingFactory = inputFactories.get(key);
        if (existingFactory != null)
            return existingFactory;

        if (logger.isDebugEnabled())
            logger.debug("Creating XML input factory for configuration " + key);
        final XMLInputFactory newFactory = configuration.createInputFactory();
        inputFactories.put(key, newFactory);
        return newFactory;
    }

    /**
     * The lazy sequence of events. Always the same sequence for a given source.
     */
    public LazySeq<Event> events() {
        return events;
    }

    public boolean isClosed() {
        return cursor.isClosed();
    }

    public void close() {
        cursor.close();
    }
}
