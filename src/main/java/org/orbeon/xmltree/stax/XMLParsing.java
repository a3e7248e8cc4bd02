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

import org.orbeon.xmltree.event.Event;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.tree.EventTree;
import org.orbeon.xmltree.util.LazySeq;

import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.function.Function;

/**
 * Parsing of XML text into lazy event sequences and lazy element trees.
 *
 * Trees returned by the <code>parse</code> methods read their input as they are consumed: the stream must stay open
 * until the tree has been consumed as far as the caller needs. {@link #withTree(Reader, ParserConfiguration, Function)}
 * scopes this, releasing the tokenizer when the function returns or fails.
 */
public class XMLParsing {

    private XMLParsing() {
    }

    /**
     * Lazy sequence of events read from the reader. The tokenizer is released at the end of the document.
     */
    public static LazySeq<Event> sourceSeq(Reader reader, ParserConfiguration configuration) {
        return EventSource.open(reader, configuration).events();
    }

    public static LazySeq<Event> sourceSeq(InputStream inputStream, ParserConfiguration configuration) {
        return EventSource.open(inputStream, configuration).events();
    }

    public static Element parse(Reader reader) {
        return parse(reader, ParserConfiguration.DEFAULT);
    }

    /**
     * Lazy tree of the document read from the reader.
     */
    public static Element parse(Reader reader, ParserConfiguration configuration) {
        return EventTree.firstElement(sourceSeq(reader, configuration));
    }

    public static Element parse(InputStream inputStream) {
        return parse(inputStream, ParserConfiguration.DEFAULT);
    }

    public static Element parse(InputStream inputStream, ParserConfiguration configuration) {
        return EventTree.firstElement(sourceSeq(inputStream, configuration));
    }

    public static Element parseString(String xml) {
        return parseString(xml, ParserConfiguration.DEFAULT);
    }

    public static Element parseString(String xml, ParserConfiguration configuration) {
        return parse(new StringReader(xml), configuration);
    }

    /**
     * Parse a document and apply a function to its lazy tree. The tokenizer is released when the function
     * completes, normally or not, so the function must not let unconsumed parts of the tree escape.
     */
    public static <T> T withTree(Reader reader, ParserConfiguration configuration, Function<Element, T> function) {
        final EventSource source = EventSource.open(reader, configuration);
        try {
            return function.apply(EventTree.firstElement(source.events()));
        } finally {
            source.close();
        }
    }
}
