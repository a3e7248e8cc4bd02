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
package org.orbeon.xmltree.common;

import org.junit.Test;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.stax.XMLParsing;

import javax.xml.stream.XMLStreamException;

import static org.junit.Assert.*;

public class XMLTreeExceptionTest {

    @Test
    public void testRootThrowable() {
        final XMLStreamException cause = new XMLStreamException("bad");
        final XMLTreeException e = new XMLTreeException(new XMLTreeException("wrapper", cause));
        assertSame(cause, XMLTreeException.getRootThrowable(e));
        assertSame(cause, XMLTreeException.getRootThrowable(cause));
    }

    @Test
    public void testMalformedInput() {
        // The error only surfaces when the faulty part is consumed
        final Element a = XMLParsing.parseString("<a><b></a>");
        try {
            a.getContent().toList();
            fail();
        } catch (XMLTreeException e) {
            assertTrue(XMLTreeException.getRootThrowable(e) instanceof XMLStreamException);
        }
    }
}
