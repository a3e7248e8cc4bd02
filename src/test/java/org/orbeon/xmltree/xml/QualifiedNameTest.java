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

import org.junit.Test;

import static org.junit.Assert.*;

public class QualifiedNameTest {

    @Test
    public void testValueOf() {
        assertEquals(new QualifiedName("a"), QualifiedName.valueOf("a"));
        assertEquals(new QualifiedName("a", "p"), QualifiedName.valueOf("p:a"));
        assertEquals(QualifiedName.resolved("urn:u", "a", null), QualifiedName.valueOf("{urn:u}a"));
        assertEquals(QualifiedName.resolved("", "a", null), QualifiedName.valueOf("{}a"));
    }

    @Test
    public void testParts() {
        final QualifiedName name = QualifiedName.resolved("urn:u", "a", "p");
        assertEquals("a", name.getLocalName());
        assertEquals("p", name.getPrefix());
        assertEquals("urn:u", name.getURI());
        assertTrue(name.isResolved());
        assertEquals("p:a", name.getQualifiedName());
        assertEquals("{urn:u}p:a", name.toString());
        assertEquals(new javax.xml.namespace.QName("urn:u", "a", "p"), name.toQName());

        assertFalse(new QualifiedName("a").isResolved());
        assertFalse(new QualifiedName("a", "").hasPrefix());
        assertEquals(new QualifiedName("a"), new QualifiedName("a", ""));
    }

    @Test
    public void testExactEquality() {
        assertFalse(new QualifiedName("a", "p").equals(QualifiedName.resolved("urn:u", "a", "p")));
        assertFalse(QualifiedName.resolved("urn:u", "a", "p").equals(QualifiedName.resolved("urn:u", "a", "q")));
        assertEquals(QualifiedName.resolved("urn:u", "a", "p").hashCode(), QualifiedName.resolved("urn:u", "a", "p").hashCode());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyLocalName() {
        new QualifiedName("");
    }
}
