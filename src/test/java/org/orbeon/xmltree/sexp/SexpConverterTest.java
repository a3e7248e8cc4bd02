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
package org.orbeon.xmltree.sexp;

import org.junit.Test;
import org.orbeon.xmltree.common.InvalidStructureException;
import org.orbeon.xmltree.node.CData;
import org.orbeon.xmltree.node.Comment;
import org.orbeon.xmltree.node.Element;
import org.orbeon.xmltree.stax.XMLEmitter;
import org.orbeon.xmltree.xml.QualifiedName;
import org.orbeon.xmltree.xml.XMLConstants;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class SexpConverterTest {

    private static final QualifiedName A = new QualifiedName("a");
    private static final QualifiedName B = new QualifiedName("b");

    @Test
    public void testNestedForms() {
        final Element expected = Element.create(A, null, Element.create(B, null, "x"), "y");
        assertEquals(expected, SexpConverter.toSingleRoot(new Object[] { A, new Object[] { B, "x" }, "y" }));
    }

    @Test
    public void testSplicedGroups() {
        final Element element = SexpConverter.toSingleRoot(new Object[] { A, Arrays.asList("x", new Object[] { B }), "y" });
        assertEquals(Arrays.<Object>asList("x", Element.create(B), "y"), element.getContent().toList());
    }

    @Test
    public void testBareName() {
        assertEquals(Element.create(A), SexpConverter.toSingleRoot(A));
        assertEquals(Element.create(A, null, Element.create(B)), SexpConverter.toSingleRoot(new Object[] { A, B }));
    }

    @Test
    public void testAttributes() {
        final Map<Object, Object> attributes = new LinkedHashMap<Object, Object>();
        attributes.put("p:x", 1);
        attributes.put(new QualifiedName("y"), null);
        attributes.put("z", true);

        final Element element = SexpConverter.toSingleRoot(new Object[] { A, attributes, "t" });
        assertEquals("1", element.getAttribute(new QualifiedName("x", "p")));
        assertEquals("", element.getAttribute(new QualifiedName("y")));
        assertEquals("true", element.getAttribute(new QualifiedName("z")));
        assertEquals(Arrays.<Object>asList("t"), element.getContent().toList());
    }

    @Test
    public void testReservedTags() {
        final Element element = SexpConverter.toSingleRoot(new Object[] { A,
                new Object[] { XMLConstants.CDATA_TAG, "x]]>y" },
                new Object[] { XMLConstants.COMMENT_TAG, "c" } });
        assertEquals(Arrays.<Object>asList(new CData("x]]>y"), new Comment("c")), element.getContent().toList());
    }

    @Test
    public void testReservedTagsWithoutText() {
        final Element element = SexpConverter.toSingleRoot(new Object[] { A,
                new Object[] { XMLConstants.CDATA_TAG, null },
                new Object[] { XMLConstants.COMMENT_TAG, null },
                new Object[] { XMLConstants.CDATA_TAG } });
        assertEquals(Arrays.<Object>asList(new CData(""), new Comment(""), new CData("")), element.getContent().toList());
        assertEquals("<?xml version=\"1.0\" encoding=\"UTF-8\"?><a><!----></a>", XMLEmitter.emitString(element));
    }

    @Test
    public void testScalarsAndNulls() {
        final Element existing = Element.create(B);
        final Element element = SexpConverter.toSingleRoot(new Object[] { A, 1, null, existing, 2.5 });
        final List<Object> content = element.getContent().toList();
        assertEquals(Arrays.<Object>asList("1", existing, "2.5"), content);
        assertSame(existing, content.get(1));
    }

    @Test
    public void testFragment() {
        final List<Object> fragment = SexpConverter.asFragment(A, "t", null, new Object[] { B });
        assertEquals(Arrays.<Object>asList(Element.create(A), "t", Element.create(B)), fragment);
        assertTrue(SexpConverter.asFragment().isEmpty());
    }

    @Test
    public void testInvalidStructure() {
        try {
            SexpConverter.toSingleRoot(Collections.emptyList());
            fail();
        } catch (InvalidStructureException e) {
            assertEquals(0, e.getRootCount());
        }
        try {
            SexpConverter.toSingleRoot(Arrays.asList(A, B));
            fail();
        } catch (InvalidStructureException e) {
            assertEquals(2, e.getRootCount());
        }
        try {
            SexpConverter.toSingleRoot("text");
            fail();
        } catch (InvalidStructureException e) {
            assertEquals(1, e.getRootCount());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFormWithoutTag() {
        SexpConverter.toSingleRoot(new Object[] { "a", "x" });
    }
}
