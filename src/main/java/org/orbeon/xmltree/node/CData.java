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
package org.orbeon.xmltree.node;

/**
 * Verbatim text, written as a CDATA section.
 */
public final class CData extends Node {

    private final String content;

    public CData(String content) {
        this.content = content == null ? "" : content;
    }

    public Type getType() {
        return Type.CDATA;
    }

    public String getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CData && content.equals(((CData) o).content));
    }

    @Override
    public int hashCode() {
        return 31 * Type.CDATA.hashCode() + content.hashCode();
    }

    @Override
    public String toString() {
        return "<![CDATA[" + content + "]]>";
    }
}
