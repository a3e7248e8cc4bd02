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

import javax.xml.stream.XMLStreamException;

/**
 * Unchecked exception raised by the XML tree library. Checked exceptions coming from the StAX and I/O layers are
 * wrapped into this.
 */
public class XMLTreeException extends RuntimeException {

    public XMLTreeException(String message) {
        super(message);
    }

    public XMLTreeException(Throwable throwable) {
        super(throwable);
    }

    public XMLTreeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the exception directly nested in <code>t</code>.
     */
    public static Throwable getNestedThrowable(Throwable t) {
        Throwable nested = null;
        if (t instanceof XMLStreamException)
            nested = ((XMLStreamException) t).getNestedException();

        if (nested == null)
            nested = t.getCause();
        return nested == t ? null : nested;
    }

    /**
     * Get exception at the source of the problem.
     */
    public static Throwable getRootThrowable(Throwable e) {
        while (true) {
            final Throwable nested = getNestedThrowable(e);
            if (nested == null) break;
            e = nested;
        }
        return e;
    }
}
