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

import javax.xml.stream.XMLInputFactory;

/**
 * Options of the StAX tokenizer, and of how its events are reported.
 */
public class ParserConfiguration {

    public final boolean coalescing;
    public final boolean namespaceAware;
    public final boolean replacingEntityReferences;
    public final boolean supportingExternalEntities;
    public final boolean validating;
    public final boolean supportDTD;

    /** Drop text made only of whitespace */
    public final boolean skipWhitespace;
    /** Report comments as comment events instead of ignoring them */
    public final boolean reportComments;
    /** Report CDATA sections as CDATA events instead of characters; requires coalescing to be off */
    public final boolean reportCData;

    public ParserConfiguration(boolean coalescing, boolean namespaceAware, boolean replacingEntityReferences,
                               boolean supportingExternalEntities, boolean validating, boolean supportDTD,
                               boolean skipWhitespace, boolean reportComments, boolean reportCData) {
        this.coalescing = coalescing;
        this.namespaceAware = namespaceAware;
        this.replacingEntityReferences = replacingEntityReferences;
        this.supportingExternalEntities = supportingExternalEntities;
        this.validating = validating;
        this.supportDTD = supportDTD;
        this.skipWhitespace = skipWhitespace;
        this.reportComments = reportComments;
        this.reportCData = reportCData;
    }

    public static final ParserConfiguration DEFAULT = new ParserConfiguration(true, true, true, false, false, true, true, false, false);
    public static final ParserConfiguration PRESERVE_WHITESPACE = new ParserConfiguration(true, true, true, false, false, true, false, false, false);
    public static final ParserConfiguration FULL_FIDELITY = new ParserConfiguration(false, true, true, false, false, true, false, true, true);

    /**
     * Key identifying the tokenizer options, used to share factories.
     */
    public String getKey() {
        return (coalescing ? "1" : "0") + (namespaceAware ? "1" : "0") + (replacingEntityReferences ? "1" : "0")
                + (supportingExternalEntities ? "1" : "0") + (validating ? "1" : "0") + (supportDTD ? "1" : "0");
    }

    public XMLInputFactory createInputFactory() {
        final XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.IS_COALESCING, coalescing);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, namespaceAware);
        factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, replacingEntityReferences);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, supportingExternalEntities);
        factory.setProperty(XMLInputFactory.IS_VALIDATING, validating);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, supportDTD);
        return factory;
    }
}
