package com.micaixbrl.core.taxonomy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Constants of the ESMA MiCA taxonomy and the XBRL specifications it builds on.
 */
public final class MicaTaxonomy {

    private MicaTaxonomy() {
        // Utility class
    }

    /** Namespace prefix of MiCA taxonomy elements. */
    public static final String PREFIX = "mica";

    /** MiCA taxonomy namespace, also the base of enumeration member URIs. */
    public static final String NAMESPACE = "https://www.esma.europa.eu/taxonomy/2025-03-31/mica/";

    /** Entry point referenced by generated documents. */
    public static final String ENTRY_POINT = NAMESPACE + "mica_entry_table_2.xsd";

    /** Identifier scheme of ISO 17442 legal entity identifiers. */
    public static final String LEI_SCHEME = "http://standards.iso.org/iso/17442";

    /** XHTML default namespace. */
    public static final String XHTML_NAMESPACE = "http://www.w3.org/1999/xhtml";

    /**
     * Fixed namespace prefixes declared on every generated document, in declaration order.
     */
    public static final Map<String, String> NAMESPACES = namespaces();

    private static Map<String, String> namespaces() {
        Map<String, String> namespaces = new LinkedHashMap<>();
        namespaces.put("xbrli", "http://www.xbrl.org/2003/instance");
        namespaces.put("ix", "http://www.xbrl.org/2013/inlineXBRL");
        namespaces.put("ixt", "http://www.xbrl.org/inlineXBRL/transformation/2020-02-12");
        namespaces.put("ixt4", "http://www.xbrl.org/inlineXBRL/transformation/2020-02-12");
        namespaces.put("link", "http://www.xbrl.org/2003/linkbase");
        namespaces.put("xlink", "http://www.w3.org/1999/xlink");
        namespaces.put("xbrldi", "http://xbrl.org/2006/xbrldi");
        namespaces.put(PREFIX, NAMESPACE);
        namespaces.put("iso4217", "http://www.xbrl.org/2003/iso4217");
        namespaces.put("utr", "http://www.xbrl.org/2009/utr");
        return Collections.unmodifiableMap(namespaces);
    }

    /**
     * Qualifies a local element name with the MiCA prefix.
     *
     * @param localName element local name
     * @return qualified name such as {@code mica:IssuePrice}
     */
    public static String element(String localName) {
        return PREFIX + ":" + localName;
    }
}
