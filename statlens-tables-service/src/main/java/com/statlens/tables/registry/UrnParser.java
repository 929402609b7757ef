package com.statlens.tables.registry;

/**
 * Reads the parts of SDMX code URNs such as
 * {@code urn:sdmx:org.sdmx.infomodel.codelist.Code=IMF.STA:CL_BOP_INDICATOR(1.0+.0).CA}.
 */
public final class UrnParser {

    public static String agencyOf(String urn) {
        if (urn == null) return null;
        int eq = urn.indexOf('=');
        if (eq < 0) return null;
        String rest = urn.substring(eq + 1);
        int colon = rest.indexOf(':');
        String agency = colon >= 0 ? rest.substring(0, colon) : rest;
        return agency.isBlank() ? null : agency;
    }

    public static String codeOf(String urn) {
        if (urn == null || urn.isBlank()) return null;
        int dot = urn.lastIndexOf('.');
        String code = dot >= 0 ? urn.substring(dot + 1) : urn;
        return code.isBlank() ? null : code;
    }

    public static String codelistOf(String urn) {
        if (urn == null) return null;
        int colon = urn.lastIndexOf(':');
        if (colon < 0) return null;
        String rest = urn.substring(colon + 1);
        int paren = rest.indexOf('(');
        String id = paren >= 0 ? rest.substring(0, paren) : rest;
        return id.isBlank() ? null : id;
    }

    private UrnParser() {}
}
