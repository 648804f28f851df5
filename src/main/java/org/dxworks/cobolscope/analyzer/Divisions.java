package org.dxworks.cobolscope.analyzer;

import java.util.List;
import java.util.Locale;

public final class Divisions {

    public static final String IDENTIFICATION = "IDENTIFICATION";
    public static final String ENVIRONMENT = "ENVIRONMENT";
    public static final String DATA = "DATA";
    public static final String PROCEDURE = "PROCEDURE";

    public static final List<String> REQUIRED_ORDER = List.of(IDENTIFICATION, ENVIRONMENT, DATA, PROCEDURE);

    private Divisions() {
    }

    /** "procedure division", "PROCEDURE" and "Procedure Division." all normalize to PROCEDURE. */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        if (upper.endsWith(".")) {
            upper = upper.substring(0, upper.length() - 1).trim();
        }
        if (upper.endsWith(" DIVISION")) {
            upper = upper.substring(0, upper.length() - " DIVISION".length()).trim();
        }
        if (upper.equals("ID")) {
            return IDENTIFICATION;
        }
        return upper;
    }
}
