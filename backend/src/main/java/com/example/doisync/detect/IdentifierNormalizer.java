package com.example.doisync.detect;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

public final class IdentifierNormalizer {

    public static final String ORCID_SCHEME = "ORCID";
    private static final String[] ORCID_PREFIXES = {"https://orcid.org/", "http://orcid.org/"};

    private IdentifierNormalizer() {}

    /**
     * Reduce an ORCID (URL or bare) to its bare token. Null or blank gives "".
     * Prefixes are stripped repeatedly so normalize(normalize(x)) == normalize(x).
     */
    public static String normalize(String value) {
        if (value == null) return "";
        String v = value.trim();
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String prefix : ORCID_PREFIXES) {
                if (v.startsWith(prefix)) {
                    v = v.substring(prefix.length()).trim();
                    stripped = true;
                }
            }
        }
        return v;
    }

    /**
     * Normalized identifier of a registry person/organisation node for the given scheme
     * (ORCID when scheme is blank); "" when none is present.
     */
    public static String extract(JsonNode entity, String scheme) {
        if (entity == null) return "";
        String wanted = scheme == null || scheme.isBlank() ? ORCID_SCHEME : scheme.trim();
        for (JsonNode id : entity.path("nameIdentifiers")) {
            String s = id.path("nameIdentifierScheme").asText("");
            if (s.toUpperCase(Locale.ROOT).equals(wanted.toUpperCase(Locale.ROOT))) {
                return normalize(id.path("nameIdentifier").asText(""));
            }
        }
        return "";
    }

    public static String extractOrcid(JsonNode entity) {
        return extract(entity, ORCID_SCHEME);
    }
}
