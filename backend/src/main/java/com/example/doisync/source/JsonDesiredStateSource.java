package com.example.doisync.source;

import com.example.doisync.model.EntityDescriptor;
import com.example.doisync.model.Facet;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@code {"entries": {"<doi>": [ {row}, ... ]}}} request bodies.
 */
@Component
public class JsonDesiredStateSource implements DesiredStateSource<JsonNode> {

    @Override
    public ParsedDesiredState parse(Facet facet, JsonNode source) {
        if (source == null || !source.path("entries").isObject()) {
            throw new InvalidDesiredStateException("Request body must contain an 'entries' object keyed by DOI");
        }
        Map<String, List<EntityDescriptor>> entries = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        source.get("entries").fields().forEachRemaining(field -> {
            String doi = field.getKey() == null ? "" : field.getKey().trim();
            if (doi.isEmpty()) {
                warnings.add("Entry with blank DOI ignored");
                return;
            }
            List<JsonNode> rows = rowsOf(facet, field.getValue());
            if (rows == null) {
                warnings.add(doi + ": expected a list of rows, entry ignored");
                return;
            }
            List<EntityDescriptor> parsed = new ArrayList<>();
            for (int i = 0; i < rows.size(); i++) {
                EntityDescriptor row = toDescriptor(facet, rows.get(i));
                if (row.name().isEmpty()) {
                    warnings.add(doi + ": row " + (i + 1) + " has no name and was ignored");
                    continue;
                }
                parsed.add(row);
            }
            if (entries.containsKey(doi)) {
                warnings.add(doi + ": duplicate entry, last one wins");
            }
            entries.put(doi, parsed);
        });
        return new ParsedDesiredState(entries, warnings);
    }

    private static List<JsonNode> rowsOf(Facet facet, JsonNode value) {
        List<JsonNode> rows = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(rows::add);
            return rows;
        }
        // a publisher may be given as a single object
        if (facet == Facet.PUBLISHER && value.isObject()) {
            rows.add(value);
            return rows;
        }
        return null;
    }

    static EntityDescriptor toDescriptor(Facet facet, JsonNode row) {
        if (facet == Facet.PUBLISHER) {
            return EntityDescriptor.publisher(text(row, "name"), text(row, "publisherIdentifier"),
                    text(row, "publisherIdentifierScheme"), text(row, "schemeUri"), text(row, "lang"));
        }
        String name = text(row, "name");
        String given = text(row, "givenName");
        String family = text(row, "familyName");
        if (name.isEmpty() && !family.isEmpty()) {
            name = given.isEmpty() ? family : family + ", " + given;
        }
        return new EntityDescriptor(name, text(row, "nameType"), given, family,
                text(row, "nameIdentifier"), text(row, "nameIdentifierScheme"), text(row, "schemeUri"),
                facet == Facet.CONTRIBUTORS ? contributorTypes(row.get("contributorTypes")) : List.of(),
                text(row, "email"), text(row, "website"), text(row, "position"),
                null, null, null);
    }

    /**
     * Accepts a JSON list or a comma-separated string.
     */
    static List<String> contributorTypes(JsonNode node) {
        List<String> types = new ArrayList<>();
        if (node == null || node.isNull()) return types;
        if (node.isArray()) {
            node.forEach(t -> {
                String v = t.asText("").trim();
                if (!v.isEmpty()) types.add(v);
            });
            return types;
        }
        for (String part : node.asText("").split(",")) {
            if (!part.trim().isEmpty()) types.add(part.trim());
        }
        return types;
    }

    private static String text(JsonNode row, String field) {
        JsonNode v = row.get(field);
        return v == null || v.isNull() ? "" : v.asText("");
    }
}
