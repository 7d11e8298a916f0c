package com.example.doisync.detect;

import com.example.doisync.model.ContributorTypes;
import com.example.doisync.model.EntityDescriptor;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether desired facet values differ from the live registry attributes.
 * All methods are side-effect free; {@code attributes} is the {@code data.attributes} node of a registry document.
 */
public final class ChangeDetector {

    public static final String INVALID_STRUCTURE = "metadata structure invalid (update required)";
    public static final String CREATORS_UNCHANGED = "Creators: no changes";
    public static final String CONTRIBUTORS_UNCHANGED = "Contributors: no changes";
    public static final String PUBLISHER_UNCHANGED = "Publisher: no changes";

    private ChangeDetector() {}

    public static ChangeResult detectCreators(JsonNode attributes, List<EntityDescriptor> desired) {
        if (!isObject(attributes)) return ChangeResult.changed(INVALID_STRUCTURE);
        List<JsonNode> remote = elements(attributes.path("creators"));
        if (remote.size() != desired.size()) {
            return ChangeResult.changed(String.format("Creator count differs (remote: %d, desired: %d)", remote.size(), desired.size()));
        }
        if (remote.isEmpty()) {
            return ChangeResult.unchanged(CREATORS_UNCHANGED + " (none present)");
        }
        List<String> diffs = new ArrayList<>();
        for (int i = 0; i < desired.size(); i++) {
            String label = "Creator " + (i + 1);
            JsonNode current = remote.get(i);
            EntityDescriptor wanted = desired.get(i);
            if (!text(current, "name", "").equals(wanted.name())) {
                diffs.add(label + ": name changed");
            }
            comparePersonFields(label, current, wanted, diffs);
        }
        return ChangeResult.fromDiffs(diffs, CREATORS_UNCHANGED);
    }

    /**
     * Contributors are matched by name rather than position; their order carries no meaning.
     * Local-only contact attributes always count as a change because the registry never holds them.
     */
    public static ChangeResult detectContributors(JsonNode attributes, List<EntityDescriptor> desired) {
        if (!isObject(attributes)) return ChangeResult.changed(INVALID_STRUCTURE);
        List<JsonNode> remote = elements(attributes.path("contributors"));
        if (remote.size() != desired.size()) {
            return ChangeResult.changed(String.format("Contributor count differs (remote: %d, desired: %d)", remote.size(), desired.size()));
        }
        if (remote.isEmpty()) {
            return ChangeResult.unchanged(CONTRIBUTORS_UNCHANGED + " (none present)");
        }
        List<String> diffs = new ArrayList<>();
        List<String> localOnly = new ArrayList<>();
        for (int i = 0; i < desired.size(); i++) {
            EntityDescriptor wanted = desired.get(i);
            String label = "Contributor " + (i + 1);
            JsonNode current = findByName(remote, wanted.name());
            if (current == null) {
                diffs.add("Contributor '" + wanted.name() + "': not found in remote");
            } else {
                comparePersonFields(label, current, wanted, diffs);
                String remoteType = text(current, "contributorType", "");
                if (!remoteType.equals(ContributorTypes.registryTypeFor(wanted.contributorTypes()))) {
                    diffs.add(label + ": contributorType changed");
                }
            }
            if (!wanted.email().isEmpty()) localOnly.add(label + ": email (local only)");
            if (!wanted.website().isEmpty()) localOnly.add(label + ": website (local only)");
            if (!wanted.position().isEmpty()) localOnly.add(label + ": position (local only)");
        }
        diffs.addAll(localOnly);
        return ChangeResult.fromDiffs(diffs, CONTRIBUTORS_UNCHANGED);
    }

    public static ChangeResult detectPublisher(JsonNode attributes, EntityDescriptor desired) {
        if (!isObject(attributes)) return ChangeResult.changed(INVALID_STRUCTURE);
        PublisherFields current = PublisherFields.fromRemote(attributes.get("publisher"));
        PublisherFields wanted = PublisherFields.fromDescriptor(desired);
        List<String> diffs = new ArrayList<>();
        addFieldDiff(diffs, "Name", current.name(), wanted.name());
        addFieldDiff(diffs, "Identifier", current.identifier(), wanted.identifier());
        addFieldDiff(diffs, "Scheme", current.scheme(), wanted.scheme());
        addFieldDiff(diffs, "SchemeURI", current.schemeUri(), wanted.schemeUri());
        addFieldDiff(diffs, "Language", current.lang(), wanted.lang());
        return ChangeResult.fromDiffs(diffs, PUBLISHER_UNCHANGED);
    }

    static JsonNode findByName(List<JsonNode> remote, String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (JsonNode node : remote) {
            if (text(node, "name", "").trim().toLowerCase(Locale.ROOT).equals(key)) {
                return node;
            }
        }
        return null;
    }

    private static void comparePersonFields(String label, JsonNode current, EntityDescriptor wanted, List<String> diffs) {
        if (!text(current, "nameType", EntityDescriptor.PERSONAL).equals(wanted.nameType())) {
            diffs.add(label + ": nameType changed");
        }
        if (wanted.isPersonal()) {
            if (!text(current, "givenName", "").equals(wanted.givenName())) {
                diffs.add(label + ": givenName changed");
            }
            if (!text(current, "familyName", "").equals(wanted.familyName())) {
                diffs.add(label + ": familyName changed");
            }
        }
        String remoteId = IdentifierNormalizer.extract(current, wanted.nameIdentifierScheme());
        if (!remoteId.equals(IdentifierNormalizer.normalize(wanted.nameIdentifier()))) {
            diffs.add(label + ": identifier changed");
        }
    }

    private static void addFieldDiff(List<String> diffs, String field, String current, String wanted) {
        if (!current.equals(wanted)) {
            diffs.add(field + ": '" + current + "' → '" + wanted + "'");
        }
    }

    static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> out = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(out::add);
        }
        return out;
    }

    static String text(JsonNode node, String field, String fallback) {
        JsonNode v = node == null ? null : node.get(field);
        if (v == null || v.isNull()) return fallback;
        return v.asText(fallback);
    }

    private static boolean isObject(JsonNode node) {
        return node != null && node.isObject();
    }
}
