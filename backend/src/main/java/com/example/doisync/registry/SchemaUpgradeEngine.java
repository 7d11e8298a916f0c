package com.example.doisync.registry;

import com.example.doisync.config.DoiSyncProperties;
import com.example.doisync.model.ContributorTypes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repairs registry documents that were rejected because they still carry legacy schema
 * declarations, and assesses whether a document can be moved to the current kernel-4 schema.
 * <p>
 * The engine never talks to the registry itself; {@link DataCiteMetadataStore} re-fetches
 * the document and re-issues the write.
 */
@Component
public class SchemaUpgradeEngine {
    private static final Logger log = LoggerFactory.getLogger(SchemaUpgradeEngine.class);

    static final String CURRENT_MINOR = "kernel-4.6";
    private static final Set<String> NAME_TYPES = Set.of("Personal", "Organizational");

    private final DoiSyncProperties.Upgrade upgrade;
    private final DoiSyncProperties.Registry registry;

    public SchemaUpgradeEngine(DoiSyncProperties properties) {
        this.upgrade = properties.getUpgrade();
        this.registry = properties.getRegistry();
    }

    /**
     * Mandatory fields the engine cannot fill in, in reporting order.
     */
    public static List<String> nonAutofillableMissing(JsonNode attributes) {
        List<String> missing = new ArrayList<>();
        if (!hasNonEmptyTitle(attributes)) missing.add("title");
        if (!hasElements(attributes, "creators")) missing.add("creators");
        return missing;
    }

    /**
     * Build the document to re-issue after a 422 with an upgrade trigger.
     *
     * @param refetched   freshly fetched registry document, used to judge which fields are missing
     * @param pendingWrite the rejected write; repairs are merged into a copy of it
     */
    public UpgradePlan plan(String doi, UpgradeTrigger trigger, JsonNode refetched, JsonNode pendingWrite) {
        if (trigger == UpgradeTrigger.DEPRECATED_SCHEMA) {
            // kernel-4 makes title and creators mandatory; a version stamp alone does not
            List<String> missing = nonAutofillableMissing(RegistryDocuments.attributes(refetched));
            if (!missing.isEmpty()) {
                return UpgradePlan.aborted(manualEditMessage(doi, missing));
            }
        }

        ObjectNode merged = RegistryDocuments.copyForWrite(pendingWrite);
        ObjectNode attrs = RegistryDocuments.writableAttributes(merged);
        List<String> repairs = new ArrayList<>();

        if (trigger == UpgradeTrigger.DEPRECATED_SCHEMA) {
            if (attrs.path("types").path("resourceTypeGeneral").asText("").isBlank()) {
                ObjectNode types = attrs.path("types").isObject() ? (ObjectNode) attrs.get("types") : attrs.putObject("types");
                types.put("resourceTypeGeneral", upgrade.getDefaultResourceTypeGeneral());
                repairs.add("resourceTypeGeneral set to " + upgrade.getDefaultResourceTypeGeneral());
            }
            if (!hasPublisherName(attrs.get("publisher"))) {
                attrs.put("publisher", upgrade.getDefaultPublisher());
                repairs.add("publisher set to " + upgrade.getDefaultPublisher());
            }
        }

        int moved = migrateFunders(attrs);
        if (moved > 0) {
            repairs.add(moved + " Funder contributor(s) moved to fundingReferences");
        }
        attrs.put("schemaVersion", upgrade.getSchemaVersion());
        repairs.add("schemaVersion set to " + upgrade.getSchemaVersion());
        log.info("Prepared schema upgrade for {} ({}): {}", doi, trigger, repairs);
        return UpgradePlan.ready(merged, repairs);
    }

    /**
     * Report for a "can't be blank" rejection, or {@code null} when the refetched document
     * shows none of the fields a human has to supply.
     */
    public String blankFieldsMessage(String doi, JsonNode refetched) {
        List<String> missing = nonAutofillableMissing(RegistryDocuments.attributes(refetched));
        return missing.isEmpty() ? null : manualEditMessage(doi, missing);
    }

    public String editorLink(String doi) {
        String base = registry.getEditorBaseUrl();
        if (!base.endsWith("/")) base = base + "/";
        return base + doi;
    }

    private String manualEditMessage(String doi, List<String> missing) {
        return "DOI " + doi + " cannot be upgraded to schema 4 automatically: missing mandatory field(s) "
                + String.join(", ", missing) + ". Please complete them in the registry editor: " + editorLink(doi);
    }

    /**
     * Moves contributors typed {@code Funder} into {@code fundingReferences}. Returns how many moved.
     */
    static int migrateFunders(ObjectNode attrs) {
        JsonNode contributors = attrs.get("contributors");
        if (contributors == null || !contributors.isArray()) return 0;
        ArrayNode kept = attrs.arrayNode();
        List<ObjectNode> funding = new ArrayList<>();
        for (JsonNode c : contributors) {
            if (!ContributorTypes.FUNDER.equals(c.path("contributorType").asText(""))) {
                kept.add(c);
                continue;
            }
            ObjectNode ref = attrs.objectNode();
            ref.put("funderName", c.path("name").asText(""));
            JsonNode firstId = c.path("nameIdentifiers").path(0);
            String identifier = firstId.path("nameIdentifier").asText("");
            if (!identifier.isEmpty()) {
                ref.put("funderIdentifier", identifier);
                String type = firstId.path("nameIdentifierScheme").asText("");
                if (!type.isEmpty()) ref.put("funderIdentifierType", type);
            }
            funding.add(ref);
        }
        if (funding.isEmpty()) return 0;

        ArrayNode refs = attrs.path("fundingReferences").isArray()
                ? (ArrayNode) attrs.get("fundingReferences")
                : attrs.putArray("fundingReferences");
        funding.forEach(refs::add);
        if (kept.isEmpty()) {
            attrs.remove("contributors");
        } else {
            attrs.set("contributors", kept);
        }
        return funding.size();
    }

    /**
     * Schema-4 readiness of a fetched document.
     */
    public SchemaAssessment assess(String doi, JsonNode document) {
        JsonNode attrs = RegistryDocuments.attributes(document);
        String schema = attrs == null ? "" : attrs.path("schemaVersion").asText("");
        String shown = schema.isEmpty() ? "unknown" : schema;
        if (schema.contains(CURRENT_MINOR)) {
            return new SchemaAssessment(doi, shown, SchemaAssessment.Status.ALREADY_CURRENT,
                    List.of("Already on schema 4.6"), Map.of(), 0);
        }
        if (attrs == null) {
            return new SchemaAssessment(doi, shown, SchemaAssessment.Status.NOT_UPGRADEABLE,
                    List.of("No metadata available"), Map.of(), 0);
        }

        Map<String, Object> missing = new LinkedHashMap<>();
        List<String> reasons = new ArrayList<>();

        JsonNode publisher = attrs.get("publisher");
        if (publisher == null || publisher.isNull()) {
            missing.put("publisher", "missing");
            reasons.add("Publisher missing");
        } else if (!hasPublisherName(publisher)) {
            missing.put("publisher", "empty");
            reasons.add(publisher.isObject() ? "Publisher name missing" : "Publisher is empty");
        }
        if (attrs.path("publicationYear").asText("").isBlank()) {
            missing.put("publicationYear", "missing");
            reasons.add("Publication year missing");
        }
        if (!hasElements(attrs, "titles")) {
            missing.put("titles", "missing");
            reasons.add("Title missing");
        } else if (!hasNonEmptyTitle(attrs)) {
            missing.put("titles", "empty");
            reasons.add("All titles are empty");
        }
        if (!hasElements(attrs, "creators")) {
            missing.put("creators", "missing");
            reasons.add("Creators missing");
        } else {
            int i = 0;
            for (JsonNode creator : attrs.get("creators")) {
                i++;
                String nameType = creator.path("nameType").asText("");
                if (!nameType.isEmpty() && !NAME_TYPES.contains(nameType)) {
                    missing.put("creators", "invalid nameType");
                    reasons.add("Creator " + i + " has invalid nameType '" + nameType + "'");
                }
            }
        }
        if (attrs.path("types").path("resourceTypeGeneral").asText("").isBlank()) {
            missing.put("resourceTypeGeneral", "missing");
            reasons.add("resourceTypeGeneral missing");
        }

        int funders = 0;
        List<String> invalidTypes = new ArrayList<>();
        for (JsonNode c : attrs.path("contributors")) {
            String type = c.path("contributorType").asText("");
            if (ContributorTypes.FUNDER.equals(type)) {
                funders++;
            } else if (!type.isEmpty() && !ContributorTypes.isRegistryType(type)) {
                invalidTypes.add(type);
            }
        }
        if (!invalidTypes.isEmpty()) {
            missing.put("contributorTypes", invalidTypes);
            reasons.add("Unknown contributor type(s): " + String.join(", ", invalidTypes));
        }

        if (!reasons.isEmpty()) {
            return new SchemaAssessment(doi, shown, SchemaAssessment.Status.NOT_UPGRADEABLE, reasons, missing, funders);
        }
        String note = "All mandatory fields present";
        if (funders > 0) {
            note += "; " + funders + " Funder contributor(s) to move to fundingReferences";
        }
        return new SchemaAssessment(doi, shown, SchemaAssessment.Status.UPGRADEABLE, List.of(note), Map.of(), funders);
    }

    private static boolean hasNonEmptyTitle(JsonNode attrs) {
        if (attrs == null) return false;
        for (JsonNode t : attrs.path("titles")) {
            if (!t.path("title").asText("").isBlank()) return true;
        }
        return false;
    }

    private static boolean hasElements(JsonNode attrs, String field) {
        return attrs != null && attrs.path(field).isArray() && attrs.path(field).size() > 0;
    }

    private static boolean hasPublisherName(JsonNode publisher) {
        if (publisher == null || publisher.isNull()) return false;
        if (publisher.isObject()) return !publisher.path("name").asText("").isBlank();
        return !publisher.asText("").isBlank();
    }
}
