package com.example.doisync.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Helpers for the JSON:API envelope used by the registry.
 */
public final class RegistryDocuments {

    private RegistryDocuments() {}

    public static JsonNode attributes(JsonNode document) {
        if (document == null) return null;
        JsonNode attrs = document.path("data").path("attributes");
        return attrs.isObject() ? attrs : null;
    }

    /**
     * Deep copy of {@code document} whose attributes node is guaranteed to be a mutable object.
     */
    public static ObjectNode copyForWrite(JsonNode document) {
        ObjectNode copy = document != null && document.isObject()
                ? ((ObjectNode) document).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        ObjectNode data = copy.path("data").isObject() ? (ObjectNode) copy.get("data") : copy.putObject("data");
        data.put("type", "dois");
        if (!data.path("attributes").isObject()) {
            data.putObject("attributes");
        }
        return copy;
    }

    public static ObjectNode writableAttributes(ObjectNode document) {
        return (ObjectNode) document.path("data").path("attributes");
    }

    public static ObjectNode envelope(ObjectNode attributes) {
        ObjectNode doc = JsonNodeFactory.instance.objectNode();
        ObjectNode data = doc.putObject("data");
        data.put("type", "dois");
        data.set("attributes", attributes);
        return doc;
    }
}
