package com.example.doisync.detect;

import com.example.doisync.model.EntityDescriptor;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Canonical five-field view of a publisher. The registry stores either a bare name
 * (legacy) or an object with identifier, scheme, schemeUri and lang.
 */
public record PublisherFields(String name, String identifier, String scheme, String schemeUri, String lang) {

    public PublisherFields {
        name = name == null ? "" : name;
        identifier = identifier == null ? "" : identifier;
        scheme = scheme == null ? "" : scheme;
        schemeUri = schemeUri == null ? "" : schemeUri;
        lang = lang == null ? "" : lang;
    }

    public static PublisherFields fromRemote(JsonNode publisher) {
        if (publisher == null || publisher.isMissingNode() || publisher.isNull()) {
            return new PublisherFields("", "", "", "", "");
        }
        if (publisher.isObject()) {
            return new PublisherFields(
                    publisher.path("name").asText(""),
                    publisher.path("publisherIdentifier").asText(""),
                    publisher.path("publisherIdentifierScheme").asText(""),
                    publisher.path("schemeUri").asText(""),
                    publisher.path("lang").asText(""));
        }
        return new PublisherFields(publisher.asText(""), "", "", "", "");
    }

    public static PublisherFields fromDescriptor(EntityDescriptor desired) {
        return new PublisherFields(desired.name(), desired.publisherIdentifier(), desired.publisherIdentifierScheme(),
                desired.schemeUri(), desired.lang());
    }

    public boolean hasExtendedFields() {
        return !identifier.isEmpty() || !scheme.isEmpty() || !schemeUri.isEmpty() || !lang.isEmpty();
    }
}
