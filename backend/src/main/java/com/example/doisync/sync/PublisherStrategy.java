package com.example.doisync.sync;

import com.example.doisync.detect.ChangeDetector;
import com.example.doisync.detect.ChangeResult;
import com.example.doisync.detect.PublisherFields;
import com.example.doisync.local.LocalRecord;
import com.example.doisync.model.EntityDescriptor;
import com.example.doisync.model.Facet;
import com.example.doisync.registry.RegistryDocuments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PublisherStrategy implements FacetStrategy {

    @Override
    public Facet facet() {
        return Facet.PUBLISHER;
    }

    @Override
    public ChangeResult detect(JsonNode attributes, List<EntityDescriptor> desired) {
        return ChangeDetector.detectPublisher(attributes, single(desired));
    }

    @Override
    public List<LocalRecord> buildLocalRecords(List<EntityDescriptor> desired) {
        return List.of(LocalRecord.publisher(single(desired).name()));
    }

    /**
     * Object form when any extended field is set, plain string otherwise.
     */
    @Override
    public ObjectNode buildRemotePayload(ObjectNode cachedDocument, List<EntityDescriptor> desired) {
        PublisherFields wanted = PublisherFields.fromDescriptor(single(desired));
        if (wanted.name().isEmpty()) {
            throw new IllegalArgumentException("Publisher name is empty");
        }
        ObjectNode doc = RegistryDocuments.copyForWrite(cachedDocument);
        ObjectNode attrs = RegistryDocuments.writableAttributes(doc);
        if (!wanted.hasExtendedFields()) {
            attrs.put("publisher", wanted.name());
            return doc;
        }
        ObjectNode publisher = attrs.putObject("publisher");
        publisher.put("name", wanted.name());
        if (!wanted.identifier().isEmpty()) publisher.put("publisherIdentifier", wanted.identifier());
        if (!wanted.scheme().isEmpty()) publisher.put("publisherIdentifierScheme", wanted.scheme());
        if (!wanted.schemeUri().isEmpty()) publisher.put("schemeUri", wanted.schemeUri());
        if (!wanted.lang().isEmpty()) publisher.put("lang", wanted.lang());
        return doc;
    }

    private static EntityDescriptor single(List<EntityDescriptor> desired) {
        if (desired == null || desired.isEmpty()) {
            return EntityDescriptor.publisher("", null, null, null, null);
        }
        return desired.get(0);
    }
}
