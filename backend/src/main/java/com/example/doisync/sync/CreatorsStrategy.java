package com.example.doisync.sync;

import com.example.doisync.detect.ChangeDetector;
import com.example.doisync.detect.ChangeResult;
import com.example.doisync.detect.IdentifierNormalizer;
import com.example.doisync.local.LocalRecord;
import com.example.doisync.model.ContributorTypes;
import com.example.doisync.model.EntityDescriptor;
import com.example.doisync.model.Facet;
import com.example.doisync.registry.RegistryDocuments;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CreatorsStrategy implements FacetStrategy {

    static final String DEFAULT_SCHEME_URI = "https://orcid.org";

    @Override
    public Facet facet() {
        return Facet.CREATORS;
    }

    @Override
    public ChangeResult detect(JsonNode attributes, List<EntityDescriptor> desired) {
        return ChangeDetector.detectCreators(attributes, desired);
    }

    /**
     * Creators are stored as personal agents named "Last, First" with a bare ORCID.
     */
    @Override
    public List<LocalRecord> buildLocalRecords(List<EntityDescriptor> desired) {
        List<LocalRecord> out = new ArrayList<>();
        for (int i = 0; i < desired.size(); i++) {
            EntityDescriptor d = desired.get(i);
            String last = d.familyName();
            String first = d.givenName();
            String name = first.isEmpty() ? last : last + ", " + first;
            String orcid = IdentifierNormalizer.normalize(d.nameIdentifier());
            out.add(new LocalRecord(i + 1, name, first, last, orcid, orcid.isEmpty() ? null : IdentifierNormalizer.ORCID_SCHEME,
                    EntityDescriptor.PERSONAL, List.of(ContributorTypes.CREATOR_ROLE), null, null, null));
        }
        return out;
    }

    @Override
    public ObjectNode buildRemotePayload(ObjectNode cachedDocument, List<EntityDescriptor> desired) {
        ObjectNode doc = RegistryDocuments.copyForWrite(cachedDocument);
        ObjectNode attrs = RegistryDocuments.writableAttributes(doc);
        ArrayNode creators = attrs.putArray("creators");
        for (EntityDescriptor d : desired) {
            creators.add(toRegistryEntity(attrs, d));
        }
        return doc;
    }

    static ObjectNode toRegistryEntity(ObjectNode factory, EntityDescriptor d) {
        ObjectNode node = factory.objectNode();
        node.put("name", d.name());
        node.put("nameType", d.nameType());
        if (d.isPersonal()) {
            if (!d.givenName().isEmpty()) node.put("givenName", d.givenName());
            if (!d.familyName().isEmpty()) node.put("familyName", d.familyName());
        }
        if (!d.nameIdentifier().isEmpty()) {
            ObjectNode id = node.putArray("nameIdentifiers").addObject();
            id.put("nameIdentifier", d.nameIdentifier());
            id.put("nameIdentifierScheme", d.nameIdentifierScheme().isEmpty() ? IdentifierNormalizer.ORCID_SCHEME : d.nameIdentifierScheme());
            id.put("schemeUri", d.schemeUri().isEmpty() ? DEFAULT_SCHEME_URI : d.schemeUri());
        }
        return node;
    }
}
