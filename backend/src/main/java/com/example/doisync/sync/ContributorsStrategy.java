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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class ContributorsStrategy implements FacetStrategy {
    private static final Logger log = LoggerFactory.getLogger(ContributorsStrategy.class);

    static final String ROR_SCHEME = "ROR";

    @Override
    public Facet facet() {
        return Facet.CONTRIBUTORS;
    }

    @Override
    public ChangeResult detect(JsonNode attributes, List<EntityDescriptor> desired) {
        return ChangeDetector.detectContributors(attributes, desired);
    }

    @Override
    public List<LocalRecord> buildLocalRecords(List<EntityDescriptor> desired) {
        List<LocalRecord> out = new ArrayList<>();
        for (int i = 0; i < desired.size(); i++) {
            EntityDescriptor d = desired.get(i);
            String identifier = IdentifierNormalizer.normalize(d.nameIdentifier());
            String identifierType = identifier.isEmpty() ? null
                    : identifier.contains("ror.org") ? ROR_SCHEME : IdentifierNormalizer.ORCID_SCHEME;
            List<String> roles = localRoles(d.contributorTypes());
            boolean contact = roles.contains(ContributorTypes.CONTACT_PERSON);
            out.add(new LocalRecord(i + 1, d.name(),
                    d.isPersonal() ? d.givenName() : null,
                    d.isPersonal() ? d.familyName() : null,
                    identifier, identifierType, d.nameType(), roles,
                    contact ? d.email() : null,
                    contact ? d.website() : null,
                    contact ? d.position() : null));
        }
        return out;
    }

    /**
     * One role per valid type; unknown types collapse into a single "Other".
     */
    static List<String> localRoles(List<String> types) {
        Set<String> roles = new LinkedHashSet<>();
        for (String t : types) {
            String type = t == null ? "" : t.trim();
            if (type.isEmpty()) continue;
            if (ContributorTypes.isLocalRole(type)) {
                roles.add(type);
            } else {
                log.warn("Unknown contributor type '{}', storing as {}", type, ContributorTypes.OTHER);
                roles.add(ContributorTypes.OTHER);
            }
        }
        if (roles.isEmpty()) roles.add(ContributorTypes.OTHER);
        return new ArrayList<>(roles);
    }

    /**
     * Rebuilds remote contributors that match a desired entry (ORCID first, then name) and keeps
     * every unmatched remote contributor as it is. Contact details never leave the local database.
     */
    @Override
    public ObjectNode buildRemotePayload(ObjectNode cachedDocument, List<EntityDescriptor> desired) {
        ObjectNode doc = RegistryDocuments.copyForWrite(cachedDocument);
        ObjectNode attrs = RegistryDocuments.writableAttributes(doc);
        JsonNode remote = attrs.path("contributors");
        ArrayNode rebuilt = attrs.arrayNode();
        int updated = 0;
        for (JsonNode current : remote) {
            EntityDescriptor match = findMatch(current, desired);
            if (match == null) {
                rebuilt.add(current);
                continue;
            }
            ObjectNode node = CreatorsStrategy.toRegistryEntity(attrs, match);
            node.put("contributorType", ContributorTypes.registryTypeFor(match.contributorTypes()));
            if (current.has("affiliation")) {
                node.set("affiliation", current.get("affiliation"));
            }
            rebuilt.add(node);
            updated++;
        }
        attrs.set("contributors", rebuilt);
        log.debug("Contributor payload: {} of {} remote contributors rebuilt", updated, remote.size());
        return doc;
    }

    static EntityDescriptor findMatch(JsonNode remote, List<EntityDescriptor> desired) {
        String remoteName = remote.path("name").asText("").trim().toLowerCase(Locale.ROOT);
        String remoteOrcid = IdentifierNormalizer.extractOrcid(remote);
        for (EntityDescriptor d : desired) {
            String orcid = IdentifierNormalizer.normalize(d.nameIdentifier());
            if (!orcid.isEmpty() && !remoteOrcid.isEmpty() && orcid.equals(remoteOrcid)) {
                return d;
            }
            if (d.name().toLowerCase(Locale.ROOT).equals(remoteName)) {
                return d;
            }
        }
        return null;
    }
}
