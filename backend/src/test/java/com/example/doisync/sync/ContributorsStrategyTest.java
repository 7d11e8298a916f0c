package com.example.doisync.sync;

import com.example.doisync.local.LocalRecord;
import com.example.doisync.model.EntityDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContributorsStrategyTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ContributorsStrategy strategy = new ContributorsStrategy();

    @Test
    void rolesCollapseUnknownTypesIntoOther() {
        assertThat(ContributorsStrategy.localRoles(List.of("ContactPerson", "Bogus", "Wizard", "DataCurator")))
                .containsExactly("ContactPerson", "Other", "DataCurator");
        assertThat(ContributorsStrategy.localRoles(List.of())).containsExactly("Other");
        assertThat(ContributorsStrategy.localRoles(List.of("pointOfContact"))).containsExactly("pointOfContact");
    }

    @Test
    void localRecordsCarryContactInfoOnlyForContactPersons() {
        List<LocalRecord> rows = strategy.buildLocalRecords(List.of(
                EntityDescriptor.person("Doe, Jane", "Jane", "Doe", "https://orcid.org/0000-0001-5000-0007")
                        .withContributorTypes(List.of("ContactPerson"))
                        .withContactInfo("jane@example.org", "https://example.org", "Lead"),
                EntityDescriptor.organization("GFZ", "https://ror.org/04z8jg394")
                        .withContributorTypes(List.of("HostingInstitution"))
                        .withContactInfo("info@gfz.de", "", "")));

        LocalRecord jane = rows.get(0);
        assertThat(jane.identifier()).isEqualTo("0000-0001-5000-0007");
        assertThat(jane.identifierType()).isEqualTo("ORCID");
        assertThat(jane.firstname()).isEqualTo("Jane");
        assertThat(jane.email()).isEqualTo("jane@example.org");
        assertThat(jane.hasContactInfo()).isTrue();

        LocalRecord gfz = rows.get(1);
        assertThat(gfz.identifierType()).isEqualTo("ROR");
        assertThat(gfz.firstname()).isEmpty();
        assertThat(gfz.lastname()).isEmpty();
        assertThat(gfz.hasContactInfo()).isFalse();
    }

    @Test
    void payloadRebuildsMatchedEntriesAndKeepsOthers() throws Exception {
        ObjectNode cached = (ObjectNode) mapper.readTree("{\"data\":{\"type\":\"dois\",\"attributes\":{\"contributors\":["
                + "{\"name\":\"Doe, J.\",\"contributorType\":\"Other\",\"affiliation\":[{\"name\":\"GFZ\"}],"
                + "\"nameIdentifiers\":[{\"nameIdentifier\":\"https://orcid.org/0000-0001-5000-0007\",\"nameIdentifierScheme\":\"ORCID\"}]},"
                + "{\"name\":\"Roe, Rick\",\"contributorType\":\"Editor\"},"
                + "{\"name\":\"Untouched Person\",\"contributorType\":\"Researcher\"}]}}}");

        ObjectNode payload = strategy.buildRemotePayload(cached, List.of(
                EntityDescriptor.person("Doe, Jane", "Jane", "Doe", "0000-0001-5000-0007")
                        .withContributorTypes(List.of("ContactPerson"))
                        .withContactInfo("jane@example.org", "", ""),
                EntityDescriptor.person("roe, rick", "Rick", "Roe", "")
                        .withContributorTypes(List.of("NotAType"))));

        JsonNode contributors = payload.path("data").path("attributes").path("contributors");
        assertThat(contributors).hasSize(3);
        assertThat(contributors.get(0).path("name").asText()).isEqualTo("Doe, Jane");
        assertThat(contributors.get(0).path("contributorType").asText()).isEqualTo("ContactPerson");
        assertThat(contributors.get(0).path("affiliation").get(0).path("name").asText()).isEqualTo("GFZ");
        assertThat(contributors.get(0).has("email")).isFalse();
        assertThat(contributors.get(1).path("contributorType").asText()).isEqualTo("Other");
        assertThat(contributors.get(2).path("name").asText()).isEqualTo("Untouched Person");
        assertThat(contributors.get(2).path("contributorType").asText()).isEqualTo("Researcher");
    }
}
