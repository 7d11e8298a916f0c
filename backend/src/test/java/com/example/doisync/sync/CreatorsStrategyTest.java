package com.example.doisync.sync;

import com.example.doisync.local.LocalRecord;
import com.example.doisync.model.EntityDescriptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CreatorsStrategyTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final CreatorsStrategy strategy = new CreatorsStrategy();

    @Test
    void localRecordsUseLastCommaFirstAndBareOrcid() {
        List<LocalRecord> rows = strategy.buildLocalRecords(List.of(
                EntityDescriptor.person("Doe, Jane", "Jane", "Doe", "https://orcid.org/0000-0001-5000-0007"),
                EntityDescriptor.person("Roe", "", "Roe", "")));

        assertThat(rows).hasSize(2);
        LocalRecord first = rows.get(0);
        assertThat(first.order()).isEqualTo(1);
        assertThat(first.name()).isEqualTo("Doe, Jane");
        assertThat(first.identifier()).isEqualTo("0000-0001-5000-0007");
        assertThat(first.identifierType()).isEqualTo("ORCID");
        assertThat(first.nameType()).isEqualTo("Personal");
        assertThat(first.roles()).containsExactly("Creator");

        LocalRecord second = rows.get(1);
        assertThat(second.name()).isEqualTo("Roe");
        assertThat(second.identifier()).isEmpty();
        assertThat(second.identifierType()).isEmpty();
    }

    @Test
    void payloadReplacesCreatorsAndLeavesCacheUntouched() throws Exception {
        ObjectNode cached = (ObjectNode) mapper.readTree("{\"data\":{\"id\":\"10.5880/x\",\"type\":\"dois\",\"attributes\":{"
                + "\"titles\":[{\"title\":\"T\"}],\"creators\":[{\"name\":\"Old\"}]}}}");
        String before = cached.toString();

        ObjectNode payload = strategy.buildRemotePayload(cached, List.of(
                EntityDescriptor.person("Doe, Jane", "Jane", "Doe", "0000-0001-5000-0007"),
                EntityDescriptor.organization("GFZ", "")));

        assertThat(cached.toString()).isEqualTo(before);
        ObjectNode attrs = (ObjectNode) payload.path("data").path("attributes");
        assertThat(attrs.path("titles").get(0).path("title").asText()).isEqualTo("T");
        assertThat(attrs.path("creators")).hasSize(2);
        assertThat(attrs.path("creators").get(0).path("givenName").asText()).isEqualTo("Jane");
        assertThat(attrs.path("creators").get(0).path("nameIdentifiers").get(0).path("nameIdentifierScheme").asText()).isEqualTo("ORCID");
        assertThat(attrs.path("creators").get(0).path("nameIdentifiers").get(0).path("schemeUri").asText()).isEqualTo("https://orcid.org");
        assertThat(attrs.path("creators").get(1).has("givenName")).isFalse();
        assertThat(attrs.path("creators").get(1).has("nameIdentifiers")).isFalse();
    }
}
