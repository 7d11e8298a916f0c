package com.example.doisync.detect;

import com.example.doisync.model.EntityDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChangeDetectorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode attrs(String json) throws Exception {
        return mapper.readTree(json);
    }

    private static final String TWO_CREATORS = "{\"creators\":["
            + "{\"name\":\"Doe, Jane\",\"nameType\":\"Personal\",\"givenName\":\"Jane\",\"familyName\":\"Doe\","
            + "\"nameIdentifiers\":[{\"nameIdentifier\":\"https://orcid.org/0000-0001-5000-0007\",\"nameIdentifierScheme\":\"ORCID\"}]},"
            + "{\"name\":\"Roe, Rick\",\"nameType\":\"Personal\",\"givenName\":\"Rick\",\"familyName\":\"Roe\"}]}";

    @Test
    void identicalCreatorsAreUnchanged() throws Exception {
        List<EntityDescriptor> desired = List.of(
                EntityDescriptor.person("Doe, Jane", "Jane", "Doe", "0000-0001-5000-0007"),
                EntityDescriptor.person("Roe, Rick", "Rick", "Roe", ""));

        ChangeResult result = ChangeDetector.detectCreators(attrs(TWO_CREATORS), desired);

        assertThat(result.hasChanges()).isFalse();
        assertThat(result.description()).contains("no changes");
    }

    @Test
    void creatorCountMismatchNamesBothCounts() throws Exception {
        ChangeResult result = ChangeDetector.detectCreators(attrs(TWO_CREATORS),
                List.of(EntityDescriptor.person("Doe, Jane", "Jane", "Doe", "0000-0001-5000-0007")));

        assertThat(result.hasChanges()).isTrue();
        assertThat(result.description()).isEqualTo("Creator count differs (remote: 2, desired: 1)");
    }

    @Test
    void bothEmptyIsUnchanged() throws Exception {
        ChangeResult result = ChangeDetector.detectCreators(attrs("{\"creators\":[]}"), List.of());
        assertThat(result.hasChanges()).isFalse();
    }

    @Test
    void positionalDiffsAreLabelledAndCapped() throws Exception {
        List<EntityDescriptor> desired = List.of(
                EntityDescriptor.person("Doe, Janet", "Janet", "Doe", "0000-0009-9999-9999"),
                EntityDescriptor.person("Roe, Richard", "Richard", "Roe", ""));

        ChangeResult result = ChangeDetector.detectCreators(attrs(TWO_CREATORS), desired);

        assertThat(result.hasChanges()).isTrue();
        assertThat(result.description())
                .startsWith("Creator 1: name changed; Creator 1: givenName changed; Creator 1: identifier changed")
                .endsWith("(+ 2 more)");
    }

    @Test
    void givenAndFamilyIgnoredForOrganizations() throws Exception {
        JsonNode remote = attrs("{\"creators\":[{\"name\":\"GFZ\",\"nameType\":\"Organizational\",\"givenName\":\"x\"}]}");
        ChangeResult result = ChangeDetector.detectCreators(remote, List.of(EntityDescriptor.organization("GFZ", "")));
        assertThat(result.hasChanges()).isFalse();
    }

    @Test
    void missingAttributesMeansInvalidStructure() throws Exception {
        ChangeResult result = ChangeDetector.detectCreators(null, List.of());
        assertThat(result.hasChanges()).isTrue();
        assertThat(result.description()).isEqualTo(ChangeDetector.INVALID_STRUCTURE);
    }

    @Test
    void contributorsMatchByNameRegardlessOfOrder() throws Exception {
        JsonNode remote = attrs("{\"contributors\":["
                + "{\"name\":\"Roe, Rick\",\"nameType\":\"Personal\",\"givenName\":\"Rick\",\"familyName\":\"Roe\",\"contributorType\":\"DataCurator\"},"
                + "{\"name\":\"Doe, Jane\",\"nameType\":\"Personal\",\"givenName\":\"Jane\",\"familyName\":\"Doe\",\"contributorType\":\"ContactPerson\"}]}");
        List<EntityDescriptor> desired = List.of(
                EntityDescriptor.person(" doe, jane ", "Jane", "Doe", "").withContributorTypes(List.of("ContactPerson", "DataManager")),
                EntityDescriptor.person("Roe, Rick", "Rick", "Roe", "").withContributorTypes(List.of("DataCurator")));

        ChangeResult result = ChangeDetector.detectContributors(remote, desired);

        assertThat(result.hasChanges()).isFalse();
    }

    @Test
    void contributorCountMismatchIsAChange() throws Exception {
        JsonNode remote = attrs("{\"contributors\":[{\"name\":\"Roe, Rick\",\"contributorType\":\"Other\"}]}");
        ChangeResult result = ChangeDetector.detectContributors(remote, List.of());
        assertThat(result.hasChanges()).isTrue();
        assertThat(result.description()).contains("1").contains("0");
    }

    @Test
    void unknownContributorAndLocalOnlyFieldsAreReported() throws Exception {
        JsonNode remote = attrs("{\"contributors\":[{\"name\":\"Roe, Rick\",\"nameType\":\"Personal\",\"givenName\":\"Rick\",\"familyName\":\"Roe\",\"contributorType\":\"ContactPerson\"}]}");
        List<EntityDescriptor> desired = List.of(
                EntityDescriptor.person("Roe, Rick", "Rick", "Roe", "")
                        .withContributorTypes(List.of("ContactPerson"))
                        .withContactInfo("rick@example.org", "", ""));

        ChangeResult result = ChangeDetector.detectContributors(remote, desired);
        assertThat(result.hasChanges()).isTrue();
        assertThat(result.description()).isEqualTo("Contributor 1: email (local only)");

        ChangeResult missing = ChangeDetector.detectContributors(remote,
                List.of(EntityDescriptor.person("Someone Else", "", "", "").withContributorTypes(List.of("Other"))));
        assertThat(missing.description()).contains("Contributor 'Someone Else': not found in remote");
    }

    @Test
    void invalidDesiredTypeIsComparedAsOther() throws Exception {
        JsonNode remote = attrs("{\"contributors\":[{\"name\":\"Roe, Rick\",\"nameType\":\"Personal\",\"givenName\":\"Rick\",\"familyName\":\"Roe\",\"contributorType\":\"Other\"}]}");
        List<EntityDescriptor> desired = List.of(
                EntityDescriptor.person("Roe, Rick", "Rick", "Roe", "").withContributorTypes(List.of("pointOfContact")));

        assertThat(ChangeDetector.detectContributors(remote, desired).hasChanges()).isFalse();
    }

    @Test
    void legacyStringPublisherComparedFieldByField() throws Exception {
        JsonNode remote = attrs("{\"publisher\":\"GFZ Data Services\"}");

        ChangeResult same = ChangeDetector.detectPublisher(remote, EntityDescriptor.publisher("GFZ Data Services", "", "", "", ""));
        assertThat(same.hasChanges()).isFalse();

        ChangeResult extended = ChangeDetector.detectPublisher(remote,
                EntityDescriptor.publisher("GFZ Data Services", "https://ror.org/04z8jg394", "ROR", "https://ror.org/", "en"));
        assertThat(extended.hasChanges()).isTrue();
        assertThat(extended.description())
                .startsWith("Identifier: '' → 'https://ror.org/04z8jg394'; Scheme: '' → 'ROR'; SchemeURI: '' → 'https://ror.org/'")
                .endsWith("(+ 1 more)");
    }

    @Test
    void objectPublisherRenamed() throws Exception {
        JsonNode remote = attrs("{\"publisher\":{\"name\":\"Old Name\",\"lang\":\"en\"}}");
        ChangeResult result = ChangeDetector.detectPublisher(remote, EntityDescriptor.publisher("New Name", "", "", "", "en"));
        assertThat(result.description()).isEqualTo("Name: 'Old Name' → 'New Name'");
    }

    @Test
    void missingPublisherTreatedAsEmpty() throws Exception {
        ChangeResult result = ChangeDetector.detectPublisher(attrs("{}"), EntityDescriptor.publisher("", "", "", "", ""));
        assertThat(result.hasChanges()).isFalse();
    }
}
