package com.example.doisync.local;

import com.example.doisync.config.DoiSyncProperties;
import com.example.doisync.config.LocalDbConfig;
import com.example.doisync.model.Facet;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcLocalRecordStoreTest {

    private static final String DOI = "10.5880/GFZ.3.1.2020.002";

    private LocalDbConfig localDb;
    private JdbcLocalRecordStore store;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() throws Exception {
        DoiSyncProperties props = new DoiSyncProperties();
        props.getLocal().setJdbcUrl("jdbc:h2:mem:local_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;INIT=RUNSCRIPT FROM 'classpath:local-h2-schema.sql'");
        props.getLocal().setUsername("sa");
        props.getLocal().setPassword("");
        localDb = new LocalDbConfig(props, mock(ObjectProvider.class));
        store = new JdbcLocalRecordStore(localDb);

        try (Connection c = localDb.getConnection(); Statement st = c.createStatement()) {
            st.execute("INSERT INTO resource (id, identifier, publisher) VALUES (1, '" + DOI + "', 'Old Press')");
            st.execute("INSERT INTO resourceagent (resource_id, `order`, name, firstname, lastname, nametype) VALUES (1, 1, 'Doe, Jane', 'Jane', 'Doe', 'Personal')");
            st.execute("INSERT INTO resourceagent (resource_id, `order`, name, firstname, lastname, nametype) VALUES (1, 2, 'Roe, Rick', 'Rick', 'Roe', 'Personal')");
            st.execute("INSERT INTO resourceagent (resource_id, `order`, name, identifier, identifiertype, nametype) VALUES (1, 3, 'GFZ', 'https://ror.org/04z8jg394', 'ROR', 'Organizational')");
            st.execute("INSERT INTO resourceagent (resource_id, `order`, name, firstname, lastname, nametype) VALUES (1, 4, 'Smith, Ann', 'Ann', 'Smith', 'Personal')");
            st.execute("INSERT INTO role (role, resourceagent_resource_id, resourceagent_order) VALUES ('Creator', 1, 1)");
            st.execute("INSERT INTO role (role, resourceagent_resource_id, resourceagent_order) VALUES ('Creator', 1, 2)");
            st.execute("INSERT INTO role (role, resourceagent_resource_id, resourceagent_order) VALUES ('HostingInstitution', 1, 3)");
            st.execute("INSERT INTO role (role, resourceagent_resource_id, resourceagent_order) VALUES ('ContactPerson', 1, 4)");
            st.execute("INSERT INTO contactinfo (resourceagent_resource_id, resourceagent_order, email) VALUES (1, 4, 'ann@example.org')");
        }
    }

    @AfterEach
    void tearDown() {
        localDb.shutdown();
    }

    private static LocalRecord person(String first, String last, String... roles) {
        return new LocalRecord(0, last + ", " + first, first, last, null, null, "Personal", List.of(roles), null, null, null);
    }

    private int count(String sql) throws SQLException {
        try (Connection c = localDb.getConnection(); Statement st = c.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    void connectionCheckAndResolve() {
        assertThat(store.testConnection().ok()).isTrue();
        assertThat(store.resolve(DOI)).contains(1L);
        assertThat(store.resolve("10.5880/unknown")).isEmpty();
    }

    @Test
    void replacingCreatorsKeepsContributors() {
        LocalWriteResult result = store.replaceFacetRecords(1L, Facet.CREATORS, List.of(
                person("Max", "Miller", "Creator"),
                new LocalRecord(0, "Anonymous", null, null, null, null, "Personal", List.of("Creator"), null, null, null)));

        assertThat(result.success()).isTrue();
        assertThat(result.warnings()).containsExactly("Creator 2: Missing lastname");

        List<LocalRecord> creators = store.fetchFacetRecords(1L, Facet.CREATORS);
        assertThat(creators).singleElement().satisfies(r -> {
            assertThat(r.order()).isEqualTo(1);
            assertThat(r.name()).isEqualTo("Miller, Max");
            assertThat(r.roles()).containsExactly("Creator");
        });
        List<LocalRecord> contributors = store.fetchFacetRecords(1L, Facet.CONTRIBUTORS);
        assertThat(contributors).extracting(LocalRecord::name).containsExactly("GFZ", "Smith, Ann");
        assertThat(contributors.get(1).email()).isEqualTo("ann@example.org");
    }

    @Test
    void replacingContributorsKeepsCreatorsAndWritesContactInfo() throws SQLException {
        LocalRecord contact = new LocalRecord(0, "Lee, Kim", "Kim", "Lee", "0000-0002-1825-0097", "ORCID", "Personal",
                List.of("ContactPerson", "DataCurator"), "kim@example.org", "https://example.org", "Data manager");

        LocalWriteResult result = store.replaceFacetRecords(1L, Facet.CONTRIBUTORS, List.of(contact));

        assertThat(result.success()).isTrue();
        List<LocalRecord> contributors = store.fetchFacetRecords(1L, Facet.CONTRIBUTORS);
        assertThat(contributors).singleElement().satisfies(r -> {
            assertThat(r.order()).isEqualTo(3);
            assertThat(r.roles()).containsExactly("ContactPerson", "DataCurator");
            assertThat(r.email()).isEqualTo("kim@example.org");
            assertThat(r.position()).isEqualTo("Data manager");
        });
        assertThat(store.fetchFacetRecords(1L, Facet.CREATORS)).extracting(LocalRecord::name)
                .containsExactly("Doe, Jane", "Roe, Rick");
        assertThat(count("SELECT COUNT(*) FROM contactinfo")).isEqualTo(1);
        assertThat(count("SELECT COUNT(*) FROM resourceagent")).isEqualTo(3);
    }

    @Test
    void contributorWithoutRolesBecomesOtherAndNamelessRowIsSkipped() {
        LocalWriteResult result = store.replaceFacetRecords(1L, Facet.CONTRIBUTORS, List.of(
                new LocalRecord(0, "", null, null, null, null, "Personal", List.of("Editor"), null, null, null),
                new LocalRecord(0, "AWI", null, null, null, null, "Organizational", List.of(), "x@awi.de", null, null)));

        assertThat(result.warnings()).containsExactly("Contributor 1: Missing lastname/name");
        List<LocalRecord> contributors = store.fetchFacetRecords(1L, Facet.CONTRIBUTORS);
        assertThat(contributors).singleElement().satisfies(r -> {
            assertThat(r.roles()).containsExactly("Other");
            // contact info is only stored for contact persons
            assertThat(r.email()).isEmpty();
        });
    }

    @Test
    void failedInsertRollsBackEverything() throws SQLException {
        String tooLong = "x".repeat(300);

        LocalWriteResult result = store.replaceFacetRecords(1L, Facet.CREATORS, List.of(person("Max", tooLong, "Creator")));

        assertThat(result.success()).isFalse();
        assertThat(result.message()).startsWith("Database transaction failed: ");
        assertThat(store.fetchFacetRecords(1L, Facet.CREATORS)).extracting(LocalRecord::name)
                .containsExactly("Doe, Jane", "Roe, Rick");
        assertThat(count("SELECT COUNT(*) FROM role")).isEqualTo(4);
    }

    @Test
    void publisherIsUpdatedAndValidated() {
        assertThat(store.replaceFacetRecords(1L, Facet.PUBLISHER, List.of(LocalRecord.publisher("GFZ Data Services"))).success()).isTrue();
        assertThat(store.fetchFacetRecords(1L, Facet.PUBLISHER)).extracting(LocalRecord::name).containsExactly("GFZ Data Services");

        assertThat(store.replaceFacetRecords(1L, Facet.PUBLISHER, List.of(LocalRecord.publisher(" "))).message())
                .isEqualTo("Publisher name is empty");
        LocalWriteResult missing = store.replaceFacetRecords(99L, Facet.PUBLISHER, List.of(LocalRecord.publisher("X")));
        assertThat(missing.success()).isFalse();
        assertThat(missing.message()).contains("resource 99 does not exist");
    }

    @Test
    void failedRollbackIsEscalated() throws SQLException {
        LocalDbConfig broken = mock(LocalDbConfig.class);
        Connection connection = mock(Connection.class);
        when(broken.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenThrow(new SQLException("lost connection"));
        doThrow(new SQLException("rollback refused")).when(connection).rollback();

        JdbcLocalRecordStore failing = new JdbcLocalRecordStore(broken);

        assertThatThrownBy(() -> failing.replaceFacetRecords(1L, Facet.CREATORS, List.of(person("A", "B", "Creator"))))
                .isInstanceOf(LocalStoreException.class)
                .hasMessageContaining("rollback failed")
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void unreachableDatabaseFailsConnectionCheck() throws SQLException {
        LocalDbConfig broken = mock(LocalDbConfig.class);
        when(broken.getConnection()).thenThrow(new SQLException("Communications link failure"));
        when(broken.describeTarget()).thenReturn("jdbc:mysql://db:3306/metaworks");

        ConnectionCheck check = new JdbcLocalRecordStore(broken).testConnection();

        assertThat(check.ok()).isFalse();
        assertThat(check.message()).contains("Communications link failure");
    }
}
