package com.example.doisync.local;

import com.example.doisync.config.LocalDbConfig;
import com.example.doisync.model.ContributorTypes;
import com.example.doisync.model.Facet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC access to the local metadata schema. Each facet replacement runs in its own
 * transaction on a pooled connection from {@link LocalDbConfig}.
 */
@Repository
public class JdbcLocalRecordStore implements LocalRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcLocalRecordStore.class);

    private static final String INSERT_AGENT =
            "INSERT INTO resourceagent (resource_id, `order`, name, firstname, lastname, identifier, identifiertype, nametype) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String INSERT_ROLE =
            "INSERT INTO role (role, resourceagent_resource_id, resourceagent_order) VALUES (?, ?, ?)";
    private static final String INSERT_CONTACT =
            "INSERT INTO contactinfo (resourceagent_resource_id, resourceagent_order, email, website, position) VALUES (?, ?, ?, ?, ?)";

    private final LocalDbConfig localDb;

    public JdbcLocalRecordStore(LocalDbConfig localDb) {
        this.localDb = localDb;
    }

    @Override
    public ConnectionCheck testConnection() {
        try (Connection c = localDb.getConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            rs.next();
            return ConnectionCheck.ok("Connected to " + localDb.describeTarget());
        } catch (SQLException ex) {
            log.warn("Local database {} not reachable: {}", localDb.describeTarget(), ex.getMessage());
            return ConnectionCheck.failed("Cannot connect to local database " + localDb.describeTarget() + ": " + ex.getMessage());
        }
    }

    @Override
    public Optional<Long> resolve(String doi) {
        try (Connection c = localDb.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT id FROM resource WHERE identifier = ?")) {
            ps.setString(1, doi);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw new LocalStoreException("Failed to resolve " + doi + " in local database: " + ex.getMessage(), ex);
        }
    }

    @Override
    public LocalWriteResult replaceFacetRecords(long resourceId, Facet facet, List<LocalRecord> records) {
        if (facet == Facet.PUBLISHER && (records.isEmpty() || records.get(0).name().isEmpty())) {
            return LocalWriteResult.failure("Publisher name is empty");
        }
        try (Connection c = localDb.getConnection()) {
            c.setAutoCommit(false);
            try {
                List<String> warnings = new ArrayList<>();
                int written;
                switch (facet) {
                    case CREATORS:
                        written = replaceCreators(c, resourceId, records, warnings);
                        break;
                    case CONTRIBUTORS:
                        written = replaceContributors(c, resourceId, records, warnings);
                        break;
                    case PUBLISHER:
                        written = updatePublisher(c, resourceId, records.get(0).name());
                        break;
                    default:
                        throw new IllegalArgumentException("Unsupported facet " + facet);
                }
                c.commit();
                String message = String.format("Updated %d %s row(s) for resource %d", written, facet.label().toLowerCase(Locale.ROOT), resourceId);
                log.info(message);
                return LocalWriteResult.success(message, warnings);
            } catch (SQLException ex) {
                rollback(c, resourceId, ex);
                log.warn("Local {} update for resource {} rolled back: {}", facet.label(), resourceId, ex.getMessage());
                return LocalWriteResult.failure("Database transaction failed: " + ex.getMessage());
            }
        } catch (SQLException ex) {
            log.error("Local database unavailable for resource {}: {}", resourceId, ex.getMessage());
            return LocalWriteResult.failure("Local database unavailable: " + ex.getMessage());
        }
    }

    private int replaceCreators(Connection c, long resourceId, List<LocalRecord> records, List<String> warnings) throws SQLException {
        List<Integer> orders = ordersWithRole(c, resourceId, "r.role = ?", ContributorTypes.CREATOR_ROLE);
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM role WHERE resourceagent_resource_id = ? AND role = ?")) {
            ps.setLong(1, resourceId);
            ps.setString(2, ContributorTypes.CREATOR_ROLE);
            ps.executeUpdate();
        }
        deleteOrphanedAgents(c, resourceId, orders);

        Set<Integer> occupied = new HashSet<>(allOrders(c, resourceId));
        int next = 1;
        int written = 0;
        for (int i = 0; i < records.size(); i++) {
            LocalRecord rec = records.get(i);
            if (rec.lastname().isEmpty()) {
                warnings.add("Creator " + (i + 1) + ": Missing lastname");
                continue;
            }
            while (occupied.contains(next)) next++;
            insertAgent(c, resourceId, rec.atOrder(next), List.of(ContributorTypes.CREATOR_ROLE), false);
            occupied.add(next);
            written++;
        }
        return written;
    }

    private int replaceContributors(Connection c, long resourceId, List<LocalRecord> records, List<String> warnings) throws SQLException {
        List<Integer> orders = ordersWithRole(c, resourceId, "r.role <> ?", ContributorTypes.CREATOR_ROLE);
        if (!orders.isEmpty()) {
            String in = placeholders(orders.size());
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM contactinfo WHERE resourceagent_resource_id = ? AND resourceagent_order IN (" + in + ")")) {
                bindOrders(ps, resourceId, orders);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM role WHERE resourceagent_resource_id = ? AND role <> ? AND resourceagent_order IN (" + in + ")")) {
                ps.setLong(1, resourceId);
                ps.setString(2, ContributorTypes.CREATOR_ROLE);
                for (int i = 0; i < orders.size(); i++) ps.setInt(i + 3, orders.get(i));
                ps.executeUpdate();
            }
            deleteOrphanedAgents(c, resourceId, orders);
        }

        int next = maxOrder(c, resourceId) + 1;
        int written = 0;
        for (int i = 0; i < records.size(); i++) {
            LocalRecord rec = records.get(i);
            if (rec.name().isEmpty() && rec.lastname().isEmpty()) {
                warnings.add("Contributor " + (i + 1) + ": Missing lastname/name");
                continue;
            }
            List<String> roles = rec.roles().isEmpty() ? List.of(ContributorTypes.OTHER) : rec.roles();
            boolean contact = roles.contains(ContributorTypes.CONTACT_PERSON) && rec.hasContactInfo();
            insertAgent(c, resourceId, rec.atOrder(next), roles, contact);
            next++;
            written++;
        }
        return written;
    }

    private int updatePublisher(Connection c, long resourceId, String publisher) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE resource SET publisher = ? WHERE id = ?")) {
            ps.setString(1, publisher);
            ps.setLong(2, resourceId);
            int n = ps.executeUpdate();
            if (n == 0) {
                throw new SQLException("resource " + resourceId + " does not exist");
            }
            return n;
        }
    }

    private void insertAgent(Connection c, long resourceId, LocalRecord rec, List<String> roles, boolean withContact) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(INSERT_AGENT)) {
            ps.setLong(1, resourceId);
            ps.setInt(2, rec.order());
            ps.setString(3, rec.name());
            ps.setString(4, nullIfEmpty(rec.firstname()));
            ps.setString(5, nullIfEmpty(rec.lastname()));
            ps.setString(6, nullIfEmpty(rec.identifier()));
            ps.setString(7, nullIfEmpty(rec.identifierType()));
            ps.setString(8, nullIfEmpty(rec.nameType()));
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement(INSERT_ROLE)) {
            for (String role : roles) {
                ps.setString(1, role);
                ps.setLong(2, resourceId);
                ps.setInt(3, rec.order());
                ps.addBatch();
            }
            ps.executeBatch();
        }
        if (withContact) {
            try (PreparedStatement ps = c.prepareStatement(INSERT_CONTACT)) {
                ps.setLong(1, resourceId);
                ps.setInt(2, rec.order());
                ps.setString(3, nullIfEmpty(rec.email()));
                ps.setString(4, nullIfEmpty(rec.website()));
                ps.setString(5, nullIfEmpty(rec.position()));
                ps.executeUpdate();
            }
        }
    }

    // agents at these orders that no longer carry any role
    private void deleteOrphanedAgents(Connection c, long resourceId, List<Integer> orders) throws SQLException {
        for (Integer order : orders) {
            boolean hasRole;
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COUNT(*) FROM role WHERE resourceagent_resource_id = ? AND resourceagent_order = ?")) {
                ps.setLong(1, resourceId);
                ps.setInt(2, order);
                try (ResultSet rs = ps.executeQuery()) {
                    hasRole = rs.next() && rs.getInt(1) > 0;
                }
            }
            if (hasRole) continue;
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM contactinfo WHERE resourceagent_resource_id = ? AND resourceagent_order = ?")) {
                ps.setLong(1, resourceId);
                ps.setInt(2, order);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM resourceagent WHERE resource_id = ? AND `order` = ?")) {
                ps.setLong(1, resourceId);
                ps.setInt(2, order);
                ps.executeUpdate();
            }
        }
    }

    private List<Integer> ordersWithRole(Connection c, long resourceId, String roleCondition, String role) throws SQLException {
        String sql = "SELECT DISTINCT ra.`order` FROM resourceagent ra JOIN role r "
                + "ON r.resourceagent_resource_id = ra.resource_id AND r.resourceagent_order = ra.`order` "
                + "WHERE ra.resource_id = ? AND " + roleCondition + " ORDER BY ra.`order`";
        List<Integer> orders = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, resourceId);
            ps.setString(2, role);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) orders.add(rs.getInt(1));
            }
        }
        return orders;
    }

    private List<Integer> allOrders(Connection c, long resourceId) throws SQLException {
        List<Integer> orders = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT `order` FROM resourceagent WHERE resource_id = ?")) {
            ps.setLong(1, resourceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) orders.add(rs.getInt(1));
            }
        }
        return orders;
    }

    private int maxOrder(Connection c, long resourceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COALESCE(MAX(`order`), 0) FROM resourceagent WHERE resource_id = ?")) {
            ps.setLong(1, resourceId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    @Override
    public List<LocalRecord> fetchFacetRecords(long resourceId, Facet facet) {
        try (Connection c = localDb.getConnection()) {
            switch (facet) {
                case PUBLISHER:
                    return fetchPublisher(c, resourceId);
                case CREATORS:
                    return fetchAgents(c, resourceId, "r.role = ?");
                case CONTRIBUTORS:
                    return fetchAgents(c, resourceId, "r.role <> ?");
                default:
                    throw new IllegalArgumentException("Unsupported facet " + facet);
            }
        } catch (SQLException ex) {
            throw new LocalStoreException("Failed to read " + facet.label() + " for resource " + resourceId + ": " + ex.getMessage(), ex);
        }
    }

    private List<LocalRecord> fetchPublisher(Connection c, long resourceId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT publisher FROM resource WHERE id = ?")) {
            ps.setLong(1, resourceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getString(1) != null) {
                    return List.of(LocalRecord.publisher(rs.getString(1)));
                }
                return List.of();
            }
        }
    }

    private List<LocalRecord> fetchAgents(Connection c, long resourceId, String roleCondition) throws SQLException {
        String sql = "SELECT ra.`order`, ra.name, ra.firstname, ra.lastname, ra.identifier, ra.identifiertype, ra.nametype, "
                + "r.role, ci.email, ci.website, ci.position "
                + "FROM resourceagent ra "
                + "JOIN role r ON r.resourceagent_resource_id = ra.resource_id AND r.resourceagent_order = ra.`order` "
                + "LEFT JOIN contactinfo ci ON ci.resourceagent_resource_id = ra.resource_id AND ci.resourceagent_order = ra.`order` "
                + "WHERE ra.resource_id = ? AND " + roleCondition + " ORDER BY ra.`order`, r.role";
        Map<Integer, LocalRecord> byOrder = new LinkedHashMap<>();
        Map<Integer, List<String>> roles = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, resourceId);
            ps.setString(2, ContributorTypes.CREATOR_ROLE);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int order = rs.getInt(1);
                    roles.computeIfAbsent(order, k -> new ArrayList<>()).add(rs.getString("role"));
                    if (!byOrder.containsKey(order)) {
                        byOrder.put(order, new LocalRecord(order, rs.getString("name"), rs.getString("firstname"),
                                rs.getString("lastname"), rs.getString("identifier"), rs.getString("identifiertype"),
                                rs.getString("nametype"), List.of(), rs.getString("email"), rs.getString("website"),
                                rs.getString("position")));
                    }
                }
            }
        }
        List<LocalRecord> out = new ArrayList<>();
        for (Map.Entry<Integer, LocalRecord> e : byOrder.entrySet()) {
            LocalRecord r = e.getValue();
            out.add(new LocalRecord(r.order(), r.name(), r.firstname(), r.lastname(), r.identifier(), r.identifierType(),
                    r.nameType(), roles.get(e.getKey()), r.email(), r.website(), r.position()));
        }
        return out;
    }

    private void rollback(Connection c, long resourceId, SQLException cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            log.error("CRITICAL: rollback failed for resource {}: {}", resourceId, rollbackFailure.getMessage());
            LocalStoreException ex = new LocalStoreException(
                    "Transaction failed and rollback failed for resource " + resourceId + ": " + rollbackFailure.getMessage(), cause);
            ex.addSuppressed(rollbackFailure);
            throw ex;
        }
    }

    private static void bindOrders(PreparedStatement ps, long resourceId, List<Integer> orders) throws SQLException {
        ps.setLong(1, resourceId);
        for (int i = 0; i < orders.size(); i++) ps.setInt(i + 2, orders.get(i));
    }

    private static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    private static String nullIfEmpty(String v) {
        return v == null || v.isEmpty() ? null : v;
    }
}
