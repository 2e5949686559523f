/* Warden © 2025 Warden Devs — MIT */
package dev.warden.core;

import dev.warden.api.ActionKind;
import dev.warden.api.ActionRecord;
import dev.warden.api.EditInfo;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** MariaDB-backed implementation of {@link ModerationStore} on the {@code moderations} table. */
public final class JdbcModerationStore implements ModerationStore {
  private static final Logger LOG = LoggerFactory.getLogger("warden");

  private static final String COLUMNS =
      "id,case_number,kind,subject_id,subject_name,issuer_id,issuer_name,role_id,role_name,"
          + "reason,link,issued_at_ms,duration_ms,active,removed_by_id,removed_by_name,"
          + "removed_reason,removed_at_ms,auto_removed,expunged_by_id,expunged_by_name,"
          + "expunged_reason,expunged_at_ms";
  private static final String SELECT = "SELECT " + COLUMNS + " FROM moderations ";

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement ps) throws SQLException;
  }

  @FunctionalInterface
  private interface RowReader<T> {
    T read(ResultSet rs) throws SQLException;
  }

  private final DataSource ds;

  /**
   * Creates the store.
   *
   * @param ds shared datasource
   */
  public JdbcModerationStore(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public Optional<ActionRecord> findById(long id) {
    return first(query("store.findById", SELECT + "WHERE id=?", ps -> ps.setLong(1, id)));
  }

  @Override
  public Optional<ActionRecord> findByCase(long caseNumber) {
    return first(
        query(
            "store.findByCase", SELECT + "WHERE case_number=?", ps -> ps.setLong(1, caseNumber)));
  }

  @Override
  public List<ActionRecord> findActive(ActionKind kind) {
    return query(
        "store.findActive",
        SELECT + "WHERE kind=? AND active=1 ORDER BY issued_at_ms ASC, id ASC",
        ps -> ps.setString(1, kind.id()));
  }

  @Override
  public List<ActionRecord> findActiveFor(ActionKind kind, String subjectId, String roleId) {
    return query(
        "store.findActiveFor",
        SELECT + matchClause(kind) + " ORDER BY issued_at_ms DESC, id DESC",
        ps -> bindMatch(ps, kind, subjectId, roleId));
  }

  @Override
  public Optional<ActionRecord> findRecentActive(
      ActionKind kind, String subjectId, String roleId, long sinceMs) {
    return first(
        query(
            "store.findRecentActive",
            SELECT
                + matchClause(kind)
                + " AND issued_at_ms>? ORDER BY issued_at_ms DESC, id DESC LIMIT 1",
            ps -> {
              int next = bindMatch(ps, kind, subjectId, roleId);
              ps.setLong(next, sinceMs);
            }));
  }

  @Override
  public List<ActionRecord> findOtherActive(ActionRecord record) {
    return query(
        "store.findOtherActive",
        SELECT + matchClause(record.kind()) + " AND id<>? ORDER BY issued_at_ms ASC, id ASC",
        ps -> {
          int next = bindMatch(ps, record.kind(), record.subjectId(), record.roleId());
          ps.setLong(next, record.id());
        });
  }

  @Override
  public long countOtherActive(ActionRecord record) {
    List<Long> counts =
        read(
            "store.countOtherActive",
            "SELECT COUNT(*) FROM moderations " + matchClause(record.kind()) + " AND id<>?",
            ps -> {
              int next = bindMatch(ps, record.kind(), record.subjectId(), record.roleId());
              ps.setLong(next, record.id());
            },
            rs -> rs.getLong(1));
    return counts.isEmpty() ? 0L : counts.get(0);
  }

  @Override
  public ActionRecord insert(ActionRecord r) {
    if (r.caseNumber() <= 0) {
      throw new IllegalArgumentException("case number must be assigned before insert");
    }
    String sql =
        "INSERT INTO moderations(case_number,kind,subject_id,subject_name,issuer_id,issuer_name,"
            + "role_id,role_name,reason,link,issued_at_ms,duration_ms,active,auto_removed) "
            + "VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      ps.setLong(1, r.caseNumber());
      ps.setString(2, r.kind().id());
      ps.setString(3, r.subjectId());
      ps.setString(4, r.subjectName());
      ps.setString(5, r.issuerId());
      ps.setString(6, r.issuerName());
      ps.setString(7, r.roleId());
      ps.setString(8, r.roleName());
      ps.setString(9, r.reason());
      ps.setString(10, r.link());
      ps.setLong(11, r.issuedAtMs());
      setNullableLong(ps, 12, r.durationMs());
      ps.setBoolean(13, r.active());
      ps.setBoolean(14, r.autoRemoved());
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("no generated key for case " + r.caseNumber(), "HY000");
        }
        return r.withIdentity(keys.getLong(1), r.caseNumber());
      }
    } catch (SQLException e) {
      throw fail("store.insert", e);
    }
  }

  @Override
  public boolean markInactive(long id) {
    return update(
        "store.markInactive",
        "UPDATE moderations SET active=0 WHERE id=? AND active=1",
        ps -> ps.setLong(1, id));
  }

  @Override
  public boolean markRemoved(long id, EditInfo removed, boolean autoRemoved) {
    Objects.requireNonNull(removed, "removed");
    return update(
        "store.markRemoved",
        "UPDATE moderations SET active=0,removed_by_id=?,removed_by_name=?,removed_reason=?,"
            + "removed_at_ms=?,auto_removed=? WHERE id=? AND active=1",
        ps -> {
          ps.setString(1, removed.actorId());
          ps.setString(2, removed.actorName());
          ps.setString(3, removed.reason());
          ps.setLong(4, removed.timestampMs());
          ps.setBoolean(5, autoRemoved);
          ps.setLong(6, id);
        });
  }

  @Override
  public boolean markExpunged(long id, EditInfo expunged) {
    Objects.requireNonNull(expunged, "expunged");
    return update(
        "store.markExpunged",
        "UPDATE moderations SET active=0,expunged_by_id=?,expunged_by_name=?,expunged_reason=?,"
            + "expunged_at_ms=? WHERE id=? AND expunged_at_ms IS NULL",
        ps -> {
          ps.setString(1, expunged.actorId());
          ps.setString(2, expunged.actorName());
          ps.setString(3, expunged.reason());
          ps.setLong(4, expunged.timestampMs());
          ps.setLong(5, id);
        });
  }

  @Override
  public boolean updateReason(long id, String reason) {
    // affected-row counts are zero for a no-op rewrite, so existence is checked separately
    update(
        "store.updateReason",
        "UPDATE moderations SET reason=? WHERE id=?",
        ps -> {
          ps.setString(1, reason);
          ps.setLong(2, id);
        });
    return exists(id);
  }

  @Override
  public boolean updateDuration(long id, Long durationMs, boolean reactivate) {
    String sql =
        reactivate
            ? "UPDATE moderations SET duration_ms=?,active=1,removed_by_id=NULL,"
                + "removed_by_name=NULL,removed_reason=NULL,removed_at_ms=NULL,auto_removed=0 "
                + "WHERE id=?"
            : "UPDATE moderations SET duration_ms=? WHERE id=?";
    update(
        "store.updateDuration",
        sql,
        ps -> {
          setNullableLong(ps, 1, durationMs);
          ps.setLong(2, id);
        });
    return exists(id);
  }

  @Override
  public Map<ActionKind, Long> countByKind() {
    return counts("store.countByKind", "SELECT kind,COUNT(*) FROM moderations GROUP BY kind");
  }

  @Override
  public Map<ActionKind, Long> countActiveByKind() {
    return counts(
        "store.countActiveByKind",
        "SELECT kind,COUNT(*) FROM moderations WHERE active=1 GROUP BY kind");
  }

  @Override
  public List<ActionRecord> history(String subjectId, boolean includeExpunged) {
    String sql =
        SELECT
            + "WHERE subject_id=?"
            + (includeExpunged ? "" : " AND expunged_at_ms IS NULL")
            + " ORDER BY issued_at_ms DESC, id DESC";
    return query("store.history", sql, ps -> ps.setString(1, subjectId));
  }

  private boolean exists(long id) {
    return !read(
            "store.exists",
            "SELECT 1 FROM moderations WHERE id=?",
            ps -> ps.setLong(1, id),
            rs -> Boolean.TRUE)
        .isEmpty();
  }

  private Map<ActionKind, Long> counts(String op, String sql) {
    Map<ActionKind, Long> out = new EnumMap<>(ActionKind.class);
    for (Map.Entry<String, Long> row :
        read(op, sql, ps -> {}, rs -> Map.entry(rs.getString(1), rs.getLong(2)))) {
      try {
        out.put(ActionKind.fromId(row.getKey()), row.getValue());
      } catch (IllegalArgumentException e) {
        LOG.warn("(warden) op={} message=unknown kind '{}' in moderations", op, row.getKey());
      }
    }
    return out;
  }

  private static String matchClause(ActionKind kind) {
    return kind.carriesRole()
        ? "WHERE kind=? AND subject_id=? AND role_id<=>? AND active=1"
        : "WHERE kind=? AND subject_id=? AND active=1";
  }

  private static int bindMatch(PreparedStatement ps, ActionKind kind, String subject, String role)
      throws SQLException {
    ps.setString(1, kind.id());
    ps.setString(2, subject);
    if (kind.carriesRole()) {
      ps.setString(3, role);
      return 4;
    }
    return 3;
  }

  private List<ActionRecord> query(String op, String sql, Binder binder) {
    return read(op, sql, binder, JdbcModerationStore::mapRecord);
  }

  private <T> List<T> read(String op, String sql, Binder binder, RowReader<T> reader) {
    List<T> out = new ArrayList<>();
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      binder.bind(ps);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          out.add(reader.read(rs));
        }
      }
    } catch (SQLException e) {
      throw fail(op, e);
    }
    return out;
  }

  private boolean update(String op, String sql, Binder binder) {
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      binder.bind(ps);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      throw fail(op, e);
    }
  }

  private static StoreException fail(String op, SQLException e) {
    StoreException wrapped = StoreException.wrap(op, e);
    LOG.warn(
        "(warden) code={} op={} message={} sqlState={} vendor={}",
        wrapped.errorCode(),
        op,
        e.getMessage(),
        e.getSQLState(),
        e.getErrorCode(),
        e);
    return wrapped;
  }

  private static Optional<ActionRecord> first(List<ActionRecord> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  private static void setNullableLong(PreparedStatement ps, int index, Long value)
      throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.BIGINT);
    } else {
      ps.setLong(index, value);
    }
  }

  private static Long nullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  private static EditInfo editInfo(ResultSet rs, String prefix) throws SQLException {
    Long at = nullableLong(rs, prefix + "_at_ms");
    String by = rs.getString(prefix + "_by_id");
    if (at == null || by == null) {
      return null;
    }
    String name = rs.getString(prefix + "_by_name");
    return new EditInfo(by, name, rs.getString(prefix + "_reason"), at);
  }

  private static ActionRecord mapRecord(ResultSet rs) throws SQLException {
    return new ActionRecord(
        rs.getLong("id"),
        rs.getLong("case_number"),
        ActionKind.fromId(rs.getString("kind")),
        rs.getString("subject_id"),
        rs.getString("subject_name"),
        rs.getString("issuer_id"),
        rs.getString("issuer_name"),
        rs.getString("role_id"),
        rs.getString("role_name"),
        rs.getString("reason"),
        rs.getString("link"),
        rs.getLong("issued_at_ms"),
        nullableLong(rs, "duration_ms"),
        rs.getBoolean("active"),
        editInfo(rs, "removed"),
        rs.getBoolean("auto_removed"),
        editInfo(rs, "expunged"));
  }
}
