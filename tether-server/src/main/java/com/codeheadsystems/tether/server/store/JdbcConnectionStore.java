package com.codeheadsystems.tether.server.store;

import com.codeheadsystems.tether.model.ConnectionStatus;
import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.crypto.EncryptedToken;
import com.codeheadsystems.tether.server.exceptions.ConnectionStoreException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionStore} on a relational database through plain JDBC.
 * <p>
 * Times are stored as epoch milliseconds. The SQL sticks to what H2 and PostgreSQL both
 * accept.
 */
public class JdbcConnectionStore implements ConnectionStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcConnectionStore.class);

  private static final String TABLE = "provider_connections";
  private static final String COLUMNS = "id, user_id, provider, provider_user_id, access_token, refresh_token, "
      + "token_expires_at, scopes, connected_at, last_refreshed_at, status";

  private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
      + "id VARCHAR(64) PRIMARY KEY, "
      + "user_id VARCHAR(255) NOT NULL, "
      + "provider VARCHAR(32) NOT NULL, "
      + "provider_user_id VARCHAR(255), "
      + "access_token VARCHAR(8192) NOT NULL, "
      + "refresh_token VARCHAR(8192) NOT NULL, "
      + "token_expires_at BIGINT NOT NULL, "
      + "scopes VARCHAR(2048), "
      + "connected_at BIGINT NOT NULL, "
      + "last_refreshed_at BIGINT, "
      + "status VARCHAR(16) NOT NULL, "
      + "CONSTRAINT provider_connections_user_provider UNIQUE (user_id, provider))";

  private final DataSource dataSource;

  /**
   * Instantiates a new Jdbc connection store.
   *
   * @param dataSource the data source
   */
  public JdbcConnectionStore(DataSource dataSource) {
    log.info("JdbcConnectionStore()");
    this.dataSource = dataSource;
  }

  /**
   * Creates the table if it does not exist.
   */
  public void initializeSchema() {
    try (Connection connection = dataSource.getConnection();
         Statement statement = connection.createStatement()) {
      statement.execute(CREATE_TABLE);
    } catch (SQLException e) {
      throw new ConnectionStoreException("Unable to create " + TABLE, e);
    }
  }

  @Override
  public Optional<ProviderConnection> findById(String id) {
    return queryOne("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE id = ?", id);
  }

  @Override
  public Optional<ProviderConnection> findByUserAndProvider(String userId, Provider provider) {
    return queryOne("SELECT " + COLUMNS + " FROM " + TABLE + " WHERE user_id = ? AND provider = ?",
        userId, provider.name());
  }

  @Override
  public List<ProviderConnection> listByUser(String userId) {
    String sql = "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE user_id = ? ORDER BY provider";
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      statement.setString(1, userId);
      try (ResultSet rs = statement.executeQuery()) {
        List<ProviderConnection> result = new ArrayList<>();
        while (rs.next()) {
          result.add(map(rs));
        }
        return result;
      }
    } catch (SQLException e) {
      throw new ConnectionStoreException("Unable to list connections", e);
    }
  }

  @Override
  public void replace(ProviderConnection c) {
    String delete = "DELETE FROM " + TABLE + " WHERE user_id = ? AND provider = ?";
    String insert = "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    try (Connection connection = dataSource.getConnection()) {
      boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try (PreparedStatement del = connection.prepareStatement(delete);
           PreparedStatement ins = connection.prepareStatement(insert)) {
        del.setString(1, c.userId());
        del.setString(2, c.provider());
        del.executeUpdate();

        ins.setString(1, c.id());
        ins.setString(2, c.userId());
        ins.setString(3, c.provider());
        ins.setString(4, c.providerUserId());
        ins.setString(5, c.accessToken().value());
        ins.setString(6, c.refreshToken().value());
        ins.setLong(7, c.tokenExpiresAt().toEpochMilli());
        ins.setString(8, c.scopes());
        ins.setLong(9, c.connectedAt().toEpochMilli());
        setNullableMillis(ins, 10, c.lastRefreshedAt());
        ins.setString(11, c.status().name());
        ins.executeUpdate();
        connection.commit();
      } catch (SQLException e) {
        connection.rollback();
        throw e;
      } finally {
        connection.setAutoCommit(autoCommit);
      }
      log.debug("replace(id={}, provider={})", c.id(), c.provider());
    } catch (SQLException e) {
      throw new ConnectionStoreException("Unable to store connection " + c.id(), e);
    }
  }

  @Override
  public boolean recordRefresh(String id, EncryptedToken accessToken, Instant tokenExpiresAt,
                               Instant refreshedAt, EncryptedToken rotatedRefreshToken) {
    if (rotatedRefreshToken == null) {
      return update("UPDATE " + TABLE + " SET access_token = ?, token_expires_at = ?, last_refreshed_at = ?, "
              + "status = ? WHERE id = ?",
          accessToken.value(), tokenExpiresAt.toEpochMilli(), refreshedAt.toEpochMilli(),
          ConnectionStatus.ACTIVE.name(), id);
    }
    return update("UPDATE " + TABLE + " SET access_token = ?, token_expires_at = ?, last_refreshed_at = ?, "
            + "status = ?, refresh_token = ? WHERE id = ?",
        accessToken.value(), tokenExpiresAt.toEpochMilli(), refreshedAt.toEpochMilli(),
        ConnectionStatus.ACTIVE.name(), rotatedRefreshToken.value(), id);
  }

  @Override
  public boolean markStatus(String id, ConnectionStatus status) {
    return update("UPDATE " + TABLE + " SET status = ? WHERE id = ?", status.name(), id);
  }

  @Override
  public boolean delete(String id) {
    return update("DELETE FROM " + TABLE + " WHERE id = ?", id);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private Optional<ProviderConnection> queryOne(String sql, Object... params) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      bind(statement, params);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    } catch (SQLException e) {
      throw new ConnectionStoreException("Query failed on " + TABLE, e);
    }
  }

  private boolean update(String sql, Object... params) {
    try (Connection connection = dataSource.getConnection();
         PreparedStatement statement = connection.prepareStatement(sql)) {
      bind(statement, params);
      return statement.executeUpdate() > 0;
    } catch (SQLException e) {
      throw new ConnectionStoreException("Update failed on " + TABLE, e);
    }
  }

  private static void bind(PreparedStatement statement, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      statement.setObject(i + 1, params[i]);
    }
  }

  private static void setNullableMillis(PreparedStatement statement, int index, Instant instant)
      throws SQLException {
    if (instant == null) {
      statement.setNull(index, Types.BIGINT);
    } else {
      statement.setLong(index, instant.toEpochMilli());
    }
  }

  private static ProviderConnection map(ResultSet rs) throws SQLException {
    long lastRefreshed = rs.getLong("last_refreshed_at");
    Instant lastRefreshedAt = rs.wasNull() ? null : Instant.ofEpochMilli(lastRefreshed);
    return new ProviderConnection(
        rs.getString("id"),
        rs.getString("user_id"),
        rs.getString("provider"),
        rs.getString("provider_user_id"),
        new EncryptedToken(rs.getString("access_token")),
        new EncryptedToken(rs.getString("refresh_token")),
        Instant.ofEpochMilli(rs.getLong("token_expires_at")),
        rs.getString("scopes"),
        Instant.ofEpochMilli(rs.getLong("connected_at")),
        lastRefreshedAt,
        ConnectionStatus.valueOf(rs.getString("status")));
  }
}
