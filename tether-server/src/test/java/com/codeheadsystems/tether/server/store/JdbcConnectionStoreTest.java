package com.codeheadsystems.tether.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tether.model.Provider;
import com.codeheadsystems.tether.server.exceptions.ConnectionStoreException;
import java.sql.SQLException;
import java.util.UUID;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

class JdbcConnectionStoreTest extends ConnectionStoreContractTest {

  @Override
  protected ConnectionStore createStore() {
    JdbcConnectionStore jdbc = new JdbcConnectionStore(dataSource());
    jdbc.initializeSchema();
    return jdbc;
  }

  private static DataSource dataSource() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    dataSource.setUser("sa");
    return dataSource;
  }

  @Test
  void initializeSchema_isIdempotent() {
    ((JdbcConnectionStore) store).initializeSchema();
    store.replace(connection("c1", "alice", Provider.SPOTIFY));

    assertThat(store.findById("c1")).isPresent();
  }

  @Test
  void scopesAndNullsSurviveRoundTrip() {
    store.replace(connection("c1", "alice", Provider.YOUTUBE));

    ProviderConnection read = store.findById("c1").orElseThrow();
    assertThat(read.scopes()).isEqualTo("scope-a scope-b");
    assertThat(read.lastRefreshedAt()).isNull();
    assertThat(read.connectedAt()).isEqualTo(CONNECTED);
  }

  @Test
  void sqlFailures_areWrapped() throws SQLException {
    DataSource down = mock(DataSource.class);
    when(down.getConnection()).thenThrow(new SQLException("down"));
    JdbcConnectionStore broken = new JdbcConnectionStore(down);

    assertThatThrownBy(() -> broken.findById("c1"))
        .isInstanceOf(ConnectionStoreException.class)
        .hasCauseInstanceOf(SQLException.class);
  }
}
