package org.ltiadvantage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcStoreTest extends AbstractStoreTest {

	@TempDir
	Path dir;

	private String url;
	private JdbcStore store;

	@Override
	Datastores createStores(MutableClock clock, Duration nonceLifetime, Duration launchLifetime) throws Exception {
		url = "jdbc:sqlite:" + dir.resolve("lti.db");
		store = new JdbcStore(url, null, null, clock, nonceLifetime, launchLifetime);
		store.createSchema();
		return Datastores.of(store);
	}

	@Test
	void createSchemaIsRepeatable() throws Exception {
		store.storeNonce("nonce-1", "https://tool.example.com/launch");
		store.createSchema();

		store.testAndClearNonce("nonce-1", "https://tool.example.com/launch");
	}

	@Test
	void storingLaunchDeletesExpiredRows() throws Exception {
		store.storeLaunchData("launch-old", "{}");
		clock.advance(LAUNCH_LIFETIME);
		store.storeLaunchData("launch-new", "{}");

		try (Connection c = DriverManager.getConnection(url);
				Statement s = c.createStatement();
				ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM launch_data")) {
			rs.next();
			assertThat(rs.getInt(1)).isEqualTo(1);
		}
	}

	@Test
	void unreachableDatabaseIsDatastoreError() {
		JdbcStore broken = new JdbcStore("jdbc:sqlite:" + dir.resolve("missing").resolve("lti.db"), null, null);

		assertThatThrownBy(() -> broken.findLaunchData("launch-1"))
				.isInstanceOf(DatastoreException.class)
				.isNotInstanceOf(LaunchDataNotFoundException.class);
	}
}
