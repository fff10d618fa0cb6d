/*  LTI Advantage - A Java library for LTI 1.3 tools
*   Copyright (C) 2026 The LTI Advantage Authors
*   
*   This program is free software: you can redistribute it and/or modify
*   it under the terms of the GNU General Public License as published by
*   the Free Software Foundation, either version 3 of the License, or
*   (at your option) any later version.
*
*   This program is distributed in the hope that it will be useful,
*   but WITHOUT ANY WARRANTY; without even the implied warranty of
*   MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
*   GNU General Public License for more details.
*
*   You should have received a copy of the GNU General Public License
*   along with this program.  If not, see <http://www.gnu.org/licenses/>.
*/

package org.ltiadvantage;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.logging.Logger;

/**
 * JdbcStore - implements all four storage roles on relational tables.
 *
 * The SQL is kept portable (no vendor upsert syntax); replacements are done as a
 * delete followed by an insert inside one transaction. Times are stored as epoch milliseconds.
 * A nonce is consumed by a DELETE whose row count decides which of several concurrent
 * launches wins, so the single-use rule holds across server instances sharing the database.
 *
 * Each operation opens its own Connection from the DriverManager.
 */
public class JdbcStore implements RegistrationStore, NonceStore, LaunchDataStore, AccessTokenStore {

	private static final Logger logger = Logger.getLogger(JdbcStore.class.getName());

	static final String[] SCHEMA = {
		"CREATE TABLE IF NOT EXISTS registration (issuer VARCHAR(255) NOT NULL, client_id VARCHAR(255) NOT NULL, "
				+ "auth_token_uri VARCHAR(1024), auth_login_uri VARCHAR(1024), keyset_uri VARCHAR(1024), target_link_uri VARCHAR(1024), "
				+ "PRIMARY KEY (issuer, client_id))",
		"CREATE TABLE IF NOT EXISTS deployment (issuer VARCHAR(255) NOT NULL, deployment_id VARCHAR(255) NOT NULL, "
				+ "PRIMARY KEY (issuer, deployment_id))",
		"CREATE TABLE IF NOT EXISTS nonce (nonce VARCHAR(255) NOT NULL PRIMARY KEY, target_link_uri VARCHAR(1024) NOT NULL, expires BIGINT NOT NULL)",
		"CREATE TABLE IF NOT EXISTS launch_data (launch_id VARCHAR(255) NOT NULL PRIMARY KEY, claims TEXT NOT NULL, expires BIGINT NOT NULL)",
		"CREATE TABLE IF NOT EXISTS access_token (token_key VARCHAR(2048) NOT NULL PRIMARY KEY, token_uri VARCHAR(1024) NOT NULL, "
				+ "client_id VARCHAR(255) NOT NULL, scopes VARCHAR(1024) NOT NULL, token TEXT NOT NULL, expires BIGINT NOT NULL)"
	};

	private final String url;
	private final String user;
	private final String password;
	private final Clock clock;
	private final Duration nonceLifetime;
	private final Duration launchLifetime;

	public JdbcStore(String url, String user, String password) {
		this(url, user, password, Clock.systemUTC(), LtiSettings.DEFAULT_LIFETIME, LtiSettings.DEFAULT_LIFETIME);
	}

	public JdbcStore(String url, String user, String password, Clock clock, Duration nonceLifetime, Duration launchLifetime) {
		if (url == null || url.isEmpty()) throw new IllegalArgumentException("A JDBC url is required.");
		this.url = url;
		this.user = user;
		this.password = password;
		this.clock = clock;
		this.nonceLifetime = nonceLifetime;
		this.launchLifetime = launchLifetime;
	}

	private Connection connect() throws SQLException {
		return user == null ? DriverManager.getConnection(url) : DriverManager.getConnection(url, user, password);
	}

	/** Creates the tables if they do not exist yet. */
	public void createSchema() throws DatastoreException {
		try (Connection c = connect(); Statement s = c.createStatement()) {
			for (String ddl : SCHEMA) s.executeUpdate(ddl);
			logger.info("LTI tables are ready at " + url);
		} catch (SQLException e) {
			throw new DatastoreException("Unable to create LTI tables: " + e.getMessage(), e);
		}
	}

	@Override
	public void storeRegistration(Registration r) throws DatastoreException {
		try (Connection c = connect()) {
			c.setAutoCommit(false);
			try (PreparedStatement delete = c.prepareStatement("DELETE FROM registration WHERE issuer = ? AND client_id = ?");
					PreparedStatement insert = c.prepareStatement("INSERT INTO registration (issuer, client_id, auth_token_uri, auth_login_uri, keyset_uri, target_link_uri) VALUES (?, ?, ?, ?, ?, ?)")) {
				delete.setString(1, r.getIssuer());
				delete.setString(2, r.getClientId());
				delete.executeUpdate();
				insert.setString(1, r.getIssuer());
				insert.setString(2, r.getClientId());
				insert.setString(3, r.getAuthTokenUri());
				insert.setString(4, r.getAuthLoginUri());
				insert.setString(5, r.getKeysetUri());
				insert.setString(6, r.getTargetLinkUri());
				insert.executeUpdate();
				c.commit();
			} catch (SQLException e) {
				c.rollback();
				throw e;
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to store " + r + ": " + e.getMessage(), e);
		}
	}

	@Override
	public Registration findRegistration(String issuer, String clientId) throws DatastoreException {
		try (Connection c = connect();
				PreparedStatement select = c.prepareStatement("SELECT auth_token_uri, auth_login_uri, keyset_uri, target_link_uri FROM registration WHERE issuer = ? AND client_id = ?")) {
			select.setString(1, issuer);
			select.setString(2, clientId);
			try (ResultSet rs = select.executeQuery()) {
				if (!rs.next()) throw new RegistrationNotFoundException("No registration for issuer " + issuer + " and client_id " + clientId);
				return new Registration(issuer, clientId, rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4));
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to load registration for issuer " + issuer + ": " + e.getMessage(), e);
		}
	}

	@Override
	public void storeDeployment(Deployment d) throws DatastoreException {
		try (Connection c = connect()) {
			c.setAutoCommit(false);
			try (PreparedStatement delete = c.prepareStatement("DELETE FROM deployment WHERE issuer = ? AND deployment_id = ?");
					PreparedStatement insert = c.prepareStatement("INSERT INTO deployment (issuer, deployment_id) VALUES (?, ?)")) {
				delete.setString(1, d.getIssuer());
				delete.setString(2, d.getDeploymentId());
				delete.executeUpdate();
				insert.setString(1, d.getIssuer());
				insert.setString(2, d.getDeploymentId());
				insert.executeUpdate();
				c.commit();
			} catch (SQLException e) {
				c.rollback();
				throw e;
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to store " + d + ": " + e.getMessage(), e);
		}
	}

	@Override
	public Deployment findDeployment(String issuer, String deploymentId) throws DatastoreException {
		try (Connection c = connect();
				PreparedStatement select = c.prepareStatement("SELECT deployment_id FROM deployment WHERE issuer = ? AND deployment_id = ?")) {
			select.setString(1, issuer);
			select.setString(2, deploymentId);
			try (ResultSet rs = select.executeQuery()) {
				if (!rs.next()) throw new DeploymentNotFoundException("No deployment " + deploymentId + " for issuer " + issuer);
				return new Deployment(issuer, rs.getString(1));
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to load deployment for issuer " + issuer + ": " + e.getMessage(), e);
		}
	}

	@Override
	public void storeNonce(String nonce, String targetLinkUri) throws DatastoreException {
		try (Connection c = connect();
				PreparedStatement insert = c.prepareStatement("INSERT INTO nonce (nonce, target_link_uri, expires) VALUES (?, ?, ?)")) {
			insert.setString(1, nonce);
			insert.setString(2, targetLinkUri);
			insert.setLong(3, clock.instant().plus(nonceLifetime).toEpochMilli());
			insert.executeUpdate();
		} catch (SQLException e) {
			throw new DatastoreException("Unable to store nonce: " + e.getMessage(), e);
		}
	}

	@Override
	public void testAndClearNonce(String nonce, String targetLinkUri) throws DatastoreException {
		String storedUri;
		long expires;
		try (Connection c = connect()) {
			c.setAutoCommit(false);
			try (PreparedStatement select = c.prepareStatement("SELECT target_link_uri, expires FROM nonce WHERE nonce = ?");
					PreparedStatement delete = c.prepareStatement("DELETE FROM nonce WHERE nonce = ?")) {
				select.setString(1, nonce);
				try (ResultSet rs = select.executeQuery()) {
					if (!rs.next()) {
						c.rollback();
						throw new NonceNotFoundException("Nonce was not found or has already been used.");
					}
					storedUri = rs.getString(1);
					expires = rs.getLong(2);
				}
				delete.setString(1, nonce);
				int deleted = delete.executeUpdate();
				c.commit();
				// another launch consumed it between the select and the delete
				if (deleted == 0) throw new NonceNotFoundException("Nonce was not found or has already been used.");
			} catch (SQLException e) {
				c.rollback();
				throw e;
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to consume nonce: " + e.getMessage(), e);
		}
		if (clock.millis() >= expires) throw new NonceNotFoundException("Nonce has expired.");
		if (!storedUri.equals(targetLinkUri)) throw new NonceMismatchException("Nonce was issued for a different target_link_uri.");
	}

	@Override
	public void storeLaunchData(String launchId, String claimsJson) throws DatastoreException {
		long now = clock.millis();
		try (Connection c = connect();
				PreparedStatement insert = c.prepareStatement("INSERT INTO launch_data (launch_id, claims, expires) VALUES (?, ?, ?)");
				PreparedStatement purge = c.prepareStatement("DELETE FROM launch_data WHERE expires <= ?")) {
			insert.setString(1, launchId);
			insert.setString(2, claimsJson);
			insert.setLong(3, now + launchLifetime.toMillis());
			insert.executeUpdate();
			purge.setLong(1, now);
			int purged = purge.executeUpdate();
			if (purged > 0) logger.fine("Purged " + purged + " expired launches.");
		} catch (SQLException e) {
			throw new DatastoreException("Unable to store launch " + launchId + ": " + e.getMessage(), e);
		}
	}

	@Override
	public String findLaunchData(String launchId) throws DatastoreException {
		try (Connection c = connect();
				PreparedStatement select = c.prepareStatement("SELECT claims, expires FROM launch_data WHERE launch_id = ?")) {
			select.setString(1, launchId);
			try (ResultSet rs = select.executeQuery()) {
				if (!rs.next() || clock.millis() >= rs.getLong(2)) throw new LaunchDataNotFoundException("Launch " + launchId + " was not found or has expired.");
				return rs.getString(1);
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to load launch " + launchId + ": " + e.getMessage(), e);
		}
	}

	@Override
	public void storeAccessToken(AccessToken token) throws DatastoreException {
		try (Connection c = connect()) {
			c.setAutoCommit(false);
			try (PreparedStatement delete = c.prepareStatement("DELETE FROM access_token WHERE token_key = ?");
					PreparedStatement insert = c.prepareStatement("INSERT INTO access_token (token_key, token_uri, client_id, scopes, token, expires) VALUES (?, ?, ?, ?, ?, ?)")) {
				delete.setString(1, token.cacheKey());
				delete.executeUpdate();
				insert.setString(1, token.cacheKey());
				insert.setString(2, token.getTokenUri());
				insert.setString(3, token.getClientId());
				insert.setString(4, String.join(" ", token.getScopes()));
				insert.setString(5, token.getToken());
				insert.setLong(6, token.getExpiresAt().toEpochMilli());
				insert.executeUpdate();
				c.commit();
			} catch (SQLException e) {
				c.rollback();
				throw e;
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to store access token for " + token.getTokenUri() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public AccessToken findAccessToken(String tokenUri, String clientId, Collection<String> scopes) throws DatastoreException {
		try (Connection c = connect();
				PreparedStatement select = c.prepareStatement("SELECT scopes, token, expires FROM access_token WHERE token_key = ?")) {
			select.setString(1, AccessToken.cacheKey(tokenUri, clientId, scopes));
			try (ResultSet rs = select.executeQuery()) {
				if (!rs.next()) throw new AccessTokenNotFoundException("No cached access token for " + tokenUri);
				String storedScopes = rs.getString(1);
				AccessToken token = new AccessToken(tokenUri, clientId, storedScopes.isEmpty() ? Arrays.<String>asList() : Arrays.asList(storedScopes.split(" ")),
						rs.getString(2), Instant.ofEpochMilli(rs.getLong(3)));
				if (token.isExpired(clock.instant())) throw new AccessTokenExpiredException("Cached access token for " + tokenUri + " has expired.");
				return token;
			}
		} catch (SQLException e) {
			throw new DatastoreException("Unable to load access token for " + tokenUri + ": " + e.getMessage(), e);
		}
	}
}
