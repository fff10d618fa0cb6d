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

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import java.util.logging.Logger;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/* AccessTokenManager obtains OAuth2 bearer tokens from the platform for a Connector.
 *
 * Tokens are requested with the client-credentials grant, authenticating with a JWT
 * client assertion signed by the tool's private key (RFC 7523). Each token is cached under
 * (token endpoint, client_id, sorted scopes) until it expires, so repeated service calls
 * for the same scopes cost one exchange per token lifetime.
 * Token values are never logged.
 */
class AccessTokenManager {

	private static final Logger logger = Logger.getLogger(AccessTokenManager.class.getName());

	static final String CLIENT_ASSERTION_TYPE = "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";
	static final Duration CLOCK_SKEW_ALLOWANCE = Duration.ofMinutes(2);
	static final Duration ASSERTION_LIFETIME = Duration.ofHours(1);
	static final long DEFAULT_EXPIRES_IN = 3600;

	private final Connector connector;

	AccessTokenManager(Connector connector) {
		this.connector = connector;
	}

	AccessToken obtain(Collection<String> scopes) throws ConnectorException {
		if (scopes == null || scopes.isEmpty()) throw new ConnectorException("At least one scope is required for an access token.");
		Registration registration = connector.getRegistration();
		List<String> sorted = AccessToken.sortedScopes(scopes);

		AccessToken cached = findCached(registration, sorted);
		if (cached != null) {
			logger.fine("Using cached access token for " + registration.getAuthTokenUri() + " " + sorted);
			connector.setAccessToken(cached);
			return cached;
		}

		// No usable cached token, so request a new one from the platform
		String assertion = clientAssertion(registration);
		AccessToken token = requestToken(registration, sorted, assertion);
		try {
			connector.getStores().accessTokens().storeAccessToken(token);
		} catch (DatastoreException e) {
			throw new ConnectorException("Unable to cache the access token: " + e.getMessage(), e);
		}
		logger.fine("Obtained new access token for " + registration.getAuthTokenUri() + " " + sorted + ", expires " + token.getExpiresAt());
		connector.setAccessToken(token);
		return token;
	}

	private AccessToken findCached(Registration registration, List<String> scopes) throws ConnectorException {
		try {
			return connector.getStores().accessTokens().findAccessToken(registration.getAuthTokenUri(), registration.getClientId(), scopes);
		} catch (AccessTokenNotFoundException | AccessTokenExpiredException e) {
			return null;
		} catch (DatastoreException e) {
			throw new ConnectorException("Unable to read the access token cache: " + e.getMessage(), e);
		}
	}

	String clientAssertion(Registration registration) throws SigningKeyException {
		ToolKey key = connector.getSigningKey();
		if (key == null || key.getPrivateKey() == null) throw new SigningKeyException("No signing key is configured; cannot request an access token.");
		Instant now = connector.getClock().instant();
		try {
			return JWT.create()
					.withIssuer(registration.getClientId())
					.withSubject(registration.getClientId())
					.withAudience(registration.getAuthTokenUri())
					.withKeyId(key.getKid())
					.withIssuedAt(Date.from(now.minus(CLOCK_SKEW_ALLOWANCE)))
					.withExpiresAt(Date.from(now.plus(ASSERTION_LIFETIME)))
					.withJWTId("lti-service-token-" + UUID.randomUUID())
					.sign(Algorithm.RSA256(null, key.getPrivateKey()));
		} catch (IllegalArgumentException | JWTCreationException e) {
			throw new SigningKeyException("Unable to sign the client assertion with key " + key.getKid() + ".", e);
		}
	}

	AccessToken requestToken(Registration registration, List<String> scopes, String assertion) throws ConnectorException {
		String tokenUri = registration.getAuthTokenUri();
		if (tokenUri == null) throw new ConnectorException("The registration for " + registration.getIssuer() + " has no token endpoint.");

		String body = "grant_type=client_credentials"
				+ "&client_assertion_type=" + URLEncoder.encode(CLIENT_ASSERTION_TYPE, StandardCharsets.UTF_8)
				+ "&client_assertion=" + URLEncoder.encode(assertion, StandardCharsets.UTF_8)
				+ "&scope=" + URLEncoder.encode(String.join(" ", scopes), StandardCharsets.UTF_8);

		HttpURLConnection uc = null;
		try {
			int timeout = (int) connector.getTimeout().toMillis();
			uc = (HttpURLConnection) URI.create(tokenUri).toURL().openConnection();
			uc.setDoOutput(true);
			uc.setDoInput(true);
			uc.setRequestMethod("POST");
			uc.setRequestProperty("Content-Type", "application/x-www-form-urlencoded");
			uc.setRequestProperty("Accept", "application/json");
			uc.setUseCaches(false);
			uc.setConnectTimeout(timeout);
			uc.setReadTimeout(timeout);  // waits up to the timeout for the platform to respond
			try (OutputStream out = uc.getOutputStream()) {
				out.write(body.getBytes(StandardCharsets.UTF_8));
			}

			int responseCode = uc.getResponseCode();
			if (responseCode != 200) throw new ServiceRequestException(tokenUri, responseCode, uc.getResponseMessage());

			JsonObject json;
			try (InputStreamReader reader = new InputStreamReader(uc.getInputStream(), StandardCharsets.UTF_8)) {
				JsonElement e = JsonParser.parseReader(reader);
				if (!e.isJsonObject()) throw new ConnectorException("The token endpoint response is not a JSON object.");
				json = e.getAsJsonObject();
			}
			if (!json.has("access_token") || !json.get("access_token").isJsonPrimitive()) throw new ConnectorException("The token endpoint response has no access_token.");
			String accessToken = json.get("access_token").getAsString();
			long expiresIn = json.has("expires_in") ? json.get("expires_in").getAsLong() : DEFAULT_EXPIRES_IN;  // number of seconds from now, typically 3600
			Instant expiresAt = connector.getClock().instant().plusSeconds(expiresIn);
			return new AccessToken(tokenUri, registration.getClientId(), scopes, accessToken, expiresAt);
		} catch (IOException | IllegalArgumentException e) {
			throw new ConnectorException("Access token request to " + tokenUri + " failed: " + e.getMessage(), e);
		} catch (JsonParseException | UnsupportedOperationException | IllegalStateException e) {
			throw new ConnectorException("The token endpoint response from " + tokenUri + " is malformed.", e);
		} finally {
			if (uc != null) uc.disconnect();
		}
	}
}
