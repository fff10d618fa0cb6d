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

import java.net.MalformedURLException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

import com.auth0.jwk.Jwk;
import com.auth0.jwk.SigningKeyNotFoundException;
import com.auth0.jwk.UrlJwkProvider;
import com.google.gson.JsonParseException;

/**
 * Connector - a tool session rebuilt from the launch id that LaunchFilter attached to the request.
 *
 * It holds the verified launch claims, the tool's signing key and the most recent access token,
 * and is the starting point for calls back into the platform:
 *
 * <pre>
 * Connector connector = new Connector(stores, LaunchFilter.launchId(request));
 * connector.setSigningKey(toolKey);
 * Ags ags = connector.upgradeAgs();
 * ags.putScore(score);
 * </pre>
 *
 * One Connector serves one launch and one thread; it is not shared between requests.
 */
public class Connector {

	private static final Logger logger = Logger.getLogger(Connector.class.getName());

	private final Datastores stores;
	private final String launchId;
	private final LaunchClaims claims;
	private final Clock clock;
	private final AccessTokenManager tokens;
	private final ServiceRequestDispatcher dispatcher;
	private ToolKey signingKey;
	private AccessToken accessToken;
	private Duration timeout = LtiSettings.DEFAULT_HTTP_TIMEOUT;

	public Connector(Datastores stores, String launchId) throws ConnectorException {
		this(stores, launchId, Clock.systemUTC());
	}

	Connector(Datastores stores, String launchId, Clock clock) throws ConnectorException {
		if (launchId == null || launchId.isEmpty()) throw new ConnectorException("A launch id is required.");
		this.stores = stores;
		this.launchId = launchId;
		this.clock = clock;
		String claimsJson;
		try {
			claimsJson = stores.launchData().findLaunchData(launchId);
		} catch (LaunchDataNotFoundException e) {
			throw new ConnectorException("Launch " + launchId + " was not found or has expired.", e);
		} catch (DatastoreException e) {
			throw new ConnectorException("Unable to load launch " + launchId + ": " + e.getMessage(), e);
		}
		try {
			this.claims = LaunchClaims.parse(claimsJson);
		} catch (JsonParseException e) {
			throw new ConnectorException("The stored claims of launch " + launchId + " are malformed: " + e.getMessage(), e);
		}
		this.tokens = new AccessTokenManager(this);
		this.dispatcher = new ServiceRequestDispatcher(this);
	}

	public String getLaunchId() {
		return launchId;
	}

	public LaunchClaims getClaims() {
		return claims;
	}

	Datastores getStores() {
		return stores;
	}

	Clock getClock() {
		return clock;
	}

	public void setSigningKey(ToolKey signingKey) {
		this.signingKey = signingKey;
	}

	/** Sets the signing key from a PEM encoded RSA private key. */
	public void setSigningKey(String kid, String pem) throws SigningKeyException {
		this.signingKey = ToolKey.fromPem(kid, pem);
	}

	public ToolKey getSigningKey() {
		return signingKey;
	}

	/** The token most recently obtained for this session, or null before the first service call. */
	public AccessToken getAccessToken() {
		return accessToken;
	}

	void setAccessToken(AccessToken accessToken) {
		this.accessToken = accessToken;
	}

	public Duration getTimeout() {
		return timeout;
	}

	/** Sets the timeout applied to each token exchange and service call. */
	public void setTimeout(Duration timeout) {
		if (timeout == null || timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("The timeout must be positive.");
		this.timeout = timeout;
	}

	/** The Registration that issued this launch. */
	public Registration getRegistration() throws ConnectorException {
		try {
			return stores.registrations().findRegistration(claims.getIssuer(), claims.getClientId());
		} catch (DatastoreException e) {
			throw new ConnectorException("Unable to find the registration for " + claims.getIssuer() + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Returns a bearer token for the scopes, from cache when one is still valid.
	 */
	public AccessToken obtainAccessToken(Collection<String> scopes) throws ConnectorException {
		return tokens.obtain(scopes);
	}

	/** Performs one authenticated call. The caller closes the returned response. */
	public ServiceResponse dispatch(ServiceRequest request) throws ConnectorException {
		return dispatcher.dispatch(request);
	}

	/**
	 * Returns the Assignment and Grade Services client for this launch.
	 * @throws ServiceUnsupportedException if the platform did not offer AGS in the launch
	 */
	public Ags upgradeAgs() throws ConnectorException {
		return new Ags(this);
	}

	/**
	 * Returns the Names and Role Provisioning Services client for this launch.
	 * @throws ServiceUnsupportedException if the platform did not offer NRPS in the launch
	 */
	public Nrps upgradeNrps() throws ConnectorException {
		return new Nrps(this);
	}

	/** Fetches the platform's current public keys from the registration's JWKS URL. */
	public List<Jwk> platformKeys() throws ConnectorException {
		Registration registration = getRegistration();
		if (registration.getKeysetUri() == null) throw new ConnectorException("The registration for " + registration.getIssuer() + " has no JWKS URL.");
		try {
			UrlJwkProvider provider = new UrlJwkProvider(URI.create(registration.getKeysetUri()).toURL(), (int) timeout.toMillis(), (int) timeout.toMillis());
			return provider.getAll();
		} catch (MalformedURLException | IllegalArgumentException e) {
			logger.warning("Bad JWKS URL for " + registration + ": " + e.getMessage());
			throw new ConnectorException("The registration JWKS URL is invalid.", e);
		} catch (SigningKeyNotFoundException e) {
			throw new ConnectorException("Unable to read the platform JWKS: " + e.getMessage(), e);
		}
	}
}
