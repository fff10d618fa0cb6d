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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * InMemoryStore - implements all four storage roles with ConcurrentHashMaps.
 *
 * Suitable for a single server instance and for tests. Nothing survives a restart.
 * Safe for concurrent launches: a nonce is consumed with a single atomic remove(),
 * so two requests presenting the same nonce can never both succeed.
 */
public class InMemoryStore implements RegistrationStore, NonceStore, LaunchDataStore, AccessTokenStore {

	private static final Logger logger = Logger.getLogger(InMemoryStore.class.getName());

	private final Map<String, Registration> registrations = new ConcurrentHashMap<String, Registration>();
	private final Map<String, Deployment> deployments = new ConcurrentHashMap<String, Deployment>();
	private final Map<String, Stamped> nonces = new ConcurrentHashMap<String, Stamped>();
	private final Map<String, Stamped> launches = new ConcurrentHashMap<String, Stamped>();
	private final Map<String, AccessToken> accessTokens = new ConcurrentHashMap<String, AccessToken>();

	private final Clock clock;
	private final Duration nonceLifetime;
	private final Duration launchLifetime;

	// a value together with the instant after which it is no longer usable
	private static class Stamped {
		final String value;
		final Instant expires;

		Stamped(String value, Instant expires) {
			this.value = value;
			this.expires = expires;
		}
	}

	public InMemoryStore() {
		this(Clock.systemUTC(), LtiSettings.DEFAULT_LIFETIME, LtiSettings.DEFAULT_LIFETIME);
	}

	public InMemoryStore(Clock clock, Duration nonceLifetime, Duration launchLifetime) {
		this.clock = clock;
		this.nonceLifetime = nonceLifetime;
		this.launchLifetime = launchLifetime;
	}

	private static String key(String a, String b) {
		return a + "\n" + b;
	}

	@Override
	public void storeRegistration(Registration registration) {
		registrations.put(key(registration.getIssuer(), registration.getClientId()), registration);
	}

	@Override
	public Registration findRegistration(String issuer, String clientId) throws DatastoreException {
		Registration r = registrations.get(key(issuer, clientId));
		if (r == null) throw new RegistrationNotFoundException("No registration for issuer " + issuer + " and client_id " + clientId);
		return r;
	}

	@Override
	public void storeDeployment(Deployment deployment) {
		deployments.put(key(deployment.getIssuer(), deployment.getDeploymentId()), deployment);
	}

	@Override
	public Deployment findDeployment(String issuer, String deploymentId) throws DatastoreException {
		Deployment d = deployments.get(key(issuer, deploymentId));
		if (d == null) throw new DeploymentNotFoundException("No deployment " + deploymentId + " for issuer " + issuer);
		return d;
	}

	@Override
	public void storeNonce(String nonce, String targetLinkUri) {
		nonces.put(nonce, new Stamped(targetLinkUri, clock.instant().plus(nonceLifetime)));
	}

	@Override
	public void testAndClearNonce(String nonce, String targetLinkUri) throws DatastoreException {
		Stamped stored = nonces.remove(nonce);
		if (stored == null || !clock.instant().isBefore(stored.expires)) throw new NonceNotFoundException("Nonce was not found or has already been used.");
		if (!stored.value.equals(targetLinkUri)) throw new NonceMismatchException("Nonce was issued for a different target_link_uri.");
	}

	@Override
	public void storeLaunchData(String launchId, String claimsJson) {
		launches.put(launchId, new Stamped(claimsJson, clock.instant().plus(launchLifetime)));
		purgeExpired();
	}

	@Override
	public String findLaunchData(String launchId) throws DatastoreException {
		Stamped stored = launches.get(launchId);
		if (stored == null || !clock.instant().isBefore(stored.expires)) throw new LaunchDataNotFoundException("Launch " + launchId + " was not found or has expired.");
		return stored.value;
	}

	@Override
	public void storeAccessToken(AccessToken token) {
		accessTokens.put(token.cacheKey(), token);
	}

	@Override
	public AccessToken findAccessToken(String tokenUri, String clientId, Collection<String> scopes) throws DatastoreException {
		AccessToken token = accessTokens.get(AccessToken.cacheKey(tokenUri, clientId, scopes));
		if (token == null) throw new AccessTokenNotFoundException("No cached access token for " + tokenUri);
		if (token.isExpired(clock.instant())) throw new AccessTokenExpiredException("Cached access token for " + tokenUri + " has expired.");
		return token;
	}

	// drops stale nonces and launches so the maps do not grow without bound
	void purgeExpired() {
		Instant now = clock.instant();
		int before = nonces.size() + launches.size();
		nonces.values().removeIf(s -> !now.isBefore(s.expires));
		launches.values().removeIf(s -> !now.isBefore(s.expires));
		int purged = before - nonces.size() - launches.size();
		if (purged > 0) logger.fine("Purged " + purged + " expired nonces and launches.");
	}
}
