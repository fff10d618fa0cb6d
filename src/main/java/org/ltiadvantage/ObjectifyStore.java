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

import static com.googlecode.objectify.ObjectifyService.ofy;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;

import com.googlecode.objectify.ObjectifyService;
import com.googlecode.objectify.annotation.Entity;
import com.googlecode.objectify.annotation.Id;
import com.googlecode.objectify.annotation.Index;

/**
 * ObjectifyStore - implements all four storage roles on Google Cloud Datastore.
 *
 * ObjectifyService.init() must already have been called (see LtiWebListener) and
 * register() must run once before first use. Every operation opens its own Objectify
 * context, so the store can be used outside of a request filter.
 * Nonces are consumed inside a transaction.
 */
public class ObjectifyStore implements RegistrationStore, NonceStore, LaunchDataStore, AccessTokenStore {

	private final Clock clock;
	private final Duration nonceLifetime;
	private final Duration launchLifetime;

	@Entity
	static class RegistrationEntity {
		@Id String id;
		String issuer;
		String clientId;
		String authTokenUri;
		String authLoginUri;
		String keysetUri;
		String targetLinkUri;

		RegistrationEntity() {}
	}

	@Entity
	static class DeploymentEntity {
		@Id String id;
		String issuer;
		String deploymentId;

		DeploymentEntity() {}
	}

	@Entity
	static class NonceEntity {
		@Id String id;
		String targetLinkUri;
		@Index Date expires;

		NonceEntity() {}
	}

	@Entity
	static class LaunchDataEntity {
		@Id String id;
		String claims;
		@Index Date expires;

		LaunchDataEntity() {}
	}

	@Entity
	static class AccessTokenEntity {
		@Id String id;
		String tokenUri;
		String clientId;
		List<String> scopes = new ArrayList<String>();
		String token;
		Date expires;

		AccessTokenEntity() {}
	}

	public ObjectifyStore() {
		this(Clock.systemUTC(), LtiSettings.DEFAULT_LIFETIME, LtiSettings.DEFAULT_LIFETIME);
	}

	public ObjectifyStore(Clock clock, Duration nonceLifetime, Duration launchLifetime) {
		this.clock = clock;
		this.nonceLifetime = nonceLifetime;
		this.launchLifetime = launchLifetime;
	}

	public static void register() {
		ObjectifyService.register(RegistrationEntity.class);
		ObjectifyService.register(DeploymentEntity.class);
		ObjectifyService.register(NonceEntity.class);
		ObjectifyService.register(LaunchDataEntity.class);
		ObjectifyService.register(AccessTokenEntity.class);
	}

	private static String key(String a, String b) {
		return a + "\n" + b;
	}

	@Override
	public void storeRegistration(Registration r) throws DatastoreException {
		RegistrationEntity e = new RegistrationEntity();
		e.id = key(r.getIssuer(), r.getClientId());
		e.issuer = r.getIssuer();
		e.clientId = r.getClientId();
		e.authTokenUri = r.getAuthTokenUri();
		e.authLoginUri = r.getAuthLoginUri();
		e.keysetUri = r.getKeysetUri();
		e.targetLinkUri = r.getTargetLinkUri();
		try {
			ObjectifyService.run(() -> ofy().save().entity(e).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to store " + r + ": " + ex.getMessage(), ex);
		}
	}

	@Override
	public Registration findRegistration(String issuer, String clientId) throws DatastoreException {
		RegistrationEntity e;
		try {
			e = ObjectifyService.run(() -> ofy().load().type(RegistrationEntity.class).id(key(issuer, clientId)).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to load registration for issuer " + issuer + ": " + ex.getMessage(), ex);
		}
		if (e == null) throw new RegistrationNotFoundException("No registration for issuer " + issuer + " and client_id " + clientId);
		return new Registration(e.issuer, e.clientId, e.authTokenUri, e.authLoginUri, e.keysetUri, e.targetLinkUri);
	}

	@Override
	public void storeDeployment(Deployment d) throws DatastoreException {
		DeploymentEntity e = new DeploymentEntity();
		e.id = key(d.getIssuer(), d.getDeploymentId());
		e.issuer = d.getIssuer();
		e.deploymentId = d.getDeploymentId();
		try {
			ObjectifyService.run(() -> ofy().save().entity(e).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to store " + d + ": " + ex.getMessage(), ex);
		}
	}

	@Override
	public Deployment findDeployment(String issuer, String deploymentId) throws DatastoreException {
		DeploymentEntity e;
		try {
			e = ObjectifyService.run(() -> ofy().load().type(DeploymentEntity.class).id(key(issuer, deploymentId)).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to load deployment for issuer " + issuer + ": " + ex.getMessage(), ex);
		}
		if (e == null) throw new DeploymentNotFoundException("No deployment " + deploymentId + " for issuer " + issuer);
		return new Deployment(e.issuer, e.deploymentId);
	}

	@Override
	public void storeNonce(String nonce, String targetLinkUri) throws DatastoreException {
		NonceEntity e = new NonceEntity();
		e.id = nonce;
		e.targetLinkUri = targetLinkUri;
		e.expires = Date.from(clock.instant().plus(nonceLifetime));
		try {
			ObjectifyService.run(() -> ofy().save().entity(e).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to store nonce: " + ex.getMessage(), ex);
		}
	}

	@Override
	public void testAndClearNonce(String nonce, String targetLinkUri) throws DatastoreException {
		NonceEntity e;
		try {
			e = ObjectifyService.run(() -> ofy().transact(() -> {
				NonceEntity found = ofy().load().type(NonceEntity.class).id(nonce).now();
				if (found != null) ofy().delete().entity(found);
				return found;
			}));
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to consume nonce: " + ex.getMessage(), ex);
		}
		if (e == null || !clock.instant().isBefore(e.expires.toInstant())) throw new NonceNotFoundException("Nonce was not found or has already been used.");
		if (!e.targetLinkUri.equals(targetLinkUri)) throw new NonceMismatchException("Nonce was issued for a different target_link_uri.");
	}

	@Override
	public void storeLaunchData(String launchId, String claimsJson) throws DatastoreException {
		LaunchDataEntity e = new LaunchDataEntity();
		e.id = launchId;
		e.claims = claimsJson;
		e.expires = Date.from(clock.instant().plus(launchLifetime));
		try {
			ObjectifyService.run(() -> ofy().save().entity(e).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to store launch " + launchId + ": " + ex.getMessage(), ex);
		}
	}

	@Override
	public String findLaunchData(String launchId) throws DatastoreException {
		LaunchDataEntity e;
		try {
			e = ObjectifyService.run(() -> ofy().load().type(LaunchDataEntity.class).id(launchId).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to load launch " + launchId + ": " + ex.getMessage(), ex);
		}
		if (e == null || !clock.instant().isBefore(e.expires.toInstant())) throw new LaunchDataNotFoundException("Launch " + launchId + " was not found or has expired.");
		return e.claims;
	}

	@Override
	public void storeAccessToken(AccessToken token) throws DatastoreException {
		AccessTokenEntity e = new AccessTokenEntity();
		e.id = token.cacheKey();
		e.tokenUri = token.getTokenUri();
		e.clientId = token.getClientId();
		e.scopes = new ArrayList<String>(token.getScopes());
		e.token = token.getToken();
		e.expires = Date.from(token.getExpiresAt());
		try {
			ObjectifyService.run(() -> ofy().save().entity(e).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to store access token for " + token.getTokenUri() + ": " + ex.getMessage(), ex);
		}
	}

	@Override
	public AccessToken findAccessToken(String tokenUri, String clientId, Collection<String> scopes) throws DatastoreException {
		AccessTokenEntity e;
		try {
			e = ObjectifyService.run(() -> ofy().load().type(AccessTokenEntity.class).id(AccessToken.cacheKey(tokenUri, clientId, scopes)).now());
		} catch (RuntimeException ex) {
			throw new DatastoreException("Unable to load access token for " + tokenUri + ": " + ex.getMessage(), ex);
		}
		if (e == null) throw new AccessTokenNotFoundException("No cached access token for " + tokenUri);
		AccessToken token = new AccessToken(e.tokenUri, e.clientId, e.scopes, e.token, e.expires.toInstant());
		if (token.isExpired(clock.instant())) throw new AccessTokenExpiredException("Cached access token for " + tokenUri + " has expired.");
		return token;
	}
}
