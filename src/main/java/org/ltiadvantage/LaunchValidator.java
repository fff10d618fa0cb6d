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
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;
import java.util.logging.Logger;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import com.auth0.jwk.Jwk;
import com.auth0.jwk.JwkException;
import com.auth0.jwk.JwkProvider;
import com.auth0.jwk.NetworkException;
import com.auth0.jwk.SigningKeyNotFoundException;
import com.auth0.jwk.UrlJwkProvider;
import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.google.gson.JsonParseException;

/* LaunchValidator checks an LTI v1.3 ResourceLink launch request.
 *
 * The platform POSTs an id_token (a JWT signed with the platform's private key) and the state
 * value that this tool issued at login. The checks run in a fixed order and stop at the first
 * failure, because each later check relies on the earlier ones:
 *
 *  TOKEN          the id_token is present and is a structurally valid JWT (not yet trusted)
 *  REGISTRATION   the unverified iss and client_id identify a known Registration
 *  SIGNATURE      the JWT is signed (RS256) by a key in the platform's JWKS and is not expired
 *  STATE          the state parameter matches the state cookie set at login
 *  AUDIENCE       the verified aud claim includes our client_id (and azp names it when aud has several values)
 *  NONCE          the nonce was issued by our login step for this target_link_uri and has not been used
 *  DEPLOYMENT     the deployment_id is known under the verified issuer
 *  VERSION        version 1.3.0 and message_type LtiResourceLinkRequest
 *  RESOURCE_LINK  a resource_link claim with an id of at most 255 characters
 *  LAUNCH_DATA    the verified claims are saved under a new launch id
 *
 * Each failure is a LaunchException carrying 400 (bad launch) or 500 (dependency failed).
 */
public class LaunchValidator {

	private static final Logger logger = Logger.getLogger(LaunchValidator.class.getName());

	public static final String STATE_COOKIE = "lti1p3-state";
	public static final String LEGACY_STATE_COOKIE = "lti1p3-state-legacy";
	public static final String LAUNCH_ID_PREFIX = "lti1p3-launch-";
	public static final String SUPPORTED_VERSION = "1.3.0";
	public static final String RESOURCE_LINK_REQUEST = "LtiResourceLinkRequest";
	static final int MAX_RESOURCE_LINK_ID_LENGTH = 255;

	private final Datastores stores;
	private final Duration keysetTimeout;

	public LaunchValidator(Datastores stores) {
		this(stores, LtiSettings.DEFAULT_HTTP_TIMEOUT);
	}

	public LaunchValidator(Datastores stores, Duration keysetTimeout) {
		this.stores = stores;
		this.keysetTimeout = keysetTimeout;
	}

	/**
	 * Validates the launch carried by a servlet request and returns the new launch id.
	 */
	public String validate(HttpServletRequest request) throws LaunchException {
		return validate(request.getParameter("id_token"), request.getParameter("state"), stateCookie(request));
	}

	static String stateCookie(HttpServletRequest request) {
		Cookie[] cookies = request.getCookies();
		if (cookies == null) return null;
		String legacy = null;
		for (Cookie c : cookies) {
			if (STATE_COOKIE.equals(c.getName())) return c.getValue();
			if (LEGACY_STATE_COOKIE.equals(c.getName())) legacy = c.getValue();
		}
		return legacy;
	}

	/**
	 * Runs every check against the posted id_token and state and returns the new launch id.
	 *
	 * @param idToken the id_token form parameter
	 * @param state the state form parameter
	 * @param stateCookie the value of the state cookie set at login, or null if the browser sent none
	 */
	public String validate(String idToken, String state, String stateCookie) throws LaunchException {
		DecodedJWT jwt = decode(idToken);
		Registration registration = findRegistration(jwt);
		LaunchClaims claims = verify(jwt, registration);
		checkState(state, stateCookie);
		checkAudience(claims, registration);
		checkNonce(claims);
		checkDeployment(claims);
		checkVersion(claims);
		checkResourceLink(claims);
		String launchId = storeLaunchData(jwt);
		logger.info("Accepted launch " + launchId + " from " + claims.getIssuer() + " deployment " + claims.getDeploymentId());
		return launchId;
	}

	DecodedJWT decode(String idToken) throws LaunchException {
		if (idToken == null || idToken.isEmpty()) throw LaunchException.badRequest(LaunchStep.TOKEN, "The id_token parameter is missing.");
		try {
			return JWT.decode(idToken);
		} catch (JWTDecodeException e) {
			throw LaunchException.badRequest(LaunchStep.TOKEN, "The id_token is not a valid JWT: " + e.getMessage(), e);
		}
	}

	Registration findRegistration(DecodedJWT jwt) throws LaunchException {
		String issuer = jwt.getIssuer();
		String clientId = jwt.getClaim("azp").isMissing() || jwt.getClaim("azp").isNull() ? null : jwt.getClaim("azp").asString();
		if (clientId == null && jwt.getAudience() != null && !jwt.getAudience().isEmpty()) clientId = jwt.getAudience().get(0);
		if (issuer == null || clientId == null) throw LaunchException.badRequest(LaunchStep.REGISTRATION, "The id_token has no iss or client_id.");
		try {
			return stores.registrations().findRegistration(issuer, clientId);
		} catch (RegistrationNotFoundException e) {
			throw LaunchException.badRequest(LaunchStep.REGISTRATION, "The platform " + issuer + " is not registered for client_id " + clientId + ".", e);
		} catch (DatastoreException e) {
			throw LaunchException.serverError(LaunchStep.REGISTRATION, "Unable to look up the registration: " + e.getMessage(), e);
		}
	}

	LaunchClaims verify(DecodedJWT jwt, Registration registration) throws LaunchException {
		if (!"RS256".equals(jwt.getAlgorithm())) throw LaunchException.badRequest(LaunchStep.SIGNATURE, "JWT algorithm must be RS256.");
		if (jwt.getKeyId() == null || jwt.getKeyId().isEmpty()) throw LaunchException.badRequest(LaunchStep.SIGNATURE, "No JWK id found in the id_token header.");
		if (registration.getKeysetUri() == null) throw LaunchException.serverError(LaunchStep.SIGNATURE, "The registration has no JWKS URL.", null);

		// retrieve the public Java Web Key from the platform to verify the signature
		RSAPublicKey publicKey;
		try {
			JwkProvider provider = new UrlJwkProvider(toUrl(registration.getKeysetUri()), (int) keysetTimeout.toMillis(), (int) keysetTimeout.toMillis());
			Jwk jwk = provider.get(jwt.getKeyId());
			publicKey = (RSAPublicKey) jwk.getPublicKey();
		} catch (MalformedURLException | IllegalArgumentException e) {
			throw LaunchException.serverError(LaunchStep.SIGNATURE, "The registration JWKS URL is invalid.", e);
		} catch (NetworkException e) {
			throw LaunchException.serverError(LaunchStep.SIGNATURE, "Unable to fetch the platform JWKS: " + e.getMessage(), e);
		} catch (SigningKeyNotFoundException e) {
			throw LaunchException.badRequest(LaunchStep.SIGNATURE, "The platform JWKS has no usable key " + jwt.getKeyId() + ".", e);
		} catch (JwkException | ClassCastException e) {
			throw LaunchException.badRequest(LaunchStep.SIGNATURE, "The platform key " + jwt.getKeyId() + " is not an RSA public key.", e);
		}

		try {
			JWT.require(Algorithm.RSA256(publicKey, null)).build().verify(jwt);
		} catch (JWTVerificationException e) {
			throw LaunchException.badRequest(LaunchStep.SIGNATURE, "ID token could not be validated: " + e.getMessage(), e);
		}

		try {
			return LaunchClaims.parse(payload(jwt));
		} catch (JsonParseException | IllegalArgumentException e) {
			throw LaunchException.badRequest(LaunchStep.SIGNATURE, "The id_token claims are malformed: " + e.getMessage(), e);
		}
	}

	private static URL toUrl(String uri) throws MalformedURLException {
		return URI.create(uri).toURL();
	}

	static String payload(DecodedJWT jwt) {
		return new String(Base64.getUrlDecoder().decode(jwt.getPayload()), StandardCharsets.UTF_8);
	}

	void checkState(String state, String stateCookie) throws LaunchException {
		if (stateCookie == null) throw LaunchException.badRequest(LaunchStep.STATE, "The state cookie is missing.");
		if (state == null || !state.equals(stateCookie)) throw LaunchException.badRequest(LaunchStep.STATE, "The state parameter does not match the state cookie.");
	}

	void checkAudience(LaunchClaims claims, Registration registration) throws LaunchException {
		String clientId = registration.getClientId();
		if (!claims.getAudience().contains(clientId)) throw LaunchException.badRequest(LaunchStep.AUDIENCE, "The id_token audience does not include client_id " + clientId + ".");
		if (claims.getAudience().size() > 1 && !clientId.equals(claims.getAuthorizedParty()))
			throw LaunchException.badRequest(LaunchStep.AUDIENCE, "The id_token azp claim must equal client_id " + clientId + " when there are several audiences.");
	}

	void checkNonce(LaunchClaims claims) throws LaunchException {
		if (claims.getNonce() == null) throw LaunchException.badRequest(LaunchStep.NONCE, "The id_token has no nonce.");
		if (claims.getTargetLinkUri() == null) throw LaunchException.badRequest(LaunchStep.NONCE, "The id_token has no target_link_uri claim.");
		try {
			stores.nonces().testAndClearNonce(claims.getNonce(), claims.getTargetLinkUri());
		} catch (NonceNotFoundException e) {
			throw LaunchException.badRequest(LaunchStep.NONCE, "The nonce is unknown, expired or already used.", e);
		} catch (NonceMismatchException e) {
			throw LaunchException.badRequest(LaunchStep.NONCE, "The nonce was not issued for target_link_uri " + claims.getTargetLinkUri() + ".", e);
		} catch (DatastoreException e) {
			throw LaunchException.serverError(LaunchStep.NONCE, "Unable to check the nonce: " + e.getMessage(), e);
		}
	}

	void checkDeployment(LaunchClaims claims) throws LaunchException {
		String deploymentId = claims.getDeploymentId();
		if (!Deployment.isValidId(deploymentId)) throw LaunchException.badRequest(LaunchStep.DEPLOYMENT, "The deployment_id claim is missing or too long.");
		try {
			stores.registrations().findDeployment(claims.getIssuer(), deploymentId);
		} catch (DeploymentNotFoundException e) {
			throw LaunchException.badRequest(LaunchStep.DEPLOYMENT, "The deployment " + deploymentId + " is not registered.", e);
		} catch (DatastoreException e) {
			throw LaunchException.serverError(LaunchStep.DEPLOYMENT, "Unable to look up the deployment: " + e.getMessage(), e);
		}
	}

	void checkVersion(LaunchClaims claims) throws LaunchException {
		if (!SUPPORTED_VERSION.equals(claims.getVersion())) throw LaunchException.badRequest(LaunchStep.VERSION, "Unsupported LTI version " + claims.getVersion() + "; only " + SUPPORTED_VERSION + " is supported.");
		if (!RESOURCE_LINK_REQUEST.equals(claims.getMessageType())) throw LaunchException.badRequest(LaunchStep.VERSION, "Unsupported message type " + claims.getMessageType() + ".");
	}

	void checkResourceLink(LaunchClaims claims) throws LaunchException {
		LaunchClaims.ResourceLink link = claims.getResourceLink();
		if (link == null || link.getId() == null) throw LaunchException.badRequest(LaunchStep.RESOURCE_LINK, "The resource_link claim or its id is missing.");
		if (link.getId().length() > MAX_RESOURCE_LINK_ID_LENGTH) throw LaunchException.badRequest(LaunchStep.RESOURCE_LINK, "The resource_link id is longer than " + MAX_RESOURCE_LINK_ID_LENGTH + " characters.");
	}

	String storeLaunchData(DecodedJWT jwt) throws LaunchException {
		String launchId = LAUNCH_ID_PREFIX + UUID.randomUUID();
		try {
			stores.launchData().storeLaunchData(launchId, payload(jwt));
		} catch (DatastoreException e) {
			throw LaunchException.serverError(LaunchStep.LAUNCH_DATA, "Unable to save the launch: " + e.getMessage(), e);
		}
		return launchId;
	}
}
