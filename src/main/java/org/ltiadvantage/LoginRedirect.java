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

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/* LoginRedirect answers a third-party initiated login (the first step of an LTI 1.3 launch).
 * It picks the Registration for the platform, issues a state value for the browser cookie and a
 * single-use nonce bound to the target_link_uri, and builds the OIDC authentication request URL
 * that sends the browser back to the platform.
 */
public class LoginRedirect {

	private final Datastores stores;

	/** The outcome of a login: where to send the browser and which state to put in the cookie. */
	public static class Redirect {
		private final String url;
		private final String state;
		private final String cookiePath;

		Redirect(String url, String state, String cookiePath) {
			this.url = url;
			this.state = state;
			this.cookiePath = cookiePath;
		}

		public String getUrl() {
			return url;
		}

		public String getState() {
			return state;
		}

		/** The path of the launch URL, so that the cookie is only sent with the launch. */
		public String getCookiePath() {
			return cookiePath;
		}
	}

	public LoginRedirect(Datastores stores) {
		this.stores = stores;
	}

	/**
	 * @throws IllegalArgumentException if a required login parameter is missing
	 * @throws RegistrationNotFoundException if the platform is not registered for the client_id
	 */
	public Redirect build(String iss, String loginHint, String targetLinkUri, String messageHint, String clientId) throws DatastoreException {
		if (iss == null || iss.isEmpty()) throw new IllegalArgumentException("Missing required iss parameter.");
		if (loginHint == null || loginHint.isEmpty()) throw new IllegalArgumentException("Missing required login_hint parameter.");
		if (clientId == null || clientId.isEmpty()) throw new IllegalArgumentException("Missing required client_id parameter.");

		Registration registration = stores.registrations().findRegistration(iss, clientId);
		String redirectUri = registration.getTargetLinkUri() != null ? registration.getTargetLinkUri() : targetLinkUri;
		if (redirectUri == null || redirectUri.isEmpty()) throw new IllegalArgumentException("Missing required target_link_uri parameter.");
		if (registration.getAuthLoginUri() == null) throw new IllegalArgumentException("The registration for " + iss + " has no authentication endpoint.");

		String state = "state-" + UUID.randomUUID();
		String nonce = UUID.randomUUID().toString();
		stores.nonces().storeNonce(nonce, redirectUri);

		Map<String, String> params = new LinkedHashMap<String, String>();
		params.put("scope", "openid");
		params.put("response_type", "id_token");
		params.put("response_mode", "form_post");
		params.put("prompt", "none");
		params.put("client_id", registration.getClientId());
		params.put("redirect_uri", redirectUri);
		params.put("login_hint", loginHint);
		params.put("state", state);
		params.put("nonce", nonce);
		if (messageHint != null && !messageHint.isEmpty()) params.put("lti_message_hint", messageHint);

		StringBuilder url = new StringBuilder(registration.getAuthLoginUri());
		char separator = registration.getAuthLoginUri().contains("?") ? '&' : '?';
		for (Map.Entry<String, String> p : params.entrySet()) {
			url.append(separator).append(p.getKey()).append('=').append(URLEncoder.encode(p.getValue(), StandardCharsets.UTF_8));
			separator = '&';
		}
		return new Redirect(url.toString(), state, cookiePath(redirectUri));
	}

	static String cookiePath(String uri) {
		try {
			String path = URI.create(uri).getRawPath();
			return path == null || path.isEmpty() ? "/" : path;
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("The target_link_uri " + uri + " is not a valid URI.", e);
		}
	}
}
