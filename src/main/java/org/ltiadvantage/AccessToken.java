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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * AccessToken - a bearer token issued by a platform token endpoint for a set of scopes.
 *
 * Tokens are cached by (token endpoint, client_id, scopes). The scopes are kept sorted
 * so that the order in which a caller lists them never changes the cache key.
 * The token string itself is never written into toString() or any log message.
 */
public class AccessToken {
	private final String tokenUri;
	private final String clientId;
	private final List<String> scopes;
	private final String token;
	private final Instant expiresAt;

	public AccessToken(String tokenUri, String clientId, Collection<String> scopes, String token, Instant expiresAt) {
		this.tokenUri = tokenUri;
		this.clientId = clientId;
		this.scopes = sortedScopes(scopes);
		this.token = token;
		this.expiresAt = expiresAt;
	}

	static List<String> sortedScopes(Collection<String> scopes) {
		List<String> sorted = new ArrayList<String>(scopes);
		Collections.sort(sorted);
		return Collections.unmodifiableList(sorted);
	}

	/**
	 * Builds the canonical cache key for a token request.
	 */
	public static String cacheKey(String tokenUri, String clientId, Collection<String> scopes) {
		return tokenUri + "\n" + clientId + "\n" + String.join(" ", sortedScopes(scopes));
	}

	public String cacheKey() {
		return cacheKey(tokenUri, clientId, scopes);
	}

	/** A token is usable only while now is strictly before its expiry. */
	public boolean isExpired(Instant now) {
		return !now.isBefore(expiresAt);
	}

	public String getTokenUri() {
		return tokenUri;
	}

	public String getClientId() {
		return clientId;
	}

	public List<String> getScopes() {
		return scopes;
	}

	public String getToken() {
		return token;
	}

	public Instant getExpiresAt() {
		return expiresAt;
	}

	@Override
	public String toString() {
		return "AccessToken[" + tokenUri + ", " + clientId + ", " + scopes + ", expires " + expiresAt + "]";
	}
}
