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

/* A Registration is the trust relationship between one LMS platform and this tool.
 * It is identified by the pair (issuer, client_id) and is created out-of-band when
 * the tool is configured for the platform. The launch pipeline and the Connector only read it.
 */
public class Registration {
	private final String issuer;
	private final String clientId;
	private final String authTokenUri;
	private final String authLoginUri;
	private final String keysetUri;
	private final String targetLinkUri;

	public Registration(String issuer, String clientId, String authTokenUri, String authLoginUri, String keysetUri, String targetLinkUri) {
		if (issuer == null || issuer.isEmpty()) throw new IllegalArgumentException("Registration issuer is required.");
		if (clientId == null || clientId.isEmpty()) throw new IllegalArgumentException("Registration client_id is required.");
		this.issuer = issuer;
		this.clientId = clientId;
		this.authTokenUri = authTokenUri;
		this.authLoginUri = authLoginUri;
		this.keysetUri = keysetUri;
		this.targetLinkUri = targetLinkUri;
	}

	public String getIssuer() {
		return issuer;
	}

	public String getClientId() {
		return clientId;
	}

	/** The platform's OAuth2 token endpoint used for the client-credentials grant. */
	public String getAuthTokenUri() {
		return authTokenUri;
	}

	/** The platform's OIDC authentication endpoint that receives the login redirect. */
	public String getAuthLoginUri() {
		return authLoginUri;
	}

	/** The platform's public JSON Web Key Set URL. */
	public String getKeysetUri() {
		return keysetUri;
	}

	public String getTargetLinkUri() {
		return targetLinkUri;
	}

	@Override
	public String toString() {
		return "Registration[" + issuer + ", " + clientId + "]";
	}
}
