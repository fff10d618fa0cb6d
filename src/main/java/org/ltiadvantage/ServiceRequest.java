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

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One outbound call to a platform service: the scopes it needs, the method and target,
 * an optional body and the expected response status. Unset content type, accept type and
 * expected status take their defaults when the request is dispatched.
 */
public class ServiceRequest {
	public static final String JSON = "application/json";

	private final List<String> scopes;
	private final String method;
	private final String uri;
	private byte[] body;
	private String contentType;
	private String accept;
	private int expectedStatus;
	private Duration timeout;

	public ServiceRequest(String method, String uri, List<String> scopes) {
		this.method = method;
		this.uri = uri;
		this.scopes = scopes == null ? Collections.<String>emptyList() : scopes;
	}

	public ServiceRequest(String method, String uri, String... scopes) {
		this(method, uri, Arrays.asList(scopes));
	}

	public ServiceRequest body(String body) {
		this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
		return this;
	}

	public ServiceRequest contentType(String contentType) {
		this.contentType = contentType;
		return this;
	}

	public ServiceRequest accept(String accept) {
		this.accept = accept;
		return this;
	}

	public ServiceRequest expectStatus(int expectedStatus) {
		this.expectedStatus = expectedStatus;
		return this;
	}

	/** Overrides the dispatcher's default timeout for this request only. */
	public ServiceRequest timeout(Duration timeout) {
		this.timeout = timeout;
		return this;
	}

	public List<String> getScopes() {
		return scopes;
	}

	public String getMethod() {
		return method;
	}

	public String getUri() {
		return uri;
	}

	public byte[] getBody() {
		return body;
	}

	/** The content type, defaulting to JSON for POST and PUT. Null for other methods when unset. */
	public String getContentType() {
		if (contentType != null) return contentType;
		return "POST".equals(method) || "PUT".equals(method) ? JSON : null;
	}

	public String getAccept() {
		return accept == null ? JSON : accept;
	}

	public int getExpectedStatus() {
		return expectedStatus == 0 ? 200 : expectedStatus;
	}

	public Duration getTimeout() {
		return timeout;
	}
}
