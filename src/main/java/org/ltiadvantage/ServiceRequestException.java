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

import java.io.Serial;

/**
 * The platform answered with an unexpected HTTP status. Only the status line is kept;
 * the response body is not trusted for error detail. The caller may retry.
 */
public class ServiceRequestException extends ConnectorException {
	@Serial
	private static final long serialVersionUID = 1L;

	private final String uri;
	private final int statusCode;
	private final String statusText;

	public ServiceRequestException(String uri, int statusCode, String statusText) {
		super("Request to " + uri + " failed: " + statusCode + (statusText == null ? "" : " " + statusText));
		this.uri = uri;
		this.statusCode = statusCode;
		this.statusText = statusText;
	}

	public String getUri() {
		return uri;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getStatusText() {
		return statusText;
	}
}
