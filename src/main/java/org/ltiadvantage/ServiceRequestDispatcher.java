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
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.time.Duration;
import java.util.logging.Logger;

/* ServiceRequestDispatcher performs one authenticated call to a platform service for a Connector.
 * It obtains a bearer token for the request's scopes, sends the request with the negotiated
 * Accept and Content-Type headers, and accepts only the expected status code.
 */
class ServiceRequestDispatcher {

	private static final Logger logger = Logger.getLogger(ServiceRequestDispatcher.class.getName());

	private final Connector connector;

	ServiceRequestDispatcher(Connector connector) {
		this.connector = connector;
	}

	ServiceResponse dispatch(ServiceRequest request) throws ConnectorException {
		if (request.getScopes().isEmpty()) throw new ConnectorException("A service request must declare at least one scope.");
		if (request.getUri() == null) throw new ConnectorException("A service request needs a target URI.");

		AccessToken token = connector.obtainAccessToken(request.getScopes());
		Duration timeout = request.getTimeout() == null ? connector.getTimeout() : request.getTimeout();

		HttpURLConnection uc = null;
		try {
			uc = (HttpURLConnection) URI.create(request.getUri()).toURL().openConnection();
			uc.setRequestMethod(request.getMethod());
			uc.setRequestProperty("Authorization", "Bearer " + token.getToken());
			uc.setRequestProperty("Accept", request.getAccept());
			if (request.getContentType() != null) uc.setRequestProperty("Content-Type", request.getContentType());
			uc.setUseCaches(false);
			uc.setConnectTimeout((int) timeout.toMillis());
			uc.setReadTimeout((int) timeout.toMillis());
			if (request.getBody() != null) {
				uc.setDoOutput(true);
				try (OutputStream out = uc.getOutputStream()) {
					out.write(request.getBody());
				}
			}

			int responseCode = uc.getResponseCode();
			if (responseCode != request.getExpectedStatus()) {
				String statusText = uc.getResponseMessage();
				InputStream error = uc.getErrorStream();
				if (error != null) error.close();
				uc.disconnect();
				logger.warning(request.getMethod() + " " + request.getUri() + " returned " + responseCode + ", expected " + request.getExpectedStatus());
				throw new ServiceRequestException(request.getUri(), responseCode, statusText);
			}
			InputStream body = responseCode == HttpURLConnection.HTTP_NO_CONTENT ? null : uc.getInputStream();
			return new ServiceResponse(responseCode, uc.getHeaderFields(), body);
		} catch (IOException | IllegalArgumentException e) {
			if (uc != null) uc.disconnect();
			throw new ConnectorException(request.getMethod() + " " + request.getUri() + " failed: " + e.getMessage(), e);
		}
	}
}
