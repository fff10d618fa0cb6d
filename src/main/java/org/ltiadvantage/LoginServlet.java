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
import java.util.logging.Logger;

import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/* The OpenID Connect login initiation endpoint that platforms call before each launch.
 * It sets the state cookies and redirects the browser to the platform's authentication endpoint.
 */
@WebServlet(urlPatterns = {"/lti/login", "/lti/login/"})
public class LoginServlet extends HttpServlet {
	private static final long serialVersionUID = 1L;

	private static final Logger logger = Logger.getLogger(LoginServlet.class.getName());

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws ServletException, IOException {
		Datastores stores = (Datastores) getServletContext().getAttribute(LtiWebListener.STORES_ATTRIBUTE);
		LoginRedirect.Redirect redirect;
		try {
			redirect = new LoginRedirect(stores).build(request.getParameter("iss"), request.getParameter("login_hint"),
					request.getParameter("target_link_uri"), request.getParameter("lti_message_hint"), request.getParameter("client_id"));
		} catch (IllegalArgumentException | RegistrationNotFoundException e) {
			logger.warning("Login rejected: " + e.getMessage());
			response.sendError(HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
			return;
		} catch (DatastoreException e) {
			logger.severe("Login failed: " + e.getMessage());
			response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Unable to start the login.");
			return;
		}

		// The launch arrives as a cross-site POST, so the cookie must be SameSite=None.
		// Older browsers reject SameSite=None and get the legacy cookie instead.
		response.addHeader("Set-Cookie", LaunchValidator.STATE_COOKIE + "=" + redirect.getState() + "; Path=" + redirect.getCookiePath()
				+ "; Secure; HttpOnly; SameSite=None");
		response.addHeader("Set-Cookie", LaunchValidator.LEGACY_STATE_COOKIE + "=" + redirect.getState() + "; Path=" + redirect.getCookiePath()
				+ "; Secure; HttpOnly");
		response.sendRedirect(redirect.getUrl());
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response) throws ServletException, IOException {
		doGet(request, response);
	}
}
