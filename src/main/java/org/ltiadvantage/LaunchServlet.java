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
import java.io.PrintWriter;
import java.util.logging.Logger;

import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/* The landing page for a validated launch. LaunchFilter runs first, so every request that
 * reaches doPost carries a launch id. Tools replace this page with their own content.
 */
@WebServlet(urlPatterns = {"/lti/launch"})
public class LaunchServlet extends HttpServlet {
	private static final long serialVersionUID = 1L;

	private static final Logger logger = Logger.getLogger(LaunchServlet.class.getName());

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response) throws ServletException, IOException {
		String launchId = LaunchFilter.launchId(request);
		if (launchId == null) {
			response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "No validated launch.");
			return;
		}
		Datastores stores = (Datastores) getServletContext().getAttribute(LtiWebListener.STORES_ATTRIBUTE);
		Connector connector;
		try {
			connector = new Connector(stores, launchId);
		} catch (ConnectorException e) {
			logger.severe("Unable to open launch " + launchId + ": " + e.getMessage());
			response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "Unable to open the launch.");
			return;
		}
		LaunchClaims claims = connector.getClaims();
		LaunchClaims.ResourceLink link = claims.getResourceLink();

		response.setContentType("text/html;charset=UTF-8");
		PrintWriter out = response.getWriter();
		out.println("<!DOCTYPE html><html><head><title>LTI Launch</title></head><body>");
		out.println("<h1>" + escape(link.getTitle() == null ? link.getId() : link.getTitle()) + "</h1>");
		if (claims.getName() != null) out.println("<p>Welcome, " + escape(claims.getName()) + ".</p>");
		out.println("<p>Launch id: " + escape(launchId) + "</p>");
		out.println("<p>Assignment and Grade Services: " + (claims.getAgsEndpoint() == null ? "not available" : "available") + "<br/>");
		out.println("Names and Role Provisioning Services: " + (claims.getNamesRoleService() == null ? "not available" : "available") + "</p>");
		out.println("</body></html>");
	}

	static String escape(String s) {
		if (s == null) return "";
		return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
	}
}
