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

import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/* Publishes the tool's public signing key so that platforms can verify client assertions. */
@WebServlet(urlPatterns = {"/jwks", "/jwks/"})
public class JwksServlet extends HttpServlet {
	private static final long serialVersionUID = 1L;

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response) throws ServletException, IOException {
		ToolKey key = (ToolKey) getServletContext().getAttribute(LtiWebListener.TOOL_KEY_ATTRIBUTE);
		if (key == null) {
			response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "No signing key is configured.");
			return;
		}
		response.setContentType("application/json;charset=UTF-8");
		response.getWriter().println(key.toJwks().toString());
	}
}
