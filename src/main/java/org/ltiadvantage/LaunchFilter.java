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

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.FilterConfig;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.annotation.WebFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/* Guards the launch endpoint. A POSTed launch that passes every LaunchValidator check continues
 * down the filter chain with its launch id in the request attribute LAUNCH_ID_ATTRIBUTE;
 * anything else is answered here with 400 or 500.
 */
@WebFilter(urlPatterns = {"/lti/launch"})
public class LaunchFilter implements Filter {

	private static final Logger logger = Logger.getLogger(LaunchFilter.class.getName());

	public static final String LAUNCH_ID_ATTRIBUTE = "org.ltiadvantage.launchId";

	private LaunchValidator validator;

	public LaunchFilter() {}

	LaunchFilter(LaunchValidator validator) {
		this.validator = validator;
	}

	@Override
	public void init(FilterConfig config) throws ServletException {
		if (validator != null) return;
		validator = (LaunchValidator) config.getServletContext().getAttribute(LtiWebListener.VALIDATOR_ATTRIBUTE);
		if (validator == null) throw new ServletException("LaunchValidator is not available; was LtiWebListener registered?");
	}

	@Override
	public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain) throws IOException, ServletException {
		HttpServletRequest req = (HttpServletRequest) request;
		HttpServletResponse res = (HttpServletResponse) response;

		if (!"POST".equals(req.getMethod())) {
			res.sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED, "LTI launches must be POSTed.");
			return;
		}

		String launchId;
		try {
			launchId = validator.validate(req);
		} catch (LaunchException e) {
			logger.warning("Launch rejected at " + e.getStep() + " (" + e.getStatusCode() + "): " + e.getMessage());
			res.sendError(e.getStatusCode(), e.getMessage());
			return;
		}

		req.setAttribute(LAUNCH_ID_ATTRIBUTE, launchId);
		chain.doFilter(request, response);
	}

	/** Returns the launch id attached by this filter, or null if the request did not pass through it. */
	public static String launchId(ServletRequest request) {
		return (String) request.getAttribute(LAUNCH_ID_ATTRIBUTE);
	}
}
