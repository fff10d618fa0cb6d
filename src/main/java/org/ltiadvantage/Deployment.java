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

/* A Deployment scopes one installation of the tool within a platform Registration.
 * The deployment_id is supplied by the platform and is unique only under its issuer.
 */
public class Deployment {
	static final int MAX_DEPLOYMENT_ID_LENGTH = 255;

	private final String issuer;
	private final String deploymentId;

	public Deployment(String issuer, String deploymentId) {
		if (issuer == null || issuer.isEmpty()) throw new IllegalArgumentException("Deployment issuer is required.");
		if (!isValidId(deploymentId)) throw new IllegalArgumentException("Deployment id must be 1 to " + MAX_DEPLOYMENT_ID_LENGTH + " characters.");
		this.issuer = issuer;
		this.deploymentId = deploymentId;
	}

	public static boolean isValidId(String deploymentId) {
		return deploymentId != null && !deploymentId.isEmpty() && deploymentId.length() <= MAX_DEPLOYMENT_ID_LENGTH;
	}

	public String getIssuer() {
		return issuer;
	}

	public String getDeploymentId() {
		return deploymentId;
	}

	@Override
	public String toString() {
		return "Deployment[" + issuer + "/" + deploymentId + "]";
	}
}
