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

/**
 * Storage for platform Registrations and their Deployments.
 */
public interface RegistrationStore {

	void storeRegistration(Registration registration) throws DatastoreException;

	/**
	 * @throws RegistrationNotFoundException if no Registration exists for the pair
	 */
	Registration findRegistration(String issuer, String clientId) throws DatastoreException;

	void storeDeployment(Deployment deployment) throws DatastoreException;

	/**
	 * @throws DeploymentNotFoundException if the issuer has no such deployment
	 */
	Deployment findDeployment(String issuer, String deploymentId) throws DatastoreException;
}
