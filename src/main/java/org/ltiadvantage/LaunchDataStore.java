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
 * Storage for the verified id_token payload of a successful launch, keyed by launch id.
 * The payload is the untouched claims JSON.
 */
public interface LaunchDataStore {

	void storeLaunchData(String launchId, String claimsJson) throws DatastoreException;

	/**
	 * @throws LaunchDataNotFoundException if the launch id is unknown or its session lifetime has passed
	 */
	String findLaunchData(String launchId) throws DatastoreException;
}
