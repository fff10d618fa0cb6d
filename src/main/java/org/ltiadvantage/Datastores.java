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
 * The four storage roles used by the launch pipeline and the Connector.
 * Built once by the application's composition root and passed to the components that need it.
 */
public class Datastores {
	private final RegistrationStore registrations;
	private final NonceStore nonces;
	private final LaunchDataStore launchData;
	private final AccessTokenStore accessTokens;

	public Datastores(RegistrationStore registrations, NonceStore nonces, LaunchDataStore launchData, AccessTokenStore accessTokens) {
		if (registrations == null || nonces == null || launchData == null || accessTokens == null) throw new IllegalArgumentException("All four stores are required.");
		this.registrations = registrations;
		this.nonces = nonces;
		this.launchData = launchData;
		this.accessTokens = accessTokens;
	}

	/** Uses one store for every role. */
	public static <S extends RegistrationStore & NonceStore & LaunchDataStore & AccessTokenStore> Datastores of(S store) {
		return new Datastores(store, store, store, store);
	}

	public RegistrationStore registrations() {
		return registrations;
	}

	public NonceStore nonces() {
		return nonces;
	}

	public LaunchDataStore launchData() {
		return launchData;
	}

	public AccessTokenStore accessTokens() {
		return accessTokens;
	}
}
