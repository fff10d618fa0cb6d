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

import java.util.Collection;

/**
 * Cache of platform access tokens keyed by (token endpoint, client_id, sorted scopes).
 */
public interface AccessTokenStore {

	/** Stores the token, replacing any token cached under the same key. */
	void storeAccessToken(AccessToken token) throws DatastoreException;

	/**
	 * @throws AccessTokenNotFoundException if nothing is cached under the key
	 * @throws AccessTokenExpiredException if the cached token is no longer usable
	 */
	AccessToken findAccessToken(String tokenUri, String clientId, Collection<String> scopes) throws DatastoreException;
}
