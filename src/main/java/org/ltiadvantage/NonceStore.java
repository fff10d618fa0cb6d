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
 * Storage for single-use login nonces.
 */
public interface NonceStore {

	/** Records a nonce issued by the login step for the given target_link_uri. */
	void storeNonce(String nonce, String targetLinkUri) throws DatastoreException;

	/**
	 * Atomically consumes a nonce. A nonce can be consumed at most once, so a second call
	 * with the same value throws NonceNotFoundException even when the URI matches.
	 *
	 * @throws NonceNotFoundException if the nonce was never issued, already used or expired
	 * @throws NonceMismatchException if the nonce was issued for a different target_link_uri
	 */
	void testAndClearNonce(String nonce, String targetLinkUri) throws DatastoreException;
}
