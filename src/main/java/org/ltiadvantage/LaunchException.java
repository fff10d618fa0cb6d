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

import java.io.Serial;

/**
 * A launch was rejected. The status code is 400 when the request itself is at fault
 * (malformed, untrusted, replayed or unsupported) and 500 when a dependency failed
 * (platform key set unreachable, storage error). The step names the check that failed.
 */
public class LaunchException extends Exception {
	@Serial
	private static final long serialVersionUID = 1L;

	public static final int BAD_REQUEST = 400;
	public static final int SERVER_ERROR = 500;

	private final int statusCode;
	private final LaunchStep step;

	public LaunchException(int statusCode, LaunchStep step, String message) {
		super(message);
		this.statusCode = statusCode;
		this.step = step;
	}

	public LaunchException(int statusCode, LaunchStep step, String message, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
		this.step = step;
	}

	static LaunchException badRequest(LaunchStep step, String message) {
		return new LaunchException(BAD_REQUEST, step, message);
	}

	static LaunchException badRequest(LaunchStep step, String message, Throwable cause) {
		return new LaunchException(BAD_REQUEST, step, message, cause);
	}

	static LaunchException serverError(LaunchStep step, String message, Throwable cause) {
		return new LaunchException(SERVER_ERROR, step, message, cause);
	}

	public int getStatusCode() {
		return statusCode;
	}

	public LaunchStep getStep() {
		return step;
	}
}
