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
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * LtiSettings - tool configuration read from lti.properties on the classpath.
 *
 * Any key can be overridden by a JVM system property of the same name, or by an environment
 * variable formed by upper-casing the key and replacing dots with underscores
 * (lti.key.pem becomes LTI_KEY_PEM). Secrets such as the private key should only be
 * supplied through the environment.
 */
public class LtiSettings {

	private static final Logger logger = Logger.getLogger(LtiSettings.class.getName());

	static final String RESOURCE = "lti.properties";
	static final Duration DEFAULT_LIFETIME = Duration.ofMinutes(90);
	static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(15);

	public static final String DATASTORE = "lti.datastore";
	public static final String JDBC_URL = "lti.jdbc.url";
	public static final String JDBC_USER = "lti.jdbc.user";
	public static final String JDBC_PASSWORD = "lti.jdbc.password";
	public static final String KEY_ID = "lti.key.id";
	public static final String KEY_PEM = "lti.key.pem";
	public static final String HTTP_TIMEOUT_SECONDS = "lti.http.timeout.seconds";
	public static final String LAUNCH_LIFETIME_MINUTES = "lti.launch.lifetime.minutes";
	public static final String NONCE_LIFETIME_MINUTES = "lti.nonce.lifetime.minutes";

	private final Properties properties;
	private final Map<String, String> environment;

	LtiSettings(Properties properties, Map<String, String> environment) {
		this.properties = properties;
		this.environment = environment;
	}

	/** Loads lti.properties from the classpath. A missing file leaves only the built-in defaults. */
	public static LtiSettings load() throws IOException {
		Properties p = new Properties();
		try (InputStream in = LtiSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in == null) logger.warning(RESOURCE + " was not found on the classpath; using defaults.");
			else p.load(in);
		}
		return new LtiSettings(p, System.getenv());
	}

	public String get(String key) {
		String value = System.getProperty(key);
		if (value == null) value = environment.get(key.toUpperCase().replace('.', '_'));
		if (value == null) value = properties.getProperty(key);
		return value == null || value.isBlank() ? null : value.trim();
	}

	public String get(String key, String defaultValue) {
		String value = get(key);
		return value == null ? defaultValue : value;
	}

	long getLong(String key, long defaultValue) {
		String value = get(key);
		if (value == null) return defaultValue;
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new IllegalStateException(key + " must be a whole number but was " + value);
		}
	}

	public String datastore() {
		return get(DATASTORE, "memory");
	}

	public Duration httpTimeout() {
		return Duration.ofSeconds(getLong(HTTP_TIMEOUT_SECONDS, DEFAULT_HTTP_TIMEOUT.getSeconds()));
	}

	public Duration launchLifetime() {
		return Duration.ofMinutes(getLong(LAUNCH_LIFETIME_MINUTES, DEFAULT_LIFETIME.toMinutes()));
	}

	public Duration nonceLifetime() {
		return Duration.ofMinutes(getLong(NONCE_LIFETIME_MINUTES, DEFAULT_LIFETIME.toMinutes()));
	}
}
