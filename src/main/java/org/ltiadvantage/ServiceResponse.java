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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * The successful response to a ServiceRequest. The body stream belongs to the caller,
 * who must close this response (try-with-resources) when done with it.
 */
public class ServiceResponse implements Closeable {
	private final int statusCode;
	private final Map<String, List<String>> headers = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
	private final InputStream body;

	public ServiceResponse(int statusCode, Map<String, List<String>> headers, InputStream body) {
		this.statusCode = statusCode;
		for (Map.Entry<String, List<String>> e : headers.entrySet()) {
			if (e.getKey() != null) this.headers.put(e.getKey(), e.getValue());  // HttpURLConnection reports the status line under a null key
		}
		this.body = body == null ? InputStream.nullInputStream() : body;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public List<String> getHeaders(String name) {
		List<String> values = headers.get(name);
		return values == null ? Collections.<String>emptyList() : values;
	}

	public String getHeader(String name) {
		List<String> values = getHeaders(name);
		return values.isEmpty() ? null : values.get(0);
	}

	public InputStream getBody() {
		return body;
	}

	/** Reads the whole body as JSON. */
	public JsonElement readJson() throws IOException {
		try (InputStreamReader reader = new InputStreamReader(body, StandardCharsets.UTF_8)) {
			return JsonParser.parseReader(reader);
		} catch (JsonParseException e) {
			throw new IOException("The response body is not valid JSON: " + e.getMessage(), e);
		}
	}

	/**
	 * Returns the URI of the Link header entry with rel="next", or null when this is the last page.
	 */
	public String nextPageUri() {
		return nextPageUri(getHeaders("Link"));
	}

	// Link: <https://lms.example.com/results?page=2>; rel="next", <...>; rel="last"
	// Targets are read between angle brackets first, since a URI may itself contain commas.
	static String nextPageUri(List<String> linkHeaders) {
		for (String header : linkHeaders) {
			int pos = 0;
			while (true) {
				int start = header.indexOf('<', pos);
				if (start < 0) break;
				int end = header.indexOf('>', start);
				if (end < 0) break;
				int following = header.indexOf('<', end);
				String params = header.substring(end + 1, following < 0 ? header.length() : following);
				for (String param : params.split("[;,]")) {
					String p = param.trim().replace(" ", "");
					if (p.equalsIgnoreCase("rel=\"next\"") || p.equalsIgnoreCase("rel=next")) return header.substring(start + 1, end);
				}
				pos = end + 1;
			}
		}
		return null;
	}

	@Override
	public void close() throws IOException {
		body.close();
	}
}
