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
import java.io.InputStreamReader;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Ags - the LTI Assignment and Grade Services client for one launch.
 *
 * The line item URIs and the scopes the platform granted come from the launch's AGS endpoint
 * claim. Every call checks that the scope it needs was granted before asking for a token;
 * a read-write scope also covers the matching read-only one.
 */
public class Ags {

	public static final String SCOPE_SCORE = "https://purl.imsglobal.org/spec/lti-ags/scope/score";
	public static final String SCOPE_RESULT_READONLY = "https://purl.imsglobal.org/spec/lti-ags/scope/result.readonly";
	public static final String SCOPE_LINEITEM = "https://purl.imsglobal.org/spec/lti-ags/scope/lineitem";
	public static final String SCOPE_LINEITEM_READONLY = "https://purl.imsglobal.org/spec/lti-ags/scope/lineitem.readonly";

	static final String SCORE_TYPE = "application/vnd.ims.lis.v1.score+json";
	static final String RESULT_CONTAINER_TYPE = "application/vnd.ims.lis.v2.resultcontainer+json";
	static final String LINEITEM_TYPE = "application/vnd.ims.lis.v2.lineitem+json";
	static final String LINEITEM_CONTAINER_TYPE = "application/vnd.ims.lis.v2.lineitemcontainer+json";

	private static final Gson gson = new Gson();

	private final Connector connector;
	private final String lineItem;
	private final String lineItems;
	private final List<String> scopes;

	Ags(Connector connector) throws ServiceUnsupportedException {
		LaunchClaims.AgsEndpoint endpoint = connector.getClaims().getAgsEndpoint();
		if (endpoint == null) throw new ServiceUnsupportedException("The platform did not offer Assignment and Grade Services for this launch.");
		if (endpoint.getLineItem() == null || endpoint.getLineItems() == null || endpoint.getScopes() == null)
			throw new ServiceUnsupportedException("The Assignment and Grade Services claim lacks lineitem, lineitems or scope.");
		this.connector = connector;
		this.lineItem = endpoint.getLineItem();
		this.lineItems = endpoint.getLineItems();
		this.scopes = endpoint.getScopes();
	}

	public String getLineItemUri() {
		return lineItem;
	}

	public String getLineItemsUri() {
		return lineItems;
	}

	public List<String> getScopes() {
		return scopes;
	}

	void requireScope(String scope) throws ServiceUnsupportedException {
		if (scopes.contains(scope)) return;
		if (scope.endsWith(".readonly") && scopes.contains(scope.substring(0, scope.length() - ".readonly".length()))) return;
		throw new ServiceUnsupportedException("The platform did not grant the scope " + scope + ".");
	}

	/**
	 * Publishes a score to the launched line item. A score without a user id is
	 * recorded for the launching user; a score without a timestamp is stamped now.
	 * The Score passed in is not modified, so it can be reused for another launch.
	 */
	public void putScore(Score score) throws ConnectorException {
		requireScope(SCOPE_SCORE);
		JsonObject body = gson.toJsonTree(score).getAsJsonObject();
		if (score.getUserId() == null) {
			String sub = connector.getClaims().getSubject();
			if (sub == null) throw new ConnectorException("The launch has no sub claim to publish a score for.");
			body.addProperty("userId", sub);
		}
		if (score.getTimestamp() == null) body.addProperty("timestamp", connector.getClock().instant().toString());

		ServiceRequest request = new ServiceRequest("POST", appendPath(lineItem, "/scores"), SCOPE_SCORE)
				.contentType(SCORE_TYPE)
				.body(body.toString());
		try (ServiceResponse response = connector.dispatch(request)) {
			// nothing to read
		} catch (IOException e) {
			throw new ConnectorException("Unable to close the score response: " + e.getMessage(), e);
		}
	}

	/** Reads every result on the launched line item, following all pages. */
	public List<Result> getResults() throws ConnectorException {
		return allResults(getPagedResults(0, null));
	}

	/** Reads the results of one user on the launched line item, following all pages. */
	public List<Result> getUserResults(String userId) throws ConnectorException {
		if (userId == null || userId.isEmpty()) throw new IllegalArgumentException("A user id is required.");
		return allResults(getPagedResults(0, userId));
	}

	private static List<Result> allResults(Pager<List<Result>> pager) throws ConnectorException {
		List<Result> results = new ArrayList<Result>();
		while (pager.hasMorePages()) results.addAll(pager.nextPage());
		return results;
	}

	/**
	 * Returns a pager over the results of the launched line item.
	 *
	 * @param limit the page size to ask the platform for, or 0 to let the platform choose
	 * @param userId only results of this user, or null for all users
	 */
	public Pager<List<Result>> getPagedResults(int limit, String userId) throws ConnectorException {
		if (limit < 0) throw new IllegalArgumentException("The limit cannot be negative.");
		requireScope(SCOPE_RESULT_READONLY);
		String first = appendPath(lineItem, "/results");
		if (limit > 0) first = appendQuery(first, "limit", Integer.toString(limit));
		if (userId != null) first = appendQuery(first, "user_id", userId);
		return new Pager<List<Result>>(connector, first,
				uri -> new ServiceRequest("GET", uri, SCOPE_RESULT_READONLY).accept(RESULT_CONTAINER_TYPE),
				response -> readJson(response, new TypeToken<List<Result>>() {}));
	}

	/** Reads the launched line item. */
	public LineItem getLineItem() throws ConnectorException {
		requireScope(SCOPE_LINEITEM_READONLY);
		ServiceRequest request = new ServiceRequest("GET", lineItem, SCOPE_LINEITEM_READONLY).accept(LINEITEM_TYPE);
		try (ServiceResponse response = connector.dispatch(request)) {
			return readJson(response, TypeToken.get(LineItem.class));
		} catch (IOException e) {
			throw new ConnectorException("Unable to read line item " + lineItem + ": " + e.getMessage(), e);
		}
	}

	/** Reads the line items of the launch context. */
	public List<LineItem> getLineItems() throws ConnectorException {
		requireScope(SCOPE_LINEITEM_READONLY);
		ServiceRequest request = new ServiceRequest("GET", lineItems, SCOPE_LINEITEM_READONLY).accept(LINEITEM_CONTAINER_TYPE);
		try (ServiceResponse response = connector.dispatch(request)) {
			return readJson(response, new TypeToken<List<LineItem>>() {});
		} catch (IOException e) {
			throw new ConnectorException("Unable to read line items " + lineItems + ": " + e.getMessage(), e);
		}
	}

	/** Creates a line item in the launch context and returns it as the platform stored it. */
	public LineItem createLineItem(LineItem item) throws ConnectorException {
		requireScope(SCOPE_LINEITEM);
		ServiceRequest request = new ServiceRequest("POST", lineItems, SCOPE_LINEITEM)
				.contentType(LINEITEM_TYPE)
				.accept(LINEITEM_TYPE)
				.body(gson.toJson(item));
		try (ServiceResponse response = connector.dispatch(request)) {
			return readJson(response, TypeToken.get(LineItem.class));
		} catch (IOException e) {
			throw new ConnectorException("Unable to read the created line item: " + e.getMessage(), e);
		}
	}

	/**
	 * Replaces a line item.
	 * @param target the line item URI to update, or null for the launched line item
	 */
	public LineItem updateLineItem(LineItem item, String target) throws ConnectorException {
		requireScope(SCOPE_LINEITEM);
		String uri = target == null ? lineItem : target;
		ServiceRequest request = new ServiceRequest("PUT", uri, SCOPE_LINEITEM)
				.contentType(LINEITEM_TYPE)
				.accept(LINEITEM_TYPE)
				.body(gson.toJson(item));
		try (ServiceResponse response = connector.dispatch(request)) {
			return readJson(response, TypeToken.get(LineItem.class));
		} catch (IOException e) {
			throw new ConnectorException("Unable to read the updated line item: " + e.getMessage(), e);
		}
	}

	/**
	 * Deletes a line item.
	 * @param target the line item URI to delete, or null for the launched line item
	 */
	public void deleteLineItem(String target) throws ConnectorException {
		requireScope(SCOPE_LINEITEM);
		String uri = target == null ? lineItem : target;
		if (uri.isEmpty()) throw new IllegalArgumentException("The line item URI to delete is empty.");
		try (ServiceResponse response = connector.dispatch(new ServiceRequest("DELETE", uri, SCOPE_LINEITEM))) {
			// nothing to read
		} catch (IOException e) {
			throw new ConnectorException("Unable to close the delete response: " + e.getMessage(), e);
		}
	}

	static <T> T readJson(ServiceResponse response, TypeToken<T> type) throws IOException {
		try (InputStreamReader reader = new InputStreamReader(response.getBody(), StandardCharsets.UTF_8)) {
			T value = gson.fromJson(reader, type);
			if (value == null) throw new IOException("The response body is empty.");
			return value;
		} catch (JsonParseException e) {
			throw new IOException("The response body is not the expected JSON: " + e.getMessage(), e);
		}
	}

	/** Appends a path segment to a URI, keeping its query string: .../lineitem/1?type=x becomes .../lineitem/1/scores?type=x */
	static String appendPath(String uri, String suffix) {
		int q = uri.indexOf('?');
		String path = q < 0 ? uri : uri.substring(0, q);
		String query = q < 0 ? "" : uri.substring(q);
		if (path.endsWith("/")) path = path.substring(0, path.length() - 1);
		return path + suffix + query;
	}

	static String appendQuery(String uri, String name, String value) {
		return uri + (uri.contains("?") ? "&" : "?") + name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
	}
}
