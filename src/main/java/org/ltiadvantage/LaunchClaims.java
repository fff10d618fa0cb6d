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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * LaunchClaims - the claims of a verified LTI 1.3 id_token, decoded once into fixed fields.
 *
 * A claim that is absent decodes to null (or an empty list); the launch pipeline decides
 * which of them are required. A claim that is present with the wrong JSON type is rejected
 * here with a JsonParseException, so no caller ever sees a half-decoded launch.
 * The untouched JSON remains available from getJson().
 */
public class LaunchClaims {

	public static final String CLAIM_PREFIX = "https://purl.imsglobal.org/spec/lti/claim/";
	public static final String TARGET_LINK_URI = CLAIM_PREFIX + "target_link_uri";
	public static final String DEPLOYMENT_ID = CLAIM_PREFIX + "deployment_id";
	public static final String VERSION = CLAIM_PREFIX + "version";
	public static final String MESSAGE_TYPE = CLAIM_PREFIX + "message_type";
	public static final String RESOURCE_LINK = CLAIM_PREFIX + "resource_link";
	public static final String ROLES = CLAIM_PREFIX + "roles";
	public static final String CONTEXT = CLAIM_PREFIX + "context";
	public static final String AGS_ENDPOINT = "https://purl.imsglobal.org/spec/lti-ags/claim/endpoint";
	public static final String NRPS_SERVICE = "https://purl.imsglobal.org/spec/lti-nrps/claim/namesroleservice";

	private final JsonObject json;
	private final String issuer;
	private final String subject;
	private final List<String> audience;
	private final String authorizedParty;
	private final String nonce;
	private final String targetLinkUri;
	private final String deploymentId;
	private final String version;
	private final String messageType;
	private final ResourceLink resourceLink;
	private final List<String> roles;
	private final Context context;
	private final String email;
	private final String name;
	private final String givenName;
	private final String familyName;
	private final AgsEndpoint agsEndpoint;
	private final NamesRoleService namesRoleService;

	public static class ResourceLink {
		private final String id;
		private final String title;
		private final String description;

		ResourceLink(String id, String title, String description) {
			this.id = id;
			this.title = title;
			this.description = description;
		}

		public String getId() {
			return id;
		}

		public String getTitle() {
			return title;
		}

		public String getDescription() {
			return description;
		}
	}

	public static class Context {
		private final String id;
		private final String label;
		private final String title;

		Context(String id, String label, String title) {
			this.id = id;
			this.label = label;
			this.title = title;
		}

		public String getId() {
			return id;
		}

		public String getLabel() {
			return label;
		}

		public String getTitle() {
			return title;
		}
	}

	/** The Assignment and Grade Services endpoint claim. */
	public static class AgsEndpoint {
		private final String lineItem;
		private final String lineItems;
		private final List<String> scopes;

		AgsEndpoint(String lineItem, String lineItems, List<String> scopes) {
			this.lineItem = lineItem;
			this.lineItems = lineItems;
			this.scopes = scopes;
		}

		public String getLineItem() {
			return lineItem;
		}

		public String getLineItems() {
			return lineItems;
		}

		public List<String> getScopes() {
			return scopes;
		}
	}

	/** The Names and Role Provisioning Services claim. */
	public static class NamesRoleService {
		private final String contextMembershipsUrl;
		private final List<String> serviceVersions;

		NamesRoleService(String contextMembershipsUrl, List<String> serviceVersions) {
			this.contextMembershipsUrl = contextMembershipsUrl;
			this.serviceVersions = serviceVersions;
		}

		public String getContextMembershipsUrl() {
			return contextMembershipsUrl;
		}

		public List<String> getServiceVersions() {
			return serviceVersions;
		}
	}

	private LaunchClaims(JsonObject json) {
		this.json = json;
		issuer = string(json, "iss");
		subject = string(json, "sub");
		audience = audience(json);
		authorizedParty = string(json, "azp");
		nonce = string(json, "nonce");
		targetLinkUri = string(json, TARGET_LINK_URI);
		deploymentId = string(json, DEPLOYMENT_ID);
		version = string(json, VERSION);
		messageType = string(json, MESSAGE_TYPE);
		roles = strings(json, ROLES);
		email = string(json, "email");
		name = string(json, "name");
		givenName = string(json, "given_name");
		familyName = string(json, "family_name");

		JsonObject link = object(json, RESOURCE_LINK);
		resourceLink = link == null ? null : new ResourceLink(string(link, "id"), string(link, "title"), string(link, "description"));

		JsonObject ctx = object(json, CONTEXT);
		context = ctx == null ? null : new Context(string(ctx, "id"), string(ctx, "label"), string(ctx, "title"));

		JsonObject ags = object(json, AGS_ENDPOINT);
		agsEndpoint = ags == null ? null : new AgsEndpoint(string(ags, "lineitem"), string(ags, "lineitems"), ags.has("scope") ? strings(ags, "scope") : null);

		JsonObject nrps = object(json, NRPS_SERVICE);
		namesRoleService = nrps == null ? null : new NamesRoleService(string(nrps, "context_memberships_url"), strings(nrps, "service_versions"));
	}

	/**
	 * Decodes a claims payload.
	 * @throws JsonParseException if the payload is not a JSON object or a claim has the wrong type
	 */
	public static LaunchClaims parse(String claimsJson) throws JsonParseException {
		JsonElement e;
		try {
			e = JsonParser.parseString(claimsJson);
		} catch (RuntimeException ex) {
			throw new JsonParseException("Launch claims are not valid JSON.", ex);
		}
		if (e == null || !e.isJsonObject()) throw new JsonParseException("Launch claims must be a JSON object.");
		return new LaunchClaims(e.getAsJsonObject());
	}

	static String string(JsonObject o, String name) {
		JsonElement e = o.get(name);
		if (e == null || e.isJsonNull()) return null;
		if (!e.isJsonPrimitive() || !e.getAsJsonPrimitive().isString()) throw new JsonParseException("The " + name + " claim must be a string.");
		return e.getAsString();
	}

	static JsonObject object(JsonObject o, String name) {
		JsonElement e = o.get(name);
		if (e == null || e.isJsonNull()) return null;
		if (!e.isJsonObject()) throw new JsonParseException("The " + name + " claim must be an object.");
		return e.getAsJsonObject();
	}

	static List<String> strings(JsonObject o, String name) {
		JsonElement e = o.get(name);
		if (e == null || e.isJsonNull()) return Collections.emptyList();
		if (!e.isJsonArray()) throw new JsonParseException("The " + name + " claim must be an array.");
		List<String> values = new ArrayList<String>();
		for (JsonElement item : e.getAsJsonArray()) {
			if (!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isString()) throw new JsonParseException("The " + name + " claim must hold only strings.");
			values.add(item.getAsString());
		}
		return Collections.unmodifiableList(values);
	}

	// aud may be a single string or an array of strings
	private static List<String> audience(JsonObject o) {
		JsonElement e = o.get("aud");
		if (e == null || e.isJsonNull()) return Collections.emptyList();
		if (e.isJsonArray()) return strings(o, "aud");
		return Collections.singletonList(string(o, "aud"));
	}

	public JsonObject getJson() {
		return json.deepCopy();
	}

	public String getIssuer() {
		return issuer;
	}

	public String getSubject() {
		return subject;
	}

	public List<String> getAudience() {
		return audience;
	}

	public String getAuthorizedParty() {
		return authorizedParty;
	}

	public String getNonce() {
		return nonce;
	}

	public String getTargetLinkUri() {
		return targetLinkUri;
	}

	public String getDeploymentId() {
		return deploymentId;
	}

	public String getVersion() {
		return version;
	}

	public String getMessageType() {
		return messageType;
	}

	public ResourceLink getResourceLink() {
		return resourceLink;
	}

	public List<String> getRoles() {
		return roles;
	}

	public Context getContext() {
		return context;
	}

	public String getEmail() {
		return email;
	}

	public String getName() {
		return name;
	}

	public String getGivenName() {
		return givenName;
	}

	public String getFamilyName() {
		return familyName;
	}

	public AgsEndpoint getAgsEndpoint() {
		return agsEndpoint;
	}

	public NamesRoleService getNamesRoleService() {
		return namesRoleService;
	}

	/** The client_id the token was issued to: azp when present, otherwise the first audience. */
	public String getClientId() {
		if (authorizedParty != null) return authorizedParty;
		return audience.isEmpty() ? null : audience.get(0);
	}
}
