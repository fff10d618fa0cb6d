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

import com.google.gson.reflect.TypeToken;

/**
 * Nrps - the LTI Names and Role Provisioning Services client for one launch.
 */
public class Nrps {

	public static final String SCOPE_MEMBERSHIP_READONLY = "https://purl.imsglobal.org/spec/lti-nrps/scope/contextmembership.readonly";

	static final String MEMBERSHIP_CONTAINER_TYPE = "application/vnd.ims.lti-nrps.v2.membershipcontainer+json";

	private final Connector connector;
	private final String membershipsUrl;

	Nrps(Connector connector) throws ServiceUnsupportedException {
		LaunchClaims.NamesRoleService service = connector.getClaims().getNamesRoleService();
		if (service == null || service.getContextMembershipsUrl() == null)
			throw new ServiceUnsupportedException("The platform did not offer Names and Role Provisioning Services for this launch.");
		this.connector = connector;
		this.membershipsUrl = service.getContextMembershipsUrl();
	}

	public String getMembershipsUri() {
		return membershipsUrl;
	}

	/** Reads the roster in a single request. Platforms that paginate return only the first page here. */
	public Membership getMembership() throws ConnectorException {
		ServiceRequest request = new ServiceRequest("GET", membershipsUrl, SCOPE_MEMBERSHIP_READONLY).accept(MEMBERSHIP_CONTAINER_TYPE);
		try (ServiceResponse response = connector.dispatch(request)) {
			return Ags.readJson(response, TypeToken.get(Membership.class));
		} catch (IOException e) {
			throw new ConnectorException("Unable to read the membership at " + membershipsUrl + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Returns a pager over the roster, asking the platform for at most limit members per page.
	 */
	public Pager<Membership> getPagedMembership(int limit) {
		if (limit < 1) throw new IllegalArgumentException("The page limit must be at least 1.");
		String first = Ags.appendQuery(membershipsUrl, "limit", Integer.toString(limit));
		return new Pager<Membership>(connector, first,
				uri -> new ServiceRequest("GET", uri, SCOPE_MEMBERSHIP_READONLY).accept(MEMBERSHIP_CONTAINER_TYPE),
				response -> Ags.readJson(response, TypeToken.get(Membership.class)));
	}

	/**
	 * Builds the launching user's roster entry from the launch claims, without a request.
	 * Status and roles are not part of the launch and stay empty.
	 */
	public Member getLaunchingMember() throws ConnectorException {
		LaunchClaims claims = connector.getClaims();
		if (claims.getSubject() == null) throw new ConnectorException("The launch has no sub claim.");
		return new Member(claims.getSubject(), claims.getName(), claims.getGivenName(), claims.getFamilyName(), claims.getEmail());
	}
}
