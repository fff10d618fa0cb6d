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
import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * One entry of a context roster.
 */
public class Member {
	private String status;
	private String name;
	private String picture;
	@SerializedName("given_name") private String givenName;
	@SerializedName("family_name") private String familyName;
	@SerializedName("middle_name") private String middleName;
	private String email;
	@SerializedName("user_id") private String userId;
	@SerializedName("lis_person_sourcedid") private String lisPersonSourcedId;
	private List<String> roles = new ArrayList<String>();

	public Member() {}

	Member(String userId, String name, String givenName, String familyName, String email) {
		this.userId = userId;
		this.name = name;
		this.givenName = givenName;
		this.familyName = familyName;
		this.email = email;
	}

	/** Active, Inactive or Deleted; null for a member built from launch claims. */
	public String getStatus() {
		return status;
	}

	public String getName() {
		return name;
	}

	public String getPicture() {
		return picture;
	}

	public String getGivenName() {
		return givenName;
	}

	public String getFamilyName() {
		return familyName;
	}

	public String getMiddleName() {
		return middleName;
	}

	public String getEmail() {
		return email;
	}

	public String getUserId() {
		return userId;
	}

	public String getLisPersonSourcedId() {
		return lisPersonSourcedId;
	}

	public List<String> getRoles() {
		return roles == null ? new ArrayList<String>() : roles;
	}
}
