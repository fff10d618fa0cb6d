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

/**
 * A membership container: the context and (one page of) its members.
 */
public class Membership {
	private String id;
	private Context context;
	private List<Member> members = new ArrayList<Member>();

	public static class Context {
		private String id;
		private String label;
		private String title;

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

	public String getId() {
		return id;
	}

	public Context getContext() {
		return context;
	}

	public List<Member> getMembers() {
		return members == null ? new ArrayList<Member>() : members;
	}
}
