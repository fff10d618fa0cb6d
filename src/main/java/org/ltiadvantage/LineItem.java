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

import java.util.Objects;

/**
 * A gradebook column. The platform assigns the id when the line item is created.
 */
public class LineItem {
	private String id;
	private String startDateTime;
	private String endDateTime;
	private Double scoreMaximum;
	private String label;
	private String tag;
	private String resourceId;
	private String resourceLinkId;

	public LineItem() {}

	public LineItem(String label, double scoreMaximum) {
		this.label = label;
		this.scoreMaximum = scoreMaximum;
	}

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getStartDateTime() {
		return startDateTime;
	}

	public void setStartDateTime(String startDateTime) {
		this.startDateTime = startDateTime;
	}

	public String getEndDateTime() {
		return endDateTime;
	}

	public void setEndDateTime(String endDateTime) {
		this.endDateTime = endDateTime;
	}

	public Double getScoreMaximum() {
		return scoreMaximum;
	}

	public void setScoreMaximum(Double scoreMaximum) {
		this.scoreMaximum = scoreMaximum;
	}

	public String getLabel() {
		return label;
	}

	public void setLabel(String label) {
		this.label = label;
	}

	public String getTag() {
		return tag;
	}

	public void setTag(String tag) {
		this.tag = tag;
	}

	public String getResourceId() {
		return resourceId;
	}

	public void setResourceId(String resourceId) {
		this.resourceId = resourceId;
	}

	public String getResourceLinkId() {
		return resourceLinkId;
	}

	public void setResourceLinkId(String resourceLinkId) {
		this.resourceLinkId = resourceLinkId;
	}

	/** True when every field the tool submits (all but id) is equal. */
	public boolean sameContent(LineItem other) {
		return other != null
				&& Objects.equals(startDateTime, other.startDateTime)
				&& Objects.equals(endDateTime, other.endDateTime)
				&& Objects.equals(scoreMaximum, other.scoreMaximum)
				&& Objects.equals(label, other.label)
				&& Objects.equals(tag, other.tag)
				&& Objects.equals(resourceId, other.resourceId)
				&& Objects.equals(resourceLinkId, other.resourceLinkId);
	}
}
