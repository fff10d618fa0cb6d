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
 * A score published to the platform gradebook for one user on one line item.
 * Serialized with Gson; fields left null are omitted from the JSON.
 */
public class Score {
	private String timestamp;
	private Double scoreGiven;
	private Double scoreMaximum;
	private String comment;
	private ActivityProgress activityProgress;
	private GradingProgress gradingProgress;
	private String userId;

	public Score() {}

	public Score(double scoreGiven, double scoreMaximum, ActivityProgress activityProgress, GradingProgress gradingProgress) {
		this.scoreGiven = scoreGiven;
		this.scoreMaximum = scoreMaximum;
		this.activityProgress = activityProgress;
		this.gradingProgress = gradingProgress;
	}

	/** ISO-8601 time of the score; filled with the current time when published without one. */
	public String getTimestamp() {
		return timestamp;
	}

	public void setTimestamp(String timestamp) {
		this.timestamp = timestamp;
	}

	public Double getScoreGiven() {
		return scoreGiven;
	}

	public void setScoreGiven(Double scoreGiven) {
		this.scoreGiven = scoreGiven;
	}

	public Double getScoreMaximum() {
		return scoreMaximum;
	}

	public void setScoreMaximum(Double scoreMaximum) {
		this.scoreMaximum = scoreMaximum;
	}

	public String getComment() {
		return comment;
	}

	public void setComment(String comment) {
		this.comment = comment;
	}

	public ActivityProgress getActivityProgress() {
		return activityProgress;
	}

	public void setActivityProgress(ActivityProgress activityProgress) {
		this.activityProgress = activityProgress;
	}

	public GradingProgress getGradingProgress() {
		return gradingProgress;
	}

	public void setGradingProgress(GradingProgress gradingProgress) {
		this.gradingProgress = gradingProgress;
	}

	/** The platform user id; null means the launching user. */
	public String getUserId() {
		return userId;
	}

	public void setUserId(String userId) {
		this.userId = userId;
	}
}
