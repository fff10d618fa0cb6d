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
 * A result the platform recorded for one user on a line item.
 */
public class Result {
	private String id;
	private String scoreOf;
	private String userId;
	private Double resultScore;
	private Double resultMaximum;
	private String comment;

	public String getId() {
		return id;
	}

	public String getScoreOf() {
		return scoreOf;
	}

	public String getUserId() {
		return userId;
	}

	public Double getResultScore() {
		return resultScore;
	}

	public Double getResultMaximum() {
		return resultMaximum;
	}

	public String getComment() {
		return comment;
	}
}
