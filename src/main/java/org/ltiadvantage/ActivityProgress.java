package org.ltiadvantage;

import com.google.gson.annotations.SerializedName;

/** The learner's progress on the activity, as reported with a Score. */
public enum ActivityProgress {
	@SerializedName("Initialized") INITIALIZED,
	@SerializedName("Started") STARTED,
	@SerializedName("InProgress") IN_PROGRESS,
	@SerializedName("Submitted") SUBMITTED,
	@SerializedName("Completed") COMPLETED
}
