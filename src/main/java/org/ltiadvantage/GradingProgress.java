package org.ltiadvantage;

import com.google.gson.annotations.SerializedName;

/** The status of grading for a Score. Only FULLY_GRADED scores are final. */
public enum GradingProgress {
	@SerializedName("FullyGraded") FULLY_GRADED,
	@SerializedName("Pending") PENDING,
	@SerializedName("PendingManual") PENDING_MANUAL,
	@SerializedName("Failed") FAILED,
	@SerializedName("NotReady") NOT_READY
}
