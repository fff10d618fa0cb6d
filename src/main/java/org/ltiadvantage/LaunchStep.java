package org.ltiadvantage;

/**
 * The checks of the launch pipeline, in the order LaunchValidator runs them.
 */
public enum LaunchStep {
	TOKEN,
	REGISTRATION,
	SIGNATURE,
	STATE,
	AUDIENCE,
	NONCE,
	DEPLOYMENT,
	VERSION,
	RESOURCE_LINK,
	LAUNCH_DATA
}
