/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.config;

/**
 * A resolved schedule is rejected: bad CRON, bad timezone or interval too short. The message is the human readable
 * reason.
 */
public class InvalidScheduleConfigException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor with the rejection reason.
	 *
	 * @param reason The human readable reason.
	 */
	public InvalidScheduleConfigException(final String reason) {
		super(reason);
	}
}
