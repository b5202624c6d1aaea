/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.time.Instant;

import lombok.Value;

/**
 * A finished run of a repeatable job.
 */
@Value
public class JobRun {

	String jobId;

	String name;

	Instant finishedOn;

	/**
	 * Amount of attempts of this run.
	 */
	int attemptsMade;

	/**
	 * Failure message, <code>null</code> for a completed run.
	 */
	String failedReason;
}
