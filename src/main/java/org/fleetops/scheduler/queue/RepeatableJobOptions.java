/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Registration options of a repeatable job.
 */
@Value
@Builder
public class RepeatableJobOptions {

	/**
	 * Logical job identifier.
	 */
	String jobId;

	/**
	 * Six fields CRON expression.
	 */
	String pattern;

	String timezone;

	/**
	 * Maximal attempts of a run, including the first one.
	 */
	@Builder.Default
	int attempts = 1;

	/**
	 * Initial delay before a retry, doubled on each new attempt.
	 */
	@Builder.Default
	Duration backoff = Duration.ZERO;

	/**
	 * Amount of kept completed runs.
	 */
	@Builder.Default
	int removeOnComplete = 0;

	/**
	 * Amount of kept failed runs.
	 */
	@Builder.Default
	int removeOnFail = 0;
}
