/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.schedule;

import java.time.Duration;

import lombok.Value;

/**
 * Retry and retention policy given to each registered job.
 */
@Value
public class JobPolicy {

	int attempts;

	/**
	 * Initial delay, doubled on each new attempt.
	 */
	Duration backoff;

	int removeOnComplete;

	int removeOnFail;
}
