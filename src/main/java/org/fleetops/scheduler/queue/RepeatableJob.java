/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.time.Instant;

import lombok.Value;

/**
 * A repeatable job registered in the work queue.
 */
@Value
public class RepeatableJob {

	/**
	 * Logical job identifier, chosen by the producer.
	 */
	String id;

	/**
	 * Job name, the job type.
	 */
	String name;

	/**
	 * Six fields CRON expression.
	 */
	String pattern;

	String timezone;

	/**
	 * Backend handle of this job, required to remove it.
	 */
	String key;

	/**
	 * Next fire time, may be <code>null</code> when the job will not fire anymore.
	 */
	Instant nextRunTime;
}
