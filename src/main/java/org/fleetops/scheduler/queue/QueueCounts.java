/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import lombok.Value;

/**
 * Job counts of a work queue.
 */
@Value
public class QueueCounts {

	/**
	 * Runs due but not started yet.
	 */
	int waiting;

	/**
	 * Runs being executed.
	 */
	int active;

	/**
	 * Retained completed runs.
	 */
	int completed;

	/**
	 * Retained failed runs.
	 */
	int failed;

	/**
	 * Pending retries.
	 */
	int delayed;
}
