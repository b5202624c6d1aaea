/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.schedule;

import lombok.Value;

/**
 * Counters of the work queue.
 */
@Value
public class QueueStats {

	int waiting;

	int active;

	int completed;

	int failed;

	int delayed;

	/**
	 * Registered repeatable jobs.
	 */
	int repeatableJobCount;
}
