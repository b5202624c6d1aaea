/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import java.time.Instant;
import java.util.List;

import lombok.Value;

/**
 * Synchronization status of the jobs of a tenant.
 */
@Value
public class SyncStatus {

	String tenantId;

	boolean hasActiveJobs;

	int jobCount;

	/**
	 * Last synchronization attempt, <code>null</code> when never attempted since the start.
	 */
	Instant lastSyncAttempt;

	/**
	 * Last successful synchronization, <code>null</code> when never succeeded since the start.
	 */
	Instant lastSyncSuccess;

	/**
	 * Recent failure messages, most recent first.
	 */
	List<String> syncErrors;
}
