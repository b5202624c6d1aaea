/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler;

import org.fleetops.scheduler.schedule.QueueStats;

import lombok.Getter;
import lombok.Setter;

/**
 * Health of the scheduler.
 */
@Getter
@Setter
public class SchedulerHealth {

	/**
	 * Healthy status.
	 */
	public static final String HEALTHY = "healthy";

	/**
	 * Unhealthy status, the work queue cannot be reached.
	 */
	public static final String UNHEALTHY = "unhealthy";

	private String status;

	/**
	 * Work queue counters, <code>null</code> when unhealthy.
	 */
	private QueueStats stats;

	/**
	 * Amount of tenants having at least one job.
	 */
	private int tenantsWithJobs;

	/**
	 * Failure message when unhealthy.
	 */
	private String error;
}
