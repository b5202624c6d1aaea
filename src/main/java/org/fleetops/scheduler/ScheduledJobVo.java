/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler;

import java.time.Instant;

import lombok.Getter;
import lombok.Setter;

/**
 * A repeatable job of a tenant.
 */
@Getter
@Setter
public class ScheduledJobVo {

	/**
	 * Logical job key "JOBTYPE:TENANT".
	 */
	private String id;

	/**
	 * Tenant decoded from the job key, "unknown" when not decodable.
	 */
	private String tenantId;

	private String jobType;

	/**
	 * CRON expression for this job
	 */
	private String cron;

	private String timezone;

	/**
	 * Work queue handle of this job.
	 */
	private String key;

	/**
	 * The next scheduled execution date from the server side.
	 */
	private Instant next;

}
