/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.config;

import lombok.Builder;
import lombok.Value;

/**
 * The resolved and validated scheduling configuration of one job type of one tenant. Derived from the settings, never
 * persisted.
 */
@Value
@Builder(toBuilder = true)
public class TenantCronConfig {

	String tenantId;

	/**
	 * Job type discriminator, such as <code>gps.sync</code>.
	 */
	String jobType;

	/**
	 * Six fields CRON expression: second, minute, hour, day of month, month, day of week.
	 */
	String cron;

	/**
	 * IANA zone name the CRON expression is evaluated in.
	 */
	String timezone;

	boolean enabled;
}
