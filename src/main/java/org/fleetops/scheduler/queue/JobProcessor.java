/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.util.Map;

import org.fleetops.scheduler.tenant.TenantContext;

/**
 * Executes the runs of one job type.
 */
public interface JobProcessor {

	/**
	 * Return the handled job type.
	 *
	 * @return The job type, such as <code>gps.sync</code>.
	 */
	String getJobType();

	/**
	 * Execute one run.
	 *
	 * @param context The tenant of this run.
	 * @param payload The data of the repeatable job.
	 * @throws Exception Any failure, the run will be retried according to the job options.
	 */
	void process(TenantContext context, Map<String, Object> payload) throws Exception; // NOSONAR
}
