/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.util.HashMap;

import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.springframework.scheduling.quartz.QuartzJobBean;

import lombok.Setter;

/**
 * Quartz job executing the runs of the repeatable jobs. The dispatcher is injected from the scheduler context.
 */
public class TenantJob extends QuartzJobBean {

	/**
	 * Scheduler context entry holding the {@link TenantJobDispatcher}.
	 */
	public static final String DISPATCHER = "jobDispatcher";

	@Setter
	private TenantJobDispatcher jobDispatcher;

	@Override
	protected void executeInternal(final JobExecutionContext context) throws JobExecutionException {
		// Extract the job data to execute the run
		final var data = context.getMergedJobDataMap();
		final var payload = new HashMap<String, Object>();
		data.forEach(payload::put);
		try {
			jobDispatcher.dispatch(data.getString(QuartzWorkQueue.TENANT_ID), context.getJobDetail().getKey().getName(),
					payload);
		} catch (final Exception e) {
			throw new JobExecutionException(e);
		}
	}
}
