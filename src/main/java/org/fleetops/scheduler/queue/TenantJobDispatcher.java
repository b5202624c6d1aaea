/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.fleetops.scheduler.tenant.TenantContextProvider;

import lombok.extern.slf4j.Slf4j;

/**
 * Route a fired run to the {@link JobProcessor} of its job type, within the context of its tenant.
 */
@Slf4j
public class TenantJobDispatcher {

	private final TenantContextProvider contextProvider;

	private final Map<String, JobProcessor> processors;

	/**
	 * Constructor with the available processors.
	 *
	 * @param contextProvider The tenant context provider.
	 * @param processors      The available processors. At most one per job type.
	 */
	public TenantJobDispatcher(final TenantContextProvider contextProvider,
			final Collection<JobProcessor> processors) {
		this.contextProvider = contextProvider;
		this.processors = processors.stream()
				.collect(Collectors.toMap(JobProcessor::getJobType, Function.identity()));
	}

	/**
	 * Execute a run.
	 *
	 * @param tenantId The tenant of this run.
	 * @param jobType  The job type.
	 * @param payload  The run data.
	 * @throws Exception Any failure of the processor.
	 */
	public void dispatch(final String tenantId, final String jobType, final Map<String, Object> payload)
			throws Exception { // NOSONAR
		final var processor = processors.get(jobType);
		if (processor == null) {
			log.warn("No processor for job type {}, run of tenant {} is ignored", jobType, tenantId);
			return;
		}

		// The context lives only during this run
		final var context = contextProvider.getTenantContext(tenantId);
		log.info("Executing {} for tenant {}", jobType, tenantId);
		processor.process(context, payload);
		log.info("Succeed {} for tenant {}", jobType, tenantId);
	}
}
