/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A named queue of repeatable jobs. The backend has no uniqueness on the logical job identifier: the same identifier
 * registered with two patterns gives two repeatable jobs.
 */
public interface WorkQueue {

	/**
	 * Return the queue name.
	 *
	 * @return The queue name.
	 */
	String getName();

	/**
	 * Register a repeatable job. Registering again the same identifier, timezone and pattern replaces the previous
	 * registration.
	 *
	 * @param name    The job name.
	 * @param payload The data given to each run.
	 * @param options The repeat options.
	 * @return The registered job.
	 * @throws BackendUnavailableException When the backend fails.
	 */
	RepeatableJob addRepeatableJob(String name, Map<String, Object> payload, RepeatableJobOptions options);

	/**
	 * Return all repeatable jobs of this queue.
	 *
	 * @return All repeatable jobs.
	 * @throws BackendUnavailableException When the backend fails.
	 */
	List<RepeatableJob> getRepeatableJobs();

	/**
	 * Remove a repeatable job.
	 *
	 * @param key The backend handle of the job.
	 * @return <code>true</code> when a job has been removed.
	 * @throws BackendUnavailableException When the backend fails.
	 */
	boolean removeRepeatableByKey(String key);

	/**
	 * Remove the pending retries of the matching jobs.
	 *
	 * @param jobIdFilter The filter on the logical job identifier.
	 * @return The amount of removed retries.
	 * @throws BackendUnavailableException When the backend fails.
	 */
	int removeDelayed(Predicate<String> jobIdFilter);

	/**
	 * Return the job counts.
	 *
	 * @return The job counts.
	 * @throws BackendUnavailableException When the backend fails.
	 */
	QueueCounts getCounts();
}
