/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.schedule;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.fleetops.scheduler.config.CronConfigValidator;
import org.fleetops.scheduler.config.CronPatterns;
import org.fleetops.scheduler.config.InvalidScheduleConfigException;
import org.fleetops.scheduler.config.TenantCronConfig;
import org.fleetops.scheduler.queue.BackendUnavailableException;
import org.fleetops.scheduler.queue.QuartzWorkQueue;
import org.fleetops.scheduler.queue.RepeatableJob;
import org.fleetops.scheduler.queue.RepeatableJobOptions;
import org.fleetops.scheduler.queue.WorkQueue;
import org.springframework.core.task.AsyncTaskExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Keep the repeatable jobs of the work queue consistent with the tenant configurations. There is at most one
 * repeatable job per logical key "JOBTYPE:TENANT" once an upsert completes. Operations on the same key are serialized
 * within this process by a fixed set of lock stripes. Each call to the work queue is bounded by a timeout.
 */
@Slf4j
public class JobRegistry {

	private final WorkQueue queue;

	private final CronConfigValidator validator;

	private final JobPolicy policy;

	private final AsyncTaskExecutor executor;

	private final Duration timeout;

	/**
	 * Amount of lock stripes shared by the job keys.
	 */
	private static final int STRIPES = 64;

	private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

	/**
	 * Constructor.
	 *
	 * @param queue     The work queue.
	 * @param validator The configuration validator.
	 * @param policy    The retry and retention policy of the registered jobs.
	 * @param executor  The executor running the work queue calls.
	 * @param timeout   The maximal duration of a work queue call.
	 */
	public JobRegistry(final WorkQueue queue, final CronConfigValidator validator, final JobPolicy policy,
			final AsyncTaskExecutor executor, final Duration timeout) {
		this.queue = queue;
		this.validator = validator;
		this.policy = policy;
		this.executor = executor;
		this.timeout = timeout;
		for (var i = 0; i < STRIPES; i++) {
			locks[i] = new ReentrantLock();
		}
	}

	/**
	 * Create, replace or remove the repeatable job of a configuration. The CRON expression is normalized to its six
	 * fields form. When the configuration is enabled, it is validated before any change, so an invalid configuration
	 * leaves the current job in place.
	 *
	 * @param source The tenant configuration.
	 * @return The registered job, or <code>null</code> when the configuration is disabled.
	 * @throws InvalidScheduleConfigException When the enabled configuration is invalid.
	 * @throws BackendUnavailableException    When the work queue fails.
	 */
	public RepeatableJob upsert(final TenantCronConfig source) {
		final var config = source.toBuilder().cron(CronPatterns.normalize(source.getCron())).build();
		final var id = JobKeys.format(config);
		if (config.isEnabled()) {
			validator.validate(config);
		}
		return locked(id, () -> {
			// Remove the previous registrations, whatever their pattern
			final var removed = removeAll(id);
			if (!config.isEnabled()) {
				removeDelayedQuietly(id, id::equals);
				log.info("Job {} is disabled, {} registration(s) removed", id, removed);
				return null;
			}

			final var options = RepeatableJobOptions.builder().jobId(id).pattern(config.getCron())
					.timezone(config.getTimezone()).attempts(policy.getAttempts()).backoff(policy.getBackoff())
					.removeOnComplete(policy.getRemoveOnComplete()).removeOnFail(policy.getRemoveOnFail()).build();
			final Map<String, Object> payload = Map.of(QuartzWorkQueue.TENANT_ID, config.getTenantId(), "jobType",
					config.getJobType());
			final var job = call("Register " + id,
					() -> queue.addRepeatableJob(config.getJobType(), payload, options));
			log.info("Job {} scheduled with '{}' in {}, next run {}", id, config.getCron(), config.getTimezone(),
					job.getNextRunTime());
			return job;
		});
	}

	/**
	 * Remove the repeatable jobs of a configuration and their pending retries.
	 *
	 * @param config The tenant configuration. Only the job type and the tenant are used.
	 * @return The amount of removed registrations.
	 * @throws BackendUnavailableException When the work queue cannot be listed.
	 */
	public int remove(final TenantCronConfig config) {
		final var id = JobKeys.format(config);
		final int removed = locked(id, () -> {
			removeDelayedQuietly(id, id::equals);
			return removeAll(id);
		});
		log.info("Job {} removed, {} registration(s)", id, removed);
		return removed;
	}

	/**
	 * Return the repeatable jobs of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The jobs whose key belongs to the tenant.
	 */
	public List<RepeatableJob> listForTenant(final String tenantId) {
		return find(j -> tenantId.equals(JobKeys.getTenant(j.getId())));
	}

	/**
	 * Return all repeatable jobs.
	 *
	 * @return All repeatable jobs.
	 */
	public List<RepeatableJob> findAll() {
		return find(j -> true);
	}

	/**
	 * Return the counters of the work queue.
	 *
	 * @return The counters.
	 */
	public QueueStats stats() {
		final var counts = call("Count jobs", queue::getCounts);
		final var repeatable = call("List jobs", queue::getRepeatableJobs).size();
		return new QueueStats(counts.getWaiting(), counts.getActive(), counts.getCompleted(), counts.getFailed(),
				counts.getDelayed(), repeatable);
	}

	/**
	 * Remove all repeatable jobs of a tenant and their pending retries. A failure on one job does not stop the others.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The amount of removed jobs.
	 */
	public int clearTenantJobs(final String tenantId) {
		var removed = 0;
		for (final var job : listForTenant(tenantId)) {
			if (removeQuietly(job)) {
				removed++;
			}
		}
		removeDelayedQuietly(tenantId, j -> tenantId.equals(JobKeys.getTenant(j)));
		log.info("Cleared {} job(s) of tenant {}", removed, tenantId);
		return removed;
	}

	private List<RepeatableJob> find(final Predicate<RepeatableJob> filter) {
		return call("List jobs", queue::getRepeatableJobs).stream().filter(filter).collect(Collectors.toList());
	}

	private int removeAll(final String id) {
		var removed = 0;
		for (final var job : find(j -> id.equals(j.getId()))) {
			if (removeQuietly(job)) {
				removed++;
			}
		}
		return removed;
	}

	private boolean removeQuietly(final RepeatableJob job) {
		try {
			final boolean removed = call("Remove " + job.getKey(), () -> queue.removeRepeatableByKey(job.getKey()));
			log.debug("Registration {} removed: {}", job.getKey(), removed);
			return removed;
		} catch (final RuntimeException e) {
			log.warn("Unable to remove the registration {} of {}", job.getKey(), job.getId(), e);
			return false;
		}
	}

	private void removeDelayedQuietly(final String owner, final Predicate<String> jobIdFilter) {
		try {
			final int removed = call("Remove retries of " + owner, () -> queue.removeDelayed(jobIdFilter));
			log.debug("{} pending retrie(s) of {} removed", removed, owner);
		} catch (final RuntimeException e) {
			log.warn("Unable to remove the pending retries of {}", owner, e);
		}
	}

	private <T> T locked(final String id, final Callable<T> action) {
		final var lock = locks[Math.floorMod(id.hashCode(), STRIPES)];
		lock.lock();
		try {
			return action.call();
		} catch (final RuntimeException e) {
			throw e;
		} catch (final Exception e) {
			throw new IllegalStateException(e);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Execute a work queue call within the timeout.
	 */
	private <T> T call(final String operation, final Callable<T> call) {
		final var future = executor.submit(call);
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (final TimeoutException e) {
			future.cancel(true);
			throw new BackendUnavailableException(operation + " did not complete within " + timeout, e);
		} catch (final ExecutionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw new BackendUnavailableException(operation + " failed", e.getCause());
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new BackendUnavailableException(operation + " was interrupted", e);
		}
	}
}
