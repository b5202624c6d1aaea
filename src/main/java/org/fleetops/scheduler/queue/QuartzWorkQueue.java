/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.function.Predicate;

import org.fleetops.scheduler.config.CronPatterns;
import org.quartz.CronScheduleBuilder;
import org.quartz.CronTrigger;
import org.quartz.JobBuilder;
import org.quartz.JobKey;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link WorkQueue} on top of a Quartz {@link Scheduler}. Each job name is a durable Quartz job of the queue group,
 * and each repeatable job is a CRON trigger of this group named by its repeat key
 * <code>"{name}:{id}::{timezone}:{pattern}"</code>. Retries are one-shot triggers of the retry group.
 */
@Slf4j
public class QuartzWorkQueue implements WorkQueue {

	/**
	 * Job data holding the logical job identifier.
	 */
	public static final String JOB_ID = "jobId";

	/**
	 * Job data holding the six fields CRON expression.
	 */
	public static final String PATTERN = "pattern";

	/**
	 * Job data holding the tenant identifier.
	 */
	public static final String TENANT_ID = "tenantId";

	/**
	 * Job data holding the allowed attempts.
	 */
	public static final String ATTEMPTS = "attempts";

	/**
	 * Job data holding the attempts already made by a retried run.
	 */
	public static final String ATTEMPTS_MADE = "attemptsMade";

	/**
	 * Job data holding the initial backoff, in milliseconds.
	 */
	public static final String BACKOFF = "backoff";

	/**
	 * Job data holding the completed run retention.
	 */
	public static final String REMOVE_ON_COMPLETE = "removeOnComplete";

	/**
	 * Job data holding the failed run retention.
	 */
	public static final String REMOVE_ON_FAIL = "removeOnFail";

	@Getter
	private final String name;

	private final String retryGroup;

	private final Scheduler scheduler;

	@Getter
	private final JobRunHistory history;

	/**
	 * Constructor registering the run listener and the dispatcher in the scheduler.
	 *
	 * @param name       The queue name, also the Quartz group.
	 * @param scheduler  The Quartz scheduler.
	 * @param dispatcher The dispatcher executing the runs.
	 * @param clock      The clock stamping the runs.
	 */
	public QuartzWorkQueue(final String name, final Scheduler scheduler, final TenantJobDispatcher dispatcher,
			final Clock clock) {
		this.name = name;
		this.retryGroup = name + "-retry";
		this.scheduler = scheduler;
		this.history = new JobRunHistory(name, retryGroup, clock);
		try {
			scheduler.getContext().put(TenantJob.DISPATCHER, dispatcher);
			scheduler.getListenerManager().addJobListener(history, GroupMatcher.jobGroupEquals(name));
		} catch (final SchedulerException e) {
			throw new BackendUnavailableException("Unable to configure the queue " + name, e);
		}
	}

	/**
	 * Build the repeat key of a job.
	 *
	 * @param name    The job name.
	 * @param options The repeat options.
	 * @return The repeat key.
	 */
	public static String toRepeatKey(final String name, final RepeatableJobOptions options) {
		return name + ":" + options.getJobId() + "::" + options.getTimezone() + ":" + options.getPattern();
	}

	@Override
	public RepeatableJob addRepeatableJob(final String jobName, final Map<String, Object> payload,
			final RepeatableJobOptions options) {
		final var jobKey = JobKey.jobKey(jobName, name);
		final var key = TriggerKey.triggerKey(toRepeatKey(jobName, options), name);
		final var zone = TimeZone.getTimeZone(ZoneId.of(options.getTimezone()));
		final var trigger = TriggerBuilder.newTrigger().withIdentity(key).forJob(jobKey)
				.withSchedule(CronScheduleBuilder.cronSchedule(CronPatterns.toQuartz(options.getPattern()))
						.inTimeZone(zone))
				.usingJobData(JOB_ID, options.getJobId()).usingJobData(PATTERN, options.getPattern())
				.usingJobData(ATTEMPTS, options.getAttempts()).usingJobData(BACKOFF, options.getBackoff().toMillis())
				.usingJobData(REMOVE_ON_COMPLETE, options.getRemoveOnComplete())
				.usingJobData(REMOVE_ON_FAIL, options.getRemoveOnFail()).build();
		trigger.getJobDataMap().putAll(payload);

		try {
			scheduler.addJob(JobBuilder.newJob(TenantJob.class).withIdentity(jobKey).storeDurably().build(), true);
			final var next = schedule(trigger);
			log.debug("Repeatable job {} registered, next run {}", key.getName(), next);
			return toRepeatableJob(trigger, next);
		} catch (final SchedulerException e) {
			throw new BackendUnavailableException("Unable to register the repeatable job " + key.getName(), e);
		}
	}

	private Date schedule(final Trigger trigger) throws SchedulerException {
		if (scheduler.checkExists(trigger.getKey())) {
			// Same repeat key, replace in place
			return scheduler.rescheduleJob(trigger.getKey(), trigger);
		}
		try {
			return scheduler.scheduleJob(trigger);
		} catch (final ObjectAlreadyExistsException e) {
			log.debug("Repeatable job {} registered concurrently, replace it", trigger.getKey().getName(), e);
			return scheduler.rescheduleJob(trigger.getKey(), trigger);
		}
	}

	@Override
	public List<RepeatableJob> getRepeatableJobs() {
		try {
			final var jobs = new ArrayList<RepeatableJob>();
			for (final var key : scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(name))) {
				final var trigger = scheduler.getTrigger(key);
				// The trigger may have been removed in the meantime
				if (trigger instanceof CronTrigger) {
					jobs.add(toRepeatableJob(trigger, trigger.getNextFireTime()));
				}
			}
			return jobs;
		} catch (final SchedulerException e) {
			throw new BackendUnavailableException("Unable to list the repeatable jobs of " + name, e);
		}
	}

	private RepeatableJob toRepeatableJob(final Trigger trigger, final Date next) {
		final var data = trigger.getJobDataMap();
		return new RepeatableJob(data.getString(JOB_ID), trigger.getJobKey().getName(), data.getString(PATTERN),
				((CronTrigger) trigger).getTimeZone().getID(), trigger.getKey().getName(),
				next == null ? null : next.toInstant());
	}

	@Override
	public boolean removeRepeatableByKey(final String key) {
		try {
			return scheduler.unscheduleJob(TriggerKey.triggerKey(key, name));
		} catch (final SchedulerException e) {
			throw new BackendUnavailableException("Unable to remove the repeatable job " + key, e);
		}
	}

	@Override
	public int removeDelayed(final Predicate<String> jobIdFilter) {
		try {
			var removed = 0;
			for (final var key : scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(retryGroup))) {
				final var trigger = scheduler.getTrigger(key);
				if (trigger != null && jobIdFilter.test(trigger.getJobDataMap().getString(JOB_ID))
						&& scheduler.unscheduleJob(key)) {
					log.debug("Retry {} of {} removed", key.getName(), trigger.getJobDataMap().getString(JOB_ID));
					removed++;
				}
			}
			return removed;
		} catch (final SchedulerException e) {
			throw new BackendUnavailableException("Unable to remove the retries of " + name, e);
		}
	}

	@Override
	public QueueCounts getCounts() {
		try {
			final var now = new Date();
			var waiting = 0;
			for (final var key : scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(name))) {
				final var trigger = scheduler.getTrigger(key);
				if (trigger != null && (scheduler.getTriggerState(key) == TriggerState.BLOCKED
						|| trigger.getNextFireTime() != null && trigger.getNextFireTime().before(now))) {
					waiting++;
				}
			}
			final var active = (int) scheduler.getCurrentlyExecutingJobs().stream()
					.filter(c -> name.equals(c.getJobDetail().getKey().getGroup())).count();
			final var delayed = scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(retryGroup)).size();
			return new QueueCounts(waiting, active, history.getCompleted().size(), history.getFailed().size(),
					delayed);
		} catch (final SchedulerException e) {
			throw new BackendUnavailableException("Unable to count the jobs of " + name, e);
		}
	}
}
