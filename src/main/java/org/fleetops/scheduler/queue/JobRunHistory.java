/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Date;
import java.util.Deque;
import java.util.LinkedList;
import java.util.List;

import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobListener;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.TriggerBuilder;

import lombok.extern.slf4j.Slf4j;

/**
 * Record the finished runs of a queue and re-fire the failed ones. A failed run is fired again after
 * <code>backoff * 2^(attempt-1)</code> until the allowed attempts are consumed. Only the last completed and failed
 * runs are retained, according to the options of each job.
 */
@Slf4j
public class JobRunHistory implements JobListener {

	private final String name;

	private final String retryGroup;

	private final Clock clock;

	private final Deque<JobRun> completed = new LinkedList<>();

	private final Deque<JobRun> failed = new LinkedList<>();

	/**
	 * Constructor.
	 *
	 * @param queue      The queue name.
	 * @param retryGroup The trigger group of the retries.
	 * @param clock      The clock stamping the runs.
	 */
	public JobRunHistory(final String queue, final String retryGroup, final Clock clock) {
		this.name = queue + "-history";
		this.retryGroup = retryGroup;
		this.clock = clock;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public void jobToBeExecuted(final JobExecutionContext context) {
		// Nothing to do
	}

	@Override
	public void jobExecutionVetoed(final JobExecutionContext context) {
		// Nothing to do
	}

	@Override
	public void jobWasExecuted(final JobExecutionContext context, final JobExecutionException jobException) {
		final var data = context.getMergedJobDataMap();
		final var attempt = getInt(data, QuartzWorkQueue.ATTEMPTS_MADE, 0) + 1;
		final var jobId = data.getString(QuartzWorkQueue.JOB_ID);
		final var jobName = context.getJobDetail().getKey().getName();
		if (jobException == null) {
			add(completed, new JobRun(jobId, jobName, clock.instant(), attempt, null),
					getInt(data, QuartzWorkQueue.REMOVE_ON_COMPLETE, 0));
			return;
		}

		final var reason = jobException.getCause() == null ? jobException.getMessage()
				: jobException.getCause().getMessage();
		if (attempt < getInt(data, QuartzWorkQueue.ATTEMPTS, 1)) {
			retry(context, data, attempt, reason);
		} else {
			log.warn("Run of {} failed after {} attempt(s): {}", jobId, attempt, reason);
			add(failed, new JobRun(jobId, jobName, clock.instant(), attempt, reason),
					getInt(data, QuartzWorkQueue.REMOVE_ON_FAIL, 0));
		}
	}

	private void retry(final JobExecutionContext context, final JobDataMap data, final int attempt,
			final String reason) {
		final var backoff = Duration.ofMillis(getLong(data, QuartzWorkQueue.BACKOFF)).multipliedBy(1L << (attempt - 1));
		final var retryData = new JobDataMap(context.getTrigger().getJobDataMap());
		retryData.put(QuartzWorkQueue.ATTEMPTS_MADE, attempt);
		final var trigger = TriggerBuilder.newTrigger()
				.withIdentity(context.getFireInstanceId() + ":" + attempt, retryGroup)
				.forJob(context.getJobDetail().getKey()).usingJobData(retryData)
				.startAt(Date.from(clock.instant().plus(backoff)))
				.withSchedule(SimpleScheduleBuilder.simpleSchedule().withMisfireHandlingInstructionFireNow()).build();
		try {
			context.getScheduler().scheduleJob(trigger);
			log.info("Run {} of {} failed ({}), retry in {}", attempt, data.getString(QuartzWorkQueue.JOB_ID), reason,
					backoff);
		} catch (final SchedulerException e) {
			log.error("Unable to schedule the retry of {}", data.getString(QuartzWorkQueue.JOB_ID), e);
		}
	}

	private synchronized void add(final Deque<JobRun> runs, final JobRun run, final int retention) {
		runs.addFirst(run);
		while (runs.size() > retention) {
			runs.removeLast();
		}
	}

	/**
	 * Return the retained completed runs, most recent first.
	 *
	 * @return The retained completed runs.
	 */
	public synchronized List<JobRun> getCompleted() {
		return new ArrayList<>(completed);
	}

	/**
	 * Return the retained failed runs, most recent first.
	 *
	 * @return The retained failed runs.
	 */
	public synchronized List<JobRun> getFailed() {
		return new ArrayList<>(failed);
	}

	private static int getInt(final JobDataMap data, final String key, final int defaultValue) {
		return data.containsKey(key) ? data.getIntValue(key) : defaultValue;
	}

	private static long getLong(final JobDataMap data, final String key) {
		return data.containsKey(key) ? data.getLongValue(key) : 0L;
	}
}
