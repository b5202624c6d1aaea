/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.awaitility.Awaitility;
import org.fleetops.scheduler.model.Tenant;
import org.fleetops.scheduler.tenant.TenantContext;
import org.fleetops.scheduler.tenant.TenantContextProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.TriggerBuilder;

/**
 * Test class of {@link QuartzWorkQueue}
 */
class QuartzWorkQueueTest {

	private Scheduler scheduler;

	private JobProcessor processor;

	private QuartzWorkQueue queue;

	@BeforeEach
	void init() throws SchedulerException {
		final var tenant = new Tenant();
		tenant.setId("t1");
		tenant.setTimezone("America/Bogota");
		processor = Mockito.mock(JobProcessor.class);
		Mockito.when(processor.getJobType()).thenReturn("gps.sync");
		final var dispatcher = new TenantJobDispatcher(new TenantContextProvider(id -> Optional.of(tenant)),
				List.of(processor));
		scheduler = RamSchedulers.newScheduler();
		queue = new QuartzWorkQueue("gps-queue", scheduler, dispatcher, Clock.systemUTC());
	}

	@AfterEach
	void shutdown() throws SchedulerException {
		scheduler.shutdown(true);
	}

	private static RepeatableJobOptions newOptions(final String id, final String pattern, final int attempts) {
		return RepeatableJobOptions.builder().jobId(id).pattern(pattern).timezone("America/Bogota").attempts(attempts)
				.backoff(Duration.ZERO).removeOnComplete(10).removeOnFail(50).build();
	}

	private RepeatableJob add(final String id, final String pattern) {
		return queue.addRepeatableJob("gps.sync", Map.of("tenantId", "t1", "jobType", "gps.sync"),
				newOptions(id, pattern, 3));
	}

	@Test
	void addRepeatableJob() {
		final var job = add("gps.sync:t1", "0 */5 * * * *");
		Assertions.assertEquals("gps.sync:t1", job.getId());
		Assertions.assertEquals("gps.sync", job.getName());
		Assertions.assertEquals("0 */5 * * * *", job.getPattern());
		Assertions.assertEquals("America/Bogota", job.getTimezone());
		Assertions.assertEquals("gps.sync:gps.sync:t1::America/Bogota:0 */5 * * * *", job.getKey());
		Assertions.assertNotNull(job.getNextRunTime());

		final var jobs = queue.getRepeatableJobs();
		Assertions.assertEquals(1, jobs.size());
		Assertions.assertEquals(job.getKey(), jobs.get(0).getKey());
		Assertions.assertEquals("gps.sync:t1", jobs.get(0).getId());
		Assertions.assertEquals("0 */5 * * * *", jobs.get(0).getPattern());
	}

	@Test
	void addRepeatableJobSameKey() {
		add("gps.sync:t1", "0 */5 * * * *");
		add("gps.sync:t1", "0 */5 * * * *");
		Assertions.assertEquals(1, queue.getRepeatableJobs().size());
	}

	@Test
	void addRepeatableJobOtherPattern() {
		// No uniqueness on the logical identifier
		add("gps.sync:t1", "0 */5 * * * *");
		add("gps.sync:t1", "0 */10 * * * *");
		Assertions.assertEquals(2, queue.getRepeatableJobs().size());
	}

	@Test
	void removeRepeatableByKey() {
		final var job = add("gps.sync:t1", "0 */5 * * * *");
		Assertions.assertTrue(queue.removeRepeatableByKey(job.getKey()));
		Assertions.assertTrue(queue.getRepeatableJobs().isEmpty());
		Assertions.assertFalse(queue.removeRepeatableByKey(job.getKey()));
	}

	@Test
	void removeDelayed() throws SchedulerException {
		add("gps.sync:t1", "0 */5 * * * *");
		for (final var jobId : List.of("gps.sync:t1", "gps.sync:t1", "gps.sync:t2")) {
			scheduler.scheduleJob(TriggerBuilder.newTrigger()
					.withIdentity(UUID.randomUUID().toString(), "gps-queue-retry").forJob(JobKey.jobKey("gps.sync", "gps-queue")).usingJobData(QuartzWorkQueue.JOB_ID, jobId)
					.startAt(Date.from(Instant.now().plus(Duration.ofHours(1)))).build());
		}
		Assertions.assertEquals(3, queue.getCounts().getDelayed());

		Assertions.assertEquals(2, queue.removeDelayed("gps.sync:t1"::equals));
		Assertions.assertEquals(0, queue.removeDelayed("gps.sync:t1"::equals));
		Assertions.assertEquals(1, queue.getCounts().getDelayed());

		// The repeatable job is kept
		Assertions.assertEquals(1, queue.getRepeatableJobs().size());
	}

	@Test
	void getCounts() {
		add("gps.sync:t1", "0 */5 * * * *");
		final var counts = queue.getCounts();
		Assertions.assertEquals(0, counts.getWaiting());
		Assertions.assertEquals(0, counts.getActive());
		Assertions.assertEquals(0, counts.getCompleted());
		Assertions.assertEquals(0, counts.getFailed());
		Assertions.assertEquals(0, counts.getDelayed());
	}

	@Test
	void getName() {
		Assertions.assertEquals("gps-queue", queue.getName());
	}

	@Test
	void shutdownScheduler() throws SchedulerException {
		scheduler.shutdown();
		Assertions.assertThrows(BackendUnavailableException.class, () -> add("gps.sync:t1", "0 */5 * * * *"));
		Assertions.assertThrows(BackendUnavailableException.class, () -> queue.getRepeatableJobs());
	}

	private void fire(final int attempts) throws SchedulerException {
		add("gps.sync:t1", "0 */5 * * * *");
		final var data = new JobDataMap();
		data.put(QuartzWorkQueue.JOB_ID, "gps.sync:t1");
		data.put(QuartzWorkQueue.TENANT_ID, "t1");
		data.put(QuartzWorkQueue.ATTEMPTS, attempts);
		data.put(QuartzWorkQueue.BACKOFF, 0L);
		data.put(QuartzWorkQueue.REMOVE_ON_COMPLETE, 10);
		data.put(QuartzWorkQueue.REMOVE_ON_FAIL, 50);
		scheduler.start();
		scheduler.triggerJob(JobKey.jobKey("gps.sync", "gps-queue"), data);
	}

	@Test
	void executeCompleted() throws Exception {
		fire(3);
		Awaitility.await().atMost(10, TimeUnit.SECONDS).until(() -> queue.getCounts().getCompleted() == 1);
		final var captor = ArgumentCaptor.forClass(TenantContext.class);
		Mockito.verify(processor).process(captor.capture(), ArgumentMatchers.anyMap());
		Assertions.assertEquals("t1", captor.getValue().getTenantId());
		Assertions.assertEquals("America/Bogota", captor.getValue().getTimezone());

		final var run = queue.getHistory().getCompleted().get(0);
		Assertions.assertEquals("gps.sync:t1", run.getJobId());
		Assertions.assertEquals("gps.sync", run.getName());
		Assertions.assertEquals(1, run.getAttemptsMade());
		Assertions.assertNull(run.getFailedReason());
	}

	@Test
	void executeFailedWithRetries() throws Exception {
		Mockito.doThrow(new IllegalStateException("provider down")).when(processor)
				.process(ArgumentMatchers.any(), ArgumentMatchers.anyMap());
		fire(2);
		Awaitility.await().atMost(10, TimeUnit.SECONDS).until(() -> queue.getCounts().getFailed() == 1);
		Mockito.verify(processor, Mockito.times(2)).process(ArgumentMatchers.any(), ArgumentMatchers.anyMap());

		final var run = queue.getHistory().getFailed().get(0);
		Assertions.assertEquals(2, run.getAttemptsMade());
		Assertions.assertEquals("provider down", run.getFailedReason());
		Assertions.assertEquals(0, queue.getCounts().getCompleted());
	}
}
