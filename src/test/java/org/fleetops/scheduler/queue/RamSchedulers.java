/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

import java.util.Properties;
import java.util.UUID;

import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.quartz.simpl.RAMJobStore;

/**
 * Isolated in-memory Quartz schedulers for tests.
 */
public final class RamSchedulers {

	private RamSchedulers() {
		// Utility class
	}

	/**
	 * Return a new scheduler, not started, with its own name and memory store.
	 *
	 * @return A new scheduler.
	 * @throws SchedulerException When the scheduler cannot be created.
	 */
	public static Scheduler newScheduler() throws SchedulerException {
		final var properties = new Properties();
		properties.setProperty(StdSchedulerFactory.PROP_SCHED_INSTANCE_NAME, "test-" + UUID.randomUUID());
		properties.setProperty(StdSchedulerFactory.PROP_JOB_STORE_CLASS, RAMJobStore.class.getName());
		properties.setProperty("org.quartz.threadPool.threadCount", "2");
		properties.setProperty("org.quartz.scheduler.skipUpdateCheck", "true");
		return new StdSchedulerFactory(properties).getScheduler();
	}
}
