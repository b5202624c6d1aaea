/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Scheduler settings, bound from <code>fleet.scheduler.*</code>.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "fleet.scheduler")
public class SchedulerProperties {

	/**
	 * Work queue name, also the Quartz group of the repeatable jobs.
	 */
	private String queueName = "gps-queue";

	/**
	 * Maximal duration of a work queue call.
	 */
	private Duration backendTimeout = Duration.ofSeconds(10);

	/**
	 * Minimal duration between two runs of a schedule.
	 */
	private Duration minimumInterval = Duration.ofSeconds(60);

	/**
	 * Maximal attempts of a run.
	 */
	private int attempts = 3;

	/**
	 * Initial delay before a retry.
	 */
	private Duration backoffDelay = Duration.ofSeconds(5);

	/**
	 * Retained completed runs.
	 */
	private int removeOnComplete = 10;

	/**
	 * Retained failed runs.
	 */
	private int removeOnFail = 50;

	/**
	 * Threads delivering the events.
	 */
	private int eventPoolSize = 4;
}
