/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.config;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

import lombok.Getter;

/**
 * Validate a {@link TenantCronConfig}: CRON syntax, timezone, schedulability and minimum interval between two runs.
 */
public class CronConfigValidator {

	/**
	 * The minimal accepted duration between two successive runs.
	 */
	@Getter
	private final Duration minimumInterval;

	private final Clock clock;

	/**
	 * Constructor with the minimal interval.
	 *
	 * @param minimumInterval The minimal accepted duration between two successive runs.
	 * @param clock           The clock giving "now".
	 */
	public CronConfigValidator(final Duration minimumInterval, final Clock clock) {
		this.minimumInterval = minimumInterval;
		this.clock = clock;
	}

	/**
	 * Validate the given configuration.
	 *
	 * @param config The configuration to check.
	 * @return The same configuration.
	 * @throws InvalidScheduleConfigException When the configuration is rejected.
	 */
	public TenantCronConfig validate(final TenantCronConfig config) {
		checkRequired(config.getTenantId(), "Tenant ID is required");
		checkRequired(config.getJobType(), "Job type is required");
		checkRequired(config.getCron(), "Cron expression is required");
		checkRequired(config.getTimezone(), "Timezone is required");

		final var cron = config.getCron();
		if (!CronExpression.isValidExpression(cron)) {
			throw new InvalidScheduleConfigException("Invalid cron expression: " + cron);
		}
		final ZoneId zone;
		try {
			zone = ZoneId.of(config.getTimezone());
		} catch (final DateTimeException e) {
			throw new InvalidScheduleConfigException("Invalid timezone: " + config.getTimezone());
		}

		// Check the expression can be scheduled in this zone and by the work queue
		final var expression = CronExpression.parse(cron);
		final var first = expression.next(ZonedDateTime.now(clock).withZoneSameInstant(zone));
		final var second = first == null ? null : expression.next(first);
		if (second == null) {
			throw new InvalidScheduleConfigException(
					"Unable to schedule cron expression \"" + cron + "\" with timezone \"" + config.getTimezone() + "\"");
		}
		try {
			final var quartz = CronPatterns.toQuartz(cron);
			if (!org.quartz.CronExpression.isValidExpression(quartz)) {
				throw new IllegalArgumentException("Unsupported expression '" + quartz + "'");
			}
		} catch (final IllegalArgumentException e) {
			throw new InvalidScheduleConfigException("Unable to schedule cron expression \"" + cron
					+ "\" with timezone \"" + config.getTimezone() + "\": " + e.getMessage());
		}

		// Prevent too frequent executions
		if (Duration.between(first, second).compareTo(minimumInterval) < 0) {
			throw new InvalidScheduleConfigException(
					"Cron expression interval must be at least " + minimumInterval.toSeconds() + " seconds");
		}
		return config;
	}

	private void checkRequired(final String value, final String reason) {
		if (StringUtils.isBlank(value)) {
			throw new InvalidScheduleConfigException(reason);
		}
	}
}
