/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.config;

import java.util.Map;
import java.util.Set;

/**
 * Hard coded base layers of the configuration: defaults per job type, then overrides per plan.
 */
public final class ScheduleDefaults {

	/**
	 * GPS synchronization job type.
	 */
	public static final String GPS_SYNC = "gps.sync";

	/**
	 * GPS provider setting key.
	 */
	public static final String GPS_PROVIDER = "gps.provider";

	/**
	 * GPS credentials setting key.
	 */
	public static final String GPS_CREDENTIALS = "gps.credentials";

	/**
	 * CRON attribute of a schedule layer.
	 */
	public static final String CRON = "cron";

	/**
	 * Timezone attribute of a schedule layer.
	 */
	public static final String TIMEZONE = "timezone";

	/**
	 * Enabled flag attribute of a schedule layer.
	 */
	public static final String ENABLED = "isEnabled";

	private static final Map<String, Map<String, Object>> DEFAULTS = Map.of(GPS_SYNC,
			Map.of(CRON, "0 */30 * * * *", TIMEZONE, "UTC", ENABLED, true));

	private static final Map<String, Map<String, Map<String, Object>>> PLANS = Map.of(
			"premium", Map.of(GPS_SYNC, Map.of(CRON, "0 */15 * * * *")),
			"enterprise", Map.of(GPS_SYNC, Map.of(CRON, "0 */5 * * * *")));

	private ScheduleDefaults() {
		// Utility class
	}

	/**
	 * Return the job types having defaults.
	 *
	 * @return The known job types.
	 */
	public static Set<String> getJobTypes() {
		return DEFAULTS.keySet();
	}

	/**
	 * Return the default layer of a job type.
	 *
	 * @param jobType The job type.
	 * @return The default layer, or <code>null</code> for an unknown job type.
	 */
	public static Map<String, Object> getDefaults(final String jobType) {
		return DEFAULTS.get(jobType);
	}

	/**
	 * Return the plan override layer of a job type.
	 *
	 * @param planType The plan identifier. May be <code>null</code>.
	 * @param jobType  The job type.
	 * @return The plan layer, or <code>null</code>.
	 */
	public static Map<String, Object> getPlan(final String planType, final String jobType) {
		if (planType == null || !PLANS.containsKey(planType)) {
			return null;
		}
		return PLANS.get(planType).get(jobType);
	}
}
