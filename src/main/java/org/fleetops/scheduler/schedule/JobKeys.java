/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.schedule;

import java.text.MessageFormat;
import java.text.ParseException;
import java.text.ParsePosition;

import org.apache.commons.lang3.StringUtils;
import org.fleetops.scheduler.config.TenantCronConfig;

/**
 * Logical job key utilities. The key of a job is made of its type and its tenant. Format is "JOBTYPE:TENANT".
 */
public final class JobKeys {

	/**
	 * Tenant of the keys that cannot be decoded.
	 */
	public static final String UNKNOWN_TENANT = "unknown";

	private static final String KEY_PARSER = "{0}:{1}";

	private JobKeys() {
		// Utility class
	}

	/**
	 * Build and return the logical job key of a configuration.
	 *
	 * @param config The tenant configuration.
	 * @return the {@link String} key for the job.
	 */
	public static String format(final TenantCronConfig config) {
		return format(config.getJobType(), config.getTenantId());
	}

	/**
	 * Build and return the logical job key of a job type and a tenant.
	 *
	 * @param jobType  The job type.
	 * @param tenantId The tenant identifier.
	 * @return the {@link String} key for the job.
	 */
	public static String format(final String jobType, final String tenantId) {
		return jobType + ":" + tenantId;
	}

	/**
	 * Extract the tenant identifier from a job key.
	 *
	 * @param key The job key. May be <code>null</code>.
	 * @return The tenant identifier, or {@value #UNKNOWN_TENANT} when the key cannot be decoded.
	 */
	public static String getTenant(final String key) {
		final var tenant = key == null ? null : (String) parse(key)[1];
		return StringUtils.defaultIfBlank(tenant, UNKNOWN_TENANT);
	}

	/**
	 * Parses text from the beginning of the given string to produce an object array.
	 * <p>
	 * See the {@link MessageFormat#parse(String, ParsePosition)} method for more information on message parsing.
	 *
	 * @param source A <code>String</code> whose beginning should be parsed.
	 * @return An <code>Object</code> array parsed from the string. ParseException is caught to return an 2 sized array
	 *         object.
	 */
	static Object[] parse(final String source) {
		try {
			return new MessageFormat(KEY_PARSER).parse(source);
		} catch (@SuppressWarnings("unused") final ParseException e) {
			// Ignore the parse error
			return new Object[2];
		}
	}
}
