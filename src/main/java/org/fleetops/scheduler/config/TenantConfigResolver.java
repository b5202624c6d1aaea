/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.fleetops.scheduler.model.SettingScope;
import org.fleetops.scheduler.model.TenantSetting;
import org.fleetops.scheduler.tenant.SettingsStore;
import org.fleetops.scheduler.tenant.TenantDirectory;
import org.fleetops.scheduler.tenant.TenantNotFoundException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolve the effective configuration of a tenant by merging, later wins:
 * <ol>
 * <li>the defaults of the job type</li>
 * <li>the plan override</li>
 * <li>the timezone of the tenant record</li>
 * <li>the tenant scoped setting of the job type</li>
 * <li>the user scoped setting of the job type, when a user is given</li>
 * </ol>
 * Merge is shallow, and absent or <code>null</code> attributes fall through. No side effect.
 */
@Slf4j
@RequiredArgsConstructor
public class TenantConfigResolver {

	private static final String DEFAULT_PROVIDER = "providerA";

	private static final String DEFAULT_BASE_URL = "https://api.default-provider.com";

	private final TenantDirectory directory;

	private final SettingsStore settings;

	private final CronConfigValidator validator;

	/**
	 * Resolve the effective configuration of the default job type.
	 *
	 * @param tenantId The tenant identifier.
	 * @param userId   Optional user identifier.
	 * @return The validated configuration.
	 * @see #resolve(String, String, String)
	 */
	public TenantCronConfig resolve(final String tenantId, final String userId) {
		return resolve(tenantId, ScheduleDefaults.GPS_SYNC, userId);
	}

	/**
	 * Resolve the effective configuration of a job type.
	 *
	 * @param tenantId The tenant identifier.
	 * @param jobType  The job type.
	 * @param userId   Optional user identifier.
	 * @return The validated configuration.
	 * @throws TenantNotFoundException        When the tenant is unknown or disabled.
	 * @throws InvalidScheduleConfigException When the job type is unknown or the merged configuration is invalid.
	 */
	public TenantCronConfig resolve(final String tenantId, final String jobType, final String userId) {
		final var tenant = directory.findEnabled(tenantId);
		final var defaults = ScheduleDefaults.getDefaults(jobType);
		if (defaults == null) {
			throw new InvalidScheduleConfigException("No default configuration for job type " + jobType);
		}

		final var merged = new HashMap<String, Object>();
		merge(merged, defaults);
		merge(merged, ScheduleDefaults.getPlan(tenant.getPlanType(), jobType));
		merge(merged, tenant.getTimezone() == null ? null : Map.of(ScheduleDefaults.TIMEZONE, tenant.getTimezone()));
		merge(merged, getValue(tenantId, jobType, SettingScope.TENANT, null));
		if (userId != null) {
			merge(merged, getValue(tenantId, jobType, SettingScope.USER, userId));
		}
		log.debug("Merged configuration of {} for tenant {}: {}", jobType, tenantId, merged);

		return validator.validate(toConfig(tenantId, jobType, merged));
	}

	/**
	 * Validate a schedule setting before it is saved. Settings not attached to a job type are not checked.
	 *
	 * @param tenantId The tenant identifier.
	 * @param key      The setting key.
	 * @param value    The new value.
	 * @throws InvalidScheduleConfigException When the value carries an invalid schedule.
	 */
	public void checkSetting(final String tenantId, final String key, final Map<String, Object> value) {
		if (value == null || !ScheduleDefaults.getJobTypes().contains(key)) {
			return;
		}
		final var merged = new HashMap<String, Object>();
		merge(merged, ScheduleDefaults.getDefaults(key));
		merge(merged, value);
		if (value.get(ScheduleDefaults.CRON) != null || value.get(ScheduleDefaults.TIMEZONE) != null) {
			validator.validate(toConfig(tenantId, key, merged));
		}
	}

	/**
	 * Resolve the GPS provider configuration of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The provider configuration, with defaults for the missing attributes.
	 * @throws TenantNotFoundException When the tenant is unknown or disabled.
	 */
	public GpsProviderConfig resolveProviderConfig(final String tenantId) {
		directory.findEnabled(tenantId);
		final var provider = ObjectUtils.defaultIfNull(
				getValue(tenantId, ScheduleDefaults.GPS_PROVIDER, SettingScope.TENANT, null), Map.<String, Object>of());
		final var credentials = ObjectUtils.defaultIfNull(
				getValue(tenantId, ScheduleDefaults.GPS_CREDENTIALS, SettingScope.TENANT, null),
				Map.<String, Object>of());
		return new GpsProviderConfig(tenantId, getString(provider, "provider", DEFAULT_PROVIDER),
				getString(provider, "baseUrl", DEFAULT_BASE_URL),
				getString(credentials, "apiKeySecretRef", "secret:gps:" + tenantId),
				toBoolean(provider.get("enabled"), true));
	}

	/**
	 * Return the job types having a default configuration.
	 *
	 * @return The known job types.
	 */
	public Set<String> getJobTypes() {
		return ScheduleDefaults.getJobTypes();
	}

	private Map<String, Object> getValue(final String tenantId, final String key, final SettingScope scope,
			final String userId) {
		return settings.get(tenantId, key, scope, userId).map(TenantSetting::getValue).orElse(null);
	}

	private TenantCronConfig toConfig(final String tenantId, final String jobType, final Map<String, Object> merged) {
		return TenantCronConfig.builder().tenantId(tenantId).jobType(jobType)
				.cron(CronPatterns.normalize(getString(merged, ScheduleDefaults.CRON, null)))
				.timezone(getString(merged, ScheduleDefaults.TIMEZONE, null))
				.enabled(toBoolean(merged.get(ScheduleDefaults.ENABLED), true)).build();
	}

	private static void merge(final Map<String, Object> target, final Map<String, Object> layer) {
		if (layer != null) {
			layer.forEach((k, v) -> {
				if (v != null) {
					target.put(k, v);
				}
			});
		}
	}

	private static String getString(final Map<String, Object> map, final String key, final String defaultValue) {
		final var value = map.get(key);
		return value == null ? defaultValue : value.toString();
	}

	private static boolean toBoolean(final Object value, final boolean defaultValue) {
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		if (value instanceof Number) {
			return ((Number) value).intValue() != 0;
		}
		return value == null ? defaultValue : BooleanUtils.toBoolean(value.toString());
	}
}
