/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.fleetops.scheduler.model.SettingScope;
import org.fleetops.scheduler.model.TenantSetting;

/**
 * Tenant scoped, hierarchically keyed store of settings. A user identifier is given if and only if the scope is
 * {@link SettingScope#USER}.
 */
public interface SettingsStore {

	/**
	 * Return the setting matching exactly the given coordinates.
	 *
	 * @param tenantId The owner tenant.
	 * @param key      The setting key.
	 * @param scope    The setting scope.
	 * @param userId   The user, only for {@link SettingScope#USER} scope.
	 * @return The setting, or empty.
	 */
	Optional<TenantSetting> get(String tenantId, String key, SettingScope scope, String userId);

	/**
	 * Create or replace the value of a setting.
	 *
	 * @param tenantId    The owner tenant.
	 * @param key         The setting key.
	 * @param value       The new value.
	 * @param scope       The setting scope.
	 * @param userId      The user, only for {@link SettingScope#USER} scope.
	 * @param description Optional description. When <code>null</code>, the current description is kept.
	 * @return The saved setting.
	 */
	TenantSetting upsert(String tenantId, String key, Map<String, Object> value, SettingScope scope, String userId,
			String description);

	/**
	 * Delete a setting.
	 *
	 * @param tenantId The owner tenant.
	 * @param key      The setting key.
	 * @param scope    The setting scope.
	 * @param userId   The user, only for {@link SettingScope#USER} scope.
	 * @return <code>true</code> when a setting has been deleted.
	 */
	boolean delete(String tenantId, String key, SettingScope scope, String userId);

	/**
	 * Return the settings of a tenant, ordered by key.
	 *
	 * @param tenantId The owner tenant.
	 * @param scope    Optional scope filter.
	 * @param userId   Optional user filter.
	 * @return The matching settings.
	 */
	List<TenantSetting> listAll(String tenantId, SettingScope scope, String userId);
}
