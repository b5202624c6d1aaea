/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.dao;

import java.util.List;
import java.util.Optional;

import org.fleetops.scheduler.model.SettingScope;
import org.fleetops.scheduler.model.TenantSetting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

/**
 * {@link TenantSetting} repository.
 */
public interface TenantSettingRepository extends JpaRepository<TenantSetting, Integer> {

	/**
	 * Return the setting matching exactly the given tenant, key, scope and owner key.
	 *
	 * @param tenantId The owner tenant.
	 * @param key      The setting key.
	 * @param scope    The setting scope.
	 * @param ownerKey The owner key, see {@link TenantSetting#toOwnerKey(String)}.
	 * @return The matching setting.
	 */
	Optional<TenantSetting> findByTenantIdAndKeyAndScopeAndOwnerKey(String tenantId, String key, SettingScope scope,
			String ownerKey);

	/**
	 * Return all settings of the given tenant ordered by key.
	 *
	 * @param tenant The owner tenant.
	 * @return All settings of the given tenant.
	 */
	@Query("FROM TenantSetting s WHERE s.tenantId = :tenant ORDER BY s.key, s.scope")
	List<TenantSetting> findAllByTenant(String tenant);
}
