/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import java.util.Optional;

import org.fleetops.scheduler.model.Tenant;

/**
 * Lookup of tenant records.
 */
public interface TenantDirectory {

	/**
	 * Return the tenant with the given identifier, enabled or not.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The tenant, or empty when unknown.
	 */
	Optional<Tenant> findById(String tenantId);

	/**
	 * Return the enabled tenant with the given identifier.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The enabled tenant.
	 * @throws TenantNotFoundException When the tenant is unknown or disabled.
	 */
	default Tenant findEnabled(final String tenantId) {
		return findById(tenantId).filter(Tenant::isEnabled).orElseThrow(() -> new TenantNotFoundException(tenantId));
	}
}
