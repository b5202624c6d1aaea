/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.dao;

import org.fleetops.scheduler.model.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * {@link Tenant} repository.
 */
public interface TenantRepository extends JpaRepository<Tenant, String> {

	// All inherited
}
