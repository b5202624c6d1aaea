/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import java.util.Optional;

import org.fleetops.scheduler.dao.TenantRepository;
import org.fleetops.scheduler.model.Tenant;
import org.springframework.transaction.annotation.Transactional;

import lombok.RequiredArgsConstructor;

/**
 * {@link TenantDirectory} backed by the {@link TenantRepository}.
 */
@RequiredArgsConstructor
public class JpaTenantDirectory implements TenantDirectory {

	private final TenantRepository repository;

	@Override
	@Transactional(readOnly = true)
	public Optional<Tenant> findById(final String tenantId) {
		if (tenantId == null) {
			return Optional.empty();
		}
		return repository.findById(tenantId);
	}
}
