/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import lombok.RequiredArgsConstructor;

/**
 * Build a fresh {@link TenantContext} for each unit of work.
 */
@RequiredArgsConstructor
public class TenantContextProvider {

	private final TenantDirectory directory;

	/**
	 * Return a new context for the given enabled tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @return A new context, owned by the caller.
	 * @throws TenantNotFoundException When the tenant is unknown or disabled.
	 */
	public TenantContext getTenantContext(final String tenantId) {
		return TenantContext.of(directory.findEnabled(tenantId));
	}
}
