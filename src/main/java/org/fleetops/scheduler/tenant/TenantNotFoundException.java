/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import lombok.Getter;

/**
 * The referenced tenant does not exist or is disabled. Never retried internally.
 */
@Getter
public class TenantNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String tenantId;

	/**
	 * Constructor with the missing tenant.
	 *
	 * @param tenantId The tenant identifier.
	 */
	public TenantNotFoundException(final String tenantId) {
		super("Tenant " + tenantId + " not found or disabled");
		this.tenantId = tenantId;
	}
}
