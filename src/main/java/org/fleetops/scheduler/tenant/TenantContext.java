/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import org.fleetops.scheduler.model.Tenant;

import lombok.Value;

/**
 * Tenant identity of one unit of work: an inbound request or a job execution. Built at the start of the unit, passed
 * explicitly along the calls, and dropped at the end. Never shared across concurrent units.
 */
@Value
public class TenantContext {

	String tenantId;

	/**
	 * IANA zone name.
	 */
	String timezone;

	/**
	 * Optional plan identifier.
	 */
	String planType;

	/**
	 * Optional region.
	 */
	String region;

	/**
	 * Build the context of the given tenant.
	 *
	 * @param tenant The tenant record.
	 * @return The new context.
	 */
	public static TenantContext of(final Tenant tenant) {
		return new TenantContext(tenant.getId(), tenant.getTimezone(), tenant.getPlanType(), tenant.getRegion());
	}
}
