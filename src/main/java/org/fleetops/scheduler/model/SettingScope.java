/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.model;

/**
 * Scope of a {@link TenantSetting} override.
 */
public enum SettingScope {

	/**
	 * The override applies to the whole tenant.
	 */
	TENANT,

	/**
	 * The override applies to one user of the tenant only. The setting then carries a user identifier.
	 */
	USER
}
