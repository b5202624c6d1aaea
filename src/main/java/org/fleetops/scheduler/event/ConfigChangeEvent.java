/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import lombok.Value;

/**
 * A setting of a tenant has been created, updated or deleted.
 */
@Value
public class ConfigChangeEvent {

	String tenantId;

	/**
	 * The changed setting key.
	 */
	String configKey;

	/**
	 * The user of a user scoped setting, otherwise <code>null</code>.
	 */
	String userId;
}
