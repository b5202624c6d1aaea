/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import java.util.List;

import lombok.Value;

/**
 * Synchronization request of the jobs of several tenants.
 */
@Value
public class BulkSyncEvent {

	/**
	 * Tenants to synchronize. When <code>null</code> or empty, nothing is done.
	 */
	List<String> tenantIds;
}
