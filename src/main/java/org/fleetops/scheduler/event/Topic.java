/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import lombok.Value;

/**
 * A named topic carrying one type of events.
 *
 * @param <E> The event type.
 */
@Value
public class Topic<E> {

	String name;

	Class<E> type;

	/**
	 * Configuration of a tenant has changed.
	 */
	public static final Topic<ConfigChangeEvent> CONFIG_CHANGED = new Topic<>("tenant.config.changed",
			ConfigChangeEvent.class);

	/**
	 * A tenant has been enabled or disabled.
	 */
	public static final Topic<StatusChangeEvent> STATUS_CHANGED = new Topic<>("tenant.status.changed",
			StatusChangeEvent.class);

	/**
	 * Synchronization of several tenants is requested.
	 */
	public static final Topic<BulkSyncEvent> BULK_SYNC = new Topic<>("tenant.bulk.sync", BulkSyncEvent.class);
}
