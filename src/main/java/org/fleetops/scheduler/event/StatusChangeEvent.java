/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import lombok.Value;

/**
 * A tenant has been enabled or disabled.
 */
@Value
public class StatusChangeEvent {

	String tenantId;

	boolean enabled;
}
