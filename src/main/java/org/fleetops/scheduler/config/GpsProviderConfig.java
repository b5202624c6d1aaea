/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.config;

import lombok.Value;

/**
 * GPS provider configuration of a tenant.
 */
@Value
public class GpsProviderConfig {

	String tenantId;

	/**
	 * Provider identifier, such as <code>providerA</code>.
	 */
	String provider;

	String baseUrl;

	/**
	 * Reference of the API key in the secret store, never the key itself.
	 */
	String apiKeySecretRef;

	boolean enabled;
}
