/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tenant scheduler application.
 */
@SpringBootApplication
public class TenantSchedulerApplication {

	/**
	 * Application entry point.
	 *
	 * @param args Command line arguments.
	 */
	public static void main(final String[] args) {
		SpringApplication.run(TenantSchedulerApplication.class, args);
	}
}
