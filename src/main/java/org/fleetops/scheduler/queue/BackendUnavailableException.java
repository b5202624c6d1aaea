/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.queue;

/**
 * The work queue backend cannot be reached or did not answer in time.
 */
public class BackendUnavailableException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Constructor with the root cause.
	 *
	 * @param message The failed operation.
	 * @param cause   The root cause.
	 */
	public BackendUnavailableException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
