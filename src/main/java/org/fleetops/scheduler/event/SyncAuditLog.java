/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import lombok.Getter;

/**
 * In-memory trace of the job synchronizations of each tenant. Only the most recent errors are kept.
 */
public class SyncAuditLog {

	/**
	 * Maximal amount of kept errors per tenant.
	 */
	public static final int MAX_ERRORS = 10;

	private final Clock clock;

	private final Map<String, TenantAudit> audits = new ConcurrentHashMap<>();

	/**
	 * Constructor.
	 *
	 * @param clock The clock stamping the entries.
	 */
	public SyncAuditLog(final Clock clock) {
		this.clock = clock;
	}

	/**
	 * Synchronization trace of one tenant.
	 */
	@Getter
	public static class TenantAudit {

		private Instant lastAttempt;

		private Instant lastSuccess;

		private final LinkedList<String> errors = new LinkedList<>();

		/**
		 * Return a copy of the recent errors, most recent first.
		 *
		 * @return The recent errors.
		 */
		public synchronized List<String> getErrors() {
			return new ArrayList<>(errors);
		}
	}

	/**
	 * Record a synchronization attempt.
	 *
	 * @param tenantId The tenant identifier.
	 */
	public void attempt(final String tenantId) {
		final var audit = audits.computeIfAbsent(tenantId, k -> new TenantAudit());
		synchronized (audit) {
			audit.lastAttempt = clock.instant();
		}
	}

	/**
	 * Record a successful synchronization.
	 *
	 * @param tenantId The tenant identifier.
	 */
	public void success(final String tenantId) {
		final var audit = audits.computeIfAbsent(tenantId, k -> new TenantAudit());
		synchronized (audit) {
			audit.lastSuccess = clock.instant();
		}
	}

	/**
	 * Record a failed synchronization.
	 *
	 * @param tenantId The tenant identifier.
	 * @param message  The failure message.
	 */
	public void failure(final String tenantId, final String message) {
		final var audit = audits.computeIfAbsent(tenantId, k -> new TenantAudit());
		synchronized (audit) {
			audit.errors.addFirst(clock.instant() + " " + message);
			while (audit.errors.size() > MAX_ERRORS) {
				audit.errors.removeLast();
			}
		}
	}

	/**
	 * Return the trace of a tenant. Reading does not record anything.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The trace, empty when nothing has been recorded.
	 */
	public TenantAudit get(final String tenantId) {
		final var audit = audits.get(tenantId);
		return audit == null ? new TenantAudit() : audit;
	}

	/**
	 * Forget the trace of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 */
	public void remove(final String tenantId) {
		audits.remove(tenantId);
	}

	/**
	 * Return the amount of traced tenants.
	 *
	 * @return The amount of traced tenants.
	 */
	public int size() {
		return audits.size();
	}
}
