/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.event;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.fleetops.scheduler.config.TenantConfigResolver;
import org.fleetops.scheduler.schedule.JobRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keep the repeatable jobs up to date with the tenant events: configuration changes, status changes and bulk
 * synchronization requests.
 */
@Slf4j
@RequiredArgsConstructor
public class ConfigChangeListener {

	/**
	 * A setting key containing one of these fragments may change a schedule.
	 */
	private static final List<String> SCHEDULE_KEYS = List.of("gps.sync", "cron", "schedule", "timezone",
			"gps.provider");

	private final TenantConfigResolver resolver;

	private final JobRegistry registry;

	private final SyncAuditLog audit;

	/**
	 * Subscribe this listener to the tenant topics.
	 *
	 * @param bus The event bus.
	 */
	public void register(final EventBus bus) {
		bus.subscribe(Topic.CONFIG_CHANGED, this::onConfigChanged);
		bus.subscribe(Topic.STATUS_CHANGED, this::onStatusChanged);
		bus.subscribe(Topic.BULK_SYNC, this::onBulkSync);
	}

	/**
	 * Update the jobs of the tenant when the changed setting may change a schedule.
	 *
	 * @param event The change event.
	 */
	public void onConfigChanged(final ConfigChangeEvent event) {
		if (!isScheduleKey(event.getConfigKey())) {
			log.debug("Setting {} of tenant {} does not affect the schedules", event.getConfigKey(),
					event.getTenantId());
			return;
		}
		log.info("Setting {} of tenant {} changed, update the jobs", event.getConfigKey(), event.getTenantId());
		try {
			updateTenantJobs(event.getTenantId(), event.getUserId());
		} catch (final RuntimeException e) {
			log.error("Unable to update the jobs of tenant {} after the change of {}", event.getTenantId(),
					event.getConfigKey(), e);
		}
	}

	/**
	 * Register the jobs of an enabled tenant, remove the jobs of a disabled one.
	 *
	 * @param event The status event.
	 */
	public void onStatusChanged(final StatusChangeEvent event) {
		try {
			if (event.isEnabled()) {
				log.info("Tenant {} enabled, register the jobs", event.getTenantId());
				updateTenantJobs(event.getTenantId(), null);
			} else {
				log.info("Tenant {} disabled, remove the jobs", event.getTenantId());
				registry.clearTenantJobs(event.getTenantId());
				audit.remove(event.getTenantId());
			}
		} catch (final RuntimeException e) {
			log.error("Unable to apply the status {} to the jobs of tenant {}", event.isEnabled(),
					event.getTenantId(), e);
		}
	}

	/**
	 * Update sequentially the jobs of the given tenants. A failing tenant does not stop the others.
	 *
	 * @param event The bulk event.
	 */
	public void onBulkSync(final BulkSyncEvent event) {
		if (event.getTenantIds() == null || event.getTenantIds().isEmpty()) {
			log.warn("Bulk synchronization of all tenants is not supported, provide the tenant identifiers");
			return;
		}
		var failures = 0;
		for (final var tenantId : event.getTenantIds()) {
			try {
				updateTenantJobs(tenantId, null);
			} catch (final RuntimeException e) {
				failures++;
				log.error("Bulk synchronization failed for tenant {}", tenantId, e);
			}
		}
		log.info("Bulk synchronization of {} tenant(s) done, {} failure(s)", event.getTenantIds().size(), failures);
	}

	/**
	 * Resolve and register the jobs of a tenant now.
	 *
	 * @param tenantId The tenant identifier.
	 * @param userId   Optional user whose settings override the tenant ones.
	 */
	public void triggerTenantJobUpdate(final String tenantId, final String userId) {
		log.info("Manual job update of tenant {}", tenantId);
		updateTenantJobs(tenantId, userId);
	}

	/**
	 * Return the synchronization status of a tenant. A work queue failure is reported in the status.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The synchronization status.
	 */
	public SyncStatus getTenantSyncStatus(final String tenantId) {
		final var trace = audit.get(tenantId);
		try {
			final var jobs = registry.listForTenant(tenantId);
			return new SyncStatus(tenantId, !jobs.isEmpty(), jobs.size(), trace.getLastAttempt(),
					trace.getLastSuccess(), trace.getErrors());
		} catch (final RuntimeException e) {
			log.error("Unable to get the synchronization status of tenant {}", tenantId, e);
			final var errors = trace.getErrors();
			errors.add(0, e.getMessage());
			return new SyncStatus(tenantId, false, 0, trace.getLastAttempt(), trace.getLastSuccess(), errors);
		}
	}

	private void updateTenantJobs(final String tenantId, final String userId) {
		audit.attempt(tenantId);
		try {
			for (final var jobType : resolver.getJobTypes()) {
				registry.upsert(resolver.resolve(tenantId, jobType, userId));
			}
			audit.success(tenantId);
		} catch (final RuntimeException e) {
			audit.failure(tenantId, e.getMessage());
			throw e;
		}
	}

	private boolean isScheduleKey(final String key) {
		return key != null && SCHEDULE_KEYS.stream().anyMatch(k -> StringUtils.contains(key, k));
	}
}
