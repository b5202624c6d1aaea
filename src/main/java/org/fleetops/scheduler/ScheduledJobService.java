/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.fleetops.scheduler.config.GpsProviderConfig;
import org.fleetops.scheduler.config.InvalidScheduleConfigException;
import org.fleetops.scheduler.config.TenantConfigResolver;
import org.fleetops.scheduler.config.TenantCronConfig;
import org.fleetops.scheduler.event.BulkSyncEvent;
import org.fleetops.scheduler.event.ConfigChangeEvent;
import org.fleetops.scheduler.event.ConfigChangeListener;
import org.fleetops.scheduler.event.EventBus;
import org.fleetops.scheduler.event.SyncStatus;
import org.fleetops.scheduler.event.Topic;
import org.fleetops.scheduler.model.SettingScope;
import org.fleetops.scheduler.model.TenantSetting;
import org.fleetops.scheduler.queue.RepeatableJob;
import org.fleetops.scheduler.schedule.JobKeys;
import org.fleetops.scheduler.schedule.JobRegistry;
import org.fleetops.scheduler.schedule.QueueStats;
import org.fleetops.scheduler.tenant.SettingsStore;
import org.fleetops.scheduler.tenant.TenantDirectory;
import org.fleetops.scheduler.tenant.TenantNotFoundException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The scheduling service: configuration resolution, repeatable jobs and tenant settings administration. Errors are
 * propagated to the caller.
 */
@Slf4j
@RequiredArgsConstructor
public class ScheduledJobService {

	private final TenantConfigResolver resolver;

	private final JobRegistry registry;

	private final ConfigChangeListener listener;

	private final SettingsStore settings;

	private final TenantDirectory directory;

	private final EventBus bus;

	/**
	 * Resolve the effective configuration of a job type.
	 *
	 * @param tenantId The tenant identifier.
	 * @param jobType  The job type.
	 * @param userId   Optional user identifier.
	 * @return The validated configuration.
	 */
	public TenantCronConfig resolveCronConfig(final String tenantId, final String jobType, final String userId) {
		return resolver.resolve(tenantId, jobType, userId);
	}

	/**
	 * Resolve the GPS provider configuration of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The provider configuration.
	 */
	public GpsProviderConfig resolveProviderConfig(final String tenantId) {
		return resolver.resolveProviderConfig(tenantId);
	}

	/**
	 * Create, replace or remove the repeatable job of a configuration.
	 *
	 * @param config The configuration.
	 * @return The registered job, or <code>null</code> when the configuration is disabled.
	 */
	public RepeatableJob upsertCronJob(final TenantCronConfig config) {
		return registry.upsert(config);
	}

	/**
	 * Remove the repeatable job of a job type of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @param jobType  The job type.
	 * @return The amount of removed registrations.
	 */
	public int removeCronJob(final String tenantId, final String jobType) {
		return registry.remove(TenantCronConfig.builder().tenantId(tenantId).jobType(jobType).build());
	}

	/**
	 * Return the repeatable jobs of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The jobs of the tenant.
	 */
	public List<ScheduledJobVo> getTenantJobs(final String tenantId) {
		return toVo(registry.listForTenant(tenantId));
	}

	/**
	 * Return all repeatable jobs.
	 *
	 * @return All jobs.
	 */
	public List<ScheduledJobVo> getAllJobs() {
		return toVo(registry.findAll());
	}

	/**
	 * Return the work queue counters.
	 *
	 * @return The counters.
	 */
	public QueueStats getQueueStats() {
		return registry.stats();
	}

	/**
	 * Remove all repeatable jobs of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The amount of removed jobs.
	 */
	public int clearTenantJobs(final String tenantId) {
		return registry.clearTenantJobs(tenantId);
	}

	/**
	 * Resolve and register now the jobs of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @param userId   Optional user identifier.
	 */
	public void triggerTenantJobUpdate(final String tenantId, final String userId) {
		listener.triggerTenantJobUpdate(tenantId, userId);
	}

	/**
	 * Return the synchronization status of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @return The synchronization status.
	 */
	public SyncStatus getTenantSyncStatus(final String tenantId) {
		return listener.getTenantSyncStatus(tenantId);
	}

	/**
	 * Request the asynchronous synchronization of several tenants. All tenants must exist.
	 *
	 * @param tenantIds The tenant identifiers.
	 * @return The amount of requested tenants.
	 * @throws TenantNotFoundException When one of the tenants does not exist.
	 */
	public int triggerBulkSync(final List<String> tenantIds) {
		if (tenantIds == null || tenantIds.isEmpty()) {
			throw new IllegalArgumentException("At least one tenant is required");
		}
		tenantIds.stream().filter(id -> directory.findById(id).isEmpty()).findFirst().ifPresent(id -> {
			throw new TenantNotFoundException(id);
		});
		log.info("Bulk synchronization requested for {} tenant(s)", tenantIds.size());
		bus.publish(Topic.BULK_SYNC, new BulkSyncEvent(List.copyOf(tenantIds)));
		return tenantIds.size();
	}

	/**
	 * Return the health of the scheduler. A work queue failure makes the scheduler unhealthy.
	 *
	 * @return The health.
	 */
	public SchedulerHealth getHealth() {
		final var health = new SchedulerHealth();
		try {
			health.setStats(registry.stats());
			health.setTenantsWithJobs((int) registry.findAll().stream().map(j -> JobKeys.getTenant(j.getId()))
					.filter(t -> !JobKeys.UNKNOWN_TENANT.equals(t)).distinct().count());
			health.setStatus(SchedulerHealth.HEALTHY);
		} catch (final RuntimeException e) {
			log.error("Scheduler health check failed", e);
			health.setStatus(SchedulerHealth.UNHEALTHY);
			health.setError(e.getMessage());
		}
		return health;
	}

	/**
	 * Return the settings of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @param scope    Optional scope filter.
	 * @param userId   Optional user filter.
	 * @return The settings.
	 */
	public List<TenantSetting> getTenantConfigs(final String tenantId, final SettingScope scope,
			final String userId) {
		directory.findEnabled(tenantId);
		return settings.listAll(tenantId, scope, userId);
	}

	/**
	 * Return a setting of a tenant.
	 *
	 * @param tenantId The tenant identifier.
	 * @param key      The setting key.
	 * @param scope    The setting scope.
	 * @param userId   The user, only for user scope.
	 * @return The setting, or empty.
	 */
	public Optional<TenantSetting> getTenantConfig(final String tenantId, final String key, final SettingScope scope,
			final String userId) {
		directory.findEnabled(tenantId);
		return settings.get(tenantId, key, scope, userId);
	}

	/**
	 * Create or replace a setting of a tenant. A schedule setting is validated before it is saved. The jobs of the
	 * tenant are then updated asynchronously.
	 *
	 * @param tenantId    The tenant identifier.
	 * @param key         The setting key.
	 * @param value       The new value.
	 * @param scope       The setting scope.
	 * @param userId      The user, only for user scope.
	 * @param description Optional description.
	 * @return The saved setting.
	 * @throws InvalidScheduleConfigException When the value carries an invalid schedule.
	 */
	public TenantSetting updateTenantConfig(final String tenantId, final String key, final Map<String, Object> value,
			final SettingScope scope, final String userId, final String description) {
		directory.findEnabled(tenantId);
		resolver.checkSetting(tenantId, key, value);
		final var saved = settings.upsert(tenantId, key, value, scope, userId, description);
		bus.publish(Topic.CONFIG_CHANGED, new ConfigChangeEvent(tenantId, key, userId));
		return saved;
	}

	/**
	 * Create or replace several settings of a tenant. Each entry is saved on its own: a rejected entry is logged and
	 * does not stop the others. A change event is published for each saved entry.
	 *
	 * @param tenantId The tenant identifier.
	 * @param updates  The settings to save.
	 * @return The amount of saved settings.
	 * @throws TenantNotFoundException When the tenant is unknown or disabled.
	 */
	public int bulkUpdateTenantConfigs(final String tenantId, final List<TenantConfigUpdate> updates) {
		directory.findEnabled(tenantId);
		var updated = 0;
		for (final var update : updates) {
			try {
				updateTenantConfig(tenantId, update.getKey(), update.getValue(), update.getEffectiveScope(),
						update.getUserId(), update.getDescription());
				updated++;
			} catch (final RuntimeException e) {
				log.error("Failed to update the setting {} of tenant {}: {}", update.getKey(), tenantId,
						e.getMessage());
			}
		}
		log.info("Bulk update of tenant {}: {}/{} setting(s) saved", tenantId, updated, updates.size());
		return updated;
	}

	/**
	 * Delete a setting of a tenant. The jobs of the tenant are then updated asynchronously.
	 *
	 * @param tenantId The tenant identifier.
	 * @param key      The setting key.
	 * @param scope    The setting scope.
	 * @param userId   The user, only for user scope.
	 * @return <code>true</code> when the setting has been deleted.
	 */
	public boolean deleteTenantConfig(final String tenantId, final String key, final SettingScope scope,
			final String userId) {
		directory.findEnabled(tenantId);
		final var deleted = settings.delete(tenantId, key, scope, userId);
		if (deleted) {
			bus.publish(Topic.CONFIG_CHANGED, new ConfigChangeEvent(tenantId, key, userId));
		}
		return deleted;
	}

	private List<ScheduledJobVo> toVo(final List<RepeatableJob> jobs) {
		return jobs.stream().map(job -> {
			// Copy basic attributes
			final var vo = new ScheduledJobVo();
			vo.setId(job.getId());
			vo.setTenantId(JobKeys.getTenant(job.getId()));
			vo.setJobType(job.getName());
			vo.setCron(job.getPattern());
			vo.setTimezone(job.getTimezone());
			vo.setKey(job.getKey());
			vo.setNext(job.getNextRunTime());
			return vo;
		}).collect(Collectors.toList());
	}
}
