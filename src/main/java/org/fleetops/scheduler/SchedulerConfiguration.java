/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler;

import java.time.Clock;
import java.util.stream.Collectors;

import org.fleetops.scheduler.config.CronConfigValidator;
import org.fleetops.scheduler.config.TenantConfigResolver;
import org.fleetops.scheduler.dao.TenantRepository;
import org.fleetops.scheduler.dao.TenantSettingRepository;
import org.fleetops.scheduler.event.AsyncEventBus;
import org.fleetops.scheduler.event.ConfigChangeListener;
import org.fleetops.scheduler.event.EventBus;
import org.fleetops.scheduler.event.SyncAuditLog;
import org.fleetops.scheduler.queue.JobProcessor;
import org.fleetops.scheduler.queue.QuartzWorkQueue;
import org.fleetops.scheduler.queue.TenantJobDispatcher;
import org.fleetops.scheduler.queue.WorkQueue;
import org.fleetops.scheduler.schedule.JobPolicy;
import org.fleetops.scheduler.schedule.JobRegistry;
import org.fleetops.scheduler.tenant.JpaSettingsStore;
import org.fleetops.scheduler.tenant.JpaTenantDirectory;
import org.fleetops.scheduler.tenant.SettingsStore;
import org.fleetops.scheduler.tenant.TenantContextProvider;
import org.fleetops.scheduler.tenant.TenantDirectory;
import org.quartz.Scheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wiring of the scheduler components.
 */
@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	@Bean
	public TenantDirectory tenantDirectory(final TenantRepository repository) {
		return new JpaTenantDirectory(repository);
	}

	@Bean
	public SettingsStore settingsStore(final TenantSettingRepository repository) {
		return new JpaSettingsStore(repository);
	}

	@Bean
	public TenantContextProvider tenantContextProvider(final TenantDirectory directory) {
		return new TenantContextProvider(directory);
	}

	@Bean
	public CronConfigValidator cronConfigValidator(final SchedulerProperties properties, final Clock clock) {
		return new CronConfigValidator(properties.getMinimumInterval(), clock);
	}

	@Bean
	public TenantConfigResolver tenantConfigResolver(final TenantDirectory directory, final SettingsStore settings,
			final CronConfigValidator validator) {
		return new TenantConfigResolver(directory, settings, validator);
	}

	@Bean
	public TenantJobDispatcher tenantJobDispatcher(final TenantContextProvider contextProvider,
			final ObjectProvider<JobProcessor> processors) {
		return new TenantJobDispatcher(contextProvider, processors.orderedStream().collect(Collectors.toList()));
	}

	@Bean
	public WorkQueue workQueue(final SchedulerProperties properties, final Scheduler scheduler,
			final TenantJobDispatcher dispatcher, final Clock clock) {
		return new QuartzWorkQueue(properties.getQueueName(), scheduler, dispatcher, clock);
	}

	/**
	 * Executor of the work queue calls, allowing them to be bounded by a timeout. A call blocked beyond its timeout
	 * keeps its thread, so all threads are available before queuing.
	 *
	 * @return The executor.
	 */
	@Bean
	public ThreadPoolTaskExecutor backendExecutor() {
		final var executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(8);
		executor.setMaxPoolSize(8);
		executor.setAllowCoreThreadTimeOut(true);
		executor.setThreadNamePrefix("queue-backend-");
		return executor;
	}

	@Bean
	public ThreadPoolTaskExecutor eventExecutor(final SchedulerProperties properties) {
		final var executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(properties.getEventPoolSize());
		executor.setMaxPoolSize(properties.getEventPoolSize());
		executor.setQueueCapacity(1000);
		executor.setThreadNamePrefix("tenant-event-");
		executor.setWaitForTasksToCompleteOnShutdown(true);
		return executor;
	}

	@Bean
	public JobRegistry jobRegistry(final SchedulerProperties properties, final WorkQueue queue,
			final CronConfigValidator validator, @Qualifier("backendExecutor") final ThreadPoolTaskExecutor executor) {
		final var policy = new JobPolicy(properties.getAttempts(), properties.getBackoffDelay(),
				properties.getRemoveOnComplete(), properties.getRemoveOnFail());
		return new JobRegistry(queue, validator, policy, executor, properties.getBackendTimeout());
	}

	@Bean
	public EventBus eventBus(@Qualifier("eventExecutor") final ThreadPoolTaskExecutor executor) {
		return new AsyncEventBus(executor);
	}

	@Bean
	public SyncAuditLog syncAuditLog(final Clock clock) {
		return new SyncAuditLog(clock);
	}

	/**
	 * The listener is subscribed to the tenant topics as soon as it is created.
	 *
	 * @param resolver The configuration resolver.
	 * @param registry The job registry.
	 * @param audit    The synchronization trace.
	 * @param bus      The event bus.
	 * @return The subscribed listener.
	 */
	@Bean
	public ConfigChangeListener configChangeListener(final TenantConfigResolver resolver, final JobRegistry registry,
			final SyncAuditLog audit, final EventBus bus) {
		final var listener = new ConfigChangeListener(resolver, registry, audit);
		listener.register(bus);
		return listener;
	}

	@Bean
	public ScheduledJobService scheduledJobService(final TenantConfigResolver resolver, final JobRegistry registry,
			final ConfigChangeListener listener, final SettingsStore settings, final TenantDirectory directory,
			final EventBus bus) {
		return new ScheduledJobService(resolver, registry, listener, settings, directory, bus);
	}
}
