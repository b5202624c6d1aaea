/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.dao;

import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.fleetops.scheduler.model.SettingScope;
import org.fleetops.scheduler.model.TenantSetting;
import org.fleetops.scheduler.tenant.SettingsStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Test class of {@link TenantSettingRepository}
 */
@SpringBootTest
class TenantSettingRepositoryTest {

	@Autowired
	private TenantSettingRepository repository;

	@Autowired
	private SettingsStore store;

	private String tenantId;

	@BeforeEach
	void prepareData() {
		tenantId = UUID.randomUUID().toString();
	}

	private TenantSetting newSetting(final SettingScope scope, final String userId) {
		final var setting = new TenantSetting();
		setting.setTenantId(tenantId);
		setting.setKey("gps.sync");
		setting.setScope(scope);
		setting.setUserId(userId);
		setting.setValue(Map.of("cron", "0 */10 * * * *"));
		return setting;
	}

	@Test
	void saveDuplicateTenantSetting() {
		repository.saveAndFlush(newSetting(SettingScope.TENANT, null));
		Assertions.assertThrows(DataIntegrityViolationException.class,
				() -> repository.saveAndFlush(newSetting(SettingScope.TENANT, null)));
		Assertions.assertEquals(1, repository.findAllByTenant(tenantId).size());
		Assertions.assertTrue(repository
				.findByTenantIdAndKeyAndScopeAndOwnerKey(tenantId, "gps.sync", SettingScope.TENANT, "").isPresent());
	}

	@Test
	void saveDuplicateUserSetting() {
		repository.saveAndFlush(newSetting(SettingScope.USER, "u1"));
		Assertions.assertThrows(DataIntegrityViolationException.class,
				() -> repository.saveAndFlush(newSetting(SettingScope.USER, "u1")));
	}

	@Test
	void saveSameKeyOtherOwners() {
		repository.saveAndFlush(newSetting(SettingScope.TENANT, null));
		repository.saveAndFlush(newSetting(SettingScope.USER, "u1"));
		repository.saveAndFlush(newSetting(SettingScope.USER, "u2"));
		Assertions.assertEquals(3, repository.findAllByTenant(tenantId).size());
		Assertions.assertEquals("u2", repository
				.findByTenantIdAndKeyAndScopeAndOwnerKey(tenantId, "gps.sync", SettingScope.USER, "u2").orElseThrow()
				.getUserId());
	}

	@Test
	void upsertConcurrently() throws InterruptedException, ExecutionException {
		final var threads = 8;
		final var executor = Executors.newFixedThreadPool(threads);
		final var start = new CountDownLatch(1);
		try {
			final var results = new ArrayList<Future<TenantSetting>>();
			for (var i = 0; i < threads; i++) {
				final var cron = "0 */" + (10 + i) + " * * * *";
				final Callable<TenantSetting> upsert = () -> {
					start.await();
					return store.upsert(tenantId, "gps.sync", Map.of("cron", cron), SettingScope.TENANT, null, null);
				};
				results.add(executor.submit(upsert));
			}
			start.countDown();
			for (final var result : results) {
				Assertions.assertNotNull(result.get());
			}
		} finally {
			executor.shutdown();
			executor.awaitTermination(10, TimeUnit.SECONDS);
		}

		// A single row, still readable
		Assertions.assertEquals(1, repository.findAllByTenant(tenantId).size());
		Assertions.assertTrue(store.get(tenantId, "gps.sync", SettingScope.TENANT, null).isPresent());
	}
}
