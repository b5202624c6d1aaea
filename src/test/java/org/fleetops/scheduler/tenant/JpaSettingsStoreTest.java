/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.fleetops.scheduler.dao.TenantSettingRepository;
import org.fleetops.scheduler.model.SettingScope;
import org.fleetops.scheduler.model.TenantSetting;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.AdditionalAnswers;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Test class of {@link JpaSettingsStore}
 */
class JpaSettingsStoreTest {

	private TenantSettingRepository repository;

	private JpaSettingsStore store;

	@BeforeEach
	void init() {
		repository = Mockito.mock(TenantSettingRepository.class);
		Mockito.when(repository.saveAndFlush(ArgumentMatchers.any())).then(AdditionalAnswers.returnsFirstArg());
		store = new JpaSettingsStore(repository);
	}

	private static TenantSetting newSetting(final String key, final SettingScope scope, final String user) {
		final var setting = new TenantSetting();
		setting.setTenantId("t1");
		setting.setKey(key);
		setting.setScope(scope);
		setting.setUserId(user);
		setting.setValue(Map.of("cron", "0 */10 * * * *"));
		setting.setDescription("Initial");
		return setting;
	}

	@Test
	void upsertCreate() {
		final var saved = store.upsert("t1", "gps.sync", Map.of("cron", "0 */5 * * * *"), SettingScope.TENANT, null,
				null);
		Assertions.assertEquals("t1", saved.getTenantId());
		Assertions.assertEquals("gps.sync", saved.getKey());
		Assertions.assertEquals(SettingScope.TENANT, saved.getScope());
		Assertions.assertNull(saved.getUserId());
		Assertions.assertEquals("0 */5 * * * *", saved.getValue().get("cron"));
		Mockito.verify(repository).saveAndFlush(saved);
	}

	@Test
	void upsertUpdate() {
		final var existing = newSetting("gps.sync", SettingScope.USER, "u1");
		Mockito.when(repository.findByTenantIdAndKeyAndScopeAndOwnerKey("t1", "gps.sync", SettingScope.USER, "u1"))
				.thenReturn(Optional.of(existing));
		final var saved = store.upsert("t1", "gps.sync", Map.of("cron", "0 0 * * * *"), SettingScope.USER, "u1",
				null);
		Assertions.assertSame(existing, saved);
		Assertions.assertEquals("0 0 * * * *", saved.getValue().get("cron"));

		// Description is kept
		Assertions.assertEquals("Initial", saved.getDescription());
	}

	@Test
	void upsertConcurrentlyCreated() {
		final var existing = newSetting("gps.sync", SettingScope.TENANT, null);
		Mockito.when(repository.findByTenantIdAndKeyAndScopeAndOwnerKey("t1", "gps.sync", SettingScope.TENANT, ""))
				.thenReturn(Optional.empty(), Optional.of(existing));
		Mockito.when(repository.saveAndFlush(ArgumentMatchers.any()))
				.thenThrow(new DataIntegrityViolationException("Duplicate setting"))
				.then(AdditionalAnswers.returnsFirstArg());

		// The conflicting insert is replayed as an update of the existing setting
		final var saved = store.upsert("t1", "gps.sync", Map.of("cron", "0 0 * * * *"), SettingScope.TENANT, null,
				null);
		Assertions.assertSame(existing, saved);
		Assertions.assertEquals("0 0 * * * *", saved.getValue().get("cron"));
		Mockito.verify(repository, Mockito.times(2)).saveAndFlush(ArgumentMatchers.any());
	}

	@Test
	void upsertUserScopeWithoutUser() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> store.upsert("t1", "gps.sync", Map.of(), SettingScope.USER, null, null));
		Mockito.verify(repository, Mockito.never()).saveAndFlush(ArgumentMatchers.any());
	}

	@Test
	void getTenantScopeWithUser() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> store.get("t1", "gps.sync", SettingScope.TENANT, "u1"));
	}

	@Test
	void delete() {
		final var existing = newSetting("gps.sync", SettingScope.TENANT, null);
		Mockito.when(repository.findByTenantIdAndKeyAndScopeAndOwnerKey("t1", "gps.sync", SettingScope.TENANT, ""))
				.thenReturn(Optional.of(existing));
		Assertions.assertTrue(store.delete("t1", "gps.sync", SettingScope.TENANT, null));
		Mockito.verify(repository).delete(existing);
	}

	@Test
	void deleteNotExists() {
		Assertions.assertFalse(store.delete("t1", "gps.sync", SettingScope.TENANT, null));
		Mockito.verify(repository, Mockito.never()).delete(ArgumentMatchers.any());
	}

	@Test
	void listAll() {
		Mockito.when(repository.findAllByTenant("t1")).thenReturn(List.of(newSetting("a", SettingScope.TENANT, null),
				newSetting("b", SettingScope.USER, "u1"), newSetting("c", SettingScope.USER, "u2")));
		Assertions.assertEquals(3, store.listAll("t1", null, null).size());
		Assertions.assertEquals(1, store.listAll("t1", SettingScope.TENANT, null).size());
		final var user = store.listAll("t1", SettingScope.USER, "u2");
		Assertions.assertEquals(1, user.size());
		Assertions.assertEquals("c", user.get(0).getKey());
	}
}
