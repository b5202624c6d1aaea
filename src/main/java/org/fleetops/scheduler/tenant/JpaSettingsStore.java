/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import org.fleetops.scheduler.dao.TenantSettingRepository;
import org.fleetops.scheduler.model.SettingScope;
import org.fleetops.scheduler.model.TenantSetting;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link SettingsStore} backed by the {@link TenantSettingRepository}.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaSettingsStore implements SettingsStore {

	private final TenantSettingRepository repository;

	@Override
	@Transactional(readOnly = true)
	public Optional<TenantSetting> get(final String tenantId, final String key, final SettingScope scope,
			final String userId) {
		checkScope(scope, userId);
		return find(tenantId, key, scope, userId);
	}

	private Optional<TenantSetting> find(final String tenantId, final String key, final SettingScope scope,
			final String userId) {
		return repository.findByTenantIdAndKeyAndScopeAndOwnerKey(tenantId, key, scope,
				TenantSetting.toOwnerKey(userId));
	}

	/**
	 * {@inheritDoc} Not transactional: an insert conflicting with a concurrent one is replayed as an update.
	 */
	@Override
	public TenantSetting upsert(final String tenantId, final String key, final Map<String, Object> value,
			final SettingScope scope, final String userId, final String description) {
		checkScope(scope, userId);
		try {
			return save(tenantId, key, value, scope, userId, description);
		} catch (final DataIntegrityViolationException e) {
			log.info("Setting {}/{} of tenant {} created concurrently, update it", scope, key, tenantId);
			return save(tenantId, key, value, scope, userId, description);
		}
	}

	private TenantSetting save(final String tenantId, final String key, final Map<String, Object> value,
			final SettingScope scope, final String userId, final String description) {
		final var entity = find(tenantId, key, scope, userId).orElseGet(() -> {
			final var setting = new TenantSetting();
			setting.setTenantId(tenantId);
			setting.setKey(key);
			setting.setScope(scope);
			setting.setUserId(userId);
			return setting;
		});
		entity.setValue(value);
		if (description != null) {
			entity.setDescription(description);
		}
		log.info("Save setting {}/{} of tenant {}{}", scope, key, tenantId, userId == null ? "" : ", user " + userId);
		return repository.saveAndFlush(entity);
	}

	@Override
	@Transactional
	public boolean delete(final String tenantId, final String key, final SettingScope scope, final String userId) {
		checkScope(scope, userId);
		final var entity = find(tenantId, key, scope, userId);
		entity.ifPresent(repository::delete);
		return entity.isPresent();
	}

	@Override
	@Transactional(readOnly = true)
	public List<TenantSetting> listAll(final String tenantId, final SettingScope scope, final String userId) {
		return repository.findAllByTenant(tenantId).stream().filter(s -> scope == null || s.getScope() == scope)
				.filter(s -> userId == null || Objects.equals(userId, s.getUserId())).collect(Collectors.toList());
	}

	private void checkScope(final SettingScope scope, final String userId) {
		if (scope == SettingScope.USER && userId == null) {
			throw new IllegalArgumentException("A user scoped setting requires a user");
		}
		if (scope == SettingScope.TENANT && userId != null) {
			throw new IllegalArgumentException("A tenant scoped setting cannot be attached to a user");
		}
	}
}
