/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.model;

import java.util.Map;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.data.jpa.domain.AbstractPersistable;

/**
 * One layered override record. Uniqueness is on tenant, key, scope and owner key, the owner key being the user or an
 * empty string for the tenant scoped settings.
 */
@Getter
@Setter
@Entity
@Table(name = "FLEET_TENANT_SETTING", uniqueConstraints = @UniqueConstraint(columnNames = { "tenant_id",
		"setting_key", "scope", "owner_key" }))
public class TenantSetting extends AbstractPersistable<Integer> {

	/**
	 * The owner tenant.
	 */
	@NotNull
	@Column(name = "tenant_id", length = 36)
	private String tenantId;

	/**
	 * Dotted namespace, such as <code>gps.sync</code> or <code>gps.provider</code>.
	 */
	@NotNull
	@Column(name = "setting_key")
	private String key;

	/**
	 * The structured value, stored as JSON.
	 */
	@NotNull
	@Convert(converter = JsonMapConverter.class)
	@Column(name = "setting_value", length = 4000)
	private Map<String, Object> value;

	@NotNull
	@Enumerated(EnumType.STRING)
	@Column(length = 20)
	private SettingScope scope = SettingScope.TENANT;

	/**
	 * The user owning this override. Only when scope is {@link SettingScope#USER}.
	 */
	@Column(name = "user_id", length = 36)
	private String userId;

	/**
	 * Never <code>null</code> copy of {@link #userId}, a <code>null</code> column being distinct from any other.
	 */
	@NotNull
	@Setter(AccessLevel.NONE)
	@Column(name = "owner_key", length = 36)
	private String ownerKey = "";

	@Column(length = 1000)
	private String description;

	/**
	 * Return the owner key of a setting.
	 *
	 * @param userId The user identifier. May be <code>null</code>.
	 * @return The user identifier, or an empty string.
	 */
	public static String toOwnerKey(final String userId) {
		return StringUtils.defaultString(userId);
	}

	/**
	 * Set the user owning this override, and the matching owner key.
	 *
	 * @param userId The user identifier. May be <code>null</code>.
	 */
	public void setUserId(final String userId) {
		this.userId = userId;
		this.ownerKey = toOwnerKey(userId);
	}

}
