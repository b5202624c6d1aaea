/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler;

import java.util.Map;

import org.fleetops.scheduler.model.SettingScope;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One entry of a bulk settings update.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TenantConfigUpdate {

	private String key;

	private Map<String, Object> value;

	/**
	 * The setting scope. When <code>null</code>, the scope is deduced from the user.
	 */
	private SettingScope scope;

	private String userId;

	private String description;

	/**
	 * Return the scope of this entry.
	 *
	 * @return The explicit scope, or {@link SettingScope#USER} when there is a user, {@link SettingScope#TENANT}
	 *         otherwise.
	 */
	public SettingScope getEffectiveScope() {
		if (scope != null) {
			return scope;
		}
		return userId == null ? SettingScope.TENANT : SettingScope.USER;
	}
}
