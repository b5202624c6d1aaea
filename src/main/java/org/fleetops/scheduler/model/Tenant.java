/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * A tenant, an isolated customer account owning its own settings and schedules. Only the attributes the scheduling
 * core reads are mapped here, the tenant life-cycle is managed elsewhere.
 */
@Getter
@Setter
@Entity
@Table(name = "FLEET_TENANT")
public class Tenant {

	/**
	 * Tenant identifier, an UUID string.
	 */
	@Id
	@Column(length = 36)
	private String id;

	@NotNull
	private String name;

	@NotNull
	@Column(unique = true, length = 100)
	private String subdomain;

	/**
	 * IANA zone name used by all the schedules of this tenant.
	 */
	@NotNull
	@Column(length = 50)
	private String timezone = "UTC";

	/**
	 * Optional plan identifier, such as <code>premium</code> or <code>enterprise</code>.
	 */
	@Column(length = 50)
	private String planType;

	@Column(length = 50)
	private String region;

	private boolean enabled = true;

}
