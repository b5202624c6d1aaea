/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.tenant;

import java.util.Optional;

import org.fleetops.scheduler.model.Tenant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Test class of {@link TenantContextProvider}
 */
class TenantContextProviderTest {

	private static Tenant newTenant(final boolean enabled) {
		final var tenant = new Tenant();
		tenant.setId("t1");
		tenant.setName("Acme");
		tenant.setSubdomain("acme");
		tenant.setTimezone("Europe/Paris");
		tenant.setPlanType("premium");
		tenant.setRegion("eu-west");
		tenant.setEnabled(enabled);
		return tenant;
	}

	@Test
	void getTenantContext() {
		final var tenant = newTenant(true);
		final var context = new TenantContextProvider(id -> Optional.of(tenant)).getTenantContext("t1");
		Assertions.assertEquals("t1", context.getTenantId());
		Assertions.assertEquals("Europe/Paris", context.getTimezone());
		Assertions.assertEquals("premium", context.getPlanType());
		Assertions.assertEquals("eu-west", context.getRegion());
	}

	@Test
	void getTenantContextDisabled() {
		final var tenant = newTenant(false);
		final var provider = new TenantContextProvider(id -> Optional.of(tenant));
		final var e = Assertions.assertThrows(TenantNotFoundException.class, () -> provider.getTenantContext("t1"));
		Assertions.assertEquals("t1", e.getTenantId());
	}

	@Test
	void getTenantContextUnknown() {
		final var provider = new TenantContextProvider(id -> Optional.empty());
		Assertions.assertThrows(TenantNotFoundException.class, () -> provider.getTenantContext("any"));
	}
}
