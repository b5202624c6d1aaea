/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.schedule;

import org.fleetops.scheduler.config.TenantCronConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Test class of {@link JobKeys}
 */
class JobKeysTest {

	@Test
	void getTenant() {
		Assertions.assertEquals("11111111-1111-1111-1111-111111111111",
				JobKeys.getTenant("gps.sync:11111111-1111-1111-1111-111111111111"));
	}

	@Test
	void getTenantUnknown() {
		Assertions.assertEquals("unknown", JobKeys.getTenant("legacy-job"));
		Assertions.assertEquals("unknown", JobKeys.getTenant("gps.sync:"));
		Assertions.assertEquals("unknown", JobKeys.getTenant(null));
	}

	@Test
	void parse() {
		Assertions.assertArrayEquals(new Object[2], JobKeys.parse("any"));
	}

	@Test
	void format() {
		final var config = TenantCronConfig.builder().tenantId("t1").jobType("gps.sync").build();
		Assertions.assertEquals("gps.sync:t1", JobKeys.format(config));
	}
}
