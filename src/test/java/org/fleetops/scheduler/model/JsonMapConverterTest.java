/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.model;

import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Test class of {@link JsonMapConverter}
 */
class JsonMapConverterTest {

	private final JsonMapConverter converter = new JsonMapConverter();

	@Test
	void convertToDatabaseColumn() {
		Assertions.assertEquals("{\"cron\":\"0 */5 * * * *\"}",
				converter.convertToDatabaseColumn(Map.of("cron", "0 */5 * * * *")));
	}

	@Test
	void convertToEntityAttribute() {
		final var value = converter.convertToEntityAttribute("{\"cron\":\"0 */5 * * * *\",\"isEnabled\":false}");
		Assertions.assertEquals("0 */5 * * * *", value.get("cron"));
		Assertions.assertEquals(Boolean.FALSE, value.get("isEnabled"));
	}

	@Test
	void convertNull() {
		Assertions.assertNull(converter.convertToDatabaseColumn(null));
		Assertions.assertNull(converter.convertToEntityAttribute(null));
	}

	@Test
	void convertToEntityAttributeInvalid() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> converter.convertToEntityAttribute("{cron"));
	}
}
