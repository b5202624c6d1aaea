/*
 * Licensed under MIT (https://github.com/ligoj/ligoj/blob/master/LICENSE)
 */
package org.fleetops.scheduler.model;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA converter storing a JSON object as text.
 */
@Converter
public class JsonMapConverter implements AttributeConverter<Map<String, Object>, String> {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
		// Nothing to override
	};

	@Override
	public String convertToDatabaseColumn(final Map<String, Object> attribute) {
		if (attribute == null) {
			return null;
		}
		try {
			return MAPPER.writeValueAsString(attribute);
		} catch (final JsonProcessingException e) {
			throw new IllegalArgumentException("Unable to serialize the setting value", e);
		}
	}

	@Override
	public Map<String, Object> convertToEntityAttribute(final String dbData) {
		if (dbData == null) {
			return null;
		}
		try {
			return MAPPER.readValue(dbData, MAP_TYPE);
		} catch (final JsonProcessingException e) {
			throw new IllegalArgumentException("Unable to read the setting value", e);
		}
	}
}
