package my.paymentplanner.app.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import my.paymentplanner.app.model.PlanConfiguration;

/**
 * Stores the configuration a version was calculated with as a JSON text column.
 */
@Converter
public class PlanConfigurationConverter implements AttributeConverter<PlanConfiguration, String> {
	private final ObjectMapper objectMapper;

	public PlanConfigurationConverter() {
		this(JsonMapper.builder()
				.addModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
				.build());
	}

	public PlanConfigurationConverter(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public String convertToDatabaseColumn(PlanConfiguration attribute) {
		if (attribute == null) {
			return null;
		}
		try {
			return objectMapper.writeValueAsString(attribute);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Could not serialize plan configuration", e);
		}
	}

	@Override
	public PlanConfiguration convertToEntityAttribute(String dbData) {
		if (dbData == null || dbData.isBlank()) {
			return null;
		}
		try {
			return objectMapper.readValue(dbData, PlanConfiguration.class);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Could not deserialize plan configuration", e);
		}
	}
}
