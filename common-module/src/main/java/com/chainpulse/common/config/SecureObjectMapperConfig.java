package com.chainpulse.common.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Application-wide ObjectMapper. No polymorphic typing, big decimals kept exact so that
 * cached payloads survive a read/write cycle without float drift.
 */
@Configuration
public class SecureObjectMapperConfig {
	
	@Bean
	@Primary
	public ObjectMapper objectMapper() {
		return create();
	}
	
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		
		mapper.registerModule(new JavaTimeModule());
		mapper.deactivateDefaultTyping();
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		
		// unknown request fields are tolerated, malformed ones are not
		mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
		mapper.configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, true);
		mapper.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
		mapper.configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);
		
		mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
		mapper.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
		
		return mapper;
	}
}
