package ru.aritmos.studioavailability.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Jackson {@link ObjectMapper} для разбора JSON-ответов источников.
 * <p>
 * Ответы API сервиса сериализуются Micronaut Serde; этот бин используется только коннекторами.
 */
@Factory
public class JsonConfig {

    @Singleton
    public ObjectMapper sourceObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
