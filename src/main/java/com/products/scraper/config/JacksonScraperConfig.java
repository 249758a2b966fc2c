package com.products.scraper.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonScraperConfig {

    /**
     * The application's {@link ObjectMapper}, qualified <b>scraperObjectMapper</b>
     * where it reads third-party payloads (the captcha provider answers JSON
     * with a {@code text/plain} content type, so bodies are read as strings
     * and parsed here). Being the only mapper bean, it also backs MVC.
     *
     * @return ObjectMapper for scraper
     */
    @Bean
    @Qualifier("scraperObjectMapper")
    public ObjectMapper scraperObjectMapper() {

        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return mapper;
    }

}
