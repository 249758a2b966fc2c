package com.products.scraper.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Loads a `.env` file from the application root and adds its entries
 * as a high-priority property source so that
 * `${PROXY_SERVER}` and `${TWO_CAPTCHA_API_KEY}` resolve correctly.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    /** highest precedence so .env entries override everything else */
    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment env,
                                       SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .filename(".env")
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));

        if (map.isEmpty()) {
            return;
        }
        env.getPropertySources()
                .addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, map));
    }
}
