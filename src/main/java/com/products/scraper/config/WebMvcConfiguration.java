package com.products.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.admission.AdmissionGate;
import com.products.scraper.controller.AdmissionInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the admission check and the cross-origin policy for the API.
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfiguration implements WebMvcConfigurer {

    private final AdmissionGate admissionGate;

    private final ObjectMapper objectMapper;

    private final ScraperProperties props;

    @Override
    public void addInterceptors(final InterceptorRegistry registry) {
        registry.addInterceptor(new AdmissionInterceptor(admissionGate, objectMapper)).addPathPatterns("/api/**");
    }

    @Override
    public void addCorsMappings(final CorsRegistry registry) {
        if (props.getCors().getAllowedOrigins().isEmpty()) {
            return;
        }
        registry.addMapping("/api/**")
                .allowedOrigins(props.getCors().getAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "OPTIONS")
                .allowedHeaders("Content-Type")
                .allowCredentials(true);
    }
}
