package com.products.scraper.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.products.scraper.admission.AdmissionGate;
import com.products.scraper.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Consults the {@link AdmissionGate} before any scrape runs and answers 429
 * when the caller has used up its window. Registered for {@code /api/**} by
 * {@link com.products.scraper.config.WebMvcConfiguration}.
 */
@RequiredArgsConstructor
public class AdmissionInterceptor implements HandlerInterceptor {

    private final AdmissionGate gate;

    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(final HttpServletRequest request,
                             final HttpServletResponse response,
                             final Object handler) throws IOException {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        if (gate.admit(request.getRemoteAddr()).isAllowed()) {
            return true;
        }

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), ErrorResponse.of(
                "Too many requests", null, "Please wait and try again later"));
        return false;
    }
}
