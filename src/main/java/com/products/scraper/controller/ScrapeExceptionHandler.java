package com.products.scraper.controller;

import com.products.scraper.dto.ErrorResponse;
import com.products.scraper.exception.ErrorKind;
import com.products.scraper.exception.NoResultsException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/**
 * Turns every failure into the public error payload. Internal failure kinds
 * are collapsed into a short detail string; nothing else leaks.
 */
@Slf4j
@RestControllerAdvice
public class ScrapeExceptionHandler {

    static final String KEYWORD_REQUIRED = "Valid keyword parameter is required";

    static final String EXAMPLE = "/api/scrape?keyword=laptop";

    static final String CAPTCHA_DETECTED = "CAPTCHA detected";

    private static final int MAX_DETAIL_LENGTH = 200;

    @ExceptionHandler({
            HandlerMethodValidationException.class,
            ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> onInvalidInput(final Exception ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(KEYWORD_REQUIRED, null, null, EXAMPLE));
    }

    @ExceptionHandler(NoResultsException.class)
    public ResponseEntity<ErrorResponse> onNoResults(final NoResultsException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(
                        "No products found",
                        describe(ex.getCauseKind(), ex.getMessage()),
                        "Target site may be blocking requests - try again later"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> onUnexpected(final Exception ex) {
        log.error("Scraping error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(
                        "Scraping failed",
                        "Unexpected server error",
                        "Use proxies or try again later"));
    }

    static String describe(final ErrorKind kind, final String message) {
        if (kind == ErrorKind.CHALLENGE
                || (kind == ErrorKind.BLOCKED && StringUtils.containsIgnoreCase(message, "captcha"))) {
            return CAPTCHA_DETECTED;
        }
        return StringUtils.abbreviate(StringUtils.defaultIfBlank(message, "Try different keywords"),
                MAX_DETAIL_LENGTH);
    }
}
