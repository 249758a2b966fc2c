package com.products.scraper.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error payload returned for every non-2xx answer.
 *
 * @param error    short headline
 * @param details  one-line cause, never a stack trace
 * @param solution hint for the caller
 * @param example  example of a valid request, for input errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String details,
        String solution,
        String example
) {

    public static ErrorResponse of(final String error, final String details, final String solution) {
        return new ErrorResponse(error, details, solution, null);
    }
}
