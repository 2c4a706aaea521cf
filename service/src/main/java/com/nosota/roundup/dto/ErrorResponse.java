package com.nosota.roundup.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * Error body returned by the REST layer.
 *
 * @param status        HTTP status code
 * @param error         Short title
 * @param message       Detail the caller can act on
 * @param path          Request URI
 * @param timestamp     When the error was produced
 * @param daysRemaining Cooldown days left, only for charity switch rejections
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String error,
        String message,
        String path,
        LocalDateTime timestamp,
        Long daysRemaining
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path, LocalDateTime.now(), null);
    }

    public static ErrorResponse cooldown(int status, String message, String path, long daysRemaining) {
        return new ErrorResponse(status, "Cooldown Active", message, path, LocalDateTime.now(), daysRemaining);
    }
}
