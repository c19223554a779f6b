package com.codeheadsystems.jwtdown.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by every failing endpoint.
 *
 * @param detail human-readable, deliberately generic message
 */
public record ErrorResponse(@JsonProperty("detail") String detail) {
}
