package com.questrail.fleet.protocol.vda5050.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of a state message's {@code errors} array.
 *
 * @param errorType   vendor or standard error type, e.g. {@code orderError}
 * @param level       severity
 * @param description free text; may be empty
 * @param references  {@code referenceKey -> referenceValue} pairs
 */
public record AgvError(String errorType, ErrorLevel level, String description, Map<String, String> references) {
    public AgvError {
        Objects.requireNonNull(errorType, "errorType");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(description, "description");
        references = Map.copyOf(Objects.requireNonNull(references, "references"));
    }

    public Optional<String> reference(String key) {
        return Optional.ofNullable(references.get(key));
    }
}
