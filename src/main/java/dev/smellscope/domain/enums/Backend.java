package dev.smellscope.domain.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Detector backends the gateway fans out to. The wire id is used in
 * request options, response status maps and log lines.
 */
public enum Backend {
    STATIC("static"), AI("ai");

    private final String id;
    Backend(String id) { this.id = id; }

    public String id() {
        return id;
    }

    public static Optional<Backend> fromId(String id) {
        if (id == null) return Optional.empty();
        String trimmed = id.trim();
        return Arrays.stream(values())
                .filter(b -> b.id.equalsIgnoreCase(trimmed) || b.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
