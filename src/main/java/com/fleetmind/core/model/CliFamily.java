package com.fleetmind.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The interactive program a worker drives. Determines which in-band control commands it
 * understands and which prompt lines mean "ready for input".
 */
public enum CliFamily {
    CLAUDE("claude", "/clear",
            List.of(Pattern.compile("^(❯|›)\\s*$")),
            List.of("claude", "opus", "sonnet", "haiku")),
    CODEX("codex", "/new",
            List.of(Pattern.compile("(\\? for shortcuts|context left)")),
            List.of("codex", "spark", "gpt", "o3", "o4"));

    private final String wireName;
    private final String resetCommand;
    private final List<Pattern> idlePrompts;
    private final List<String> modelHints;

    CliFamily(String wireName, String resetCommand, List<Pattern> idlePrompts, List<String> modelHints) {
        this.wireName = wireName;
        this.resetCommand = resetCommand;
        this.idlePrompts = idlePrompts;
        this.modelHints = modelHints;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String resetCommand() {
        return resetCommand;
    }

    public List<Pattern> idlePrompts() {
        return idlePrompts;
    }

    public String modelSwitchCommand(String modelId) {
        return "/model " + modelId;
    }

    @JsonCreator
    public static CliFamily fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CLAUDE;
        }
        for (CliFamily family : values()) {
            if (family.wireName.equalsIgnoreCase(raw.trim()) || family.name().equalsIgnoreCase(raw.trim())) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown CLI family: " + raw);
    }

    /**
     * Guesses the family that serves a model id, e.g. "opus" or "claude-sonnet-4" map to CLAUDE.
     */
    public static Optional<CliFamily> fromModel(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return Optional.empty();
        }
        String normalized = modelId.toLowerCase(Locale.ROOT);
        for (CliFamily family : values()) {
            for (String hint : family.modelHints) {
                if (normalized.contains(hint)) {
                    return Optional.of(family);
                }
            }
        }
        return Optional.empty();
    }
}
