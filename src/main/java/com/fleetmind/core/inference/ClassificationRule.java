package com.fleetmind.core.inference;

import com.fleetmind.core.model.WorkerActivity;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One row of the classification table: if any tail line satisfies {@code matcher},
 * the worker is classified as {@code outcome}.
 *
 * @param name    short label used in debug logs
 * @param matcher predicate applied to each tail line
 * @param outcome activity reported on match
 */
public record ClassificationRule(String name, Predicate<String> matcher, WorkerActivity outcome) {

    public boolean matchesAny(List<String> lines) {
        for (String line : lines) {
            if (matcher.test(line)) {
                return true;
            }
        }
        return false;
    }

    public static ClassificationRule pattern(String name, Pattern pattern, WorkerActivity outcome) {
        return new ClassificationRule(name, line -> pattern.matcher(line).find(), outcome);
    }

    public static ClassificationRule containsIgnoreCase(String name, String needle, WorkerActivity outcome) {
        String lowered = needle.toLowerCase(Locale.ROOT);
        return new ClassificationRule(name,
                line -> line.toLowerCase(Locale.ROOT).contains(lowered), outcome);
    }
}
