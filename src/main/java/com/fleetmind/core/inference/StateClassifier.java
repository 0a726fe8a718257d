package com.fleetmind.core.inference;

import com.fleetmind.core.model.CliFamily;
import com.fleetmind.core.model.WorkerActivity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Classifies a worker as busy, idle or absent from the last few lines of its terminal output.
 *
 * <p>The rule table is evaluated top to bottom and the first matching rule wins. Idle-prompt
 * rules come before busy markers: a program can leave a stale busy phrase just above a fresh
 * prompt, and checking busy first would keep such a worker "busy" forever. When nothing
 * matches the worker is idle.
 *
 * <p>Only the bottom {@value #DEFAULT_TAIL_LINES} non-blank lines are considered; busy markers
 * linger in scroll-back long after the work ended.
 */
@Service
public class StateClassifier {

    private static final Logger log = LoggerFactory.getLogger(StateClassifier.class);

    public static final int DEFAULT_TAIL_LINES = 5;

    private static final Pattern BUSY_PHRASES = Pattern.compile(
            "(Working|Thinking|Planning|Sending|task is in progress|Compacting conversation|thought for"
                    + "|思考中|考え中|計画中|送信中|処理中|実行中)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final List<ClassificationRule> rules;
    private final int tailLines;

    @Autowired
    public StateClassifier() {
        this(defaultRules(), DEFAULT_TAIL_LINES);
    }

    public StateClassifier(List<ClassificationRule> rules, int tailLines) {
        if (tailLines < 1) {
            throw new IllegalArgumentException("tailLines must be positive: " + tailLines);
        }
        this.rules = List.copyOf(rules);
        this.tailLines = tailLines;
    }

    /**
     * Idle prompts of every known CLI family, then the busy markers.
     */
    public static List<ClassificationRule> defaultRules() {
        var rules = new ArrayList<ClassificationRule>();
        for (CliFamily family : CliFamily.values()) {
            for (Pattern prompt : family.idlePrompts()) {
                rules.add(ClassificationRule.pattern(family.wireName() + "-prompt", prompt, WorkerActivity.IDLE));
            }
        }
        rules.add(ClassificationRule.containsIgnoreCase("interrupt-hint", "esc to interrupt", WorkerActivity.BUSY));
        rules.add(ClassificationRule.containsIgnoreCase("background-terminal", "background terminal running",
                WorkerActivity.BUSY));
        rules.add(ClassificationRule.pattern("busy-phrase", BUSY_PHRASES, WorkerActivity.BUSY));
        return rules;
    }

    /**
     * Classifies a raw capture (lines separated by newlines). {@code null} or blank means absent.
     */
    public WorkerActivity classify(String capture) {
        if (capture == null || capture.isBlank()) {
            return WorkerActivity.ABSENT;
        }
        return classify(Arrays.asList(capture.split("\\R", -1)));
    }

    /**
     * Classifies an ordered sequence of output lines, oldest first.
     */
    public WorkerActivity classify(List<String> lines) {
        List<String> tail = tail(lines, tailLines);
        if (tail.isEmpty()) {
            return WorkerActivity.ABSENT;
        }
        for (ClassificationRule rule : rules) {
            if (rule.matchesAny(tail)) {
                log.debug("Rule '{}' matched -> {}", rule.name(), rule.outcome());
                return rule.outcome();
            }
        }
        return WorkerActivity.IDLE;
    }

    /**
     * Last {@code n} lines after dropping trailing blank lines (terminal captures pad the
     * visible area below the cursor).
     */
    static List<String> tail(List<String> lines, int n) {
        if (lines == null || lines.isEmpty()) {
            return List.of();
        }
        int end = lines.size();
        while (end > 0 && (lines.get(end - 1) == null || lines.get(end - 1).isBlank())) {
            end--;
        }
        int start = Math.max(0, end - n);
        var tail = new ArrayList<String>(end - start);
        for (int i = start; i < end; i++) {
            String line = lines.get(i);
            tail.add(line == null ? "" : line);
        }
        return tail;
    }
}
