package com.fleetmind.core.inference;

import com.fleetmind.core.model.WorkerActivity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class StateClassifierTest {

    private final StateClassifier classifier = new StateClassifier();

    @Nested
    @DisplayName("Absent")
    class Absent {

        @Test
        @DisplayName("null capture -> ABSENT")
        void nullCapture() {
            assertEquals(WorkerActivity.ABSENT, classifier.classify((String) null));
        }

        @Test
        @DisplayName("empty or whitespace-only capture -> ABSENT")
        void emptyCapture() {
            assertEquals(WorkerActivity.ABSENT, classifier.classify(""));
            assertEquals(WorkerActivity.ABSENT, classifier.classify("  \n\n \n"));
            assertEquals(WorkerActivity.ABSENT, classifier.classify(List.of()));
        }
    }

    @Nested
    @DisplayName("Busy")
    class Busy {

        @Test
        @DisplayName("interrupt hint -> BUSY")
        void interruptHint() {
            assertEquals(WorkerActivity.BUSY, classifier.classify(List.of("Working (12s • esc to interrupt)")));
        }

        @Test
        @DisplayName("background terminal -> BUSY")
        void backgroundTerminal() {
            assertEquals(WorkerActivity.BUSY, classifier.classify("output\n1 background terminal running\n"));
        }

        @Test
        @DisplayName("localized busy phrase -> BUSY")
        void localizedPhrase() {
            assertEquals(WorkerActivity.BUSY, classifier.classify("✻ 思考中…"));
            assertEquals(WorkerActivity.BUSY, classifier.classify("Compacting conversation"));
        }

        @Test
        @DisplayName("busy phrase matching is case-insensitive")
        void caseInsensitive() {
            assertEquals(WorkerActivity.BUSY, classifier.classify("· thinking about the schema"));
        }
    }

    @Nested
    @DisplayName("Idle")
    class Idle {

        @Test
        @DisplayName("codex footer -> IDLE")
        void codexFooter() {
            assertEquals(WorkerActivity.IDLE, classifier.classify(List.of("? for shortcuts", "100% context left")));
        }

        @Test
        @DisplayName("bare claude prompt -> IDLE")
        void claudePrompt() {
            assertEquals(WorkerActivity.IDLE, classifier.classify("some output\n❯ \n"));
        }

        @Test
        @DisplayName("fresh prompt wins over stale busy phrase in the same window")
        void idleBeforeBusy() {
            var tail = List.of("Thought for 4s", "Working on the migration", "", "› ");
            assertEquals(WorkerActivity.IDLE, classifier.classify(tail));
        }

        @Test
        @DisplayName("no rule matches -> IDLE")
        void defaultIdle() {
            assertEquals(WorkerActivity.IDLE, classifier.classify("$ ls\nREADME.md  pom.xml"));
        }

        @Test
        @DisplayName("busy marker above the last five lines is ignored")
        void staleBusyOutsideWindow() {
            var lines = new ArrayList<String>();
            lines.add("Working (3s • esc to interrupt)");
            for (int i = 0; i < 5; i++) {
                lines.add("line " + i);
            }
            assertEquals(WorkerActivity.IDLE, classifier.classify(lines));
        }

        @Test
        @DisplayName("trailing blank padding does not push content out of the window")
        void trailingPaddingIgnored() {
            var capture = "a\nb\nc\nd\nWorking (1s • esc to interrupt)\n\n\n\n\n\n\n";
            assertEquals(WorkerActivity.BUSY, classifier.classify(capture));
        }
    }

    @Test
    @DisplayName("custom rule table is evaluated in order")
    void customRules() {
        var rules = List.of(
                ClassificationRule.pattern("done", Pattern.compile("DONE"), WorkerActivity.IDLE),
                ClassificationRule.containsIgnoreCase("run", "running", WorkerActivity.BUSY));
        var custom = new StateClassifier(rules, 2);

        assertEquals(WorkerActivity.IDLE, custom.classify("running\nDONE"));
        assertEquals(WorkerActivity.BUSY, custom.classify("RUNNING job 3"));
        assertEquals(WorkerActivity.IDLE, custom.classify("running\nx\ny"));
    }

    @Test
    @DisplayName("tail drops trailing blanks then keeps last n")
    void tail() {
        assertEquals(List.of("b", "c"), StateClassifier.tail(List.of("a", "b", "c", " ", ""), 2));
        assertEquals(List.of(), StateClassifier.tail(List.of("", ""), 5));
    }

    @Test
    @DisplayName("non-positive window is rejected")
    void rejectsZeroWindow() {
        assertThrows(IllegalArgumentException.class, () -> new StateClassifier(StateClassifier.defaultRules(), 0));
    }
}
