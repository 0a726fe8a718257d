package com.fleetmind.core.hook;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.mailbox.MailboxStore;
import com.fleetmind.core.model.Message;
import com.fleetmind.core.model.Worker;
import com.fleetmind.core.roster.WorkerRoster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides whether a worker may end its turn. Unread mail holds the turn open once, feeding a
 * summary of the mail back as the reason; the second call in the same deferral always
 * allows, so the loop terminates.
 * <p>
 * Any failure reading the mailbox or persisting the deferral flag results in allow: a worker
 * is never trapped by the hook.
 */
@Service
public class TurnCompletionHook {

    private static final Logger log = LoggerFactory.getLogger(TurnCompletionHook.class);

    static final int SUMMARY_LIMIT = 5;
    static final int CONTENT_LIMIT = 80;

    private final MailboxStore mailbox;
    private final WorkerRoster roster;
    private final String ownerId;
    private final Path inboxDir;

    @Autowired
    public TurnCompletionHook(MailboxStore mailbox, WorkerRoster roster, FleetProperties properties) {
        this(mailbox, roster, properties.getOwnerId(), properties.inboxDir());
    }

    public TurnCompletionHook(MailboxStore mailbox, WorkerRoster roster, String ownerId, Path inboxDir) {
        this.mailbox = mailbox;
        this.roster = roster;
        this.ownerId = ownerId;
        this.inboxDir = inboxDir;
    }

    /**
     * @param workerId          the worker ending its turn, may be null when it cannot be identified
     * @param alreadyContinuing the program's own flag: this turn already continues from a block
     */
    public HookDecision evaluate(String workerId, boolean alreadyContinuing) {
        if (workerId == null || workerId.isBlank() || workerId.equals(ownerId)) {
            return HookDecision.allow();
        }
        try {
            Optional<Worker> worker = roster.find(workerId);
            if (worker.isEmpty()) {
                log.debug("Hook called for unknown worker {}", workerId);
                return HookDecision.allow();
            }
            if (alreadyContinuing || worker.get().turnDeferred()) {
                roster.markDeferred(workerId, false);
                return HookDecision.allow();
            }
            List<Message> unread = mailbox.unread(workerId);
            if (unread.isEmpty()) {
                return HookDecision.allow();
            }
            roster.markDeferred(workerId, true);
            log.info("Holding turn of {} open for {} unread message(s)", workerId, unread.size());
            return HookDecision.block(reason(workerId, unread));
        } catch (FleetException e) {
            log.warn("Hook for {} allowing stop after failure: {}", workerId, e.getMessage());
            return HookDecision.allow();
        }
    }

    String reason(String workerId, List<Message> unread) {
        return "inbox: %d unread message(s). Read %s and process them. Content: %s"
                .formatted(unread.size(), inboxDir.resolve(workerId + ".yaml"), summarize(unread));
    }

    static String summarize(List<Message> unread) {
        return unread.stream()
                .limit(SUMMARY_LIMIT)
                .map(m -> "[%s/%s] %s".formatted(orUnknown(m.from()), orUnknown(m.type()), truncate(m.content())))
                .collect(Collectors.joining(" | "));
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? "?" : value;
    }

    private static String truncate(String content) {
        if (content == null) {
            return "";
        }
        if (content.codePointCount(0, content.length()) <= CONTENT_LIMIT) {
            return content;
        }
        return content.substring(0, content.offsetByCodePoints(0, CONTENT_LIMIT));
    }
}
