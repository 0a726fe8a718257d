package com.fleetmind.core.mailbox;

import com.fleetmind.core.model.Message;
import com.fleetmind.core.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Durable per-worker inbox.
 *
 * <p>Mutations ({@link #append}, {@link #markAllRead}, {@link #compact}) run under the
 * worker's mailbox lock and replace the document atomically; on any failure the previous
 * mailbox stays exactly as it was and the exception reaches the caller, who must not assume
 * delivery. Reads are lock-free snapshots and treat a missing mailbox as empty.
 */
@Service
public class MailboxStore {

    private static final Logger log = LoggerFactory.getLogger(MailboxStore.class);

    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final DocumentStore<MailboxDocument> documents;
    private final Clock clock;

    public MailboxStore(DocumentStore<MailboxDocument> documents, Clock clock) {
        this.documents = documents;
        this.clock = clock;
    }

    /**
     * Appends a new unread message and returns it once the mailbox has been replaced on disk.
     */
    public Message append(String workerId, String from, String type, String content) {
        return append(workerId, new Message(null, from, type, content, false, clock.instant()));
    }

    /**
     * Appends {@code message} as unread. A missing id is generated; a clashing id is replaced.
     */
    public Message append(String workerId, Message message) {
        Message[] stored = new Message[1];
        documents.update(workerId, current -> {
            MailboxDocument mailbox = current.orElseGet(MailboxDocument::empty);
            String id = message.id();
            while (id == null || mailbox.containsId(id)) {
                id = newMessageId();
            }
            stored[0] = new Message(id, message.from(), message.type(), message.content(), false,
                    message.timestamp() != null ? message.timestamp() : clock.instant());
            return mailbox.append(stored[0]);
        });
        log.info("Mailbox {} <- [{}/{}] {}", workerId, stored[0].from(), stored[0].type(), stored[0].id());
        return stored[0];
    }

    public int unreadCount(String workerId) {
        return documents.read(workerId).map(MailboxDocument::unreadCount).orElse(0);
    }

    public List<Message> messages(String workerId) {
        return documents.read(workerId).map(MailboxDocument::messages).orElse(List.of());
    }

    public List<Message> unread(String workerId) {
        return documents.read(workerId).map(MailboxDocument::unread).orElse(List.of());
    }

    /**
     * Marks every message read. A missing or already-read mailbox is left alone.
     */
    public void markAllRead(String workerId) {
        documents.update(workerId, current -> current.map(MailboxDocument::markAllRead).orElse(null));
        log.debug("Mailbox {} marked read", workerId);
    }

    /**
     * Removes old read messages, keeping the newest {@code keepRead} of them and every unread one.
     *
     * @return number of messages removed
     */
    public int compact(String workerId, int keepRead) {
        int[] removed = new int[1];
        documents.update(workerId, current -> current.map(mailbox -> {
            MailboxDocument compacted = mailbox.compact(keepRead);
            removed[0] = mailbox.messages().size() - compacted.messages().size();
            return compacted;
        }).orElse(null));
        if (removed[0] > 0) {
            log.info("Mailbox {} compacted: {} read message(s) removed", workerId, removed[0]);
        }
        return removed[0];
    }

    public boolean contains(String workerId, Predicate<Message> condition) {
        return messages(workerId).stream().anyMatch(condition);
    }

    private String newMessageId() {
        String stamp = ID_TIME.format(clock.instant().atZone(clock.getZone()));
        return "msg_" + stamp + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
