package com.fleetmind.core.mailbox;

import com.fleetmind.core.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted shape of a mailbox: messages in insertion order.
 */
public record MailboxDocument(List<Message> messages) {

    public MailboxDocument {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static MailboxDocument empty() {
        return new MailboxDocument(List.of());
    }

    public MailboxDocument append(Message message) {
        var next = new ArrayList<>(messages);
        next.add(message);
        return new MailboxDocument(next);
    }

    public MailboxDocument markAllRead() {
        return new MailboxDocument(messages.stream().map(Message::asRead).toList());
    }

    public int unreadCount() {
        return (int) messages.stream().filter(m -> !m.read()).count();
    }

    public List<Message> unread() {
        return messages.stream().filter(m -> !m.read()).toList();
    }

    public boolean containsId(String id) {
        return messages.stream().anyMatch(m -> Objects.equals(m.id(), id));
    }

    /**
     * Drops read messages beyond the newest {@code keepRead}; unread messages always survive
     * and relative order is preserved.
     */
    public MailboxDocument compact(int keepRead) {
        int readTotal = messages.size() - unreadCount();
        int toDrop = Math.max(0, readTotal - Math.max(0, keepRead));
        if (toDrop == 0) {
            return this;
        }
        var kept = new ArrayList<Message>(messages.size() - toDrop);
        for (Message message : messages) {
            if (message.read() && toDrop > 0) {
                toDrop--;
                continue;
            }
            kept.add(message);
        }
        return new MailboxDocument(kept);
    }
}
