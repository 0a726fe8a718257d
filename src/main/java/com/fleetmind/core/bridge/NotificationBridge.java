package com.fleetmind.core.bridge;

import com.fleetmind.core.mailbox.MailboxStore;
import com.fleetmind.core.model.Message;
import com.fleetmind.core.model.NotificationEvent;
import com.fleetmind.notify.NotificationChannel;
import com.fleetmind.notify.NotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns inbound relay messages into entries in the owner's mailbox and echoes an
 * acknowledgment back over the relay.
 * <p>
 * The mailbox append happens first and its failure propagates to the caller with no
 * acknowledgment sent. An acknowledgment failure after a successful append is logged and
 * reported as {@link BridgeOutcome#DELIVERED_UNACKNOWLEDGED}; the append stands.
 */
public class NotificationBridge {

    private static final Logger log = LoggerFactory.getLogger(NotificationBridge.class);

    static final String SENDER = "ntfy";

    private final MailboxStore mailbox;
    private final NotificationChannel channel;
    private final String ownerId;
    private final String ackPrefix;

    public NotificationBridge(MailboxStore mailbox, NotificationChannel channel, String ownerId, String ackPrefix) {
        this.mailbox = mailbox;
        this.channel = channel;
        this.ownerId = ownerId;
        this.ackPrefix = ackPrefix == null ? "" : ackPrefix;
    }

    public BridgeOutcome onEvent(NotificationEvent event) {
        if (!event.messageEvent() || event.content() == null || event.content().isEmpty()) {
            log.trace("Ignoring relay event {} ({})", event.id(), event.eventKind());
            return BridgeOutcome.IGNORED;
        }
        if (event.outbound()) {
            log.debug("Dropping own acknowledgment {}", event.id());
            return BridgeOutcome.DROPPED_OUTBOUND;
        }

        Message stored = mailbox.append(ownerId, SENDER, Message.TYPE_NTFY_RECEIVED, event.content());
        log.info("Relay message {} delivered to {} as {}", event.id(), ownerId, stored.id());

        try {
            channel.publish(ackPrefix + event.content());
            return BridgeOutcome.DELIVERED;
        } catch (NotificationException e) {
            log.warn("Acknowledgment for relay message {} failed: {}", event.id(), e.getMessage());
            return BridgeOutcome.DELIVERED_UNACKNOWLEDGED;
        }
    }
}
