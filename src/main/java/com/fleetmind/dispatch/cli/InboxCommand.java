package com.fleetmind.dispatch.cli;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.mailbox.MailboxStore;
import com.fleetmind.core.model.Message;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;

/**
 * CLI command group: fleetmind inbox (send|count|read|list|compact)
 */
@Command(name = "inbox", mixinStandardHelpOptions = true, description = "Read and write worker mailboxes")
@Component
public class InboxCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    private final MailboxStore mailbox;
    private final FleetProperties properties;

    public InboxCommand(MailboxStore mailbox, FleetProperties properties) {
        this.mailbox = mailbox;
        this.properties = properties;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "send", description = "Append a message to a mailbox")
    int send(@Parameters(index = "0", paramLabel = "WORKER") String workerId,
             @Parameters(index = "1", paramLabel = "CONTENT") String content,
             @Option(names = "--from", description = "Sender (default: the owner id)") String from,
             @Option(names = "--type", defaultValue = Message.TYPE_INFO) String type) {
        try {
            String sender = from != null ? from : properties.getOwnerId();
            Message stored = mailbox.append(workerId, sender, type, content);
            ConsoleOutput.success("Delivered " + stored.id() + " to " + workerId);
            return 0;
        } catch (FleetException e) {
            ConsoleOutput.error("Not delivered: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "count", description = "Print the number of unread messages")
    int count(@Parameters(index = "0", paramLabel = "WORKER") String workerId) {
        System.out.println(mailbox.unreadCount(workerId));
        return 0;
    }

    @Command(name = "read", description = "Mark every message read")
    int read(@Parameters(index = "0", paramLabel = "WORKER") String workerId) {
        try {
            mailbox.markAllRead(workerId);
            ConsoleOutput.success("Mailbox " + workerId + " marked read");
            return 0;
        } catch (FleetException e) {
            ConsoleOutput.error("Mark read failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "list", description = "List messages, newest last")
    int list(@Parameters(index = "0", paramLabel = "WORKER") String workerId,
             @Option(names = {"--unread", "-u"}, description = "Unread only") boolean unreadOnly) {
        List<Message> messages = unreadOnly ? mailbox.unread(workerId) : mailbox.messages(workerId);
        ConsoleOutput.messages(messages);
        return 0;
    }

    @Command(name = "compact", description = "Drop old read messages")
    int compact(@Parameters(index = "0", paramLabel = "WORKER") String workerId,
                @Option(names = "--keep", defaultValue = "10", description = "Read messages to keep") int keep) {
        try {
            int removed = mailbox.compact(workerId, keep);
            ConsoleOutput.success("Removed " + removed + " read message(s) from " + workerId);
            return 0;
        } catch (FleetException e) {
            ConsoleOutput.error("Compact failed: " + e.getMessage());
            return 1;
        }
    }
}
