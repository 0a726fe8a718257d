package com.fleetmind.core.config;

import com.fleetmind.core.bridge.NotificationBridge;
import com.fleetmind.core.mailbox.MailboxDocument;
import com.fleetmind.core.mailbox.MailboxStore;
import com.fleetmind.core.model.Worker;
import com.fleetmind.core.registry.TaskDocument;
import com.fleetmind.core.routing.CapabilityConfigLoader;
import com.fleetmind.core.store.DocumentStore;
import com.fleetmind.core.store.FileDocumentStore;
import com.fleetmind.notify.NotificationChannel;
import com.fleetmind.notify.NotificationException;
import com.fleetmind.notify.NtfyChannel;
import com.fleetmind.session.TmuxWorkerSession;
import com.fleetmind.session.WorkerSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the file-backed document stores under {@code fleetmind.state-dir} (one directory
 * each for mailboxes, task files and worker records) and the external collaborators.
 */
@Configuration
public class FleetConfig {

    private static final Logger log = LoggerFactory.getLogger(FleetConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DocumentStore<MailboxDocument> mailboxDocuments(FleetProperties properties) {
        log.debug("Mailboxes under {}", properties.inboxDir().toAbsolutePath());
        return new FileDocumentStore<>(properties.inboxDir(), MailboxDocument.class, properties.lockTimeout());
    }

    @Bean
    public DocumentStore<TaskDocument> taskDocuments(FleetProperties properties) {
        return new FileDocumentStore<>(properties.tasksDir(), TaskDocument.class, properties.lockTimeout());
    }

    @Bean
    public DocumentStore<Worker> workerDocuments(FleetProperties properties) {
        return new FileDocumentStore<>(properties.workersDir(), Worker.class, properties.lockTimeout());
    }

    @Bean
    public CapabilityConfigLoader capabilityConfigLoader(FleetProperties properties) {
        return new CapabilityConfigLoader(Path.of(properties.getRouting().getConfigFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkerSession workerSession() {
        return new TmuxWorkerSession();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationChannel notificationChannel(FleetProperties properties) {
        FleetProperties.Ntfy ntfy = properties.getNtfy();
        if (!ntfy.isConfigured()) {
            log.info("fleetmind.ntfy.topic not set; acknowledgments disabled");
            return text -> {
                throw new NotificationException("No ntfy topic configured");
            };
        }
        return new NtfyChannel(ntfy.getServer(), ntfy.getTopic());
    }

    @Bean
    public NotificationBridge notificationBridge(MailboxStore mailbox, NotificationChannel channel,
                                                 FleetProperties properties) {
        return new NotificationBridge(mailbox, channel, properties.getOwnerId(), properties.getNtfy().getAckPrefix());
    }
}
