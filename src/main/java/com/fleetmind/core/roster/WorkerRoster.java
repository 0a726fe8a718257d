package com.fleetmind.core.roster;

import com.fleetmind.core.FleetException;
import com.fleetmind.core.config.FleetProperties;
import com.fleetmind.core.model.CliFamily;
import com.fleetmind.core.model.Worker;
import com.fleetmind.core.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The set of provisioned workers. Identity, CLI family and session come from configuration;
 * the current model and the turn-deferred flag are persisted per worker and override the
 * configured starting values once written.
 */
@Service
public class WorkerRoster {

    private static final Logger log = LoggerFactory.getLogger(WorkerRoster.class);

    private final DocumentStore<Worker> documents;
    private final Map<String, Worker> seeds;

    public WorkerRoster(DocumentStore<Worker> documents, FleetProperties properties) {
        this(documents, seedsFrom(properties.getWorkers()));
    }

    public WorkerRoster(DocumentStore<Worker> documents, List<Worker> seeds) {
        this.documents = documents;
        this.seeds = new LinkedHashMap<>();
        for (Worker seed : seeds) {
            if (this.seeds.putIfAbsent(seed.workerId(), seed) != null) {
                throw new FleetException("Duplicate worker id in configuration: " + seed.workerId());
            }
        }
    }

    /** Every configured worker, in configuration order, with persisted state applied. */
    public List<Worker> all() {
        List<Worker> result = new ArrayList<>(seeds.size());
        for (Worker seed : seeds.values()) {
            result.add(merge(seed, documents.read(seed.workerId())));
        }
        return result;
    }

    public Optional<Worker> find(String workerId) {
        Worker seed = seeds.get(workerId);
        if (seed == null) {
            return Optional.empty();
        }
        return Optional.of(merge(seed, documents.read(workerId)));
    }

    public Worker require(String workerId) {
        return find(workerId).orElseThrow(() -> new FleetException("Unknown worker: " + workerId));
    }

    /**
     * Records that {@code workerId} now runs {@code modelId}.
     */
    public Worker switchModel(String workerId, String modelId) {
        Worker updated = documents.update(workerId, current -> {
            Worker base = merge(requireSeed(workerId), current);
            return base.withModel(modelId);
        });
        log.info("Worker {} now on model {}", workerId, modelId);
        return updated;
    }

    /**
     * Sets the turn-deferred flag. Returns the previous value; nothing is written when the
     * flag already has the requested value.
     */
    public boolean markDeferred(String workerId, boolean deferred) {
        boolean[] previous = new boolean[1];
        documents.update(workerId, current -> {
            Worker base = merge(requireSeed(workerId), current);
            previous[0] = base.turnDeferred();
            if (base.turnDeferred() == deferred) {
                return null;
            }
            return base.withTurnDeferred(deferred);
        });
        return previous[0];
    }

    /**
     * Records that the assignment notice for {@code taskId} reached the worker's mailbox.
     */
    public void markAnnounced(String workerId, String taskId) {
        documents.update(workerId, current -> {
            Worker base = merge(requireSeed(workerId), current);
            return taskId.equals(base.announcedTask()) ? null : base.withAnnouncedTask(taskId);
        });
    }

    private Worker requireSeed(String workerId) {
        Worker seed = seeds.get(workerId);
        if (seed == null) {
            throw new FleetException("Unknown worker: " + workerId);
        }
        return seed;
    }

    private static Worker merge(Worker seed, Optional<Worker> persisted) {
        if (persisted.isEmpty()) {
            return seed;
        }
        Worker stored = persisted.get();
        String model = stored.model() == null || stored.model().isBlank() ? seed.model() : stored.model();
        return new Worker(seed.workerId(), model, seed.cli(), seed.session(), stored.turnDeferred(), stored.announcedTask());
    }

    static List<Worker> seedsFrom(List<FleetProperties.WorkerSpec> specs) {
        List<Worker> result = new ArrayList<>();
        for (FleetProperties.WorkerSpec spec : specs) {
            Objects.requireNonNull(spec.getId(), "worker id");
            String session = spec.getSession() == null || spec.getSession().isBlank()
                    ? spec.getId()
                    : spec.getSession();
            result.add(new Worker(spec.getId(), spec.getModel(), CliFamily.fromString(spec.getCli()), session));
        }
        return result;
    }
}
