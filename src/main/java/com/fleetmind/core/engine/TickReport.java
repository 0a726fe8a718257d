package com.fleetmind.core.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one dispatcher tick did, per worker.
 */
public class TickReport {

    private final long tick;
    private final List<String> unblocked = new ArrayList<>();
    private final List<String> announced = new ArrayList<>();
    private final List<String> switched = new ArrayList<>();
    private final List<String> nudged = new ArrayList<>();
    private final List<String> deferred = new ArrayList<>();
    private final List<String> absent = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    public TickReport(long tick) {
        this.tick = tick;
    }

    void unblocked(String workerId) { unblocked.add(workerId); }
    void announced(String workerId) { announced.add(workerId); }
    void switched(String workerId) { switched.add(workerId); }
    void nudged(String workerId) { nudged.add(workerId); }
    void deferred(String workerId) { deferred.add(workerId); }
    void absent(String workerId) { absent.add(workerId); }
    void failed(String workerId, String reason) { failures.put(workerId, reason); }

    public long tick() { return tick; }
    public List<String> unblocked() { return Collections.unmodifiableList(unblocked); }
    public List<String> announced() { return Collections.unmodifiableList(announced); }
    public List<String> switched() { return Collections.unmodifiableList(switched); }
    public List<String> nudged() { return Collections.unmodifiableList(nudged); }
    public List<String> deferred() { return Collections.unmodifiableList(deferred); }
    public List<String> absent() { return Collections.unmodifiableList(absent); }
    public Map<String, String> failures() { return Collections.unmodifiableMap(failures); }

    public boolean quiet() {
        return unblocked.isEmpty() && announced.isEmpty() && switched.isEmpty() && nudged.isEmpty()
                && deferred.isEmpty() && absent.isEmpty() && failures.isEmpty();
    }

    @Override
    public String toString() {
        return "tick %d: unblocked=%s announced=%s switched=%s nudged=%s deferred=%s absent=%s failures=%s"
                .formatted(tick, unblocked, announced, switched, nudged, deferred, absent, failures.keySet());
    }
}
