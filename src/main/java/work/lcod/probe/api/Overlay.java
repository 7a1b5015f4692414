package work.lcod.probe.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import work.lcod.probe.runtime.ResultListener;
import work.lcod.probe.runtime.ResultRecord;

/**
 * A group of probes activated and deactivated together: taps that collect firings plus
 * override rules keyed by selector text. Probes added while the overlay is active start at once.
 */
public final class Overlay implements AutoCloseable {
    private final ProbeEngine engine;
    private final List<Probe> probes = new ArrayList<>();
    private boolean active;
    private Long boundaryScopeId;

    Overlay(ProbeEngine engine) {
        this.engine = engine;
    }

    /**
     * Collects every firing of the selector into the returned list.
     */
    public synchronized List<ResultRecord> tap(String selector) {
        Probe probe = engine.probe(selector);
        List<ResultRecord> records = probe.collect();
        add(probe);
        return records;
    }

    public synchronized Overlay on(String selector, ResultListener listener) {
        add(engine.probe(selector).subscribe(listener));
        return this;
    }

    public synchronized Overlay tweak(Map<String, Object> values) {
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            add(engine.probe(entry.getKey()).tweak(entry.getValue()));
        }
        return this;
    }

    public synchronized Overlay rewrite(Map<String, Function<Map<String, Object>, Object>> rules) {
        for (Map.Entry<String, Function<Map<String, Object>, Object>> entry : rules.entrySet()) {
            add(engine.probe(entry.getKey()).rewrite(entry.getValue()));
        }
        return this;
    }

    public synchronized Overlay override(String selector, Function<ResultRecord, Object> function) {
        add(engine.probe(selector).override(function));
        return this;
    }

    public synchronized Overlay activate() {
        active = true;
        boundaryScopeId = null;
        for (Probe probe : probes) {
            probe.activate();
        }
        return this;
    }

    public synchronized Overlay activateWithin(long scopeId) {
        active = true;
        boundaryScopeId = scopeId;
        for (Probe probe : probes) {
            probe.activateWithin(scopeId);
        }
        return this;
    }

    public synchronized List<Probe> probes() {
        return List.copyOf(probes);
    }

    public synchronized List<String> diagnostics() {
        var all = new ArrayList<String>();
        for (Probe probe : probes) {
            all.addAll(probe.diagnostics());
        }
        return all;
    }

    @Override
    public synchronized void close() {
        for (Probe probe : probes) {
            probe.deactivate();
        }
        active = false;
    }

    private void add(Probe probe) {
        probes.add(probe);
        if (active) {
            if (boundaryScopeId == null) {
                probe.activate();
            } else {
                probe.activateWithin(boundaryScopeId);
            }
        }
    }
}
