package work.lcod.probe.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Active selectors of one engine, in activation order.
 */
public final class ActivationRegistry {
    private final Map<Long, Entry> activations = new ConcurrentSkipListMap<>();
    private volatile List<Activation> global = List.of();

    public ActivationRegistry register(Activation activation, Long boundaryScopeId) {
        activations.put(activation.id(), new Entry(activation.id(), activation, boundaryScopeId));
        refreshGlobal();
        return this;
    }

    public Entry get(long id) {
        return activations.get(id);
    }

    public void unregister(long id) {
        if (activations.remove(id) != null) {
            refreshGlobal();
        }
    }

    public Map<Long, Entry> entries() {
        return Collections.unmodifiableMap(activations);
    }

    /**
     * Activations not bounded by a scope.
     */
    public List<Activation> global() {
        return global;
    }

    private void refreshGlobal() {
        List<Activation> out = new ArrayList<>();
        for (Entry entry : activations.values()) {
            if (entry.boundaryScopeId() == null) {
                out.add(entry.activation());
            }
        }
        global = List.copyOf(out);
    }

    public int size() {
        return activations.size();
    }

    public record Entry(long id, Activation activation, Long boundaryScopeId) {}
}
