package work.lcod.probe.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.runtime.Activation;
import work.lcod.probe.runtime.OverrideRule;
import work.lcod.probe.runtime.ResultListener;
import work.lcod.probe.runtime.ResultRecord;
import work.lcod.probe.runtime.ScopeTracker;

/**
 * Handle on one or more selectors ({@code ;}-separated) created by {@link ProbeEngine#probe}.
 * Listeners and override rules apply to every selector of the probe.
 *
 * <pre>{@code
 * try (Probe probe = engine.probe("fact(i, !curr)")) {
 *     probe.subscribe(record -> seen.add(record.values())).activate();
 *     ...
 * }
 * }</pre>
 */
public final class Probe implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Probe.class);

    private final ScopeTracker tracker;
    private final List<Activation> activations;
    private final List<String> unresolved;

    Probe(ScopeTracker tracker, List<Activation> activations, List<String> unresolved, boolean warnOnUnresolved) {
        this.tracker = tracker;
        this.activations = List.copyOf(activations);
        this.unresolved = List.copyOf(unresolved);
        if (warnOnUnresolved) {
            for (String diagnostic : unresolved) {
                logger.warn(diagnostic);
            }
            for (Activation activation : this.activations) {
                activation.addListener(new UnmatchedCallReporter(activation));
            }
        }
    }

    public List<Activation> activations() {
        return activations;
    }

    public List<String> selectorTexts() {
        var texts = new ArrayList<String>();
        for (Activation activation : activations) {
            texts.add(activation.selector().text());
        }
        return texts;
    }

    public Probe subscribe(ResultListener listener) {
        for (Activation activation : activations) {
            activation.addListener(listener);
        }
        return this;
    }

    public Probe unsubscribe(ResultListener listener) {
        for (Activation activation : activations) {
            activation.removeListener(listener);
        }
        return this;
    }

    /**
     * Subscribes a list that receives every firing and returns it.
     */
    public List<ResultRecord> collect() {
        List<ResultRecord> records = new CopyOnWriteArrayList<>();
        subscribe(records::add);
        return records;
    }

    /**
     * Replaces the focus value with the function's result. The function sees the whole record.
     */
    public Probe override(Function<ResultRecord, Object> function) {
        return addRule(OverrideRule.override(function));
    }

    /**
     * Replaces the focus value with the function's result. The function sees the other captures only.
     */
    public Probe rewrite(Function<Map<String, Object>, Object> function) {
        return addRule(OverrideRule.rewrite(function));
    }

    /**
     * Replaces the focus value with a constant.
     */
    public Probe tweak(Object value) {
        return addRule(OverrideRule.tweak(value));
    }

    private Probe addRule(OverrideRule rule) {
        for (Activation activation : activations) {
            activation.addOverrideRule(rule);
        }
        return this;
    }

    public Probe activate() {
        for (Activation activation : activations) {
            tracker.activate(activation);
        }
        return this;
    }

    /**
     * Activates only inside the given open scope; the probe is deactivated when that scope exits.
     */
    public Probe activateWithin(long scopeId) {
        for (Activation activation : activations) {
            tracker.activateWithin(activation, scopeId);
        }
        return this;
    }

    public void deactivate() {
        for (Activation activation : activations) {
            tracker.deactivate(activation);
        }
    }

    @Override
    public void close() {
        deactivate();
    }

    public boolean isActive() {
        return activations.stream().anyMatch(Activation::isActive);
    }

    public long firingCount() {
        return activations.stream().mapToLong(Activation::firingCount).sum();
    }

    /**
     * Unresolved references found at creation plus runtime notes (refused overrides, calls that never matched).
     */
    public List<String> diagnostics() {
        var all = new ArrayList<String>(unresolved);
        for (Activation activation : activations) {
            all.addAll(activation.diagnostics());
        }
        return all;
    }

    private static final class UnmatchedCallReporter implements ResultListener {
        private final Activation activation;

        UnmatchedCallReporter(Activation activation) {
            this.activation = activation;
        }

        @Override
        public void onResult(ResultRecord record) {
            // firings are handled by user listeners
        }

        @Override
        public void onComplete() {
            for (String call : activation.unmatchedCalls()) {
                logger.warn("Call '{}' of selector '{}' never matched", call, activation.selector().text());
            }
        }
    }
}
