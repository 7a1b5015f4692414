package work.lcod.probe.trace;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.api.ProbeEngine;
import work.lcod.probe.automaton.FunctionRef;
import work.lcod.probe.runtime.ScopeTracker;
import work.lcod.probe.runtime.Substitution;

/**
 * Drives a {@link ProbeEngine} from a recorded trace, mapping scope labels to engine scope ids.
 */
public final class TraceReplayer {
    private static final Logger logger = LoggerFactory.getLogger(TraceReplayer.class);

    private TraceReplayer() {}

    /**
     * Outcome of a replay.
     *
     * @param scopeIds engine id of the last scope opened under each label
     * @param substitutions values substituted by override rules, in event order
     */
    public record ReplayResult(Map<String, Long> scopeIds, List<AppliedSubstitution> substitutions) {
        public ReplayResult {
            scopeIds = Map.copyOf(scopeIds);
            substitutions = List.copyOf(substitutions);
        }
    }

    /**
     * @param eventIndex position of the event in the trace
     * @param name variable the substitution applied to ({@code #value}, {@code #yield} or {@code #receive} for those events)
     */
    public record AppliedSubstitution(int eventIndex, String scope, String name, Object value) {}

    public static ReplayResult replay(ProbeEngine engine, List<TraceEvent> events) {
        var open = new HashMap<String, Long>();
        var opened = new LinkedHashMap<String, Long>();
        var substitutions = new ArrayList<AppliedSubstitution>();
        for (int index = 0; index < events.size(); index++) {
            TraceEvent event = events.get(index);
            switch (event.type()) {
                case ENTER -> {
                    if (open.containsKey(event.scope())) {
                        throw new IllegalStateException("Trace event #" + index + " reopens scope '" + event.scope() + "'");
                    }
                    long parent = event.parent() == null ? ScopeTracker.NO_PARENT : requireScope(open, event.parent(), index);
                    long id = engine.enter(functionOf(event), parent, event.key());
                    open.put(event.scope(), id);
                    opened.put(event.scope(), id);
                }
                case BIND -> record(substitutions, index, event, event.name(),
                    engine.bind(requireScope(open, event.scope(), index), event.name(), event.value(),
                        Set.copyOf(event.tags()), event.overridable()));
                case YIELD -> record(substitutions, index, event, "#yield",
                    engine.yieldValue(requireScope(open, event.scope(), index), event.value()));
                case RECEIVE -> record(substitutions, index, event, "#receive",
                    engine.receive(requireScope(open, event.scope(), index), event.value()));
                case EXIT -> {
                    long id = requireScope(open, event.scope(), index);
                    record(substitutions, index, event, "#value", engine.exit(id, event.value()));
                    open.remove(event.scope());
                }
                case FAIL -> {
                    long id = requireScope(open, event.scope(), index);
                    String message = event.value() == null ? "failed" : String.valueOf(event.value());
                    engine.fail(id, new IllegalStateException(message));
                    open.remove(event.scope());
                }
            }
        }
        if (!open.isEmpty()) {
            logger.warn("Trace ended with open scopes {}", open.keySet());
        }
        return new ReplayResult(opened, substitutions);
    }

    private static FunctionRef functionOf(TraceEvent event) {
        return FunctionRef.of(event.function(), Set.copyOf(event.tags()));
    }

    private static long requireScope(Map<String, Long> open, String label, int index) {
        Long id = open.get(label);
        if (id == null) {
            throw new IllegalStateException("Trace event #" + index + " refers to scope '" + label + "' which is not open");
        }
        return id;
    }

    private static void record(List<AppliedSubstitution> substitutions, int index, TraceEvent event, String name,
                               Optional<Substitution> substitution) {
        substitution.ifPresent(applied -> substitutions.add(new AppliedSubstitution(index, event.scope(), name, applied.value())));
    }
}
