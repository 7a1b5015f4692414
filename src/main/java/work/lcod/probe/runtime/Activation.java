package work.lcod.probe.runtime;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.automaton.CompiledSelector;
import work.lcod.probe.automaton.PatternNode;
import work.lcod.probe.selector.ProbeKind;

/**
 * A compiled selector registered with a {@link ScopeTracker}, together with its listeners and
 * override rules. Created through {@link ScopeTracker#prepare}.
 */
public final class Activation {
    private static final Logger logger = LoggerFactory.getLogger(Activation.class);

    public enum State {
        PREPARED,
        ACTIVE,
        DEACTIVATED
    }

    private final long id;
    private final CompiledSelector selector;
    private final ProbeKind kind;
    private final ResultMode mode;
    private final OverrideConflictPolicy policy;
    private final List<ResultListener> listeners = new CopyOnWriteArrayList<>();
    private final List<OverrideRule> rules = new CopyOnWriteArrayList<>();
    private final List<String> diagnostics = new CopyOnWriteArrayList<>();
    private final List<String> unmatchedCalls = new CopyOnWriteArrayList<>();
    private final AtomicLong firings = new AtomicLong();
    private final Set<Integer> matchedCalls = new LinkedHashSet<>();
    final List<AutomatonInstance> instances = new ArrayList<>();
    private volatile State state = State.PREPARED;
    private volatile Long boundaryScopeId;

    Activation(long id, CompiledSelector selector, ProbeKind kind, ResultMode mode, OverrideConflictPolicy policy) {
        this.id = id;
        this.selector = Objects.requireNonNull(selector, "selector");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (kind == ProbeKind.IMMEDIATE && selector.focus() == null) {
            throw new IllegalArgumentException("Selector '" + selector.text() + "' has no focus and cannot fire immediately");
        }
    }

    public long id() {
        return id;
    }

    public CompiledSelector selector() {
        return selector;
    }

    public ProbeKind kind() {
        return kind;
    }

    public ResultMode mode() {
        return mode;
    }

    public State state() {
        return state;
    }

    public boolean isActive() {
        return state == State.ACTIVE;
    }

    /**
     * Scope the activation is bounded to, or {@code null} when global.
     */
    public Long boundaryScopeId() {
        return boundaryScopeId;
    }

    public long firingCount() {
        return firings.get();
    }

    public List<String> diagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Names of the selector's named calls that never matched, filled in on deactivation of an
     * activation that never fired.
     */
    public List<String> unmatchedCalls() {
        return List.copyOf(unmatchedCalls);
    }

    public Activation addListener(ResultListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public Activation removeListener(ResultListener listener) {
        listeners.remove(listener);
        return this;
    }

    /**
     * Registers an override rule. Rules on total selectors and on generic or tag-matched foci are
     * refused: they are logged, noted in {@link #diagnostics()} and never run.
     *
     * @return whether the rule was accepted
     * @throws OverrideConflictException under {@link OverrideConflictPolicy#ERROR} when a rule already exists
     */
    public boolean addOverrideRule(OverrideRule rule) {
        Objects.requireNonNull(rule, "rule");
        if (kind == ProbeKind.TOTAL) {
            reject(rule, "the selector fires only at exit");
            return false;
        }
        PatternNode focus = selector.focus();
        if (!focus.overridable()) {
            reject(rule, "the focus is generic or matched by tag");
            return false;
        }
        if (policy == OverrideConflictPolicy.ERROR && !rules.isEmpty()) {
            throw new OverrideConflictException(selector.text());
        }
        rules.add(rule);
        return true;
    }

    List<OverrideRule> overrideRules() {
        return rules;
    }

    void markActive(Long boundary) {
        this.boundaryScopeId = boundary;
        this.state = State.ACTIVE;
    }

    void markDeactivated() {
        this.state = State.DEACTIVATED;
    }

    void matched(PatternNode call) {
        matchedCalls.add(call.id());
    }

    void note(String diagnostic) {
        diagnostics.add(diagnostic);
    }

    private void reject(OverrideRule rule, String reason) {
        String message = "Override rule (" + rule.description() + ") on '" + selector.text() + "' refused: " + reason;
        logger.warn(message);
        note(message);
    }

    /**
     * Records diagnostics for named calls that never matched while the activation was live.
     */
    void reportUnmatchedCalls() {
        if (firings.get() > 0) {
            return;
        }
        for (PatternNode call : selector.namedCalls()) {
            if (!matchedCalls.contains(call.id())) {
                unmatchedCalls.add(call.name().text());
                note("Call '" + call.name().text() + "' of selector '" + selector.text() + "' never matched");
            }
        }
    }

    void deliver(ResultRecord record) {
        firings.incrementAndGet();
        for (ResultListener listener : listeners) {
            try {
                listener.onResult(record);
            } catch (RuntimeException ex) {
                logger.error("Listener of selector '{}' failed on firing {}", selector.text(), record.sequence(), ex);
                deliverError(listener, ex);
            }
        }
    }

    void deliverError(Throwable error) {
        logger.warn("Selector '{}' could not fire: {}", selector.text(), error.getMessage());
        for (ResultListener listener : listeners) {
            deliverError(listener, error);
        }
    }

    private void deliverError(ResultListener listener, Throwable error) {
        try {
            listener.onError(error);
        } catch (RuntimeException ex) {
            logger.error("Error handler of selector '{}' failed", selector.text(), ex);
        }
    }

    void complete() {
        for (ResultListener listener : listeners) {
            try {
                listener.onComplete();
            } catch (RuntimeException ex) {
                logger.error("Completion handler of selector '{}' failed", selector.text(), ex);
            }
        }
    }

    @Override
    public String toString() {
        return "Activation[" + id + " '" + selector.text() + "' " + kind + " " + state + "]";
    }
}
