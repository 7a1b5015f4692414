package work.lcod.probe.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.automaton.CompiledSelector;
import work.lcod.probe.automaton.FunctionRef;
import work.lcod.probe.automaton.PatternNode;
import work.lcod.probe.selector.MetaKind;
import work.lcod.probe.selector.Nesting;
import work.lcod.probe.selector.ProbeKind;

/**
 * Consumes scope lifecycle and binding events from the host, advances the automata of every
 * active selector and fires results.
 *
 * <p>All events are serialized through one lock, so firings happen in a single total order and
 * an override is resolved before the host's bind call returns. Listeners run on the calling
 * thread while the lock is held.</p>
 */
public final class ScopeTracker {
    /** Parent id to pass for scopes without a tracked caller. */
    public static final long NO_PARENT = 0L;

    private static final Logger logger = LoggerFactory.getLogger(ScopeTracker.class);
    private static final Set<String> ENTER_TAGS = Set.of("enter");
    private static final Set<String> EXIT_TAGS = Set.of("exit");

    private final ReentrantLock lock;
    private final OverrideConflictPolicy policy;
    private final int maxPooledCaptures;
    private final Map<Long, Scope> scopes = new ConcurrentHashMap<>();
    private final ActivationRegistry registry = new ActivationRegistry();
    private final AtomicLong scopeIds = new AtomicLong();
    private final AtomicLong activationIds = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();

    public ScopeTracker() {
        this(OverrideConflictPolicy.LAST_WINS, 0, false);
    }

    public ScopeTracker(OverrideConflictPolicy policy, int maxPooledCaptures, boolean fairLock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        if (maxPooledCaptures < 0) {
            throw new IllegalArgumentException("maxPooledCaptures must be >= 0");
        }
        this.maxPooledCaptures = maxPooledCaptures;
        this.lock = new ReentrantLock(fairLock);
    }

    public ActivationRegistry registry() {
        return registry;
    }

    public OverrideConflictPolicy policy() {
        return policy;
    }

    public int openScopeCount() {
        return scopes.size();
    }

    public boolean isOpen(long scopeId) {
        lock.lock();
        try {
            Scope scope = scopes.get(scopeId);
            return scope != null && scope.open;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates an activation for a compiled selector. It receives nothing until activated.
     *
     * @param kind forced probe kind, or {@code null} to use the selector's own
     * @param mode result shape, or {@code null} for the default of the kind
     */
    public Activation prepare(CompiledSelector selector, ProbeKind kind, ResultMode mode) {
        ProbeKind effectiveKind = kind == null ? selector.kind() : kind;
        ResultMode effectiveMode = mode != null ? mode : (effectiveKind == ProbeKind.IMMEDIATE ? ResultMode.SINGLE : ResultMode.POOLED);
        return new Activation(activationIds.incrementAndGet(), selector, effectiveKind, effectiveMode, policy);
    }

    /**
     * Activates globally: roots may match in any scope entered from now on.
     */
    public void activate(Activation activation) {
        lock.lock();
        try {
            requirePrepared(activation);
            activation.markActive(null);
            registry.register(activation, null);
            logger.debug("Activated {}", activation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Activates within the dynamic extent of an open scope. The activation ends when that scope exits.
     */
    public void activateWithin(Activation activation, long boundaryScopeId) {
        lock.lock();
        try {
            requirePrepared(activation);
            Scope boundary = requireOpen(boundaryScopeId, "activate within");
            activation.markActive(boundaryScopeId);
            boundary.ownedActivations.add(activation);
            registry.register(activation, boundaryScopeId);
            logger.debug("Activated {} within scope {}", activation, boundaryScopeId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops an activation. Pending total instances fire with what they captured so far; everything
     * else is dropped. Later events never reach it. Deactivating twice is a no-op.
     */
    public void deactivate(Activation activation) {
        lock.lock();
        try {
            if (activation.state() != Activation.State.ACTIVE) {
                return;
            }
            for (AutomatonInstance instance : new ArrayList<>(activation.instances)) {
                if (instance.alive() && activation.kind() == ProbeKind.TOTAL) {
                    fireTotal(instance);
                }
                instance.destroy();
            }
            activation.instances.clear();
            activation.markDeactivated();
            registry.unregister(activation.id());
            Long boundary = activation.boundaryScopeId();
            if (boundary != null) {
                Scope scope = scopes.get(boundary);
                if (scope != null) {
                    scope.ownedActivations.remove(activation);
                }
            }
            activation.reportUnmatchedCalls();
            logger.debug("Deactivated {} after {} firings", activation, activation.firingCount());
            activation.complete();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deactivates everything. Used when the host shuts down.
     */
    public void deactivateAll() {
        lock.lock();
        try {
            for (ActivationRegistry.Entry entry : new ArrayList<>(registry.entries().values())) {
                deactivate(entry.activation());
            }
        } finally {
            lock.unlock();
        }
    }

    public long enter(FunctionRef function, long parentScopeId) {
        return enter(function, parentScopeId, null);
    }

    /**
     * Opens a scope for a call of {@code function}.
     *
     * @param key the call key matched by {@code f[k]}, or {@code null}
     * @return the new scope id
     */
    public long enter(FunctionRef function, long parentScopeId, Object key) {
        Objects.requireNonNull(function, "function");
        lock.lock();
        try {
            Scope parent = parentScopeId == NO_PARENT ? null : requireOpen(parentScopeId, "enter under");
            Scope scope = new Scope(scopeIds.incrementAndGet(), function, parentScopeId, key);
            scopes.put(scope.id, scope);

            List<Scope.Pending> direct = new ArrayList<>();
            List<Scope.Pending> deep = new ArrayList<>();
            List<Scope.Pending> candidates = new ArrayList<>();
            if (parent != null) {
                scope.boundaries = parent.boundariesForChildren();
                for (Scope.Pending pending : parent.directPending) {
                    if (pending.instance().alive()) {
                        candidates.add(pending);
                    }
                }
                for (Scope.Pending pending : parent.deepPending) {
                    if (pending.instance().alive()) {
                        candidates.add(pending);
                        deep.add(pending);
                    }
                }
            }
            for (Scope.Pending pending : candidates) {
                if (pending.node().matchesCall(function, key)) {
                    matchCall(pending.node(), pending.instance(), pending.frame(), scope, direct, deep);
                }
            }
            spawnRoots(registry.global(), scope, direct, deep);
            spawnRoots(scope.boundaries, scope, direct, deep);
            scope.directPending = List.copyOf(direct);
            scope.deepPending = List.copyOf(deep);

            bindLocked(scope, MetaKind.ENTER.variableName(), Boolean.TRUE, ENTER_TAGS, false);
            return scope.id;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Substitution> bind(long scopeId, String name, Object value) {
        return bind(scopeId, name, value, Set.of(), true);
    }

    /**
     * Reports that {@code name} was bound to {@code value} in a scope.
     *
     * @param overridable whether the host accepts a substituted value for this binding
     * @return the value to use instead, when an override rule applied
     */
    public Optional<Substitution> bind(long scopeId, String name, Object value, Set<String> tags, boolean overridable) {
        Objects.requireNonNull(name, "name");
        lock.lock();
        try {
            return bindLocked(requireOpen(scopeId, "bind in"), name, value, tags == null ? Set.of() : tags, overridable);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports the scope's return value and closes it. Total selectors rooted here fire.
     */
    public Optional<Substitution> exit(long scopeId, Object returnValue) {
        lock.lock();
        try {
            Scope scope = requireOpen(scopeId, "exit");
            Optional<Substitution> substitution = bindLocked(scope, MetaKind.VALUE.variableName(), returnValue, Set.of(), true);
            bindLocked(scope, MetaKind.EXIT.variableName(), Boolean.TRUE, EXIT_TAGS, false);
            close(scope);
            return substitution;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports a value produced by a generator scope without closing it.
     */
    public Optional<Substitution> yieldValue(long scopeId, Object value) {
        lock.lock();
        try {
            return bindLocked(requireOpen(scopeId, "yield in"), MetaKind.YIELD.variableName(), value, EXIT_TAGS, true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports a value sent into a generator scope.
     */
    public Optional<Substitution> receive(long scopeId, Object value) {
        lock.lock();
        try {
            return bindLocked(requireOpen(scopeId, "receive in"), MetaKind.RECEIVE.variableName(), value, ENTER_TAGS, true);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reports that the scope terminated with an error and closes it.
     */
    public void fail(long scopeId, Throwable error) {
        lock.lock();
        try {
            Scope scope = requireOpen(scopeId, "fail");
            bindLocked(scope, MetaKind.ERROR.variableName(), error, EXIT_TAGS, false);
            bindLocked(scope, MetaKind.EXIT.variableName(), Boolean.TRUE, EXIT_TAGS, false);
            close(scope);
        } finally {
            lock.unlock();
        }
    }

    private void spawnRoots(List<Activation> activations, Scope scope, List<Scope.Pending> direct, List<Scope.Pending> deep) {
        for (Activation activation : activations) {
            if (!activation.isActive()) {
                continue;
            }
            PatternNode root = activation.selector().root();
            if (!root.matchesCall(scope.function, scope.key)) {
                continue;
            }
            AutomatonInstance instance = new AutomatonInstance(activation, scope.id);
            activation.instances.add(instance);
            scope.rootedInstances.add(instance);
            matchCall(root, instance, null, scope, direct, deep);
        }
    }

    private void matchCall(PatternNode node, AutomatonInstance instance, Frame parentFrame, Scope scope,
                           List<Scope.Pending> direct, List<Scope.Pending> deep) {
        instance.activation().matched(node);
        Frame frame;
        if (parentFrame == null) {
            frame = instance.rootFrame();
        } else if (node.onFocusPath() && instance.kind() == ProbeKind.IMMEDIATE) {
            frame = new Frame(parentFrame, scope.id);
        } else {
            frame = parentFrame;
        }
        for (PatternNode child : node.children()) {
            switch (child.kind()) {
                case KEY -> {
                    if (child.captureName() != null) {
                        frame.record(child, capture(scope, child.name().text(), scope.key), false, maxPooledCaptures);
                    }
                }
                case VARIABLE, META -> scope.registrations.add(new Scope.Registration(child, instance, frame));
                case CALL -> {
                    if (child.collapse() && child.matchesCall(scope.function, scope.key)) {
                        matchCall(child, instance, frame, scope, direct, deep);
                    }
                    Scope.Pending pending = new Scope.Pending(child, instance, frame);
                    if (child.nesting() == Nesting.DIRECT) {
                        direct.add(pending);
                    } else {
                        deep.add(pending);
                    }
                }
            }
        }
    }

    private Optional<Substitution> bindLocked(Scope scope, String name, Object value, Set<String> tags, boolean overridable) {
        scope.bindings.put(name, value);
        scope.bindingTags.put(name, tags);
        if (scope.registrations.isEmpty()) {
            return Optional.empty();
        }
        Object current = value;
        Substitution applied = null;
        Activation appliedBy = null;
        boolean conflicted = false;
        for (Scope.Registration registration : new ArrayList<>(scope.registrations)) {
            AutomatonInstance instance = registration.instance();
            PatternNode node = registration.node();
            if (!instance.alive() || !node.matchesBinding(name, tags)) {
                continue;
            }
            if (node.focus() && instance.kind() == ProbeKind.IMMEDIATE) {
                Optional<Substitution> override = fireImmediate(registration, scope, name, current, overridable);
                if (override.isPresent() && !conflicted) {
                    Activation activation = instance.activation();
                    if (appliedBy != null && appliedBy != activation && policy == OverrideConflictPolicy.ERROR) {
                        logger.error("Selectors '{}' and '{}' both override '{}' in scope {}; keeping the bound value",
                            appliedBy.selector().text(), activation.selector().text(), name, scope.id);
                        conflicted = true;
                        current = value;
                        applied = null;
                    } else {
                        current = override.get().value();
                        applied = override.get();
                        appliedBy = activation;
                    }
                }
            }
            registration.frame().record(node, capture(scope, name, current),
                instance.kind() == ProbeKind.IMMEDIATE, maxPooledCaptures);
        }
        if (applied != null) {
            scope.bindings.put(name, applied.value());
        }
        return Optional.ofNullable(applied);
    }

    private Optional<Substitution> fireImmediate(Scope.Registration registration, Scope scope, String name,
                                                 Object tentativeValue, boolean overridable) {
        AutomatonInstance instance = registration.instance();
        Activation activation = instance.activation();
        PatternNode focus = registration.node();
        List<Frame> chain = registration.frame().chain();
        Capture tentative = capture(scope, name, tentativeValue);
        if (!CaptureResolver.constraintsHold(activation.selector(), activation.kind(), chain, focus, tentative)) {
            return Optional.empty();
        }
        Map<String, List<Capture>> merged = CaptureResolver.collect(activation.selector(), chain, focus, tentative);
        ResultRecord record = CaptureResolver.assemble(activation, merged, focus.exposedName(name), scope.id,
            sequence.incrementAndGet());
        activation.deliver(record);
        return OverrideGate.resolve(activation, focus, record, name, overridable);
    }

    private void fireTotal(AutomatonInstance instance) {
        Activation activation = instance.activation();
        List<Frame> chain = List.of(instance.rootFrame());
        if (!CaptureResolver.constraintsHold(activation.selector(), activation.kind(), chain, null, null)) {
            return;
        }
        Map<String, List<Capture>> merged = CaptureResolver.collect(activation.selector(), chain, null, null);
        ResultRecord record;
        try {
            record = CaptureResolver.assemble(activation, merged, null, instance.rootScopeId(), sequence.incrementAndGet());
        } catch (CardinalityConflictException ex) {
            activation.deliverError(ex);
            return;
        }
        activation.deliver(record);
    }

    private void close(Scope scope) {
        scope.open = false;
        for (AutomatonInstance instance : scope.rootedInstances) {
            if (instance.alive() && instance.kind() == ProbeKind.TOTAL) {
                fireTotal(instance);
            }
            instance.destroy();
            instance.activation().instances.remove(instance);
        }
        for (Activation activation : new ArrayList<>(scope.ownedActivations)) {
            deactivate(activation);
        }
        scope.registrations.clear();
        scope.rootedInstances.clear();
        scopes.remove(scope.id);
    }

    private Capture capture(Scope scope, String variable, Object value) {
        return new Capture(scope.id, variable, value, sequence.incrementAndGet());
    }

    private Scope requireOpen(long scopeId, String action) {
        Scope scope = scopes.get(scopeId);
        if (scope == null || !scope.open) {
            throw new EngineContractException("Cannot " + action + " scope " + scopeId + ": it is unknown or closed", scopeId);
        }
        return scope;
    }

    private static void requirePrepared(Activation activation) {
        if (activation.state() != Activation.State.PREPARED) {
            throw new IllegalStateException(activation + " cannot be activated again");
        }
    }
}
