package work.lcod.probe.support;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.probe.api.ProbeEngine;
import work.lcod.probe.automaton.FunctionRef;
import work.lcod.probe.runtime.ScopeTracker;
import work.lcod.probe.runtime.Substitution;

/**
 * Plays the instrumented host in tests: runs nested "functions" written as lambdas and reports
 * their enters, bindings and exits to an engine, applying substituted values like a real host would.
 */
public final class HostSimulator {
    private final ProbeEngine engine;

    public HostSimulator(ProbeEngine engine) {
        this.engine = engine;
    }

    /**
     * Calls a top-level function. {@code args} alternates names and values and is bound in order.
     */
    public Object call(String function, Body body, Object... args) {
        return invoke(ScopeTracker.NO_PARENT, FunctionRef.of(function), null, body, args);
    }

    private Object invoke(long parentId, FunctionRef function, Object key, Body body, Object... args) {
        long scopeId = engine.enter(function, parentId, key);
        var frame = new Frame(scopeId);
        for (int i = 0; i < args.length; i += 2) {
            frame.set((String) args[i], args[i + 1]);
        }
        Object result;
        try {
            result = body.run(frame);
        } catch (RuntimeException ex) {
            engine.fail(scopeId, ex);
            throw ex;
        }
        return engine.exit(scopeId, result).map(Substitution::value).orElse(result);
    }

    @FunctionalInterface
    public interface Body {
        Object run(Frame frame);
    }

    /**
     * Local state of one simulated call.
     */
    public final class Frame {
        private final long scopeId;
        private final Map<String, Object> locals = new LinkedHashMap<>();

        Frame(long scopeId) {
            this.scopeId = scopeId;
        }

        public long scopeId() {
            return scopeId;
        }

        /**
         * Binds a local and returns the value the host continues with.
         */
        public Object set(String name, Object value) {
            Object effective = engine.bind(scopeId, name, value).map(Substitution::value).orElse(value);
            locals.put(name, effective);
            return effective;
        }

        public Object get(String name) {
            return locals.get(name);
        }

        public long getLong(String name) {
            return ((Number) locals.get(name)).longValue();
        }

        public Object call(String function, Body body, Object... args) {
            return invoke(scopeId, FunctionRef.of(function), null, body, args);
        }

        public Object callKeyed(String function, Object key, Body body, Object... args) {
            return invoke(scopeId, FunctionRef.of(function), key, body, args);
        }

        public Object yieldValue(Object value) {
            return engine.yieldValue(scopeId, value).map(Substitution::value).orElse(value);
        }
    }
}
