package work.lcod.probe.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.probe.automaton.FunctionRef;
import work.lcod.probe.automaton.PatternNode;

/**
 * Tracker-side state of one function invocation. Only touched under the tracker lock.
 */
final class Scope {
    final long id;
    final FunctionRef function;
    final long parentId;
    final Object key;
    final Map<String, Object> bindings = new LinkedHashMap<>();
    final Map<String, Set<String>> bindingTags = new LinkedHashMap<>();
    final List<Registration> registrations = new ArrayList<>();
    final List<AutomatonInstance> rootedInstances = new ArrayList<>();
    final List<Activation> ownedActivations = new ArrayList<>();
    List<Pending> directPending = List.of();
    List<Pending> deepPending = List.of();
    List<Activation> boundaries = List.of();
    boolean open = true;

    Scope(long id, FunctionRef function, long parentId, Object key) {
        this.id = id;
        this.function = function;
        this.parentId = parentId;
        this.key = key;
    }

    /**
     * Scoped activations whose boundary encloses this scope's children.
     */
    List<Activation> boundariesForChildren() {
        if (ownedActivations.isEmpty()) {
            return boundaries;
        }
        List<Activation> all = new ArrayList<>(boundaries);
        all.addAll(ownedActivations);
        return List.copyOf(all);
    }

    /**
     * A call node waiting to be matched by a descendant scope.
     */
    record Pending(PatternNode node, AutomatonInstance instance, Frame frame) {}

    /**
     * A variable node listening for bindings in this scope.
     */
    record Registration(PatternNode node, AutomatonInstance instance, Frame frame) {}
}
