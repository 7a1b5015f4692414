package work.lcod.probe.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.probe.automaton.CompiledSelector;
import work.lcod.probe.automaton.PatternNode;
import work.lcod.probe.selector.ProbeKind;

/**
 * Turns the captures of a frame chain into a {@link ResultRecord}.
 */
final class CaptureResolver {
    private CaptureResolver() {}

    /**
     * Captures per exposed name, ordered by recording sequence. The tentative focus capture, when
     * given, replaces earlier focus captures from the same scope.
     */
    static Map<String, List<Capture>> collect(CompiledSelector selector, List<Frame> chain, PatternNode focus, Capture tentative) {
        Map<String, List<Capture>> merged = new LinkedHashMap<>();
        for (String name : selector.staticCaptureNames()) {
            merged.put(name, new ArrayList<>());
        }
        for (Frame frame : chain) {
            for (Map.Entry<Integer, List<Capture>> entry : frame.captures().entrySet()) {
                PatternNode node = selector.node(entry.getKey());
                for (Capture capture : entry.getValue()) {
                    if (tentative != null && node == focus && capture.scopeId() == tentative.scopeId()
                        && capture.variable().equals(tentative.variable())) {
                        continue;
                    }
                    merged.computeIfAbsent(node.exposedName(capture.variable()), key -> new ArrayList<>()).add(capture);
                }
            }
        }
        if (tentative != null) {
            merged.computeIfAbsent(focus.exposedName(tentative.variable()), key -> new ArrayList<>()).add(tentative);
        }
        for (List<Capture> captures : merged.values()) {
            captures.sort(Comparator.comparingLong(Capture::sequence));
        }
        return merged;
    }

    /**
     * Whether every value-constrained variable holds acceptable values: the latest one for
     * immediate firings, all of them (and at least one) for total firings.
     */
    static boolean constraintsHold(CompiledSelector selector, ProbeKind kind, List<Frame> chain, PatternNode focus, Capture tentative) {
        for (PatternNode node : selector.nodes()) {
            if (node.expected() == null || node.kind() == PatternNode.Kind.KEY || node.isCall()) {
                continue;
            }
            List<Capture> captures = new ArrayList<>();
            for (Frame frame : chain) {
                List<Capture> logged = frame.captures().get(node.id());
                if (logged != null) {
                    for (Capture capture : logged) {
                        if (tentative == null || node != focus || capture.scopeId() != tentative.scopeId()) {
                            captures.add(capture);
                        }
                    }
                }
            }
            if (tentative != null && node == focus) {
                captures.add(tentative);
            }
            if (captures.isEmpty()) {
                return false;
            }
            if (kind == ProbeKind.IMMEDIATE) {
                Capture latest = captures.stream().max(Comparator.comparingLong(Capture::sequence)).orElseThrow();
                if (!node.expected().matches(latest.value())) {
                    return false;
                }
            } else {
                for (Capture capture : captures) {
                    if (!node.expected().matches(capture.value())) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /**
     * @throws CardinalityConflictException when a total firing in {@link ResultMode#SINGLE} finds several values
     */
    static ResultRecord assemble(Activation activation, Map<String, List<Capture>> merged, String focusName,
                                 long scopeId, long sequence) {
        String selectorId = activation.selector().text();
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, List<Capture>> entry : merged.entrySet()) {
            List<Capture> captures = entry.getValue();
            switch (activation.mode()) {
                case RAW -> values.put(entry.getKey(), List.copyOf(captures));
                case POOLED -> values.put(entry.getKey(), valuesOf(captures));
                case SINGLE -> {
                    if (captures.isEmpty()) {
                        continue;
                    }
                    if (activation.kind() == ProbeKind.TOTAL && captures.size() > 1) {
                        throw new CardinalityConflictException(selectorId, entry.getKey(), valuesOf(captures));
                    }
                    values.put(entry.getKey(), captures.get(captures.size() - 1).value());
                }
            }
        }
        return new ResultRecord(selectorId, activation.kind(), activation.mode(), focusName, values, scopeId, sequence);
    }

    private static List<Object> valuesOf(List<Capture> captures) {
        List<Object> values = new ArrayList<>(captures.size());
        for (Capture capture : captures) {
            values.add(capture.value());
        }
        return Collections.unmodifiableList(values);
    }
}
