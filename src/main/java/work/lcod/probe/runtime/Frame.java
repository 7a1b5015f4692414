package work.lcod.probe.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.automaton.PatternNode;

/**
 * Captures logged for one matched invocation of a call on the focus path. Frames chain to their
 * parent so a firing sees the captures of every enclosing matched call, and siblings share the
 * parent's frame without seeing each other's focus-path captures.
 */
final class Frame {
    private static final Logger logger = LoggerFactory.getLogger(Frame.class);

    private final Frame parent;
    private final long anchorScopeId;
    private final Map<Integer, List<Capture>> captures = new LinkedHashMap<>();

    Frame(Frame parent, long anchorScopeId) {
        this.parent = parent;
        this.anchorScopeId = anchorScopeId;
    }

    Frame parent() {
        return parent;
    }

    long anchorScopeId() {
        return anchorScopeId;
    }

    /**
     * @param replaceSameScope keep only the latest capture per scope and variable
     * @param maxPooled oldest captures beyond this count are dropped; {@code 0} keeps everything
     */
    void record(PatternNode node, Capture capture, boolean replaceSameScope, int maxPooled) {
        List<Capture> list = captures.computeIfAbsent(node.id(), id -> new ArrayList<>());
        if (replaceSameScope) {
            list.removeIf(existing -> existing.scopeId() == capture.scopeId() && existing.variable().equals(capture.variable()));
        }
        list.add(capture);
        if (maxPooled > 0) {
            while (list.size() > maxPooled) {
                Capture dropped = list.remove(0);
                logger.warn("Dropped capture of '{}' from scope {}: more than {} captures pooled", dropped.variable(),
                    dropped.scopeId(), maxPooled);
            }
        }
    }

    Map<Integer, List<Capture>> captures() {
        return captures;
    }

    /**
     * Frames from the instance root down to this one.
     */
    List<Frame> chain() {
        Deque<Frame> chain = new ArrayDeque<>();
        for (Frame frame = this; frame != null; frame = frame.parent) {
            chain.addFirst(frame);
        }
        return new ArrayList<>(chain);
    }
}
