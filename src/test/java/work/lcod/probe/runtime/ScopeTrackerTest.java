package work.lcod.probe.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.probe.api.ProbeEngine;
import work.lcod.probe.automaton.FunctionRef;
import work.lcod.probe.support.HostSimulator;
import work.lcod.probe.support.Programs;

class ScopeTrackerTest {
    private final ProbeEngine engine = new ProbeEngine();
    private final HostSimulator host = new HostSimulator(engine);

    private List<ResultRecord> tap(String selector) {
        var probe = engine.probe(selector);
        var records = probe.collect();
        probe.activate();
        return records;
    }

    private static List<Map<String, Object>> values(List<ResultRecord> records) {
        var out = new ArrayList<Map<String, Object>>();
        for (ResultRecord record : records) {
            out.add(record.values());
        }
        return out;
    }

    @Test
    void directNestingRequiresAnImmediateChild() {
        var direct = tap("f > h > y");
        var deep = tap("f >> h > y");
        var middle = tap("g > h > y");

        Programs.nested(host, 5L);

        assertEquals(0, direct.size());
        assertEquals(1, deep.size());
        assertEquals(5L, deep.get(0).get("y"));
        assertEquals(1, middle.size());
    }

    @Test
    void deepVariableAlsoMatchesAtDepthZero() {
        var deep = tap("f >> y");
        var direct = tap("f > y");

        host.call("f", f -> {
            f.set("y", 1L);
            return f.call("g", g -> g.set("y", 2L));
        });

        assertEquals(List.of(1L, 2L), deep.stream().map(ResultRecord::focusValue).toList());
        assertEquals(List.of(1L), direct.stream().map(ResultRecord::focusValue).toList());
    }

    @Test
    void focusFiresOncePerBindingWithLatestContext() {
        var records = tap("fact(i, !curr)");

        assertEquals(6L, Programs.fact(host, 3));

        assertEquals(List.of(
            Map.of("curr", 1L),
            Map.of("curr", 1L, "i", 0L),
            Map.of("curr", 2L, "i", 1L),
            Map.of("curr", 6L, "i", 2L)
        ), values(records));
        assertEquals("curr", records.get(0).focusName());
    }

    @Test
    void recursiveCallsGetIndependentInstances() {
        var records = tap("rec{n}");

        host.call("rec", new HostSimulator.Body() {
            @Override
            public Object run(HostSimulator.Frame frame) {
                long n = frame.getLong("n");
                return n == 0 ? 0L : frame.call("rec", this, "n", n - 1);
            }
        }, "n", 3L);

        assertEquals(List.of(List.of(0L), List.of(1L), List.of(2L), List.of(3L)),
            records.stream().map(record -> record.get("n")).toList());
    }

    @Test
    void totalSelectorFiresOnceWithEveryCaptureName() {
        var records = tap("main{x, missing, side{x as sx}}");

        Programs.sideEffects(host);

        assertEquals(1, records.size());
        var record = records.get(0);
        assertEquals(List.of(3L), record.get("x"));
        assertEquals(List.of(3L, 6L), record.get("sx"));
        assertEquals(List.of(), record.get("missing"));
        assertEquals(ResultMode.POOLED, record.mode());
    }

    @Test
    void metaVariablesReportReturnsAndYields() {
        var returns = tap("side > #value as out");
        var yields = tap("gen > #yield");
        var entered = tap("side{!#enter}");

        Programs.sideEffects(host);
        host.call("gen", frame -> {
            frame.yieldValue("a");
            frame.yieldValue("b");
            return null;
        });

        assertEquals(List.of(4L, 7L), returns.stream().map(record -> record.get("out")).toList());
        assertEquals(List.of("a", "b"), yields.stream().map(ResultRecord::focusValue).toList());
        assertEquals(2, entered.size());
        assertEquals(Boolean.TRUE, entered.get(0).get("#enter"));
    }

    @Test
    void failingScopeReportsItsError() {
        var records = tap("boom{#error as err}");

        var thrown = assertThrows(IllegalStateException.class, () -> host.call("boom", frame -> {
            throw new IllegalStateException("broken");
        }));

        assertEquals(1, records.size());
        assertEquals(List.of(thrown), records.get(0).get("err"));
    }

    @Test
    void valueConstraintsGateFirings() {
        var records = tap("fact{i=1, !curr}");

        Programs.fact(host, 3);

        assertEquals(List.of(Map.of("i", 1L, "curr", 2L)), values(records));
    }

    @Test
    void nonFiniteValuesFailConstraintsWithoutReachingTheHost() {
        var records = tap("f{x=1, !y}");
        var total = tap("f{x=1, y}");
        var tracker = engine.tracker();

        long scope = tracker.enter(FunctionRef.of("f"), ScopeTracker.NO_PARENT);
        tracker.bind(scope, "x", Double.NaN);
        tracker.bind(scope, "y", 2L);
        tracker.bind(scope, "x", Double.POSITIVE_INFINITY);
        tracker.bind(scope, "y", 3L);
        tracker.bind(scope, "x", 1.0f);
        tracker.bind(scope, "y", 4L);
        tracker.exit(scope, null);

        assertEquals(List.of(Map.of("x", 1.0f, "y", 4L)), values(records));
        assertTrue(total.isEmpty());
        assertFalse(tracker.isOpen(scope));
    }

    @Test
    void openScopesAreReported() {
        var tracker = engine.tracker();

        long scope = tracker.enter(FunctionRef.of("f"), ScopeTracker.NO_PARENT);
        assertTrue(tracker.isOpen(scope));
        tracker.exit(scope, null);

        assertFalse(tracker.isOpen(scope));
        assertFalse(tracker.isOpen(scope + 100));
    }

    @Test
    void callKeysSelectAndCapture() {
        var second = tap("step[2] > loss");
        var keyed = tap("step[$k] > loss");

        host.call("train", train -> {
            for (long k = 1; k <= 3; k++) {
                long key = k;
                train.callKeyed("step", key, step -> step.set("loss", key * 10));
            }
            return null;
        });

        assertEquals(List.of(20L), second.stream().map(ResultRecord::focusValue).toList());
        assertEquals(List.of(1L, 2L, 3L), keyed.stream().map(record -> record.get("k")).toList());
    }

    @Test
    void genericCaptureUsesActualVariableNames() {
        var records = tap("side{*}");

        Programs.sideEffects(host);

        assertEquals(2, records.size());
        assertEquals(List.of(3L), records.get(0).get("x"));
        assertFalse(records.get(0).has("#enter"));
    }

    @Test
    void scopedActivationEndsWithItsBoundary() {
        var probe = engine.probe("inner > v");
        var records = probe.collect();

        host.call("outer", outer -> {
            outer.call("inner", inner -> null, "v", 1L);
            probe.activateWithin(outer.scopeId());
            outer.call("inner", inner -> null, "v", 2L);
            return null;
        });
        host.call("inner", inner -> null, "v", 3L);

        assertEquals(List.of(2L), records.stream().map(ResultRecord::focusValue).toList());
        assertFalse(probe.isActive());
    }

    @Test
    void deactivationMidRunFinalizesTotalsAndIgnoresLaterEvents() {
        var probe = engine.probe("main{x, side{x as sx}}");
        var records = probe.collect();
        var completed = new ArrayList<Boolean>();
        probe.subscribe(new ResultListener() {
            @Override
            public void onResult(ResultRecord record) {
            }

            @Override
            public void onComplete() {
                completed.add(true);
            }
        });
        probe.activate();

        host.call("main", main -> {
            main.call("side", side -> 0L, "x", 3L);
            probe.deactivate();
            main.call("side", side -> 0L, "x", 6L);
            return null;
        }, "x", 1L);

        assertEquals(1, records.size());
        assertEquals(List.of(3L), records.get(0).get("sx"));
        assertEquals(List.of(true), completed);
        assertEquals(0, engine.tracker().openScopeCount());
    }

    @Test
    void contractViolationsAreFatal() {
        var tracker = engine.tracker();
        long scope = tracker.enter(FunctionRef.of("f"), ScopeTracker.NO_PARENT);
        tracker.exit(scope, null);

        var ex = assertThrows(EngineContractException.class, () -> tracker.bind(scope, "x", 1));
        assertEquals("engine_contract", ex.code());
        assertEquals(scope, ex.scopeId());
        assertThrows(EngineContractException.class, () -> tracker.exit(scope, null));
        assertThrows(EngineContractException.class, () -> tracker.enter(FunctionRef.of("g"), scope));
        assertThrows(EngineContractException.class, () -> tracker.bind(999L, "x", 1));
    }

    @Test
    void activationCannotBeReused() {
        var probe = engine.probe("f > x").activate();
        probe.deactivate();
        assertThrows(IllegalStateException.class, probe::activate);
        assertFalse(probe.isActive());
    }

    @Test
    void unknownFunctionsMatchOnlyWildcards() {
        var named = tap("f > x");
        var any = tap("* > x");
        var tracker = engine.tracker();

        long scope = tracker.enter(FunctionRef.UNKNOWN, ScopeTracker.NO_PARENT);
        tracker.bind(scope, "x", 1);
        tracker.exit(scope, null);

        assertTrue(named.isEmpty());
        assertEquals(1, any.size());
        assertEquals(1, any.get(0).focusValue());
    }
}
