package work.lcod.probe.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.probe.automaton.FunctionRef;
import work.lcod.probe.manifest.FunctionManifest;
import work.lcod.probe.manifest.ManifestCatalog;
import work.lcod.probe.runtime.ResultListener;
import work.lcod.probe.runtime.ResultMode;
import work.lcod.probe.runtime.ResultRecord;
import work.lcod.probe.runtime.ScopeTracker;
import work.lcod.probe.selector.ProbeKind;
import work.lcod.probe.selector.SelectorSyntaxException;
import work.lcod.probe.support.HostSimulator;
import work.lcod.probe.support.Programs;

class ProbeEngineTest {
    private final ProbeEngine engine = new ProbeEngine();
    private final HostSimulator host = new HostSimulator(engine);

    @Test
    void oneProbeCanHoldSeveralSelectors() {
        var probe = engine.probe("fact > i; fact > !curr");
        var records = probe.collect();
        probe.activate();

        assertEquals(6L, Programs.fact(host, 3));

        assertEquals(List.of("fact > i", "fact > !curr"), probe.selectorTexts());
        assertEquals(7, records.size());
        assertEquals(7, probe.firingCount());
        assertTrue(probe.isActive());
    }

    @Test
    void closingTheEngineFiresPendingTotals() {
        var completed = new ArrayList<String>();
        var records = new ArrayList<ResultRecord>();
        var probe = engine.probe("main{x, first}").subscribe(new ResultListener() {
            @Override
            public void onResult(ResultRecord record) {
                records.add(record);
            }

            @Override
            public void onComplete() {
                completed.add("main");
            }
        }).activate();

        long scope = engine.enter(FunctionRef.of("main"), ScopeTracker.NO_PARENT);
        engine.bind(scope, "x", 3L);
        engine.close();

        assertEquals(1, records.size());
        assertEquals(List.of(3L), records.get(0).get("x"));
        assertEquals(List.of(), records.get(0).get("first"));
        assertEquals(List.of("main"), completed);
        assertFalse(probe.isActive());
    }

    @Test
    void kindCanBeForced() {
        var probe = engine.probe("fact > curr", ProbeOptions.defaults().withKind(ProbeKind.TOTAL));
        var records = probe.collect();
        probe.activate();

        Programs.fact(host, 3);

        assertEquals(1, records.size());
        assertEquals(ResultMode.POOLED, records.get(0).mode());
        assertEquals(List.of(1L, 1L, 2L, 6L), records.get(0).get("curr"));
    }

    @Test
    void forcingImmediateNeedsAFocus() {
        assertThrows(IllegalArgumentException.class,
            () -> engine.probe("f{x, y}", ProbeOptions.defaults().withKind(ProbeKind.IMMEDIATE)));
    }

    @Test
    void malformedSelectorsFailAtCreation() {
        var ex = assertThrows(SelectorSyntaxException.class, () -> engine.probe("f{x, y"));
        assertEquals("f{x, y", ex.source());
    }

    @Test
    void callsThatNeverMatchedAreReported() {
        var probe = engine.probe("nothere > x").activate();

        Programs.fact(host, 2);
        probe.deactivate();

        assertEquals(List.of("nothere"), probe.activations().get(0).unmatchedCalls());
        assertTrue(probe.diagnostics().get(0).contains("never matched"), probe.diagnostics().toString());
    }

    @Test
    void selectorsAreCheckedAgainstKnownFunctions() {
        var catalog = ManifestCatalog.empty()
            .register(new FunctionManifest("fact", null, List.of("n", "i", "curr"), List.of()));
        var checked = new ProbeEngine(EngineConfiguration.defaults(), catalog);

        var unknown = checked.probe("nope > x");
        var undeclared = checked.probe("fact{zzz, !curr}");
        var fine = checked.probe("fact{i, !curr}");

        assertEquals(List.of("Unknown function 'nope' in selector 'nope > x'"), unknown.diagnostics());
        assertEquals(1, undeclared.diagnostics().size());
        assertTrue(undeclared.diagnostics().get(0).startsWith("Variable 'zzz' is not declared by 'fact'"));
        assertTrue(fine.diagnostics().isEmpty());
    }

    @Test
    void failingListenerIsToldAndOthersStillReceive() {
        var errors = new ArrayList<Throwable>();
        var probe = engine.probe("fact > !curr").subscribe(new ResultListener() {
            @Override
            public void onResult(ResultRecord record) {
                throw new IllegalStateException("listener broke");
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        var records = probe.collect();
        probe.activate();

        assertEquals(2L, Programs.fact(host, 2));

        assertEquals(3, records.size());
        assertEquals(3, errors.size());
        assertEquals("listener broke", errors.get(0).getMessage());
    }

    @Test
    void unsubscribedListenersStopReceiving() {
        var records = new ArrayList<ResultRecord>();
        ResultListener listener = records::add;
        var probe = engine.probe("fact > !curr").subscribe(listener).activate();

        Programs.fact(host, 1);
        probe.unsubscribe(listener);
        Programs.fact(host, 1);

        assertEquals(2, records.size());
        assertEquals(4, probe.firingCount());
    }
}
