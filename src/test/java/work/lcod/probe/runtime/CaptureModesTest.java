package work.lcod.probe.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.probe.api.EngineConfiguration;
import work.lcod.probe.api.ProbeEngine;
import work.lcod.probe.api.ProbeOptions;
import work.lcod.probe.support.HostSimulator;
import work.lcod.probe.support.Programs;

class CaptureModesTest {
    private static final String SIBLINGS = "main(x, side(x as x2), negmul(!a))";

    private static List<ResultRecord> run(ProbeEngine engine, String selector, ProbeOptions options) {
        var probe = engine.probe(selector, options);
        var records = probe.collect();
        probe.activate();
        Programs.sideEffects(new HostSimulator(engine));
        return records;
    }

    @Test
    void singleModeKeepsTheLatestSiblingValue() {
        var records = run(new ProbeEngine(), SIBLINGS, ProbeOptions.defaults());

        assertEquals(1, records.size());
        var record = records.get(0);
        assertEquals(ResultMode.SINGLE, record.mode());
        assertEquals(3L, record.get("x"));
        assertEquals(6L, record.get("x2"));
        assertEquals(28L, record.focusValue());
    }

    @Test
    void rawModeKeepsEveryCaptureWithItsScope() {
        var records = run(new ProbeEngine(), SIBLINGS, ProbeOptions.mode(ResultMode.RAW));

        var record = records.get(0);
        @SuppressWarnings("unchecked")
        var captures = (List<Capture>) record.get("x2");
        assertEquals(2, captures.size());
        assertEquals(List.of(3L, 6L), record.all("x2"));
        assertEquals("x", captures.get(0).variable());
        assertNotEquals(captures.get(0).scopeId(), captures.get(1).scopeId());
        assertTrue(captures.get(0).sequence() < captures.get(1).sequence());
        assertEquals(28L, record.focusValue());
    }

    @Test
    void pooledModeListsValues() {
        var records = run(new ProbeEngine(), SIBLINGS, ProbeOptions.mode(ResultMode.POOLED));

        var record = records.get(0);
        assertEquals(List.of(3L), record.get("x"));
        assertEquals(List.of(3L, 6L), record.get("x2"));
        assertEquals(List.of(28L), record.get("a"));
    }

    @Test
    void totalSingleModeReportsCardinalityConflicts() {
        var engine = new ProbeEngine();
        var probe = engine.probe("main{x, side{x as x2}}", ProbeOptions.mode(ResultMode.SINGLE));
        var results = new ArrayList<ResultRecord>();
        var errors = new ArrayList<Throwable>();
        probe.subscribe(new ResultListener() {
            @Override
            public void onResult(ResultRecord record) {
                results.add(record);
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        }).activate();

        Programs.sideEffects(new HostSimulator(engine));

        assertTrue(results.isEmpty());
        assertEquals(1, errors.size());
        var conflict = assertInstanceOf(CardinalityConflictException.class, errors.get(0));
        assertEquals("x2", conflict.captureName());
        assertEquals(List.of(3L, 6L), conflict.values());
        assertEquals("cardinality_conflict", conflict.code());
    }

    @Test
    void totalSingleModeWithOneValuePerName() {
        var records = run(new ProbeEngine(), "main{x, negmul{a}}", ProbeOptions.mode(ResultMode.SINGLE));

        assertEquals(1, records.size());
        assertEquals(3L, records.get(0).get("x"));
        assertEquals(28L, records.get(0).get("a"));
    }

    @Test
    void pooledCapturesAreBoundedWhenConfigured() {
        var engine = new ProbeEngine(EngineConfiguration.builder().maxPooledCaptures(1).build());
        var records = run(engine, SIBLINGS, ProbeOptions.mode(ResultMode.POOLED));

        assertEquals(List.of(6L), records.get(0).get("x2"));
    }

    @Test
    void recordsSerializeToJson() {
        var records = run(new ProbeEngine(), SIBLINGS, ProbeOptions.defaults());

        var json = records.get(0).toPrettyJson();
        assertTrue(json.contains("\"selector\" : \"" + SIBLINGS + "\""), json);
        assertTrue(json.contains("\"x2\" : 6"), json);
        assertEquals("immediate", records.get(0).toSerializableMap().get("kind"));
    }
}
