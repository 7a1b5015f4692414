package work.lcod.probe.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.probe.automaton.CompiledSelector;
import work.lcod.probe.automaton.FunctionRef;
import work.lcod.probe.automaton.SelectorCompiler;
import work.lcod.probe.manifest.FunctionManifestLoader;
import work.lcod.probe.manifest.ManifestCatalog;
import work.lcod.probe.runtime.Activation;
import work.lcod.probe.runtime.ScopeTracker;
import work.lcod.probe.runtime.Substitution;

/**
 * Public entry point: creates probes from selector text and receives the host's scope and binding events.
 *
 * <p>Closing the engine deactivates every probe, so pending total selectors report what they captured.</p>
 */
public final class ProbeEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ProbeEngine.class);

    private final EngineConfiguration configuration;
    private final ScopeTracker tracker;
    private final SelectorCompiler compiler = new SelectorCompiler();
    private final ManifestCatalog catalog;

    public ProbeEngine() {
        this(EngineConfiguration.defaults());
    }

    public ProbeEngine(EngineConfiguration configuration) {
        this(configuration, ManifestCatalog.empty());
    }

    /**
     * Manifests listed in the configuration are added to the given catalog.
     */
    public ProbeEngine(EngineConfiguration configuration, ManifestCatalog catalog) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        for (Path manifest : configuration.manifests()) {
            catalog.registerAll(FunctionManifestLoader.load(manifest));
        }
        this.tracker = new ScopeTracker(configuration.overrideConflictPolicy(), configuration.maxPooledCaptures(),
            configuration.fairLock());
    }

    public static ProbeEngine fromConfigFile(Path configPath) {
        return new ProbeEngine(EngineConfigurationLoader.load(configPath));
    }

    public EngineConfiguration configuration() {
        return configuration;
    }

    public ScopeTracker tracker() {
        return tracker;
    }

    public SelectorCompiler compiler() {
        return compiler;
    }

    public ManifestCatalog catalog() {
        return catalog;
    }

    /**
     * Parses and compiles selector text (one or more {@code ;}-separated selectors) into an inactive probe.
     *
     * @throws work.lcod.probe.selector.SelectorException when the text is malformed
     */
    public Probe probe(String selectorText) {
        return probe(selectorText, ProbeOptions.defaults());
    }

    public Probe probe(String selectorText, ProbeOptions options) {
        Objects.requireNonNull(options, "options");
        var activations = new ArrayList<Activation>();
        var unresolved = new ArrayList<String>();
        for (CompiledSelector selector : compiler.compileAll(selectorText)) {
            activations.add(tracker.prepare(selector, options.kind(), options.mode()));
            unresolved.addAll(catalog.check(selector));
        }
        if (activations.isEmpty()) {
            throw new IllegalArgumentException("No selector in '" + selectorText + "'");
        }
        logger.debug("Created probe for {} selector(s) from '{}'", activations.size(), selectorText);
        return new Probe(tracker, activations, unresolved, configuration.warnOnUnresolved());
    }

    public Overlay overlay() {
        return new Overlay(this);
    }

    public long enter(FunctionRef function, long parentScopeId) {
        return tracker.enter(function, parentScopeId);
    }

    public long enter(FunctionRef function, long parentScopeId, Object key) {
        return tracker.enter(function, parentScopeId, key);
    }

    public Optional<Substitution> bind(long scopeId, String name, Object value) {
        return tracker.bind(scopeId, name, value);
    }

    public Optional<Substitution> bind(long scopeId, String name, Object value, Set<String> tags, boolean overridable) {
        return tracker.bind(scopeId, name, value, tags, overridable);
    }

    public Optional<Substitution> exit(long scopeId, Object returnValue) {
        return tracker.exit(scopeId, returnValue);
    }

    public Optional<Substitution> yieldValue(long scopeId, Object value) {
        return tracker.yieldValue(scopeId, value);
    }

    public Optional<Substitution> receive(long scopeId, Object value) {
        return tracker.receive(scopeId, value);
    }

    public void fail(long scopeId, Throwable error) {
        tracker.fail(scopeId, error);
    }

    @Override
    public void close() {
        tracker.deactivateAll();
    }

    /**
     * Deactivates every probe when the JVM exits.
     */
    public ProbeEngine closeOnShutdown() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::close, "lcod-probe-shutdown"));
        return this;
    }
}
