package work.lcod.probe.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import work.lcod.probe.automaton.CompiledSelector;
import work.lcod.probe.automaton.PatternNode;

/**
 * Known instrumented functions. Checks selectors against them and reports references that cannot
 * match anything. An empty catalog reports nothing.
 */
public final class ManifestCatalog {
    private final List<FunctionManifest> manifests = new CopyOnWriteArrayList<>();

    public static ManifestCatalog empty() {
        return new ManifestCatalog();
    }

    public ManifestCatalog register(FunctionManifest manifest) {
        manifests.add(manifest);
        return this;
    }

    public ManifestCatalog registerAll(List<FunctionManifest> more) {
        manifests.addAll(more);
        return this;
    }

    public List<FunctionManifest> manifests() {
        return List.copyOf(manifests);
    }

    public boolean isEmpty() {
        return manifests.isEmpty();
    }

    /**
     * Unresolved references of a selector: named calls matching no known function, and plain
     * variables that none of the matching functions declares.
     */
    public List<String> check(CompiledSelector selector) {
        List<String> diagnostics = new ArrayList<>();
        if (manifests.isEmpty()) {
            return diagnostics;
        }
        for (PatternNode call : selector.namedCalls()) {
            List<FunctionManifest> candidates = new ArrayList<>();
            for (FunctionManifest manifest : manifests) {
                if (call.matchesName(manifest.toFunctionRef())) {
                    candidates.add(manifest);
                }
            }
            if (candidates.isEmpty()) {
                diagnostics.add("Unknown function '" + call.name().text() + "' in selector '" + selector.text() + "'");
                continue;
            }
            for (PatternNode child : call.children()) {
                if (child.kind() != PatternNode.Kind.VARIABLE || child.generic()) {
                    continue;
                }
                String variable = child.name().text();
                boolean declared = candidates.stream().anyMatch(manifest -> manifest.declares(variable));
                if (!declared) {
                    diagnostics.add("Variable '" + variable + "' is not declared by '" + call.name().text()
                        + "' in selector '" + selector.text() + "'");
                }
            }
        }
        return diagnostics;
    }
}
