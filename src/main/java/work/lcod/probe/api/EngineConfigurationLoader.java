package work.lcod.probe.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.probe.runtime.OverrideConflictPolicy;

/**
 * Reads an {@link EngineConfiguration} from the {@code [engine]} table of a TOML file. Missing keys
 * keep their defaults; relative manifest paths resolve against the file's directory.
 *
 * <pre>
 * [engine]
 * override_conflict_policy = "error"
 * max_pooled_captures = 100
 * warn_on_unresolved = true
 * fair_lock = false
 * manifests = ["functions.toml"]
 * </pre>
 */
public final class EngineConfigurationLoader {
    private EngineConfigurationLoader() {}

    public static EngineConfiguration load(Path configPath) {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            throw new IllegalArgumentException("Engine configuration not found: " + configPath);
        }
        try {
            Path base = configPath.toAbsolutePath().getParent();
            return parse(Files.readString(configPath), base);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read engine configuration " + configPath, ex);
        }
    }

    public static EngineConfiguration parse(String toml, Path baseDirectory) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid engine configuration: " + result.errors().get(0).toString());
        }
        return fromToml(result, baseDirectory);
    }

    public static EngineConfiguration fromToml(TomlParseResult result, Path baseDirectory) {
        EngineConfiguration.Builder builder = EngineConfiguration.builder();
        TomlTable engine = result == null ? null : result.getTable("engine");
        if (engine == null) {
            return builder.build();
        }
        String policy = engine.getString("override_conflict_policy");
        if (policy != null) {
            builder.overrideConflictPolicy(parsePolicy(policy));
        }
        Long maxPooled = engine.getLong("max_pooled_captures");
        if (maxPooled != null) {
            builder.maxPooledCaptures(Math.toIntExact(maxPooled));
        }
        Boolean warn = engine.getBoolean("warn_on_unresolved");
        if (warn != null) {
            builder.warnOnUnresolved(warn);
        }
        Boolean fair = engine.getBoolean("fair_lock");
        if (fair != null) {
            builder.fairLock(fair);
        }
        TomlArray manifests = engine.getArray("manifests");
        if (manifests != null) {
            List<Path> paths = new ArrayList<>();
            for (int i = 0; i < manifests.size(); i++) {
                Path path = Path.of(manifests.getString(i));
                paths.add(path.isAbsolute() || baseDirectory == null ? path : baseDirectory.resolve(path).normalize());
            }
            builder.manifests(paths);
        }
        return builder.build();
    }

    private static OverrideConflictPolicy parsePolicy(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return OverrideConflictPolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown override_conflict_policy '" + value + "'", ex);
        }
    }
}
