package work.lcod.probe.manifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link FunctionManifest}s from TOML. Each {@code [functions.<name>]} table describes one
 * function; {@code <name>} is its qualified name unless {@code qualified_name} says otherwise.
 *
 * <pre>
 * [functions.fact]
 * path = "/demo.math/fact"
 * variables = ["n", "i", "curr"]
 * tags = ["math"]
 * </pre>
 */
public final class FunctionManifestLoader {
    private static final Logger logger = LoggerFactory.getLogger(FunctionManifestLoader.class);

    private FunctionManifestLoader() {}

    public static List<FunctionManifest> load(Path manifestPath) {
        if (manifestPath == null || !Files.isRegularFile(manifestPath)) {
            logger.warn("Function manifest {} not found", manifestPath);
            return List.of();
        }
        try {
            return parse(Files.readString(manifestPath), manifestPath.toString());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read function manifest " + manifestPath, ex);
        }
    }

    public static List<FunctionManifest> parse(String toml, String origin) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid function manifest " + origin + ": " + result.errors().get(0).toString());
        }
        return fromToml(result);
    }

    public static List<FunctionManifest> fromToml(TomlParseResult result) {
        if (result == null) {
            return List.of();
        }
        TomlTable functions = result.getTable("functions");
        if (functions == null || functions.isEmpty()) {
            return List.of();
        }
        List<FunctionManifest> manifests = new ArrayList<>();
        for (String key : functions.keySet()) {
            TomlTable table = functions.getTable(List.of(key));
            if (table == null) {
                continue;
            }
            String qualifiedName = table.getString("qualified_name");
            manifests.add(new FunctionManifest(
                qualifiedName == null ? key : qualifiedName,
                table.getString("path"),
                readStrings(table.getArray("variables")),
                readStrings(table.getArray("tags"))
            ));
        }
        return manifests;
    }

    private static List<String> readStrings(TomlArray array) {
        if (array == null || array.isEmpty()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
