package org.netpreserve.crawlguard;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.crawlguard.config.GuardConfig;
import org.netpreserve.crawlguard.util.Json;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Command line entry point for inspecting the configuration and persisted state of a data directory.
 */
public class CrawlGuard {

    public static void main(String[] args) throws Exception {
        Path dataDir = Path.of("data");
        boolean dumpConfig = false;
        boolean stats = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--dump-config" -> dumpConfig = true;
                case "--stats" -> stats = true;
                case "--data-dir", "-d" -> {
                    if (i + 1 >= args.length) {
                        System.err.println("Missing value for " + args[i]);
                        System.exit(1);
                    }
                    dataDir = Path.of(args[++i]);
                }
                case "--help", "-h" -> {
                    System.out.println("Usage: crawlguard [options]");
                    System.out.println("Options:");
                    System.out.println("  -d, --data-dir DIR       Directory holding config.yaml and stored state");
                    System.out.println("      --dump-config        Print the effective configuration");
                    System.out.println("      --stats              Print cache and selector library statistics");
                    System.out.println("  -h, --help");
                    System.exit(0);
                }
                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    System.exit(1);
                }
            }
        }

        GuardConfig config = loadConfig(dataDir);
        if (dumpConfig) {
            System.out.println(yamlMapper().writerWithDefaultPrettyPrinter().writeValueAsString(config));
        }
        if (stats) {
            try (var session = GuardSession.open(dataDir, config)) {
                System.out.println(Json.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(session.stats()));
            }
        }
        if (!dumpConfig && !stats) {
            System.err.println("Nothing to do, see --help");
            System.exit(1);
        }
    }

    /**
     * Reads the bundled defaults and merges {@code <dataDir>/config.yaml} over them if it exists.
     */
    public static GuardConfig loadConfig(Path dataDir) throws IOException {
        var mapper = yamlMapper();
        JsonNode configTree;
        try (InputStream stream = Objects.requireNonNull(CrawlGuard.class.getResourceAsStream("config/defaults.yaml"),
                "missing config/defaults.yaml")) {
            configTree = mapper.readTree(stream);
        }
        Path configFile = dataDir.resolve("config.yaml");
        if (Files.exists(configFile)) {
            JsonNode override = mapper.readTree(configFile.toFile());
            if (override != null && !override.isMissingNode() && !override.isNull()) {
                configTree = deepMerge(configTree, override);
            }
        }
        return mapper.treeToValue(configTree, GuardConfig.class);
    }

    private static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and arrays are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
