package io.mydata.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link MyDataConfig} from a YAML file with optional environment variable overlay.
 *
 * <pre>
 * schema:
 *   catalog: schemas/catalog.yaml
 * markup:
 *   indent: true
 *   xml-declaration: false
 * </pre>
 *
 * <p>A relative {@code schema.catalog} is resolved against the directory of the configuration
 * file.
 *
 * <p>Environment variables take precedence over YAML values: {@code MYDATA_SCHEMA_CATALOG},
 * {@code MYDATA_MARKUP_INDENT}, {@code MYDATA_MARKUP_XML_DECLARATION}. A variable counts as set
 * only if it is defined and its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    static final String ENV_SCHEMA_CATALOG = "MYDATA_SCHEMA_CATALOG";
    static final String ENV_MARKUP_INDENT = "MYDATA_MARKUP_INDENT";
    static final String ENV_MARKUP_XML_DECLARATION = "MYDATA_MARKUP_XML_DECLARATION";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying environment variable overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static MyDataConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying environment variable overrides from
     * the supplied lookup function. Returning {@code null} from the lookup means the variable is
     * not defined.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static MyDataConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, configPath.toAbsolutePath().getParent(), envLookup);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
    }

    private static MyDataConfig mapToConfig(JsonNode root, Path baseDir, Function<String, String> envLookup) {
        MyDataConfig.Builder builder = MyDataConfig.builder();
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }

        // --- YAML mapping ---

        JsonNode schema = root.path("schema");
        if (schema.hasNonNull("catalog")) {
            builder.schemaCatalog(resolve(baseDir, schema.get("catalog").asText()));
        }

        JsonNode markup = root.path("markup");
        if (markup.has("indent")) builder.markupIndent(markup.get("indent").asBoolean());
        if (markup.has("xml-declaration"))
            builder.markupXmlDeclaration(markup.get("xml-declaration").asBoolean());

        // --- Environment variable overlay ---

        envString(envLookup, ENV_SCHEMA_CATALOG, value -> builder.schemaCatalog(resolve(baseDir, value)));
        envBool(envLookup, ENV_MARKUP_INDENT, builder::markupIndent);
        envBool(envLookup, ENV_MARKUP_XML_DECLARATION, builder::markupXmlDeclaration);

        return builder.build();
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
    }

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
