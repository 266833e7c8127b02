package io.mydata.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.mydata.core.error.SchemaSourceException;
import io.mydata.core.model.AttributeDeclaration;
import io.mydata.core.model.AttributeOptions;
import io.mydata.core.model.ContainerMetadata;
import io.mydata.core.model.SchemaMode;
import io.mydata.core.schema.KindNames;
import io.mydata.core.spi.SchemaSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchemaSource} backed by a YAML catalog file. The catalog is parsed and checked once at
 * load time; lookups afterwards are read-only.
 *
 * <pre>
 * documents:
 *   InvoicesDoc:
 *     container:
 *       name: InvoicesDoc
 *       attributes:
 *         xmlns: "http://www.example.com/invoice"
 *     attributes:
 *       - name: invoice
 *         type: resource
 *         class_name: Invoice
 *         collection: true
 *         required: true
 * complex-types:
 *   Invoice:
 *     attributes:
 *       - name: uid
 *         type: string
 * </pre>
 *
 * <p>Kinds are looked up by their full name first, then by their short name (the segment after
 * the last {@code ::}, {@code .} or {@code $}).
 *
 * <p>Thread-safe: immutable after loading.
 */
public final class YamlSchemaSource implements SchemaSource {

    private static final Logger LOG = LoggerFactory.getLogger(YamlSchemaSource.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    // ── Strict unknown-key detection ──

    private static final Set<String> KNOWN_ROOT_KEYS = Set.of("documents", "complex-types");
    private static final Set<String> KNOWN_DOCUMENT_KEYS = Set.of("container", "attributes");
    private static final Set<String> KNOWN_COMPLEX_TYPE_KEYS = Set.of("attributes");
    private static final Set<String> KNOWN_CONTAINER_KEYS = Set.of("name", "attributes");
    private static final Set<String> KNOWN_ATTRIBUTE_KEYS = Set.of(
            "name",
            "type",
            "required",
            AttributeOptions.CLASS_NAME,
            AttributeOptions.COLLECTION,
            AttributeOptions.COLLECTION_ELEMENT_NAME);

    private record Entry(ContainerMetadata container, List<AttributeDeclaration> attributes) {}

    private final String source;
    private final Map<String, Entry> documents;
    private final Map<String, Entry> complexTypes;

    private YamlSchemaSource(String source, Map<String, Entry> documents, Map<String, Entry> complexTypes) {
        this.source = source;
        this.documents = Collections.unmodifiableMap(documents);
        this.complexTypes = Collections.unmodifiableMap(complexTypes);
    }

    /**
     * Loads a catalog from a YAML file.
     *
     * @throws SchemaSourceException if the file cannot be read or has invalid structure
     */
    public static YamlSchemaSource load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        try (InputStream in = Files.newInputStream(path)) {
            return parse(YAML_MAPPER.readTree(in), source);
        } catch (IOException e) {
            throw new SchemaSourceException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
    }

    /**
     * Loads a catalog from a stream; {@code source} names it in error messages.
     *
     * @throws SchemaSourceException if the stream cannot be read or has invalid structure
     */
    public static YamlSchemaSource load(InputStream in, String source) {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return parse(YAML_MAPPER.readTree(in), source);
        } catch (IOException e) {
            throw new SchemaSourceException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
    }

    /** The file path or resource name the catalog was loaded from. */
    public String source() {
        return source;
    }

    /** Kind names described as documents. */
    public Set<String> documentNames() {
        return documents.keySet();
    }

    /** Kind names described as complex types. */
    public Set<String> complexTypeNames() {
        return complexTypes.keySet();
    }

    @Override
    public ContainerMetadata documentContainer(String kindName) {
        return lookup(documents, kindName, SchemaMode.DOCUMENT).container();
    }

    @Override
    public List<AttributeDeclaration> attributes(String kindName, SchemaMode mode) {
        Map<String, Entry> entries = mode == SchemaMode.DOCUMENT ? documents : complexTypes;
        return lookup(entries, kindName, mode).attributes();
    }

    private Entry lookup(Map<String, Entry> entries, String kindName, SchemaMode mode) {
        Entry entry = entries.get(kindName);
        if (entry == null) {
            entry = entries.get(KindNames.shortName(kindName));
        }
        if (entry == null) {
            throw new SchemaSourceException(
                    "No " + (mode == SchemaMode.DOCUMENT ? "document" : "complex type") + " described for '"
                            + kindName + "' — available: " + entries.keySet(),
                    kindName,
                    source);
        }
        return entry;
    }

    // --- Parsing ---

    private static YamlSchemaSource parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new SchemaSourceException("Schema catalog is empty", null, source);
        }
        if (!root.isObject()) {
            throw new SchemaSourceException("Schema catalog must be a YAML mapping", null, source);
        }
        rejectUnknownKeys(root, KNOWN_ROOT_KEYS, "catalog root", null, source);

        Map<String, Entry> documents = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : objectFields(root.get("documents"), "documents", source)) {
            String kind = field.getKey();
            JsonNode node = field.getValue();
            requireObject(node, "documents." + kind, kind, source);
            rejectUnknownKeys(node, KNOWN_DOCUMENT_KEYS, "documents." + kind, kind, source);
            ContainerMetadata container = parseContainer(node.get("container"), kind, source);
            documents.put(kind, new Entry(container, parseAttributes(node, kind, source)));
        }

        Map<String, Entry> complexTypes = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : objectFields(root.get("complex-types"), "complex-types", source)) {
            String kind = field.getKey();
            JsonNode node = field.getValue();
            requireObject(node, "complex-types." + kind, kind, source);
            rejectUnknownKeys(node, KNOWN_COMPLEX_TYPE_KEYS, "complex-types." + kind, kind, source);
            complexTypes.put(kind, new Entry(null, parseAttributes(node, kind, source)));
        }

        LOG.info(
                "Loaded schema catalog: source={}, documents={}, complexTypes={}",
                source,
                documents.keySet(),
                complexTypes.keySet());
        return new YamlSchemaSource(source, documents, complexTypes);
    }

    private static ContainerMetadata parseContainer(JsonNode node, String kind, String source) {
        if (node == null || node.isNull()) {
            return ContainerMetadata.named(KindNames.shortName(kind));
        }
        requireObject(node, "documents." + kind + ".container", kind, source);
        rejectUnknownKeys(node, KNOWN_CONTAINER_KEYS, "documents." + kind + ".container", kind, source);
        JsonNode nameNode = node.get("name");
        String name = nameNode != null && nameNode.isTextual() ? nameNode.asText() : KindNames.shortName(kind);

        Map<String, String> attributes = new LinkedHashMap<>();
        JsonNode attrsNode = node.get("attributes");
        if (attrsNode != null && !attrsNode.isNull()) {
            requireObject(attrsNode, "documents." + kind + ".container.attributes", kind, source);
            for (Map.Entry<String, JsonNode> field : attrsNode.properties()) {
                attributes.put(field.getKey(), field.getValue().asText());
            }
        }
        return new ContainerMetadata(name, attributes);
    }

    private static List<AttributeDeclaration> parseAttributes(JsonNode node, String kind, String source) {
        JsonNode attrsNode = node.get("attributes");
        if (attrsNode == null || attrsNode.isNull()) {
            return List.of();
        }
        if (!attrsNode.isArray()) {
            throw new SchemaSourceException("'attributes' of '" + kind + "' must be a YAML list", kind, source);
        }

        List<AttributeDeclaration> declarations = new ArrayList<>();
        int index = 0;
        for (JsonNode attrNode : attrsNode) {
            String block = kind + ".attributes[" + index++ + "]";
            requireObject(attrNode, block, kind, source);
            rejectUnknownKeys(attrNode, KNOWN_ATTRIBUTE_KEYS, block, kind, source);

            String name = requireString(attrNode, "name", block, kind, source);
            String type = requireString(attrNode, "type", block, kind, source);
            boolean required = attrNode.path("required").asBoolean(false);

            Map<String, Object> options = new LinkedHashMap<>();
            if (attrNode.has(AttributeOptions.CLASS_NAME)) {
                options.put(AttributeOptions.CLASS_NAME, attrNode.get(AttributeOptions.CLASS_NAME).asText());
            }
            if (attrNode.has(AttributeOptions.COLLECTION)) {
                options.put(AttributeOptions.COLLECTION, attrNode.get(AttributeOptions.COLLECTION).asBoolean());
            }
            if (attrNode.has(AttributeOptions.COLLECTION_ELEMENT_NAME)) {
                options.put(
                        AttributeOptions.COLLECTION_ELEMENT_NAME,
                        attrNode.get(AttributeOptions.COLLECTION_ELEMENT_NAME).asText());
            }
            declarations.add(new AttributeDeclaration(name, type, options, required));
        }
        return Collections.unmodifiableList(declarations);
    }

    private static Iterable<Map.Entry<String, JsonNode>> objectFields(JsonNode node, String block, String source) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        requireObject(node, block, null, source);
        return node.properties();
    }

    private static void requireObject(JsonNode node, String block, String kind, String source) {
        if (node == null || !node.isObject()) {
            throw new SchemaSourceException("'" + block + "' must be a YAML mapping", kind, source);
        }
    }

    private static String requireString(JsonNode node, String field, String block, String kind, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isTextual() || value.asText().isBlank()) {
            throw new SchemaSourceException(
                    "Missing or invalid required field '" + field + "' in '" + block + "'", kind, source);
        }
        return value.asText();
    }

    private static void rejectUnknownKeys(
            JsonNode node, Set<String> knownKeys, String blockName, String kind, String source) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new SchemaSourceException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + " — recognized keys are: " + knownKeys,
                    kind,
                    source);
        }
    }
}
