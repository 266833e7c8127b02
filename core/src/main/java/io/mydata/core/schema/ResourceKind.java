package io.mydata.core.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.mydata.core.error.DuplicateAttributeException;
import io.mydata.core.error.TypeCastException;
import io.mydata.core.error.UnknownAttributeTypeException;
import io.mydata.core.error.UnresolvedResourceException;
import io.mydata.core.error.UnsupportedOptionException;
import io.mydata.core.model.AttributeDeclaration;
import io.mydata.core.model.AttributeOptions;
import io.mydata.core.model.ContainerMetadata;
import io.mydata.core.model.SchemaMode;
import io.mydata.core.spi.SchemaSource;
import io.mydata.core.spi.TypeCaster;
import io.mydata.core.spi.ValidationRule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema of one record kind: its attributes in declaration order, their descriptors, the container
 * metadata used for markup, and the local validation rules.
 *
 * <p>A kind is populated once through its {@link Declaration} inside {@link
 * KindRegistry#declare(String, java.util.function.Consumer)} and is read-only afterwards. Instances
 * can only be created once the declaration has completed.
 *
 * <p>Thread-safe after declaration: all state is effectively immutable once the kind is
 * registered.
 */
public final class ResourceKind {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceKind.class);

    private final String name;
    private final KindRegistry registry;
    // Key order is the attribute order; a single map keeps both views in sync.
    private final Map<String, AttributeDescriptor> descriptors = new LinkedHashMap<>();
    private final Map<String, AttributeDescriptor> descriptorsView = Collections.unmodifiableMap(descriptors);
    private final List<ValidationRule> rules = new ArrayList<>();
    private final List<ValidationRule> rulesView = Collections.unmodifiableList(rules);
    private ContainerMetadata container;
    private boolean sealed;

    ResourceKind(String name, KindRegistry registry) {
        this.name = name;
        this.registry = registry;
        this.container = ContainerMetadata.named(KindNames.camelize(KindNames.shortName(name)));
    }

    /** The kind's registered name, e.g. {@code "Order"}. */
    public String name() {
        return name;
    }

    /** The registry this kind was declared in. */
    public KindRegistry registry() {
        return registry;
    }

    /** Attribute names in declaration order. */
    public List<String> attributeNames() {
        return List.copyOf(descriptors.keySet());
    }

    /** Descriptors keyed by attribute name, iterated in declaration order. */
    public Map<String, AttributeDescriptor> descriptors() {
        return descriptorsView;
    }

    /** Looks up the descriptor for an attribute. */
    public Optional<AttributeDescriptor> descriptor(String attribute) {
        return Optional.ofNullable(descriptors.get(attribute));
    }

    /**
     * Looks up the descriptor for an attribute, throwing if the kind does not declare it.
     *
     * @throws IllegalArgumentException if the attribute is not declared
     */
    public AttributeDescriptor requireDescriptor(String attribute) {
        AttributeDescriptor descriptor = descriptors.get(attribute);
        if (descriptor == null) {
            throw new IllegalArgumentException("Unknown attribute '" + attribute + "' on " + name);
        }
        return descriptor;
    }

    public boolean hasAttribute(String attribute) {
        return descriptors.containsKey(attribute);
    }

    /** Root element name and attributes for markup rendering. */
    public ContainerMetadata container() {
        return container;
    }

    /** Local validation rules in registration order. */
    public List<ValidationRule> rules() {
        return rulesView;
    }

    /** Returns {@code true} once the declaration has completed. */
    public boolean isSealed() {
        return sealed;
    }

    /**
     * Human-readable summary of the kind's attributes, e.g. {@code "Order id: integer, items:
     * [LineItem]"}.
     */
    public String describe() {
        String attrs = descriptors.values().stream()
                .map(AttributeDescriptor::toString)
                .collect(Collectors.joining(", "));
        return attrs.isEmpty() ? name : name + " " + attrs;
    }

    // ── Instance construction ──

    /** Creates an instance with every attribute unset. */
    public Resource newInstance() {
        requireSealed();
        return new Resource(this);
    }

    /**
     * Creates an instance and bulk-assigns the given values. Keys that are not declared
     * attributes are ignored.
     *
     * @throws TypeCastException if a value cannot be cast to its attribute's type
     */
    public Resource newInstance(Map<?, ?> values) {
        Resource resource = newInstance();
        resource.setAttributes(values);
        return resource;
    }

    /** Creates an instance from another instance's {@link Resource#attributes()} view. */
    public Resource newInstance(Resource source) {
        Resource resource = newInstance();
        resource.setAttributes(source);
        return resource;
    }

    /**
     * Creates an instance from a JSON object document. Nested objects and arrays are cast through
     * the same dispatch as map input.
     *
     * @throws TypeCastException if the text is not a JSON object or a value cannot be cast
     */
    public Resource fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode node;
        try {
            node = ResourceJson.MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TypeCastException(
                    "Malformed JSON for " + name + ": " + e.getOriginalMessage(), e, TypeCaster.RESOURCE);
        }
        if (node == null || !node.isObject()) {
            throw new TypeCastException(
                    "Expected a JSON object for " + name + " but got "
                            + (node == null ? "nothing" : node.getNodeType()),
                    TypeCaster.RESOURCE);
        }
        return newInstance(ResourceJson.MAPPER.convertValue(node, Map.class));
    }

    AttributeValue cast(AttributeDescriptor descriptor, Object raw) {
        return AttributeCaster.cast(this, descriptor, raw);
    }

    Declaration declaration() {
        return new Declaration();
    }

    void seal() {
        sealed = true;
    }

    private void requireSealed() {
        if (!sealed) {
            throw new IllegalStateException("Resource kind '" + name + "' is still being declared");
        }
    }

    @Override
    public String toString() {
        return name;
    }

    /**
     * Declaration-time API for a kind. Handed to the callback of {@link
     * KindRegistry#declare(String, java.util.function.Consumer)}; every method fails with {@link
     * IllegalStateException} once the declaration has completed.
     */
    public final class Declaration {

        private Declaration() {}

        /** The kind being declared. */
        public ResourceKind kind() {
            return ResourceKind.this;
        }

        /** Declares a single-valued attribute with no options. */
        public Declaration attribute(String attribute, String type) {
            return attribute(attribute, type, Map.of());
        }

        /**
         * Declares an attribute.
         *
         * @param attribute attribute name, non-empty and not yet declared on this kind
         * @param type      a type tag known to the registry's {@link TypeCaster}, or {@code resource}
         * @param options   any of {@code class_name}, {@code collection}, {@code
         *                  collection_element_name}. A nested kind name resolves to this kind
         *                  itself, then to an exact registered name, then to the same name inside
         *                  this kind's namespace.
         * @throws UnknownAttributeTypeException if the type is not known
         * @throws UnsupportedOptionException    if an option key is not recognized or has an invalid value
         * @throws DuplicateAttributeException   if the attribute is already declared
         * @throws UnresolvedResourceException   if a resource attribute names an undeclared kind
         */
        public Declaration attribute(String attribute, String type, Map<String, ?> options) {
            requireOpen();
            if (attribute == null || attribute.isEmpty()) {
                throw new IllegalArgumentException("attribute name must not be null or empty");
            }
            Map<String, ?> opts = options != null ? options : Map.of();

            if (type == null || !(TypeCaster.RESOURCE.equals(type) || registry.caster().isKnownType(type))) {
                throw new UnknownAttributeTypeException("Wrong type: " + attribute + ": " + type, name, attribute);
            }
            List<String> unsupported = opts.keySet().stream()
                    .filter(key -> !AttributeOptions.ALLOWED.contains(key))
                    .sorted()
                    .collect(Collectors.toList());
            if (!unsupported.isEmpty()) {
                throw new UnsupportedOptionException(
                        "Option" + (unsupported.size() > 1 ? "s" : "") + " not supported: " + attribute + ": "
                                + unsupported + " — recognized options are: "
                                + new TreeSet<>(AttributeOptions.ALLOWED),
                        name,
                        attribute);
            }
            if (descriptors.containsKey(attribute)) {
                throw new DuplicateAttributeException(
                        "Attribute '" + attribute + "' is already declared on " + name, name, attribute);
            }

            boolean collection = booleanOption(attribute, AttributeOptions.COLLECTION, opts.get(AttributeOptions.COLLECTION));
            String elementName = stringOption(
                    attribute, AttributeOptions.COLLECTION_ELEMENT_NAME, opts.get(AttributeOptions.COLLECTION_ELEMENT_NAME));
            String className = stringOption(attribute, AttributeOptions.CLASS_NAME, opts.get(AttributeOptions.CLASS_NAME));

            ValueType valueType = TypeCaster.RESOURCE.equals(type)
                    ? new ValueType.Nested(resolveKind(attribute, className))
                    : new ValueType.Primitive(type);

            AttributeDescriptor descriptor = new AttributeDescriptor(attribute, valueType, collection, elementName);
            descriptors.put(attribute, descriptor);
            LOG.debug("Declared attribute: kind={}, {}", name, descriptor);
            return this;
        }

        /** Overrides the container element name, keeping no root attributes. */
        public Declaration container(String containerName) {
            return container(containerName, Map.of());
        }

        /** Overrides the container element name and its root attributes. */
        public Declaration container(String containerName, Map<String, String> attributes) {
            requireOpen();
            container = new ContainerMetadata(containerName, attributes);
            return this;
        }

        /** Registers a local validation rule. */
        public Declaration validates(ValidationRule rule) {
            requireOpen();
            rules.add(Objects.requireNonNull(rule, "rule must not be null"));
            return this;
        }

        /**
         * Registers presence rules for the given attributes.
         *
         * @throws IllegalArgumentException if an attribute is not declared
         */
        public Declaration validatesPresenceOf(String... attributes) {
            for (String attribute : attributes) {
                requireDescriptor(attribute);
                validates(Validations.presence(attribute));
            }
            return this;
        }

        /**
         * Declares container metadata and attributes from the registry's {@link SchemaSource},
         * reading the kind as a document. Attributes marked required get a presence rule.
         */
        public Declaration fromDocumentSchema() {
            requireOpen();
            SchemaSource source = requireSchemaSource();
            ContainerMetadata document = source.documentContainer(name);
            container(document.name(), document.attributes());
            return declareAll(source.attributes(name, SchemaMode.DOCUMENT));
        }

        /**
         * Declares attributes from the registry's {@link SchemaSource}, reading the kind as a
         * complex type. The container metadata keeps its default.
         */
        public Declaration fromComplexTypeSchema() {
            requireOpen();
            return declareAll(requireSchemaSource().attributes(name, SchemaMode.COMPLEX_TYPE));
        }

        private Declaration declareAll(List<AttributeDeclaration> declarations) {
            for (AttributeDeclaration declaration : declarations) {
                attribute(declaration.name(), declaration.type(), declaration.options());
                if (declaration.required()) {
                    validatesPresenceOf(declaration.name());
                }
            }
            return this;
        }

        private ResourceKind resolveKind(String attribute, String className) {
            String target = className != null && !className.isBlank() ? className : KindNames.camelize(attribute);
            String qualified = KindNames.namespace(name) + target;
            if (target.equals(name) || qualified.equals(name)) {
                return ResourceKind.this;
            }
            return registry.find(target)
                    .or(() -> registry.find(qualified))
                    .orElseThrow(() -> new UnresolvedResourceException(
                            "Unresolved resource kind '" + target + "' for attribute '" + attribute + "' on " + name
                                    + " — declare it before referencing it",
                            name,
                            attribute));
        }

        private SchemaSource requireSchemaSource() {
            return registry.schemaSource()
                    .orElseThrow(() -> new IllegalStateException(
                            "No SchemaSource configured for the registry declaring '" + name + "'"));
        }

        private void requireOpen() {
            if (sealed) {
                throw new IllegalStateException("Resource kind '" + name + "' is already declared and read-only");
            }
        }

        private boolean booleanOption(String attribute, String option, Object value) {
            if (value == null) {
                return false;
            }
            if (value instanceof Boolean flag) {
                return flag;
            }
            if (value instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
                return Boolean.parseBoolean(text);
            }
            throw new UnsupportedOptionException(
                    "Invalid value for option '" + option + "' on " + attribute + ": " + value, name, attribute);
        }

        private String stringOption(String attribute, String option, Object value) {
            if (value == null || value instanceof String) {
                return (String) value;
            }
            throw new UnsupportedOptionException(
                    "Invalid value for option '" + option + "' on " + attribute + ": " + value, name, attribute);
        }
    }
}
