package io.mydata.core.schema;

import io.mydata.core.cast.DefaultTypeCaster;
import io.mydata.core.config.MyDataConfig;
import io.mydata.core.error.DuplicateKindException;
import io.mydata.core.markup.XmlMarkupRenderer;
import io.mydata.core.source.YamlSchemaSource;
import io.mydata.core.spi.MarkupRenderer;
import io.mydata.core.spi.SchemaSource;
import io.mydata.core.spi.TypeCaster;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of declared resource kinds, indexed by kind name, together with the collaborators every
 * kind shares: the {@link TypeCaster}, an optional {@link SchemaSource} and the {@link
 * MarkupRenderer}.
 *
 * <p>Each kind is declared exactly once. {@link #declare(String, Consumer)} is serialized so that
 * concurrent declarations cannot interleave; lookups are lock-free and can happen concurrently
 * with declarations of other kinds.
 */
public final class KindRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(KindRegistry.class);

    private final Map<String, ResourceKind> kinds = new ConcurrentHashMap<>();
    private final TypeCaster caster;
    private final SchemaSource schemaSource;
    private final MarkupRenderer markupRenderer;

    private KindRegistry(TypeCaster caster, SchemaSource schemaSource, MarkupRenderer markupRenderer) {
        this.caster = Objects.requireNonNull(caster, "caster must not be null");
        this.schemaSource = schemaSource;
        this.markupRenderer = Objects.requireNonNull(markupRenderer, "markupRenderer must not be null");
    }

    /**
     * Creates a registry with the {@link DefaultTypeCaster}, the {@link XmlMarkupRenderer} and no
     * schema source.
     */
    public static KindRegistry withDefaults() {
        return builder().build();
    }

    /**
     * Creates a registry wired from configuration: the default caster, a {@link YamlSchemaSource}
     * when a schema catalog is configured, and an {@link XmlMarkupRenderer} with the configured
     * output options.
     */
    public static KindRegistry fromConfig(MyDataConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Builder builder = builder()
                .markupRenderer(new XmlMarkupRenderer(
                        new XmlMarkupRenderer.Options(config.markupIndent(), config.markupXmlDeclaration())));
        if (config.schemaCatalog() != null) {
            builder.schemaSource(YamlSchemaSource.load(config.schemaCatalog()));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Declares a new kind. The callback receives the kind's declaration API; when it returns the
     * kind becomes read-only and is registered. If the callback throws, nothing is registered.
     *
     * @param name kind name, unique within this registry
     * @param body declares the kind's attributes, container and rules
     * @return the declared kind
     * @throws DuplicateKindException if a kind with this name is already registered
     * @throws io.mydata.core.error.ResourceDeclarationException if any declaration step fails
     */
    public synchronized ResourceKind declare(String name, Consumer<ResourceKind.Declaration> body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("kind name must not be null or blank");
        }
        Objects.requireNonNull(body, "body must not be null");
        if (kinds.containsKey(name)) {
            throw new DuplicateKindException("Resource kind already declared: '" + name + "'", name);
        }

        ResourceKind kind = new ResourceKind(name, this);
        try {
            body.accept(kind.declaration());
        } finally {
            // a failed declaration must not stay writable through a leaked Declaration
            kind.seal();
        }
        kinds.put(name, kind);
        LOG.info(
                "Declared resource kind: name={}, attributes={}, rules={}",
                name,
                kind.attributeNames(),
                kind.rules().size());
        return kind;
    }

    /** Looks up a kind by name. */
    public Optional<ResourceKind> find(String name) {
        return Optional.ofNullable(kinds.get(name));
    }

    /**
     * Looks up a kind by name, throwing if it is not declared.
     *
     * @throws IllegalArgumentException if no kind is registered under the name
     */
    public ResourceKind require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("No resource kind declared: '" + name + "'"));
    }

    public boolean contains(String name) {
        return kinds.containsKey(name);
    }

    public int size() {
        return kinds.size();
    }

    /** Names of all registered kinds. */
    public Set<String> kindNames() {
        return Collections.unmodifiableSet(kinds.keySet());
    }

    public TypeCaster caster() {
        return caster;
    }

    public Optional<SchemaSource> schemaSource() {
        return Optional.ofNullable(schemaSource);
    }

    public MarkupRenderer markupRenderer() {
        return markupRenderer;
    }

    /** Builder for {@link KindRegistry}. Unset collaborators fall back to the defaults. */
    public static final class Builder {

        private TypeCaster caster;
        private SchemaSource schemaSource;
        private MarkupRenderer markupRenderer;

        Builder() {}

        public Builder caster(TypeCaster caster) {
            this.caster = caster;
            return this;
        }

        public Builder schemaSource(SchemaSource schemaSource) {
            this.schemaSource = schemaSource;
            return this;
        }

        public Builder markupRenderer(MarkupRenderer markupRenderer) {
            this.markupRenderer = markupRenderer;
            return this;
        }

        public KindRegistry build() {
            return new KindRegistry(
                    caster != null ? caster : new DefaultTypeCaster(),
                    schemaSource,
                    markupRenderer != null ? markupRenderer : new XmlMarkupRenderer());
        }
    }
}
