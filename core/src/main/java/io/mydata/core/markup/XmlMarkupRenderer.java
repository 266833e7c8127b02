package io.mydata.core.markup;

import io.mydata.core.error.MarkupRenderException;
import io.mydata.core.model.ContainerMetadata;
import io.mydata.core.schema.AttributeDescriptor;
import io.mydata.core.schema.AttributeValue;
import io.mydata.core.schema.Resource;
import io.mydata.core.spi.MarkupRenderer;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.Map;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a resource as an XML document with StAX.
 *
 * <p>The root element is the kind's container name, carrying the container attributes. Every set
 * attribute becomes a child element in declaration order; nested resources recurse. A collection
 * with a {@code collection_element_name} is wrapped in one element named after the attribute, with
 * one child per entry; without it, the attribute element repeats once per entry. Unset values and
 * empty collections are omitted.
 *
 * <p>Element and attribute names must be XML names without a colon, and text must contain only
 * characters XML 1.0 allows; anything else fails with {@link MarkupRenderException} instead of
 * producing a malformed document.
 *
 * <p>Thread-safe: a new writer is created per call.
 */
public final class XmlMarkupRenderer implements MarkupRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(XmlMarkupRenderer.class);
    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();
    private static final String INDENT = "  ";

    /**
     * Output options.
     *
     * @param indent         pretty-print with two-space indentation
     * @param xmlDeclaration emit the {@code <?xml ...?>} declaration
     */
    public record Options(boolean indent, boolean xmlDeclaration) {

        public static Options defaults() {
            return new Options(false, true);
        }
    }

    private final Options options;

    public XmlMarkupRenderer() {
        this(Options.defaults());
    }

    public XmlMarkupRenderer(Options options) {
        this.options = options != null ? options : Options.defaults();
    }

    public Options options() {
        return options;
    }

    @Override
    public String render(Resource resource) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter writer = OUTPUT_FACTORY.createXMLStreamWriter(out);
            try {
                if (options.xmlDeclaration()) {
                    writer.writeStartDocument("UTF-8", "1.0");
                }
                ContainerMetadata container = resource.kind().container();
                writer.writeStartElement(checkName(container.name()));
                for (Map.Entry<String, String> attribute : container.attributes().entrySet()) {
                    writer.writeAttribute(
                            checkName(attribute.getKey()), checkText(attribute.getValue(), attribute.getKey()));
                }
                boolean hasChildren = writeBody(writer, resource, 1);
                closeElement(writer, 0, hasChildren);
                writer.writeEndDocument();
                writer.flush();
            } finally {
                writer.close();
            }
        } catch (XMLStreamException e) {
            throw new MarkupRenderException(
                    "Failed to render " + resource.kind().name() + " as XML: " + e.getMessage(),
                    e,
                    resource.kind().name());
        }
        LOG.debug("Rendered markup: kind={}, chars={}", resource.kind().name(), out.getBuffer().length());
        return out.toString();
    }

    private boolean writeBody(XMLStreamWriter writer, Resource resource, int depth) throws XMLStreamException {
        boolean wrote = false;
        for (AttributeDescriptor descriptor : resource.kind().descriptors().values()) {
            AttributeValue value = resource.get(descriptor.name());
            if (value instanceof AttributeValue.Many many) {
                wrote |= writeCollection(writer, descriptor, many, depth);
            } else {
                wrote |= writeValue(writer, descriptor.name(), value, depth);
            }
        }
        return wrote;
    }

    private boolean writeCollection(
            XMLStreamWriter writer, AttributeDescriptor descriptor, AttributeValue.Many many, int depth)
            throws XMLStreamException {
        if (many.isEmpty()) {
            return false;
        }
        String elementName = descriptor.collectionElementName();
        if (elementName == null) {
            boolean wrote = false;
            for (AttributeValue element : many.elements()) {
                wrote |= writeValue(writer, descriptor.name(), element, depth);
            }
            return wrote;
        }
        openElement(writer, descriptor.name(), depth);
        boolean hasChildren = false;
        for (AttributeValue element : many.elements()) {
            hasChildren |= writeValue(writer, elementName, element, depth + 1);
        }
        closeElement(writer, depth, hasChildren);
        return true;
    }

    private boolean writeValue(XMLStreamWriter writer, String elementName, AttributeValue value, int depth)
            throws XMLStreamException {
        if (value instanceof AttributeValue.Nested nested) {
            openElement(writer, elementName, depth);
            boolean hasChildren = writeBody(writer, nested.resource(), depth + 1);
            closeElement(writer, depth, hasChildren);
            return true;
        }
        if (value instanceof AttributeValue.Scalar scalar) {
            openElement(writer, elementName, depth);
            writer.writeCharacters(checkText(format(scalar.value()), elementName));
            writer.writeEndElement();
            return true;
        }
        return false;
    }

    private void openElement(XMLStreamWriter writer, String name, int depth) throws XMLStreamException {
        newline(writer, depth);
        writer.writeStartElement(checkName(name));
    }

    private void closeElement(XMLStreamWriter writer, int depth, boolean hasChildren) throws XMLStreamException {
        if (hasChildren) {
            newline(writer, depth);
        }
        writer.writeEndElement();
    }

    private void newline(XMLStreamWriter writer, int depth) throws XMLStreamException {
        if (options.indent()) {
            writer.writeCharacters("\n" + INDENT.repeat(depth));
        }
    }

    private static String checkName(String name) throws XMLStreamException {
        if (name == null || name.isEmpty() || !isNameStartChar(name.codePointAt(0))) {
            throw new XMLStreamException("Invalid XML name '" + name + "'");
        }
        for (int i = Character.charCount(name.codePointAt(0)); i < name.length(); ) {
            int c = name.codePointAt(i);
            if (!isNameChar(c)) {
                throw new XMLStreamException("Invalid XML name '" + name + "'");
            }
            i += Character.charCount(c);
        }
        return name;
    }

    private static String checkText(String text, String owner) throws XMLStreamException {
        for (int i = 0; i < text.length(); ) {
            int c = text.codePointAt(i);
            if (!isXmlChar(c)) {
                throw new XMLStreamException(String.format(
                        "Character U+%04X in '%s' is not allowed in XML 1.0", c, owner));
            }
            i += Character.charCount(c);
        }
        return text;
    }

    // NameStartChar of XML 1.0 (5th ed.) without ':'
    private static boolean isNameStartChar(int c) {
        return (c >= 'A' && c <= 'Z')
                || (c >= 'a' && c <= 'z')
                || c == '_'
                || (c >= 0xC0 && c <= 0xD6)
                || (c >= 0xD8 && c <= 0xF6)
                || (c >= 0xF8 && c <= 0x2FF)
                || (c >= 0x370 && c <= 0x37D)
                || (c >= 0x37F && c <= 0x1FFF)
                || (c >= 0x200C && c <= 0x200D)
                || (c >= 0x2070 && c <= 0x218F)
                || (c >= 0x2C00 && c <= 0x2FEF)
                || (c >= 0x3001 && c <= 0xD7FF)
                || (c >= 0xF900 && c <= 0xFDCF)
                || (c >= 0xFDF0 && c <= 0xFFFD)
                || (c >= 0x10000 && c <= 0xEFFFF);
    }

    private static boolean isNameChar(int c) {
        return isNameStartChar(c)
                || c == '-'
                || c == '.'
                || (c >= '0' && c <= '9')
                || c == 0xB7
                || (c >= 0x300 && c <= 0x36F)
                || (c >= 0x203F && c <= 0x2040);
    }

    private static boolean isXmlChar(int c) {
        return c == 0x9
                || c == 0xA
                || c == 0xD
                || (c >= 0x20 && c <= 0xD7FF)
                || (c >= 0xE000 && c <= 0xFFFD)
                || (c >= 0x10000 && c <= 0x10FFFF);
    }

    private static String format(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(value);
    }
}
