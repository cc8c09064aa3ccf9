package com.composum.platform.remap.layout;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The XML serialization of layouts:
 * <pre>
 * &lt;r xmlns:s="s"&gt;
 *   &lt;d id="{device}" l="{layout}"&gt;
 *     &lt;r id="{rendering}" ds="{datasource}" ph="main" uid="{uid}"/&gt;
 *   &lt;/d&gt;
 * &lt;/r&gt;
 * </pre>
 * Final layouts store deltas where the datasource is written as {@code s:ds}. The parser is not namespace aware,
 * the attribute names are taken literally.
 */
public class XmlLayoutFormat implements LayoutFormat {

    private static final Logger LOG = LoggerFactory.getLogger(XmlLayoutFormat.class);

    public static final String ELEMENT_DEVICE = "d";
    public static final String ELEMENT_RENDERING = "r";

    public static final String ATTR_ID = "id";
    public static final String ATTR_LAYOUT = "l";
    public static final String ATTR_PLACEHOLDER = "ph";
    public static final String ATTR_UNIQUE_ID = "uid";

    public static final List<String> DEFAULT_DATASOURCE_ATTRIBUTES =
            Collections.unmodifiableList(Arrays.asList("ds", "s:ds"));

    @NotNull
    protected final List<String> datasourceAttributes;

    @NotNull
    protected final DocumentBuilderFactory factory;

    public XmlLayoutFormat() {
        this(DEFAULT_DATASOURCE_ATTRIBUTES);
    }

    /**
     * @param datasourceAttributes the names of the rendering attributes containing datasource references
     */
    public XmlLayoutFormat(@Nullable List<String> datasourceAttributes) {
        List<String> attributes = datasourceAttributes != null ? datasourceAttributes.stream()
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .collect(Collectors.toList()) : Collections.emptyList();
        this.datasourceAttributes = attributes.isEmpty() ? DEFAULT_DATASOURCE_ATTRIBUTES
                : Collections.unmodifiableList(attributes);
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        } catch (ParserConfigurationException e) {
            LOG.warn("Could not restrict the XML parser: {}", e.toString());
        }
    }

    @NotNull
    public List<String> getDatasourceAttributes() {
        return datasourceAttributes;
    }

    @Override
    @Nullable
    public LayoutDefinition parse(@Nullable String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        Document document;
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(SILENT_ERROR_HANDLER);
            document = builder.parse(new InputSource(new StringReader(raw)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            LOG.debug("Unparseable layout: {}", e.toString());
            return null;
        }
        List<DeviceDefinition> devices = new ArrayList<>();
        for (Element device : childElements(document.getDocumentElement(), ELEMENT_DEVICE)) {
            List<RenderingDefinition> renderings = new ArrayList<>();
            for (Element rendering : childElements(device, ELEMENT_RENDERING)) {
                renderings.add(new RenderingDefinition(
                        rendering.getAttribute(ATTR_ID),
                        datasource(rendering),
                        rendering.getAttribute(ATTR_PLACEHOLDER),
                        rendering.getAttribute(ATTR_UNIQUE_ID)));
            }
            devices.add(new DeviceDefinition(
                    StringUtils.trimToNull(device.getAttribute(ATTR_ID)),
                    StringUtils.trimToNull(device.getAttribute(ATTR_LAYOUT)),
                    renderings));
        }
        return new LayoutDefinition(devices);
    }

    /** The first nonblank of the configured datasource attributes. */
    @Nullable
    protected String datasource(@NotNull Element rendering) {
        for (String attribute : datasourceAttributes) {
            String value = rendering.getAttribute(attribute);
            if (StringUtils.isNotBlank(value)) {
                return value;
            }
        }
        return null;
    }

    @NotNull
    protected List<Element> childElements(@Nullable Element parent, @NotNull String name) {
        List<Element> result = new ArrayList<>();
        if (parent != null) {
            NodeList children = parent.getChildNodes();
            for (int i = 0; i < children.getLength(); i++) {
                Node child = children.item(i);
                if (child.getNodeType() == Node.ELEMENT_NODE && name.equals(child.getNodeName())) {
                    result.add((Element) child);
                }
            }
        }
        return result;
    }

    @Override
    @NotNull
    public String replaceReference(@NotNull String raw, @NotNull String oldReference, @NotNull String newReference) {
        if (oldReference.equals(newReference)) {
            return raw;
        }
        Matcher matcher = referencePattern(oldReference).matcher(raw);
        StringBuffer result = new StringBuffer();
        boolean found = false;
        while (matcher.find()) {
            found = true;
            String replacedMatch = matcher.group("beforeref") + escape(newReference) + matcher.group("quot");
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacedMatch));
        }
        if (!found) {
            return raw;
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Matches a datasource attribute whose value is {reference} after entity expansion, in single or double quotes.
     * Each character may be written literally, as predefined entity or as decimal / hexadecimal character reference.
     */
    @NotNull
    protected Pattern referencePattern(@NotNull String reference) {
        String attributes = datasourceAttributes.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        StringBuilder value = new StringBuilder();
        reference.codePoints().forEach(codePoint -> value.append(encodedCharacter(codePoint)));
        return Pattern.compile("(?<beforeref>\\s(" + attributes + ")\\s*=\\s*(?<quot>['\"]))"
                + value
                + "\\k<quot>");
    }

    /** The alternatives how a character can be written in an attribute value. */
    @NotNull
    protected static String encodedCharacter(int codePoint) {
        StringBuilder alternatives = new StringBuilder("(?:")
                .append(Pattern.quote(new String(Character.toChars(codePoint))))
                .append("|&#0*").append(codePoint).append(';')
                .append("|&#[xX]0*(?i:").append(Integer.toHexString(codePoint)).append(");");
        String entity = PREDEFINED_ENTITIES.get(codePoint);
        if (entity != null) {
            alternatives.append('|').append(Pattern.quote(entity));
        }
        return alternatives.append(')').toString();
    }

    protected static final Map<Integer, String> PREDEFINED_ENTITIES;

    static {
        Map<Integer, String> entities = new HashMap<>();
        entities.put((int) '&', "&amp;");
        entities.put((int) '<', "&lt;");
        entities.put((int) '>', "&gt;");
        entities.put((int) '"', "&quot;");
        entities.put((int) '\'', "&apos;");
        PREDEFINED_ENTITIES = Collections.unmodifiableMap(entities);
    }

    /** The value as it is written into an attribute quoted with either quote character. */
    @NotNull
    protected static String escape(@NotNull String value) {
        return StringUtils.replaceEach(value,
                new String[]{"&", "<", ">", "\"", "'"},
                new String[]{"&amp;", "&lt;", "&gt;", "&quot;", "&apos;"});
    }

    protected static final ErrorHandler SILENT_ERROR_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            LOG.debug("Layout parser warning: {}", exception.toString());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

}
