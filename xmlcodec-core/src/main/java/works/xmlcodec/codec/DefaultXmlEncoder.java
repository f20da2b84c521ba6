package works.xmlcodec.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.DOMException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import works.xmlcodec.Namespace;
import works.xmlcodec.XmlDocument;
import works.xmlcodec.XmlDocumentConfig;
import works.xmlcodec.exceptions.InvalidStructureException;
import works.xmlcodec.text.TextNormalizer;

import static works.xmlcodec.codec.Structures.ATTRIBUTES;
import static works.xmlcodec.codec.Structures.VALUE;
import static works.xmlcodec.codec.Structures.asSequence;
import static works.xmlcodec.codec.Structures.isScalar;
import static works.xmlcodec.codec.Structures.isSkipped;
import static works.xmlcodec.codec.Structures.scalarText;

/**
 * Entries of a map become child elements named by their keys. A sequence value
 * produces one sibling element per item, all with the same tag. Scalars become
 * element text after {@link TextNormalizer#sanitize sanitizing}.
 */
public final class DefaultXmlEncoder implements XmlEncoder {
	private final XmlDocumentConfig config;

	public DefaultXmlEncoder() {
		this(XmlDocumentConfig.simple());
	}

	/**
	 * @param config used for documents this encoder creates.
	 */
	public DefaultXmlEncoder(XmlDocumentConfig config) {
		this.config = config;
	}

	@Override
	public XmlDocument encode(Map<String, ?> data, @Nullable Namespace namespace, @Nullable Element parent, @Nullable XmlDocument document) {
		if (parent != null && (document == null || parent.getOwnerDocument() != document.getDocument())) {
			throw new IllegalArgumentException("Parent <" + parent.getTagName() + "> must belong to the document being written into");
		}
		XmlDocument target = document != null ? document : new XmlDocument(config);
		Node start = parent != null ? parent : target.getDocument();
		try {
			encodeContent(target.getDocument(), start, data, namespace);
		} finally {
			target.invalidate();
		}
		LOGGER.debug("Encoded into <{}>", start.getNodeName());
		return target;
	}

	private void encodeContent(Document dom, Node parent, Map<String, ?> data, @Nullable Namespace namespace) {
		for (Map.Entry<String, ?> entry : data.entrySet()) {
			String key = entry.getKey();
			Object value = entry.getValue();
			switch (key) {
				case ATTRIBUTES -> {
					if (isSkipped(value)) {
						continue;
					}
					if (!(value instanceof Map<?, ?> attributes) || asSequence(attributes) != null) {
						throw new InvalidStructureException("The " + ATTRIBUTES + " of node \"" + parent.getNodeName() + "\" must be a record of attribute names to values, not " + value);
					}
					// Before the root exists there is nothing to attach them to
					if (parent instanceof Element element) {
						setAttributes(element, attributes);
					}
				}
				case VALUE -> {
					if (!isSkipped(value)) {
						if (!isScalar(value)) {
							throw new InvalidStructureException("The " + VALUE + " of node \"" + parent.getNodeName() + "\" must be a scalar, not " + value);
						}
						if (parent instanceof Element) {
							setText(dom, parent, scalarText(value));
						}
					}
				}
				default -> {
					if (isScalar(value)) {
						if (!isSkipped(value)) {
							setText(dom, appendElement(dom, parent, key, namespace), scalarText(value));
						}
					} else if (!isSkipped(value)) {
						encodeChildren(dom, parent, key, value, namespace);
					}
				}
			}
		}
	}

	private void encodeChildren(Document dom, Node parent, String tagName, Object value, @Nullable Namespace namespace) {
		List<?> items = asSequence(value);
		if (items == null) {
			items = List.of(value);
		}
		for (Object item : items) {
			if (isSkipped(item)) {
				continue;
			}
			if (isScalar(item)) {
				// A repeated sibling
				setText(dom, appendElement(dom, parent, tagName, namespace), scalarText(item));
			} else if (item instanceof Map<?, ?> record && asSequence(record) == null) {
				Element element = appendElement(dom, parent, tagName, namespace);
				encodeContent(dom, element, stringKeys(record, tagName), namespace);
			} else {
				throw new InvalidStructureException(String.format(
					"The node \"%s\" allows sequences, but their items must be records of other nodes or scalars. The current value is incorrect: %s",
					tagName, item));
			}
		}
	}

	private void setAttributes(Element element, Map<?, ?> attributes) {
		// Declarations first, so prefixed names can be resolved
		List<Map.Entry<?, ?>> ordered = new ArrayList<>();
		for (Map.Entry<?, ?> entry : attributes.entrySet()) {
			if (isNamespaceDeclaration(String.valueOf(entry.getKey()))) {
				ordered.add(entry);
			}
		}
		for (Map.Entry<?, ?> entry : attributes.entrySet()) {
			if (!isNamespaceDeclaration(String.valueOf(entry.getKey()))) {
				ordered.add(entry);
			}
		}
		for (Map.Entry<?, ?> entry : ordered) {
			String name = String.valueOf(entry.getKey());
			Object value = entry.getValue();
			if (!isScalar(value)) {
				throw new InvalidStructureException(String.format(
					"The value for the attribute \"%s\" of the node \"%s\" is incorrect (cannot be a structure). The value is: %s",
					name, element.getTagName(), value));
			}
			if (!isSkipped(value)) {
				setAttribute(element, name, scalarText(value));
			}
		}
	}

	private static void setAttribute(Element element, String name, String value) {
		try {
			if (isNamespaceDeclaration(name)) {
				element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, name, value);
				return;
			}
			int colon = name.indexOf(':');
			if (colon < 0) {
				element.setAttributeNS(null, name, value);
				return;
			}
			String prefix = name.substring(0, colon);
			String uri = element.lookupNamespaceURI(prefix);
			if (uri == null) {
				uri = WELL_KNOWN_PREFIXES.get(prefix);
			}
			if (uri == null) {
				throw new InvalidStructureException("The attribute \"" + name + "\" of the node \"" + element.getTagName() + "\" uses an undeclared prefix");
			}
			element.setAttributeNS(uri, name, value);
		} catch (DOMException e) {
			throw new InvalidStructureException("Invalid attribute \"" + name + "\" on node \"" + element.getTagName() + "\"", e);
		}
	}

	private static boolean isNamespaceDeclaration(String name) {
		return name.equals(XMLConstants.XMLNS_ATTRIBUTE) || name.startsWith(XMLConstants.XMLNS_ATTRIBUTE + ":");
	}

	private static Element appendElement(Document dom, Node parent, String tagName, @Nullable Namespace namespace) {
		Element element;
		try {
			if (namespace == null) {
				element = dom.createElementNS(null, tagName);
			} else {
				element = dom.createElementNS(namespace.uri(), namespace.qualify(tagName));
			}
			parent.appendChild(element);
		} catch (DOMException e) {
			if (e.code == DOMException.HIERARCHY_REQUEST_ERR) {
				throw new InvalidStructureException("The document already has a root element; cannot add another one named \"" + tagName + "\"", e);
			}
			if (e.code == DOMException.INVALID_CHARACTER_ERR || e.code == DOMException.NAMESPACE_ERR) {
				throw new InvalidStructureException("Invalid node name \"" + tagName + "\"", e);
			}
			throw new InvalidStructureException("Cannot append node \"" + tagName + "\" to \"" + parent.getNodeName() + "\": " + e.getMessage(), e);
		}
		if (namespace != null) {
			String prefix = namespace.hasPrefix() ? namespace.prefix() : null;
			if (!namespace.uri().equals(parent.lookupNamespaceURI(prefix))) {
				element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, namespace.declarationName(), namespace.uri());
			}
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Appended <{}> to <{}>", element.getTagName(), parent.getNodeName());
		}
		return element;
	}

	/**
	 * Replaces the content of {@code node} with {@code text}. An empty string still
	 * leaves an empty text node, so the element serializes with an end tag.
	 */
	private static void setText(Document dom, Node node, String text) {
		while (node.getFirstChild() != null) {
			node.removeChild(node.getFirstChild());
		}
		node.appendChild(dom.createTextNode(TextNormalizer.resolveReferences(TextNormalizer.sanitize(text))));
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> stringKeys(Map<?, ?> record, String tagName) {
		for (Object key : record.keySet()) {
			if (!(key instanceof String)) {
				throw new InvalidStructureException("The node \"" + tagName + "\" has a non-text key: " + key);
			}
		}
		return (Map<String, ?>) record;
	}

	private static final Map<String, String> WELL_KNOWN_PREFIXES = Map.of(
		"xsi", XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI,
		XMLConstants.XML_NS_PREFIX, XMLConstants.XML_NS_URI);

	private static final Logger LOGGER = LoggerFactory.getLogger(DefaultXmlEncoder.class);
}
