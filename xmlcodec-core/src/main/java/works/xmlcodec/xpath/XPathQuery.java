package works.xmlcodec.xpath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import works.xmlcodec.XmlDocument;
import works.xmlcodec.dom.DomParser;
import works.xmlcodec.exceptions.InvalidXPathException;
import works.xmlcodec.exceptions.InvalidXmlException;
import works.xmlcodec.exceptions.MalformedXmlException;

import static java.util.Collections.emptyMap;

/**
 * XPath 1.0 queries over one document, with {@code :name} parameters and
 * projection of matched nodes into nested maps and lists.
 * <p>
 * When constructed without namespaces, queries are written without prefixes
 * and match elements by local name whatever their namespace. When namespaces
 * are given, queries must use the registered prefixes.
 */
public final class XPathQuery {
	private final Document document;
	private final Map<String, String> namespaces;
	private final XPath xpath;

	public XPathQuery(String xml) {
		this(xml, emptyMap());
	}

	/**
	 * @throws InvalidXmlException if {@code xml} is not well-formed.
	 */
	public XPathQuery(String xml, Map<String, String> namespaces) {
		this(parse(xml), namespaces);
	}

	public XPathQuery(XmlDocument document, Map<String, String> namespaces) {
		this(document.getDocument(), namespaces);
	}

	public XPathQuery(Document document) {
		this(document, emptyMap());
	}

	public XPathQuery(Document document, Map<String, String> namespaces) {
		this.document = document;
		this.namespaces = Map.copyOf(namespaces);
		this.xpath = XPathFactory.newInstance().newXPath();
		if (!this.namespaces.isEmpty()) {
			xpath.setNamespaceContext(new NamespaceBindings(this.namespaces));
		}
	}

	public Document getDocument() {
		return document;
	}

	public Map<String, String> getNamespaces() {
		return namespaces;
	}

	public boolean isNamespaceAware() {
		return !namespaces.isEmpty();
	}

	@Nullable
	public Object get(String query) {
		return get(query, emptyMap(), null);
	}

	@Nullable
	public Object get(String query, Map<String, ?> params) {
		return get(query, params, null);
	}

	/**
	 * @return null if nothing matched; the projection of the node if exactly one did;
	 * otherwise a list of projections in document order.
	 * @see #project(Node)
	 */
	@Nullable
	public Object get(String query, Map<String, ?> params, @Nullable Node contextNode) {
		List<Node> nodes = getNodes(query, params, contextNode);
		if (nodes.isEmpty()) {
			return null;
		} else if (nodes.size() == 1) {
			return project(nodes.get(0));
		}
		List<Object> result = new ArrayList<>(nodes.size());
		for (Node node : nodes) {
			result.add(project(node));
		}
		return result;
	}

	public List<String> getValues(String query) {
		return getValues(query, emptyMap(), null);
	}

	public List<String> getValues(String query, Map<String, ?> params, @Nullable Node contextNode) {
		List<String> result = new ArrayList<>();
		for (Node node : getNodes(query, params, contextNode)) {
			result.add(textOf(node));
		}
		return result;
	}

	@Nullable
	public String getValue(String query) {
		return getValue(query, emptyMap(), null);
	}

	@Nullable
	public String getValue(String query, Map<String, ?> params, @Nullable Node contextNode) {
		List<Node> nodes = getNodes(query, params, contextNode);
		return nodes.isEmpty() ? null : textOf(nodes.get(0));
	}

	public List<Node> getNodes(String query) {
		return getNodes(query, emptyMap(), null);
	}

	public List<Node> getNodes(String query, Map<String, ?> params) {
		return getNodes(query, params, null);
	}

	/**
	 * @param contextNode where relative queries start; the document if null.
	 * @throws InvalidXPathException if the query does not compile, or does not select nodes.
	 */
	public List<Node> getNodes(String query, Map<String, ?> params, @Nullable Node contextNode) {
		String resolved = resolve(query, params);
		NodeList nodeList;
		try {
			nodeList = (NodeList) xpath.evaluate(resolved, contextNode == null ? document : contextNode, XPathConstants.NODESET);
		} catch (XPathExpressionException e) {
			String reason = e.getMessage() != null ? e.getMessage() : String.valueOf(e.getCause());
			throw new InvalidXPathException(
				String.format("An error occurred while executing the XPath expression: %s. %s", resolved, reason), e);
		}
		List<Node> result = new ArrayList<>(nodeList.getLength());
		for (int i = 0; i < nodeList.getLength(); i++) {
			result.add(nodeList.item(i));
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Query {} matched {} nodes", resolved, result.size());
		}
		return result;
	}

	/**
	 * The query as it is handed to the evaluator.
	 */
	public String resolve(String query, Map<String, ?> params) {
		String result = isNamespaceAware() ? query : XPathLiterals.ignoreNamespaces(query);
		return XPathLiterals.substitute(result, params);
	}

	/**
	 * A node as nested data: its text if it has no child elements, otherwise a map from
	 * child tag name to the child's projection. Tags that occur more than once map to a list.
	 */
	@Nullable
	public static Object project(Node node) {
		Map<String, Object> children = new LinkedHashMap<>();
		Map<String, Integer> occurrences = new LinkedHashMap<>();
		for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
			if (child.getNodeType() != Node.ELEMENT_NODE) {
				continue;
			}
			String name = child.getNodeName();
			int count = occurrences.merge(name, 1, Integer::sum);
			Object value = project(child);
			if (count == 1) {
				children.put(name, value);
			} else {
				if (count == 2) {
					List<Object> list = new ArrayList<>();
					list.add(children.get(name));
					children.put(name, list);
				}
				@SuppressWarnings("unchecked")
				List<Object> list = (List<Object>) children.get(name);
				list.add(value);
			}
		}
		return children.isEmpty() ? textOf(node) : children;
	}

	/**
	 * The node's value: text content for elements, nothing for the document itself.
	 */
	@Nullable
	public static String textOf(Node node) {
		return switch (node.getNodeType()) {
			case Node.DOCUMENT_NODE -> null;
			case Node.ELEMENT_NODE, Node.DOCUMENT_FRAGMENT_NODE, Node.ENTITY_REFERENCE_NODE -> node.getTextContent();
			default -> node.getNodeValue();
		};
	}

	private static Document parse(String xml) {
		try {
			return DomParser.parse(xml);
		} catch (MalformedXmlException e) {
			throw new InvalidXmlException("The provided XML is not valid: " + e.getMessage(), e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(XPathQuery.class);
}
