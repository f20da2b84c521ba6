package works.xmlcodec;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import works.xmlcodec.dom.Canonicalization;
import works.xmlcodec.dom.DomParser;
import works.xmlcodec.dom.DomWriter;
import works.xmlcodec.dom.SchemaValidation;
import works.xmlcodec.exceptions.EmptyDocumentException;
import works.xmlcodec.exceptions.MalformedXmlException;
import works.xmlcodec.exceptions.XPathNodeNotFoundException;
import works.xmlcodec.exceptions.XmlDiagnostic;
import works.xmlcodec.text.EncodingTranscoder;
import works.xmlcodec.text.EncodingTranscoder.Prepared;
import works.xmlcodec.text.TextNormalizer;
import works.xmlcodec.xpath.XPathQuery;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.emptyMap;
import static javax.xml.XMLConstants.W3C_XML_SCHEMA_INSTANCE_NS_URI;

/**
 * An XML document together with the version and encoding it is written in.
 * <p>
 * Queries made through the document use prefix-free XPath that matches by local name.
 * The array projection behind {@link #toArray()} and {@link #get} is computed once
 * and kept until {@link #load} or an encoder writes into this document. Code that
 * mutates {@link #getDocument()} directly must call {@link #invalidate()} afterward.
 */
public final class XmlDocument {
	private final XmlDocumentConfig config;
	private Document document;
	private String version;
	private Charset encoding;

	@Nullable private XPathQuery queryEngine;
	@Nullable private Map<String, Object> projection;

	public XmlDocument() {
		this(XmlDocumentConfig.simple());
	}

	public XmlDocument(XmlDocumentConfig config) {
		this.config = config;
		this.document = DomParser.newDocument();
		this.version = config.version();
		this.encoding = config.encoding();
	}

	public XmlDocumentConfig getConfig() {
		return config;
	}

	public Document getDocument() {
		return document;
	}

	@Nullable
	public Element getDocumentElement() {
		return document.getDocumentElement();
	}

	public String getVersion() {
		return version;
	}

	/**
	 * The encoding output is produced in. Starts as the configured one; after {@link #load},
	 * it is whatever the loaded declaration names once UTF-8 conversion has been applied.
	 */
	public Charset getEncoding() {
		return encoding;
	}

	/**
	 * @return the root tag, or null if there is no root yet.
	 */
	@Nullable
	public String getName() {
		Element root = getDocumentElement();
		return root == null ? null : root.getTagName();
	}

	/**
	 * @return the default namespace declared on the root, or null.
	 */
	@Nullable
	public String getNamespace() {
		Element root = getDocumentElement();
		if (root == null) {
			return null;
		}
		String namespace = root.getAttribute("xmlns");
		return namespace.isEmpty() ? null : namespace;
	}

	/**
	 * @return the schema location from the root's {@code xsi:schemaLocation}: the second
	 * token of its namespace/location pair. Null if absent or not a pair.
	 */
	@Nullable
	public String getSchemaLocationHint() {
		Element root = getDocumentElement();
		if (root == null) {
			return null;
		}
		String schemaLocation = root.getAttributeNS(W3C_XML_SCHEMA_INSTANCE_NS_URI, "schemaLocation");
		if (schemaLocation.isEmpty()) {
			schemaLocation = root.getAttribute("xsi:schemaLocation");
		}
		String[] tokens = schemaLocation.trim().split("\\s+");
		return tokens.length < 2 ? null : tokens[1];
	}

	/**
	 * Replaces the content of this document.
	 *
	 * @throws EmptyDocumentException if {@code xml} is empty.
	 * @throws MalformedXmlException  if it cannot be parsed.
	 */
	public XmlDocument load(String xml) {
		if (xml == null || xml.isEmpty()) {
			throw new EmptyDocumentException(EMPTY_MESSAGE);
		}
		return load(EncodingTranscoder.toBytes(xml, config.encoding()));
	}

	/**
	 * Replaces the content of this document. UTF-8 input is converted to the configured
	 * encoding when that encoding is single-byte; input without a declaration is taken
	 * to be in the configured encoding.
	 *
	 * @throws EmptyDocumentException if {@code xml} is empty.
	 * @throws MalformedXmlException  if it cannot be parsed.
	 */
	public XmlDocument load(byte[] xml) {
		if (xml == null || xml.length == 0) {
			throw new EmptyDocumentException(EMPTY_MESSAGE);
		}
		Prepared prepared = EncodingTranscoder.prepareForParsing(xml, config.encoding(), config.version());
		this.document = DomParser.parse(prepared.bytes());
		this.encoding = prepared.encoding();
		this.version = prepared.version();
		invalidate();
		LOGGER.debug("Loaded <{}> as {}", getName(), encoding.name());
		return this;
	}

	/**
	 * The whole document with its declaration, quotes in text escaped.
	 */
	public String saveXml() {
		return TextNormalizer.fixEntities(DomWriter.writeDocument(document, version, encoding, config.formatOutput()));
	}

	/**
	 * {@link #saveXml()} without the declaration, trimmed.
	 */
	public String getXml() {
		return DECLARATION.matcher(saveXml()).replaceFirst("").trim();
	}

	/**
	 * {@link #saveXml()} in this document's encoding.
	 */
	public byte[] toBytes() {
		return saveXml().getBytes(encoding);
	}

	public String c14n() {
		return c14n(C14nMethod.INCLUSIVE, null);
	}

	/**
	 * @param xpath selects the node to canonicalize; the first match is used.
	 *              The whole document if null.
	 * @return the canonical form as produced, before any entity or encoding fix-up.
	 * @throws XPathNodeNotFoundException if {@code xpath} matches nothing.
	 */
	public String c14n(C14nMethod method, @Nullable String xpath) {
		Node node = xpath == null ? document : requireNode(xpath);
		return new String(Canonicalization.canonicalize(node, method), UTF_8);
	}

	public byte[] c14nWithWorkingEncoding() {
		return c14nWithWorkingEncoding(null);
	}

	/**
	 * Inclusive canonical form with quotes in text escaped, in this document's encoding.
	 * This is the form signatures are computed over.
	 */
	public byte[] c14nWithWorkingEncoding(@Nullable String xpath) {
		String canonical = TextNormalizer.fixEntities(c14n(C14nMethod.INCLUSIVE, xpath));
		return EncodingTranscoder.fromUtf8(canonical.getBytes(UTF_8), encoding);
	}

	public byte[] c14nWithWorkingEncodingFlattened() {
		return c14nWithWorkingEncodingFlattened(null);
	}

	/**
	 * As {@link #c14nWithWorkingEncoding(String)}, with whitespace between tags removed.
	 */
	public byte[] c14nWithWorkingEncodingFlattened(@Nullable String xpath) {
		String canonical = TextNormalizer.fixEntities(c14n(C14nMethod.INCLUSIVE, xpath));
		String flattened = BETWEEN_TAGS.matcher(canonical).replaceAll("><");
		return EncodingTranscoder.fromUtf8(flattened.getBytes(UTF_8), encoding);
	}

	/**
	 * @return canonical form of the {@code Signature} element directly under the root, or null if there is none.
	 */
	@Nullable
	public String getSignatureNodeXml() {
		Element root = getDocumentElement();
		if (root == null) {
			return null;
		}
		String rootName = root.getLocalName() != null ? root.getLocalName() : root.getTagName();
		List<Node> nodes = getNodes("/" + rootName + "/Signature");
		return nodes.isEmpty() ? null : new String(Canonicalization.canonicalize(nodes.get(0), C14nMethod.INCLUSIVE), UTF_8);
	}

	@Nullable
	public Object query(String xpath) {
		return query(xpath, emptyMap());
	}

	/**
	 * @see XPathQuery#get(String, Map, Node)
	 */
	@Nullable
	public Object query(String xpath, Map<String, ?> params) {
		return queryEngine().get(xpath, params);
	}

	public List<Node> getNodes(String xpath) {
		return getNodes(xpath, emptyMap());
	}

	public List<Node> getNodes(String xpath, Map<String, ?> params) {
		return queryEngine().getNodes(xpath, params);
	}

	@Nullable
	public Object get(String selector) {
		return get(selector, null);
	}

	/**
	 * Walks {@link #toArray()} along a dot-separated path. Numeric segments index into lists.
	 *
	 * @return the value found, or {@code defaultValue} if the path leads nowhere.
	 */
	@Nullable
	public Object get(String selector, @Nullable Object defaultValue) {
		Object current = toArray();
		for (String key : selector.split("\\.", -1)) {
			if (current instanceof Map<?, ?> map && map.containsKey(key)) {
				current = map.get(key);
			} else if (current instanceof List<?> list && isIndex(key, list.size())) {
				current = list.get(Integer.parseInt(key));
			} else {
				return defaultValue;
			}
		}
		return current;
	}

	/**
	 * The whole document as nested maps, lists and strings, keyed by tag names.
	 * Attributes are not included.
	 *
	 * @see XPathQuery#project(Node)
	 */
	public Map<String, Object> toArray() {
		if (projection == null) {
			Object result = query("/");
			if (result instanceof Map<?, ?>) {
				@SuppressWarnings("unchecked")
				Map<String, Object> map = (Map<String, Object>) result;
				projection = Collections.unmodifiableMap(map);
			} else {
				projection = Collections.unmodifiableMap(new LinkedHashMap<>());
			}
		}
		return projection;
	}

	public boolean schemaValidate(Path schemaPath) {
		return schemaValidate(schemaPath, d -> { });
	}

	/**
	 * @param diagnostics receives every problem reported, including warnings.
	 * @return whether the document is valid.
	 */
	public boolean schemaValidate(Path schemaPath, Consumer<XmlDiagnostic> diagnostics) {
		List<XmlDiagnostic> reported = SchemaValidation.validate(document, schemaPath);
		reported.forEach(diagnostics);
		return SchemaValidation.isValid(reported);
	}

	/**
	 * Drops what has been derived from the tree so far.
	 */
	public void invalidate() {
		queryEngine = null;
		projection = null;
	}

	@Override
	public String toString() {
		return getXml();
	}

	private XPathQuery queryEngine() {
		if (queryEngine == null) {
			queryEngine = new XPathQuery(document);
		}
		return queryEngine;
	}

	private Node requireNode(String xpath) {
		List<Node> nodes = getNodes(xpath);
		if (nodes.isEmpty()) {
			throw new XPathNodeNotFoundException(String.format("Unable to find the node with the XPath %s.", xpath));
		}
		return nodes.get(0);
	}

	private static boolean isIndex(String key, int size) {
		if (key.isEmpty() || key.length() > 9 || !key.chars().allMatch(Character::isDigit)) {
			return false;
		}
		return Integer.parseInt(key) < size;
	}

	private static final String EMPTY_MESSAGE = "The XML content that you want to load is empty.";
	private static final Pattern DECLARATION = Pattern.compile("^\\s*<\\?xml[^?]*\\?>", Pattern.CASE_INSENSITIVE);
	private static final Pattern BETWEEN_TAGS = Pattern.compile(">\\s+<");
	private static final Logger LOGGER = LoggerFactory.getLogger(XmlDocument.class);
}
