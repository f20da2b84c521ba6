package works.xmlcodec.dom;

import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.DocumentType;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import works.xmlcodec.text.EncodingTranscoder;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Serializes a DOM tree to text destined for a given encoding.
 * <p>
 * With formatting on, element-only content is indented by two spaces per level;
 * elements holding any text keep their content exactly as it is. Characters
 * the target encoding cannot carry are written as decimal character references.
 * Quotes in text are left literal.
 */
public final class DomWriter {
	private final CharsetEncoder encoder;
	private final boolean utf8;
	private final boolean formatOutput;
	private final StringBuilder out = new StringBuilder();

	private DomWriter(Charset encoding, boolean formatOutput) {
		this.encoder = encoding.newEncoder();
		this.utf8 = encoding.equals(UTF_8);
		this.formatOutput = formatOutput;
	}

	/**
	 * The whole document: declaration, then each top-level node on its own line.
	 */
	public static String writeDocument(Document document, String version, Charset encoding, boolean formatOutput) {
		DomWriter writer = new DomWriter(encoding, formatOutput);
		writer.out.append(EncodingTranscoder.declarationText(version, encoding.name(), null)).append('\n');
		NodeList children = document.getChildNodes();
		for (int i = 0; i < children.getLength(); i++) {
			writer.node(children.item(i), 0);
			writer.out.append('\n');
		}
		return writer.out.toString();
	}

	/**
	 * A single node and its descendants, without a declaration.
	 */
	public static String writeNode(Node node, Charset encoding, boolean formatOutput) {
		if (node instanceof Document document) {
			return writeDocument(document, document.getXmlVersion(), encoding, formatOutput);
		}
		DomWriter writer = new DomWriter(encoding, formatOutput);
		writer.node(node, 0);
		return writer.out.toString();
	}

	private void node(Node node, int level) {
		switch (node.getNodeType()) {
			case Node.ELEMENT_NODE -> element((Element) node, level);
			case Node.TEXT_NODE -> text(node.getNodeValue());
			case Node.CDATA_SECTION_NODE -> out.append("<![CDATA[").append(node.getNodeValue()).append("]]>");
			case Node.COMMENT_NODE -> out.append("<!--").append(node.getNodeValue()).append("-->");
			case Node.PROCESSING_INSTRUCTION_NODE -> {
				out.append("<?").append(node.getNodeName());
				String data = node.getNodeValue();
				if (data != null && !data.isEmpty()) {
					out.append(' ').append(data);
				}
				out.append("?>");
			}
			case Node.ENTITY_REFERENCE_NODE -> out.append('&').append(node.getNodeName()).append(';');
			case Node.DOCUMENT_TYPE_NODE -> doctype((DocumentType) node);
			case Node.ATTRIBUTE_NODE -> attributeValue(node.getNodeValue());
			default -> {
				NodeList children = node.getChildNodes();
				for (int i = 0; i < children.getLength(); i++) {
					node(children.item(i), level);
				}
			}
		}
	}

	private void element(Element element, int level) {
		String name = element.getTagName();
		out.append('<').append(name);
		NamedNodeMap attributes = element.getAttributes();
		for (int i = 0; i < attributes.getLength(); i++) {
			Attr attr = (Attr) attributes.item(i);
			out.append(' ').append(attr.getName()).append("=\"");
			attributeValue(attr.getValue());
			out.append('"');
		}
		NodeList children = element.getChildNodes();
		if (children.getLength() == 0) {
			out.append("/>");
			return;
		}
		out.append('>');
		boolean indent = formatOutput && !hasTextChild(children);
		for (int i = 0; i < children.getLength(); i++) {
			if (indent) {
				newline(level + 1);
			}
			node(children.item(i), level + 1);
		}
		if (indent) {
			newline(level);
		}
		out.append("</").append(name).append('>');
	}

	private void doctype(DocumentType doctype) {
		out.append("<!DOCTYPE ").append(doctype.getName());
		if (doctype.getPublicId() != null) {
			out.append(" PUBLIC \"").append(doctype.getPublicId()).append('"');
			if (doctype.getSystemId() != null) {
				out.append(" \"").append(doctype.getSystemId()).append('"');
			}
		} else if (doctype.getSystemId() != null) {
			out.append(" SYSTEM \"").append(doctype.getSystemId()).append('"');
		}
		if (doctype.getInternalSubset() != null) {
			out.append(" [").append(doctype.getInternalSubset()).append(']');
		}
		out.append('>');
	}

	private void text(String value) {
		value.codePoints().forEach(c -> {
			switch (c) {
				case '&' -> out.append("&amp;");
				case '<' -> out.append("&lt;");
				case '>' -> out.append("&gt;");
				case '\r' -> out.append("&#13;");
				default -> character(c);
			}
		});
	}

	private void attributeValue(String value) {
		value.codePoints().forEach(c -> {
			switch (c) {
				case '&' -> out.append("&amp;");
				case '<' -> out.append("&lt;");
				case '>' -> out.append("&gt;");
				case '"' -> out.append("&quot;");
				case '\t' -> out.append("&#9;");
				case '\n' -> out.append("&#10;");
				case '\r' -> out.append("&#13;");
				default -> character(c);
			}
		});
	}

	private void character(int codePoint) {
		if (utf8 || canEncode(codePoint)) {
			out.appendCodePoint(codePoint);
		} else {
			out.append("&#").append(codePoint).append(';');
		}
	}

	private boolean canEncode(int codePoint) {
		if (Character.isBmpCodePoint(codePoint)) {
			return encoder.canEncode((char) codePoint);
		}
		return encoder.canEncode(new String(Character.toChars(codePoint)));
	}

	private void newline(int level) {
		out.append('\n');
		for (int i = 0; i < level; i++) {
			out.append(INDENT);
		}
	}

	private static boolean hasTextChild(NodeList children) {
		for (int i = 0; i < children.getLength(); i++) {
			short type = children.item(i).getNodeType();
			if (type == Node.TEXT_NODE || type == Node.ENTITY_REFERENCE_NODE) {
				return true;
			}
		}
		return false;
	}

	private static final String INDENT = "  ";
}
