package works.xmlcodec.codec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import javax.xml.XMLConstants;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.Text;
import works.xmlcodec.XmlDocument;

import static works.xmlcodec.codec.Structures.ATTRIBUTES;
import static works.xmlcodec.codec.Structures.VALUE;

/**
 * The content of an element decodes to:
 * <ul>
 *     <li>its text, if it has neither attributes nor child elements (empty text if it has no text either);</li>
 *     <li>otherwise a map holding {@value Structures#ATTRIBUTES}, {@value Structures#VALUE} for any text,
 *     and one entry per child tag. A tag occurring more than once maps to a list.</li>
 * </ul>
 * Whitespace-only text is ignored when looking for content. Several text fragments
 * interrupted by child elements are trimmed and joined with a single space.
 * Namespace declarations are not reported as attributes.
 */
public final class DefaultXmlDecoder implements XmlDecoder {
	@Override
	public Map<String, Object> decode(XmlDocument document) {
		Element root = document.getDocument().getDocumentElement();
		if (root == null) {
			return new LinkedHashMap<>();
		}
		return decode(root);
	}

	@Override
	public Map<String, Object> decode(Element element) {
		return decode(element, new LinkedHashMap<>(), false);
	}

	@Override
	public Map<String, Object> decode(Element element, Map<String, Object> into, boolean twinsAsArray) {
		Object content = contentOf(element);
		if (twinsAsArray && content instanceof Map<?, ?> entries) {
			entries.forEach((k, v) -> into.put((String) k, v));
		} else {
			into.put(element.getTagName(), content);
		}
		return into;
	}

	private Object contentOf(Element element) {
		Map<String, String> attributes = attributesOf(element);
		Map<String, Integer> occurrences = countChildTags(element);
		Map<String, Object> children = new LinkedHashMap<>();
		List<String> fragments = new ArrayList<>();

		for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
			if (child instanceof Text t) {
				String value = t.getData();
				if (!value.isBlank()) {
					fragments.add(value);
				}
			} else if (child instanceof Element e) {
				String tag = e.getTagName();
				if (occurrences.get(tag) == 1) {
					children.put(tag, contentOf(e));
				} else {
					@SuppressWarnings("unchecked")
					List<Object> twins = (List<Object>) children.computeIfAbsent(tag, k -> new ArrayList<>());
					twins.add(contentOf(e));
				}
			}
		}

		String text = joinFragments(fragments);
		if (attributes.isEmpty() && children.isEmpty()) {
			return text == null ? "" : text;
		}
		Map<String, Object> result = new LinkedHashMap<>();
		if (!attributes.isEmpty()) {
			result.put(ATTRIBUTES, attributes);
		}
		if (text != null) {
			result.put(VALUE, text);
		}
		result.putAll(children);
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Decoded <{}>: {} attributes, {} child tags", element.getTagName(), attributes.size(), children.size());
		}
		return result;
	}

	/**
	 * A lone fragment is kept as is; text split up by child elements is trimmed and joined with spaces.
	 */
	@Nullable
	private static String joinFragments(List<String> fragments) {
		if (fragments.isEmpty()) {
			return null;
		} else if (fragments.size() == 1) {
			return fragments.get(0);
		}
		StringJoiner joiner = new StringJoiner(" ");
		fragments.forEach(f -> joiner.add(f.trim()));
		return joiner.toString();
	}

	private static Map<String, String> attributesOf(Element element) {
		Map<String, String> result = new LinkedHashMap<>();
		NamedNodeMap attributes = element.getAttributes();
		for (int i = 0; i < attributes.getLength(); i++) {
			Attr attr = (Attr) attributes.item(i);
			if (!XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
				result.put(attr.getName(), attr.getValue());
			}
		}
		return result;
	}

	private static Map<String, Integer> countChildTags(Element element) {
		Map<String, Integer> result = new LinkedHashMap<>();
		for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
			if (child instanceof Element e) {
				result.merge(e.getTagName(), 1, Integer::sum);
			}
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DefaultXmlDecoder.class);
}
