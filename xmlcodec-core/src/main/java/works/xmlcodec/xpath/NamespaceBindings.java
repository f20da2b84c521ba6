package works.xmlcodec.xpath;

import java.util.Iterator;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.namespace.NamespaceContext;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
final class NamespaceBindings implements NamespaceContext {
	private final Map<String, String> uriByPrefix;

	@Override
	public String getNamespaceURI(String prefix) {
		if (prefix == null) {
			throw new IllegalArgumentException("Namespace prefix cannot be null");
		}
		return switch (prefix) {
			case XMLConstants.XML_NS_PREFIX -> XMLConstants.XML_NS_URI;
			case XMLConstants.XMLNS_ATTRIBUTE -> XMLConstants.XMLNS_ATTRIBUTE_NS_URI;
			default -> uriByPrefix.getOrDefault(prefix, XMLConstants.NULL_NS_URI);
		};
	}

	@Override
	public String getPrefix(String namespaceURI) {
		Iterator<String> prefixes = getPrefixes(namespaceURI);
		return prefixes.hasNext() ? prefixes.next() : null;
	}

	@Override
	public Iterator<String> getPrefixes(String namespaceURI) {
		return uriByPrefix.entrySet().stream()
			.filter(e -> e.getValue().equals(namespaceURI))
			.map(Map.Entry::getKey)
			.iterator();
	}
}
