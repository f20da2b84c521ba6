package works.xmlcodec.codec;

import java.util.Map;
import org.w3c.dom.Element;
import works.xmlcodec.XmlDocument;

/**
 * Reads nested data out of XML; the inverse of {@link XmlEncoder}.
 */
public interface XmlDecoder {
	/**
	 * @return a single-entry map from the root tag to its content, or an empty map if there is no root.
	 */
	Map<String, Object> decode(XmlDocument document);

	Map<String, Object> decode(Element element);

	/**
	 * Accumulates the content of {@code element} into {@code into}.
	 *
	 * @param twinsAsArray if true, the element's own entries are merged into {@code into} directly
	 *                     rather than nested under its tag; this is how one item of a repeated tag is filled in.
	 * @return {@code into}
	 */
	Map<String, Object> decode(Element element, Map<String, Object> into, boolean twinsAsArray);
}
