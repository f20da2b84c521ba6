package works.xmlcodec.codec;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;
import works.xmlcodec.Namespace;
import works.xmlcodec.XmlDocument;
import works.xmlcodec.exceptions.InvalidStructureException;

/**
 * Builds XML from nested data. See {@link Structures} for the shapes accepted.
 */
public interface XmlEncoder {
	default XmlDocument encode(Map<String, ?> data) {
		return encode(data, null, null, null);
	}

	default XmlDocument encode(Map<String, ?> data, @Nullable Namespace namespace) {
		return encode(data, namespace, null, null);
	}

	/**
	 * @param namespace applied to every element created
	 * @param parent    element the data describes the content of; the document itself if null
	 * @param document  document to write into; a new one if null, which requires a null {@code parent}
	 * @return the document written into
	 * @throws InvalidStructureException if the data cannot be represented as XML
	 * @throws IllegalArgumentException if {@code parent} does not belong to {@code document}
	 */
	XmlDocument encode(Map<String, ?> data, @Nullable Namespace namespace, @Nullable Element parent, @Nullable XmlDocument document);
}
