package works.xmlcodec;

import java.nio.file.Path;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.w3c.dom.Element;
import works.xmlcodec.codec.DefaultXmlDecoder;
import works.xmlcodec.codec.DefaultXmlEncoder;
import works.xmlcodec.codec.XmlDecoder;
import works.xmlcodec.codec.XmlEncoder;
import works.xmlcodec.validation.SchemaXmlValidator;
import works.xmlcodec.validation.XmlValidator;

/**
 * One entry point for encoding, decoding and validating.
 */
@RequiredArgsConstructor
public final class XmlService {
	private final XmlEncoder encoder;
	private final XmlDecoder decoder;
	private final XmlValidator validator;

	public static XmlService simple() {
		return new XmlService(new DefaultXmlEncoder(), new DefaultXmlDecoder(), new SchemaXmlValidator());
	}

	public XmlDocument encode(Map<String, ?> data) {
		return encoder.encode(data);
	}

	public XmlDocument encode(Map<String, ?> data, @Nullable Namespace namespace) {
		return encoder.encode(data, namespace);
	}

	public XmlDocument encode(Map<String, ?> data, @Nullable Namespace namespace, @Nullable Element parent, @Nullable XmlDocument document) {
		return encoder.encode(data, namespace, parent, document);
	}

	public Map<String, Object> decode(XmlDocument document) {
		return decoder.decode(document);
	}

	public Map<String, Object> decode(Element element) {
		return decoder.decode(element);
	}

	public void validate(XmlDocument document) {
		validator.validate(document);
	}

	public void validate(XmlDocument document, @Nullable Path schemaPath) {
		validator.validate(document, schemaPath);
	}
}
