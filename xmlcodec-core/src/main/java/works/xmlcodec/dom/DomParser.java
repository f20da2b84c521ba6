package works.xmlcodec.dom;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import works.xmlcodec.exceptions.MalformedXmlException;

/**
 * Namespace-aware, whitespace-preserving parsing into a DOM tree.
 * External entities and DTDs are never fetched.
 */
public final class DomParser {
	private DomParser() {
	}

	public static Document newDocument() {
		return newBuilder().newDocument();
	}

	/**
	 * @throws MalformedXmlException carrying the engine's diagnostics.
	 */
	public static Document parse(byte[] xml) {
		return parse(new InputSource(new ByteArrayInputStream(xml)));
	}

	/**
	 * Parses already-decoded text; any encoding named by its declaration is ignored.
	 */
	public static Document parse(String xml) {
		return parse(new InputSource(new StringReader(xml)));
	}

	private static Document parse(InputSource source) {
		DocumentBuilder builder = newBuilder();
		DiagnosticCollector collector = new DiagnosticCollector();
		builder.setErrorHandler(collector);
		try {
			Document document = builder.parse(source);
			LOGGER.debug("Parsed document with root <{}>", document.getDocumentElement() == null ? null : document.getDocumentElement().getTagName());
			return document;
		} catch (SAXException e) {
			LOGGER.debug("Parse failed: {}", e.getMessage());
			if (collector.diagnostics().isEmpty()) {
				throw new MalformedXmlException("The XML could not be loaded: " + e.getMessage(), e);
			}
			throw new MalformedXmlException("The XML could not be loaded.", collector.diagnostics());
		} catch (IOException e) {
			throw new MalformedXmlException("The XML could not be read", e);
		}
	}

	private static DocumentBuilder newBuilder() {
		try {
			return newFactory().newDocumentBuilder();
		} catch (ParserConfigurationException e) {
			throw new IllegalStateException("XML parser is not available", e);
		}
	}

	private static DocumentBuilderFactory newFactory() {
		DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
		factory.setNamespaceAware(true);
		factory.setIgnoringElementContentWhitespace(false);
		factory.setXIncludeAware(false);
		factory.setExpandEntityReferences(true);
		try {
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
			factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
			factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
		} catch (ParserConfigurationException e) {
			throw new IllegalStateException("XML parser does not support secure processing", e);
		}
		return factory;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DomParser.class);
}
