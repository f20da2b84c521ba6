package works.xmlcodec.dom;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.transform.dom.DOMSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import works.xmlcodec.exceptions.SchemaValidationException;
import works.xmlcodec.exceptions.XmlDiagnostic;

/**
 * XSD validation of an in-memory document.
 */
public final class SchemaValidation {
	private SchemaValidation() {
	}

	/**
	 * @return every problem found; the document is valid if none of them is an error.
	 * @throws SchemaValidationException if the schema itself cannot be loaded.
	 */
	public static List<XmlDiagnostic> validate(Document document, Path schemaPath) {
		Schema schema;
		try {
			SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
			schema = factory.newSchema(schemaPath.toFile());
		} catch (SAXException e) {
			throw new SchemaValidationException("Unable to load the schema " + schemaPath, e);
		}

		Validator validator = schema.newValidator();
		DiagnosticCollector collector = new DiagnosticCollector();
		validator.setErrorHandler(collector);
		try {
			validator.validate(new DOMSource(document));
		} catch (SAXException e) {
			if (!collector.hasErrors()) {
				throw new SchemaValidationException("Validation against " + schemaPath + " failed", e);
			}
			LOGGER.debug("Validation against {} stopped early: {}", schemaPath, e.getMessage());
		} catch (IOException e) {
			throw new SchemaValidationException("Unable to read while validating against " + schemaPath, e);
		}
		List<XmlDiagnostic> diagnostics = collector.diagnostics();
		LOGGER.debug("Validated against {}: {} diagnostics", schemaPath, diagnostics.size());
		return diagnostics;
	}

	public static boolean isValid(List<XmlDiagnostic> diagnostics) {
		return diagnostics.stream().allMatch(d -> d.severity() == XmlDiagnostic.Severity.WARNING);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaValidation.class);
}
