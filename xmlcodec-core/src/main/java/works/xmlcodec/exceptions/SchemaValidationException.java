package works.xmlcodec.exceptions;

import java.util.List;

/**
 * The document could not be validated against its schema, or did not pass.
 */
public final class SchemaValidationException extends XmlException {
	public SchemaValidationException(String message) {
		super(message);
	}

	public SchemaValidationException(Throwable cause) {
		super(cause);
	}

	public SchemaValidationException(String message, Throwable cause) {
		super(message, cause);
	}

	public SchemaValidationException(String message, List<XmlDiagnostic> diagnostics) {
		super(message, diagnostics);
	}
}
