package works.xmlcodec.exceptions;

import java.util.List;

/**
 * A query engine was given text that is not well-formed XML.
 */
public final class InvalidXmlException extends XmlException {
	public InvalidXmlException(String message) {
		super(message);
	}

	public InvalidXmlException(Throwable cause) {
		super(cause);
	}

	public InvalidXmlException(String message, Throwable cause) {
		super(message, cause);
	}

	public InvalidXmlException(String message, List<XmlDiagnostic> diagnostics) {
		super(message, diagnostics);
	}
}
