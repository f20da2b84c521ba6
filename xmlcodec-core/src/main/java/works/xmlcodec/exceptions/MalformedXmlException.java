package works.xmlcodec.exceptions;

import java.util.List;

/**
 * The input could not be parsed as XML.
 */
public final class MalformedXmlException extends XmlException {
	public MalformedXmlException(String message) {
		super(message);
	}

	public MalformedXmlException(Throwable cause) {
		super(cause);
	}

	public MalformedXmlException(String message, Throwable cause) {
		super(message, cause);
	}

	public MalformedXmlException(String message, List<XmlDiagnostic> diagnostics) {
		super(message, diagnostics);
	}
}
