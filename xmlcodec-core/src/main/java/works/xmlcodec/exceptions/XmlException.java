package works.xmlcodec.exceptions;

import java.util.List;

/**
 * Base of every failure raised while building, loading, querying or validating XML.
 * <p>
 * Where the underlying engine reported positioned problems, they are available
 * from {@link #diagnostics()} and are also appended to the message.
 */
public sealed abstract class XmlException extends RuntimeException permits
	EmptyDocumentException,
	MalformedXmlException,
	InvalidStructureException,
	InvalidXPathException,
	InvalidXmlException,
	XPathNodeNotFoundException,
	SchemaValidationException
{
	private final List<XmlDiagnostic> diagnostics;

	protected XmlException(String message) {
		this(message, List.of());
	}

	protected XmlException(Throwable cause) {
		super(cause);
		this.diagnostics = List.of();
	}

	protected XmlException(String message, Throwable cause) {
		super(message, cause);
		this.diagnostics = List.of();
	}

	protected XmlException(String message, List<XmlDiagnostic> diagnostics) {
		super(withDiagnostics(message, diagnostics));
		this.diagnostics = List.copyOf(diagnostics);
	}

	public List<XmlDiagnostic> diagnostics() {
		return diagnostics;
	}

	private static String withDiagnostics(String message, List<XmlDiagnostic> diagnostics) {
		if (diagnostics.isEmpty()) {
			return message;
		}
		StringBuilder sb = new StringBuilder(message);
		for (XmlDiagnostic d : diagnostics) {
			sb.append("\n").append(d.format());
		}
		return sb.toString();
	}
}
