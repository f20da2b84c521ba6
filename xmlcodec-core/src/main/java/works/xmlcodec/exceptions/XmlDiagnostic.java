package works.xmlcodec.exceptions;

import static java.util.Objects.requireNonNull;

/**
 * One problem reported by the XML engine, positioned in the input.
 * Line and column are 1-based; -1 when the engine could not tell.
 */
public record XmlDiagnostic(
	Severity severity,
	int line,
	int column,
	String message
) {
	public XmlDiagnostic {
		requireNonNull(severity);
		requireNonNull(message);
	}

	public enum Severity {
		WARNING("Warning"),
		ERROR("Error"),
		FATAL("Fatal");

		private final String label;

		Severity(String label) {
			this.label = label;
		}

		public String label() {
			return label;
		}
	}

	public XmlDiagnostic withMessage(String newMessage) {
		return new XmlDiagnostic(severity, line, column, newMessage);
	}

	public String format() {
		return "Error " + severity.label() + ": " + message.trim() + " in line " + line + ", column " + column + ".";
	}
}
