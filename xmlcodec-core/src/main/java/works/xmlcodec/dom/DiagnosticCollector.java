package works.xmlcodec.dom;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;
import works.xmlcodec.exceptions.XmlDiagnostic;
import works.xmlcodec.exceptions.XmlDiagnostic.Severity;

/**
 * Records what the engine reports instead of letting it print to stderr.
 * Fatal errors are recorded and then rethrown, because the engine cannot continue past them.
 */
final class DiagnosticCollector implements ErrorHandler {
	private final List<XmlDiagnostic> diagnostics = new ArrayList<>();

	@Override
	public void warning(SAXParseException exception) {
		record(Severity.WARNING, exception);
	}

	@Override
	public void error(SAXParseException exception) {
		record(Severity.ERROR, exception);
	}

	@Override
	public void fatalError(SAXParseException exception) throws SAXParseException {
		record(Severity.FATAL, exception);
		throw exception;
	}

	List<XmlDiagnostic> diagnostics() {
		return List.copyOf(diagnostics);
	}

	boolean hasErrors() {
		return diagnostics.stream().anyMatch(d -> d.severity() != Severity.WARNING);
	}

	private void record(Severity severity, SAXParseException exception) {
		XmlDiagnostic diagnostic = new XmlDiagnostic(
			severity,
			exception.getLineNumber(),
			exception.getColumnNumber(),
			String.valueOf(exception.getMessage()));
		LOGGER.trace("{}", diagnostic);
		diagnostics.add(diagnostic);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticCollector.class);
}
