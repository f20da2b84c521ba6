package works.xmlcodec.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.xmlcodec.XmlDocument;
import works.xmlcodec.exceptions.SchemaValidationException;
import works.xmlcodec.exceptions.XmlDiagnostic;

/**
 * XSD validation reporting failures with messages rewritten by a {@link ValidationMessages}.
 */
public final class SchemaXmlValidator implements XmlValidator {
	private final ValidationMessages messages;
	@Nullable private final Path schemaDirectory;

	public SchemaXmlValidator() {
		this(ValidationMessages.defaults(), null);
	}

	public SchemaXmlValidator(ValidationMessages messages) {
		this(messages, null);
	}

	/**
	 * @param schemaDirectory where schema location hints are resolved; the working directory if null.
	 */
	public SchemaXmlValidator(ValidationMessages messages, @Nullable Path schemaDirectory) {
		this.messages = messages;
		this.schemaDirectory = schemaDirectory;
	}

	@Override
	public void validate(XmlDocument document, @Nullable Path schemaPath) {
		Path schema = schemaPath != null ? schemaPath : schemaFromHint(document);
		List<XmlDiagnostic> diagnostics = new ArrayList<>();
		boolean valid = document.schemaValidate(schema, diagnostics::add);
		if (valid) {
			LOGGER.debug("<{}> is valid against {}", document.getName(), schema);
			return;
		}
		String namespace = document.getNamespace();
		List<XmlDiagnostic> translated = diagnostics.stream()
			.map(d -> messages.translate(d, namespace))
			.toList();
		throw new SchemaValidationException(
			String.format("The XML validation failed using the schema %s.", schema.getFileName()),
			translated);
	}

	private Path schemaFromHint(XmlDocument document) {
		String hint = document.getSchemaLocationHint();
		if (hint == null) {
			throw new SchemaValidationException("The XML does not contain a valid schema location in the \"xsi:schemaLocation\" attribute.");
		}
		Path path = schemaDirectory == null ? Path.of(hint) : schemaDirectory.resolve(hint);
		if (!Files.isRegularFile(path)) {
			throw new SchemaValidationException("To validate an XML, the path to the schema must exist: " + path.toAbsolutePath());
		}
		return path;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaXmlValidator.class);
}
