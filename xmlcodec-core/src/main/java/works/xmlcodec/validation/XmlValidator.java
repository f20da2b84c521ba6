package works.xmlcodec.validation;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;
import works.xmlcodec.XmlDocument;
import works.xmlcodec.exceptions.SchemaValidationException;

public interface XmlValidator {
	/**
	 * Validates against the schema named by the document's {@code xsi:schemaLocation}.
	 */
	default void validate(XmlDocument document) {
		validate(document, null);
	}

	/**
	 * @param schemaPath the XSD to use; derived from the document if null.
	 * @throws SchemaValidationException if the document is not valid, or no schema can be found.
	 */
	void validate(XmlDocument document, @Nullable Path schemaPath);
}
