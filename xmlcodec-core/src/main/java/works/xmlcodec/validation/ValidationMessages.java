package works.xmlcodec.validation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import works.xmlcodec.exceptions.XmlDiagnostic;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Rewrites the schema validator's messages into something a person filling in the
 * document can act on. Replacements are literal and applied in order; a replacement
 * may contain {@value #LINE_PLACEHOLDER} to mention the line of the problem.
 */
public final class ValidationMessages {
	public static final String LINE_PLACEHOLDER = "%(line)s";

	private final Map<String, String> replacements;

	private ValidationMessages(Map<String, String> replacements) {
		this.replacements = replacements;
	}

	public static ValidationMessages defaults() {
		return DEFAULTS;
	}

	/**
	 * The defaults, overridden or extended by {@code translations}.
	 */
	public static ValidationMessages withTranslations(Map<String, String> translations) {
		Map<String, String> merged = new LinkedHashMap<>(DEFAULT_REPLACEMENTS);
		translations.forEach((k, v) -> merged.put(requireNonNull(k), requireNonNull(v)));
		return new ValidationMessages(unmodifiableMap(merged));
	}

	/**
	 * Only {@code translations}, without the defaults.
	 */
	public static ValidationMessages only(Map<String, String> translations) {
		return new ValidationMessages(unmodifiableMap(new LinkedHashMap<>(translations)));
	}

	public Map<String, String> replacements() {
		return replacements;
	}

	/**
	 * @param namespace the document's namespace, whose mentions are removed.
	 */
	public XmlDiagnostic translate(XmlDiagnostic diagnostic, @Nullable String namespace) {
		String message = CODE_PREFIX.matcher(diagnostic.message().trim()).replaceFirst("");
		if (namespace != null) {
			message = message
				.replace("{\"" + namespace + "\":", "{")
				.replace("{" + namespace + "}", "");
		}
		for (Map.Entry<String, String> entry : replacements.entrySet()) {
			message = message.replace(entry.getKey(), entry.getValue());
		}
		message = message.replace(LINE_PLACEHOLDER, String.valueOf(diagnostic.line()));
		return diagnostic.withMessage(message);
	}

	private static final Pattern CODE_PREFIX = Pattern.compile("^cvc-[\\w.-]+:\\s*");

	private static final Map<String, String> DEFAULT_REPLACEMENTS = defaultReplacements();

	private static Map<String, String> defaultReplacements() {
		Map<String, String> result = new LinkedHashMap<>();
		result.put("Invalid content was found starting with element", "Field was not expected:");
		result.put(". One of ", ", the expected was one of the following: ");
		result.put(" is expected.", ".");
		result.put("The content of element", "Field");
		result.put("is not complete.", "is incomplete, it must have inside, lower level, another field.");
		result.put("is not facet-valid with respect to pattern", "is not valid according to the regular expression (pattern)");
		result.put("is not facet-valid with respect to maxLength", "exceeds the maximum allowed length");
		result.put("is not facet-valid with respect to minLength", "is shorter than the minimum required length");
		result.put("is not facet-valid with respect to enumeration", "is not valid, it must be one of the following values");
		result.put("is not a valid value for", "is not a valid value for the field type");
		result.put("Cannot find the declaration of element", "The root node of the XML does not match what is expected in the schema definition:");
		return unmodifiableMap(result);
	}

	private static final ValidationMessages DEFAULTS = new ValidationMessages(DEFAULT_REPLACEMENTS);
}
