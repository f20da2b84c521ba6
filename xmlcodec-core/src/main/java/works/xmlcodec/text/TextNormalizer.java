package works.xmlcodec.text;

import java.util.regex.Pattern;

/**
 * Text fix-ups that keep serialized XML byte-compatible with canonicalization
 * and signature verification.
 */
public final class TextNormalizer {
	private TextNormalizer() {
	}

	/**
	 * Prepares a scalar for insertion as element text.
	 * <p>
	 * Control characters (U+0000 to U+001F and U+007F) are removed, the predefined
	 * entities and their numeric forms are turned back into literal characters,
	 * and then only {@code &} is escaped again. The result is in the form
	 * {@link #resolveReferences} expects.
	 * <p>
	 * Empty and numeric input is returned untouched.
	 */
	public static String sanitize(String value) {
		if (value == null || value.isEmpty() || NUMERIC.matcher(value).matches()) {
			return value;
		}
		String stripped = CONTROL_CHARACTERS.matcher(value).replaceAll("");
		return unescapePredefined(stripped).replace("&", "&amp;");
	}

	/**
	 * Escapes {@code '} and {@code "} appearing in element text of a serialized document.
	 * Markup and attribute values pass through unchanged.
	 * <p>
	 * Never fails: on malformed input the scan simply continues in whatever state it was in.
	 */
	public static String fixEntities(String xml) {
		if (xml == null || xml.isEmpty()) {
			return xml;
		}
		StringBuilder sb = new StringBuilder(xml.length() + 16);
		boolean inText = false;
		char attributeDelimiter = 0; // zero when not inside an attribute value
		int length = xml.length();
		for (int i = 0; i < length; i++) {
			char c = xml.charAt(i);
			if (attributeDelimiter != 0) {
				if (c == attributeDelimiter) {
					attributeDelimiter = 0;
				}
				sb.append(c);
				continue;
			}
			if (!inText && c == '=' && i + 1 < length && isQuote(xml.charAt(i + 1))) {
				attributeDelimiter = xml.charAt(i + 1);
				sb.append(c).append(attributeDelimiter);
				i++;
				continue;
			}
			switch (c) {
				case '>' -> {
					inText = true;
					sb.append(c);
				}
				case '<' -> {
					inText = false;
					sb.append(c);
				}
				case '\'' -> sb.append(inText ? "&apos;" : "'");
				case '"' -> sb.append(inText ? "&quot;" : "\"");
				default -> sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Turns entity and character references in sanitized text into the characters they denote,
	 * the way the engine reads text handed to it on element creation.
	 * Unknown or unterminated references are kept literally.
	 */
	public static String resolveReferences(String value) {
		if (value == null || value.indexOf('&') < 0) {
			return value;
		}
		return replaceReferences(value, true);
	}

	static String unescapePredefined(String value) {
		if (value.indexOf('&') < 0) {
			return value;
		}
		return replaceReferences(value, false);
	}

	/**
	 * @param anyCharacterReference when false, only numeric references to the five
	 *                              predefined characters are resolved.
	 */
	private static String replaceReferences(String value, boolean anyCharacterReference) {
		StringBuilder sb = new StringBuilder(value.length());
		int i = 0;
		while (i < value.length()) {
			char c = value.charAt(i);
			int semicolon;
			if (c != '&' || (semicolon = value.indexOf(';', i + 1)) < 0 || semicolon - i > MAX_REFERENCE_LENGTH) {
				sb.append(c);
				i++;
				continue;
			}
			String name = value.substring(i + 1, semicolon);
			int codePoint = referencedCodePoint(name);
			if (codePoint >= 0 && (anyCharacterReference || isPredefined(codePoint))) {
				sb.appendCodePoint(codePoint);
				i = semicolon + 1;
			} else {
				sb.append(c);
				i++;
			}
		}
		return sb.toString();
	}

	private static int referencedCodePoint(String name) {
		switch (name) {
			case "amp": return '&';
			case "lt": return '<';
			case "gt": return '>';
			case "quot": return '"';
			case "apos": return '\'';
			default:
				break;
		}
		if (name.length() < 2 || name.charAt(0) != '#') {
			return -1;
		}
		try {
			int codePoint = (name.charAt(1) == 'x' || name.charAt(1) == 'X')
				? Integer.parseInt(name.substring(2), 16)
				: Integer.parseInt(name.substring(1));
			return Character.isValidCodePoint(codePoint) ? codePoint : -1;
		} catch (NumberFormatException e) {
			return -1;
		}
	}

	private static boolean isPredefined(int codePoint) {
		return codePoint == '&' || codePoint == '<' || codePoint == '>' || codePoint == '"' || codePoint == '\'';
	}

	private static boolean isQuote(char c) {
		return c == '"' || c == '\'';
	}

	private static final int MAX_REFERENCE_LENGTH = 10;
	private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
	private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x1F\\x7F]");
}
