package works.xmlcodec.text;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.xmlcodec.exceptions.MalformedXmlException;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Moves XML bytes between UTF-8 and a document's working encoding.
 * <p>
 * Narrowing is lossy: characters the target encoding lacks become {@code ?}.
 */
public final class EncodingTranscoder {
	private EncodingTranscoder() {
	}

	/**
	 * Input ready for the parser, with the encoding its declaration now names.
	 */
	public record Prepared(byte[] bytes, Charset encoding, String version) {
	}

	/**
	 * The parts of an XML declaration this class cares about.
	 *
	 * @param length   number of characters the declaration occupies at the start of the input
	 * @param encoding the declared encoding name, or null if the declaration has none
	 */
	record Declaration(int length, String version, @Nullable String encoding, @Nullable String standalone) {
	}

	/**
	 * Makes raw bytes acceptable to the parser while converging on {@code working}.
	 * <ul>
	 *     <li>No declaration: one naming {@code working} is prepended on the first line, so reported
	 *     line numbers still match the input, and the bytes
	 *     are taken to be in that encoding already.</li>
	 *     <li>Declared (or BOM-marked) UTF-8 while {@code working} is single-byte: the content
	 *     is converted and the declaration rewritten.</li>
	 *     <li>Anything else is left for the parser, and the declared encoding becomes the document's.</li>
	 * </ul>
	 */
	public static Prepared prepareForParsing(byte[] input, Charset working, String defaultVersion) {
		boolean bom = hasUtf8Bom(input);
		byte[] content = bom ? Arrays.copyOfRange(input, UTF8_BOM.length, input.length) : input;

		// The declaration is ASCII in every encoding we accept, so a byte-preserving decode finds it
		String head = new String(content, 0, Math.min(content.length, HEAD_LENGTH), ISO_8859_1);
		Declaration declaration = parseDeclaration(head);

		if (declaration == null) {
			if (bom && isSingleByte(working)) {
				LOGGER.debug("Converting undeclared UTF-8 input with byte-order mark to {}", working.name());
				content = new String(content, UTF_8).getBytes(working);
			} else if (bom) {
				working = UTF_8;
			}
			byte[] synthesized = declarationText(defaultVersion, working.name(), null).getBytes(ISO_8859_1);
			return new Prepared(concat(synthesized, content), working, defaultVersion);
		}

		Charset declared = declaration.encoding() == null ? UTF_8 : charsetFor(declaration.encoding());
		if (declared.equals(UTF_8) && isSingleByte(working)) {
			LOGGER.debug("Converting UTF-8 input to working encoding {}", working.name());
			String rest = new String(content, declaration.length(), content.length - declaration.length(), UTF_8);
			byte[] rewritten = declarationText(declaration.version(), working.name(), declaration.standalone()).getBytes(ISO_8859_1);
			return new Prepared(concat(rewritten, rest.getBytes(working)), working, declaration.version());
		}
		return new Prepared(content, declared, declaration.version());
	}

	/**
	 * Encodes XML text for {@link #prepareForParsing}: in its declared encoding if it
	 * has a declaration, otherwise in {@code working}.
	 */
	public static byte[] toBytes(String xml, Charset working) {
		Declaration declaration = parseDeclaration(xml);
		if (declaration == null) {
			return xml.getBytes(working);
		}
		return xml.getBytes(declaration.encoding() == null ? UTF_8 : charsetFor(declaration.encoding()));
	}

	/**
	 * Re-expresses UTF-8 bytes in {@code target}, substituting what cannot be represented.
	 */
	public static byte[] fromUtf8(byte[] utf8, Charset target) {
		if (target.equals(UTF_8)) {
			return utf8;
		}
		return new String(utf8, UTF_8).getBytes(target);
	}

	public static boolean isSingleByte(Charset charset) {
		return charset.canEncode() && charset.newEncoder().maxBytesPerChar() == 1.0f;
	}

	public static String declarationText(String version, String encoding, @Nullable String standalone) {
		StringBuilder sb = new StringBuilder("<?xml version=\"").append(version).append("\" encoding=\"").append(encoding).append('"');
		if (standalone != null) {
			sb.append(" standalone=\"").append(standalone).append('"');
		}
		return sb.append("?>").toString();
	}

	@Nullable
	static Declaration parseDeclaration(String head) {
		Matcher matcher = DECLARATION.matcher(head);
		if (!matcher.lookingAt()) {
			return null;
		}
		String pseudoAttributes = matcher.group(1);
		String version = pseudoAttribute(pseudoAttributes, "version");
		return new Declaration(
			matcher.end(),
			version == null ? "1.0" : version,
			pseudoAttribute(pseudoAttributes, "encoding"),
			pseudoAttribute(pseudoAttributes, "standalone"));
	}

	@Nullable
	private static String pseudoAttribute(String text, String name) {
		Matcher matcher = Pattern.compile("\\b" + name + "\\s*=\\s*([\"'])([^\"']*)\\1").matcher(text);
		return matcher.find() ? matcher.group(2) : null;
	}

	private static Charset charsetFor(String name) {
		try {
			return Charset.forName(name);
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			throw new MalformedXmlException("Unsupported encoding in XML declaration: " + name, e);
		}
	}

	private static boolean hasUtf8Bom(byte[] input) {
		return input.length >= UTF8_BOM.length
			&& input[0] == UTF8_BOM[0]
			&& input[1] == UTF8_BOM[1]
			&& input[2] == UTF8_BOM[2];
	}

	private static byte[] concat(byte[]... parts) {
		int length = 0;
		for (byte[] part : parts) {
			length += part.length;
		}
		byte[] result = new byte[length];
		int offset = 0;
		for (byte[] part : parts) {
			System.arraycopy(part, 0, result, offset, part.length);
			offset += part.length;
		}
		return result;
	}

	private static final int HEAD_LENGTH = 256;
	private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
	private static final Pattern DECLARATION = Pattern.compile("\\s*<\\?xml(\\s[^?]*)\\?>");
	private static final Logger LOGGER = LoggerFactory.getLogger(EncodingTranscoder.class);
}
