package works.xmlcodec.text;

import java.nio.charset.Charset;
import org.junit.jupiter.api.Test;
import works.xmlcodec.exceptions.MalformedXmlException;
import works.xmlcodec.text.EncodingTranscoder.Prepared;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_16;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EncodingTranscoderTest {

	@Test
	void utf8IsConvertedToSingleByteWorkingEncoding() {
		byte[] input = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<r>ñandú €</r>".getBytes(UTF_8);
		Prepared prepared = EncodingTranscoder.prepareForParsing(input, ISO_8859_1, "1.0");

		assertEquals(ISO_8859_1, prepared.encoding());
		assertEquals(
			"<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>\n<r>ñandú ?</r>",
			new String(prepared.bytes(), ISO_8859_1));
	}

	@Test
	void declarationWithoutEncodingMeansUtf8() {
		byte[] input = "<?xml version='1.0' standalone='yes'?><r>ü</r>".getBytes(UTF_8);
		Prepared prepared = EncodingTranscoder.prepareForParsing(input, ISO_8859_1, "1.0");

		assertEquals(
			"<?xml version=\"1.0\" encoding=\"ISO-8859-1\" standalone=\"yes\"?><r>ü</r>",
			new String(prepared.bytes(), ISO_8859_1));
	}

	@Test
	void missingDeclarationIsSynthesized() {
		byte[] input = "<r>é</r>".getBytes(ISO_8859_1);
		Prepared prepared = EncodingTranscoder.prepareForParsing(input, ISO_8859_1, "1.0");

		assertEquals(ISO_8859_1, prepared.encoding());
		assertEquals(
			"<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><r>é</r>",
			new String(prepared.bytes(), ISO_8859_1));
	}

	@Test
	void otherDeclaredEncodingsAreLeftAlone() {
		byte[] input = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><r>é</r>".getBytes(ISO_8859_1);
		Prepared prepared = EncodingTranscoder.prepareForParsing(input, ISO_8859_1, "1.0");

		assertArrayEquals(input, prepared.bytes());
		assertEquals(ISO_8859_1, prepared.encoding());
	}

	@Test
	void utf8WorkingEncodingKeepsUtf8Input() {
		byte[] input = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><r>€</r>".getBytes(UTF_8);
		Prepared prepared = EncodingTranscoder.prepareForParsing(input, UTF_8, "1.0");

		assertArrayEquals(input, prepared.bytes());
		assertEquals(UTF_8, prepared.encoding());
	}

	@Test
	void byteOrderMarkImpliesUtf8() {
		byte[] body = "<r>ñ</r>".getBytes(UTF_8);
		byte[] input = new byte[body.length + 3];
		input[0] = (byte) 0xEF;
		input[1] = (byte) 0xBB;
		input[2] = (byte) 0xBF;
		System.arraycopy(body, 0, input, 3, body.length);

		Prepared prepared = EncodingTranscoder.prepareForParsing(input, ISO_8859_1, "1.0");

		assertEquals(
			"<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><r>ñ</r>",
			new String(prepared.bytes(), ISO_8859_1));
	}

	@Test
	void unsupportedDeclaredEncodingIsRejected() {
		byte[] input = "<?xml version=\"1.0\" encoding=\"NO-SUCH-CHARSET\"?><r/>".getBytes(UTF_8);
		assertThrows(MalformedXmlException.class, () -> EncodingTranscoder.prepareForParsing(input, ISO_8859_1, "1.0"));
	}

	@Test
	void toBytes_followsDeclaration() {
		assertArrayEquals("<r>€</r>".getBytes(ISO_8859_1), EncodingTranscoder.toBytes("<r>€</r>", ISO_8859_1));
		String declared = "<?xml version=\"1.0\" encoding=\"UTF-8\"?><r>€</r>";
		assertArrayEquals(declared.getBytes(UTF_8), EncodingTranscoder.toBytes(declared, ISO_8859_1));
	}

	@Test
	void fromUtf8_substitutesUnrepresentableCharacters() {
		byte[] result = EncodingTranscoder.fromUtf8("Precio: 100€ ñ".getBytes(UTF_8), ISO_8859_1);
		assertEquals("Precio: 100? ñ", new String(result, ISO_8859_1));
	}

	@Test
	void isSingleByte() {
		assertTrue(EncodingTranscoder.isSingleByte(ISO_8859_1));
		assertTrue(EncodingTranscoder.isSingleByte(Charset.forName("windows-1252")));
		assertFalse(EncodingTranscoder.isSingleByte(UTF_8));
		assertFalse(EncodingTranscoder.isSingleByte(UTF_16));
	}
}
