package works.xmlcodec;

import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static works.xmlcodec.TestUtils.fixture;

/**
 * Characters that tend to break signatures: outside the working encoding,
 * control characters, markup characters in text and attributes.
 */
class SpecialCasesTest {
	static final Map<String, Map<String, Map<String, Object>>> CASES = fixture("special-cases.json");

	final XmlService service = XmlService.simple();

	static Stream<Arguments> roundTripCases() {
		return Stream.of("unsupportedInWorkingEncoding", "controlCharacters", "whitespaceCharacters", "attributeCharacters", "signatureCompatibility")
			.flatMap(SpecialCasesTest::casesIn);
	}

	static Stream<Arguments> canonicalCases() {
		return casesIn("canonicalForm");
	}

	private static Stream<Arguments> casesIn(String group) {
		return CASES.get(group).entrySet().stream()
			.map(e -> arguments(group + "/" + e.getKey(), e.getValue().get("data"), e.getValue().get("expected")));
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("roundTripCases")
	void roundTrip(String name, Map<String, Object> data, Map<String, Object> expected) {
		XmlDocument encoded = service.encode(data);
		String saved = encoded.saveXml();

		assertThat(saved, containsString("encoding=\"ISO-8859-1\""));
		assertThat(saved, matchesPattern("(?s)[^\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]*"));

		XmlDocument reloaded = new XmlDocument().load(saved);
		assertEquals(expected, service.decode(reloaded));
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("canonicalCases")
	void canonicalForm(String name, Map<String, Object> data, String expected) {
		XmlDocument encoded = service.encode(data);
		assertEquals(expected, new String(encoded.c14nWithWorkingEncoding(), ISO_8859_1));
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("canonicalCases")
	void canonicalFormSurvivesReload(String name, Map<String, Object> data, String expected) {
		XmlDocument reloaded = new XmlDocument().load(service.encode(data).saveXml());
		assertEquals(expected, new String(reloaded.c14nWithWorkingEncodingFlattened(), ISO_8859_1));
	}
}
