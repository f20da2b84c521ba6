package works.xmlcodec;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import works.xmlcodec.exceptions.EmptyDocumentException;
import works.xmlcodec.exceptions.MalformedXmlException;
import works.xmlcodec.exceptions.XPathNodeNotFoundException;
import works.xmlcodec.exceptions.XmlDiagnostic;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.xmlcodec.TestUtils.list;
import static works.xmlcodec.TestUtils.map;

class XmlDocumentTest {
	static final String SIMPLE = """
		<root>
		    <element>Value</element>
		</root>""";

	static final String TWO_ELEMENTS = """
		<root>
		    <element>Value</element>
		    <element2>Other Value</element2>
		</root>""";

	@Test
	void load() {
		XmlDocument doc = new XmlDocument().load(SIMPLE);

		assertEquals("root", doc.getName());
		assertEquals("root", doc.getDocumentElement().getTagName());
		assertNull(doc.getNamespace());
		assertNull(doc.getSchemaLocationHint());
		assertEquals("1.0", doc.getVersion());
		assertEquals(ISO_8859_1, doc.getEncoding());
	}

	@Test
	void emptyDocument() {
		XmlDocument doc = new XmlDocument();
		assertNull(doc.getName());
		assertNull(doc.getDocumentElement());
		assertEquals(Map.of(), doc.toArray());
	}

	@Test
	void namespace() {
		XmlDocument doc = new XmlDocument().load("<root xmlns=\"http://example.com\"><element>Value</element></root>");
		assertEquals("http://example.com", doc.getNamespace());
		assertEquals("Value", doc.get("root.element"));
	}

	@Test
	void schemaLocationHint() {
		XmlDocument doc = new XmlDocument().load("""
			<root xsi:schemaLocation="http://example.com schema.xsd"
			      xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance">
			    <element>Value</element>
			</root>""");
		assertEquals("schema.xsd", doc.getSchemaLocationHint());
	}

	@Test
	void schemaLocationWithoutPair() {
		XmlDocument doc = new XmlDocument().load(
			"<root xsi:schemaLocation=\"schema.xsd\" xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"/>");
		assertNull(doc.getSchemaLocationHint());
	}

	@Test
	void emptyInput() {
		EmptyDocumentException e = assertThrows(EmptyDocumentException.class, () -> new XmlDocument().load(""));
		assertEquals("The XML content that you want to load is empty.", e.getMessage());
		assertThrows(EmptyDocumentException.class, () -> new XmlDocument().load(new byte[0]));
	}

	@Test
	void malformedInput() {
		MalformedXmlException e = assertThrows(MalformedXmlException.class,
			() -> new XmlDocument().load("<root>\n<open>\n</root>"));

		assertThat(e.getMessage(), startsWith("The XML could not be loaded."));
		assertThat(e.diagnostics(), not(empty()));
		XmlDiagnostic first = e.diagnostics().get(0);
		assertEquals(XmlDiagnostic.Severity.FATAL, first.severity());
		assertEquals(3, first.line());
		assertThat(e.getMessage(), containsString("Error Fatal: "));
		assertThat(e.getMessage(), containsString(" in line 3, column "));
	}

	@Test
	void saveXml() {
		XmlDocument doc = new XmlDocument().load(SIMPLE);

		assertEquals("<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>\n" + SIMPLE + "\n", doc.saveXml());
		assertEquals(SIMPLE, doc.getXml());
		assertEquals(SIMPLE, doc.toString());
	}

	@Test
	void saveXmlEscapesQuotesInTextOnly() {
		XmlDocument doc = new XmlDocument().load("<root a=\"it's\">say \"hi\" it's</root>");
		assertEquals("<root a=\"it's\">say &quot;hi&quot; it&apos;s</root>", doc.getXml());
	}

	@Test
	void utf8InputIsConverted() {
		byte[] input = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<root>Árbol ñandú €</root>".getBytes(UTF_8);
		XmlDocument doc = new XmlDocument().load(input);

		assertEquals(ISO_8859_1, doc.getEncoding());
		assertEquals("Árbol ñandú ?", doc.get("root"));
		assertThat(doc.saveXml(), startsWith("<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>"));
		assertArrayEquals("<root>Árbol ñandú ?</root>".getBytes(ISO_8859_1), doc.c14nWithWorkingEncoding());
	}

	@Test
	void toBytes() {
		XmlDocument doc = new XmlDocument().load("<root>ñ</root>");
		assertArrayEquals(doc.saveXml().getBytes(ISO_8859_1), doc.toBytes());
	}

	@Test
	void utf8WorkingEncoding() {
		XmlDocumentConfig config = XmlDocumentConfig.builder().encoding(UTF_8).build();
		XmlDocument doc = new XmlDocument(config).load("<root>Precio: 100€</root>");

		assertEquals(StandardCharsets.UTF_8, doc.getEncoding());
		assertThat(doc.saveXml(), startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"));
		assertThat(doc.saveXml(), containsString("100€"));
		assertEquals("<root>Precio: 100€</root>", new String(doc.c14nWithWorkingEncoding(), UTF_8));
	}

	@Test
	void canonical() {
		XmlDocument doc = new XmlDocument().load(SIMPLE);

		assertEquals(SIMPLE, doc.c14n());
		assertEquals("<root><element>Value</element></root>", new String(doc.c14nWithWorkingEncodingFlattened(), ISO_8859_1));
	}

	@Test
	void canonicalSubset() {
		XmlDocument doc = new XmlDocument().load(TWO_ELEMENTS);

		assertEquals("<element2>Other Value</element2>", new String(doc.c14nWithWorkingEncoding("//element2"), ISO_8859_1));
		assertEquals("<element2>Other Value</element2>", new String(doc.c14nWithWorkingEncodingFlattened("//element2"), ISO_8859_1));
		assertEquals("<element2>Other Value</element2>", doc.c14n(C14nMethod.EXCLUSIVE, "//element2"));
	}

	@Test
	void canonicalSubsetNotFound() {
		XmlDocument doc = new XmlDocument().load(SIMPLE);
		XPathNodeNotFoundException e = assertThrows(XPathNodeNotFoundException.class, () -> doc.c14nWithWorkingEncoding("//nonexistent"));
		assertEquals("Unable to find the node with the XPath //nonexistent.", e.getMessage());
	}

	@Test
	void inclusiveAndExclusiveNamespaces() {
		XmlDocument doc = new XmlDocument().load("<root xmlns:a=\"urn:a\"><b>x</b></root>");

		assertEquals("<b xmlns:a=\"urn:a\">x</b>", doc.c14n(C14nMethod.INCLUSIVE, "//b"));
		assertEquals("<b>x</b>", doc.c14n(C14nMethod.EXCLUSIVE, "//b"));
	}

	@Test
	void comments() {
		XmlDocument doc = new XmlDocument().load("<root><!-- note --><a>x</a></root>");

		assertEquals("<root><a>x</a></root>", doc.c14n());
		assertEquals("<root><!-- note --><a>x</a></root>", doc.c14n(C14nMethod.INCLUSIVE_WITH_COMMENTS, null));
	}

	@Test
	void signatureNode() {
		XmlDocument doc = new XmlDocument().load("""
			<DTE xmlns="http://www.sii.cl/SiiDte"><Documento>x</Documento><Signature xmlns="http://www.w3.org/2000/09/xmldsig#"><SignedInfo/></Signature></DTE>""");

		assertEquals(
			"<Signature xmlns=\"http://www.w3.org/2000/09/xmldsig#\"><SignedInfo></SignedInfo></Signature>",
			doc.getSignatureNodeXml());
		assertNull(new XmlDocument().load(SIMPLE).getSignatureNodeXml());
	}

	@Test
	void query() {
		XmlDocument doc = new XmlDocument().load(TWO_ELEMENTS);

		assertEquals("Other Value", doc.query("/root/element2"));
		assertEquals("Value", doc.query("//*[.=:v]", Map.of("v", "Value")));
		assertEquals(2, doc.getNodes("/root/*").size());
	}

	@Test
	void get() {
		XmlDocument doc = new XmlDocument().load("<root><a><b>1</b><b>2</b></a><c>3</c></root>");

		assertEquals(map("root", map("a", map("b", list("1", "2")), "c", "3")), doc.toArray());
		assertEquals("3", doc.get("root.c"));
		assertEquals("2", doc.get("root.a.b.1"));
		assertEquals(List.of("1", "2"), doc.get("root.a.b"));
		assertNull(doc.get("root.a.b.2"));
		assertEquals("none", doc.get("root.x", "none"));
		assertEquals("none", doc.get("root.c.d", "none"));
	}

	@Test
	void toArrayIsMemoized() {
		XmlDocument doc = new XmlDocument().load(SIMPLE);
		Map<String, Object> first = doc.toArray();

		assertSame(first, doc.toArray());
		assertThrows(UnsupportedOperationException.class, () -> first.put("x", "y"));

		doc.getDocumentElement().appendChild(doc.getDocument().createElement("added"));
		assertSame(first, doc.toArray());

		doc.invalidate();
		assertEquals(map("root", map("element", "Value", "added", "")), doc.toArray());
	}

	@Test
	void reloadReplacesContent() {
		XmlDocument doc = new XmlDocument().load(SIMPLE);
		doc.toArray();

		doc.load("<other>1</other>");

		assertEquals("other", doc.getName());
		assertEquals(map("other", "1"), doc.toArray());
	}

	@Test
	void unformattedOutput() {
		XmlDocumentConfig config = XmlDocumentConfig.builder().formatOutput(false).build();
		XmlDocument doc = new XmlDocument(config);
		doc.getDocument().appendChild(doc.getDocument().createElement("root"))
			.appendChild(doc.getDocument().createElement("a"));

		assertEquals("<root><a/></root>", doc.getXml());
		assertEquals("<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>\n<root><a/></root>\n", doc.saveXml());
	}
}
