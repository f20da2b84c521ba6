package works.xmlcodec.dom;

import java.io.ByteArrayOutputStream;
import org.apache.xml.security.Init;
import org.apache.xml.security.c14n.Canonicalizer;
import org.apache.xml.security.exceptions.XMLSecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;
import works.xmlcodec.C14nMethod;

/**
 * Canonical form of a subtree, always in UTF-8.
 */
public final class Canonicalization {
	private Canonicalization() {
	}

	public static byte[] canonicalize(Node node, C14nMethod method) {
		Init.init();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try {
			Canonicalizer.getInstance(method.algorithmUri()).canonicalizeSubtree(node, out);
		} catch (XMLSecurityException e) {
			throw new IllegalStateException("Unable to canonicalize <" + node.getNodeName() + "> with " + method, e);
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("Canonicalized <{}> with {}: {} bytes", node.getNodeName(), method, out.size());
		}
		return out.toByteArray();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Canonicalization.class);
}
