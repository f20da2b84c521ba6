package works.xmlcodec;

import org.apache.xml.security.c14n.Canonicalizer;

/**
 * Canonical XML flavours, identified by their algorithm URIs.
 */
public enum C14nMethod {
	INCLUSIVE(Canonicalizer.ALGO_ID_C14N_OMIT_COMMENTS),
	INCLUSIVE_WITH_COMMENTS(Canonicalizer.ALGO_ID_C14N_WITH_COMMENTS),
	EXCLUSIVE(Canonicalizer.ALGO_ID_C14N_EXCL_OMIT_COMMENTS),
	EXCLUSIVE_WITH_COMMENTS(Canonicalizer.ALGO_ID_C14N_EXCL_WITH_COMMENTS);

	private final String algorithmUri;

	C14nMethod(String algorithmUri) {
		this.algorithmUri = algorithmUri;
	}

	public String algorithmUri() {
		return algorithmUri;
	}
}
