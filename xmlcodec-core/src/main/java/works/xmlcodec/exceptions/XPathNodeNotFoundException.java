package works.xmlcodec.exceptions;

/**
 * A lookup that requires a node found none.
 */
public final class XPathNodeNotFoundException extends XmlException {
	public XPathNodeNotFoundException(String message) {
		super(message);
	}

	public XPathNodeNotFoundException(Throwable cause) {
		super(cause);
	}

	public XPathNodeNotFoundException(String message, Throwable cause) {
		super(message, cause);
	}
}
