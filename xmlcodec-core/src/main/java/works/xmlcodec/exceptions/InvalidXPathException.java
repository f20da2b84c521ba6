package works.xmlcodec.exceptions;

/**
 * An XPath expression could not be compiled or evaluated.
 */
public final class InvalidXPathException extends XmlException {
	public InvalidXPathException(String message) {
		super(message);
	}

	public InvalidXPathException(Throwable cause) {
		super(cause);
	}

	public InvalidXPathException(String message, Throwable cause) {
		super(message, cause);
	}
}
