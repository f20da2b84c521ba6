package works.xmlcodec.exceptions;

/**
 * There was nothing to load.
 */
public final class EmptyDocumentException extends XmlException {
	public EmptyDocumentException(String message) {
		super(message);
	}

	public EmptyDocumentException(Throwable cause) {
		super(cause);
	}

	public EmptyDocumentException(String message, Throwable cause) {
		super(message, cause);
	}
}
