package works.xmlcodec.exceptions;

/**
 * The data handed to the encoder has a shape that XML cannot represent.
 */
public final class InvalidStructureException extends XmlException {
	public InvalidStructureException(String message) {
		super(message);
	}

	public InvalidStructureException(Throwable cause) {
		super(cause);
	}

	public InvalidStructureException(String message, Throwable cause) {
		super(message, cause);
	}
}
