package works.xmlcodec;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * The namespace given to every element an encoder creates.
 *
 * @param prefix null or empty to make {@code uri} the default namespace.
 */
public record Namespace(String uri, @Nullable String prefix) {
	public Namespace {
		requireNonNull(uri);
	}

	public static Namespace of(String uri, String prefix) {
		return new Namespace(uri, prefix);
	}

	public static Namespace defaultNamespace(String uri) {
		return new Namespace(uri, null);
	}

	public boolean hasPrefix() {
		return prefix != null && !prefix.isEmpty();
	}

	public String qualify(String localName) {
		return hasPrefix() ? prefix + ":" + localName : localName;
	}

	/**
	 * The attribute that declares this namespace.
	 */
	public String declarationName() {
		return hasPrefix() ? "xmlns:" + prefix : "xmlns";
	}
}
