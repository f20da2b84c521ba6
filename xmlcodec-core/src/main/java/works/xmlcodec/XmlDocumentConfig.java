package works.xmlcodec;

import java.nio.charset.Charset;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static java.util.Objects.requireNonNull;

/**
 * Settings that a new {@link XmlDocument} starts from.
 */
public final class XmlDocumentConfig {
	private final String version;
	private final Charset encoding;
	private final boolean formatOutput;

	private XmlDocumentConfig(String version, Charset encoding, boolean formatOutput) {
		this.version = version;
		this.encoding = encoding;
		this.formatOutput = formatOutput;
	}

	/**
	 * XML 1.0 in ISO-8859-1, indented.
	 */
	public static XmlDocumentConfig simple() {
		return SIMPLE_CONFIG;
	}

	public static Builder builder() {
		return new Builder();
	}

	public String version() {
		return version;
	}

	/**
	 * The working encoding: what saved and canonicalized output is expressed in,
	 * and what UTF-8 input is converted to on load.
	 */
	public Charset encoding() {
		return encoding;
	}

	public boolean formatOutput() {
		return formatOutput;
	}

	public static class Builder {
		private String version = DEFAULT_VERSION;
		private Charset encoding = ISO_8859_1;
		private boolean formatOutput = true;

		Builder() {
		}

		public Builder version(String version) {
			this.version = requireNonNull(version);
			return this;
		}

		public Builder encoding(Charset encoding) {
			this.encoding = requireNonNull(encoding);
			return this;
		}

		public Builder formatOutput(boolean formatOutput) {
			this.formatOutput = formatOutput;
			return this;
		}

		public XmlDocumentConfig build() {
			return new XmlDocumentConfig(version, encoding, formatOutput);
		}

		@Override
		public String toString() {
			return "XmlDocumentConfig.Builder(version=" + this.version + ", encoding=" + this.encoding + ", formatOutput=" + this.formatOutput + ")";
		}
	}

	@Override
	public String toString() {
		return "XmlDocumentConfig(version=" + version + ", encoding=" + encoding + ", formatOutput=" + formatOutput + ")";
	}

	private static final String DEFAULT_VERSION = "1.0";
	private static final XmlDocumentConfig SIMPLE_CONFIG = new XmlDocumentConfig(DEFAULT_VERSION, ISO_8859_1, true);
}
