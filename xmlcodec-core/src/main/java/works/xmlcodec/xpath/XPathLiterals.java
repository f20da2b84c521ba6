package works.xmlcodec.xpath;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual rewriting of queries before they reach the evaluator.
 */
public final class XPathLiterals {
	private XPathLiterals() {
	}

	/**
	 * An XPath 1.0 string literal denoting exactly {@code value}.
	 * XPath has no escape syntax, so a value with both kinds of quote
	 * becomes a {@code concat()} of single-quoted pieces and {@code "'"}.
	 */
	public static String quote(String value) {
		if (value.indexOf('\'') < 0) {
			return "'" + value + "'";
		}
		if (value.indexOf('"') < 0) {
			return "\"" + value + "\"";
		}
		return "concat('" + value.replace("'", "',\"'\",'") + "')";
	}

	/**
	 * Replaces each {@code :name} placeholder that has an entry in {@code params}
	 * with the quoted literal of its value. Prefixed names and axes are not placeholders.
	 */
	public static String substitute(String query, Map<String, ?> params) {
		if (params.isEmpty()) {
			return query;
		}
		Matcher matcher = PLACEHOLDER.matcher(query);
		StringBuilder sb = new StringBuilder();
		while (matcher.find()) {
			String key = params.containsKey(matcher.group(1)) ? matcher.group(1) : matcher.group();
			String replacement = params.containsKey(key) ? quote(String.valueOf(params.get(key))) : matcher.group();
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	/**
	 * Turns every bare name step that starts the query or follows a {@code /}
	 * into a local-name test, so the query matches regardless of namespace.
	 * Function calls, node tests, axes, prefixed names and string literals are left alone.
	 */
	public static String ignoreNamespaces(String query) {
		// Transparent, non-anchoring bounds keep the lookarounds and ^ relative to the whole query
		Matcher matcher = BARE_STEP.matcher(query).useTransparentBounds(true).useAnchoringBounds(false);
		StringBuilder sb = new StringBuilder(query.length());
		int i = 0;
		while (i < query.length()) {
			char c = query.charAt(i);
			if (c == '\'' || c == '"') {
				int close = query.indexOf(c, i + 1);
				int end = close < 0 ? query.length() : close + 1;
				sb.append(query, i, end);
				i = end;
				continue;
			}
			int end = nextQuote(query, i);
			matcher.region(i, end);
			int copied = i;
			while (matcher.find()) {
				sb.append(query, copied, matcher.start()).append("*[local-name()=\"").append(matcher.group(1)).append("\"]");
				copied = matcher.end();
			}
			sb.append(query, copied, end);
			i = end;
		}
		return sb.toString();
	}

	private static int nextQuote(String query, int from) {
		for (int i = from; i < query.length(); i++) {
			char c = query.charAt(i);
			if (c == '\'' || c == '"') {
				return i;
			}
		}
		return query.length();
	}

	private static final Pattern PLACEHOLDER = Pattern.compile("(?<![\\w:]):(\\w+)");
	private static final Pattern BARE_STEP = Pattern.compile("(?:(?<=/)|^)([A-Za-z_][\\w.-]*)(?![\\w.(:-])");
}
