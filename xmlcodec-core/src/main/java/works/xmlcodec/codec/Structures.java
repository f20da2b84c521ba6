package works.xmlcodec.codec;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Shape rules for the nested maps, lists and scalars that stand for XML.
 * <ul>
 *     <li>A {@link Map} is a record of child elements, plus the reserved
 *     {@value #ATTRIBUTES} and {@value #VALUE} keys.</li>
 *     <li>A {@link List}, array, or map keyed by the integers {@code 0..n-1}
 *     in order, is a sequence of sibling elements sharing one tag.</li>
 *     <li>Anything else is a scalar.</li>
 * </ul>
 */
public final class Structures {
	public static final String ATTRIBUTES = "@attributes";
	public static final String VALUE = "@value";

	private Structures() {
	}

	/**
	 * Values that produce no element at all: null, {@code false},
	 * and empty maps and sequences.
	 */
	public static boolean isSkipped(@Nullable Object value) {
		if (value == null || Boolean.FALSE.equals(value)) {
			return true;
		} else if (value instanceof Map<?, ?> map) {
			return map.isEmpty();
		} else if (value instanceof Collection<?> collection) {
			return collection.isEmpty();
		} else if (value instanceof Object[] array) {
			return array.length == 0;
		}
		return false;
	}

	public static boolean isScalar(@Nullable Object value) {
		return !(value instanceof Map || value instanceof Collection || value instanceof Object[]);
	}

	/**
	 * @return the items of {@code value} if it is a sequence, or null if it is not.
	 */
	@Nullable
	public static List<?> asSequence(@Nullable Object value) {
		if (value instanceof List<?> list) {
			return list;
		} else if (value instanceof Collection<?> collection) {
			return new ArrayList<>(collection);
		} else if (value instanceof Object[] array) {
			return Arrays.asList(array);
		} else if (value instanceof Map<?, ?> map && !map.isEmpty() && hasSequentialKeys(map)) {
			return new ArrayList<>(map.values());
		}
		return null;
	}

	/**
	 * The text an element gets for a scalar. {@code true} yields empty text.
	 */
	public static String scalarText(Object value) {
		if (value instanceof Boolean) {
			return "";
		} else if (value instanceof BigDecimal decimal) {
			return decimal.toPlainString();
		} else if (value instanceof Enum<?> e) {
			return e.name();
		}
		return value.toString();
	}

	private static boolean hasSequentialKeys(Map<?, ?> map) {
		Iterator<?> keys = map.keySet().iterator();
		for (int expected = 0; keys.hasNext(); expected++) {
			if (!Integer.valueOf(expected).equals(keys.next())) {
				return false;
			}
		}
		return true;
	}
}
