package org.javai.shuuten.ops;

/**
 * Length limits for text sent to destinations. Cuts never split a surrogate pair.
 */
public final class TextLimits {

	private TextLimits() {
		// Utility class
	}

	/**
	 * Keeps at most the first {@code limit} chars, one fewer if the cut would split a surrogate pair.
	 */
	public static String head(String value, int limit) {
		if (value == null || value.length() <= limit) {
			return value;
		}
		int end = limit;
		if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
			end--;
		}
		return value.substring(0, end);
	}

	/**
	 * Keeps at most the last {@code limit} chars, one fewer if the cut would split a surrogate pair.
	 */
	public static String tail(String value, int limit) {
		if (value == null || value.length() <= limit) {
			return value;
		}
		int start = value.length() - limit;
		if (start < value.length() && Character.isLowSurrogate(value.charAt(start))) {
			start++;
		}
		return value.substring(start);
	}
}
