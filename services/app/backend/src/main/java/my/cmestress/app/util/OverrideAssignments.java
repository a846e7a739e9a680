package my.cmestress.app.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code path.to.key=value} assignments into the nested override structure the engine accepts.
 */
public final class OverrideAssignments {
	private OverrideAssignments() {
	}

	public static Map<String, Object> parse(String assignment) {
		if (assignment == null || assignment.indexOf('=') < 0) {
			throw new IllegalArgumentException("Invalid override format: " + assignment + ". Expected 'key=value'.");
		}
		int separator = assignment.indexOf('=');
		String path = assignment.substring(0, separator).trim();
		String rawValue = assignment.substring(separator + 1).trim();
		String[] segments = path.split("\\.", -1);
		for (String segment : segments) {
			if (segment.isBlank()) {
				throw new IllegalArgumentException("Invalid override path: '" + path + "'");
			}
		}
		double value;
		try {
			value = Double.parseDouble(rawValue);
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException("Override value for " + path + " is not numeric: '" + rawValue + "'", exc);
		}
		Map<String, Object> root = new LinkedHashMap<>();
		Map<String, Object> current = root;
		for (int i = 0; i < segments.length - 1; i++) {
			Map<String, Object> child = new LinkedHashMap<>();
			current.put(segments[i].trim(), child);
			current = child;
		}
		current.put(segments[segments.length - 1].trim(), value);
		return root;
	}

	public static Map<String, Object> parseAll(List<String> assignments) {
		Map<String, Object> merged = new LinkedHashMap<>();
		if (assignments == null) {
			return merged;
		}
		for (String assignment : assignments) {
			merge(merged, parse(assignment));
		}
		return merged;
	}

	/**
	 * Deep-merges {@code updates} into {@code target}. Nested maps merge; any other value replaces.
	 */
	public static Map<String, Object> merge(Map<String, Object> target, Map<String, ?> updates) {
		if (updates == null) {
			return target;
		}
		for (Map.Entry<String, ?> entry : updates.entrySet()) {
			Object existing = target.get(entry.getKey());
			Object update = entry.getValue();
			if (update instanceof Map<?, ?> updateMap) {
				Map<String, Object> copy = existing instanceof Map<?, ?> existingMap ? copyOf(existingMap)
						: new LinkedHashMap<>();
				merge(copy, copyOf(updateMap));
				target.put(entry.getKey(), copy);
			} else {
				target.put(entry.getKey(), update);
			}
		}
		return target;
	}

	private static Map<String, Object> copyOf(Map<?, ?> source) {
		Map<String, Object> copy = new LinkedHashMap<>();
		source.forEach((key, value) -> copy.put(String.valueOf(key), value));
		return copy;
	}
}
