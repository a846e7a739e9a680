package my.cmestress.app.engine;

import my.cmestress.app.model.Region;
import my.cmestress.app.model.TrackedValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the caller's nested override structure ({@code macro.us.inflation_forecast},
 * {@code bonds_hy.default_rate}, ...) and resolves paths against it. Paths nobody asks for are simply never
 * read, so speculative keys are harmless.
 */
public class OverrideResolver {
	private final Node overrides = new Node();

	public OverrideResolver() {
	}

	public OverrideResolver(Map<String, ?> overrides) {
		mergeOverrides(overrides);
	}

	public static String path(String... segments) {
		return String.join(".", segments);
	}

	public TrackedValue resolve(String path, double defaultValue) {
		return findOverride(path).orElseGet(() -> TrackedValue.ofDefault(defaultValue));
	}

	public Optional<TrackedValue> findOverride(String path) {
		Object value = lookup(path);
		if (value == null || value instanceof Map<?, ?>) {
			return Optional.empty();
		}
		return Optional.of(TrackedValue.ofOverride(toDouble(path, value)));
	}

	public boolean hasOverride(String path) {
		Object value = lookup(path);
		return value != null && !(value instanceof Map<?, ?>);
	}

	/**
	 * Resolves every default field of one category, e.g. all inputs of {@code bonds_hy}.
	 */
	public Map<String, TrackedValue> resolveAll(String category, Map<String, Double> defaults) {
		Map<String, TrackedValue> resolved = new LinkedHashMap<>();
		defaults.forEach((field, value) -> resolved.put(field, resolve(path(category, field), value)));
		return resolved;
	}

	public Map<String, TrackedValue> resolveMacroInputs(Region region, Map<String, Double> defaults) {
		return resolveAll(path(DefaultsCatalog.MACRO, region.getKey()), defaults);
	}

	public void setOverride(String path, Object value) {
		String[] segments = path.split("\\.");
		Node current = overrides;
		for (int i = 0; i < segments.length - 1; i++) {
			if (current.get(segments[i]) instanceof Node child) {
				current = child;
			} else {
				Node created = new Node();
				current.put(segments[i], created);
				current = created;
			}
		}
		current.put(segments[segments.length - 1], copyValue(value));
	}

	/**
	 * Deep-merges a partial structure: nested mappings are combined, anything else replaces what was there.
	 */
	public void mergeOverrides(Map<String, ?> partial) {
		if (partial != null) {
			deepMerge(overrides, partial);
		}
	}

	public void clear() {
		overrides.clear();
	}

	/**
	 * Every override leaf keyed by its dotted path.
	 */
	public Map<String, Object> summary() {
		Map<String, Object> flat = new LinkedHashMap<>();
		flatten("", overrides, flat);
		return flat;
	}

	private Object lookup(String path) {
		if (path == null || path.isEmpty()) {
			return null;
		}
		Object current = overrides;
		for (String segment : path.split("\\.")) {
			if (!(current instanceof Map<?, ?> map)) {
				return null;
			}
			current = map.get(segment);
			if (current == null) {
				return null;
			}
		}
		return current;
	}

	private static double toDouble(String path, Object value) {
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		if (value instanceof String text) {
			try {
				return Double.parseDouble(text.trim());
			} catch (NumberFormatException ex) {
				throw new IllegalArgumentException("Override at " + path + " is not numeric: " + text, ex);
			}
		}
		throw new IllegalArgumentException("Override at " + path + " is not numeric: " + value);
	}

	private static void deepMerge(Node target, Map<?, ?> source) {
		source.forEach((key, value) -> {
			Object existing = target.get(String.valueOf(key));
			if (value instanceof Map<?, ?> nested && existing instanceof Node node) {
				deepMerge(node, nested);
			} else {
				target.put(String.valueOf(key), copyValue(value));
			}
		});
	}

	private static Object copyValue(Object value) {
		if (value instanceof Map<?, ?> nested) {
			Node copy = new Node();
			deepMerge(copy, nested);
			return copy;
		}
		return value;
	}

	private static void flatten(String prefix, Node node, Map<String, Object> flat) {
		node.forEach((key, value) -> {
			String path = prefix.isEmpty() ? key : prefix + "." + key;
			if (value instanceof Node nested) {
				flatten(path, nested, flat);
			} else {
				flat.put(path, value);
			}
		});
	}

	// One level of the override tree; every nested level is copied into a Node on the way in.
	private static final class Node extends LinkedHashMap<String, Object> {
	}
}
