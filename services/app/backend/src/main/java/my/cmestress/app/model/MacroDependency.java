package my.cmestress.app.model;

import java.util.List;

/**
 * Explains which macro forecast fed into an asset result and whether it was touched by an override.
 */
public record MacroDependency(
		String macroInput,
		double valueUsed,
		InputSource source,
		List<String> affects,
		String impactDescription
) {
	public MacroDependency {
		affects = affects == null ? List.of() : List.copyOf(affects);
	}
}
