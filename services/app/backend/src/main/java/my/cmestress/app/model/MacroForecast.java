package my.cmestress.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ten-year macro view for one region. Components are grouped by forecast ({@code rgdp}, {@code inflation},
 * {@code tbill}) and keep the provenance of every building block.
 */
public record MacroForecast(
		Region region,
		TrackedValue rgdpGrowth,
		TrackedValue inflation,
		TrackedValue tbillRate,
		double nominalGdpGrowth,
		Map<String, Map<String, TrackedValue>> components,
		List<String> unusedInputs
) {
	public MacroForecast {
		Map<String, Map<String, TrackedValue>> copy = new LinkedHashMap<>();
		if (components != null) {
			components.forEach((group, values) -> copy.put(group, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
		}
		components = Collections.unmodifiableMap(copy);
		unusedInputs = unusedInputs == null ? List.of() : List.copyOf(unusedInputs);
	}

	public Map<String, InputSource> sources() {
		Map<String, InputSource> sources = new LinkedHashMap<>();
		components.forEach((group, values) ->
				values.forEach((name, value) -> sources.put(group + "." + name, value.source())));
		return sources;
	}

	public MacroSummary toSummary() {
		return new MacroSummary(rgdpGrowth.value(), inflation.value(), tbillRate.value(), nominalGdpGrowth);
	}
}
