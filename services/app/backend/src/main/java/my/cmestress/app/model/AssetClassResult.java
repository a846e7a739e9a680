package my.cmestress.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AssetClassResult(
		AssetClass assetClass,
		String displayName,
		double expectedReturnNominal,
		double expectedReturnReal,
		double expectedVolatility,
		Map<String, Double> components,
		Map<String, SourcedValue> inputsUsed,
		Map<String, MacroDependency> macroDependencies
) {
	public AssetClassResult {
		components = components == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(components));
		inputsUsed = inputsUsed == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputsUsed));
		macroDependencies = macroDependencies == null ? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(macroDependencies));
	}

	public double component(String name) {
		Double value = components.get(name);
		if (value == null) {
			throw new IllegalArgumentException("Unknown component: " + name);
		}
		return value;
	}
}
