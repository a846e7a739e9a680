package my.cmestress.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ScenarioResult(
		String scenarioName,
		BaseCurrency baseCurrency,
		EquityModelType equityModel,
		Map<String, AssetClassResult> results,
		Map<String, MacroSummary> macroAssumptions,
		double globalRgdpGrowth,
		Map<String, FxSummary> fxForecasts,
		Map<String, Object> overridesApplied
) {
	public ScenarioResult {
		results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
		macroAssumptions = Collections.unmodifiableMap(new LinkedHashMap<>(macroAssumptions));
		fxForecasts = fxForecasts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fxForecasts));
		overridesApplied = overridesApplied == null ? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(overridesApplied));
	}

	public AssetClassResult result(AssetClass assetClass) {
		AssetClassResult result = results.get(assetClass.getKey());
		if (result == null) {
			throw new UnknownIdentifierException("asset class", assetClass.getKey());
		}
		return result;
	}
}
