package my.cmestress.app.dto;

import java.util.Map;

/**
 * One scenario to compute. Null currency or model fall back to the configured engine defaults.
 */
public record ScenarioRequest(
		String scenarioName,
		Map<String, Object> overrides,
		String baseCurrency,
		String equityModel
) {
	public static ScenarioRequest of(String scenarioName, Map<String, Object> overrides) {
		return new ScenarioRequest(scenarioName, overrides, null, null);
	}
}
