package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.TrackedValue;

import java.util.LinkedHashMap;
import java.util.Map;

public record RaEquityForecast(
		AssetClass assetClass,
		double expectedReturnNominal,
		double expectedReturnReal,
		double dividendYield,
		double realEpsGrowth,
		double valuationChange,
		double inflation,
		boolean epsCapped,
		Map<String, Map<String, TrackedValue>> components
) implements EquityForecast {
	@Override
	public Map<String, Double> returnComponents() {
		Map<String, Double> parts = new LinkedHashMap<>();
		parts.put("dividend_yield", dividendYield);
		parts.put("real_eps_growth", realEpsGrowth);
		parts.put("valuation_change", valuationChange);
		return parts;
	}
}
