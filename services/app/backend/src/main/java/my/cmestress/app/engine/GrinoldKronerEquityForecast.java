package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.TrackedValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param revenueGrowthComputed false when the caller supplied revenue growth directly
 */
public record GrinoldKronerEquityForecast(
		AssetClass assetClass,
		double expectedReturnNominal,
		double expectedReturnReal,
		double dividendYield,
		double netBuybackYield,
		double revenueGrowth,
		double marginChange,
		double valuationChange,
		double inflation,
		double rgdpGrowth,
		boolean revenueGrowthComputed,
		Map<String, Map<String, TrackedValue>> components
) implements EquityForecast {
	@Override
	public Map<String, Double> returnComponents() {
		Map<String, Double> parts = new LinkedHashMap<>();
		parts.put("dividend_yield", dividendYield);
		parts.put("net_buyback_yield", netBuybackYield);
		parts.put("revenue_growth", revenueGrowth);
		parts.put("margin_change", marginChange);
		parts.put("valuation_change", valuationChange);
		return parts;
	}
}
