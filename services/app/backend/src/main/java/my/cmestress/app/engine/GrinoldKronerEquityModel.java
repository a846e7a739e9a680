package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.TrackedValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Nominal return = dividend yield + net buyback yield + revenue growth + margin change + P/E valuation change.
 * Real return is the nominal return less inflation.
 */
public class GrinoldKronerEquityModel {
	public static final String NET_BUYBACK_YIELD = "net_buyback_yield";
	public static final String REVENUE_GDP_WEDGE = "revenue_gdp_wedge";
	public static final String REVENUE_GROWTH = "revenue_growth";
	public static final String MARGIN_CHANGE = "margin_change";
	public static final String CURRENT_PE = "current_pe";
	public static final String TARGET_PE = "target_pe";

	private final OverrideResolver overrides;
	private final DefaultsCatalog defaults;
	private final ModelParameters parameters;

	public GrinoldKronerEquityModel(OverrideResolver overrides, DefaultsCatalog defaults) {
		this.overrides = overrides;
		this.defaults = defaults;
		this.parameters = defaults.parameters();
	}

	public GrinoldKronerEquityForecast computeReturn(AssetClass assetClass, double inflationForecast, double rgdpGrowth) {
		RaEquityModel.requireEquity(assetClass);
		TrackedValue dividendYield = input(assetClass, RaEquityModel.DIVIDEND_YIELD);
		TrackedValue buybackYield = input(assetClass, NET_BUYBACK_YIELD);
		TrackedValue marginChange = input(assetClass, MARGIN_CHANGE);
		TrackedValue currentPe = input(assetClass, CURRENT_PE);
		TrackedValue targetPe = input(assetClass, TARGET_PE);

		Map<String, TrackedValue> revenuePart = new LinkedHashMap<>();
		Optional<TrackedValue> revenueOverride = overrides.findOverride(
				OverrideResolver.path(assetClass.getKey(), REVENUE_GROWTH));
		TrackedValue revenueGrowth;
		if (revenueOverride.isPresent()) {
			revenueGrowth = revenueOverride.get();
			revenuePart.put(REVENUE_GROWTH, revenueGrowth);
		} else {
			TrackedValue wedge = input(assetClass, REVENUE_GDP_WEDGE);
			revenueGrowth = TrackedValue.computed(inflationForecast + rgdpGrowth + wedge.value());
			revenuePart.put(REVENUE_GROWTH, revenueGrowth);
			revenuePart.put("inflation", TrackedValue.computed(inflationForecast));
			revenuePart.put("rgdp_growth", TrackedValue.computed(rgdpGrowth));
			revenuePart.put(REVENUE_GDP_WEDGE, wedge);
		}

		int horizon = parameters.forecastHorizonYears();
		double valuationChange = peValuationChange(currentPe.value(), targetPe.value(), horizon);
		Map<String, TrackedValue> valuationPart = new LinkedHashMap<>();
		valuationPart.put("valuation_change", TrackedValue.computed(valuationChange));
		valuationPart.put(CURRENT_PE, currentPe);
		valuationPart.put(TARGET_PE, targetPe);

		Map<String, TrackedValue> incomePart = new LinkedHashMap<>();
		incomePart.put(RaEquityModel.DIVIDEND_YIELD, dividendYield);
		incomePart.put(NET_BUYBACK_YIELD, buybackYield);
		incomePart.put(MARGIN_CHANGE, marginChange);

		Map<String, Map<String, TrackedValue>> components = new LinkedHashMap<>();
		components.put("income", incomePart);
		components.put("revenue", revenuePart);
		components.put("valuation", valuationPart);

		double nominal = dividendYield.value() + buybackYield.value() + revenueGrowth.value()
				+ marginChange.value() + valuationChange;
		return new GrinoldKronerEquityForecast(assetClass, nominal, nominal - inflationForecast, dividendYield.value(),
				buybackYield.value(), revenueGrowth.value(), marginChange.value(), valuationChange, inflationForecast,
				rgdpGrowth, revenueOverride.isEmpty(), components);
	}

	static double peValuationChange(double currentPe, double targetPe, int horizon) {
		if (currentPe <= 0.0 || targetPe <= 0.0) {
			return 0.0;
		}
		return Math.pow(targetPe / currentPe, 1.0 / horizon) - 1.0;
	}

	private TrackedValue input(AssetClass assetClass, String field) {
		return overrides.resolve(OverrideResolver.path(assetClass.getKey(), field),
				defaults.assetDefault(assetClass, field, EquityModelType.GK));
	}
}
