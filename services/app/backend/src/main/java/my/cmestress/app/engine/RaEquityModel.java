package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.TrackedValue;
import my.cmestress.app.model.UnknownIdentifierException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Real return = dividend yield + real EPS growth + valuation change from CAEY reverting to fair value.
 */
public class RaEquityModel {
	public static final String DIVIDEND_YIELD = "dividend_yield";
	public static final String CURRENT_CAEY = "current_caey";
	public static final String FAIR_CAEY = "fair_caey";
	public static final String REAL_EPS_GROWTH = "real_eps_growth";
	public static final String REGIONAL_EPS_GROWTH = "regional_eps_growth";
	public static final String REVERSION_SPEED = "reversion_speed";

	private final OverrideResolver overrides;
	private final DefaultsCatalog defaults;
	private final ModelParameters parameters;

	public RaEquityModel(OverrideResolver overrides, DefaultsCatalog defaults) {
		this.overrides = overrides;
		this.defaults = defaults;
		this.parameters = defaults.parameters();
	}

	/**
	 * @param globalRgdpGrowth ceiling for EPS growth, or null for no cap
	 */
	public RaEquityForecast computeReturn(AssetClass assetClass, double inflationForecast, Double globalRgdpGrowth) {
		requireEquity(assetClass);
		TrackedValue dividendYield = input(assetClass, DIVIDEND_YIELD);

		TrackedValue countryEps = input(assetClass, REAL_EPS_GROWTH);
		TrackedValue regionalEps = input(assetClass, REGIONAL_EPS_GROWTH);
		double blendedEps = parameters.countryEpsWeight() * countryEps.value()
				+ parameters.regionalEpsWeight() * regionalEps.value();
		double cappedEps = globalRgdpGrowth == null ? blendedEps : Math.min(blendedEps, globalRgdpGrowth);
		boolean capped = cappedEps < blendedEps;

		TrackedValue currentCaey = input(assetClass, CURRENT_CAEY);
		TrackedValue fairCaey = input(assetClass, FAIR_CAEY);
		TrackedValue reversionSpeed = input(assetClass, REVERSION_SPEED);
		int horizon = parameters.forecastHorizonYears();
		double annualCaeyChange = caeyAnnualChange(currentCaey.value(), fairCaey.value(), reversionSpeed.value());
		double valuationChange = averageValuationEffect(currentCaey.value(), annualCaeyChange, horizon);

		Map<String, TrackedValue> dividendPart = new LinkedHashMap<>();
		dividendPart.put(DIVIDEND_YIELD, dividendYield);

		Map<String, TrackedValue> epsPart = new LinkedHashMap<>();
		epsPart.put(REAL_EPS_GROWTH, TrackedValue.computed(cappedEps));
		epsPart.put("country_eps_growth", countryEps);
		epsPart.put(REGIONAL_EPS_GROWTH, regionalEps);
		epsPart.put("blended_eps_growth", TrackedValue.computed(blendedEps));
		epsPart.put("country_weight", TrackedValue.ofDefault(parameters.countryEpsWeight()));
		epsPart.put("regional_weight", TrackedValue.ofDefault(parameters.regionalEpsWeight()));

		Map<String, TrackedValue> valuationPart = new LinkedHashMap<>();
		valuationPart.put("valuation_change", TrackedValue.computed(valuationChange));
		valuationPart.put(CURRENT_CAEY, currentCaey);
		valuationPart.put(FAIR_CAEY, fairCaey);
		valuationPart.put(REVERSION_SPEED, reversionSpeed);
		valuationPart.put("caey_annual_change", TrackedValue.computed(annualCaeyChange));
		valuationPart.put("full_reversion_years", TrackedValue.ofDefault(parameters.caeyFullReversionYears()));

		Map<String, Map<String, TrackedValue>> components = new LinkedHashMap<>();
		components.put("dividend", dividendPart);
		components.put("eps", epsPart);
		components.put("valuation", valuationPart);

		double real = dividendYield.value() + cappedEps + valuationChange;
		return new RaEquityForecast(assetClass, real + inflationForecast, real, dividendYield.value(), cappedEps,
				valuationChange, inflationForecast, capped, components);
	}

	/**
	 * Yearly CAEY growth so that a full move to fair value takes the configured reversion years, slowed by the
	 * speed multiplier. Non-positive CAEY values mean no reversion.
	 */
	double caeyAnnualChange(double currentCaey, double fairCaey, double reversionSpeed) {
		if (currentCaey <= 0.0 || fairCaey <= 0.0) {
			return 0.0;
		}
		return Math.pow(fairCaey / currentCaey, reversionSpeed / parameters.caeyFullReversionYears()) - 1.0;
	}

	/**
	 * Average yearly price effect while CAEY compounds at {@code annualChange}; a rising earnings yield
	 * means falling prices.
	 */
	static double averageValuationEffect(double currentCaey, double annualChange, int horizon) {
		if (currentCaey <= 0.0 || annualChange <= -1.0) {
			return 0.0;
		}
		double caey = currentCaey;
		double total = 0.0;
		for (int year = 0; year < horizon; year++) {
			double next = caey * (1.0 + annualChange);
			total += caey / next - 1.0;
			caey = next;
		}
		return total / horizon;
	}

	private TrackedValue input(AssetClass assetClass, String field) {
		return overrides.resolve(OverrideResolver.path(assetClass.getKey(), field),
				defaults.assetDefault(assetClass, field, EquityModelType.RA));
	}

	static void requireEquity(AssetClass assetClass) {
		if (assetClass.getKind() != AssetClass.Kind.EQUITY) {
			throw new UnknownIdentifierException("equity region", assetClass.getKey());
		}
	}
}
