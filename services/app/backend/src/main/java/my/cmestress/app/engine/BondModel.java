package my.cmestress.app.engine;

import my.cmestress.app.engine.util.ForecastMath;
import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.TrackedValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bond return = yield + roll + valuation - credit loss, shared by every bond class. Class differences come
 * from the {@link BondPolicy}.
 */
public class BondModel {
	public static final String CURRENT_YIELD = "current_yield";
	public static final String DURATION = "duration";
	public static final String CURRENT_TERM_PREMIUM = "current_term_premium";
	public static final String FAIR_TERM_PREMIUM = "fair_term_premium";
	public static final String CREDIT_SPREAD = "credit_spread";
	public static final String FAIR_CREDIT_SPREAD = "fair_credit_spread";
	public static final String EM_INFLATION_PREMIUM = "em_inflation_premium";

	private final OverrideResolver overrides;
	private final DefaultsCatalog defaults;
	private final ModelParameters parameters;

	public BondModel(OverrideResolver overrides, DefaultsCatalog defaults) {
		this.overrides = overrides;
		this.defaults = defaults;
		this.parameters = defaults.parameters();
	}

	public Map<String, TrackedValue> inputs(AssetClass assetClass) {
		return overrides.resolveAll(assetClass.getKey(), defaults.assetInputs(assetClass, EquityModelType.RA));
	}

	public BondForecast computeReturn(BondPolicy policy, double tbillForecast, double inflationForecast) {
		Map<String, TrackedValue> inputs = inputs(policy.assetClass());
		int horizon = parameters.forecastHorizonYears();
		TrackedValue currentYield = inputs.get(CURRENT_YIELD);
		double duration = inputs.get(DURATION).value();

		// An overridden yield moves the term premium by the same amount so the two stay consistent.
		TrackedValue currentTermPremium = inputs.get(CURRENT_TERM_PREMIUM);
		if (currentYield.isOverride()) {
			double defaultYield = defaults.assetDefault(policy.assetClass(), CURRENT_YIELD, EquityModelType.RA);
			currentTermPremium = TrackedValue.computed(currentTermPremium.value() + currentYield.value() - defaultYield);
		}
		TrackedValue fairTermPremium = inputs.get(FAIR_TERM_PREMIUM);
		double averageTermPremium = ForecastMath.averageMeanReverting(currentTermPremium.value(),
				fairTermPremium.value(), parameters.termPremiumReversionSpeed(), horizon);
		double averageYield = tbillForecast + averageTermPremium;

		Map<String, TrackedValue> yieldPart = new LinkedHashMap<>();
		yieldPart.put(CURRENT_YIELD, currentYield);
		yieldPart.put("tbill_forecast", TrackedValue.computed(tbillForecast));
		yieldPart.put(CURRENT_TERM_PREMIUM, currentTermPremium);
		yieldPart.put(FAIR_TERM_PREMIUM, fairTermPremium);
		yieldPart.put("avg_term_premium", TrackedValue.computed(averageTermPremium));
		yieldPart.put("avg_yield", TrackedValue.computed(averageYield));

		double slope = currentTermPremium.value() / parameters.assumedMaturityYears();
		double rollReturn = slope * duration;
		Map<String, TrackedValue> rollPart = new LinkedHashMap<>();
		rollPart.put("roll_return", TrackedValue.computed(rollReturn));
		rollPart.put("yield_curve_slope", TrackedValue.computed(slope));
		rollPart.put(DURATION, inputs.get(DURATION));

		double reversionFraction = parameters.horizonReversionFraction();
		double expectedTermPremiumChange = (fairTermPremium.value() - currentTermPremium.value()) * reversionFraction;
		double valuationReturn = -duration * expectedTermPremiumChange / horizon;
		Map<String, TrackedValue> valuationPart = new LinkedHashMap<>();
		valuationPart.put("valuation_return", TrackedValue.computed(valuationReturn));
		valuationPart.put("expected_tp_change", TrackedValue.computed(expectedTermPremiumChange));
		valuationPart.put("reversion_fraction", TrackedValue.computed(reversionFraction));

		Map<String, TrackedValue> creditPart = policy.creditLoss().apply(inputs);
		double creditLoss = creditPart.get(CreditLossPolicy.CREDIT_LOSS).value();

		Map<String, Map<String, TrackedValue>> components = new LinkedHashMap<>();
		components.put("yield", yieldPart);
		components.put("roll", rollPart);
		components.put("valuation", valuationPart);
		components.put("credit", creditPart);

		double spreadValuation = 0.0;
		if (policy.creditSpreadReversion()) {
			TrackedValue spread = inputs.get(CREDIT_SPREAD);
			TrackedValue fairSpread = inputs.get(FAIR_CREDIT_SPREAD);
			double spreadChange = (fairSpread.value() - spread.value()) * parameters.hySpreadReversionFraction();
			spreadValuation = -duration * spreadChange / horizon;
			Map<String, TrackedValue> spreadPart = new LinkedHashMap<>();
			spreadPart.put("current_spread", spread);
			spreadPart.put("fair_spread", fairSpread);
			spreadPart.put("spread_change", TrackedValue.computed(spreadChange));
			spreadPart.put("spread_valuation", TrackedValue.computed(spreadValuation));
			components.put("credit_spread", spreadPart);
		}

		double nominal = averageYield + rollReturn + valuationReturn + spreadValuation - creditLoss;
		return new BondForecast(nominal, nominal - inflationForecast, averageYield, rollReturn,
				valuationReturn + spreadValuation, spreadValuation, creditLoss, inflationForecast, components);
	}

	/**
	 * EM bonds. With no EM T-Bill the curve is the US T-Bill plus {@link ModelParameters#emHardCurrencySpread()}.
	 */
	public BondForecast computeEmReturn(EmBondMode mode, double usTbillForecast, Double emTbillForecast,
										double inflationForecast) {
		double tbill = emTbillForecast == null ? usTbillForecast + parameters.emHardCurrencySpread() : emTbillForecast;
		double inflation = inflationForecast;
		if (mode == EmBondMode.LOCAL_CURRENCY) {
			inflation += inputs(AssetClass.BONDS_EM).get(EM_INFLATION_PREMIUM).value();
		}
		return computeReturn(BondPolicy.EMERGING, tbill, inflation);
	}
}
