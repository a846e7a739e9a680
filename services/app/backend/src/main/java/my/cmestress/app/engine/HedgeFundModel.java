package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.TrackedValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Absolute return = T-Bill + sum of factor beta times factor premium + trading alpha.
 */
public class HedgeFundModel {
	public static final String MARKET = "market";
	public static final List<String> FACTORS = List.of(MARKET, "size", "value", "profitability", "investment", "momentum");
	public static final String TRADING_ALPHA = "trading_alpha";
	private static final String BETA_PREFIX = "beta_";
	private static final String PREMIUM_PREFIX = "premium_";

	private final OverrideResolver overrides;
	private final DefaultsCatalog defaults;
	private final ModelParameters parameters;

	public HedgeFundModel(OverrideResolver overrides, DefaultsCatalog defaults) {
		this.overrides = overrides;
		this.defaults = defaults;
		this.parameters = defaults.parameters();
	}

	public Map<String, TrackedValue> betas() {
		Map<String, TrackedValue> betas = new LinkedHashMap<>();
		for (String factor : FACTORS) {
			betas.put(factor, input(BETA_PREFIX + factor));
		}
		return betas;
	}

	/**
	 * Expected factor premia. The market premium is the equity return over cash when an equity return is given;
	 * the rest are discounted historical premia. Any premium can be overridden as {@code premium_<factor>}.
	 */
	public Map<String, TrackedValue> premia(Double equityReturn, Double tbillRate) {
		Map<String, TrackedValue> premia = new LinkedHashMap<>();
		for (String factor : FACTORS) {
			Optional<TrackedValue> override = overrides.findOverride(
					OverrideResolver.path(AssetClass.ABSOLUTE_RETURN.getKey(), PREMIUM_PREFIX + factor));
			if (override.isPresent()) {
				premia.put(factor, override.get());
				continue;
			}
			double historical = parameters.historicalFactorPremia().getOrDefault(factor, 0.0);
			if (MARKET.equals(factor)) {
				premia.put(factor, equityReturn != null && tbillRate != null
						? TrackedValue.computed(equityReturn - tbillRate)
						: TrackedValue.ofDefault(historical));
			} else {
				premia.put(factor, TrackedValue.ofDefault(historical * parameters.historicalDiscount()));
			}
		}
		return premia;
	}

	public HedgeFundForecast computeReturn(double tbillForecast, double inflationForecast, Double equityReturn) {
		Map<String, TrackedValue> betas = betas();
		Map<String, TrackedValue> premia = premia(equityReturn, tbillForecast);
		Map<String, Double> contributions = new LinkedHashMap<>();
		double factorReturn = 0.0;
		for (String factor : FACTORS) {
			double contribution = betas.get(factor).value() * premia.get(factor).value();
			contributions.put(factor, contribution);
			factorReturn += contribution;
		}
		TrackedValue alpha = input(TRADING_ALPHA);

		Map<String, TrackedValue> alphaPart = new LinkedHashMap<>();
		alphaPart.put(TRADING_ALPHA, alpha);
		alphaPart.put("historical_discount", TrackedValue.ofDefault(parameters.historicalDiscount()));
		Map<String, Map<String, TrackedValue>> components = new LinkedHashMap<>();
		components.put("betas", betas);
		components.put("premia", premia);
		components.put("alpha", alphaPart);

		double nominal = tbillForecast + factorReturn + alpha.value();
		return new HedgeFundForecast(nominal, nominal - inflationForecast, tbillForecast, factorReturn, alpha.value(),
				inflationForecast, contributions, components);
	}

	private TrackedValue input(String field) {
		return overrides.resolve(OverrideResolver.path(AssetClass.ABSOLUTE_RETURN.getKey(), field),
				defaults.assetDefault(AssetClass.ABSOLUTE_RETURN, field, EquityModelType.RA));
	}
}
