package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.Region;
import my.cmestress.app.model.UnknownIdentifierException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Baseline market assumptions every scenario starts from. Instances are immutable; refreshed market data is
 * layered on top with {@link #withMarketData}.
 */
public final class DefaultsCatalog {
	public static final String MACRO = "macro";

	private final Map<Region, Map<String, Double>> macroDefaults;
	private final Map<AssetClass, Map<String, Double>> assetDefaults;
	private final Map<AssetClass, Map<String, Double>> grinoldKronerOverlay;
	private final ModelParameters parameters;

	public DefaultsCatalog(Map<Region, Map<String, Double>> macroDefaults,
						   Map<AssetClass, Map<String, Double>> assetDefaults,
						   Map<AssetClass, Map<String, Double>> grinoldKronerOverlay,
						   ModelParameters parameters) {
		this.macroDefaults = freeze(macroDefaults, Region.class);
		this.assetDefaults = freeze(assetDefaults, AssetClass.class);
		this.grinoldKronerOverlay = freeze(grinoldKronerOverlay, AssetClass.class);
		this.parameters = parameters;
	}

	public static DefaultsCatalog builtIn() {
		Map<Region, Map<String, Double>> macro = new EnumMap<>(Region.class);
		macro.put(Region.US, macroInputs(0.004, 0.012, 2.1, 0.025, 0.0367, 0.022, 0.0, -0.003));
		macro.put(Region.EUROZONE, macroInputs(0.001, 0.010, 2.3, 0.022, 0.0204, 0.020, -0.002, -0.003));
		macro.put(Region.JAPAN, macroInputs(-0.005, 0.008, 2.5, 0.020, 0.0075, 0.015, -0.005, -0.003));
		macro.put(Region.EM, macroInputs(0.010, 0.025, 1.5, 0.045, 0.060, 0.035, 0.005, -0.005));

		Map<AssetClass, Map<String, Double>> assets = new EnumMap<>(AssetClass.class);
		assets.put(AssetClass.LIQUIDITY, Map.of());

		Map<String, Double> government = new LinkedHashMap<>();
		government.put("current_yield", 0.035);
		government.put("duration", 7.0);
		government.put("current_term_premium", 0.01);
		government.put("fair_term_premium", 0.015);
		assets.put(AssetClass.BONDS_GLOBAL, government);

		Map<String, Double> highYield = new LinkedHashMap<>();
		highYield.put("current_yield", 0.075);
		highYield.put("duration", 4.0);
		highYield.put("current_term_premium", 0.015);
		highYield.put("fair_term_premium", 0.015);
		highYield.put("credit_spread", 0.0271);
		highYield.put("fair_credit_spread", 0.04);
		highYield.put("default_rate", 0.055);
		highYield.put("recovery_rate", 0.40);
		assets.put(AssetClass.BONDS_HY, highYield);

		Map<String, Double> emerging = new LinkedHashMap<>();
		emerging.put("current_yield", 0.0577);
		emerging.put("duration", 5.5);
		emerging.put("current_term_premium", 0.015);
		emerging.put("fair_term_premium", 0.02);
		emerging.put("default_rate", 0.028);
		emerging.put("recovery_rate", 0.55);
		emerging.put("em_inflation_premium", 0.015);
		assets.put(AssetClass.BONDS_EM, emerging);

		assets.put(AssetClass.EQUITY_US, equityInputs(0.0113, 0.0248, 0.05, 0.018, 0.016,
				0.015, 0.020, 0.055, -0.005, 22.0, 20.0));
		assets.put(AssetClass.EQUITY_EUROPE, equityInputs(0.030, 0.055, 0.055, 0.012, 0.016,
				0.005, 0.005, 0.034, 0.0, 14.0, 14.0));
		assets.put(AssetClass.EQUITY_JAPAN, equityInputs(0.022, 0.055, 0.05, 0.008, 0.016,
				0.008, 0.005, 0.025, 0.003, 15.0, 14.5));
		assets.put(AssetClass.EQUITY_EM, equityInputs(0.030, 0.065, 0.06, 0.030, 0.028,
				-0.015, 0.005, 0.073, 0.0, 12.0, 12.0));

		ModelParameters parameters = ModelParameters.defaults();
		Map<String, Double> hedgeFund = new LinkedHashMap<>();
		hedgeFund.put("beta_market", 0.30);
		hedgeFund.put("beta_size", 0.10);
		hedgeFund.put("beta_value", 0.05);
		hedgeFund.put("beta_profitability", 0.05);
		hedgeFund.put("beta_investment", 0.05);
		hedgeFund.put("beta_momentum", 0.10);
		hedgeFund.put("trading_alpha", parameters.historicalDiscount() * parameters.historicalTradingAlpha());
		assets.put(AssetClass.ABSOLUTE_RETURN, hedgeFund);

		Map<AssetClass, Map<String, Double>> overlay = new EnumMap<>(AssetClass.class);
		overlay.put(AssetClass.EQUITY_US, Map.of("dividend_yield", 0.013));

		return new DefaultsCatalog(macro, assets, overlay, parameters);
	}

	/**
	 * Returns a catalog whose market data is replaced field by field with the given values. Unknown regions,
	 * assets and fields are ignored so a partial refresh never drops a default.
	 */
	public DefaultsCatalog withMarketData(Map<Region, Map<String, Double>> macro,
										  Map<AssetClass, Map<String, Double>> assets,
										  Map<AssetClass, Map<String, Double>> overlay) {
		return new DefaultsCatalog(
				mergeKnown(macroDefaults, macro),
				mergeKnown(assetDefaults, assets),
				mergeOverlay(grinoldKronerOverlay, overlay),
				parameters);
	}

	public ModelParameters parameters() {
		return parameters;
	}

	public Map<String, Double> macroInputs(Region region) {
		Map<String, Double> inputs = macroDefaults.get(region);
		if (inputs == null) {
			throw new UnknownIdentifierException("region", region == null ? null : region.getKey());
		}
		return inputs;
	}

	public Map<String, Double> assetInputs(AssetClass assetClass, EquityModelType equityModel) {
		Map<String, Double> inputs = assetDefaults.get(assetClass);
		if (inputs == null) {
			throw new UnknownIdentifierException("asset class", assetClass == null ? null : assetClass.getKey());
		}
		if (equityModel == EquityModelType.GK && grinoldKronerOverlay.containsKey(assetClass)) {
			Map<String, Double> merged = new LinkedHashMap<>(inputs);
			merged.putAll(grinoldKronerOverlay.get(assetClass));
			return Collections.unmodifiableMap(merged);
		}
		return inputs;
	}

	public double macroDefault(Region region, String field) {
		Double value = macroInputs(region).get(field);
		if (value == null) {
			throw new UnknownIdentifierException("macro input", region.getKey() + "." + field);
		}
		return value;
	}

	public double assetDefault(AssetClass assetClass, String field, EquityModelType equityModel) {
		Double value = assetInputs(assetClass, equityModel).get(field);
		if (value == null) {
			throw new UnknownIdentifierException("asset input", assetClass.getKey() + "." + field);
		}
		return value;
	}

	/**
	 * Looks up the default behind an override path such as {@code macro.us.current_tbill} or
	 * {@code bonds_hy.default_rate}. Paths without a catalog default return empty.
	 */
	public Optional<Double> lookup(String path, EquityModelType equityModel) {
		if (path == null) {
			return Optional.empty();
		}
		String[] segments = path.split("\\.");
		if (segments.length == 3 && MACRO.equals(segments[0])) {
			for (Region region : Region.values()) {
				if (region.getKey().equals(segments[1])) {
					return Optional.ofNullable(macroDefaults.get(region).get(segments[2]));
				}
			}
			return Optional.empty();
		}
		if (segments.length == 2 && AssetClass.isKnownKey(segments[0])) {
			return Optional.ofNullable(assetInputs(AssetClass.fromKey(segments[0]), equityModel).get(segments[1]));
		}
		return Optional.empty();
	}

	/**
	 * Every default as {@code macro.<region>.<field>} or {@code <asset>.<field>}.
	 */
	public Map<String, Double> flatten(EquityModelType equityModel) {
		Map<String, Double> flat = new LinkedHashMap<>();
		macroDefaults.forEach((region, inputs) ->
				inputs.forEach((field, value) -> flat.put(MACRO + "." + region.getKey() + "." + field, value)));
		for (AssetClass assetClass : assetDefaults.keySet()) {
			assetInputs(assetClass, equityModel).forEach((field, value) -> flat.put(assetClass.getKey() + "." + field, value));
		}
		return flat;
	}

	private static Map<String, Double> macroInputs(double population, double productivity, double myRatio,
												   double headline, double tbill, double longTermInflation,
												   double countryFactor, double rgdpAdjustment) {
		Map<String, Double> inputs = new LinkedHashMap<>();
		inputs.put("population_growth", population);
		inputs.put("productivity_growth", productivity);
		inputs.put("my_ratio", myRatio);
		inputs.put("current_headline_inflation", headline);
		inputs.put("current_tbill", tbill);
		inputs.put("long_term_inflation", longTermInflation);
		inputs.put("inflation_adjustment", 0.0);
		inputs.put("country_factor", countryFactor);
		inputs.put("rgdp_adjustment", rgdpAdjustment);
		return inputs;
	}

	private static Map<String, Double> equityInputs(double dividendYield, double currentCaey, double fairCaey,
													double realEpsGrowth, double regionalEpsGrowth,
													double netBuybackYield, double revenueGdpWedge,
													double revenueGrowth, double marginChange,
													double currentPe, double targetPe) {
		Map<String, Double> inputs = new LinkedHashMap<>();
		inputs.put("dividend_yield", dividendYield);
		inputs.put("current_caey", currentCaey);
		inputs.put("fair_caey", fairCaey);
		inputs.put("real_eps_growth", realEpsGrowth);
		inputs.put("regional_eps_growth", regionalEpsGrowth);
		inputs.put("reversion_speed", 1.0);
		inputs.put("net_buyback_yield", netBuybackYield);
		inputs.put("revenue_gdp_wedge", revenueGdpWedge);
		inputs.put("revenue_growth", revenueGrowth);
		inputs.put("margin_change", marginChange);
		inputs.put("current_pe", currentPe);
		inputs.put("target_pe", targetPe);
		return inputs;
	}

	private static <K extends Enum<K>> Map<K, Map<String, Double>> mergeKnown(Map<K, Map<String, Double>> base,
																			 Map<K, Map<String, Double>> updates) {
		Map<K, Map<String, Double>> merged = new LinkedHashMap<>();
		base.forEach((key, inputs) -> {
			Map<String, Double> copy = new LinkedHashMap<>(inputs);
			Map<String, Double> refreshed = updates == null ? null : updates.get(key);
			if (refreshed != null) {
				refreshed.forEach((field, value) -> {
					if (value != null && copy.containsKey(field)) {
						copy.put(field, value);
					}
				});
			}
			merged.put(key, copy);
		});
		return merged;
	}

	private static Map<AssetClass, Map<String, Double>> mergeOverlay(Map<AssetClass, Map<String, Double>> base,
																	Map<AssetClass, Map<String, Double>> updates) {
		Map<AssetClass, Map<String, Double>> merged = new LinkedHashMap<>();
		base.forEach((key, inputs) -> merged.put(key, new LinkedHashMap<>(inputs)));
		if (updates != null) {
			updates.forEach((key, inputs) -> {
				Map<String, Double> target = merged.computeIfAbsent(key, ignored -> new LinkedHashMap<>());
				inputs.forEach((field, value) -> {
					if (value != null) {
						target.put(field, value);
					}
				});
			});
		}
		return merged;
	}

	private static <K extends Enum<K>> Map<K, Map<String, Double>> freeze(Map<K, Map<String, Double>> source, Class<K> type) {
		Map<K, Map<String, Double>> frozen = new EnumMap<>(type);
		if (source != null) {
			source.forEach((key, inputs) -> frozen.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(inputs))));
		}
		return Collections.unmodifiableMap(frozen);
	}
}
