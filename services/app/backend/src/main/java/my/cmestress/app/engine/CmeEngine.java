package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.AssetClassResult;
import my.cmestress.app.model.BaseCurrency;
import my.cmestress.app.model.Currency;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.FxForecast;
import my.cmestress.app.model.FxSummary;
import my.cmestress.app.model.InputSource;
import my.cmestress.app.model.MacroDependency;
import my.cmestress.app.model.MacroForecast;
import my.cmestress.app.model.MacroForecastSet;
import my.cmestress.app.model.MacroSummary;
import my.cmestress.app.model.Region;
import my.cmestress.app.model.ScenarioResult;
import my.cmestress.app.model.SourcedValue;
import my.cmestress.app.model.TrackedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one scenario: macro forecasts first, then every asset class through its model, the currency step
 * and the macro dependency explanations. An instance owns its overrides and macro cache and must not be
 * shared between threads.
 */
public class CmeEngine {
	private static final Logger logger = LoggerFactory.getLogger(CmeEngine.class);
	public static final String DEFAULT_SCENARIO_NAME = "Base Case";
	public static final String GLOBAL_RGDP_GROWTH = "global.rgdp_growth";
	private static final List<Currency> FX_SUMMARY_CURRENCIES = List.of(Currency.USD, Currency.JPY, Currency.EM);
	private static final List<String> NOMINAL = List.of("expected_return_nominal");
	private static final List<String> REAL = List.of("expected_return_real");

	private final DefaultsCatalog defaults;
	private final BaseCurrency baseCurrency;
	private final EquityModelType equityModelType;
	private final OverrideResolver overrides;
	private final MacroModel macroModel;
	private final BondModel bondModel;
	private final RaEquityModel raEquityModel;
	private final GrinoldKronerEquityModel grinoldKronerEquityModel;
	private final HedgeFundModel hedgeFundModel;
	private final FxModel fxModel;
	private final MacroForecastCache macroCache;

	public CmeEngine(DefaultsCatalog defaults) {
		this(defaults, Map.of(), BaseCurrency.USD, EquityModelType.RA);
	}

	public CmeEngine(DefaultsCatalog defaults, Map<String, ?> overrides, BaseCurrency baseCurrency,
					 EquityModelType equityModelType) {
		this.defaults = defaults;
		this.baseCurrency = baseCurrency == null ? BaseCurrency.USD : baseCurrency;
		this.equityModelType = equityModelType == null ? EquityModelType.RA : equityModelType;
		this.overrides = new OverrideResolver(overrides);
		this.macroModel = new MacroModel(this.overrides, defaults);
		this.bondModel = new BondModel(this.overrides, defaults);
		this.raEquityModel = new RaEquityModel(this.overrides, defaults);
		this.grinoldKronerEquityModel = new GrinoldKronerEquityModel(this.overrides, defaults);
		this.hedgeFundModel = new HedgeFundModel(this.overrides, defaults);
		this.fxModel = new FxModel(defaults.parameters());
		this.macroCache = new MacroForecastCache(macroModel);
	}

	public record OverrideComparison(Double defaultValue, Object overrideValue) {
	}

	public BaseCurrency getBaseCurrency() {
		return baseCurrency;
	}

	public EquityModelType getEquityModelType() {
		return equityModelType;
	}

	public MacroForecastCache macroCache() {
		return macroCache;
	}

	public void setOverride(String path, Object value) {
		overrides.setOverride(path, value);
		macroCache.invalidate();
	}

	public void mergeOverrides(Map<String, ?> partial) {
		overrides.mergeOverrides(partial);
		macroCache.invalidate();
	}

	public void replaceOverrides(Map<String, ?> replacement) {
		overrides.clear();
		overrides.mergeOverrides(replacement);
		macroCache.invalidate();
	}

	public void clearOverrides() {
		overrides.clear();
		macroCache.invalidate();
	}

	public Map<String, Object> overridesSummary() {
		return overrides.summary();
	}

	/**
	 * Pairs every override with the value it replaced. Direct macro forecasts are compared with the
	 * forecast the building blocks would give; paths without any default map to a null default.
	 */
	public Map<String, OverrideComparison> compareWithDefaults() {
		Map<String, Object> summary = overrides.summary();
		MacroForecastSet baseline = summary.isEmpty() ? null
				: new CmeEngine(defaults, Map.of(), baseCurrency, equityModelType).computeMacroForecasts();
		Map<String, OverrideComparison> comparison = new LinkedHashMap<>();
		summary.forEach((path, value) -> {
			Double defaultValue = defaults.lookup(path, equityModelType).orElse(null);
			if (defaultValue == null) {
				defaultValue = baselineForecast(baseline, path);
			}
			comparison.put(path, new OverrideComparison(defaultValue, value));
		});
		return comparison;
	}

	public MacroForecastSet computeMacroForecasts() {
		return macroCache.get();
	}

	/**
	 * Provenance of every direct forecast and building block as {@code <region>.<field>}, plus
	 * {@code global.rgdp_growth}.
	 */
	public Map<String, InputSource> macroSources() {
		Map<String, InputSource> sources = new LinkedHashMap<>();
		for (Region region : Region.values()) {
			for (String field : macroFields()) {
				sources.put(region.getKey() + "." + field, isOverridden(region, field) ? InputSource.OVERRIDE : InputSource.DEFAULT);
			}
		}
		sources.put(GLOBAL_RGDP_GROWTH, globalRgdpSource());
		return sources;
	}

	public AssetClassResult computeAssetClass(AssetClass assetClass) {
		MacroForecastSet macro = computeMacroForecasts();
		AssetClassResult localResult = switch (assetClass.getKind()) {
			case LIQUIDITY -> computeLiquidity(macro);
			case BOND -> computeBond(assetClass, macro);
			case EQUITY -> computeEquity(assetClass, macro);
			case HEDGE_FUND -> computeAbsoluteReturn(macro);
		};
		return fxModel.adjustmentFor(assetClass, baseCurrency, macro)
				.map(fx -> applyFx(localResult, fx))
				.orElse(localResult);
	}

	public Map<String, FxSummary> computeFxForecasts() {
		Map<String, FxSummary> forecasts = new LinkedHashMap<>();
		if (baseCurrency == BaseCurrency.USD) {
			return forecasts;
		}
		MacroForecastSet macro = computeMacroForecasts();
		for (Currency foreign : FX_SUMMARY_CURRENCIES) {
			fxModel.forecastForCurrencies(baseCurrency.getCurrency(), foreign, macro)
					.ifPresent(fx -> forecasts.put(foreign.getKey(), fx.toSummary()));
		}
		return forecasts;
	}

	public ScenarioResult computeAll(String scenarioName) {
		String name = scenarioName == null || scenarioName.isBlank() ? DEFAULT_SCENARIO_NAME : scenarioName;
		Map<String, AssetClassResult> results = new LinkedHashMap<>();
		for (AssetClass assetClass : AssetClass.values()) {
			results.put(assetClass.getKey(), computeAssetClass(assetClass));
		}
		MacroForecastSet macro = computeMacroForecasts();
		Map<String, MacroSummary> macroSummary = new LinkedHashMap<>();
		macro.regions().forEach((region, forecast) -> macroSummary.put(region.getKey(), forecast.toSummary()));
		logger.debug("Scenario '{}' computed with {} override(s)", name, overrides.summary().size());
		return new ScenarioResult(name, baseCurrency, equityModelType, results, macroSummary,
				macro.globalRgdpGrowth().value(), computeFxForecasts(), overrides.summary());
	}

	public ScenarioResult computeAll() {
		return computeAll(DEFAULT_SCENARIO_NAME);
	}

	private AssetClassResult computeLiquidity(MacroForecastSet macro) {
		Region region = baseCurrency.getRegion();
		MacroForecast forecast = macro.forRegion(region);
		double nominal = forecast.tbillRate().value();
		Map<String, Double> components = new LinkedHashMap<>();
		components.put("tbill_rate", nominal);
		Map<String, SourcedValue> inputs = new LinkedHashMap<>();
		forecast.components().get("tbill").forEach((key, value) -> inputs.put(key, value.flatten()));

		Map<String, MacroDependency> dependencies = new LinkedHashMap<>();
		dependencies.put("tbill", tbillDependency(region, forecast, NOMINAL,
				"T-Bill rate is the direct cash return (" + percent(nominal) + ")"));
		dependencies.put("inflation", inflationDependency(region, forecast, REAL, "Inflation forecast for region"));
		return result(AssetClass.LIQUIDITY, nominal, nominal - forecast.inflation().value(), components, inputs,
				dependencies);
	}

	private AssetClassResult computeBond(AssetClass assetClass, MacroForecastSet macro) {
		MacroForecast us = macro.forRegion(Region.US);
		double tbill = us.tbillRate().value();
		double inflation = us.inflation().value();
		BondForecast forecast = assetClass == AssetClass.BONDS_EM
				? bondModel.computeEmReturn(EmBondMode.HARD_CURRENCY, tbill, null, inflation)
				: bondModel.computeReturn(BondPolicy.forAssetClass(assetClass), tbill, inflation);

		Map<String, Double> components = new LinkedHashMap<>();
		components.put("yield", forecast.yieldComponent());
		components.put("roll_return", forecast.rollReturn());
		components.put("valuation", forecast.valuationReturn());
		components.put("credit_loss", forecast.creditLoss());

		String tbillNote = assetClass == AssetClass.BONDS_EM
				? "Base rate for yield calculation, plus " + percent(defaults.parameters().emHardCurrencySpread()) + " EM spread"
				: "Base rate for yield calculation";
		Map<String, MacroDependency> dependencies = new LinkedHashMap<>();
		dependencies.put("tbill", tbillDependency(Region.US, us, List.of("yield", "expected_return_nominal"), tbillNote));
		dependencies.put("inflation", inflationDependency(Region.US, us, REAL, "Subtracted from nominal for real return"));
		return result(assetClass, forecast.expectedReturnNominal(), forecast.expectedReturnReal(), components,
				flattenInputs(forecast.components()), dependencies);
	}

	private EquityForecast equityForecast(AssetClass assetClass, MacroForecastSet macro) {
		MacroForecast regional = macro.forRegion(assetClass.macroRegion(baseCurrency));
		return switch (equityModelType) {
			case RA -> raEquityModel.computeReturn(assetClass, regional.inflation().value(),
					macro.globalRgdpGrowth().value());
			case GK -> grinoldKronerEquityModel.computeReturn(assetClass, regional.inflation().value(),
					regional.rgdpGrowth().value());
		};
	}

	private AssetClassResult computeEquity(AssetClass assetClass, MacroForecastSet macro) {
		Region region = assetClass.macroRegion(baseCurrency);
		MacroForecast regional = macro.forRegion(region);
		EquityForecast forecast = equityForecast(assetClass, macro);
		Map<String, MacroDependency> dependencies = new LinkedHashMap<>();
		if (forecast instanceof RaEquityForecast ra) {
			dependencies.put("inflation", inflationDependency(region, regional, NOMINAL,
					"Added to real return for nominal (" + percent(ra.inflation()) + ")"));
			double ceiling = macro.globalRgdpGrowth().value();
			dependencies.put("global_gdp_cap", new MacroDependency(GLOBAL_RGDP_GROWTH, ceiling, globalRgdpSource(),
					List.of("real_eps_growth"), "Caps EPS growth at " + percent(ceiling)
					+ " (GDP-weighted global average)" + (ra.epsCapped() ? ", binding" : "")));
		} else if (forecast instanceof GrinoldKronerEquityForecast gk) {
			if (gk.revenueGrowthComputed()) {
				List<String> affects = List.of("revenue_growth", "expected_return_nominal");
				dependencies.put("inflation", inflationDependency(region, regional, affects, "Flows into revenue growth ("
						+ percent(gk.inflation()) + " of " + percent(gk.revenueGrowth()) + ")"));
				dependencies.put("rgdp", new MacroDependency(region.getKey() + "." + MacroModel.RGDP_GROWTH, gk.rgdpGrowth(), rgdpSource(region), affects,
						"Flows into revenue growth (" + percent(gk.rgdpGrowth()) + " of " + percent(gk.revenueGrowth()) + ")"));
			} else {
				dependencies.put("inflation", inflationDependency(region, regional, REAL,
						"Used for real return back-computation (" + percent(gk.inflation()) + ")"));
			}
		}
		return result(assetClass, forecast.expectedReturnNominal(), forecast.expectedReturnReal(),
				forecast.returnComponents(), flattenInputs(forecast.components()), dependencies);
	}

	private AssetClassResult computeAbsoluteReturn(MacroForecastSet macro) {
		Region region = baseCurrency.getRegion();
		MacroForecast base = macro.forRegion(region);
		// The market premium is global, so it always comes from the RA US equity return.
		EquityForecast usEquity = raEquityModel.computeReturn(AssetClass.EQUITY_US,
				macro.forRegion(Region.US).inflation().value(), macro.globalRgdpGrowth().value());
		HedgeFundForecast forecast = hedgeFundModel.computeReturn(base.tbillRate().value(), base.inflation().value(),
				usEquity.expectedReturnNominal());

		Map<String, Double> components = new LinkedHashMap<>();
		components.put("tbill", forecast.tbillComponent());
		components.put("factor_return", forecast.factorReturn());
		components.put("trading_alpha", forecast.tradingAlpha());

		Map<String, SourcedValue> inputs = new LinkedHashMap<>();
		inputs.put("tbill_forecast", new SourcedValue(forecast.tbillComponent(), InputSource.COMPUTED));
		inputs.put(HedgeFundModel.TRADING_ALPHA, forecast.components().get("alpha").get(HedgeFundModel.TRADING_ALPHA).flatten());
		forecast.components().get("betas").forEach((factor, beta) -> inputs.put("beta_" + factor, beta.flatten()));
		forecast.components().get("premia").forEach((factor, premium) -> inputs.put("premium_" + factor, premium.flatten()));
		forecast.factorContributions().forEach((factor, contribution) ->
				inputs.put("factor_" + factor, new SourcedValue(contribution, InputSource.COMPUTED)));

		Map<String, MacroDependency> dependencies = new LinkedHashMap<>();
		dependencies.put("tbill", tbillDependency(region, base, NOMINAL, "Risk-free rate component"));
		dependencies.put("inflation", inflationDependency(region, base, REAL, "Inflation forecast for region"));
		dependencies.put("us_equity_return", new MacroDependency("us.equity_return", usEquity.expectedReturnNominal(),
				usEquitySource(), List.of("factor_return"),
				"US equity return (" + percent(usEquity.expectedReturnNominal()) + ") used for market factor premium"));
		return result(AssetClass.ABSOLUTE_RETURN, forecast.expectedReturnNominal(), forecast.expectedReturnReal(),
				components, inputs, dependencies);
	}

	private AssetClassResult applyFx(AssetClassResult local, FxForecast fx) {
		Map<String, Double> components = new LinkedHashMap<>(local.components());
		components.put("fx_return", fx.fxChange());
		Map<String, SourcedValue> inputs = new LinkedHashMap<>(local.inputsUsed());
		inputs.put("fx_home_tbill", new SourcedValue(fx.homeTbill(), InputSource.COMPUTED));
		inputs.put("fx_foreign_tbill", new SourcedValue(fx.foreignTbill(), InputSource.COMPUTED));
		inputs.put("fx_home_inflation", new SourcedValue(fx.homeInflation(), InputSource.COMPUTED));
		inputs.put("fx_foreign_inflation", new SourcedValue(fx.foreignInflation(), InputSource.COMPUTED));
		inputs.put("fx_carry_component", new SourcedValue(fx.carryComponent(), InputSource.COMPUTED));
		inputs.put("fx_ppp_component", new SourcedValue(fx.pppComponent(), InputSource.COMPUTED));

		Map<String, MacroDependency> dependencies = new LinkedHashMap<>(local.macroDependencies());
		Currency foreign = local.assetClass().localCurrency(baseCurrency);
		boolean affected = tbillSource(fx.homeRegion()) != InputSource.DEFAULT
				|| tbillSource(fx.foreignRegion()) != InputSource.DEFAULT
				|| inflationSource(fx.homeRegion()) != InputSource.DEFAULT
				|| inflationSource(fx.foreignRegion()) != InputSource.DEFAULT;
		dependencies.put("fx", new MacroDependency("fx." + baseCurrency.getKey() + "_" + foreign.getKey(), fx.fxChange(),
				affected ? InputSource.AFFECTED_BY_OVERRIDE : InputSource.DEFAULT,
				List.of("expected_return_nominal", "expected_return_real"),
				"Translates " + foreign.getKey().toUpperCase(Locale.ROOT) + " returns into "
						+ baseCurrency.getKey().toUpperCase(Locale.ROOT) + " (" + percent(fx.fxChange()) + ")"));

		return new AssetClassResult(local.assetClass(), local.displayName(), local.expectedReturnNominal() + fx.fxChange(),
				local.expectedReturnReal() + fx.fxChange(), local.expectedVolatility(), components, inputs, dependencies);
	}

	private AssetClassResult result(AssetClass assetClass, double nominal, double real, Map<String, Double> components,
									Map<String, SourcedValue> inputs, Map<String, MacroDependency> dependencies) {
		return new AssetClassResult(assetClass, assetClass.getDisplayName(), nominal, real,
				defaults.parameters().expectedVolatility(assetClass), components, inputs, dependencies);
	}

	private MacroDependency tbillDependency(Region region, MacroForecast forecast, List<String> affects, String note) {
		return new MacroDependency(region.getKey() + "." + MacroModel.TBILL_FORECAST, forecast.tbillRate().value(),
				tbillSource(region), affects, note);
	}

	private MacroDependency inflationDependency(Region region, MacroForecast forecast, List<String> affects, String note) {
		return new MacroDependency(region.getKey() + "." + MacroModel.INFLATION_FORECAST, forecast.inflation().value(),
				inflationSource(region), affects, note);
	}

	InputSource rgdpSource(Region region) {
		return chainSource(region, MacroModel.RGDP_GROWTH, MacroModel.RGDP_BUILDING_BLOCKS);
	}

	InputSource inflationSource(Region region) {
		return chainSource(region, MacroModel.INFLATION_FORECAST, MacroModel.INFLATION_BUILDING_BLOCKS);
	}

	/**
	 * The long-term T-Bill is built from GDP and inflation, so their overrides reach it even when the T-Bill
	 * itself keeps its default.
	 */
	InputSource tbillSource(Region region) {
		InputSource own = chainSource(region, MacroModel.TBILL_FORECAST, MacroModel.TBILL_BUILDING_BLOCKS);
		if (own != InputSource.DEFAULT) {
			return own;
		}
		if (rgdpSource(region) != InputSource.DEFAULT || inflationSource(region) != InputSource.DEFAULT) {
			return InputSource.AFFECTED_BY_OVERRIDE;
		}
		return InputSource.DEFAULT;
	}

	InputSource globalRgdpSource() {
		for (Region region : defaults.parameters().globalGdpWeights().keySet()) {
			if (rgdpSource(region) != InputSource.DEFAULT) {
				return InputSource.AFFECTED_BY_OVERRIDE;
			}
		}
		return InputSource.DEFAULT;
	}

	private InputSource usEquitySource() {
		boolean equityInputs = overrides.summary().keySet().stream()
				.anyMatch(path -> path.startsWith(AssetClass.EQUITY_US.getKey() + "."));
		boolean macroInputs = inflationSource(Region.US) != InputSource.DEFAULT
				|| globalRgdpSource() != InputSource.DEFAULT;
		return equityInputs || macroInputs ? InputSource.AFFECTED_BY_OVERRIDE : InputSource.COMPUTED;
	}

	private InputSource chainSource(Region region, String forecastField, List<String> buildingBlocks) {
		if (isOverridden(region, forecastField)) {
			return InputSource.OVERRIDE;
		}
		for (String block : buildingBlocks) {
			if (isOverridden(region, block)) {
				return InputSource.AFFECTED_BY_OVERRIDE;
			}
		}
		return InputSource.DEFAULT;
	}

	private boolean isOverridden(Region region, String field) {
		return overrides.hasOverride(MacroModel.macroPath(region, field));
	}

	private static List<String> macroFields() {
		List<String> fields = new ArrayList<>(MacroModel.DIRECT_FORECASTS);
		fields.addAll(MacroModel.RGDP_BUILDING_BLOCKS);
		fields.addAll(MacroModel.INFLATION_BUILDING_BLOCKS);
		fields.addAll(MacroModel.TBILL_BUILDING_BLOCKS);
		return fields;
	}

	private static Map<String, SourcedValue> flattenInputs(Map<String, Map<String, TrackedValue>> components) {
		Map<String, SourcedValue> inputs = new LinkedHashMap<>();
		components.forEach((section, values) ->
				values.forEach((key, value) -> inputs.put(section + "_" + key, value.flatten())));
		return inputs;
	}

	private static Double baselineForecast(MacroForecastSet baseline, String path) {
		if (baseline == null) {
			return null;
		}
		String[] segments = path.split("\\.");
		if (segments.length != 3 || !DefaultsCatalog.MACRO.equals(segments[0])) {
			return null;
		}
		Optional<Region> region = Arrays.stream(Region.values())
				.filter(candidate -> candidate.getKey().equals(segments[1]))
				.findFirst();
		if (region.isEmpty()) {
			return null;
		}
		MacroForecast forecast = baseline.forRegion(region.get());
		return switch (segments[2]) {
			case MacroModel.RGDP_GROWTH -> forecast.rgdpGrowth().value();
			case MacroModel.INFLATION_FORECAST -> forecast.inflation().value();
			case MacroModel.TBILL_FORECAST -> forecast.tbillRate().value();
			default -> null;
		};
	}

	static String percent(double value) {
		return String.format(Locale.ROOT, "%.2f%%", value * 100.0);
	}
}
