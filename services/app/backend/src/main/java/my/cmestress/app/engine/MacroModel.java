package my.cmestress.app.engine;

import my.cmestress.app.engine.util.ForecastMath;
import my.cmestress.app.model.MacroForecast;
import my.cmestress.app.model.Region;
import my.cmestress.app.model.TrackedValue;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Real GDP growth, inflation and T-Bill forecasts per region. Each forecast can be overridden outright, which
 * bypasses its building blocks.
 */
public class MacroModel {
	public static final String RGDP_GROWTH = "rgdp_growth";
	public static final String INFLATION_FORECAST = "inflation_forecast";
	public static final String TBILL_FORECAST = "tbill_forecast";

	public static final String POPULATION_GROWTH = "population_growth";
	public static final String PRODUCTIVITY_GROWTH = "productivity_growth";
	public static final String MY_RATIO = "my_ratio";
	public static final String RGDP_ADJUSTMENT = "rgdp_adjustment";
	public static final String CURRENT_HEADLINE_INFLATION = "current_headline_inflation";
	public static final String LONG_TERM_INFLATION = "long_term_inflation";
	public static final String INFLATION_ADJUSTMENT = "inflation_adjustment";
	public static final String CURRENT_TBILL = "current_tbill";
	public static final String COUNTRY_FACTOR = "country_factor";

	public static final List<String> DIRECT_FORECASTS = List.of(RGDP_GROWTH, INFLATION_FORECAST, TBILL_FORECAST);
	public static final List<String> RGDP_BUILDING_BLOCKS = List.of(POPULATION_GROWTH, PRODUCTIVITY_GROWTH, MY_RATIO,
			RGDP_ADJUSTMENT);
	public static final List<String> INFLATION_BUILDING_BLOCKS = List.of(CURRENT_HEADLINE_INFLATION, LONG_TERM_INFLATION,
			INFLATION_ADJUSTMENT);
	public static final List<String> TBILL_BUILDING_BLOCKS = List.of(CURRENT_TBILL, COUNTRY_FACTOR);

	private final OverrideResolver overrides;
	private final DefaultsCatalog defaults;
	private final ModelParameters parameters;

	public MacroModel(OverrideResolver overrides, DefaultsCatalog defaults) {
		this.overrides = overrides;
		this.defaults = defaults;
		this.parameters = defaults.parameters();
	}

	public record Step(TrackedValue forecast, Map<String, TrackedValue> components, List<String> unusedInputs) {
	}

	public Step forecastRgdpGrowth(Region region) {
		Map<String, TrackedValue> inputs = overrides.resolveMacroInputs(region, defaults.macroInputs(region));
		TrackedValue population = inputs.get(POPULATION_GROWTH);
		Map<String, TrackedValue> components = new LinkedHashMap<>();
		var direct = overrides.findOverride(macroPath(region, RGDP_GROWTH));
		if (direct.isPresent()) {
			components.put(RGDP_GROWTH, direct.get());
			components.put(POPULATION_GROWTH, population);
			components.put("output_per_capita_growth", TrackedValue.computed(direct.get().value() - population.value()));
			return new Step(direct.get(), components, List.of(PRODUCTIVITY_GROWTH, MY_RATIO, RGDP_ADJUSTMENT));
		}

		TrackedValue productivity = inputs.get(PRODUCTIVITY_GROWTH);
		TrackedValue myRatio = inputs.get(MY_RATIO);
		TrackedValue adjustment = inputs.get(RGDP_ADJUSTMENT);
		double demographicEffect = ForecastMath.sigmoidMyRatio(myRatio.value(), parameters.myRatioMidpoint(),
				parameters.myRatioSteepness());
		double outputPerCapita = productivity.value() + demographicEffect + adjustment.value();
		TrackedValue rgdp = TrackedValue.computed(outputPerCapita + population.value());

		components.put(RGDP_GROWTH, rgdp);
		components.put(POPULATION_GROWTH, population);
		components.put(PRODUCTIVITY_GROWTH, productivity);
		components.put(MY_RATIO, myRatio);
		components.put("demographic_effect", TrackedValue.computed(demographicEffect));
		components.put(RGDP_ADJUSTMENT, adjustment);
		components.put("output_per_capita_growth", TrackedValue.computed(outputPerCapita));
		return new Step(rgdp, components, List.of());
	}

	public Step forecastInflation(Region region) {
		Map<String, TrackedValue> inputs = overrides.resolveMacroInputs(region, defaults.macroInputs(region));
		TrackedValue headline = inputs.get(CURRENT_HEADLINE_INFLATION);
		Map<String, TrackedValue> components = new LinkedHashMap<>();
		var direct = overrides.findOverride(macroPath(region, INFLATION_FORECAST));
		if (direct.isPresent()) {
			components.put(INFLATION_FORECAST, direct.get());
			components.put(CURRENT_HEADLINE_INFLATION, headline);
			components.put(LONG_TERM_INFLATION, TrackedValue.computed(direct.get().value()));
			return new Step(direct.get(), components, List.of(LONG_TERM_INFLATION, INFLATION_ADJUSTMENT));
		}

		TrackedValue longTerm = inputs.get(LONG_TERM_INFLATION);
		TrackedValue adjustment = inputs.get(INFLATION_ADJUSTMENT);
		double currentWeight = parameters.inflationCurrentWeight();
		double longTermWeight = parameters.inflationLongTermWeight();
		TrackedValue inflation = TrackedValue.computed(
				currentWeight * headline.value() + longTermWeight * longTerm.value() + adjustment.value());

		components.put(INFLATION_FORECAST, inflation);
		components.put(CURRENT_HEADLINE_INFLATION, headline);
		components.put(LONG_TERM_INFLATION, longTerm);
		components.put(INFLATION_ADJUSTMENT, adjustment);
		components.put("current_weight", TrackedValue.ofDefault(currentWeight));
		components.put("long_term_weight", TrackedValue.ofDefault(longTermWeight));
		return new Step(inflation, components, List.of());
	}

	public Step forecastTbill(Region region, TrackedValue rgdp, TrackedValue inflation) {
		Map<String, TrackedValue> inputs = overrides.resolveMacroInputs(region, defaults.macroInputs(region));
		TrackedValue currentTbill = inputs.get(CURRENT_TBILL);
		Map<String, TrackedValue> components = new LinkedHashMap<>();
		var direct = overrides.findOverride(macroPath(region, TBILL_FORECAST));
		if (direct.isPresent()) {
			components.put(TBILL_FORECAST, direct.get());
			components.put(CURRENT_TBILL, currentTbill);
			return new Step(direct.get(), components, List.of(COUNTRY_FACTOR));
		}

		TrackedValue countryFactor = inputs.get(COUNTRY_FACTOR);
		double longTermTbill = Math.max(parameters.tbillRateFloor(),
				countryFactor.value() + rgdp.value() + inflation.value());
		TrackedValue tbill = TrackedValue.computed(
				parameters.tbillCurrentWeight() * currentTbill.value() + parameters.tbillLongTermWeight() * longTermTbill);

		components.put(TBILL_FORECAST, tbill);
		components.put(CURRENT_TBILL, currentTbill);
		components.put("long_term_tbill", TrackedValue.computed(longTermTbill));
		components.put(COUNTRY_FACTOR, countryFactor);
		components.put("rgdp_forecast", rgdp);
		components.put(INFLATION_FORECAST, inflation);
		components.put("rate_floor", TrackedValue.ofDefault(parameters.tbillRateFloor()));
		return new Step(tbill, components, List.of());
	}

	public MacroForecast computeFullForecast(Region region) {
		Step rgdp = forecastRgdpGrowth(region);
		Step inflation = forecastInflation(region);
		Step tbill = forecastTbill(region, rgdp.forecast(), inflation.forecast());

		Map<String, Map<String, TrackedValue>> components = new LinkedHashMap<>();
		components.put("rgdp", rgdp.components());
		components.put("inflation", inflation.components());
		components.put("tbill", tbill.components());
		List<String> unused = new ArrayList<>(rgdp.unusedInputs());
		unused.addAll(inflation.unusedInputs());
		unused.addAll(tbill.unusedInputs());

		return new MacroForecast(region, rgdp.forecast(), inflation.forecast(), tbill.forecast(),
				rgdp.forecast().value() + inflation.forecast().value(), components, unused);
	}

	public Map<Region, MacroForecast> computeAllRegions() {
		Map<Region, MacroForecast> forecasts = new EnumMap<>(Region.class);
		for (Region region : Region.values()) {
			forecasts.put(region, computeFullForecast(region));
		}
		return forecasts;
	}

	/**
	 * GDP-weighted real growth across the regions that have a weight.
	 */
	public TrackedValue computeGlobalRgdpGrowth(Map<Region, MacroForecast> forecasts) {
		double totalWeight = parameters.globalGdpWeights().values().stream().mapToDouble(Double::doubleValue).sum();
		double growth = 0.0;
		for (Map.Entry<Region, Double> entry : parameters.globalGdpWeights().entrySet()) {
			MacroForecast forecast = forecasts.get(entry.getKey());
			if (forecast != null) {
				growth += entry.getValue() / totalWeight * forecast.rgdpGrowth().value();
			}
		}
		return TrackedValue.computed(growth);
	}

	public static String macroPath(Region region, String field) {
		return OverrideResolver.path(DefaultsCatalog.MACRO, region.getKey(), field);
	}
}
