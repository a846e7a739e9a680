package my.cmestress.app.service;

import my.cmestress.app.config.AppProperties;
import my.cmestress.app.dto.MacroPreviewDto;
import my.cmestress.app.dto.ScenarioComparisonRowDto;
import my.cmestress.app.dto.ScenarioRequest;
import my.cmestress.app.dto.StressScenarioDto;
import my.cmestress.app.dto.StressTestResultDto;
import my.cmestress.app.engine.CmeEngine;
import my.cmestress.app.engine.DefaultsCatalog;
import my.cmestress.app.engine.MacroModel;
import my.cmestress.app.model.AssetClassResult;
import my.cmestress.app.model.BaseCurrency;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.MacroForecast;
import my.cmestress.app.model.MacroForecastSet;
import my.cmestress.app.model.Region;
import my.cmestress.app.model.ScenarioResult;
import my.cmestress.app.model.SourcedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for scenario work: single scenarios, side-by-side comparisons and preset stress tests.
 * Every call builds its own engine, so the service itself holds no scenario state.
 */
@Service
public class ScenarioService {
	private static final Logger logger = LoggerFactory.getLogger(ScenarioService.class);

	private final DefaultsCatalogService defaultsCatalogService;
	private final StressScenarioService stressScenarioService;
	private final AppProperties properties;

	public ScenarioService(DefaultsCatalogService defaultsCatalogService,
						   StressScenarioService stressScenarioService,
						   AppProperties properties) {
		this.defaultsCatalogService = defaultsCatalogService;
		this.stressScenarioService = stressScenarioService;
		this.properties = properties;
	}

	public CmeEngine createEngine(Map<String, ?> overrides, String baseCurrency, String equityModel) {
		return new CmeEngine(defaultsCatalogService.getCatalog(),
				overrides == null ? Map.of() : overrides,
				resolveBaseCurrency(baseCurrency),
				resolveEquityModel(equityModel));
	}

	public ScenarioResult computeScenario(ScenarioRequest request) {
		ScenarioRequest effective = request == null ? ScenarioRequest.of(null, Map.of()) : request;
		CmeEngine engine = createEngine(effective.overrides(), effective.baseCurrency(), effective.equityModel());
		String name = effective.scenarioName() == null || effective.scenarioName().isBlank()
				? defaultScenarioName()
				: effective.scenarioName();
		logger.info("Computing scenario '{}' (base currency {}, equity model {}, {} override(s))", name,
				engine.getBaseCurrency().getKey(), engine.getEquityModelType().getKey(), engine.overridesSummary().size());
		return engine.computeAll(name);
	}

	public List<ScenarioResult> compareScenarios(List<ScenarioRequest> requests) {
		if (requests == null || requests.isEmpty()) {
			throw new IllegalArgumentException("At least one scenario is required");
		}
		List<ScenarioResult> results = new ArrayList<>();
		for (ScenarioRequest request : requests) {
			results.add(computeScenario(request));
		}
		return results;
	}

	public StressTestResultDto runStressTest(String scenarioKey, String baseCurrency, String equityModel) {
		StressScenarioDto scenario = stressScenarioService.getScenario(scenarioKey);
		logger.info("Running stress test '{}'", scenario.key());
		ScenarioResult base = computeScenario(new ScenarioRequest(CmeEngine.DEFAULT_SCENARIO_NAME, Map.of(),
				baseCurrency, equityModel));
		ScenarioResult stress = computeScenario(new ScenarioRequest(scenario.name(), scenario.overrides(),
				baseCurrency, equityModel));
		return new StressTestResultDto(scenario.key(), scenario.description(), base, stress, compare(base, stress));
	}

	public List<ScenarioComparisonRowDto> compare(ScenarioResult base, ScenarioResult other) {
		List<ScenarioComparisonRowDto> rows = new ArrayList<>();
		base.results().forEach((key, baseResult) -> {
			AssetClassResult otherResult = other.results().get(key);
			if (otherResult == null) {
				return;
			}
			rows.add(new ScenarioComparisonRowDto(key, baseResult.displayName(),
					baseResult.expectedReturnNominal(), otherResult.expectedReturnNominal(),
					otherResult.expectedReturnNominal() - baseResult.expectedReturnNominal(),
					baseResult.expectedReturnReal(), otherResult.expectedReturnReal(),
					otherResult.expectedReturnReal() - baseResult.expectedReturnReal()));
		});
		return rows;
	}

	/**
	 * Every default input as a flat {@code path -> value} map, including the baseline macro forecasts the
	 * building blocks produce.
	 */
	public Map<String, Double> getAllDefaults(String equityModel) {
		EquityModelType model = resolveEquityModel(equityModel);
		DefaultsCatalog catalog = defaultsCatalogService.getCatalog();
		Map<String, Double> defaults = new LinkedHashMap<>(catalog.flatten(model));
		MacroForecastSet baseline = new CmeEngine(catalog, Map.of(), BaseCurrency.USD, model).computeMacroForecasts();
		baseline.regions().forEach((region, forecast) -> {
			defaults.put(MacroModel.macroPath(region, MacroModel.RGDP_GROWTH), forecast.rgdpGrowth().value());
			defaults.put(MacroModel.macroPath(region, MacroModel.INFLATION_FORECAST), forecast.inflation().value());
			defaults.put(MacroModel.macroPath(region, MacroModel.TBILL_FORECAST), forecast.tbillRate().value());
		});
		return defaults;
	}

	/**
	 * Macro forecast for one region with the given building blocks applied as overrides.
	 */
	public MacroPreviewDto previewMacro(String regionKey, Map<String, ?> buildingBlocks) {
		Region region = Region.fromKey(regionKey);
		Map<String, Object> regionOverrides = new LinkedHashMap<>();
		if (buildingBlocks != null) {
			regionOverrides.putAll(buildingBlocks);
		}
		Map<String, Object> overrides = Map.of(DefaultsCatalog.MACRO, Map.of(region.getKey(), regionOverrides));
		MacroForecast forecast = new CmeEngine(defaultsCatalogService.getCatalog(), overrides,
				BaseCurrency.USD, resolveEquityModel(null)).computeMacroForecasts().forRegion(region);
		Map<String, Map<String, SourcedValue>> components = new LinkedHashMap<>();
		forecast.components().forEach((group, values) -> {
			Map<String, SourcedValue> flattened = new LinkedHashMap<>();
			values.forEach((name, value) -> flattened.put(name, value.flatten()));
			components.put(group, flattened);
		});
		return new MacroPreviewDto(region.getKey(), forecast.toSummary(), components, forecast.unusedInputs());
	}

	public List<StressScenarioDto> listStressScenarios() {
		return stressScenarioService.listScenarios();
	}

	private BaseCurrency resolveBaseCurrency(String baseCurrency) {
		if (baseCurrency != null && !baseCurrency.isBlank()) {
			return BaseCurrency.fromKey(baseCurrency);
		}
		if (properties != null && properties.engine() != null && properties.engine().baseCurrency() != null) {
			return BaseCurrency.fromKey(properties.engine().baseCurrency());
		}
		return BaseCurrency.USD;
	}

	private EquityModelType resolveEquityModel(String equityModel) {
		if (equityModel != null && !equityModel.isBlank()) {
			return EquityModelType.fromKey(equityModel);
		}
		if (properties != null && properties.engine() != null && properties.engine().equityModel() != null) {
			return EquityModelType.fromKey(properties.engine().equityModel());
		}
		return EquityModelType.RA;
	}

	private String defaultScenarioName() {
		if (properties != null && properties.engine() != null && properties.engine().scenarioName() != null
				&& !properties.engine().scenarioName().isBlank()) {
			return properties.engine().scenarioName();
		}
		return CmeEngine.DEFAULT_SCENARIO_NAME;
	}
}
