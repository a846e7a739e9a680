package my.cmestress.app.service;

import my.cmestress.app.config.AppProperties;
import my.cmestress.app.dto.MacroPreviewDto;
import my.cmestress.app.dto.ScenarioComparisonRowDto;
import my.cmestress.app.dto.ScenarioRequest;
import my.cmestress.app.dto.StressScenarioDto;
import my.cmestress.app.dto.StressTestResultDto;
import my.cmestress.app.engine.DefaultsCatalog;
import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.BaseCurrency;
import my.cmestress.app.model.EquityModelType;
import my.cmestress.app.model.InputSource;
import my.cmestress.app.model.ScenarioResult;
import my.cmestress.app.model.UnknownIdentifierException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScenarioServiceTest {
	private static final double EPS = 1e-12;

	@Mock
	private DefaultsCatalogService defaultsCatalogService;

	@Mock
	private StressScenarioService stressScenarioService;

	private ScenarioService service;

	@BeforeEach
	void setUp() {
		when(defaultsCatalogService.getCatalog()).thenReturn(DefaultsCatalog.builtIn());
		service = new ScenarioService(defaultsCatalogService, stressScenarioService, properties("usd", "ra"));
	}

	private static AppProperties properties(String baseCurrency, String equityModel) {
		return new AppProperties(
				new AppProperties.Engine(baseCurrency, equityModel, "Configured Base"),
				new AppProperties.Defaults(null, null),
				new AppProperties.Cli(false));
	}

	@Test
	void missingRequestFieldsFallBackToConfiguration() {
		ScenarioService eurService = new ScenarioService(defaultsCatalogService, stressScenarioService,
				properties("eur", "gk"));

		ScenarioResult result = eurService.computeScenario(ScenarioRequest.of(null, null));

		assertThat(result.scenarioName()).isEqualTo("Configured Base");
		assertThat(result.baseCurrency()).isEqualTo(BaseCurrency.EUR);
		assertThat(result.equityModel()).isEqualTo(EquityModelType.GK);
		assertThat(result.fxForecasts()).containsOnlyKeys("usd", "jpy", "em");
	}

	@Test
	void requestFieldsWinOverConfiguration() {
		ScenarioResult result = service.computeScenario(new ScenarioRequest("Custom", Map.of(), "EUR", "ra"));

		assertThat(result.scenarioName()).isEqualTo("Custom");
		assertThat(result.baseCurrency()).isEqualTo(BaseCurrency.EUR);
	}

	@Test
	void unknownBaseCurrencyIsRejected() {
		assertThatThrownBy(() -> service.computeScenario(new ScenarioRequest("X", Map.of(), "gbp", null)))
				.isInstanceOf(UnknownIdentifierException.class)
				.hasMessageContaining("gbp");
	}

	@Test
	void compareScenariosComputesEachIndependently() {
		List<ScenarioResult> results = service.compareScenarios(List.of(
				ScenarioRequest.of("Base", Map.of()),
				ScenarioRequest.of("High rates", Map.of("macro", Map.of("us", Map.of("tbill_forecast", 0.06))))));

		assertThat(results).extracting(ScenarioResult::scenarioName).containsExactly("Base", "High rates");
		assertThat(results.get(0).result(AssetClass.LIQUIDITY).expectedReturnNominal())
				.isCloseTo(0.0354423240376253, within(EPS));
		assertThat(results.get(1).result(AssetClass.LIQUIDITY).expectedReturnNominal()).isEqualTo(0.06);
	}

	@Test
	void compareScenariosNeedsAtLeastOneRequest() {
		assertThatThrownBy(() -> service.compareScenarios(List.of()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void stressTestComparesPresetWithBaseCase() {
		when(stressScenarioService.getScenario("recession")).thenReturn(new StressScenarioDto("recession", "Recession",
				"Recession scenario (lower GDP, higher defaults)",
				Map.of("macro", Map.of("us", Map.of("rgdp_growth", 0.005, "tbill_forecast", 0.02)),
						"bonds_hy", Map.of("default_rate", 0.08, "recovery_rate", 0.35))));

		StressTestResultDto stress = service.runStressTest("recession", null, null);

		assertThat(stress.baseCase().overridesApplied()).isEmpty();
		assertThat(stress.stressCase().scenarioName()).isEqualTo("Recession");
		assertThat(stress.comparison()).hasSize(AssetClass.values().length);
		ScenarioComparisonRowDto liquidity = stress.comparison().get(0);
		assertThat(liquidity.assetClass()).isEqualTo("liquidity");
		assertThat(liquidity.stressNominal()).isEqualTo(0.02);
		assertThat(liquidity.nominalChange()).isCloseTo(0.02 - 0.0354423240376253, within(EPS));
		ScenarioComparisonRowDto highYield = stress.comparison().stream()
				.filter(row -> row.assetClass().equals("bonds_hy"))
				.findFirst()
				.orElseThrow();
		assertThat(highYield.nominalChange()).isNegative();
	}

	@Test
	void allDefaultsIncludeBaselineMacroForecasts() {
		Map<String, Double> defaults = service.getAllDefaults("gk");

		assertThat(defaults.get("macro.us.tbill_forecast")).isCloseTo(0.0354423240376253, within(EPS));
		assertThat(defaults.get("macro.us.inflation_forecast")).isCloseTo(0.0229, within(EPS));
		assertThat(defaults).containsEntry("equity_us.dividend_yield", 0.013);
		assertThat(defaults).containsEntry("macro.em.current_tbill", 0.060);
	}

	@Test
	void macroPreviewAppliesBuildingBlocks() {
		MacroPreviewDto preview = service.previewMacro("us", Map.of("my_ratio", 2.0));

		assertThat(preview.region()).isEqualTo("us");
		assertThat(preview.forecast().rgdpGrowth()).isCloseTo(0.013, within(EPS));
		assertThat(preview.forecast().tbillRate()).isCloseTo(0.03614, within(EPS));
		assertThat(preview.components().get("rgdp").get("my_ratio").source()).isEqualTo(InputSource.OVERRIDE);
		assertThat(preview.components().get("rgdp").get("demographic_effect").value()).isCloseTo(0.0, within(EPS));
		assertThat(preview.unusedInputs()).isEmpty();
	}

	@Test
	void macroPreviewRejectsUnknownRegion() {
		assertThatThrownBy(() -> service.previewMacro("atlantis", Map.of()))
				.isInstanceOf(UnknownIdentifierException.class);
	}
}
