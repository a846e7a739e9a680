package my.cmestress.app.service;

import my.cmestress.app.engine.CmeEngine;
import my.cmestress.app.engine.DefaultsCatalog;
import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.ScenarioResult;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScenarioExportServiceTest {
	private final ScenarioExportService exportService = new ScenarioExportService();
	private final ScenarioResult result = new CmeEngine(DefaultsCatalog.builtIn(),
			Map.of("bonds_hy", Map.of("default_rate", 0.08)), null, null).computeAll("Stressed");

	@Test
	void jsonUsesSnakeCaseAndProvenanceKeys() {
		String json = exportService.toJson(result);

		assertThat(json)
				.contains("\"scenario_name\"")
				.contains("\"expected_return_nominal\"")
				.contains("\"macro_dependencies\"")
				.contains("\"computed\"")
				.contains("\"override\"")
				.doesNotContain("OVERRIDE");

		JsonNode root = JsonMapper.builder().build().readTree(json);
		assertThat(root.path("global_rgdp_growth").doubleValue()).isCloseTo(result.globalRgdpGrowth(), within(1e-15));
		assertThat(root.path("results").path("bonds_hy").path("expected_return_nominal").doubleValue())
				.isCloseTo(result.result(AssetClass.BONDS_HY).expectedReturnNominal(), within(1e-15));
		assertThat(root.path("overrides_applied").path("bonds_hy.default_rate").doubleValue()).isEqualTo(0.08);
	}

	@Test
	void csvHasHeaderAndOneRowPerAssetClass() {
		String csv = exportService.toCsv(result);
		String[] lines = csv.split("\r\n");

		assertThat(lines).hasSize(AssetClass.values().length + 1);
		assertThat(lines[0]).isEqualTo(String.join(",", ScenarioExportService.CSV_HEADER));
		assertThat(lines[1]).startsWith("Stressed,usd,ra,liquidity,Liquidity (Cash),");
	}

	@Test
	void csvStacksSeveralScenarios() {
		ScenarioResult base = new CmeEngine(DefaultsCatalog.builtIn()).computeAll();

		String csv = exportService.toCsv(List.of(base, result));

		assertThat(csv.split("\r\n")).hasSize(2 * AssetClass.values().length + 1);
		assertThat(csv).contains("Base Case,usd,ra,equity_em,Equity EM,");
	}
}
