package my.cmestress.app;

import my.cmestress.app.cli.CmeCommandLineRunner;
import my.cmestress.app.dto.ScenarioRequest;
import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.ScenarioResult;
import my.cmestress.app.service.DefaultsCatalogService;
import my.cmestress.app.service.ScenarioService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AppApplicationTests {
	@Autowired
	private ApplicationContext context;

	@Autowired
	private ScenarioService scenarioService;

	@Autowired
	private DefaultsCatalogService defaultsCatalogService;

	@Test
	void contextLoads() {
		assertThat(context.getBeansOfType(CmeCommandLineRunner.class)).isEmpty();
	}

	@Test
	void computesScenarioFromBundledDefaults() {
		ScenarioResult result = scenarioService.computeScenario(ScenarioRequest.of(null, Map.of()));

		assertThat(result.scenarioName()).isEqualTo("Base Case");
		assertThat(result.results()).hasSize(AssetClass.values().length);
		assertThat(defaultsCatalogService.getCatalog().parameters().forecastHorizonYears()).isEqualTo(10);
	}
}
