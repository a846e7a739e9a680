package my.cmestress.app.service;

import my.cmestress.app.dto.StressScenarioDto;
import my.cmestress.app.model.UnknownIdentifierException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StressScenarioServiceTest {
	private final StressScenarioService service = new StressScenarioService(new DefaultResourceLoader(), null);

	@Test
	void loadsBundledPresets() {
		assertThat(service.listScenarios())
				.extracting(StressScenarioDto::key)
				.containsExactly("inflation_shock", "recession", "equity_valuation_correction", "rising_rates", "em_stress");
	}

	@Test
	@SuppressWarnings("unchecked")
	void presetCarriesNestedOverrides() {
		StressScenarioDto recession = service.getScenario("Recession");

		assertThat(recession.name()).isEqualTo("Recession");
		assertThat(recession.description()).contains("higher defaults");
		Map<String, Object> bonds = (Map<String, Object>) recession.overrides().get("bonds_hy");
		assertThat(((Number) bonds.get("default_rate")).doubleValue()).isEqualTo(0.08);
	}

	@Test
	void unknownPresetIsRejected() {
		assertThatThrownBy(() -> service.getScenario("alien_invasion"))
				.isInstanceOf(UnknownIdentifierException.class)
				.hasMessageContaining("alien_invasion");
	}

	@Test
	void missingResourceYieldsNoPresets() {
		ResourceLoader loader = mock(ResourceLoader.class);
		Resource resource = mock(Resource.class);
		when(loader.getResource(anyString())).thenReturn(resource);
		when(resource.exists()).thenReturn(false);

		assertThat(new StressScenarioService(loader, null).listScenarios()).isEmpty();
	}
}
