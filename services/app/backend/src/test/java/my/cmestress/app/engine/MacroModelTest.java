package my.cmestress.app.engine;

import my.cmestress.app.model.InputSource;
import my.cmestress.app.model.MacroForecast;
import my.cmestress.app.model.Region;
import my.cmestress.app.model.TrackedValue;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MacroModelTest {
	private static final double EPS = 1e-12;
	private final DefaultsCatalog defaults = DefaultsCatalog.builtIn();

	private MacroModel model(Map<String, ?> overrides) {
		return new MacroModel(new OverrideResolver(overrides), defaults);
	}

	private static Map<String, Object> macro(String region, String field, double value) {
		return Map.of("macro", Map.of(region, Map.of(field, value)));
	}

	@Test
	void buildsUsForecastFromBuildingBlocks() {
		MacroForecast us = model(Map.of()).computeFullForecast(Region.US);

		assertThat(us.rgdpGrowth().value()).isCloseTo(0.012003320053750443, within(EPS));
		assertThat(us.inflation().value()).isCloseTo(0.0229, within(EPS));
		assertThat(us.tbillRate().value()).isCloseTo(0.0354423240376253, within(EPS));
		assertThat(us.nominalGdpGrowth()).isCloseTo(0.012003320053750443 + 0.0229, within(EPS));
		assertThat(us.rgdpGrowth().source()).isEqualTo(InputSource.COMPUTED);
		assertThat(us.unusedInputs()).isEmpty();
	}

	@Test
	void rgdpComponentsAddUp() {
		MacroModel.Step step = model(Map.of()).forecastRgdpGrowth(Region.US);
		Map<String, TrackedValue> c = step.components();

		double expected = c.get("productivity_growth").value() + c.get("demographic_effect").value()
				+ c.get("rgdp_adjustment").value() + c.get("population_growth").value();
		assertThat(step.forecast().value()).isCloseTo(expected, within(EPS));
		assertThat(c.get("output_per_capita_growth").value()).isCloseTo(0.008003320053750443, within(EPS));
		assertThat(c.get("population_growth").source()).isEqualTo(InputSource.DEFAULT);
	}

	@Test
	void directRgdpOverrideSkipsBuildingBlocks() {
		MacroModel.Step step = model(macro("us", "rgdp_growth", 0.02)).forecastRgdpGrowth(Region.US);

		assertThat(step.forecast()).isEqualTo(TrackedValue.ofOverride(0.02));
		assertThat(step.components().get("output_per_capita_growth").value()).isCloseTo(0.016, within(EPS));
		assertThat(step.components()).doesNotContainKey("productivity_growth");
		assertThat(step.unusedInputs()).containsExactly("productivity_growth", "my_ratio", "rgdp_adjustment");
	}

	@Test
	void directRgdpOverrideFlowsIntoTbill() {
		MacroForecast us = model(macro("us", "rgdp_growth", 0.02)).computeFullForecast(Region.US);

		assertThat(us.tbillRate().value()).isCloseTo(0.04104, within(EPS));
	}

	@Test
	void directInflationOverrideReplacesLongTermInflation() {
		MacroForecast us = model(macro("us", "inflation_forecast", 0.04)).computeFullForecast(Region.US);

		assertThat(us.inflation()).isEqualTo(TrackedValue.ofOverride(0.04));
		assertThat(us.components().get("inflation").get("long_term_inflation"))
				.isEqualTo(TrackedValue.computed(0.04));
		assertThat(us.unusedInputs()).contains("long_term_inflation", "inflation_adjustment");
		assertThat(us.tbillRate().value()).isCloseTo(0.047412324037625304, within(EPS));
	}

	@Test
	void directTbillOverrideIsUsedAsIs() {
		MacroForecast us = model(macro("us", "tbill_forecast", 0.03)).computeFullForecast(Region.US);

		assertThat(us.tbillRate()).isEqualTo(TrackedValue.ofOverride(0.03));
		assertThat(us.unusedInputs()).containsExactly("country_factor");
		assertThat(us.components().get("tbill")).containsOnlyKeys("tbill_forecast", "current_tbill");
	}

	@Test
	void longTermTbillIsFloored() {
		Map<String, Object> overrides = Map.of("macro", Map.of("japan",
				Map.of("current_tbill", 0.0, "country_factor", -0.05)));

		MacroForecast japan = model(overrides).computeFullForecast(Region.JAPAN);

		assertThat(japan.components().get("tbill").get("long_term_tbill").value()).isCloseTo(-0.0075, within(EPS));
		assertThat(japan.tbillRate().value()).isCloseTo(-0.00525, within(EPS));
	}

	@Test
	void inflationAdjustmentOverrideKeepsItsProvenance() {
		MacroForecast us = model(macro("us", "inflation_adjustment", 0.01)).computeFullForecast(Region.US);

		assertThat(us.components().get("inflation").get("inflation_adjustment").source())
				.isEqualTo(InputSource.OVERRIDE);
		assertThat(us.inflation().value()).isCloseTo(0.0329, within(EPS));
	}

	@Test
	void globalGrowthIsGdpWeighted() {
		MacroModel baseline = model(Map.of());
		assertThat(baseline.computeGlobalRgdpGrowth(baseline.computeAllRegions()).value())
				.isCloseTo(0.020350353890357865, within(EPS));

		MacroModel stressed = model(macro("em", "rgdp_growth", 0.0));
		assertThat(stressed.computeGlobalRgdpGrowth(stressed.computeAllRegions()).value())
				.isCloseTo(0.004247483391474098, within(EPS));
	}

	@Test
	void macroPathIsDotted() {
		assertThat(MacroModel.macroPath(Region.EUROZONE, MacroModel.CURRENT_TBILL)).isEqualTo("macro.eurozone.current_tbill");
	}
}
