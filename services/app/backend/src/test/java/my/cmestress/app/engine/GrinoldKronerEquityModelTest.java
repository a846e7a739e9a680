package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.InputSource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GrinoldKronerEquityModelTest {
	private static final double EPS = 1e-12;

	private GrinoldKronerEquityModel model(Map<String, ?> overrides) {
		return new GrinoldKronerEquityModel(new OverrideResolver(overrides), DefaultsCatalog.builtIn());
	}

	@Test
	void revenueGrowthFollowsNominalGdpPlusWedge() {
		GrinoldKronerEquityForecast forecast = model(Map.of()).computeReturn(AssetClass.EQUITY_US, 0.02, 0.015);

		assertThat(forecast.dividendYield()).isEqualTo(0.013);
		assertThat(forecast.revenueGrowth()).isCloseTo(0.055, within(EPS));
		assertThat(forecast.valuationChange()).isCloseTo(-0.00948574178547823, within(EPS));
		assertThat(forecast.expectedReturnNominal()).isCloseTo(0.06851425821452177, within(EPS));
		assertThat(forecast.expectedReturnReal()).isCloseTo(0.048514258214521766, within(EPS));
		assertThat(forecast.revenueGrowthComputed()).isTrue();
		assertThat(forecast.components().get("revenue").get("revenue_growth").source()).isEqualTo(InputSource.COMPUTED);
	}

	@Test
	void revenueGrowthOverrideBypassesMacro() {
		GrinoldKronerEquityForecast forecast = model(Map.of("equity_us", Map.of("revenue_growth", 0.05)))
				.computeReturn(AssetClass.EQUITY_US, 0.02, 0.015);

		assertThat(forecast.revenueGrowth()).isEqualTo(0.05);
		assertThat(forecast.revenueGrowthComputed()).isFalse();
		assertThat(forecast.expectedReturnNominal()).isCloseTo(0.06351425821452177, within(EPS));
	}

	@Test
	void unchangedPeGivesNoValuationChange() {
		GrinoldKronerEquityForecast forecast = model(Map.of()).computeReturn(AssetClass.EQUITY_EUROPE, 0.02, 0.01);

		assertThat(forecast.valuationChange()).isCloseTo(0.0, within(EPS));
		assertThat(forecast.expectedReturnNominal()).isCloseTo(0.07, within(EPS));
	}

	@Test
	void degeneratePeGivesNoValuationChange() {
		assertThat(GrinoldKronerEquityModel.peValuationChange(0.0, 20.0, 10)).isEqualTo(0.0);
		assertThat(GrinoldKronerEquityModel.peValuationChange(20.0, -1.0, 10)).isEqualTo(0.0);
	}
}
