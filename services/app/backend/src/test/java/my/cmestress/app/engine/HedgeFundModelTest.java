package my.cmestress.app.engine;

import my.cmestress.app.model.InputSource;
import my.cmestress.app.model.TrackedValue;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HedgeFundModelTest {
	private static final double EPS = 1e-12;

	private HedgeFundModel model(Map<String, ?> overrides) {
		return new HedgeFundModel(new OverrideResolver(overrides), DefaultsCatalog.builtIn());
	}

	@Test
	void marketPremiumComesFromEquityReturnOverCash() {
		HedgeFundForecast forecast = model(Map.of()).computeReturn(0.03, 0.02, 0.07);

		assertThat(forecast.components().get("premia").get("market")).isEqualTo(TrackedValue.computed(0.04));
		assertThat(forecast.factorReturn()).isCloseTo(0.018, within(EPS));
		assertThat(forecast.tradingAlpha()).isCloseTo(0.01, within(EPS));
		assertThat(forecast.expectedReturnNominal()).isCloseTo(0.058, within(EPS));
		assertThat(forecast.expectedReturnReal()).isCloseTo(0.038, within(EPS));
	}

	@Test
	void otherPremiaAreDiscountedHistoricalValues() {
		Map<String, TrackedValue> premia = model(Map.of()).premia(null, null);

		assertThat(premia.get("market")).isEqualTo(TrackedValue.ofDefault(0.05));
		assertThat(premia.get("momentum").value()).isCloseTo(0.03, within(EPS));
		assertThat(premia.get("size").source()).isEqualTo(InputSource.DEFAULT);
	}

	@Test
	void withoutEquityReturnHistoricalMarketPremiumIsUsed() {
		HedgeFundForecast forecast = model(Map.of()).computeReturn(0.03, 0.02, null);

		assertThat(forecast.factorReturn()).isCloseTo(0.021, within(EPS));
	}

	@Test
	void betaAndPremiumOverridesApply() {
		HedgeFundForecast forecast = model(Map.of("absolute_return",
				Map.of("beta_market", 0.5, "premium_momentum", 0.0))).computeReturn(0.03, 0.02, 0.07);

		assertThat(forecast.components().get("betas").get("market").source()).isEqualTo(InputSource.OVERRIDE);
		assertThat(forecast.factorContributions().get("market")).isCloseTo(0.02, within(EPS));
		assertThat(forecast.factorContributions().get("momentum")).isEqualTo(0.0);
		assertThat(forecast.factorReturn()).isCloseTo(0.023, within(EPS));
	}
}
