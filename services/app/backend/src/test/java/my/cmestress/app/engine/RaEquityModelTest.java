package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.UnknownIdentifierException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RaEquityModelTest {
	private static final double EPS = 1e-12;
	private static final double INFLATION = 0.02;

	private RaEquityModel model(Map<String, ?> overrides) {
		return new RaEquityModel(new OverrideResolver(overrides), DefaultsCatalog.builtIn());
	}

	@Test
	void usRealReturnIsDividendPlusEpsPlusValuation() {
		RaEquityForecast forecast = model(Map.of()).computeReturn(AssetClass.EQUITY_US, INFLATION, null);

		assertThat(forecast.dividendYield()).isEqualTo(0.0113);
		assertThat(forecast.realEpsGrowth()).isCloseTo(0.017, within(EPS));
		assertThat(forecast.valuationChange()).isCloseTo(-0.0344515215100367, within(EPS));
		assertThat(forecast.expectedReturnReal()).isCloseTo(-0.0061515215100367004, within(EPS));
		assertThat(forecast.expectedReturnNominal()).isCloseTo(forecast.expectedReturnReal() + INFLATION, within(EPS));
		assertThat(forecast.epsCapped()).isFalse();
	}

	@Test
	void epsGrowthIsCappedAtGlobalGrowth() {
		RaEquityForecast forecast = model(Map.of()).computeReturn(AssetClass.EQUITY_EM, INFLATION, 0.02);

		assertThat(forecast.realEpsGrowth()).isEqualTo(0.02);
		assertThat(forecast.epsCapped()).isTrue();
		assertThat(forecast.components().get("eps").get("blended_eps_growth").value()).isCloseTo(0.029, within(EPS));
	}

	@Test
	void caeyAtFairValueGivesNoValuationChange() {
		RaEquityForecast forecast = model(Map.of("equity_us", Map.of("current_caey", 0.05)))
				.computeReturn(AssetClass.EQUITY_US, INFLATION, null);

		assertThat(forecast.valuationChange()).isCloseTo(0.0, within(EPS));
	}

	@Test
	void higherFairCaeyLowersValuationReturn() {
		double low = model(Map.of("equity_us", Map.of("fair_caey", 0.04)))
				.computeReturn(AssetClass.EQUITY_US, INFLATION, null).valuationChange();
		double mid = model(Map.of()).computeReturn(AssetClass.EQUITY_US, INFLATION, null).valuationChange();
		double high = model(Map.of("equity_us", Map.of("fair_caey", 0.06)))
				.computeReturn(AssetClass.EQUITY_US, INFLATION, null).valuationChange();

		assertThat(low).isCloseTo(-0.02361840456018015, within(EPS));
		assertThat(low).isGreaterThan(mid);
		assertThat(mid).isGreaterThan(high);
	}

	@Test
	void nonPositiveCaeyMeansNoReversion() {
		RaEquityForecast forecast = model(Map.of("equity_japan", Map.of("current_caey", 0.0)))
				.computeReturn(AssetClass.EQUITY_JAPAN, INFLATION, null);

		assertThat(forecast.valuationChange()).isEqualTo(0.0);
	}

	@Test
	void averageValuationEffectOfUnchangedCaeyIsZero() {
		assertThat(RaEquityModel.averageValuationEffect(0.05, 0.0, 10)).isEqualTo(0.0);
		assertThat(RaEquityModel.averageValuationEffect(0.05, 0.01, 10)).isCloseTo(1.0 / 1.01 - 1.0, within(EPS));
	}

	@Test
	void rejectsNonEquityAssetClass() {
		assertThatThrownBy(() -> model(Map.of()).computeReturn(AssetClass.BONDS_HY, INFLATION, null))
				.isInstanceOf(UnknownIdentifierException.class);
	}
}
