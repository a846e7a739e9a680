package my.cmestress.app.engine;

import my.cmestress.app.model.InputSource;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BondModelTest {
	private static final double EPS = 1e-12;
	private static final double TBILL = 0.03;
	private static final double INFLATION = 0.02;

	private BondModel model(Map<String, ?> overrides) {
		return new BondModel(new OverrideResolver(overrides), DefaultsCatalog.builtIn());
	}

	@Test
	void governmentBondsHaveNoCreditLoss() {
		BondForecast forecast = model(Map.of()).computeReturn(BondPolicy.GOVERNMENT, TBILL, INFLATION);

		assertThat(forecast.yieldComponent()).isCloseTo(0.0445, within(EPS));
		assertThat(forecast.rollReturn()).isCloseTo(0.007, within(EPS));
		assertThat(forecast.valuationReturn()).isCloseTo(-0.003409494253193648, within(EPS));
		assertThat(forecast.creditLoss()).isZero();
		assertThat(forecast.expectedReturnNominal()).isCloseTo(0.04809050574680635, within(EPS));
		assertThat(forecast.expectedReturnReal()).isCloseTo(forecast.expectedReturnNominal() - INFLATION, within(EPS));
	}

	@Test
	void termPremiumAtFairValueGivesNoValuationEffect() {
		BondForecast forecast = model(Map.of("bonds_global", Map.of("current_term_premium", 0.015)))
				.computeReturn(BondPolicy.GOVERNMENT, TBILL, INFLATION);

		assertThat(forecast.valuationReturn()).isCloseTo(0.0, within(EPS));
	}

	@Test
	void highYieldSubtractsExpectedDefaultLossAndSpreadReversion() {
		BondForecast forecast = model(Map.of()).computeReturn(BondPolicy.HIGH_YIELD, TBILL, INFLATION);

		assertThat(forecast.creditLoss()).isCloseTo(0.033, within(EPS));
		assertThat(forecast.spreadValuation()).isCloseTo(-0.00258, within(EPS));
		assertThat(forecast.expectedReturnNominal()).isCloseTo(0.015419999999999996, within(EPS));
		assertThat(forecast.components()).containsKey("credit_spread");
		assertThat(forecast.components().get("credit").get("credit_loss").source()).isEqualTo(InputSource.COMPUTED);
	}

	@Test
	void creditLossFollowsDefaultAndRecoveryOverrides() {
		BondForecast forecast = model(Map.of("bonds_hy", Map.of("default_rate", 0.08, "recovery_rate", 0.4)))
				.computeReturn(BondPolicy.HIGH_YIELD, TBILL, INFLATION);

		assertThat(forecast.creditLoss()).isCloseTo(0.048, within(EPS));
		assertThat(forecast.components().get("credit").get("default_rate").source()).isEqualTo(InputSource.OVERRIDE);
	}

	@Test
	void yieldOverrideShiftsTermPremium() {
		BondForecast forecast = model(Map.of("bonds_global", Map.of("current_yield", 0.045)))
				.computeReturn(BondPolicy.GOVERNMENT, TBILL, INFLATION);

		var tp = forecast.components().get("yield").get("current_term_premium");
		assertThat(tp.value()).isCloseTo(0.02, within(EPS));
		assertThat(tp.source()).isEqualTo(InputSource.COMPUTED);
		assertThat(forecast.valuationReturn()).isPositive();
	}

	@Test
	void hardCurrencyEmBondsUseUsTbillPlusSpread() {
		BondForecast forecast = model(Map.of()).computeEmReturn(EmBondMode.HARD_CURRENCY, TBILL, null, INFLATION);

		assertThat(forecast.yieldComponent()).isCloseTo(0.0695, within(EPS));
		assertThat(forecast.creditLoss()).isCloseTo(0.0126, within(EPS));
		assertThat(forecast.expectedReturnNominal()).isCloseTo(0.062471111658205, within(EPS));
	}

	@Test
	void localCurrencyEmBondsAddInflationPremium() {
		BondForecast forecast = model(Map.of()).computeEmReturn(EmBondMode.LOCAL_CURRENCY, TBILL, 0.05, INFLATION);

		assertThat(forecast.inflation()).isCloseTo(0.035, within(EPS));
		assertThat(forecast.expectedReturnReal()).isCloseTo(forecast.expectedReturnNominal() - 0.035, within(EPS));
	}
}
