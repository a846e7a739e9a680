package my.cmestress.app.engine;

import my.cmestress.app.model.TrackedValue;

import java.util.Map;

/**
 * @param valuationReturn term premium valuation plus any credit spread valuation
 */
public record BondForecast(
		double expectedReturnNominal,
		double expectedReturnReal,
		double yieldComponent,
		double rollReturn,
		double valuationReturn,
		double spreadValuation,
		double creditLoss,
		double inflation,
		Map<String, Map<String, TrackedValue>> components
) {
}
