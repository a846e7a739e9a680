package my.cmestress.app.engine;

import my.cmestress.app.model.TrackedValue;

import java.util.Map;

public record HedgeFundForecast(
		double expectedReturnNominal,
		double expectedReturnReal,
		double tbillComponent,
		double factorReturn,
		double tradingAlpha,
		double inflation,
		Map<String, Double> factorContributions,
		Map<String, Map<String, TrackedValue>> components
) {
}
