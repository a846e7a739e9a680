package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.TrackedValue;

import java.util.Map;

/**
 * Result of either equity methodology. The engine flattens it into the common asset result.
 */
public interface EquityForecast {
	AssetClass assetClass();

	double expectedReturnNominal();

	double expectedReturnReal();

	double inflation();

	/**
	 * Headline building blocks of the return, in display order.
	 */
	Map<String, Double> returnComponents();

	Map<String, Map<String, TrackedValue>> components();
}
