package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.Region;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Methodology constants. Unlike market defaults these are not overridable per scenario.
 */
public record ModelParameters(
		int forecastHorizonYears,
		double inflationCurrentWeight,
		double tbillCurrentWeight,
		double tbillRateFloor,
		double termPremiumReversionSpeed,
		double monthlyConvergenceSpeed,
		double assumedMaturityYears,
		double hySpreadReversionFraction,
		double emHardCurrencySpread,
		double caeyFullReversionYears,
		double countryEpsWeight,
		double regionalEpsWeight,
		double myRatioMidpoint,
		double myRatioSteepness,
		double historicalDiscount,
		Map<String, Double> historicalFactorPremia,
		double historicalTradingAlpha,
		double fxCarryWeight,
		double fxPppWeight,
		Map<Region, Double> globalGdpWeights,
		Map<AssetClass, Double> expectedVolatility
) {
	public static final int DEFAULT_HORIZON_YEARS = 10;
	// Lower bound of the term premium reversion band; its magnitude is the yearly speed.
	private static final double TERM_PREMIUM_BOUND_LOW = -1.0;
	/** EM hard-currency bonds are priced off the US T-Bill plus this spread when no EM T-Bill is known. */
	public static final double EM_HARD_CURRENCY_SPREAD = 0.02;

	public ModelParameters {
		historicalFactorPremia = Collections.unmodifiableMap(new LinkedHashMap<>(historicalFactorPremia));
		globalGdpWeights = Collections.unmodifiableMap(new EnumMap<>(globalGdpWeights));
		expectedVolatility = Collections.unmodifiableMap(new EnumMap<>(expectedVolatility));
	}

	public static ModelParameters defaults() {
		Map<String, Double> premia = new LinkedHashMap<>();
		premia.put("market", 0.05);
		premia.put("size", 0.02);
		premia.put("value", 0.03);
		premia.put("profitability", 0.025);
		premia.put("investment", 0.025);
		premia.put("momentum", 0.06);

		Map<Region, Double> gdpWeights = new EnumMap<>(Region.class);
		gdpWeights.put(Region.US, 0.26);
		gdpWeights.put(Region.EUROZONE, 0.15);
		gdpWeights.put(Region.JAPAN, 0.05);
		gdpWeights.put(Region.EM, 0.40);

		Map<AssetClass, Double> volatility = new EnumMap<>(AssetClass.class);
		volatility.put(AssetClass.LIQUIDITY, 0.01);
		volatility.put(AssetClass.BONDS_GLOBAL, 0.06);
		volatility.put(AssetClass.BONDS_HY, 0.10);
		volatility.put(AssetClass.BONDS_EM, 0.12);
		volatility.put(AssetClass.EQUITY_US, 0.16);
		volatility.put(AssetClass.EQUITY_EUROPE, 0.18);
		volatility.put(AssetClass.EQUITY_JAPAN, 0.18);
		volatility.put(AssetClass.EQUITY_EM, 0.24);
		volatility.put(AssetClass.ABSOLUTE_RETURN, 0.08);

		return new ModelParameters(
				DEFAULT_HORIZON_YEARS,
				0.30,
				0.30,
				-0.0075,
				Math.abs(TERM_PREMIUM_BOUND_LOW),
				0.03,
				10.0,
				0.5,
				EM_HARD_CURRENCY_SPREAD,
				20.0,
				0.5,
				0.5,
				2.0,
				2.0,
				0.5,
				premia,
				0.02,
				0.30,
				0.70,
				gdpWeights,
				volatility
		);
	}

	public double inflationLongTermWeight() {
		return 1.0 - inflationCurrentWeight;
	}

	public double tbillLongTermWeight() {
		return 1.0 - tbillCurrentWeight;
	}

	/**
	 * Share of a valuation gap expected to close over the horizon under monthly convergence.
	 */
	public double horizonReversionFraction() {
		return Math.min(1.0, 1.0 - Math.pow(1.0 - monthlyConvergenceSpeed, forecastHorizonYears * 12.0));
	}

	public double expectedVolatility(AssetClass assetClass) {
		return expectedVolatility.getOrDefault(assetClass, 0.0);
	}
}
