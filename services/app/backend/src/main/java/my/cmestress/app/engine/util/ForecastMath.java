package my.cmestress.app.engine.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Averaging and trend helpers shared by the return models. Series are ordered oldest first.
 */
public final class ForecastMath {
	public static final double DEFAULT_MY_MIDPOINT = 2.0;
	public static final double DEFAULT_MY_STEEPNESS = 2.0;
	private static final double DEMOGRAPHIC_BAND = 0.02;

	public enum Frequency {
		MONTHLY(12),
		QUARTERLY(4),
		ANNUAL(1);

		private final int periodsPerYear;

		Frequency(int periodsPerYear) {
			this.periodsPerYear = periodsPerYear;
		}

		public int getPeriodsPerYear() {
			return periodsPerYear;
		}
	}

	private ForecastMath() {
	}

	public static double ewma(List<Double> data, double halfLifeYears, Integer windowYears, Frequency frequency) {
		if (halfLifeYears <= 0) {
			throw new IllegalArgumentException("Half-life must be positive");
		}
		List<Double> window = tail(data, windowYears, frequency);
		if (window.isEmpty()) {
			throw new IllegalArgumentException("No data provided for EWMA calculation");
		}
		double lambda = Math.pow(0.5, 1.0 / (halfLifeYears * frequency.getPeriodsPerYear()));
		int n = window.size();
		double weighted = 0.0;
		double totalWeight = 0.0;
		for (int i = 0; i < n; i++) {
			double weight = Math.pow(lambda, n - 1 - i);
			weighted += weight * window.get(i);
			totalWeight += weight;
		}
		return weighted / totalWeight;
	}

	public static double ewma(List<Double> data, double halfLifeYears) {
		return ewma(data, halfLifeYears, null, Frequency.MONTHLY);
	}

	/**
	 * Rolling EWMA, one value per point using the data available up to that point.
	 */
	public static List<Double> ewmaSeries(List<Double> data, double halfLifeYears, Integer windowYears, Frequency frequency) {
		List<Double> result = new ArrayList<>(data.size());
		for (int i = 1; i <= data.size(); i++) {
			result.add(ewma(data.subList(0, i), halfLifeYears, windowYears, frequency));
		}
		return result;
	}

	/**
	 * Annualized log-linear trend growth. Non-positive levels are skipped.
	 */
	public static double trendGrowth(List<Double> levels, int windowYears, Frequency frequency) {
		List<Double> window = tail(levels, windowYears, frequency);
		if (window.size() < 2) {
			throw new IllegalArgumentException("Need at least 2 data points for trend calculation");
		}
		List<Double> logs = new ArrayList<>();
		for (Double level : window) {
			if (level != null && level > 0) {
				logs.add(Math.log(level));
			}
		}
		if (logs.size() < 2) {
			throw new IllegalArgumentException("Insufficient positive values for trend calculation");
		}
		int n = logs.size();
		double xMean = (n - 1) / 2.0;
		double yMean = logs.stream().mapToDouble(Double::doubleValue).sum() / n;
		double numerator = 0.0;
		double denominator = 0.0;
		for (int i = 0; i < n; i++) {
			double dx = i - xMean;
			numerator += dx * (logs.get(i) - yMean);
			denominator += dx * dx;
		}
		if (denominator == 0.0) {
			return 0.0;
		}
		return numerator / denominator * frequency.getPeriodsPerYear();
	}

	public static double sigmoidMyRatio(double myRatio) {
		return sigmoidMyRatio(myRatio, DEFAULT_MY_MIDPOINT, DEFAULT_MY_STEEPNESS);
	}

	/**
	 * Demographic growth effect of the middle-to-young ratio, within +/- 1%. Zero at the midpoint,
	 * negative for ageing populations.
	 */
	public static double sigmoidMyRatio(double myRatio, double midpoint, double steepness) {
		double z = steepness * (midpoint - myRatio);
		double sigmoid = 1.0 / (1.0 + Math.exp(-z));
		return (sigmoid - 0.5) * DEMOGRAPHIC_BAND;
	}

	/**
	 * Mean of a yearly path that starts at {@code current} and closes {@code speed} of the gap to
	 * {@code fair} each year.
	 */
	public static double averageMeanReverting(double current, double fair, double speed, int years) {
		if (years <= 0) {
			throw new IllegalArgumentException("Years must be positive");
		}
		double total = 0.0;
		double value = current;
		for (int year = 0; year < years; year++) {
			total += value;
			value += speed * (fair - value);
		}
		return total / years;
	}

	private static List<Double> tail(List<Double> data, Integer windowYears, Frequency frequency) {
		if (data == null) {
			return List.of();
		}
		if (windowYears == null) {
			return data;
		}
		int periods = windowYears * frequency.getPeriodsPerYear();
		return data.size() > periods ? data.subList(data.size() - periods, data.size()) : data;
	}
}
