package my.cmestress.app.service;

import my.cmestress.app.dto.ScenarioComparisonRowDto;
import my.cmestress.app.dto.StressTestResultDto;
import my.cmestress.app.model.AssetClassResult;
import my.cmestress.app.model.InputSource;
import my.cmestress.app.model.MacroDependency;
import my.cmestress.app.model.ScenarioResult;
import my.cmestress.app.model.SourcedValue;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text tables for the command line.
 */
@Component
public class ScenarioReportFormatter {
	private static final String RULE = "-".repeat(72);

	public String formatScenario(ScenarioResult result) {
		StringBuilder sb = new StringBuilder();
		sb.append(String.format(Locale.ROOT, "%s (base currency %s, equity model %s)%n", result.scenarioName(),
				result.baseCurrency().getKey().toUpperCase(Locale.ROOT),
				result.equityModel().getKey().toUpperCase(Locale.ROOT)));
		sb.append(RULE).append(System.lineSeparator());
		sb.append(String.format(Locale.ROOT, "%-28s %10s %10s %10s%n", "Asset Class", "Nominal", "Real", "Vol"));
		for (AssetClassResult asset : result.results().values()) {
			sb.append(String.format(Locale.ROOT, "%-28s %10s %10s %10s%n", asset.displayName(),
					percent(asset.expectedReturnNominal()), percent(asset.expectedReturnReal()),
					percent(asset.expectedVolatility())));
		}
		sb.append(System.lineSeparator());
		sb.append(String.format(Locale.ROOT, "%-12s %10s %10s %10s %10s%n", "Region", "RGDP", "Inflation", "T-Bill",
				"Nominal GDP"));
		result.macroAssumptions().forEach((region, macro) -> sb.append(String.format(Locale.ROOT,
				"%-12s %10s %10s %10s %10s%n", region, percent(macro.rgdpGrowth()), percent(macro.inflation()),
				percent(macro.tbillRate()), percent(macro.nominalGdpGrowth()))));
		sb.append(String.format(Locale.ROOT, "Global RGDP growth (GDP-weighted): %s%n", percent(result.globalRgdpGrowth())));
		if (!result.fxForecasts().isEmpty()) {
			sb.append(System.lineSeparator());
			sb.append(String.format(Locale.ROOT, "%-12s %10s %10s %10s%n", "Currency", "FX change", "Carry", "PPP"));
			result.fxForecasts().forEach((currency, fx) -> sb.append(String.format(Locale.ROOT,
					"%-12s %10s %10s %10s%n", currency, percent(fx.fxChange()), percent(fx.carryComponent()),
					percent(fx.pppComponent()))));
		}
		if (!result.overridesApplied().isEmpty()) {
			sb.append(System.lineSeparator()).append("Overrides applied:").append(System.lineSeparator());
			result.overridesApplied().forEach((path, value) ->
					sb.append("  ").append(path).append(" = ").append(value).append(System.lineSeparator()));
		}
		return sb.toString();
	}

	/**
	 * One-paragraph summary: best and worst nominal return and the number of overrides.
	 */
	public String formatSummary(ScenarioResult result) {
		AssetClassResult best = null;
		AssetClassResult worst = null;
		for (AssetClassResult asset : result.results().values()) {
			if (best == null || asset.expectedReturnNominal() > best.expectedReturnNominal()) {
				best = asset;
			}
			if (worst == null || asset.expectedReturnNominal() < worst.expectedReturnNominal()) {
				worst = asset;
			}
		}
		StringBuilder sb = new StringBuilder();
		sb.append(result.scenarioName()).append(": ").append(result.results().size()).append(" asset classes");
		if (best != null) {
			sb.append(String.format(Locale.ROOT, ", highest %s (%s), lowest %s (%s)", best.displayName(),
					percent(best.expectedReturnNominal()), worst.displayName(), percent(worst.expectedReturnNominal())));
		}
		int overrides = result.overridesApplied().size();
		sb.append(", ").append(overrides).append(overrides == 1 ? " override" : " overrides").append(" applied");
		return sb.append(System.lineSeparator()).toString();
	}

	/**
	 * Nominal returns of several scenarios side by side, one column per scenario.
	 */
	public String formatComparison(List<ScenarioResult> results) {
		if (results == null || results.isEmpty()) {
			return "";
		}
		StringBuilder sb = new StringBuilder();
		sb.append(String.format(Locale.ROOT, "%-28s", "Asset Class"));
		for (ScenarioResult result : results) {
			sb.append(String.format(Locale.ROOT, " %18s", truncate(result.scenarioName(), 18)));
		}
		sb.append(System.lineSeparator());
		for (Map.Entry<String, AssetClassResult> entry : results.get(0).results().entrySet()) {
			sb.append(String.format(Locale.ROOT, "%-28s", entry.getValue().displayName()));
			for (ScenarioResult result : results) {
				AssetClassResult asset = result.results().get(entry.getKey());
				sb.append(String.format(Locale.ROOT, " %18s", asset == null ? "-" : percent(asset.expectedReturnNominal())));
			}
			sb.append(System.lineSeparator());
		}
		return sb.toString();
	}

	public String formatStressTest(StressTestResultDto stressTest) {
		StringBuilder sb = new StringBuilder();
		sb.append("Stress test: ").append(stressTest.stressCase().scenarioName()).append(System.lineSeparator());
		if (stressTest.description() != null && !stressTest.description().isBlank()) {
			sb.append(stressTest.description()).append(System.lineSeparator());
		}
		sb.append(RULE).append(System.lineSeparator());
		sb.append(String.format(Locale.ROOT, "%-28s %10s %10s %10s%n", "Asset Class", "Base", "Stress", "Change"));
		for (ScenarioComparisonRowDto row : stressTest.comparison()) {
			sb.append(String.format(Locale.ROOT, "%-28s %10s %10s %10s%n", row.displayName(),
					percent(row.baseNominal()), percent(row.stressNominal()), signedPercent(row.nominalChange())));
		}
		return sb.toString();
	}

	/**
	 * Every input and macro dependency of one asset class with its provenance tag.
	 */
	public String formatInputSources(AssetClassResult asset) {
		StringBuilder sb = new StringBuilder();
		sb.append(asset.displayName()).append(System.lineSeparator());
		for (Map.Entry<String, SourcedValue> entry : asset.inputsUsed().entrySet()) {
			sb.append(String.format(Locale.ROOT, "  %-32s %12.4f  [%s]%n", entry.getKey(), entry.getValue().value(),
					tag(entry.getValue().source())));
		}
		for (MacroDependency dependency : asset.macroDependencies().values()) {
			sb.append(String.format(Locale.ROOT, "  %-32s %12s  [%s] %s%n", dependency.macroInput(),
					percent(dependency.valueUsed()), tag(dependency.source()), dependency.impactDescription()));
		}
		return sb.toString();
	}

	static String percent(double value) {
		return String.format(Locale.ROOT, "%.2f%%", value * 100.0);
	}

	static String signedPercent(double value) {
		return String.format(Locale.ROOT, "%+.2f%%", value * 100.0);
	}

	private static String tag(InputSource source) {
		return source == null ? "" : source.getKey();
	}

	private static String truncate(String value, int length) {
		if (value == null) {
			return "";
		}
		return value.length() <= length ? value : value.substring(0, length);
	}
}
