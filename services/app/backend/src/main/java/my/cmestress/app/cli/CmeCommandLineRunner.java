package my.cmestress.app.cli;

import my.cmestress.app.config.AppProperties;
import my.cmestress.app.dto.ScenarioRequest;
import my.cmestress.app.dto.StressScenarioDto;
import my.cmestress.app.dto.StressTestResultDto;
import my.cmestress.app.engine.CmeEngine;
import my.cmestress.app.model.AssetClassResult;
import my.cmestress.app.model.ScenarioResult;
import my.cmestress.app.service.ScenarioExportService;
import my.cmestress.app.service.ScenarioReportFormatter;
import my.cmestress.app.service.ScenarioService;
import my.cmestress.app.service.StressScenarioService;
import my.cmestress.app.util.OverrideAssignments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line front end, active with {@code app.cli.enabled=true}.
 *
 * <pre>
 * --scenario=&lt;key&gt;            preset stress scenario
 * --override=&lt;path&gt;=&lt;value&gt;   repeatable, e.g. macro.us.inflation_forecast=0.04
 * --name=&lt;name&gt;                scenario name
 * --base-currency=usd|eur
 * --equity-model=ra|gk
 * --compare                    base case against the stressed scenario
 * --format=table|json|csv
 * --show-sources               input provenance per asset class (table format)
 * --list-scenarios
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true")
public class CmeCommandLineRunner implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(CmeCommandLineRunner.class);
	static final String CUSTOM_SCENARIO_NAME = "Custom";

	private final ScenarioService scenarioService;
	private final StressScenarioService stressScenarioService;
	private final ScenarioReportFormatter reportFormatter;
	private final ScenarioExportService exportService;
	private final AppProperties properties;

	public CmeCommandLineRunner(ScenarioService scenarioService,
								StressScenarioService stressScenarioService,
								ScenarioReportFormatter reportFormatter,
								ScenarioExportService exportService,
								AppProperties properties) {
		this.scenarioService = scenarioService;
		this.stressScenarioService = stressScenarioService;
		this.reportFormatter = reportFormatter;
		this.exportService = exportService;
		this.properties = properties;
	}

	@Override
	public void run(ApplicationArguments args) {
		run(args, System.out);
	}

	void run(ApplicationArguments args, PrintStream out) {
		if (args.containsOption("list-scenarios")) {
			for (StressScenarioDto scenario : stressScenarioService.listScenarios()) {
				out.println(scenario.key() + ": " + scenario.description());
			}
			return;
		}
		OutputFormat format = OutputFormat.fromOption(single(args, "format"));
		String baseCurrency = single(args, "base-currency");
		String equityModel = single(args, "equity-model");

		Map<String, Object> overrides = new LinkedHashMap<>();
		String scenarioKey = single(args, "scenario");
		StressScenarioDto preset = null;
		if (scenarioKey != null) {
			preset = stressScenarioService.getScenario(scenarioKey);
			OverrideAssignments.merge(overrides, preset.overrides());
		}
		List<String> assignments = args.getOptionValues("override");
		OverrideAssignments.merge(overrides, OverrideAssignments.parseAll(assignments));
		String name = scenarioName(single(args, "name"), preset, !overrides.isEmpty());
		logger.info("Running '{}' from the command line ({} format)", name, format.name().toLowerCase(Locale.ROOT));

		if (args.containsOption("compare")) {
			ScenarioResult base = scenarioService.computeScenario(
					new ScenarioRequest(CmeEngine.DEFAULT_SCENARIO_NAME, Map.of(), baseCurrency, equityModel));
			ScenarioResult stress = scenarioService.computeScenario(
					new ScenarioRequest(name, overrides, baseCurrency, equityModel));
			StressTestResultDto comparison = new StressTestResultDto(
					preset == null ? CUSTOM_SCENARIO_NAME.toLowerCase(Locale.ROOT) : preset.key(),
					preset == null ? "" : preset.description(),
					base, stress, scenarioService.compare(base, stress));
			switch (format) {
				case JSON -> out.println(exportService.toJson(comparison));
				case CSV -> out.print(exportService.toCsv(List.of(base, stress)));
				case TABLE -> out.print(reportFormatter.formatStressTest(comparison));
			}
			return;
		}

		ScenarioResult result = scenarioService.computeScenario(
				new ScenarioRequest(name, overrides, baseCurrency, equityModel));
		switch (format) {
			case JSON -> out.println(exportService.toJson(result));
			case CSV -> out.print(exportService.toCsv(result));
			case TABLE -> {
				out.print(reportFormatter.formatScenario(result));
				if (args.containsOption("show-sources")) {
					for (AssetClassResult asset : result.results().values()) {
						out.println();
						out.print(reportFormatter.formatInputSources(asset));
					}
				}
				out.println();
				out.print(reportFormatter.formatSummary(result));
			}
		}
	}

	private String scenarioName(String explicitName, StressScenarioDto preset, boolean hasOverrides) {
		if (explicitName != null && !explicitName.isBlank()) {
			return explicitName;
		}
		if (preset != null) {
			return preset.name();
		}
		if (hasOverrides) {
			return CUSTOM_SCENARIO_NAME;
		}
		if (properties != null && properties.engine() != null && properties.engine().scenarioName() != null) {
			return properties.engine().scenarioName();
		}
		return CmeEngine.DEFAULT_SCENARIO_NAME;
	}

	private static String single(ApplicationArguments args, String option) {
		List<String> values = args.getOptionValues(option);
		if (values == null || values.isEmpty()) {
			return null;
		}
		return values.get(values.size() - 1);
	}

	enum OutputFormat {
		TABLE, JSON, CSV;

		static OutputFormat fromOption(String value) {
			if (value == null || value.isBlank()) {
				return TABLE;
			}
			for (OutputFormat format : values()) {
				if (format.name().equalsIgnoreCase(value.trim())) {
					return format;
				}
			}
			throw new IllegalArgumentException("Unknown output format: " + value + " (expected table, json or csv)");
		}
	}
}
