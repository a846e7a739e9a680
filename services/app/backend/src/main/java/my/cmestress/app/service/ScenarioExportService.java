package my.cmestress.app.service;

import my.cmestress.app.model.AssetClassResult;
import my.cmestress.app.model.ScenarioResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

@Service
public class ScenarioExportService {
	static final String[] CSV_HEADER = {
			"scenario", "base_currency", "equity_model", "asset_class", "display_name",
			"expected_return_nominal", "expected_return_real", "expected_volatility"
	};

	private final ObjectMapper jsonMapper;

	public ScenarioExportService() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.enable(SerializationFeature.INDENT_OUTPUT)
				.build();
	}

	/**
	 * Serializes a scenario result, a list of them or a stress test with snake_case field names.
	 */
	public String toJson(Object value) {
		return jsonMapper.writeValueAsString(value);
	}

	/**
	 * One row per scenario and asset class, returns as decimals.
	 */
	public String toCsv(List<ScenarioResult> results) {
		StringWriter out = new StringWriter();
		CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
		try (CSVPrinter printer = new CSVPrinter(out, format)) {
			for (ScenarioResult result : results) {
				for (AssetClassResult asset : result.results().values()) {
					printer.printRecord(result.scenarioName(), result.baseCurrency().getKey(),
							result.equityModel().getKey(), asset.assetClass().getKey(), asset.displayName(),
							asset.expectedReturnNominal(), asset.expectedReturnReal(), asset.expectedVolatility());
				}
			}
		} catch (IOException exc) {
			throw new IllegalStateException("Failed to write CSV: " + exc.getMessage(), exc);
		}
		return out.toString();
	}

	public String toCsv(ScenarioResult result) {
		return toCsv(List.of(result));
	}
}
