package my.cmestress.app.dto;

import my.cmestress.app.model.ScenarioResult;

import java.util.List;

public record StressTestResultDto(
		String scenarioKey,
		String description,
		ScenarioResult baseCase,
		ScenarioResult stressCase,
		List<ScenarioComparisonRowDto> comparison
) {
}
