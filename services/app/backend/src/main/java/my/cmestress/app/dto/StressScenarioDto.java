package my.cmestress.app.dto;

import java.util.Map;

public record StressScenarioDto(
		String key,
		String name,
		String description,
		Map<String, Object> overrides
) {
}
