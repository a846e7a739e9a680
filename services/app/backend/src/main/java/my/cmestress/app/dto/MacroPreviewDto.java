package my.cmestress.app.dto;

import my.cmestress.app.model.MacroSummary;
import my.cmestress.app.model.SourcedValue;

import java.util.List;
import java.util.Map;

public record MacroPreviewDto(
		String region,
		MacroSummary forecast,
		Map<String, Map<String, SourcedValue>> components,
		List<String> unusedInputs
) {
}
