package my.cmestress.app.dto;

public record ScenarioComparisonRowDto(
		String assetClass,
		String displayName,
		double baseNominal,
		double stressNominal,
		double nominalChange,
		double baseReal,
		double stressReal,
		double realChange
) {
}
