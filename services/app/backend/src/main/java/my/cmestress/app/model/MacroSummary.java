package my.cmestress.app.model;

public record MacroSummary(
		double rgdpGrowth,
		double inflation,
		double tbillRate,
		double nominalGdpGrowth
) {
}
