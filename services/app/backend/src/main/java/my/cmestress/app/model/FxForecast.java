package my.cmestress.app.model;

/**
 * Expected annual change of the foreign currency against the home currency. Positive means the home
 * currency depreciates, which adds to foreign asset returns measured at home.
 */
public record FxForecast(
		Region homeRegion,
		Region foreignRegion,
		double fxChange,
		double carryComponent,
		double pppComponent,
		double homeTbill,
		double foreignTbill,
		double homeInflation,
		double foreignInflation
) {
	public FxSummary toSummary() {
		return new FxSummary(fxChange, carryComponent, pppComponent);
	}
}
