package my.cmestress.app.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public record MacroForecastSet(Map<Region, MacroForecast> regions, TrackedValue globalRgdpGrowth) {
	public MacroForecastSet {
		regions = Collections.unmodifiableMap(new EnumMap<>(regions));
	}

	public MacroForecast forRegion(Region region) {
		MacroForecast forecast = regions.get(region);
		if (forecast == null) {
			throw new UnknownIdentifierException("region", region == null ? null : region.getKey());
		}
		return forecast;
	}
}
