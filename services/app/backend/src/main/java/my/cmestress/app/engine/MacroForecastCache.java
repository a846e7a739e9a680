package my.cmestress.app.engine;

import my.cmestress.app.model.MacroForecast;
import my.cmestress.app.model.MacroForecastSet;
import my.cmestress.app.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Macro forecasts for all regions, computed on first use. Must be invalidated whenever the overrides behind
 * the model change. Not thread-safe; one engine instance serves one scenario.
 */
public class MacroForecastCache {
	private static final Logger logger = LoggerFactory.getLogger(MacroForecastCache.class);

	private final MacroModel macroModel;
	private MacroForecastSet cached;

	public MacroForecastCache(MacroModel macroModel) {
		this.macroModel = macroModel;
	}

	public MacroForecastSet get() {
		if (cached == null) {
			Map<Region, MacroForecast> regions = macroModel.computeAllRegions();
			cached = new MacroForecastSet(regions, macroModel.computeGlobalRgdpGrowth(regions));
			logger.debug("Macro forecasts computed for {} regions", regions.size());
		}
		return cached;
	}

	public boolean isPopulated() {
		return cached != null;
	}

	public void invalidate() {
		if (cached != null) {
			logger.debug("Macro forecast cache invalidated");
		}
		cached = null;
	}
}
