package my.cmestress.app.engine;

import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.BaseCurrency;
import my.cmestress.app.model.Currency;
import my.cmestress.app.model.FxForecast;
import my.cmestress.app.model.MacroForecast;
import my.cmestress.app.model.MacroForecastSet;
import my.cmestress.app.model.Region;

import java.util.Optional;

/**
 * Blends the T-Bill (carry) and inflation (PPP) differentials into an expected annual currency move.
 */
public class FxModel {
	private final ModelParameters parameters;

	public FxModel(ModelParameters parameters) {
		this.parameters = parameters;
	}

	public FxForecast forecastFxChange(Region home, Region foreign, MacroForecastSet macro) {
		MacroForecast homeMacro = macro.forRegion(home);
		MacroForecast foreignMacro = macro.forRegion(foreign);
		double homeTbill = homeMacro.tbillRate().value();
		double foreignTbill = foreignMacro.tbillRate().value();
		double homeInflation = homeMacro.inflation().value();
		double foreignInflation = foreignMacro.inflation().value();
		double carry = homeTbill - foreignTbill;
		double ppp = homeInflation - foreignInflation;
		double fxChange = parameters.fxCarryWeight() * carry + parameters.fxPppWeight() * ppp;
		return new FxForecast(home, foreign, fxChange, carry, ppp, homeTbill, foreignTbill, homeInflation, foreignInflation);
	}

	public Optional<FxForecast> forecastForCurrencies(Currency home, Currency foreign, MacroForecastSet macro) {
		if (home == foreign) {
			return Optional.empty();
		}
		return Optional.of(forecastFxChange(home.getRegion(), foreign.getRegion(), macro));
	}

	/**
	 * Currency step for an asset held by a {@code baseCurrency} investor; empty when none is needed.
	 */
	public Optional<FxForecast> adjustmentFor(AssetClass assetClass, BaseCurrency baseCurrency, MacroForecastSet macro) {
		if (assetClass.isBasePegged()) {
			return Optional.empty();
		}
		return forecastForCurrencies(baseCurrency.getCurrency(), assetClass.localCurrency(baseCurrency), macro);
	}
}
