package my.cmestress.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AssetClass {
	LIQUIDITY("liquidity", "Liquidity (Cash)", Kind.LIQUIDITY, null, null),
	BONDS_GLOBAL("bonds_global", "Bonds Global (Gov)", Kind.BOND, Currency.USD, Region.US),
	BONDS_HY("bonds_hy", "Bonds High Yield", Kind.BOND, Currency.USD, Region.US),
	BONDS_EM("bonds_em", "Bonds EM (Hard Currency)", Kind.BOND, Currency.USD, Region.US),
	EQUITY_US("equity_us", "Equity US", Kind.EQUITY, Currency.USD, Region.US),
	EQUITY_EUROPE("equity_europe", "Equity Europe", Kind.EQUITY, Currency.EUR, Region.EUROZONE),
	EQUITY_JAPAN("equity_japan", "Equity Japan", Kind.EQUITY, Currency.JPY, Region.JAPAN),
	EQUITY_EM("equity_em", "Equity EM", Kind.EQUITY, Currency.EM, Region.EM),
	ABSOLUTE_RETURN("absolute_return", "Absolute Return (HF)", Kind.HEDGE_FUND, null, null);

	public enum Kind {
		LIQUIDITY,
		BOND,
		EQUITY,
		HEDGE_FUND
	}

	private final String key;
	private final String displayName;
	private final Kind kind;
	// null means the asset is held in the base currency itself
	private final Currency localCurrency;
	private final Region macroRegion;

	AssetClass(String key, String displayName, Kind kind, Currency localCurrency, Region macroRegion) {
		this.key = key;
		this.displayName = displayName;
		this.kind = kind;
		this.localCurrency = localCurrency;
		this.macroRegion = macroRegion;
	}

	@JsonValue
	public String getKey() {
		return key;
	}

	public String getDisplayName() {
		return displayName;
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isBasePegged() {
		return localCurrency == null;
	}

	public Currency localCurrency(BaseCurrency baseCurrency) {
		return localCurrency == null ? baseCurrency.getCurrency() : localCurrency;
	}

	public Region macroRegion(BaseCurrency baseCurrency) {
		return macroRegion == null ? baseCurrency.getRegion() : macroRegion;
	}

	public static AssetClass fromKey(String key) {
		if (key != null) {
			String normalized = key.trim().toLowerCase(Locale.ROOT);
			for (AssetClass assetClass : values()) {
				if (assetClass.key.equals(normalized)) {
					return assetClass;
				}
			}
		}
		throw new UnknownIdentifierException("asset class", key);
	}

	public static boolean isKnownKey(String key) {
		for (AssetClass assetClass : values()) {
			if (assetClass.key.equals(key)) {
				return true;
			}
		}
		return false;
	}
}
