package my.cmestress.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Currency {
	USD("usd", Region.US),
	EUR("eur", Region.EUROZONE),
	JPY("jpy", Region.JAPAN),
	EM("em", Region.EM);

	private final String key;
	private final Region region;

	Currency(String key, Region region) {
		this.key = key;
		this.region = region;
	}

	@JsonValue
	public String getKey() {
		return key;
	}

	public Region getRegion() {
		return region;
	}

	public static Currency fromKey(String key) {
		if (key != null) {
			String normalized = key.trim().toLowerCase(Locale.ROOT);
			for (Currency currency : values()) {
				if (currency.key.equals(normalized)) {
					return currency;
				}
			}
		}
		throw new UnknownIdentifierException("currency", key);
	}
}
