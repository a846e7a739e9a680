package my.cmestress.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Currencies results can be expressed in.
 */
public enum BaseCurrency {
	USD(Currency.USD),
	EUR(Currency.EUR);

	private final Currency currency;

	BaseCurrency(Currency currency) {
		this.currency = currency;
	}

	public Currency getCurrency() {
		return currency;
	}

	public Region getRegion() {
		return currency.getRegion();
	}

	@JsonValue
	public String getKey() {
		return currency.getKey();
	}

	public static BaseCurrency fromKey(String key) {
		if (key != null) {
			String normalized = key.trim().toLowerCase(Locale.ROOT);
			for (BaseCurrency base : values()) {
				if (base.getKey().equals(normalized)) {
					return base;
				}
			}
		}
		throw new UnknownIdentifierException("base currency", key);
	}
}
