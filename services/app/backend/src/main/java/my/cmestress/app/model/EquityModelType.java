package my.cmestress.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EquityModelType {
	RA("ra"),
	GK("gk");

	private final String key;

	EquityModelType(String key) {
		this.key = key;
	}

	@JsonValue
	public String getKey() {
		return key;
	}

	public static EquityModelType fromKey(String key) {
		if (key != null) {
			String normalized = key.trim().toLowerCase(Locale.ROOT);
			for (EquityModelType type : values()) {
				if (type.key.equals(normalized)) {
					return type;
				}
			}
		}
		throw new UnknownIdentifierException("equity model", key);
	}
}
