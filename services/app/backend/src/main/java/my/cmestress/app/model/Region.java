package my.cmestress.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Region {
	US("us", true),
	EUROZONE("eurozone", true),
	JAPAN("japan", true),
	EM("em", false);

	private final String key;
	private final boolean developed;

	Region(String key, boolean developed) {
		this.key = key;
		this.developed = developed;
	}

	@JsonValue
	public String getKey() {
		return key;
	}

	public boolean isDeveloped() {
		return developed;
	}

	public static Region fromKey(String key) {
		if (key != null) {
			String normalized = key.trim().toLowerCase(Locale.ROOT);
			for (Region region : values()) {
				if (region.key.equals(normalized)) {
					return region;
				}
			}
		}
		throw new UnknownIdentifierException("region", key);
	}
}
