package my.cmestress.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InputSource {
	DEFAULT("default"),
	OVERRIDE("override"),
	COMPUTED("computed"),
	AFFECTED_BY_OVERRIDE("affected_by_override");

	private final String key;

	InputSource(String key) {
		this.key = key;
	}

	@JsonValue
	public String getKey() {
		return key;
	}
}
