package my.cmestress.app.model;

/**
 * A number together with where it came from.
 */
public record TrackedValue(double value, InputSource source) {
	public static TrackedValue ofDefault(double value) {
		return new TrackedValue(value, InputSource.DEFAULT);
	}

	public static TrackedValue ofOverride(double value) {
		return new TrackedValue(value, InputSource.OVERRIDE);
	}

	public static TrackedValue computed(double value) {
		return new TrackedValue(value, InputSource.COMPUTED);
	}

	public boolean isOverride() {
		return source == InputSource.OVERRIDE;
	}

	public SourcedValue flatten() {
		return new SourcedValue(value, source);
	}
}
