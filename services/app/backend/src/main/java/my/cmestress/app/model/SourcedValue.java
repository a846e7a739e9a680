package my.cmestress.app.model;

public record SourcedValue(double value, InputSource source) {
}
