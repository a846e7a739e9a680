package my.cmestress.app.model;

public record FxSummary(double fxChange, double carryComponent, double pppComponent) {
}
