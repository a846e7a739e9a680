package my.cmestress.app.model;

public class UnknownIdentifierException extends IllegalArgumentException {
	public UnknownIdentifierException(String kind, String identifier) {
		super("Unknown " + kind + ": " + identifier);
	}
}
