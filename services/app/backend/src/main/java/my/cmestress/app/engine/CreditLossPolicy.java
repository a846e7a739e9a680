package my.cmestress.app.engine;

import my.cmestress.app.model.TrackedValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expected annual credit loss of a bond class, given its resolved inputs. The returned map always carries
 * {@code credit_loss}, {@code default_rate} and {@code recovery_rate}.
 */
@FunctionalInterface
public interface CreditLossPolicy {
	String CREDIT_LOSS = "credit_loss";
	String DEFAULT_RATE = "default_rate";
	String RECOVERY_RATE = "recovery_rate";

	Map<String, TrackedValue> apply(Map<String, TrackedValue> inputs);

	/** Developed sovereigns: no defaults, full recovery. */
	CreditLossPolicy NONE = inputs -> {
		Map<String, TrackedValue> result = new LinkedHashMap<>();
		result.put(CREDIT_LOSS, TrackedValue.ofDefault(0.0));
		result.put(DEFAULT_RATE, TrackedValue.ofDefault(0.0));
		result.put(RECOVERY_RATE, TrackedValue.ofDefault(1.0));
		return result;
	};

	CreditLossPolicy EXPECTED_DEFAULT_LOSS = inputs -> {
		TrackedValue defaultRate = required(inputs, DEFAULT_RATE);
		TrackedValue recoveryRate = required(inputs, RECOVERY_RATE);
		Map<String, TrackedValue> result = new LinkedHashMap<>();
		result.put(CREDIT_LOSS, TrackedValue.computed(defaultRate.value() * (1.0 - recoveryRate.value())));
		result.put(DEFAULT_RATE, defaultRate);
		result.put(RECOVERY_RATE, recoveryRate);
		return result;
	};

	private static TrackedValue required(Map<String, TrackedValue> inputs, String field) {
		TrackedValue value = inputs.get(field);
		if (value == null) {
			throw new IllegalArgumentException("Missing bond input: " + field);
		}
		return value;
	}
}
