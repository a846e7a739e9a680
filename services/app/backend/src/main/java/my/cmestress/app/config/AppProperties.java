package my.cmestress.app.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Engine engine,
		Defaults defaults,
		Cli cli
) {
	public record Engine(
			@NotBlank String baseCurrency,
			@NotBlank String equityModel,
			String scenarioName
	) {
	}

	public record Defaults(
			String resource,
			String stressScenariosResource
	) {
	}

	public record Cli(
			boolean enabled
	) {
	}
}
