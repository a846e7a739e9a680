package my.cmestress.app.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import my.cmestress.app.config.AppProperties;
import my.cmestress.app.dto.StressScenarioDto;
import my.cmestress.app.model.UnknownIdentifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Predefined stress scenarios, each a named override structure.
 */
@Service
public class StressScenarioService {
	private static final Logger logger = LoggerFactory.getLogger(StressScenarioService.class);
	static final String DEFAULT_RESOURCE = "classpath:stress_scenarios.json";

	private final ResourceLoader resourceLoader;
	private final AppProperties properties;
	private final ObjectMapper jsonMapper;
	private volatile Map<String, StressScenarioDto> scenarios;

	public StressScenarioService(ResourceLoader resourceLoader, AppProperties properties) {
		this.resourceLoader = resourceLoader;
		this.properties = properties;
		this.jsonMapper = JsonMapper.builder().build();
	}

	public List<StressScenarioDto> listScenarios() {
		return List.copyOf(scenarios().values());
	}

	public StressScenarioDto getScenario(String key) {
		String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
		StressScenarioDto scenario = scenarios().get(normalized);
		if (scenario == null) {
			throw new UnknownIdentifierException("stress scenario", key);
		}
		return scenario;
	}

	private Map<String, StressScenarioDto> scenarios() {
		Map<String, StressScenarioDto> current = scenarios;
		if (current == null) {
			synchronized (this) {
				if (scenarios == null) {
					scenarios = loadScenarios();
				}
				current = scenarios;
			}
		}
		return current;
	}

	Map<String, StressScenarioDto> loadScenarios() {
		String location = resourceLocation();
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.warn("Stress scenario resource {} not found", location);
			return Map.of();
		}
		try (InputStream inputStream = resource.getInputStream()) {
			JsonNode root = jsonMapper.readTree(inputStream);
			Map<String, StressScenarioDto> loaded = new LinkedHashMap<>();
			if (root != null && root.isObject()) {
				root.properties().forEach(entry -> {
					Definition definition = jsonMapper.treeToValue(entry.getValue(), Definition.class);
					String key = entry.getKey().toLowerCase(Locale.ROOT);
					loaded.put(key, new StressScenarioDto(key,
							definition.name() == null ? key : definition.name(),
							definition.description() == null ? "" : definition.description(),
							definition.overrides() == null ? Map.of() : definition.overrides()));
				});
			}
			logger.info("Loaded {} stress scenarios from {}", loaded.size(), location);
			return Collections.unmodifiableMap(loaded);
		} catch (IOException | JacksonException ex) {
			logger.warn("Failed to read stress scenarios from {}", location, ex);
			return Map.of();
		}
	}

	private String resourceLocation() {
		if (properties == null || properties.defaults() == null || properties.defaults().stressScenariosResource() == null
				|| properties.defaults().stressScenariosResource().isBlank()) {
			return DEFAULT_RESOURCE;
		}
		return properties.defaults().stressScenariosResource();
	}

	record Definition(
			@JsonProperty("name") String name,
			@JsonProperty("description") String description,
			@JsonProperty("overrides") Map<String, Object> overrides
	) {
	}
}
