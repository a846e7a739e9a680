package my.cmestress.app.service;

import my.cmestress.app.config.AppProperties;
import my.cmestress.app.engine.DefaultsCatalog;
import my.cmestress.app.model.AssetClass;
import my.cmestress.app.model.Region;
import my.cmestress.app.model.UnknownIdentifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Supplies the defaults catalog. Market data refreshed outside this application is read from a JSON resource
 * and layered over the built-in values; without a readable resource the built-in values are used.
 */
@Service
public class DefaultsCatalogService {
	private static final Logger logger = LoggerFactory.getLogger(DefaultsCatalogService.class);
	static final String DEFAULT_RESOURCE = "classpath:cme_defaults.json";

	private final ResourceLoader resourceLoader;
	private final AppProperties properties;
	private final ObjectMapper jsonMapper;
	private volatile DefaultsCatalog catalog;

	public DefaultsCatalogService(ResourceLoader resourceLoader, AppProperties properties) {
		this.resourceLoader = resourceLoader;
		this.properties = properties;
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.build();
	}

	public DefaultsCatalog getCatalog() {
		DefaultsCatalog current = catalog;
		if (current == null) {
			synchronized (this) {
				if (catalog == null) {
					catalog = loadCatalog();
				}
				current = catalog;
			}
		}
		return current;
	}

	public DefaultsCatalog reload() {
		DefaultsCatalog reloaded = loadCatalog();
		catalog = reloaded;
		return reloaded;
	}

	DefaultsCatalog loadCatalog() {
		DefaultsCatalog builtIn = DefaultsCatalog.builtIn();
		String location = resourceLocation();
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.warn("Defaults resource {} not found, using built-in defaults", location);
			return builtIn;
		}
		try (InputStream inputStream = resource.getInputStream()) {
			JsonNode root = jsonMapper.readTree(inputStream);
			if (root == null || !root.isObject()) {
				logger.warn("Defaults resource {} is not a JSON object, using built-in defaults", location);
				return builtIn;
			}
			Map<Region, Map<String, Double>> macro = parseSection(root.path("macro"), Region::fromKey, Region.class);
			Map<AssetClass, Map<String, Double>> assets = parseSection(root.path("assets"), AssetClass::fromKey,
					AssetClass.class);
			Map<AssetClass, Map<String, Double>> overlay = parseSection(root.path("grinold_kroner_overlay"),
					AssetClass::fromKey, AssetClass.class);
			logger.info("Loaded market defaults from {} ({} regions, {} asset classes)", location, macro.size(), assets.size());
			return builtIn.withMarketData(macro, assets, overlay);
		} catch (IOException | JacksonException ex) {
			logger.warn("Failed to read defaults resource {}, using built-in defaults", location, ex);
			return builtIn;
		}
	}

	private <K extends Enum<K>> Map<K, Map<String, Double>> parseSection(JsonNode node, Function<String, K> keyParser,
																		 Class<K> keyType) {
		Map<K, Map<String, Double>> section = new EnumMap<>(keyType);
		if (node == null || node.isMissingNode() || !node.isObject()) {
			return section;
		}
		node.properties().forEach(entry -> {
			K key;
			try {
				key = keyParser.apply(entry.getKey());
			} catch (UnknownIdentifierException ex) {
				logger.warn("Ignoring defaults for {}: {}", entry.getKey(), ex.getMessage());
				return;
			}
			section.put(key, parseValues(entry.getValue()));
		});
		return section;
	}

	private Map<String, Double> parseValues(JsonNode node) {
		Map<String, Double> values = new LinkedHashMap<>();
		if (node == null || !node.isObject()) {
			return values;
		}
		node.properties().forEach(entry -> {
			JsonNode value = entry.getValue();
			if (value.isNumber()) {
				values.put(entry.getKey(), value.doubleValue());
			}
		});
		return values;
	}

	private String resourceLocation() {
		if (properties == null || properties.defaults() == null || properties.defaults().resource() == null
				|| properties.defaults().resource().isBlank()) {
			return DEFAULT_RESOURCE;
		}
		return properties.defaults().resource();
	}
}
