package org.processgraph.reasoning.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.processgraph.reasoning.config.models.AnalysisConfig;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads {@link AnalysisConfig} documents and validates them against
 * {@code config/analysis-config.schema.json} before mapping.
 */
@Slf4j
public class AnalysisConfigHelper {
    public static final String DEFAULT_CONFIG_RESOURCE = "config/analysis-config.json";
    private static final String SCHEMA_RESOURCE = "config/analysis-config.schema.json";

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    /**
     * Loads the configuration shipped on the classpath.
     */
    public static AnalysisConfig loadDefaults() {
        ClassLoader cl = AnalysisConfigHelper.class.getClassLoader();
        try (InputStream is = cl.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (is == null) {
                log.warn("Config resource {} not found, using built-in defaults", DEFAULT_CONFIG_RESOURCE);
                return AnalysisConfig.defaults();
            }
            return toConfig(mapper.readTree(is), DEFAULT_CONFIG_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config resource: " + DEFAULT_CONFIG_RESOURCE, e);
        }
    }

    /**
     * Loads a configuration file from disk.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if the document violates the schema
     */
    public static AnalysisConfig loadConfigFile(String configFilePath) throws IOException {
        JsonNode document = mapper.readTree(new File(configFilePath));
        return toConfig(document, configFilePath);
    }

    /**
     * Parses a configuration document given as JSON text.
     */
    public static AnalysisConfig parse(String json) throws IOException {
        return toConfig(mapper.readTree(json), "<inline>");
    }

    /**
     * Validates a configuration document against the schema.
     *
     * @return the schema violations, empty when the document is valid
     */
    public static Set<ValidationMessage> validate(JsonNode document) {
        ClassLoader cl = AnalysisConfigHelper.class.getClassLoader();
        try (InputStream schemaStream = cl.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (schemaStream == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            JsonSchema schema = factory.getSchema(mapper.readTree(schemaStream));
            return schema.validate(document);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource: " + SCHEMA_RESOURCE, e);
        }
    }

    private static AnalysisConfig toConfig(JsonNode document, String source) throws IOException {
        Set<ValidationMessage> violations = validate(document);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Analysis config " + source + " is invalid: " + details);
        }
        AnalysisConfig config = mapper.treeToValue(document, AnalysisConfig.class);
        log.debug("Loaded analysis config from {}", source);
        return config;
    }
}
