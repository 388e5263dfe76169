package org.stbridge.converter.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stbridge.converter.config.models.AttributeConfigFile;
import org.stbridge.converter.config.models.ElementRenameFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Loads the bundled conversion tables from the classpath. Every table is checked against
 * {@code stb/stb-config-schema.json} before it is bound.
 */
public class ConverterConfigHelper {

    public static final String ELEMENT_RENAMES_RESOURCE = "stb/element-renames.json";
    public static final String ATTRIBUTE_CONFIG_RESOURCE = "stb/attribute-config.json";
    public static final String SCHEMA_RESOURCE = "stb/stb-config-schema.json";

    private static final Logger log = LoggerFactory.getLogger(ConverterConfigHelper.class);
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final JsonSchemaFactory factory =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private ConverterConfigHelper() {
    }

    public static ElementRenameFile loadElementRenames() {
        return load(ELEMENT_RENAMES_RESOURCE, ElementRenameFile.class);
    }

    public static AttributeConfigFile loadAttributeConfig() {
        return load(ATTRIBUTE_CONFIG_RESOURCE, AttributeConfigFile.class);
    }

    /**
     * Reads a classpath JSON resource, validates it and binds it to the given type.
     *
     * @param resourcePath classpath location of the table
     * @param type         model class to bind to
     * @return the bound table
     * @throws IllegalArgumentException if the resource is missing or does not match the schema
     * @throws RuntimeException         if the resource cannot be read
     */
    public static <T> T load(String resourcePath, Class<T> type) {
        JsonNode jsonNode = readResource(resourcePath);
        Set<ValidationMessage> result = validate(jsonNode);
        if (!result.isEmpty()) {
            result.forEach(e -> log.error("{}: {}", resourcePath, e.getMessage()));
            throw new IllegalArgumentException("Conversion table is invalid: " + resourcePath);
        }
        try {
            T table = mapper.treeToValue(jsonNode, type);
            log.debug("Loaded conversion table {}", resourcePath);
            return table;
        } catch (IOException e) {
            throw new RuntimeException("Failed to bind conversion table: " + resourcePath, e);
        }
    }

    /**
     * Validates a table against the bundled schema.
     *
     * @param jsonNode parsed table
     * @return the validation messages, empty when the table is valid
     */
    public static Set<ValidationMessage> validate(JsonNode jsonNode) {
        JsonSchema schema = factory.getSchema(readResource(SCHEMA_RESOURCE));
        return schema.validate(jsonNode);
    }

    private static JsonNode readResource(String resourcePath) {
        ClassLoader cl = ConverterConfigHelper.class.getClassLoader();
        try (InputStream stream = cl.getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return mapper.readTree(stream);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load resource: " + resourcePath, e);
        }
    }
}
