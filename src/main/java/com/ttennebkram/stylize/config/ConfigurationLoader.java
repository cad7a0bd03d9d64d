package com.ttennebkram.stylize.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.ttennebkram.stylize.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes configuration documents as JSON.
 *
 * The document is parsed into a {@link ConfigSection} tree and validated by
 * {@link Configuration#fromSection(ConfigSection)}; the pipeline never sees
 * the raw document.
 */
public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Load a configuration document.
     *
     * @param path document path, or null for built-in defaults
     * @return validated configuration
     * @throws ConfigurationException if the document is malformed or holds invalid values
     */
    public static Configuration load(Path path) {
        if (path == null) {
            return Configuration.defaults();
        }
        if (!Files.exists(path)) {
            log.warn("Configuration file {} not found, using built-in defaults", path);
            return Configuration.defaults();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load a configuration and apply a preset when one is named.
     */
    public static Configuration load(Path path, String presetName) {
        Configuration config = load(path);
        if (presetName == null || presetName.isBlank()) {
            return config;
        }
        return config.withPreset(presetName);
    }

    public static Configuration parse(String json) {
        return parse(new StringReader(json), "<string>");
    }

    private static Configuration parse(Reader reader, String origin) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Malformed configuration " + origin + ": " + e.getMessage(), e);
        }
        if (root == null || root.isJsonNull()) {
            return Configuration.defaults();
        }
        if (!root.isJsonObject()) {
            throw new ConfigurationException("Configuration " + origin + " must be a JSON object");
        }
        ConfigSection section = toSection(root.getAsJsonObject());
        Configuration config = Configuration.fromSection(section);
        log.debug("Loaded configuration from {}: {}", origin, config);
        return config;
    }

    /**
     * Write a configuration document. Used to hand a configuration to child processes.
     */
    public static void save(Configuration config, Path path) throws IOException {
        JsonObject root = toJson(config.toSection());
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(root, writer);
        }
    }

    // JSON <-> section conversion

    static ConfigSection toSection(JsonObject json) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            map.put(entry.getKey(), toValue(entry.getValue()));
        }
        return ConfigSection.of(map);
    }

    private static Object toValue(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonObject()) {
            return toSection(element.getAsJsonObject());
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement item : element.getAsJsonArray()) {
                list.add(toValue(item));
            }
            return list;
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsNumber();
        }
        return primitive.getAsString();
    }

    static JsonObject toJson(ConfigSection section) {
        JsonObject json = new JsonObject();
        for (String key : section.keys()) {
            json.add(key, toJsonValue(section.get(key)));
        }
        return json;
    }

    private static JsonElement toJsonValue(Object value) {
        if (value instanceof ConfigSection) {
            return toJson((ConfigSection) value);
        }
        if (value instanceof List) {
            JsonArray array = new JsonArray();
            for (Object item : (List<?>) value) {
                array.add(toJsonValue(item));
            }
            return array;
        }
        if (value instanceof Number) {
            return new JsonPrimitive((Number) value);
        }
        if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        return new JsonPrimitive(value.toString());
    }
}
