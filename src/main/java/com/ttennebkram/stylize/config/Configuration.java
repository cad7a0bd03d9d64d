package com.ttennebkram.stylize.config;

import com.ttennebkram.stylize.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable settings for one transformation run.
 *
 * A configuration is built once, validated once, and then shared read-only by
 * the pipeline, its stages and the effect registry. Variations are derived
 * with {@link #withSeed(long)}, {@link #withPrimaryEffect(String)} and
 * {@link #withPreset(String)}, each of which returns a new instance.
 */
public final class Configuration {

    private static final Logger log = LoggerFactory.getLogger(Configuration.class);

    public static final String CURRENT_VERSION = "2";

    // Stage section names in the configuration document
    public static final String SECTION_ANALYSIS = "analysis";
    public static final String SECTION_FLOW = "flow";
    public static final String SECTION_MATERIAL = "material";
    public static final String SECTION_COMPOSITION = "composition";
    public static final String SECTION_TEMPORAL = "temporal";
    public static final String SECTION_AESTHETICS = "aesthetics";

    static final Set<String> STAGE_SECTIONS = Set.of(SECTION_ANALYSIS, SECTION_FLOW, SECTION_MATERIAL,
            SECTION_COMPOSITION, SECTION_TEMPORAL, SECTION_AESTHETICS);

    private final String version;
    private final EffectParameters effectParams;
    private final ColorScheme colorScheme;
    private final OutputFormat outputFormat;
    private final int outputQuality;
    private final String primaryEffect;
    private final String customEffectsPath;
    private final Long randomSeed;
    private final Map<String, ConfigSection> effectOverrides;
    private final Map<String, ConfigSection> stageSections;
    private final Map<String, ConfigSection> presets;

    private Configuration(Builder b) {
        this.version = b.version;
        this.effectParams = b.effectParams;
        this.colorScheme = b.colorScheme;
        this.outputFormat = b.outputFormat;
        this.outputQuality = b.outputQuality;
        this.primaryEffect = b.primaryEffect;
        this.customEffectsPath = b.customEffectsPath;
        this.randomSeed = b.randomSeed;
        this.effectOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(b.effectOverrides));
        this.stageSections = Collections.unmodifiableMap(new LinkedHashMap<>(b.stageSections));
        this.presets = Collections.unmodifiableMap(new LinkedHashMap<>(b.presets));
    }

    public static Configuration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a configuration from a parsed document root.
     */
    public static Configuration fromSection(ConfigSection root) {
        return builder().apply(root).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.version = version;
        b.effectParams = effectParams;
        b.colorScheme = colorScheme;
        b.outputFormat = outputFormat;
        b.outputQuality = outputQuality;
        b.primaryEffect = primaryEffect;
        b.customEffectsPath = customEffectsPath;
        b.randomSeed = randomSeed;
        b.effectOverrides.putAll(effectOverrides);
        b.stageSections.putAll(stageSections);
        b.presets.putAll(presets);
        return b;
    }

    // Getters

    public String getVersion() {
        return version;
    }

    public EffectParameters getEffectParams() {
        return effectParams;
    }

    public ColorScheme getColorScheme() {
        return colorScheme;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public int getOutputQuality() {
        return outputQuality;
    }

    /**
     * @return the configured primary effect name, or null for none
     */
    public String getPrimaryEffect() {
        return primaryEffect;
    }

    /**
     * @return directory scanned for plugin effect jars, or null
     */
    public String getCustomEffectsPath() {
        return customEffectsPath;
    }

    /**
     * The run seed: top-level random_seed, else effect_params.seed, else null.
     */
    public Long getRandomSeed() {
        return randomSeed != null ? randomSeed : effectParams.getSeed();
    }

    /**
     * Per-effect parameter section, EMPTY if the document has none.
     */
    public ConfigSection getEffectSection(String effectName) {
        return effectOverrides.getOrDefault(effectName, ConfigSection.EMPTY);
    }

    /**
     * Stage parameter section ("analysis", "flow", ...), EMPTY if absent.
     */
    public ConfigSection getStageSection(String name) {
        return stageSections.getOrDefault(name, ConfigSection.EMPTY);
    }

    public Set<String> getPresetNames() {
        return presets.keySet();
    }

    // Derivations

    /**
     * Copy with a different random seed. The receiver is unchanged.
     */
    public Configuration withSeed(long seed) {
        Builder b = toBuilder();
        b.randomSeed = seed;
        return b.build();
    }

    public Configuration withPrimaryEffect(String effectName) {
        Builder b = toBuilder();
        b.primaryEffect = effectName;
        return b.build();
    }

    /**
     * Copy with the named preset overlay applied.
     *
     * @throws ConfigurationException if no preset has that name
     */
    public Configuration withPreset(String presetName) {
        ConfigSection preset = presets.get(presetName);
        if (preset == null) {
            throw new ConfigurationException("Unknown preset '" + presetName + "'; available: " + presets.keySet());
        }
        return toBuilder().apply(preset).build();
    }

    /**
     * Serialize to a document root, the inverse of {@link #fromSection(ConfigSection)}.
     */
    public ConfigSection toSection() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("version", version);
        root.put("color_scheme", colorScheme.getKey());
        root.put("output_format", outputFormat.getKey());
        root.put("output_quality", outputQuality);
        if (randomSeed != null) {
            root.put("random_seed", randomSeed);
        }
        root.put("effect_params", effectParams.toSection());

        Map<String, Object> effects = new LinkedHashMap<>();
        if (primaryEffect != null) {
            effects.put("primary_effect", primaryEffect);
        }
        if (customEffectsPath != null) {
            effects.put("custom_effects_path", customEffectsPath);
        }
        effects.putAll(effectOverrides);
        root.put("effects", ConfigSection.of(effects));

        root.putAll(stageSections);
        if (!presets.isEmpty()) {
            root.put("presets", ConfigSection.of(new LinkedHashMap<>(presets)));
        }
        return ConfigSection.of(root);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration)) return false;
        return toSection().equals(((Configuration) o).toSection());
    }

    @Override
    public int hashCode() {
        return toSection().hashCode();
    }

    @Override
    public String toString() {
        return "Configuration{version=" + version + ", colorScheme=" + colorScheme.getKey()
                + ", outputFormat=" + outputFormat.getKey() + ", primaryEffect=" + primaryEffect
                + ", randomSeed=" + getRandomSeed() + "}";
    }

    /**
     * Mutable builder. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private String version = CURRENT_VERSION;
        private EffectParameters effectParams = EffectParameters.defaults();
        private ColorScheme colorScheme = ColorScheme.PHANTOM_CORE;
        private OutputFormat outputFormat = OutputFormat.PNG;
        private int outputQuality = 95;
        private String primaryEffect = null;
        private String customEffectsPath = null;
        private Long randomSeed = null;
        private final Map<String, ConfigSection> effectOverrides = new LinkedHashMap<>();
        private final Map<String, ConfigSection> stageSections = new LinkedHashMap<>();
        private final Map<String, ConfigSection> presets = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder version(String version) { this.version = version; return this; }
        public Builder effectParams(EffectParameters params) { this.effectParams = params; return this; }
        public Builder colorScheme(ColorScheme scheme) { this.colorScheme = scheme; return this; }
        public Builder outputFormat(OutputFormat format) { this.outputFormat = format; return this; }
        public Builder outputQuality(int quality) { this.outputQuality = quality; return this; }
        public Builder primaryEffect(String name) { this.primaryEffect = name; return this; }
        public Builder customEffectsPath(String path) { this.customEffectsPath = path; return this; }
        public Builder randomSeed(Long seed) { this.randomSeed = seed; return this; }

        public Builder effectSection(String effectName, ConfigSection section) {
            effectOverrides.put(effectName, section);
            return this;
        }

        public Builder stageSection(String name, ConfigSection section) {
            stageSections.put(name, section);
            return this;
        }

        public Builder preset(String name, ConfigSection overlay) {
            presets.put(name, overlay);
            return this;
        }

        /**
         * Overlay a document (or preset) section onto this builder.
         * Nested stage and effect sections merge with what is already set.
         */
        public Builder apply(ConfigSection root) {
            for (String key : root.keys()) {
                Object value = root.get(key);
                if (value == null) {
                    continue;
                }
                switch (key) {
                    case "version":
                        version = String.valueOf(value);
                        break;
                    case "color_scheme":
                        colorScheme = ColorScheme.fromKey(root.requireString(key));
                        break;
                    case "output_format":
                        outputFormat = OutputFormat.fromKey(root.requireString(key));
                        break;
                    case "output_quality":
                        outputQuality = root.requireInt(key);
                        break;
                    case "random_seed":
                        randomSeed = root.requireLong(key);
                        break;
                    case "primary_effect":
                        primaryEffect = root.requireString(key);
                        break;
                    case "effect_params":
                        effectParams = effectParams.toBuilder().apply(requireSection(root, key)).build();
                        break;
                    case "effects":
                        applyEffects(requireSection(root, key));
                        break;
                    case "presets":
                        ConfigSection presetRoot = requireSection(root, key);
                        for (String presetName : presetRoot.keys()) {
                            presets.put(presetName, requireSection(presetRoot, presetName));
                        }
                        break;
                    default:
                        if (value instanceof ConfigSection) {
                            if (!STAGE_SECTIONS.contains(key)) {
                                log.warn("Unrecognized configuration section '{}', keeping it as a stage section", key);
                            }
                            ConfigSection existing = stageSections.getOrDefault(key, ConfigSection.EMPTY);
                            stageSections.put(key, existing.merge((ConfigSection) value));
                        } else {
                            log.warn("Ignoring unrecognized configuration key '{}'", key);
                        }
                        break;
                }
            }
            return this;
        }

        private void applyEffects(ConfigSection effects) {
            for (String key : effects.keys()) {
                Object value = effects.get(key);
                if ("primary_effect".equals(key)) {
                    primaryEffect = effects.requireString(key);
                } else if ("custom_effects_path".equals(key)) {
                    customEffectsPath = effects.requireString(key);
                } else if (value instanceof ConfigSection) {
                    ConfigSection existing = effectOverrides.getOrDefault(key, ConfigSection.EMPTY);
                    effectOverrides.put(key, existing.merge((ConfigSection) value));
                } else if (value != null) {
                    log.warn("Ignoring unrecognized effects key '{}'", key);
                }
            }
        }

        private static ConfigSection requireSection(ConfigSection parent, String key) {
            Object value = parent.get(key);
            if (!(value instanceof ConfigSection)) {
                throw new ConfigurationException("'" + key + "' must be an object, got '" + value + "'");
            }
            return (ConfigSection) value;
        }

        public Configuration build() {
            if (effectParams == null) {
                throw new ConfigurationException("effect_params must not be null");
            }
            if (colorScheme == null) {
                throw new ConfigurationException("color_scheme must not be null");
            }
            if (outputFormat == null) {
                throw new ConfigurationException("output_format must not be null");
            }
            EffectParameters.checkRange("output_quality", outputQuality, 1, 100);
            if (primaryEffect != null && primaryEffect.isBlank()) {
                primaryEffect = null;
            }
            return new Configuration(this);
        }
    }
}
