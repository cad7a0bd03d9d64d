package com.ttennebkram.stylize.registry;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.effects.Effect;
import com.ttennebkram.stylize.error.EffectNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directory of named effects.
 *
 * Factories are registered up front; an effect is instantiated the first
 * time it is requested, with its own configuration section, and the same
 * instance is returned afterwards. Unknown names and failing factories yield
 * null rather than an exception so that callers can fall back.
 *
 * Each batch worker owns its own registry. Close the registry to release
 * the class loaders of plugins it loaded.
 */
public class EffectRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EffectRegistry.class);

    public static final String ORIGIN_BUILTIN = "builtin";

    /**
     * A registered effect and its lazily created instance.
     */
    public static class EffectRegistration {
        public final String name;
        public final EffectFactory factory;
        public final String origin;
        private Effect instance;

        EffectRegistration(String name, EffectFactory factory, String origin) {
            this.name = name;
            this.factory = factory;
            this.origin = origin;
        }
    }

    private final Map<String, EffectRegistration> effectsByName = new LinkedHashMap<>();
    private final List<URLClassLoader> pluginLoaders = new ArrayList<>();
    private final Configuration configuration;
    private final PluginScanner scanner;

    /**
     * Empty registry using default effect sections.
     */
    public EffectRegistry() {
        this(Configuration.defaults());
    }

    public EffectRegistry(Configuration configuration) {
        this(configuration, new PluginScanner());
    }

    public EffectRegistry(Configuration configuration, PluginScanner scanner) {
        this.configuration = configuration;
        this.scanner = scanner;
    }

    /**
     * Registry holding the built-in effects plus any plugins in the
     * configured {@code custom_effects_path}.
     */
    public static EffectRegistry forConfiguration(Configuration configuration) {
        EffectRegistry registry = new EffectRegistry(configuration);
        BuiltinEffects.registerAll(registry);
        String pluginPath = configuration.getCustomEffectsPath();
        if (pluginPath != null && !pluginPath.isBlank()) {
            registry.discoverPlugins(Path.of(pluginPath));
        }
        return registry;
    }

    /**
     * Add or replace a factory. Any cached instance for the name is dropped.
     */
    public synchronized void register(String name, EffectFactory factory) {
        register(name, factory, ORIGIN_BUILTIN);
    }

    synchronized void register(String name, EffectFactory factory, String origin) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Effect name must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Effect factory must not be null");
        }
        EffectRegistration previous = effectsByName.put(name, new EffectRegistration(name, factory, origin));
        if (previous != null) {
            log.debug("Replaced effect {} ({} -> {})", name, previous.origin, origin);
        }
    }

    /**
     * The effect registered under {@code name}, instantiated on first use.
     *
     * @return the effect, or null if the name is unknown or its factory failed
     */
    public synchronized Effect get(String name) {
        EffectRegistration reg = name == null ? null : effectsByName.get(name);
        if (reg == null) {
            log.warn("Unknown effect: {}", name);
            return null;
        }
        if (reg.instance == null) {
            try {
                Effect effect = reg.factory.create(sectionFor(name));
                if (effect == null) {
                    log.warn("Factory for effect {} returned null", name);
                    return null;
                }
                reg.instance = effect;
            } catch (RuntimeException | LinkageError e) {
                log.warn("Failed to create effect {} ({}): {}", name, reg.origin, e.toString());
                return null;
            }
        }
        return reg.instance;
    }

    /**
     * Like {@link #get(String)} but throws for unknown or broken effects.
     *
     * @throws EffectNotFoundException if no usable effect has that name
     */
    public Effect require(String name) {
        Effect effect = get(name);
        if (effect == null) {
            throw new EffectNotFoundException(name);
        }
        return effect;
    }

    public synchronized boolean contains(String name) {
        return effectsByName.containsKey(name);
    }

    /**
     * Registered names in registration order.
     */
    public synchronized List<String> listEffects() {
        return Collections.unmodifiableList(new ArrayList<>(effectsByName.keySet()));
    }

    /**
     * "builtin" or the plugin jar path, or null if unknown.
     */
    public synchronized String getOrigin(String name) {
        EffectRegistration reg = effectsByName.get(name);
        return reg == null ? null : reg.origin;
    }

    /**
     * Register every plugin jar in {@code directory} under its base name.
     *
     * @return number of plugins registered
     */
    public int discoverPlugins(Path directory) {
        List<PluginScanner.PluginModule> modules = scanner.scan(directory);
        synchronized (this) {
            for (PluginScanner.PluginModule module : modules) {
                pluginLoaders.add(module.loader);
                register(module.name, module.factory, module.jarPath.toString());
            }
        }
        if (!modules.isEmpty()) {
            log.info("Registered {} plugin effect(s) from {}", modules.size(), directory);
        }
        return modules.size();
    }

    // Global intensity first, then the effect's own section on top
    private ConfigSection sectionFor(String name) {
        ConfigSection base = ConfigSection.EMPTY.with("intensity", configuration.getEffectParams().getIntensity());
        return base.merge(configuration.getEffectSection(name));
    }

    @Override
    public synchronized void close() {
        for (URLClassLoader loader : pluginLoaders) {
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Could not close plugin class loader: {}", e.getMessage());
            }
        }
        pluginLoaders.clear();
    }
}
