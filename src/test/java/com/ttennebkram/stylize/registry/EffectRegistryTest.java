package com.ttennebkram.stylize.registry;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.config.Configuration;
import com.ttennebkram.stylize.effects.EffectBase;
import com.ttennebkram.stylize.effects.Effect;
import com.ttennebkram.stylize.error.EffectNotFoundException;
import com.ttennebkram.stylize.registry.fixtures.NotAnEffect;
import com.ttennebkram.stylize.registry.fixtures.TintPluginEffect;
import com.ttennebkram.stylize.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.jar.Attributes;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EffectRegistryTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    @Test
    void forConfiguration_registersBuiltinsInOrder() {
        try (EffectRegistry registry = EffectRegistry.forConfiguration(Configuration.defaults())) {
            List<String> names = registry.listEffects();

            assertEquals(BuiltinEffects.CLASSES.size(), names.size());
            assertEquals("horizontal_smear", names.get(0));
            assertTrue(names.contains("spectral_shift"));
            assertEquals(EffectRegistry.ORIGIN_BUILTIN, registry.getOrigin("liquid"));
        }
    }

    @Test
    void get_isIdempotent() {
        try (EffectRegistry registry = EffectRegistry.forConfiguration(Configuration.defaults())) {
            Effect first = registry.get("crystallize");
            assertNotNull(first);
            assertSame(first, registry.get("crystallize"));
        }
    }

    @Test
    void get_unknownNameReturnsNullAndRequireThrows() {
        try (EffectRegistry registry = EffectRegistry.forConfiguration(Configuration.defaults())) {
            assertNull(registry.get("nonexistent"));
            assertNull(registry.get(null));
            EffectNotFoundException e = assertThrows(EffectNotFoundException.class,
                    () -> registry.require("nonexistent"));
            assertEquals("nonexistent", e.getEffectName());
        }
    }

    @Test
    void register_replacesAndDropsCachedInstance() {
        EffectRegistry registry = new EffectRegistry();
        registry.register("tint", config -> new TintPluginEffect());
        Effect before = registry.get("tint");

        registry.register("tint", config -> new TintPluginEffect());

        assertNotSame(before, registry.get("tint"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", config -> new TintPluginEffect()));
    }

    @Test
    void get_failingFactoryReturnsNull() {
        EffectRegistry registry = new EffectRegistry();
        registry.register("broken", config -> {
            throw new IllegalStateException("cannot build");
        });

        assertNull(registry.get("broken"));
        assertTrue(registry.contains("broken"));
    }

    @Test
    void get_passesGlobalIntensityAndEffectSection() {
        Configuration config = Configuration.builder()
                .apply(ConfigSection.of(Map.of(
                        "effect_params", Map.of("intensity", 0.4),
                        "effects", Map.of("liquid", Map.of("amplitude", 3)))))
                .build();
        try (EffectRegistry registry = EffectRegistry.forConfiguration(config)) {
            EffectBase liquid = (EffectBase) registry.get("liquid");

            assertEquals(0.4, liquid.getConfig().getDouble("intensity", 0), 1e-9);
            assertEquals(3, liquid.getConfig().getInt("amplitude", 0));
        }
    }

    @Test
    void forClass_rejectsNonEffects() {
        assertThrows(IllegalArgumentException.class, () -> EffectFactory.forClass(NotAnEffect.class));
        assertThrows(IllegalArgumentException.class, () -> EffectFactory.forClass(EffectBase.class));
    }

    @Test
    void discoverPlugins_registersJarsUnderBaseName() throws Exception {
        Path plugins = Files.createDirectories(tempDir.resolve("plugins"));
        writeJar(plugins.resolve("tint.jar"), TintPluginEffect.class, TintPluginEffect.class);
        writeJar(plugins.resolve("scanned.jar"), null, TintPluginEffect.class);

        try (EffectRegistry registry = new EffectRegistry()) {
            int count = registry.discoverPlugins(plugins);

            assertEquals(2, count);
            assertInstanceOf(TintPluginEffect.class, registry.get("tint"));
            assertInstanceOf(TintPluginEffect.class, registry.get("scanned"));
            assertEquals(plugins.resolve("tint.jar").toString(), registry.getOrigin("tint"));
        }
    }

    @Test
    void discoverPlugins_skipsBrokenJars() throws Exception {
        Path plugins = Files.createDirectories(tempDir.resolve("plugins"));
        Files.write(plugins.resolve("garbage.jar"), new byte[]{1, 2, 3, 4, 5});
        writeJar(plugins.resolve("wrong.jar"), NotAnEffect.class, NotAnEffect.class);
        writeJar(plugins.resolve("empty.jar"), null);
        writeJar(plugins.resolve("good.jar"), TintPluginEffect.class, TintPluginEffect.class);
        Files.writeString(plugins.resolve("readme.txt"), "not a jar");

        try (EffectRegistry registry = new EffectRegistry()) {
            assertEquals(1, registry.discoverPlugins(plugins));
            assertTrue(registry.contains("good"));
            assertFalse(registry.contains("garbage"));
            assertFalse(registry.contains("wrong"));
            assertFalse(registry.contains("empty"));
        }
    }

    @Test
    void discoverPlugins_missingDirectoryFindsNothing() {
        try (EffectRegistry registry = new EffectRegistry()) {
            assertEquals(0, registry.discoverPlugins(tempDir.resolve("absent")));
        }
    }

    @Test
    void forConfiguration_discoversCustomEffectsPath() throws Exception {
        Path plugins = Files.createDirectories(tempDir.resolve("custom"));
        writeJar(plugins.resolve("tint.jar"), TintPluginEffect.class, TintPluginEffect.class);
        Configuration config = Configuration.builder().customEffectsPath(plugins.toString()).build();

        try (EffectRegistry registry = EffectRegistry.forConfiguration(config)) {
            assertTrue(registry.contains("tint"));
            assertTrue(registry.contains(BuiltinEffects.DEFAULT_EFFECT));
        }
    }

    @Test
    void baseName_dropsExtension() {
        assertEquals("glow", PluginScanner.baseName(Path.of("/tmp/glow.jar")));
        assertEquals("noext", PluginScanner.baseName(Path.of("noext")));
    }

    private static void writeJar(Path jar, Class<?> declared, Class<?>... classes) throws Exception {
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().put(Attributes.Name.MANIFEST_VERSION, "1.0");
        if (declared != null) {
            manifest.getMainAttributes().putValue(PluginScanner.EFFECT_CLASS_ATTRIBUTE, declared.getName());
        }
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream jarOut = new JarOutputStream(out, manifest)) {
            for (Class<?> type : classes) {
                String entry = type.getName().replace('.', '/') + ".class";
                jarOut.putNextEntry(new JarEntry(entry));
                try (InputStream in = type.getClassLoader().getResourceAsStream(entry)) {
                    in.transferTo(jarOut);
                }
                jarOut.closeEntry();
            }
        }
    }
}
