package com.ttennebkram.stylize.registry;

import com.ttennebkram.stylize.effects.Effect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * Finds plugin effects in a directory of jars.
 *
 * Each {@code *.jar} is one plugin, named after the jar's base name. The
 * effect class is taken from the {@value #EFFECT_CLASS_ATTRIBUTE} manifest
 * attribute, or found by scanning the jar for a concrete {@link Effect}.
 * A jar that cannot be loaded is logged and skipped.
 */
public class PluginScanner {

    private static final Logger log = LoggerFactory.getLogger(PluginScanner.class);

    public static final String EFFECT_CLASS_ATTRIBUTE = "Effect-Class";

    /**
     * A loaded plugin. The caller owns {@link #loader} and must close it.
     */
    public static class PluginModule {
        public final String name;
        public final Path jarPath;
        public final Class<?> effectClass;
        public final EffectFactory factory;
        public final URLClassLoader loader;

        PluginModule(String name, Path jarPath, Class<?> effectClass, EffectFactory factory, URLClassLoader loader) {
            this.name = name;
            this.jarPath = jarPath;
            this.effectClass = effectClass;
            this.factory = factory;
            this.loader = loader;
        }
    }

    private final ClassLoader parent;

    public PluginScanner() {
        this(PluginScanner.class.getClassLoader());
    }

    public PluginScanner(ClassLoader parent) {
        this.parent = parent;
    }

    /**
     * Load every plugin jar in {@code directory}, sorted by file name.
     * A missing directory yields an empty list.
     */
    public List<PluginModule> scan(Path directory) {
        List<PluginModule> modules = new ArrayList<>();
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Plugin directory {} does not exist, no plugins loaded", directory);
            return modules;
        }
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.jar")) {
            for (Path jar : stream) {
                jars.add(jar);
            }
        } catch (IOException e) {
            log.warn("Cannot list plugin directory {}: {}", directory, e.getMessage());
            return modules;
        }
        jars.sort(null);

        for (Path jar : jars) {
            PluginModule module = load(jar);
            if (module != null) {
                modules.add(module);
            }
        }
        return modules;
    }

    /**
     * Load one plugin jar, or return null if it is not a usable plugin.
     */
    public PluginModule load(Path jar) {
        String name = baseName(jar);
        URLClassLoader loader = null;
        try {
            loader = new URLClassLoader(new URL[]{jar.toUri().toURL()}, parent);
            Class<?> effectClass = findEffectClass(jar, loader);
            if (effectClass == null) {
                log.warn("Plugin {} skipped: no Effect implementation found in {}", name, jar);
                closeLoader(loader, jar);
                return null;
            }
            EffectFactory factory = EffectFactory.forClass(effectClass);
            log.info("Loaded plugin effect {} ({}) from {}", name, effectClass.getName(), jar.getFileName());
            return new PluginModule(name, jar, effectClass, factory, loader);
        } catch (IOException | ReflectiveOperationException | RuntimeException | LinkageError e) {
            log.warn("Plugin {} skipped: {}", name, e.toString());
            if (loader != null) {
                closeLoader(loader, jar);
            }
            return null;
        }
    }

    private Class<?> findEffectClass(Path jar, ClassLoader loader) throws IOException, ClassNotFoundException {
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            Manifest manifest = jarFile.getManifest();
            if (manifest != null) {
                String declared = manifest.getMainAttributes().getValue(EFFECT_CLASS_ATTRIBUTE);
                if (declared != null && !declared.isBlank()) {
                    return Class.forName(declared.trim(), true, loader);
                }
            }

            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                String entryName = entries.nextElement().getName();
                if (!entryName.endsWith(".class") || entryName.contains("$") || entryName.startsWith("META-INF/")) {
                    continue;
                }
                String className = entryName.substring(0, entryName.length() - ".class".length()).replace('/', '.');
                Class<?> candidate = tryLoad(className, loader);
                if (candidate != null) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private static Class<?> tryLoad(String className, ClassLoader loader) {
        try {
            Class<?> clazz = Class.forName(className, false, loader);
            if (!Effect.class.isAssignableFrom(clazz)) return null;
            if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) return null;
            return clazz;
        } catch (ClassNotFoundException | LinkageError e) {
            // Classes with missing dependencies cannot be the plugin entry point
            log.debug("Skipping {}: {}", className, e.toString());
            return null;
        }
    }

    static String baseName(Path jar) {
        String fileName = jar.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static void closeLoader(URLClassLoader loader, Path jar) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Could not close class loader for {}: {}", jar, e.getMessage());
        }
    }
}
