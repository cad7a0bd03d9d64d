package com.ttennebkram.stylize.registry;

import com.ttennebkram.stylize.config.ConfigSection;
import com.ttennebkram.stylize.effects.Effect;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/**
 * Creates an effect from its configuration section.
 */
@FunctionalInterface
public interface EffectFactory {

    Effect create(ConfigSection config);

    /**
     * Reflective factory for an effect class. Prefers a public
     * {@code (ConfigSection)} constructor and falls back to a public no-arg one.
     *
     * @throws IllegalArgumentException if the class is abstract, not an Effect,
     *                                  or has neither constructor
     */
    static EffectFactory forClass(Class<?> type) {
        if (!Effect.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(type.getName() + " does not implement " + Effect.class.getName());
        }
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException(type.getName() + " is not a concrete class");
        }
        Constructor<?> withConfig = null;
        Constructor<?> noArg = null;
        try {
            withConfig = type.getConstructor(ConfigSection.class);
        } catch (NoSuchMethodException e) {
            try {
                noArg = type.getConstructor();
            } catch (NoSuchMethodException e2) {
                throw new IllegalArgumentException(type.getName()
                        + " needs a public (ConfigSection) or no-arg constructor", e2);
            }
        }
        final Constructor<?> ctor = withConfig != null ? withConfig : noArg;
        final boolean takesConfig = withConfig != null;
        return config -> {
            try {
                Object instance = takesConfig ? ctor.newInstance(config) : ctor.newInstance();
                return (Effect) instance;
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new IllegalStateException("Constructor of " + type.getName() + " failed: " + cause, cause);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot instantiate " + type.getName() + ": " + e, e);
            }
        };
    }
}
