package com.ttennebkram.stylize.registry;

import com.ttennebkram.stylize.effects.CrystallizeEffect;
import com.ttennebkram.stylize.effects.DataGlitchEffect;
import com.ttennebkram.stylize.effects.EchoMotionEffect;
import com.ttennebkram.stylize.effects.Effect;
import com.ttennebkram.stylize.effects.EffectInfo;
import com.ttennebkram.stylize.effects.HorizontalSmearEffect;
import com.ttennebkram.stylize.effects.LiquidEffect;
import com.ttennebkram.stylize.effects.ParticleDisintegrationEffect;
import com.ttennebkram.stylize.effects.SpectralShiftEffect;
import com.ttennebkram.stylize.effects.VerticalCascadeEffect;

import java.util.List;

/**
 * Catalog of effects compiled into the engine. Each class carries an
 * {@link EffectInfo} annotation whose name is the registry key.
 */
public final class BuiltinEffects {

    public static final String DEFAULT_EFFECT = "vertical_cascade";

    public static final List<Class<? extends Effect>> CLASSES = List.of(
            HorizontalSmearEffect.class,
            VerticalCascadeEffect.class,
            DataGlitchEffect.class,
            LiquidEffect.class,
            CrystallizeEffect.class,
            EchoMotionEffect.class,
            SpectralShiftEffect.class,
            ParticleDisintegrationEffect.class);

    private BuiltinEffects() {
    }

    /**
     * Register every built-in effect. Factories only; nothing is instantiated.
     */
    public static void registerAll(EffectRegistry registry) {
        for (Class<? extends Effect> type : CLASSES) {
            EffectInfo info = type.getAnnotation(EffectInfo.class);
            if (info == null) {
                throw new IllegalStateException(type.getName() + " is missing @EffectInfo");
            }
            registry.register(info.name(), EffectFactory.forClass(type), EffectRegistry.ORIGIN_BUILTIN);
        }
    }
}
