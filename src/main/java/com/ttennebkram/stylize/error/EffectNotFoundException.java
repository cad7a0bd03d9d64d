package com.ttennebkram.stylize.error;

/**
 * No effect is registered under the requested name.
 */
public class EffectNotFoundException extends StylizeException {

    private final String effectName;

    public EffectNotFoundException(String effectName) {
        super("Effect not found: '" + effectName + "'");
        this.effectName = effectName;
    }

    public String getEffectName() {
        return effectName;
    }
}
