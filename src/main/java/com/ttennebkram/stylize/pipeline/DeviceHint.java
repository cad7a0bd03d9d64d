package com.ttennebkram.stylize.pipeline;

/**
 * Where the pipeline should run. The OpenCV Java build runs on the CPU,
 * so AUTO currently resolves to CPU.
 */
public enum DeviceHint {
    CPU,
    AUTO;

    public DeviceHint resolve() {
        return CPU;
    }

    public static DeviceHint fromKey(String key) {
        if (key == null) {
            return AUTO;
        }
        for (DeviceHint hint : values()) {
            if (hint.name().equalsIgnoreCase(key)) {
                return hint;
            }
        }
        throw new IllegalArgumentException("Unknown device '" + key + "', expected cpu or auto");
    }
}
