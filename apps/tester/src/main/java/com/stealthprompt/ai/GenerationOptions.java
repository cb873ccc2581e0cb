package com.stealthprompt.ai;

/**
 * Per-call generation settings.
 *
 * @param temperature sampling temperature, null for the provider default
 * @param cacheable   whether a cached reply may be served and the reply stored
 */
public record GenerationOptions(Double temperature, boolean cacheable) {

    private static final GenerationOptions DEFAULTS = new GenerationOptions(null, true);
    private static final GenerationOptions UNCACHED = new GenerationOptions(null, false);

    public static GenerationOptions defaults() {
        return DEFAULTS;
    }

    /** Always hits the provider; used when a previous reply was rejected. */
    public static GenerationOptions uncached() {
        return UNCACHED;
    }

    public GenerationOptions withTemperature(Double t) {
        return new GenerationOptions(t, cacheable);
    }
}
