package com.plughub.plugin.echo;

import com.plughub.plugin.AbstractPlugin;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Echoes {@code input} (or {@code prompt}) back as {@code responseText}, prefixed with the
 * {@code prefix} setting ("ECHO: " by default).
 */
public final class EchoPlugin extends AbstractPlugin {

    static final String KEY_INPUT = "input";
    static final String KEY_PROMPT = "prompt";
    static final String KEY_RESPONSE_TEXT = "responseText";
    static final String SETTING_PREFIX = "prefix";
    static final String DEFAULT_PREFIX = "ECHO: ";

    private final AtomicLong invocations = new AtomicLong();
    private volatile String prefix = DEFAULT_PREFIX;

    @Override
    protected boolean onInitialize() {
        Object configured = getSetting(SETTING_PREFIX, DEFAULT_PREFIX);
        prefix = configured != null ? configured.toString() : DEFAULT_PREFIX;
        return true;
    }

    @Override
    public Map<String, Object> process(Map<String, Object> input) {
        Object in = input != null && input.containsKey(KEY_INPUT) ? input.get(KEY_INPUT)
                : (input != null ? input.get(KEY_PROMPT) : null);
        String value = in != null ? in.toString().trim() : "";
        invocations.incrementAndGet();
        return Map.of(KEY_RESPONSE_TEXT, prefix + value);
    }

    @Override
    public Map<String, Object> getInfo() {
        return Map.of("prefix", prefix, "invocations", invocations.get());
    }
}
