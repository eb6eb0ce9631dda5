package com.williamcallahan.asciimarkdown.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of the {@code app.*} configuration tree.
 */
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private RenderConfig render = new RenderConfig();
    private InputConfig input = new InputConfig();
    private RenderCacheConfig cache = new RenderCacheConfig();

    /**
     * Validates every configuration section; invoked once the properties are bound.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        render.validateConfiguration();
        input.validateConfiguration();
        cache.validateConfiguration();
    }

    public RenderConfig getRender() {
        return render;
    }

    public void setRender(RenderConfig render) {
        this.render = render;
    }

    public InputConfig getInput() {
        return input;
    }

    public void setInput(InputConfig input) {
        this.input = input;
    }

    public RenderCacheConfig getCache() {
        return cache;
    }

    public void setCache(RenderCacheConfig cache) {
        this.cache = cache;
    }
}
