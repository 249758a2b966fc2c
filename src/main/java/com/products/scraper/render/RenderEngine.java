package com.products.scraper.render;

/**
 * Starts rendering engine processes.
 */
@FunctionalInterface
public interface RenderEngine {

    /**
     * @param settings launch configuration
     * @return a connected session
     * @throws RuntimeException when the process cannot be started
     */
    RenderSession launch(LaunchSettings settings);
}
