package com.products.scraper.render;

import com.products.scraper.config.ScraperProperties;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Everything needed to start one engine process.
 *
 * @param headless       run without a visible window
 * @param args           command line switches passed to the browser
 * @param workDir        scratch directory owned by the session
 * @param viewportWidth  fixed viewport width for every page
 * @param viewportHeight fixed viewport height for every page
 * @param launchTimeout  how long the process may take to come up
 * @param proxyServer    upstream proxy for all traffic, if any
 */
public record LaunchSettings(
        boolean headless,
        List<String> args,
        Path workDir,
        int viewportWidth,
        int viewportHeight,
        Duration launchTimeout,
        @Nullable String proxyServer
) {

    /**
     * Switches for a contained environment: no sandbox, no GPU, no first-run
     * UI, and the automation-controlled blink feature turned off.
     */
    static final List<String> BASE_ARGS = List.of(
            "--no-sandbox",
            "--disable-setuid-sandbox",
            "--disable-dev-shm-usage",
            "--disable-accelerated-2d-canvas",
            "--no-first-run",
            "--no-zygote",
            "--disable-gpu",
            "--disable-blink-features=AutomationControlled"
    );

    public LaunchSettings {
        args = List.copyOf(args);
    }

    public Optional<String> proxy() {
        return StringUtils.isBlank(proxyServer) ? Optional.empty() : Optional.of(proxyServer.trim());
    }

    /**
     * Reads the browser settings; the proxy is taken as configured at the time of the call.
     *
     * @param props bound scraper properties
     * @return settings for the next launch
     */
    public static LaunchSettings from(final ScraperProperties props) {
        ScraperProperties.Browser browser = props.getBrowser();

        List<String> args = new ArrayList<>(BASE_ARGS);
        args.add("--window-size=" + browser.getViewportWidth() + "," + browser.getViewportHeight());
        args.add("--disk-cache-dir=" + browser.getWorkDir().resolve("cache").toAbsolutePath());

        return new LaunchSettings(
                browser.isHeadless(),
                args,
                browser.getWorkDir(),
                browser.getViewportWidth(),
                browser.getViewportHeight(),
                browser.getLaunchTimeout(),
                browser.getProxyServer());
    }
}
