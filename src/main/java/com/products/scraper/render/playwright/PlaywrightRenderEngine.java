package com.products.scraper.render.playwright;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Proxy;
import com.products.scraper.render.LaunchSettings;
import com.products.scraper.render.RenderEngine;
import com.products.scraper.render.RenderSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Launches headless Chromium through Playwright.
 */
@Slf4j
@Component
public class PlaywrightRenderEngine implements RenderEngine {

    @Override
    public RenderSession launch(final LaunchSettings settings) {
        Playwright playwright = Playwright.create();
        try {
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                    .setHeadless(settings.headless())
                    .setArgs(settings.args())
                    .setTimeout(settings.launchTimeout().toMillis())
                    .setDownloadsPath(settings.workDir().resolve("downloads"));
            settings.proxy().ifPresent(server -> options.setProxy(new Proxy(server)));

            Browser browser = playwright.chromium().launch(options);
            log.debug("Chromium {} started", browser.version());
            return new PlaywrightRenderSession(playwright, browser,
                    settings.viewportWidth(), settings.viewportHeight());
        } catch (PlaywrightException ex) {
            playwright.close();
            throw new IllegalStateException("Could not launch Chromium: " + ex.getMessage(), ex);
        }
    }
}
