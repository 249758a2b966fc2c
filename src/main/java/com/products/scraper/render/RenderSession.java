package com.products.scraper.render;

import com.products.scraper.identity.IdentityProfile;

/**
 * A live rendering engine process shared by all requests. Pages opened from
 * it are private to the caller.
 */
public interface RenderSession extends AutoCloseable {

    /**
     * Opens a new page in its own isolated context, presenting {@code identity}
     * and the session's fixed viewport.
     *
     * @param identity identity for every request the page makes
     * @return a page the caller owns and must close
     */
    RenderPage openPage(IdentityProfile identity);

    /**
     * @return {@code false} once the underlying process is gone
     */
    boolean isConnected();

    /**
     * Terminates the engine process. Safe to call more than once.
     */
    @Override
    void close();
}
