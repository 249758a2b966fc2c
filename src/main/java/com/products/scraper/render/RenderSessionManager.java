package com.products.scraper.render;

import com.products.scraper.config.ScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the single rendering engine process of this service.
 * <p>
 * The process is launched lazily by the first {@link #acquire()} (or at
 * start-up when {@code scraper.browser.launch-on-startup} is set) and reused
 * by every later request. Launching happens under a lock, so concurrent
 * first callers wait for one launch and all receive the same session. A
 * failed launch leaves nothing behind and the next {@code acquire()} tries
 * again. Once {@link #destroy()} has run, no new session is ever created.
 * </p>
 */
@Slf4j
@Component
public class RenderSessionManager implements DisposableBean {

    private final RenderEngine engine;

    private final ScraperProperties props;

    private final ReentrantLock lock = new ReentrantLock();

    private volatile RenderSession session;

    private volatile boolean shutDown;

    public RenderSessionManager(final RenderEngine engine, final ScraperProperties props) {
        this.engine = engine;
        this.props = props;
    }

    /**
     * Returns the live session, launching it first if there is none.
     *
     * @return the shared session
     * @throws IllegalStateException after shutdown
     * @throws RuntimeException      when the engine cannot be launched
     */
    public RenderSession acquire() {
        RenderSession current = session;
        if (current != null && current.isConnected()) {
            return current;
        }

        lock.lock();
        try {
            if (shutDown) {
                throw new IllegalStateException("Render session manager is shut down");
            }
            current = session;
            if (current != null) {
                if (current.isConnected()) {
                    return current;
                }
                log.warn("Render session lost its engine process, launching a new one");
                session = null;
                current.close();
            }
            session = launch();
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the current session, if any, and forgets it. A later
     * {@link #acquire()} launches a fresh one.
     */
    public void release() {
        lock.lock();
        try {
            RenderSession current = session;
            session = null;
            if (current != null) {
                log.info("Closing render session");
                current.close();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Final shutdown: releases the session and refuses any further launch.
     */
    @Override
    public void destroy() {
        lock.lock();
        try {
            if (shutDown) {
                return;
            }
            shutDown = true;
            release();
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        RenderSession current = session;
        return current != null && current.isConnected();
    }

    @EventListener(ApplicationReadyEvent.class)
    void launchOnStartup() {
        if (!props.getBrowser().isLaunchOnStartup()) {
            return;
        }
        try {
            acquire();
        } catch (RuntimeException ex) {
            log.error("Render session could not be launched at start-up, will retry on first request", ex);
        }
    }

    private RenderSession launch() {
        LaunchSettings settings = LaunchSettings.from(props);
        resetWorkDir(settings.workDir());

        long t0 = System.nanoTime();
        RenderSession created = engine.launch(settings);
        log.info("Render session launched in {}ms (proxy={}, headless={})",
                (System.nanoTime() - t0) / 1_000_000,
                settings.proxy().orElse("none"),
                settings.headless());
        return created;
    }

    /**
     * Deletes the scratch directory with everything the engine left in it
     * and recreates it empty.
     */
    static void resetWorkDir(final Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
            Files.createDirectories(dir);
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not reset render work dir " + dir.toAbsolutePath(), ex);
        }
    }
}
