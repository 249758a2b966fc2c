package com.products.scraper.challenge;

import com.products.scraper.render.RenderPage;

/**
 * Makes one attempt at getting past a bot-check page.
 */
@FunctionalInterface
public interface ChallengeSolver {

    /**
     * @param page page currently showing the challenge
     * @return {@code true} if an answer was submitted, {@code false} if no attempt could be made
     */
    boolean solve(RenderPage page);
}
