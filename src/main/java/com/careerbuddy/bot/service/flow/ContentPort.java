package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.service.ai.GenerationRequest;

import java.util.List;
import java.util.Optional;

/**
 * AI content for the assisted steps. Each call starts the generation for the request's job if none
 * is running yet and returns the result once it is available; an empty result means it is still
 * being generated. Results never fail: upstream errors are replaced by fallback content.
 *
 * @see com.careerbuddy.bot.service.ai.ContentGenerationService
 */
public interface ContentPort {

    /**
     * @param wait true to block for the configured inline wait, false to only look at the state
     */
    Optional<List<String>> skills(GenerationRequest request, boolean wait);

    Optional<String> summary(GenerationRequest request, boolean wait);

    Optional<String> revamp(GenerationRequest request, boolean wait);
}
