package com.careerbuddy.bot.service.ai;

import com.careerbuddy.bot.exception.UpstreamGenerationException;

import java.util.List;

/**
 * Remote text generation. Calls block and may be slow; callers run them off the request thread.
 *
 * @throws UpstreamGenerationException from every method when the upstream is unavailable or
 *                                     returns nothing usable
 */
public interface ContentGenerator {

    List<String> suggestSkills(GenerationRequest request);

    String writeSummary(GenerationRequest request);

    String revampResume(GenerationRequest request);
}
