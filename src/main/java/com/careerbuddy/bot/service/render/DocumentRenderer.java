package com.careerbuddy.bot.service.render;

import com.careerbuddy.bot.exception.RenderingException;

public interface DocumentRenderer {

    /**
     * @throws RenderingException when the artifact cannot be produced
     */
    RenderedDocument render(RenderRequest request);
}
