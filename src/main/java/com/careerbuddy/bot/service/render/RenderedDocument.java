package com.careerbuddy.bot.service.render;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Opaque artifact handed to the transport.
 */
@Getter
@AllArgsConstructor
@ToString(exclude = "content")
public class RenderedDocument {

    private final String fileName;
    private final String mimeType;
    private final byte[] content;
}
