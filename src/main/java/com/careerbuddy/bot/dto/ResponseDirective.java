package com.careerbuddy.bot.dto;

import com.careerbuddy.bot.service.render.RenderedDocument;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * What the transport should do with the outcome of a turn.
 */
@Getter
@ToString(exclude = "document")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResponseDirective {

    public enum Type {
        TEXT,
        /** Send the rendered file, then report back with {@code markDelivered(jobId)}. */
        DOCUMENT,
        /** Duplicate delivery: reply with nothing. */
        NONE
    }

    private final Type type;
    private final String text;
    private final Menu menu;
    private final RenderedDocument document;
    private final Long jobId;

    public static ResponseDirective text(String text) {
        return new ResponseDirective(Type.TEXT, text, Menu.NONE, null, null);
    }

    public static ResponseDirective text(String text, Menu menu) {
        return new ResponseDirective(Type.TEXT, text, menu, null, null);
    }

    public static ResponseDirective document(RenderedDocument document, Long jobId, String caption) {
        return new ResponseDirective(Type.DOCUMENT, caption, Menu.NONE, document, jobId);
    }

    public static ResponseDirective none() {
        return new ResponseDirective(Type.NONE, null, Menu.NONE, null, null);
    }

    public boolean isNone() {
        return type == Type.NONE;
    }

    public boolean isDocument() {
        return type == Type.DOCUMENT;
    }
}
