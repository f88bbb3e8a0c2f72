package com.careerbuddy.bot.service.render;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class LayoutLine {

    public enum Kind {
        NAME,
        SUBTITLE,
        HEADING,
        TEXT,
        BULLET,
        BLANK
    }

    private final Kind kind;
    private final String text;

    public static LayoutLine blank() {
        return new LayoutLine(Kind.BLANK, "");
    }
}
