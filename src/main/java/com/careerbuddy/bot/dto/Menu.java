package com.careerbuddy.bot.dto;

/** Inline keyboard the transport should attach to a reply. */
public enum Menu {

    NONE,

    DOCUMENT_MENU,

    TEMPLATE_MENU
}
