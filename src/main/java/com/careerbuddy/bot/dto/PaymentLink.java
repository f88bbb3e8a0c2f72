package com.careerbuddy.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentLink {

    private String reference;

    private String url;

    /** In major currency units. */
    private long amount;

    private String description;
}
