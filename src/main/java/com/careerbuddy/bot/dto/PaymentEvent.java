package com.careerbuddy.bot.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payment provider notification after the webhook body has been normalized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEvent {

    private String reference;

    private String status;

    private Long userId;

    /** {@code premium_upgrade} or a document type code. */
    private String purpose;

    private Long jobId;

    /** In minor currency units, as the provider reports it. May be null. */
    private Long amount;

    public boolean isSuccessful() {
        return "success".equalsIgnoreCase(status);
    }
}
