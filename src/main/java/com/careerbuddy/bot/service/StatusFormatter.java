package com.careerbuddy.bot.service;

import com.careerbuddy.bot.model.DocumentTemplate;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.GenerationLog;
import com.careerbuddy.bot.service.entitlement.EntitlementStatus;
import com.careerbuddy.bot.service.entitlement.QuotaUsage;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

/**
 * Account texts: quota status and generation history.
 */
public final class StatusFormatter {

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private StatusFormatter() {
    }

    @NotNull
    public static String status(@NotNull EntitlementStatus status) {
        if (status.isAdmin()) {
            return STATUS_ADMIN;
        }

        StringBuilder sb = new StringBuilder(String.format(STATUS_HEADER, status.getTier().getDisplayName()));
        for (DocumentType type : DocumentType.values()) {
            QuotaUsage usage = status.usage(type);
            if (usage.getLimit() == 0) {
                sb.append(String.format(STATUS_LINE_LOCKED, type.getDisplayName()));
            } else {
                sb.append(String.format(STATUS_LINE, type.getDisplayName(), usage.getUsed(), usage.getLimit(), usage.getRemaining()));
            }
        }

        sb.append(String.format(STATUS_PDF, status.isPdfAllowed() ? "✅ Enabled" : "🔒 Premium only"));
        if (status.getQuotaResetAt() != null) {
            sb.append(String.format(STATUS_RESET_AT, date(status.getQuotaResetAt())));
        }
        if (status.getPremiumExpiresAt() != null) {
            sb.append(String.format(STATUS_EXPIRES_AT, date(status.getPremiumExpiresAt())));
        } else {
            sb.append(STATUS_UPSELL);
        }
        return sb.toString();
    }

    @NotNull
    public static String history(@NotNull List<GenerationLog> logs) {
        if (logs.isEmpty()) {
            return HISTORY_EMPTY;
        }
        StringBuilder sb = new StringBuilder(HISTORY_HEADER);
        for (int i = 0; i < logs.size(); i++) {
            GenerationLog entry = logs.get(i);
            sb.append(String.format(HISTORY_LINE, i + 1,
                    entry.getDocumentType().getDisplayName(),
                    DocumentTemplate.fromCode(entry.getTemplate()).getDisplayName(),
                    date(entry.getGeneratedAt())));
        }
        return sb.toString();
    }

    @NotNull
    public static String date(@NotNull LocalDateTime dateTime) {
        return DATE_FORMAT.format(dateTime);
    }
}
