package com.careerbuddy.bot.model;

import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.model.answers.AnswersConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One successfully generated document. Keeps a snapshot of the answers so the document can be
 * re-rendered later in another format.
 */
@Entity
@Table(name = "generation_logs")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GenerationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false)
    private DocumentType documentType;

    private String template;

    private boolean paid;

    @Convert(converter = AnswersConverter.class)
    @Column(columnDefinition = "text")
    private Answers answers;

    @Column(name = "generated_at", nullable = false)
    private LocalDateTime generatedAt;
}
