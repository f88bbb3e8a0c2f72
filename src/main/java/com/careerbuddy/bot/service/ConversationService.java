package com.careerbuddy.bot.service;

import com.careerbuddy.bot.dto.InboundMessage;
import com.careerbuddy.bot.dto.Menu;
import com.careerbuddy.bot.dto.PaymentLink;
import com.careerbuddy.bot.dto.ResponseDirective;
import com.careerbuddy.bot.exception.DuplicateMessageException;
import com.careerbuddy.bot.exception.EntitlementDeniedException;
import com.careerbuddy.bot.exception.QuotaExceededException;
import com.careerbuddy.bot.exception.ValidationException;
import com.careerbuddy.bot.model.DocumentTemplate;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.GenerationLog;
import com.careerbuddy.bot.model.Job;
import com.careerbuddy.bot.model.JobStatus;
import com.careerbuddy.bot.model.PaymentPurpose;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.User;
import com.careerbuddy.bot.model.answers.AnswersConverter;
import com.careerbuddy.bot.repository.GenerationLogRepository;
import com.careerbuddy.bot.repository.JobRepository;
import com.careerbuddy.bot.service.entitlement.AdminPolicy;
import com.careerbuddy.bot.service.entitlement.EntitlementEngine;
import com.careerbuddy.bot.service.entitlement.GenerationDecision;
import com.careerbuddy.bot.service.flow.DocumentRequirements;
import com.careerbuddy.bot.service.flow.StepContext;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepHandlerRegistry;
import com.careerbuddy.bot.service.flow.StepResult;
import com.careerbuddy.bot.service.flow.StepTable;
import com.careerbuddy.bot.service.render.DocumentRenderer;
import com.careerbuddy.bot.service.render.PdfDocumentRenderer;
import com.careerbuddy.bot.service.render.RenderRequest;
import com.careerbuddy.bot.service.render.RenderedDocument;
import com.careerbuddy.bot.util.MessageUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static com.careerbuddy.bot.constant.MessageTemplates.*;

/**
 * The conversational job state machine. One call to {@link #handleInbound(InboundMessage)} is one
 * turn: the idempotency check, the entitlement lazy checks, the step transition and the processed
 * message id all commit in a single transaction.
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    static final String PDF_FEATURE = "PDF export";

    /** Upper bound of steps entered within one turn. */
    private static final int MAX_CHAIN = 8;

    private final UserService userService;
    private final JobRepository jobRepository;
    private final GenerationLogRepository generationLogRepository;
    private final EntitlementEngine entitlementEngine;
    private final AdminPolicy adminPolicy;
    private final IdempotencyFilter idempotencyFilter;
    private final StepHandlerRegistry stepHandlers;
    private final DocumentRenderer documentRenderer;
    private final PdfDocumentRenderer pdfRenderer;
    private final PaymentService paymentService;
    private final Clock clock;

    @Autowired
    public ConversationService(UserService userService,
                               JobRepository jobRepository,
                               GenerationLogRepository generationLogRepository,
                               EntitlementEngine entitlementEngine,
                               AdminPolicy adminPolicy,
                               IdempotencyFilter idempotencyFilter,
                               StepHandlerRegistry stepHandlers,
                               DocumentRenderer documentRenderer,
                               PdfDocumentRenderer pdfRenderer,
                               PaymentService paymentService,
                               Clock clock) {
        this.userService = userService;
        this.jobRepository = jobRepository;
        this.generationLogRepository = generationLogRepository;
        this.entitlementEngine = entitlementEngine;
        this.adminPolicy = adminPolicy;
        this.idempotencyFilter = idempotencyFilter;
        this.stepHandlers = stepHandlers;
        this.documentRenderer = documentRenderer;
        this.pdfRenderer = pdfRenderer;
        this.paymentService = paymentService;
        this.clock = clock;
    }

    @Transactional
    public ResponseDirective handleInbound(@NotNull InboundMessage message) {
        User user = userService.registerUserIfNeeded(message);
        Optional<Job> active = jobRepository.findFirstByUserTelegramIdAndStatusNotOrderByCreatedAtDesc(
                user.getTelegramId(), JobStatus.CLOSED);

        Optional<Job> latest = active.isPresent()
                ? active
                : jobRepository.findFirstByUserTelegramIdOrderByIdDesc(user.getTelegramId());

        if (latest.isPresent()) {
            try {
                idempotencyFilter.verify(latest.get(), message.getMessageId());
            } catch (DuplicateMessageException e) {
                log.warn("Duplicate delivery ignored: {}", e.getMessage());
                return ResponseDirective.none();
            }
        }

        log.debug("Turn for user {}: {} chars, attachment={}", user.getTelegramId(),
                message.getText() == null ? 0 : message.getText().length(), message.getAttachment() != null);

        userService.touch(user);
        entitlementEngine.checkAndResetQuota(user);
        entitlementEngine.checkPremiumExpiry(user);

        Turn turn = new Turn(user, active.orElse(null), message, adminPolicy.isAdmin(user));
        ResponseDirective directive;
        try {
            directive = route(turn);
        } catch (ValidationException e) {
            String text = String.format(VALIDATION_ERROR, e.getUserMessage());
            if (e.getExample() != null) {
                text += String.format(VALIDATION_EXAMPLE, MessageUtils.escapeHtml(e.getExample()));
            }
            directive = ResponseDirective.text(text);
        } catch (QuotaExceededException e) {
            DocumentType type = e.getDocumentType();
            directive = ResponseDirective.text(String.format(QUOTA_EXCEEDED, type.getDisplayName(), e.getLimit(),
                    user.getTier().getDisplayName(), type.getDisplayName(),
                    paymentService.getCurrency(), paymentService.getDocumentPrice()));
        } catch (EntitlementDeniedException e) {
            directive = ResponseDirective.text(PDF_FEATURE.equals(e.getFeature())
                    ? PDF_DENIED
                    : String.format(NOT_ALLOWED, e.getFeature()));
        }

        Job job = turn.job != null ? turn.job : latest.orElse(null);
        if (job != null) {
            refreshStatus(job);
            idempotencyFilter.markProcessed(job, message.getMessageId());
            job.setUpdatedAt(LocalDateTime.now(clock));
            jobRepository.save(job);
        }
        return directive;
    }

    /** Transport callback once a generated document reached the user. */
    @Transactional
    public void markDelivered(@NotNull Long jobId) {
        jobRepository.findById(jobId)
                .filter(job -> job.getStatus() == JobStatus.RENDERING)
                .ifPresent(job -> {
                    job.setStatus(JobStatus.DELIVERED);
                    job.setUpdatedAt(LocalDateTime.now(clock));
                    jobRepository.save(job);
                    log.info("Job {} delivered", jobId);
                });
    }

    private ResponseDirective route(Turn turn) {
        String text = turn.message.getText() == null ? "" : turn.message.getText().trim();

        if (turn.message.getAttachment() != null) {
            Optional<ResponseDirective> blocked = blocked(turn);
            if (blocked.isPresent()) {
                return blocked.get();
            }
            return apply(turn, currentHandler(turn).handle(context(turn), text));
        }

        Optional<GlobalCommand> command = GlobalCommand.parse(text);
        if (command.isPresent()) {
            return handleCommand(turn, command.get(), text);
        }

        Optional<DocumentType> selection = DocumentType.fromSelection(text);
        if (selection.isPresent()) {
            return selectDocument(turn, selection.get());
        }

        Optional<ResponseDirective> blocked = blocked(turn);
        if (blocked.isPresent()) {
            return blocked.get();
        }
        return apply(turn, currentHandler(turn).handle(context(turn), text));
    }

    private ResponseDirective handleCommand(Turn turn, GlobalCommand command, String text) {
        switch (command) {
            case START -> {
                String welcome = WELCOME;
                if (turn.job != null && turn.job.getStep() != Step.DONE) {
                    welcome += String.format(ACTIVE_JOB_NOTE, turn.job.getDocumentType().getDisplayName());
                }
                return ResponseDirective.text(welcome, Menu.DOCUMENT_MENU);
            }
            case HELP -> {
                return ResponseDirective.text(HELP);
            }
            case STATUS -> {
                return ResponseDirective.text(StatusFormatter.status(entitlementEngine.getStatus(turn.user)));
            }
            case RESET -> {
                return reset(turn);
            }
            case CANCEL -> {
                if (turn.job == null) {
                    return ResponseDirective.text(CANCEL_NOTHING);
                }
                DocumentType type = turn.job.getDocumentType();
                closeJob(turn.job);
                return ResponseDirective.text(String.format(CANCELLED, type.getDisplayName()));
            }
            case SKIP -> {
                Optional<ResponseDirective> blocked = blocked(turn);
                return blocked.orElseGet(() -> apply(turn, currentHandler(turn).onSkip(context(turn))));
            }
            case WAKE -> {
                Optional<ResponseDirective> blocked = blocked(turn);
                return blocked.orElseGet(() -> apply(turn, currentHandler(turn).onWake(context(turn))));
            }
            case PDF -> {
                return exportPdf(turn);
            }
            case UPGRADE -> {
                return upgrade(turn);
            }
            case HISTORY -> {
                return ResponseDirective.text(StatusFormatter.history(
                        generationLogRepository.findTop5ByUserTelegramIdOrderByGeneratedAtDesc(turn.user.getTelegramId())));
            }
            case STATS -> {
                if (!turn.admin) {
                    return ResponseDirective.text(ADMIN_ONLY);
                }
                UserService.UsageStats stats = userService.getStats();
                return ResponseDirective.text(String.format(STATS, stats.getUsers(), stats.getPremiumUsers(),
                        stats.getFreeUsers(), stats.getDocuments(), stats.getPaidDocuments()));
            }
            case SET_PRO -> {
                if (!turn.admin) {
                    return ResponseDirective.text(ADMIN_ONLY);
                }
                return setPro(GlobalCommand.argument(text));
            }
            default -> throw new IllegalStateException("Unhandled command " + command);
        }
    }

    private ResponseDirective selectDocument(Turn turn, DocumentType type) {
        GenerationDecision decision = entitlementEngine.canGenerate(turn.user, type);
        if (decision.getReason() == GenerationDecision.DenialReason.NOT_ALLOWED) {
            throw decision.toException();
        }

        Job job = turn.job;
        if (job != null && job.getDocumentType() == type && job.getStep() != Step.DONE) {
            log.info("User {} resumed job {} at {}", turn.user.getTelegramId(), job.getId(), job.getStep());
            return apply(turn, currentHandler(turn).onEnter(context(turn)),
                    String.format(RESUMING, type.getDisplayName()));
        }

        if (job != null) {
            closeJob(job);
        }
        return startJob(turn, type, String.format(STARTING, type.getDisplayName()));
    }

    private ResponseDirective reset(Turn turn) {
        Job job = turn.job;
        if (job == null) {
            return ResponseDirective.text(RESET_NOTHING);
        }
        closeJob(job);
        if (job.getStep() == Step.DONE) {
            turn.job = null;
            return ResponseDirective.text(RESET_CLOSED);
        }
        DocumentType type = job.getDocumentType();
        return startJob(turn, type, String.format(RESET_STARTED, type.getDisplayName()));
    }

    private ResponseDirective startJob(Turn turn, DocumentType type, String greeting) {
        LocalDateTime now = LocalDateTime.now(clock);
        Job job = Job.builder()
                .user(turn.user)
                .documentType(type)
                .status(JobStatus.COLLECTING)
                .step(StepTable.first(type))
                .createdAt(now)
                .updatedAt(now)
                .build();
        turn.job = jobRepository.save(job);
        log.info("Job {} ({}) created for user {}", turn.job.getId(), type.getCode(), turn.user.getTelegramId());

        List<String> replies = new ArrayList<>();
        replies.add(greeting);
        StepResult result = enter(turn, turn.job.getStep(), replies);
        return apply(turn, result, replies);
    }

    private void closeJob(Job job) {
        job.setStatus(JobStatus.CLOSED);
        job.setUpdatedAt(LocalDateTime.now(clock));
        jobRepository.save(job);
        log.info("Job {} closed at {}", job.getId(), job.getStep());
    }

    private ResponseDirective apply(Turn turn, StepResult result, String... leading) {
        return apply(turn, result, new ArrayList<>(Arrays.asList(leading)));
    }

    /**
     * Follows a handler result: collects replies, moves the job and enters every step it arrives
     * at until one of them waits for the user.
     */
    private ResponseDirective apply(Turn turn, StepResult first, List<String> replies) {
        Job job = turn.job;
        Menu menu = Menu.NONE;
        StepResult result = first;

        for (int hops = 0; ; hops++) {
            if (hops > MAX_CHAIN) {
                throw new IllegalStateException("Step chain of job " + job.getId() + " did not settle at " + job.getStep());
            }
            if (result.hasReply()) {
                replies.add(result.getReply());
            }
            if (result.getMenu() != Menu.NONE) {
                menu = result.getMenu();
            }

            if (result.getAction() == StepResult.Action.FINALIZE) {
                ResponseDirective finalized = finalizeJob(turn);
                if (finalized.isDocument()) {
                    return finalized;
                }
                replies.add(finalized.getText());
                break;
            }
            if (result.getAction() == StepResult.Action.REQUEST_PAYMENT) {
                replies.add(requestDocumentPayment(turn));
                break;
            }
            if (result.getTransition() == StepResult.Transition.STAY) {
                break;
            }

            Step next = result.getTransition() == StepResult.Transition.ADVANCE
                    ? StepTable.next(job.getDocumentType(), job.getStep(), turn.premium())
                    : result.getTarget();
            result = enter(turn, next, replies);
        }

        return ResponseDirective.text(String.join("\n\n", replies), menu);
    }

    private StepResult enter(Turn turn, Step step, List<String> replies) {
        Job job = turn.job;
        if (job.getStep() != step) {
            log.info("Job {} moved {} -> {}", job.getId(), job.getStep(), step);
        }
        job.setStep(step);
        refreshStatus(job);

        int position = StepTable.position(job.getDocumentType(), step);
        if (position > 0) {
            replies.add(String.format(PROGRESS,
                    MessageUtils.progressBar(position, StepTable.collectionSize(job.getDocumentType()))));
        }
        return stepHandlers.get(step).onEnter(context(turn));
    }

    /**
     * Entitlement check, render and usage record. A denial throws before anything is changed; a
     * rendering failure propagates and rolls the whole turn back, including the usage record.
     */
    private ResponseDirective finalizeJob(Turn turn) {
        Job job = turn.job;
        User user = turn.user;
        DocumentType type = job.getDocumentType();

        if (job.getStatus() == JobStatus.AWAITING_PAYMENT) {
            return ResponseDirective.text(AWAITING_PAYMENT);
        }
        List<String> missing = DocumentRequirements.missingFields(type, job.getAnswers());
        if (!missing.isEmpty()) {
            throw new ValidationException(String.format(ERR_PREVIEW_INCOMPLETE, String.join(", ", missing)));
        }

        boolean paid = job.getStatus() == JobStatus.PAID;
        if (!paid) {
            GenerationDecision decision = entitlementEngine.canGenerate(user, type);
            if (!decision.isAllowed()) {
                log.info("Generation of {} denied for user {}: {}", type.getCode(), user.getTelegramId(), decision.getReason());
                throw decision.toException();
            }
        }

        DocumentTemplate template = turn.premium()
                ? DocumentTemplate.fromCode(job.getAnswers().getTemplate())
                : DocumentTemplate.CLASSIC;
        job.setStatus(JobStatus.RENDERING);

        RenderedDocument document = documentRenderer.render(RenderRequest.builder()
                .jobId(job.getId())
                .documentType(type)
                .template(template)
                .answers(job.getAnswers())
                .build());

        if (!paid) {
            entitlementEngine.recordGeneration(user, type);
        }
        generationLogRepository.save(GenerationLog.builder()
                .user(user)
                .jobId(job.getId())
                .documentType(type)
                .template(template.getCode())
                .paid(paid)
                .answers(AnswersConverter.copyOf(job.getAnswers()))
                .generatedAt(LocalDateTime.now(clock))
                .build());

        job.setStep(Step.DONE);
        log.info("Job {} rendered as {} ({}, paid={})", job.getId(), document.getFileName(), template.getCode(), paid);
        return ResponseDirective.document(document, job.getId(),
                String.format(DOCUMENT_CAPTION, type.getDisplayName()) + "\n\n" + DONE);
    }

    private String requestDocumentPayment(Turn turn) {
        Job job = turn.job;
        if (job.getStatus() == JobStatus.AWAITING_PAYMENT) {
            return AWAITING_PAYMENT;
        }
        if (job.getStatus() == JobStatus.PAID) {
            return PAY_NOT_OFFERED;
        }

        GenerationDecision decision = entitlementEngine.canGenerate(turn.user, job.getDocumentType());
        if (decision.isAllowed()) {
            return PAY_NOT_OFFERED;
        }
        if (decision.getReason() == GenerationDecision.DenialReason.NOT_ALLOWED) {
            throw decision.toException();
        }

        Optional<PaymentLink> link = paymentService.createPaymentLink(
                turn.user, PaymentPurpose.forDocument(job.getDocumentType()), job.getId());
        if (link.isEmpty()) {
            return PAYMENT_UNAVAILABLE;
        }
        job.setStatus(JobStatus.AWAITING_PAYMENT);
        log.info("Job {} awaiting payment {}", job.getId(), link.get().getReference());
        return formatLink(link.get());
    }

    private ResponseDirective exportPdf(Turn turn) {
        if (!entitlementEngine.canUsePdfExport(turn.user)) {
            throw new EntitlementDeniedException(PDF_FEATURE);
        }
        Optional<GenerationLog> latest = generationLogRepository.findFirstByUserTelegramIdOrderByGeneratedAtDesc(
                turn.user.getTelegramId());
        if (latest.isEmpty()) {
            return ResponseDirective.text(PDF_NOTHING);
        }

        GenerationLog entry = latest.get();
        RenderedDocument pdf = pdfRenderer.render(RenderRequest.builder()
                .jobId(entry.getJobId())
                .documentType(entry.getDocumentType())
                .template(DocumentTemplate.fromCode(entry.getTemplate()))
                .answers(entry.getAnswers())
                .build());
        return ResponseDirective.document(pdf, null,
                String.format(DOCUMENT_CAPTION, entry.getDocumentType().getDisplayName()));
    }

    private ResponseDirective upgrade(Turn turn) {
        if (turn.admin || userService.hasActivePremium(turn.user)) {
            return ResponseDirective.text(String.format(ALREADY_PREMIUM,
                    StatusFormatter.status(entitlementEngine.getStatus(turn.user))));
        }

        String offer = String.format(UPGRADE_OFFER, paymentService.getCurrency(), paymentService.getPremiumPrice());
        Optional<PaymentLink> link = paymentService.createPaymentLink(turn.user, PaymentPurpose.PREMIUM_UPGRADE, null);
        return ResponseDirective.text(offer + "\n\n" + link.map(this::formatLink).orElse(PAYMENT_UNAVAILABLE));
    }

    private ResponseDirective setPro(String argument) {
        long telegramId;
        try {
            telegramId = Long.parseLong(argument);
        } catch (NumberFormatException e) {
            return ResponseDirective.text(SETPRO_USAGE);
        }

        Optional<User> target = userService.findByTelegramId(telegramId);
        if (target.isEmpty()) {
            return ResponseDirective.text(String.format(SETPRO_NOT_FOUND, MessageUtils.escapeHtml(argument)));
        }
        User user = target.get();
        if (adminPolicy.isAdmin(user)) {
            return ResponseDirective.text(String.format(SETPRO_ADMIN, telegramId));
        }
        if (userService.hasActivePremium(user)) {
            return ResponseDirective.text(String.format(SETPRO_ALREADY, telegramId,
                    StatusFormatter.date(user.getPremiumExpiresAt())));
        }

        userService.grantPremium(user);
        return ResponseDirective.text(String.format(SETPRO_DONE, telegramId,
                StatusFormatter.date(user.getPremiumExpiresAt())));
    }

    private String formatLink(PaymentLink link) {
        return String.format(PAYMENT_LINK, MessageUtils.escapeHtml(link.getDescription()),
                paymentService.getCurrency(), link.getAmount(), link.getUrl());
    }

    /** Reply for turns that cannot reach a step handler. */
    private Optional<ResponseDirective> blocked(Turn turn) {
        if (turn.job == null) {
            return Optional.of(ResponseDirective.text(CHOOSE_DOCUMENT_FIRST, Menu.DOCUMENT_MENU));
        }
        if (turn.job.getStatus() == JobStatus.AWAITING_PAYMENT) {
            return Optional.of(ResponseDirective.text(AWAITING_PAYMENT));
        }
        return Optional.empty();
    }

    /** Recomputes collection statuses from the answers; later statuses are only moved explicitly. */
    private void refreshStatus(Job job) {
        if (!job.getStatus().isCollectionPhase()) {
            return;
        }
        JobStatus status;
        if (!DocumentRequirements.isComplete(job.getDocumentType(), job.getAnswers())) {
            status = JobStatus.COLLECTING;
        } else if (job.getStep().isPreviewPhase()) {
            status = JobStatus.PREVIEW_READY;
        } else {
            status = JobStatus.DRAFT_READY;
        }
        job.setStatus(status);
    }

    private StepHandler currentHandler(Turn turn) {
        return stepHandlers.get(turn.job.getStep());
    }

    private StepContext context(Turn turn) {
        Job job = turn.job;
        return StepContext.builder()
                .jobId(job.getId())
                .documentType(job.getDocumentType())
                .tier(turn.user.getTier())
                .premium(turn.premium())
                .answers(job.getAnswers())
                .attachment(turn.message.getAttachment())
                .build();
    }

    private static final class Turn {
        private final User user;
        private final InboundMessage message;
        private final boolean admin;
        private Job job;

        private Turn(User user, Job job, InboundMessage message, boolean admin) {
            this.user = user;
            this.job = job;
            this.message = message;
            this.admin = admin;
        }

        private boolean premium() {
            return admin || user.isPro();
        }
    }
}
