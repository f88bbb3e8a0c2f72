package com.careerbuddy.bot.service;

import com.careerbuddy.bot.dto.InboundMessage;
import com.careerbuddy.bot.dto.Menu;
import com.careerbuddy.bot.dto.PaymentLink;
import com.careerbuddy.bot.dto.ResponseDirective;
import com.careerbuddy.bot.exception.RenderingException;
import com.careerbuddy.bot.model.DocumentType;
import com.careerbuddy.bot.model.GenerationLog;
import com.careerbuddy.bot.model.Job;
import com.careerbuddy.bot.model.JobStatus;
import com.careerbuddy.bot.model.Step;
import com.careerbuddy.bot.model.Tier;
import com.careerbuddy.bot.model.User;
import com.careerbuddy.bot.model.answers.Answers;
import com.careerbuddy.bot.model.answers.Basics;
import com.careerbuddy.bot.repository.GenerationLogRepository;
import com.careerbuddy.bot.repository.JobRepository;
import com.careerbuddy.bot.service.attachment.AttachmentReader;
import com.careerbuddy.bot.service.entitlement.AdminPolicy;
import com.careerbuddy.bot.service.entitlement.EntitlementEngine;
import com.careerbuddy.bot.service.entitlement.GenerationDecision;
import com.careerbuddy.bot.service.flow.ContentPort;
import com.careerbuddy.bot.service.flow.StepHandler;
import com.careerbuddy.bot.service.flow.StepHandlerRegistry;
import com.careerbuddy.bot.service.flow.steps.*;
import com.careerbuddy.bot.service.render.DocumentRenderer;
import com.careerbuddy.bot.service.render.PdfDocumentRenderer;
import com.careerbuddy.bot.service.render.RenderRequest;
import com.careerbuddy.bot.service.render.RenderedDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConversationServiceTest {

    private static final long USER_ID = 42L;
    private static final long ADMIN_ID = 1L;

    @Mock
    private UserService userService;
    @Mock
    private JobRepository jobRepository;
    @Mock
    private GenerationLogRepository generationLogRepository;
    @Mock
    private EntitlementEngine entitlementEngine;
    @Mock
    private DocumentRenderer documentRenderer;
    @Mock
    private PdfDocumentRenderer pdfRenderer;
    @Mock
    private PaymentService paymentService;
    @Mock
    private ContentPort contentPort;
    @Mock
    private AttachmentReader attachmentReader;

    @Captor
    private ArgumentCaptor<GenerationLog> logCaptor;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final AtomicLong ids = new AtomicLong(100);

    private ConversationService service;
    private User user;

    @BeforeEach
    void setUp() {
        service = new ConversationService(userService, jobRepository, generationLogRepository, entitlementEngine,
                new AdminPolicy(Set.of(ADMIN_ID)), new IdempotencyFilter(),
                new StepHandlerRegistry(handlers(contentPort, attachmentReader)),
                documentRenderer, pdfRenderer, paymentService, clock);

        user = User.builder().telegramId(USER_ID).tier(Tier.FREE).build();
        user.resetCounters();

        when(userService.registerUserIfNeeded(any())).thenAnswer(inv -> user);
        when(jobRepository.findFirstByUserTelegramIdAndStatusNotOrderByCreatedAtDesc(anyLong(), eq(JobStatus.CLOSED)))
                .thenReturn(Optional.empty());
        when(jobRepository.save(any(Job.class))).thenAnswer(inv -> {
            Job job = inv.getArgument(0);
            if (job.getId() == null) {
                job.setId(ids.incrementAndGet());
            }
            return job;
        });
        when(entitlementEngine.canGenerate(any(), any()))
                .thenAnswer(inv -> GenerationDecision.allow(inv.getArgument(1), 1));
    }

    static List<StepHandler> handlers(ContentPort content, AttachmentReader reader) {
        return List.of(new BasicsStep(), new TargetRoleStep(), new ExperienceHeaderStep(), new ExperienceBulletsStep(),
                new AddAnotherExperienceStep(), new EducationStep(), new CertificationsStep(), new ProfilesStep(),
                new ProjectsStep(), new SkillsStep(content), new PersonalInfoStep(), new SummaryStep(content),
                new RoleCompanyStep(), new ExperienceOverviewStep(), new InterestReasonStep(), new CurrentRoleStep(),
                new FirstAchievementStep(), new SecondAchievementStep(), new KeySkillsStep(), new CompanyGoalStep(),
                new UploadStep(reader), new RevampReviewStep(content),
                new PreviewStep(), new TemplateSelectionStep(), new FinalizeStep(), new DoneStep());
    }

    private InboundMessage message(String text, int messageId) {
        return InboundMessage.builder()
                .userId(USER_ID)
                .firstName("Ada")
                .text(text)
                .messageId(messageId)
                .build();
    }

    private Job activeJob(DocumentType type, Step step, JobStatus status) {
        Job job = Job.builder()
                .id(7L)
                .user(user)
                .documentType(type)
                .step(step)
                .status(status)
                .createdAt(LocalDateTime.now(clock).minusHours(1))
                .build();
        when(jobRepository.findFirstByUserTelegramIdAndStatusNotOrderByCreatedAtDesc(anyLong(), eq(JobStatus.CLOSED)))
                .thenReturn(Optional.of(job));
        return job;
    }

    private static Answers completeResume() {
        Answers answers = new Answers();
        answers.setBasics(new Basics("Ada Lovelace", "ada@example.com", "+234 800 000 0000", "Lagos Nigeria"));
        answers.setTargetRole("Data Analyst");
        answers.getSkills().addAll(List.of("SQL", "Python", "Tableau"));
        answers.setSummary("Data Analyst with five years of experience turning raw data into decisions.");
        return answers;
    }

    private RenderedDocument document() {
        return new RenderedDocument("Ada Lovelace - Resume.docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document", "content".getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Routing")
    class RoutingTests {

        @Test
        @DisplayName("Should greet with the document menu")
        void shouldShowWelcome() {
            ResponseDirective directive = service.handleInbound(message("/start", 1));

            assertThat(directive.getText()).contains("Welcome to Career Buddy");
            assertThat(directive.getMenu()).isEqualTo(Menu.DOCUMENT_MENU);
        }

        @Test
        @DisplayName("Should ask for a document type when there is no job")
        void shouldAskForDocumentFirst() {
            ResponseDirective directive = service.handleInbound(message("John Doe, john@example.com", 1));

            assertThat(directive.getText()).contains("choose a document");
            assertThat(directive.getMenu()).isEqualTo(Menu.DOCUMENT_MENU);
            verify(jobRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should run the lazy entitlement checks on every turn")
        void shouldRunLazyChecks() {
            service.handleInbound(message("/help", 1));

            verify(entitlementEngine).checkAndResetQuota(user);
            verify(entitlementEngine).checkPremiumExpiry(user);
            verify(userService).touch(user);
        }

        @Test
        @DisplayName("Should start a job at the first step with a progress bar")
        void shouldStartJob() {
            ResponseDirective directive = service.handleInbound(message("resume", 1));

            ArgumentCaptor<Job> jobCaptor = ArgumentCaptor.forClass(Job.class);
            verify(jobRepository, atLeastOnce()).save(jobCaptor.capture());
            Job job = jobCaptor.getValue();

            assertThat(job.getDocumentType()).isEqualTo(DocumentType.RESUME);
            assertThat(job.getStep()).isEqualTo(Step.BASICS);
            assertThat(job.getStatus()).isEqualTo(JobStatus.COLLECTING);
            assertThat(job.getLastMessageId()).isEqualTo(1);
            assertThat(directive.getText())
                    .contains("Let's create your <b>Resume</b>")
                    .contains("Progress:")
                    .contains("Full Name, Email");
        }

        @Test
        @DisplayName("Should refuse a document type the tier does not include without closing the current job")
        void shouldRejectNotAllowedSelection() {
            Job job = activeJob(DocumentType.RESUME, Step.TARGET_ROLE, JobStatus.COLLECTING);
            when(entitlementEngine.canGenerate(user, DocumentType.COVER_LETTER))
                    .thenReturn(GenerationDecision.notAllowed(DocumentType.COVER_LETTER));

            ResponseDirective directive = service.handleInbound(message("cover letter", 2));

            assertThat(directive.getText()).contains("Cover Letter is a Premium feature");
            assertThat(job.getStatus()).isEqualTo(JobStatus.COLLECTING);
            assertThat(job.getStep()).isEqualTo(Step.TARGET_ROLE);
        }

        @Test
        @DisplayName("Should resume the open job when the same type is selected again")
        void shouldResumeSameType() {
            Job job = activeJob(DocumentType.RESUME, Step.TARGET_ROLE, JobStatus.COLLECTING);

            ResponseDirective directive = service.handleInbound(message("resume", 2));

            assertThat(directive.getText()).contains("Resuming").contains("What role or position");
            assertThat(job.getStatus()).isNotEqualTo(JobStatus.CLOSED);
            assertThat(job.getStep()).isEqualTo(Step.TARGET_ROLE);
        }

        @Test
        @DisplayName("Should close the open job when another type is selected")
        void shouldReplaceJobOnOtherType() {
            Job job = activeJob(DocumentType.RESUME, Step.TARGET_ROLE, JobStatus.COLLECTING);

            service.handleInbound(message("cv", 2));

            assertThat(job.getStatus()).isEqualTo(JobStatus.CLOSED);
            verify(jobRepository, atLeastOnce()).save(argThat((Job saved) -> saved.getDocumentType() == DocumentType.CV
                    && saved.getStep() == Step.BASICS));
        }
    }

    @Nested
    @DisplayName("Step input")
    class StepInputTests {

        @Test
        @DisplayName("Should store valid input and move to the next step")
        void shouldAdvanceOnValidInput() {
            Job job = activeJob(DocumentType.RESUME, Step.BASICS, JobStatus.COLLECTING);

            ResponseDirective directive = service.handleInbound(
                    message("Ada Lovelace, ada@example.com, +234 800 000 0000, Lagos Nigeria", 2));

            assertThat(job.getStep()).isEqualTo(Step.TARGET_ROLE);
            assertThat(job.getAnswers().getBasics().getEmail()).isEqualTo("ada@example.com");
            assertThat(job.getLastMessageId()).isEqualTo(2);
            assertThat(directive.getText()).contains("What role or position");
        }

        @Test
        @DisplayName("Should keep the step and show an example on invalid input")
        void shouldRejectInvalidInput() {
            Job job = activeJob(DocumentType.RESUME, Step.BASICS, JobStatus.COLLECTING);

            ResponseDirective directive = service.handleInbound(message("just my name", 2));

            assertThat(job.getStep()).isEqualTo(Step.BASICS);
            assertThat(directive.getText()).startsWith("❌").contains("Example:");
        }

        @Test
        @DisplayName("Should process a redelivered message only once")
        void shouldIgnoreDuplicateDelivery() {
            Job job = activeJob(DocumentType.RESUME, Step.BASICS, JobStatus.COLLECTING);
            InboundMessage delivery = message("Ada Lovelace, ada@example.com, +234 800 000 0000, Lagos Nigeria", 9);

            ResponseDirective first = service.handleInbound(delivery);
            ResponseDirective second = service.handleInbound(delivery);

            assertThat(first.isNone()).isFalse();
            assertThat(second.isNone()).isTrue();
            assertThat(job.getStep()).isEqualTo(Step.TARGET_ROLE);
            verify(jobRepository, times(1)).save(job);
            verify(userService, times(1)).touch(user);
        }

        @Test
        @DisplayName("Should reject skip on a required step")
        void shouldRejectSkipOnRequiredStep() {
            Job job = activeJob(DocumentType.RESUME, Step.BASICS, JobStatus.COLLECTING);

            ResponseDirective directive = service.handleInbound(message("skip", 2));

            assertThat(directive.getText()).contains("can't be skipped");
            assertThat(job.getStep()).isEqualTo(Step.BASICS);
        }

        @Test
        @DisplayName("Should skip the experience section straight to education")
        void shouldSkipExperience() {
            Job job = activeJob(DocumentType.RESUME, Step.EXPERIENCE_HEADER, JobStatus.COLLECTING);

            service.handleInbound(message("skip", 2));

            assertThat(job.getStep()).isEqualTo(Step.EDUCATION);
        }

        @Test
        @DisplayName("Should hold messages while a payment is pending")
        void shouldHoldWhileAwaitingPayment() {
            Job job = activeJob(DocumentType.RESUME, Step.FINALIZE, JobStatus.AWAITING_PAYMENT);

            ResponseDirective directive = service.handleInbound(message("yes", 2));

            assertThat(directive.getText()).contains("Waiting for your payment");
            assertThat(job.getStatus()).isEqualTo(JobStatus.AWAITING_PAYMENT);
            verify(documentRenderer, never()).render(any());
        }
    }

    @Nested
    @DisplayName("Job status")
    class JobStatusTests {

        private Job atSummary(Answers answers) {
            Job job = activeJob(DocumentType.RESUME, Step.SUMMARY, JobStatus.DRAFT_READY);
            answers.setSummary(null);
            answers.setAiSummary("Data Analyst with five years of experience turning raw data into decisions.");
            job.setAnswers(answers);
            return job;
        }

        @Test
        @DisplayName("Should stay collecting at the preview while required answers are missing")
        void shouldKeepCollectingWithMissingSkills() {
            Answers answers = completeResume();
            answers.getSkills().remove("Tableau");
            Job job = atSummary(answers);

            service.handleInbound(message("yes", 2));

            assertThat(job.getStep()).isEqualTo(Step.PREVIEW);
            assertThat(job.getStatus()).isEqualTo(JobStatus.COLLECTING);
        }

        @Test
        @DisplayName("Should refuse to confirm an incomplete preview")
        void shouldRejectIncompletePreview() {
            Answers answers = completeResume();
            answers.getSkills().remove("Tableau");
            Job job = atSummary(answers);
            service.handleInbound(message("yes", 2));

            ResponseDirective directive = service.handleInbound(message("yes", 3));

            assertThat(directive.getText()).contains("skills");
            assertThat(job.getStep()).isEqualTo(Step.PREVIEW);
            assertThat(job.getStatus()).isEqualTo(JobStatus.COLLECTING);
            verify(documentRenderer, never()).render(any());
        }

        @Test
        @DisplayName("Should be preview ready once every required answer is present")
        void shouldBePreviewReady() {
            Job job = atSummary(completeResume());

            service.handleInbound(message("yes", 2));

            assertThat(job.getStep()).isEqualTo(Step.PREVIEW);
            assertThat(job.getStatus()).isEqualTo(JobStatus.PREVIEW_READY);
        }

        @Test
        @DisplayName("Should be a draft when answers are complete before the preview")
        void shouldBeDraftReady() {
            Job job = activeJob(DocumentType.RESUME, Step.PERSONAL_INFO, JobStatus.COLLECTING);
            Answers answers = completeResume();
            answers.setAiSummary(answers.getSummary());
            job.setAnswers(answers);

            service.handleInbound(message("Nigerian, fluent in English and Yoruba", 2));

            assertThat(job.getStep()).isEqualTo(Step.SUMMARY);
            assertThat(job.getStatus()).isEqualTo(JobStatus.DRAFT_READY);
        }
    }

    @Nested
    @DisplayName("Reset and cancel")
    class ResetTests {

        @Test
        @DisplayName("Should close the job and start a fresh one of the same type")
        void shouldResetToFirstStep() {
            Job job = activeJob(DocumentType.RESUME, Step.SKILLS, JobStatus.COLLECTING);
            job.setAnswers(completeResume());

            ResponseDirective directive = service.handleInbound(message("/reset", 2));

            assertThat(job.getStatus()).isEqualTo(JobStatus.CLOSED);
            verify(jobRepository, atLeastOnce()).save(argThat((Job saved) -> saved != job && saved.getStep() == Step.BASICS
                    && saved.getAnswers().getTargetRole() == null));
            assertThat(directive.getText()).contains("Starting your <b>Resume</b> over");
            verify(entitlementEngine, never()).recordGeneration(any(), any());
        }

        @Test
        @DisplayName("Should just close a finished job")
        void shouldCloseFinishedJob() {
            Job job = activeJob(DocumentType.RESUME, Step.DONE, JobStatus.DELIVERED);

            ResponseDirective directive = service.handleInbound(message("reset", 2));

            assertThat(job.getStatus()).isEqualTo(JobStatus.CLOSED);
            assertThat(directive.getText()).contains("create another document");
        }

        @Test
        @DisplayName("Should cancel without opening a new job")
        void shouldCancel() {
            Job job = activeJob(DocumentType.CV, Step.EDUCATION, JobStatus.COLLECTING);

            ResponseDirective directive = service.handleInbound(message("/cancel", 2));

            assertThat(job.getStatus()).isEqualTo(JobStatus.CLOSED);
            assertThat(directive.getText()).contains("has been cancelled");
            verify(jobRepository, never()).save(argThat((Job saved) -> saved != job));
        }

        /** The cancelled job is no longer open, so the redelivery only finds it as the newest job. */
        private void closedJobIsLatest(Job job) {
            when(jobRepository.findFirstByUserTelegramIdAndStatusNotOrderByCreatedAtDesc(anyLong(), eq(JobStatus.CLOSED)))
                    .thenReturn(Optional.empty());
            when(jobRepository.findFirstByUserTelegramIdOrderByIdDesc(USER_ID)).thenReturn(Optional.of(job));
        }

        @Test
        @DisplayName("Should ignore a redelivered cancel")
        void shouldIgnoreReplayedCancel() {
            Job job = activeJob(DocumentType.CV, Step.EDUCATION, JobStatus.COLLECTING);
            ResponseDirective first = service.handleInbound(message("/cancel", 11));
            closedJobIsLatest(job);

            ResponseDirective replay = service.handleInbound(message("/cancel", 11));

            assertThat(first.getText()).contains("has been cancelled");
            assertThat(job.getLastMessageId()).isEqualTo(11);
            assertThat(replay.isNone()).isTrue();
            verify(userService, times(1)).touch(user);
        }

        @Test
        @DisplayName("Should remember the message that closed a finished job")
        void shouldIgnoreReplayedResetOfFinishedJob() {
            Job job = activeJob(DocumentType.RESUME, Step.DONE, JobStatus.DELIVERED);
            service.handleInbound(message("reset", 12));
            closedJobIsLatest(job);

            ResponseDirective replay = service.handleInbound(message("reset", 12));

            assertThat(job.getLastMessageId()).isEqualTo(12);
            assertThat(replay.isNone()).isTrue();
        }

        @Test
        @DisplayName("Should not open a second checkout for a redelivered upgrade")
        void shouldIgnoreReplayedUpgradeAfterCancel() {
            Job job = activeJob(DocumentType.CV, Step.EDUCATION, JobStatus.COLLECTING);
            service.handleInbound(message("/cancel", 13));
            closedJobIsLatest(job);
            when(paymentService.createPaymentLink(any(), any(), any())).thenReturn(Optional.empty());

            ResponseDirective upgrade = service.handleInbound(message("/upgrade", 14));
            ResponseDirective replay = service.handleInbound(message("/upgrade", 14));

            assertThat(upgrade.isNone()).isFalse();
            assertThat(replay.isNone()).isTrue();
            assertThat(job.getLastMessageId()).isEqualTo(14);
            verify(paymentService, times(1)).createPaymentLink(any(), any(), any());
        }

        @Test
        @DisplayName("Should handle a new message after a cancel")
        void shouldAcceptNewMessageAfterCancel() {
            Job job = activeJob(DocumentType.CV, Step.EDUCATION, JobStatus.COLLECTING);
            service.handleInbound(message("/cancel", 15));
            closedJobIsLatest(job);

            ResponseDirective directive = service.handleInbound(message("/cancel", 16));

            assertThat(directive.getText()).contains("nothing to cancel");
            assertThat(job.getLastMessageId()).isEqualTo(16);
        }
    }

    @Nested
    @DisplayName("Finalize")
    class FinalizeTests {

        @Test
        @DisplayName("Should render, record usage and log the generation when allowed")
        void shouldGenerateWhenAllowed() {
            Job job = activeJob(DocumentType.RESUME, Step.PREVIEW, JobStatus.PREVIEW_READY);
            job.setAnswers(completeResume());
            when(documentRenderer.render(any())).thenReturn(document());

            ResponseDirective directive = service.handleInbound(message("yes", 2));

            assertThat(directive.isDocument()).isTrue();
            assertThat(directive.getJobId()).isEqualTo(7L);
            assertThat(job.getStatus()).isEqualTo(JobStatus.RENDERING);
            assertThat(job.getStep()).isEqualTo(Step.DONE);
            verify(entitlementEngine).recordGeneration(user, DocumentType.RESUME);
            verify(generationLogRepository).save(logCaptor.capture());
            assertThat(logCaptor.getValue().isPaid()).isFalse();
            assertThat(logCaptor.getValue().getTemplate()).isEqualTo("classic");
            assertThat(logCaptor.getValue().getAnswers()).isNotSameAs(job.getAnswers());
        }

        @Test
        @DisplayName("Should offer template selection to pro users before finalizing")
        void shouldOfferTemplatesToPro() {
            user.setTier(Tier.PRO);
            Job job = activeJob(DocumentType.RESUME, Step.PREVIEW, JobStatus.PREVIEW_READY);
            job.setAnswers(completeResume());

            ResponseDirective directive = service.handleInbound(message("yes", 2));

            assertThat(job.getStep()).isEqualTo(Step.TEMPLATE_SELECTION);
            assertThat(directive.getMenu()).isEqualTo(Menu.TEMPLATE_MENU);
            verify(documentRenderer, never()).render(any());
        }

        @Test
        @DisplayName("Should render with the chosen template for pro users")
        void shouldUseChosenTemplate() {
            user.setTier(Tier.PRO);
            Job job = activeJob(DocumentType.RESUME, Step.TEMPLATE_SELECTION, JobStatus.PREVIEW_READY);
            job.setAnswers(completeResume());
            when(documentRenderer.render(any())).thenReturn(document());

            service.handleInbound(message("template_modern", 2));

            ArgumentCaptor<RenderRequest> request = ArgumentCaptor.forClass(RenderRequest.class);
            verify(documentRenderer).render(request.capture());
            assertThat(request.getValue().getTemplate().getCode()).isEqualTo("modern");
        }

        @Test
        @DisplayName("Should deny over quota without touching the job")
        void shouldDenyWhenQuotaExceeded() {
            Job job = activeJob(DocumentType.RESUME, Step.PREVIEW, JobStatus.PREVIEW_READY);
            job.setAnswers(completeResume());
            when(entitlementEngine.canGenerate(user, DocumentType.RESUME))
                    .thenReturn(GenerationDecision.quotaExceeded(DocumentType.RESUME, 1));

            ResponseDirective directive = service.handleInbound(message("yes", 2));

            assertThat(directive.isDocument()).isFalse();
            assertThat(directive.getText()).contains("quota reached").contains("pay");
            assertThat(job.getStatus()).isEqualTo(JobStatus.PREVIEW_READY);
            verify(documentRenderer, never()).render(any());
            verify(entitlementEngine, never()).recordGeneration(any(), any());
        }

        @Test
        @DisplayName("Should not record usage when rendering fails")
        void shouldNotRecordOnRenderFailure() {
            Job job = activeJob(DocumentType.RESUME, Step.FINALIZE, JobStatus.PREVIEW_READY);
            job.setAnswers(completeResume());
            when(documentRenderer.render(any())).thenThrow(new RenderingException("boom", new RuntimeException()));

            assertThatThrownBy(() -> service.handleInbound(message("yes", 2)))
                    .isInstanceOf(RenderingException.class);

            verify(entitlementEngine, never()).recordGeneration(any(), any());
            verify(generationLogRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should finalize a paid job without consuming quota")
        void shouldFinalizePaidJob() {
            Job job = activeJob(DocumentType.RESUME, Step.FINALIZE, JobStatus.PAID);
            job.setAnswers(completeResume());
            when(documentRenderer.render(any())).thenReturn(document());

            ResponseDirective directive = service.handleInbound(message("yes", 2));

            assertThat(directive.isDocument()).isTrue();
            verify(entitlementEngine, never()).canGenerate(any(), any());
            verify(entitlementEngine, never()).recordGeneration(any(), any());
            verify(generationLogRepository).save(logCaptor.capture());
            assertThat(logCaptor.getValue().isPaid()).isTrue();
        }

        @Test
        @DisplayName("Should create a payment link and hold the job on pay")
        void shouldRequestDocumentPayment() {
            Job job = activeJob(DocumentType.RESUME, Step.FINALIZE, JobStatus.PREVIEW_READY);
            job.setAnswers(completeResume());
            when(entitlementEngine.canGenerate(user, DocumentType.RESUME))
                    .thenReturn(GenerationDecision.quotaExceeded(DocumentType.RESUME, 1));
            when(paymentService.createPaymentLink(user, "resume", 7L)).thenReturn(Optional.of(PaymentLink.builder()
                    .reference("cb-1").url("https://pay.example/cb-1").amount(7500).description("Career Buddy Resume")
                    .build()));

            ResponseDirective directive = service.handleInbound(message("pay", 2));

            assertThat(job.getStatus()).isEqualTo(JobStatus.AWAITING_PAYMENT);
            assertThat(directive.getText()).contains("https://pay.example/cb-1");
        }

        @Test
        @DisplayName("Should not offer payment while generation is allowed")
        void shouldNotOfferPaymentWhenAllowed() {
            Job job = activeJob(DocumentType.RESUME, Step.FINALIZE, JobStatus.PREVIEW_READY);
            job.setAnswers(completeResume());

            ResponseDirective directive = service.handleInbound(message("pay", 2));

            assertThat(directive.getText()).contains("Payment isn't needed");
            assertThat(job.getStatus()).isEqualTo(JobStatus.PREVIEW_READY);
            verify(paymentService, never()).createPaymentLink(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("Account commands")
    class AccountCommandTests {

        @Test
        @DisplayName("Should deny PDF export to free users")
        void shouldDenyPdf() {
            when(entitlementEngine.canUsePdfExport(user)).thenReturn(false);

            ResponseDirective directive = service.handleInbound(message("/pdf", 2));

            assertThat(directive.getText()).contains("PDF export is a Premium feature");
            verify(pdfRenderer, never()).render(any());
        }

        @Test
        @DisplayName("Should re-render the latest document as PDF")
        void shouldExportLatestAsPdf() {
            when(entitlementEngine.canUsePdfExport(user)).thenReturn(true);
            when(generationLogRepository.findFirstByUserTelegramIdOrderByGeneratedAtDesc(USER_ID))
                    .thenReturn(Optional.of(GenerationLog.builder()
                            .jobId(3L)
                            .documentType(DocumentType.CV)
                            .template("executive")
                            .answers(completeResume())
                            .generatedAt(LocalDateTime.now(clock))
                            .build()));
            RenderedDocument pdf = new RenderedDocument("Ada Lovelace - CV.pdf", "application/pdf", new byte[]{1});
            when(pdfRenderer.render(any())).thenReturn(pdf);

            ResponseDirective directive = service.handleInbound(message("pdf", 2));

            assertThat(directive.isDocument()).isTrue();
            assertThat(directive.getDocument()).isSameAs(pdf);
            assertThat(directive.getJobId()).isNull();
        }

        @Test
        @DisplayName("Should tell the user when there is nothing to export")
        void shouldReportNothingToExport() {
            when(entitlementEngine.canUsePdfExport(user)).thenReturn(true);
            when(generationLogRepository.findFirstByUserTelegramIdOrderByGeneratedAtDesc(USER_ID))
                    .thenReturn(Optional.empty());

            assertThat(service.handleInbound(message("/pdf", 2)).getText()).contains("haven't generated");
        }

        @Test
        @DisplayName("Should offer an upgrade link to free users")
        void shouldOfferUpgrade() {
            when(paymentService.createPaymentLink(eq(user), eq("premium_upgrade"), isNull()))
                    .thenReturn(Optional.of(PaymentLink.builder()
                            .reference("cb-2").url("https://pay.example/cb-2").amount(7500)
                            .description("Career Buddy Premium (30 days)").build()));

            ResponseDirective directive = service.handleInbound(message("/upgrade", 2));

            assertThat(directive.getText()).contains("Upgrade to Premium").contains("https://pay.example/cb-2");
        }

        @Test
        @DisplayName("Should restrict admin commands to admins")
        void shouldRestrictAdminCommands() {
            assertThat(service.handleInbound(message("/stats", 2)).getText()).contains("only available to administrators");
            assertThat(service.handleInbound(message("/setpro 5", 3)).getText()).contains("only available to administrators");
            verify(userService, never()).grantPremium(any());
        }

        @Test
        @DisplayName("Should let an admin upgrade another user")
        void shouldGrantPremiumAsAdmin() {
            user = User.builder().telegramId(ADMIN_ID).tier(Tier.FREE).build();
            User target = User.builder().telegramId(5L).tier(Tier.FREE).build();
            when(userService.findByTelegramId(5L)).thenReturn(Optional.of(target));
            doAnswer(inv -> {
                target.setTier(Tier.PRO);
                target.setPremiumExpiresAt(LocalDateTime.now(clock).plusDays(30));
                return null;
            }).when(userService).grantPremium(target);

            ResponseDirective directive = service.handleInbound(message("/setpro 5", 2));

            assertThat(directive.getText()).contains("upgraded to Premium until 31 Mar 2026");
        }

        @Test
        @DisplayName("Should explain /setpro usage on a bad argument")
        void shouldExplainSetProUsage() {
            user = User.builder().telegramId(ADMIN_ID).tier(Tier.FREE).build();

            assertThat(service.handleInbound(message("/setpro abc", 2)).getText()).contains("Usage");
        }
    }

    @Test
    @DisplayName("Should move a rendered job to delivered")
    void shouldMarkDelivered() {
        Job job = Job.builder().id(7L).status(JobStatus.RENDERING).step(Step.DONE).build();
        when(jobRepository.findById(7L)).thenReturn(Optional.of(job));

        service.markDelivered(7L);

        assertThat(job.getStatus()).isEqualTo(JobStatus.DELIVERED);
    }
}
