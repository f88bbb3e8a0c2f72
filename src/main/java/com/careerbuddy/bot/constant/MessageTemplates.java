package com.careerbuddy.bot.constant;

/**
 * User facing texts. All of them are sent with Telegram HTML parse mode, so user supplied values
 * must go through {@code MessageUtils.escapeHtml} before being formatted in.
 */
public class MessageTemplates {

    public static final String WELCOME = """
            👋 <b>Welcome to Career Buddy!</b>

            I help you build a professional resume, CV or cover letter, or revamp the one you already have.

            Choose a document to get started:""";

    public static final String ACTIVE_JOB_NOTE = "\n\nYou have an unfinished <b>%s</b>. Select it again to continue where you left off.";

    public static final String HELP = """
            🤖 <b>Career Buddy - Help</b>

            <b>📝 Documents</b>
            • <b>Resume</b> - 1-2 page professional resume
            • <b>CV</b> - detailed curriculum vitae
            • <b>Cover Letter</b> - Premium feature
            • <b>Revamp</b> - improve your existing resume

            <b>🎯 How it works</b>
            1. Choose a document type
            2. Answer my questions step by step
            3. I polish your content with AI
            4. You receive your finished document

            <b>💡 Commands</b>
            /start - choose a document
            /status - your plan and remaining documents
            /history - your recent documents
            /upgrade - get Premium
            /pdf - latest document as PDF (Premium)
            /reset - start the current document over
            /cancel - drop the current document
            /help - this message

            Send <b>skip</b> to skip optional steps and <b>continue</b> to see AI results.""";

    public static final String CHOOSE_DOCUMENT_FIRST = "Please choose a document to create first.";

    public static final String RESUMING = "▶️ Resuming your <b>%s</b>.";

    public static final String STARTING = "📝 Let's create your <b>%s</b>!";

    public static final String PROGRESS = "📊 <b>Progress:</b> %s";

    // --- resume / cv steps ---

    public static final String PROMPT_BASICS = """
            Let's start with your details.
            Send them in one line, comma-separated:
            <b>Full Name, Email, Phone, City Country</b>

            <i>Example:</i> John Doe, john@example.com, +234 801 234 5678, Lagos Nigeria""";

    public static final String ERR_BASICS = "Please send at least your full name and a valid email, separated by commas.";

    public static final String EXAMPLE_BASICS = "John Doe, john@example.com, +234 801 234 5678, Lagos Nigeria";

    public static final String PROMPT_TARGET_ROLE = """
            What role or position are you applying for?

            <i>Example:</i> Data Analyst""";

    public static final String ERR_TARGET_ROLE = "Please tell me the role you are applying for.";

    public static final String EXAMPLE_TARGET_ROLE = "Backend Engineer";

    public static final String PROMPT_EXPERIENCE_HEADER = """
            Let's add a work experience.
            Send: <b>Role, Company, City, Start, End</b>

            <i>Example:</i> Backend Engineer, TechCorp, Lagos, Jan 2020, Present

            Type <b>skip</b> if you don't have work experience yet.""";

    public static final String ERR_EXPERIENCE_HEADER = "Please send at least the role and the company, separated by commas.";

    public static final String EXAMPLE_EXPERIENCE_HEADER = "Backend Engineer, TechCorp, Lagos, Jan 2020, Present";

    public static final String PROMPT_BULLETS = """
            Great! Now send 2-4 achievements for <b>%s</b>, one per message.

            <i>Example:</i> Increased sales by 40%% through targeted campaigns

            Type <b>done</b> when finished.""";

    public static final String BULLET_ADDED = "Got it! (%d bullet%s added)\nSend another bullet point or type <b>done</b> to continue.";

    public static final String ERR_BULLET = "Please describe one achievement per message.";

    public static final String ERR_BULLET_LIMIT = "You already have %d bullets for this role. Type <b>done</b> to continue.";

    public static final String EXAMPLE_BULLET = "Cut report preparation time by 60% by automating the monthly pipeline";

    public static final String PROMPT_ADD_ANOTHER_EXPERIENCE = "Add another experience? (<b>yes</b> / <b>no</b>)";

    public static final String ERR_YES_NO = "Please reply <b>yes</b> or <b>no</b>.";

    public static final String PROMPT_EDUCATION = """
            🎓 Education: <b>Degree, School, Year</b>

            <i>Example:</i> B.Sc. Computer Science, University of Lagos, 2020

            Send one entry per message, or type <b>skip</b>.""";

    public static final String ERR_EDUCATION = "Please use: Degree, School, Year";

    public static final String EXAMPLE_EDUCATION = "B.Sc. Computer Science, University of Lagos, 2020";

    public static final String PROMPT_CERTIFICATIONS = """
            📜 Any certifications?

            <i>Example:</i> AWS Certified Solutions Architect, 2023

            Send one per message, or type <b>skip</b>.""";

    public static final String EXAMPLE_CERTIFICATION = "AWS Certified Solutions Architect, 2023";

    public static final String PROMPT_PROFILES = """
            🔗 Add your online profiles: <b>Platform, URL</b>

            <i>Example:</i> LinkedIn, https://linkedin.com/in/yourname

            Send one per message, or type <b>skip</b>.""";

    public static final String ERR_PROFILES = "Please use: Platform, URL";

    public static final String EXAMPLE_PROFILE = "GitHub, https://github.com/yourname";

    public static final String PROMPT_PROJECTS = """
            🛠 Any projects worth mentioning?

            <i>Example:</i> Built an e-commerce platform using React and Node.js

            Send one per message, or type <b>skip</b>.""";

    public static final String EXAMPLE_PROJECT = "Built an e-commerce platform using React and Node.js";

    public static final String ERR_ENTRY_EMPTY = "Please send the details in one message.";

    public static final String ENTRY_ADDED = "✅ Added. Send another or type <b>done</b> to continue.";

    public static final String SKILLS_SELECTION = """
            🤖 Based on your target role, here are some suggested skills:

            %s

            📌 <b>Select 3 to 5 skills</b> by sending their numbers (comma-separated).
            Or type your own skills, comma-separated.""";

    public static final String ERR_SKILLS = "Please pick 3 to 5 numbers from the list, or type at least 3 skills of your own.";

    public static final String EXAMPLE_SKILLS = "1,3,5";

    public static final String GENERATING = "⏳ I'm preparing your %s. Send <b>continue</b> in a few seconds to see it.";

    public static final String PROMPT_PERSONAL_INFO = """
            💬 Tell me a little about yourself: strengths, traits or what drives you at work.
            This helps me write your summary.

            <i>Example:</i> Detail-oriented, calm under pressure, love mentoring juniors

            Type <b>skip</b> to leave it out.""";

    public static final String SUMMARY_SHOW = """
            ✨ <b>Professional Summary</b>

            %s

            ✅ Happy with this? Type <b>yes</b> to continue.
            Or send your own summary to replace it.""";

    public static final String ERR_SUMMARY_SHORT = "Your summary is a little short. Write 2-3 sentences, or type <b>yes</b> to keep the suggestion.";

    public static final String EXAMPLE_SUMMARY = "Data Analyst with 5+ years building dashboards for retail teams.";

    // --- cover letter steps ---

    public static final String PROMPT_ROLE_COMPANY = """
            Which role and company are you applying to?
            Format: <b>Position Title, Company Name</b>

            <i>Example:</i> Senior HR Manager, Google""";

    public static final String ERR_ROLE_COMPANY = "Please send: Position Title, Company Name";

    public static final String EXAMPLE_ROLE_COMPANY = "Senior HR Manager, Google";

    public static final String PROMPT_EXPERIENCE_OVERVIEW = """
            How many years of experience do you have, and in which industries?
            Format: <b>Years, Industries</b>

            <i>Example:</i> 15 years, HR and Talent Management""";

    public static final String ERR_EXPERIENCE_OVERVIEW = "Please send: Years of experience, Industries";

    public static final String EXAMPLE_EXPERIENCE_OVERVIEW = "15 years, HR and Talent Management";

    public static final String PROMPT_INTEREST_REASON = """
            Why are you interested in this role or company?

            <i>Example:</i> I admire your commitment to employee development""";

    public static final String EXAMPLE_INTEREST_REASON = "I admire your commitment to employee development";

    public static final String PROMPT_CURRENT_ROLE = """
            What is your current (or most recent) job title and employer?
            Format: <b>Job Title, Employer</b>

            <i>Example:</i> HR Director, Microsoft""";

    public static final String ERR_CURRENT_ROLE = "Please send: Job Title, Employer";

    public static final String EXAMPLE_CURRENT_ROLE = "HR Director, Microsoft";

    public static final String PROMPT_ACHIEVEMENT_1 = """
            🏆 Describe a key achievement with a measurable result.

            <i>Example:</i> Redesigned the hiring process, cutting time to hire by 35%""";

    public static final String EXAMPLE_ACHIEVEMENT = "Redesigned the hiring process, cutting time to hire by 35%";

    public static final String PROMPT_ACHIEVEMENT_2 = """
            Share another key achievement (optional).

            <i>Example:</i> Led workforce planning during expansion, saving 40% in costs

            Or type <b>skip</b> to continue.""";

    public static final String PROMPT_KEY_SKILLS = """
            List 3-5 key skills most relevant to this role, comma-separated.

            <i>Example:</i> Performance management, HRIS, Employee relations""";

    public static final String ERR_KEY_SKILLS = "Please list between 3 and 5 skills separated by commas.";

    public static final String EXAMPLE_KEY_SKILLS = "Performance management, HRIS, Employee relations";

    public static final String PROMPT_COMPANY_GOAL = """
            What goal at <b>%s</b> do you want to help with?

            <i>Example:</i> Building a more inclusive workplace culture""";

    public static final String EXAMPLE_COMPANY_GOAL = "Building a more inclusive workplace culture";

    public static final String ERR_TEXT_REQUIRED = "Please send a short answer.";

    // --- revamp ---

    public static final String PROMPT_UPLOAD = """
            📄 <b>Resume Revamp</b>

            I'll improve your existing resume with AI.

            Upload it as a <b>.pdf</b> or <b>.txt</b> file, or paste its full text here.
            <i>Maximum file size: 10MB</i>""";

    public static final String ERR_UPLOAD_SHORT = "That text is too short to be a resume. Upload a file or paste the full text (at least %d characters).";

    public static final String ERR_UPLOAD_FORMAT = "I can read .pdf and .txt files. Please upload one of those, or paste the text.";

    public static final String ERR_UPLOAD_EMPTY = "I couldn't find any text in that file. Try another file or paste the text.";

    public static final String ERR_UPLOAD_TOO_LARGE = "That file is too large. The maximum size is 10MB.";

    public static final String ERR_UPLOAD_UNREADABLE = "I couldn't open that file. Please try again or paste the text.";

    public static final String EXAMPLE_UPLOAD = "Attach resume.pdf";

    public static final String REVAMP_SHOW = """
            🎯 <b>AI-Enhanced Resume</b>

            %s

            ✅ Reply <b>yes</b> to continue, or paste your own edited version.""";

    // --- preview / finalize ---

    public static final String PREVIEW_FOOTER = "\n\nLooks good? Reply <b>yes</b> to generate your document, or /reset to start over.";

    public static final String ERR_PREVIEW_INCOMPLETE = "Some details are still missing: %s. Type /reset to start over.";

    public static final String PREVIEW_CHANGES = "To make changes, type /reset to start over.\nOr reply <b>yes</b> to generate your document.";

    public static final String PROMPT_TEMPLATE = """
            🎨 <b>Choose a template</b>

            1. Classic
            2. Modern
            3. Executive

            Tap a button or reply with a number.""";

    public static final String ERR_TEMPLATE = "Please choose 1, 2 or 3.";

    public static final String EXAMPLE_TEMPLATE = "2";

    public static final String PROMPT_FINALIZE = "Reply <b>yes</b> to generate your document.";

    public static final String DONE = "Your document has been sent! Type /reset to create another one, or /start to see the menu.";

    public static final String DOCUMENT_CAPTION = "✅ Your %s is ready!";

    public static final String QUOTA_EXCEEDED = """
            📊 <b>%s quota reached</b>

            You've used all %d of your %s plan's %s documents this cycle.

            💳 Reply <b>pay</b> to get this document for %s %,d
            ⭐ Or type /upgrade for Premium.""";

    public static final String NOT_ALLOWED = """
            🔒 <b>%s is a Premium feature</b>

            Upgrade to Premium to unlock:
            • 2 Resumes + 2 CVs per month
            • 1 Cover Letter per month
            • PDF format
            • 3 professional templates

            Type /upgrade to get started!""";

    public static final String PAY_NOT_OFFERED = "Payment isn't needed right now. Reply <b>yes</b> to generate your document.";

    // --- pdf / payments / upgrade ---

    public static final String PDF_DENIED = """
            🔒 <b>PDF export is a Premium feature</b>

            Type /upgrade to unlock PDF downloads.""";

    public static final String PDF_NOTHING = "You haven't generated any documents yet. Type /start to create one.";

    public static final String PAYMENT_LINK = """
            💳 <b>Payment link created</b>

            %s
            Amount: %s %,d

            <a href="%s">Click here to pay</a>

            I'll let you know as soon as the payment is confirmed.""";

    public static final String PAYMENT_UNAVAILABLE = "❌ Sorry, payments are unavailable right now. Please try again later.";

    public static final String AWAITING_PAYMENT = """
            ⏳ Waiting for your payment to be confirmed. I'll message you as soon as it arrives.

            Type /reset to cancel.""";

    public static final String PAYMENT_DOCUMENT_CONFIRMED = "✅ Payment received! Reply <b>yes</b> to generate your %s.";

    public static final String PAYMENT_PREMIUM_CONFIRMED = """
            🎉 <b>Welcome to Premium!</b>

            📦 <b>Your monthly package:</b>
            • 📄 2 Resumes
            • 📄 2 CVs
            • 💼 1 Cover Letter
            • ✨ 1 Revamp
            • 📱 PDF format
            • 🎨 3 professional templates

            Type /start to create your next document!""";

    public static final String UPGRADE_OFFER = """
            ⭐ <b>Upgrade to Premium - %s %,d/month</b>

            <b>FREE:</b> 1 Resume, 1 CV, 1 Revamp per month, no cover letters, no PDF
            <b>PREMIUM:</b> 2 Resumes, 2 CVs, 1 Cover Letter, 1 Revamp per month, PDF and templates

            📅 Quota resets every 30 days.""";

    public static final String ALREADY_PREMIUM = """
            ✅ <b>You're already Premium!</b>

            %s

            Type /status for full details.""";

    // --- reset / cancel ---

    public static final String RESET_NOTHING = "Nothing to reset. Type /start to choose a document.";

    public static final String RESET_STARTED = "🔄 Starting your <b>%s</b> over.";

    public static final String RESET_CLOSED = "🔄 Done. Type /start to create another document.";

    public static final String CANCELLED = "❌ Your <b>%s</b> has been cancelled. Type /start whenever you're ready.";

    public static final String CANCEL_NOTHING = "There is nothing to cancel. Type /start to choose a document.";

    public static final String SKIP_NOT_ALLOWED = "This step can't be skipped.";

    // --- status / history ---

    public static final String STATUS_HEADER = "📊 <b>Your Account Status</b>\n\n🎯 Plan: %s\n\n📦 <b>Monthly Quota:</b>\n";

    public static final String STATUS_LINE = "• %s: %d/%d used (%d remaining)\n";

    public static final String STATUS_LINE_LOCKED = "• %s: 🔒 Premium only\n";

    public static final String STATUS_ADMIN = """
            👑 <b>Admin Account Status</b>

            🎯 Plan: <b>ADMIN</b> (unlimited access)

            📄 Resume: ∞
            📄 CV: ∞
            💼 Cover Letter: ∞
            ✨ Revamp: ∞
            📱 PDF Format: ✅ Enabled""";

    public static final String STATUS_PDF = "\n📱 PDF Format: %s\n";

    public static final String STATUS_RESET_AT = "⏰ Quota resets: %s\n";

    public static final String STATUS_EXPIRES_AT = "⭐ Premium expires: %s\n";

    public static final String STATUS_UPSELL = "\n💡 Type /upgrade to unlock more documents, cover letters and PDF.";

    public static final String HISTORY_HEADER = "📚 <b>Your Recent Documents</b>\n\n";

    public static final String HISTORY_LINE = "%d. <b>%s</b> - %s (%s)\n";

    public static final String HISTORY_EMPTY = "📚 You haven't created any documents yet. Type /start to begin!";

    // --- admin ---

    public static final String ADMIN_ONLY = "⚠️ This command is only available to administrators.";

    public static final String STATS = """
            📊 <b>Career Buddy Stats</b>

            👥 Users: %d
            ⭐ Premium: %d
            🆓 Free: %d
            📄 Documents generated: %d
            💳 Paid documents: %d""";

    public static final String SETPRO_USAGE = "👤 <b>Usage:</b> /setpro &lt;telegram_user_id&gt;";

    public static final String SETPRO_NOT_FOUND = "❌ No user found with Telegram ID <code>%s</code>.";

    public static final String SETPRO_ALREADY = "ℹ️ User <code>%d</code> is already Premium until %s.";

    public static final String SETPRO_ADMIN = "ℹ️ User <code>%d</code> is an administrator and already has unlimited access.";

    public static final String SETPRO_DONE = "✅ User <code>%d</code> upgraded to Premium until %s.";

    // --- scheduler ---

    public static final String PREMIUM_REMINDER = "⏰ Your Premium plan expires in %d day%s. Type /upgrade to renew.";

    public static final String PREMIUM_ENDED = "Your Premium plan has ended and your account is back on the Free plan. Type /upgrade to renew.";

    // --- errors ---

    public static final String VALIDATION_ERROR = "❌ %s";

    public static final String VALIDATION_EXAMPLE = "\n\n<i>Example:</i> %s";

    public static final String GENERIC_ERROR = "😔 Sorry, something went wrong on our side. Please send your message again.";

    private MessageTemplates() {
    }
}
