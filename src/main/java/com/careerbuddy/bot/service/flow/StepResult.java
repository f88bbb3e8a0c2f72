package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.dto.Menu;
import com.careerbuddy.bot.model.Step;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a step handler: a reply, where the job goes next and an optional engine action.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StepResult {

    public enum Transition {
        STAY,
        ADVANCE,
        MOVE_TO
    }

    public enum Action {
        NONE,
        /** Run the entitlement check and render the document. */
        FINALIZE,
        /** Create a pay-per-document link for the job. */
        REQUEST_PAYMENT
    }

    private final String reply;
    private final Transition transition;
    private final Step target;
    private final Action action;
    private final Menu menu;

    public static StepResult stay(String reply) {
        return new StepResult(reply, Transition.STAY, null, Action.NONE, Menu.NONE);
    }

    public static StepResult stay(String reply, Menu menu) {
        return new StepResult(reply, Transition.STAY, null, Action.NONE, menu);
    }

    public static StepResult advance() {
        return advance(null);
    }

    public static StepResult advance(String reply) {
        return new StepResult(reply, Transition.ADVANCE, null, Action.NONE, Menu.NONE);
    }

    public static StepResult moveTo(Step target) {
        return moveTo(target, null);
    }

    public static StepResult moveTo(Step target, String reply) {
        return new StepResult(reply, Transition.MOVE_TO, target, Action.NONE, Menu.NONE);
    }

    public static StepResult finalizeJob() {
        return new StepResult(null, Transition.STAY, null, Action.FINALIZE, Menu.NONE);
    }

    public static StepResult requestPayment() {
        return new StepResult(null, Transition.STAY, null, Action.REQUEST_PAYMENT, Menu.NONE);
    }

    public boolean hasReply() {
        return reply != null && !reply.isBlank();
    }
}
