package com.careerbuddy.bot.service.flow;

import com.careerbuddy.bot.model.Step;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class StepHandlerRegistry {

    private final Map<Step, StepHandler> handlers = new EnumMap<>(Step.class);

    @Autowired
    public StepHandlerRegistry(List<StepHandler> stepHandlers) {
        for (StepHandler handler : stepHandlers) {
            StepHandler previous = handlers.put(handler.step(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for step " + handler.step());
            }
        }
    }

    public StepHandler get(Step step) {
        StepHandler handler = handlers.get(step);
        if (handler == null) {
            throw new IllegalStateException("No handler for step " + step);
        }
        return handler;
    }
}
