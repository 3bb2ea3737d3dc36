package me.go_gradually.voicelive.application.interruption.usecase;

import me.go_gradually.voicelive.application.interruption.model.ResponderReply;
import me.go_gradually.voicelive.application.interruption.model.ResponderRequest;
import me.go_gradually.voicelive.application.pipeline.model.GenerationOptions;
import me.go_gradually.voicelive.application.pipeline.port.GenerationGateway;
import me.go_gradually.voicelive.domain.adaptive.ResponseSettings;
import me.go_gradually.voicelive.domain.interruption.InterruptionContext;
import me.go_gradually.voicelive.domain.interruption.InterruptionPrompts;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;

import java.util.Random;

public class InterruptionAwareResponder {
    private final GenerationGateway generation;
    private final Random random;

    public InterruptionAwareResponder(GenerationGateway generation, Random random) {
        this.generation = generation;
        this.random = random;
    }

    public ResponderReply respond(ResponderRequest request) throws Exception {
        InterruptionContext context = request.context();
        ResponseSettings settings = request.settings() == null ? ResponseSettings.normal() : request.settings();
        InterruptionType type = request.interruption();
        if (type == null && context != null) {
            type = context.type();
        }

        String prompt = context == null
                ? request.userMessage()
                : InterruptionPrompts.contextualPrompt(context, request.userMessage());
        String instruction = InterruptionPrompts.systemInstruction(type, settings);
        if (request.sessionInstruction() != null && !request.sessionInstruction().isBlank()) {
            instruction = request.sessionInstruction() + "\n\n" + instruction;
        }

        String text = generation.generate(prompt, new GenerationOptions(instruction, settings.maxTokens()));
        String reply = text == null ? "" : text.trim();
        String acknowledgment = "";
        if (type != null && type.acknowledges()) {
            synchronized (random) {
                acknowledgment = InterruptionPrompts.acknowledgment(type, request.language(), random);
            }
        }
        return new ResponderReply(reply, acknowledgment, context != null);
    }

    public String resumePhrase(InterruptionContext context, String language) {
        synchronized (random) {
            return InterruptionPrompts.resumePhrase(context, language, random);
        }
    }
}
