package me.go_gradually.voicelive.application.interruption.usecase;

import me.go_gradually.voicelive.application.interruption.model.ResponderReply;
import me.go_gradually.voicelive.application.interruption.model.ResponderRequest;
import me.go_gradually.voicelive.application.pipeline.model.GenerationOptions;
import me.go_gradually.voicelive.application.pipeline.port.GenerationGateway;
import me.go_gradually.voicelive.domain.adaptive.ResponseSettings;
import me.go_gradually.voicelive.domain.adaptive.ResponseStyle;
import me.go_gradually.voicelive.domain.interruption.InterruptionContext;
import me.go_gradually.voicelive.domain.interruption.InterruptionEvent;
import me.go_gradually.voicelive.domain.interruption.InterruptionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InterruptionAwareResponderTest {

    private static final String LAST_REPLY = "Your savings account earns four percent interest paid every quarter on the balance";

    @Mock
    private GenerationGateway generation;

    private InterruptionAwareResponder responder;

    @BeforeEach
    void setUp() {
        responder = new InterruptionAwareResponder(generation, new Random(3));
    }

    @Test
    void respond_bargeInBuildsContextualPromptWithoutAcknowledgment() throws Exception {
        InterruptionContext context = context(InterruptionType.BARGE_IN, 0.5);
        when(generation.generate(anyString(), any())).thenReturn("  Fees are waived for the first year.  ");

        ResponderReply reply = responder.respond(new ResponderRequest(
                "and the fees?", context, null, "en", ResponseSettings.normal(), null));

        assertTrue(context.canResume());
        assertEquals("", reply.acknowledgment());
        assertEquals("Fees are waived for the first year.", reply.spokenText());
        assertTrue(reply.usedContext());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generation).generate(prompt.capture(), any());
        assertTrue(prompt.getValue().contains("I was saying: \"Your savings account earns four percent\""));
        assertTrue(prompt.getValue().contains("50% through my response"));
        assertTrue(prompt.getValue().endsWith("User's message: and the fees?"));
    }

    @Test
    void respond_clarificationPrefixesAcknowledgment() throws Exception {
        InterruptionContext context = context(InterruptionType.CLARIFICATION, 0.4);
        when(generation.generate(anyString(), any())).thenReturn("Interest is paid four times a year.");

        ResponderReply reply = responder.respond(new ResponderRequest(
                "what do you mean quarterly", context, null, "en", ResponseSettings.normal(), null));

        List<String> english = List.of("Let me clarify: ", "Sure, ", "Of course - ", "To explain that - ");
        assertTrue(english.contains(reply.acknowledgment()));
        assertTrue(reply.spokenText().startsWith(reply.acknowledgment()));
        assertTrue(reply.spokenText().endsWith("Interest is paid four times a year."));
    }

    @Test
    void respond_correctionAcknowledgesWithoutResumableContext() throws Exception {
        when(generation.generate(eq("no, I meant the current account"), any())).thenReturn("The current account pays no interest.");

        ResponderReply reply = responder.respond(new ResponderRequest(
                "no, I meant the current account", null, InterruptionType.CORRECTION, "en",
                ResponseSettings.normal(), null));

        List<String> english = List.of("Oh, I understand now. ", "You're right, ", "Got it - ", "I see, ");
        assertTrue(english.contains(reply.acknowledgment()));
        assertEquals(reply.acknowledgment() + "The current account pays no interest.", reply.spokenText());
        assertFalse(reply.usedContext());
        ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);
        verify(generation).generate(anyString(), options.capture());
        assertTrue(options.getValue().systemInstruction().contains("The user corrected you."));
    }

    @Test
    void respond_urgentInterruptionOverridesOlderResumableContext() throws Exception {
        InterruptionContext older = context(InterruptionType.BARGE_IN, 0.5);
        when(generation.generate(anyString(), any())).thenReturn("I have blocked your card.");

        ResponderReply reply = responder.respond(new ResponderRequest(
                "block my card now", older, InterruptionType.URGENT, "en", ResponseSettings.normal(), null));

        List<String> english = List.of("Yes, I'm here. ", "What do you need? ", "I'm listening - ", "Yes? ");
        assertTrue(english.contains(reply.acknowledgment()));
        assertTrue(reply.spokenText().endsWith("I have blocked your card."));
        ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);
        verify(generation).generate(anyString(), options.capture());
        assertTrue(options.getValue().systemInstruction().contains("The user interrupted urgently."));
    }

    @Test
    void respond_plainMessageWithoutContext() throws Exception {
        when(generation.generate(eq("hello there friend"), any())).thenReturn("Hi!");

        ResponderReply reply = responder.respond(new ResponderRequest(
                "hello there friend", null, null, "en", null, "You are a bank assistant."));

        assertFalse(reply.usedContext());
        assertEquals("Hi!", reply.spokenText());
        ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);
        verify(generation).generate(anyString(), options.capture());
        assertTrue(options.getValue().systemInstruction().startsWith("You are a bank assistant."));
        assertEquals(ResponseSettings.normal().maxTokens(), options.getValue().maxTokens());
    }

    @Test
    void respond_conciseStyleLimitsTokensAndWords() throws Exception {
        when(generation.generate(anyString(), any())).thenReturn("Short answer.");

        responder.respond(new ResponderRequest(
                "tell me about loans", null, null, "en", new ResponseSettings(ResponseStyle.CONCISE, 50), null));

        ArgumentCaptor<GenerationOptions> options = ArgumentCaptor.forClass(GenerationOptions.class);
        verify(generation).generate(anyString(), options.capture());
        assertEquals(100, options.getValue().maxTokens());
        assertTrue(options.getValue().systemInstruction().contains("Keep responses under 50 words"));
    }

    @Test
    void resumePhrase_mentionsRemainingOrSpokenText() {
        InterruptionContext context = context(InterruptionType.BARGE_IN, 0.5);

        String phrase = responder.resumePhrase(context, "en");

        assertTrue(phrase.contains("every quarter") || phrase.contains("Your savings account"));
    }

    private static InterruptionContext context(InterruptionType type, double progress) {
        InterruptionEvent event = new InterruptionEvent(type, progress, "", 0.9, 0.5, Instant.parse("2026-01-01T00:00:00Z"));
        return InterruptionContext.from(event, LAST_REPLY);
    }
}
