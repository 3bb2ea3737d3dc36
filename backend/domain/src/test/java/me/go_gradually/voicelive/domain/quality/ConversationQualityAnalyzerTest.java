package me.go_gradually.voicelive.domain.quality;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationQualityAnalyzerTest {

    @Test
    void analyze_flagsVeryLowConfidenceAsCriticalAndRecommendsRepeat() {
        TranscriptionResult result = new TranscriptionResult(true, "I want to check balance", 0.25, true, "en-IN");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        assertEquals(1, issues.size());
        assertEquals(IssueType.LOW_CONFIDENCE, issues.get(0).type());
        assertEquals(Severity.CRITICAL, issues.get(0).severity());
        assertEquals("Very low confidence: 25%", issues.get(0).message());
        assertEquals(RecommendedAction.REQUEST_REPEAT, ConversationQualityAnalyzer.recommendedAction(issues));
    }

    @Test
    void analyze_returnsSingleCriticalEmptyIssueForFailedTranscription() {
        List<Issue> failed = ConversationQualityAnalyzer.analyze(TranscriptionResult.failed(), "en");
        List<Issue> blank = ConversationQualityAnalyzer.analyze(
                new TranscriptionResult(true, "   ", 0.99, true, "en"), "en");

        for (List<Issue> issues : List.of(failed, blank)) {
            assertEquals(1, issues.size());
            assertEquals(IssueType.EMPTY_TRANSCRIPT, issues.get(0).type());
            assertEquals(Severity.CRITICAL, issues.get(0).severity());
        }
    }

    @Test
    void analyze_returnsNoIssuesForClearTranscript() {
        TranscriptionResult result = new TranscriptionResult(true, "please tell me my account balance", 0.95, true, "en-US");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en-IN");

        assertTrue(issues.isEmpty());
        assertEquals(RecommendedAction.CONTINUE, ConversationQualityAnalyzer.recommendedAction(issues));
        assertEquals(1.0, ConversationQualityAnalyzer.qualityScore(issues));
    }

    @Test
    void analyze_runsIndependentChecksOnOneTranscript() {
        TranscriptionResult result = new TranscriptionResult(true, "hello [noise]", 0.55, true, "en");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        assertTrue(hasIssue(issues, IssueType.LOW_CONFIDENCE, Severity.MEDIUM));
        assertTrue(hasIssue(issues, IssueType.PARTIAL_RECOGNITION, Severity.MEDIUM));
        assertTrue(hasIssue(issues, IssueType.BACKGROUND_NOISE, Severity.HIGH));
        assertEquals(RecommendedAction.SUGGEST_QUIET_LOCATION, ConversationQualityAnalyzer.recommendedAction(issues));
    }

    @Test
    void analyze_detectsFillerOnlySpeech() {
        TranscriptionResult result = new TranscriptionResult(true, "um uh actually basically", 0.9, true, "en");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        assertTrue(hasIssue(issues, IssueType.INCOHERENT_SPEECH, Severity.HIGH));
        assertEquals(RecommendedAction.REQUEST_CLARIFICATION, ConversationQualityAnalyzer.recommendedAction(issues));
    }

    @Test
    void analyze_detectsStuttering() {
        TranscriptionResult result = new TranscriptionResult(true, "I need need the loan details", 0.9, true, "en");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        assertTrue(hasIssue(issues, IssueType.INCOHERENT_SPEECH, Severity.MEDIUM));
    }

    @Test
    void analyze_detectsFragmentedSpeech() {
        TranscriptionResult result = new TranscriptionResult(true, "a b c to go", 0.9, true, "en");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        assertTrue(issues.stream().anyMatch(issue -> issue.message().equals("Fragmented speech detected")));
    }

    @Test
    void analyze_countsEveryRepeatBeyondSecondOccurrence() {
        TranscriptionResult result = new TranscriptionResult(true,
                "pay bill pay bill pay bill pay bill now please", 0.95, true, "en");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        assertEquals(1, issues.size());
        assertEquals("Excessive word repetition", issues.get(0).message());
        assertEquals(Severity.HIGH, issues.get(0).severity());
        assertEquals(RecommendedAction.REQUEST_CLARIFICATION, ConversationQualityAnalyzer.recommendedAction(issues));
    }

    @Test
    void analyze_reportsOnlyFirstCoherenceProblem() {
        TranscriptionResult result = new TranscriptionResult(true, "a b c d need need", 0.95, true, "en");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        List<Issue> incoherent = issues.stream().filter(issue -> issue.type() == IssueType.INCOHERENT_SPEECH).toList();
        assertEquals(1, incoherent.size());
        assertEquals("Fragmented speech detected", incoherent.get(0).message());
    }

    @Test
    void analyze_comparesBaseLanguageOnly() {
        TranscriptionResult sameBase = new TranscriptionResult(true, "what is my balance today", 0.9, true, "hi-IN");
        TranscriptionResult otherBase = new TranscriptionResult(true, "what is my balance today", 0.9, true, "ta-IN");

        assertFalse(hasType(ConversationQualityAnalyzer.analyze(sameBase, "hi"), IssueType.LANGUAGE_MISMATCH));
        List<Issue> mismatch = ConversationQualityAnalyzer.analyze(otherBase, "hi");
        assertTrue(hasIssue(mismatch, IssueType.LANGUAGE_MISMATCH, Severity.MEDIUM));
        assertEquals(RecommendedAction.OFFER_LANGUAGE_SWITCH, ConversationQualityAnalyzer.recommendedAction(mismatch));
    }

    @Test
    void analyze_flagsPunctuationOnlyTranscriptAsEmpty() {
        TranscriptionResult result = new TranscriptionResult(true, "... ?!", 0.9, false, "en");

        List<Issue> issues = ConversationQualityAnalyzer.analyze(result, "en");

        assertTrue(hasIssue(issues, IssueType.EMPTY_TRANSCRIPT, Severity.CRITICAL));
    }

    @Test
    void recommendedAction_mapsNonCriticalLowConfidenceToClarification() {
        List<Issue> issues = List.of(Issue.of(IssueType.LOW_CONFIDENCE, Severity.HIGH));

        assertEquals(RecommendedAction.REQUEST_CLARIFICATION, ConversationQualityAnalyzer.recommendedAction(issues));
    }

    @Test
    void recommendedAction_continuesWithCautionForPartialRecognition() {
        List<Issue> issues = List.of(Issue.of(IssueType.PARTIAL_RECOGNITION, Severity.MEDIUM));

        RecommendedAction action = ConversationQualityAnalyzer.recommendedAction(issues);

        assertEquals(RecommendedAction.CONTINUE_WITH_CAUTION, action);
        assertFalse(action.requiresFallback());
    }

    @Test
    void qualityScore_subtractsSeverityPenaltiesWithFloor() {
        assertEquals(0.5, ConversationQualityAnalyzer.qualityScore(List.of(
                Issue.of(IssueType.LOW_CONFIDENCE, Severity.HIGH),
                Issue.of(IssueType.PARTIAL_RECOGNITION, Severity.MEDIUM))), 1e-9);
        assertEquals(0.0, ConversationQualityAnalyzer.qualityScore(List.of(
                Issue.of(IssueType.EMPTY_TRANSCRIPT, Severity.CRITICAL),
                Issue.of(IssueType.LOW_CONFIDENCE, Severity.CRITICAL),
                Issue.of(IssueType.BACKGROUND_NOISE, Severity.HIGH))), 1e-9);
    }

    @Test
    void message_fallsBackToEnglishForUnknownLanguage() {
        assertEquals("I didn't quite catch that. Could you please repeat?",
                ConversationQualityAnalyzer.message(RecommendedAction.REQUEST_REPEAT, "fr"));
        assertEquals("", ConversationQualityAnalyzer.message(RecommendedAction.CONTINUE, "en"));
    }

    @Test
    void primaryIssue_picksHighestSeverity() {
        Issue medium = Issue.of(IssueType.PARTIAL_RECOGNITION, Severity.MEDIUM);
        Issue high = Issue.of(IssueType.BACKGROUND_NOISE, Severity.HIGH);

        assertEquals(high, ConversationQualityAnalyzer.primaryIssue(List.of(medium, high)));
    }

    private static boolean hasIssue(List<Issue> issues, IssueType type, Severity severity) {
        return issues.stream().anyMatch(issue -> issue.type() == type && issue.severity() == severity);
    }

    private static boolean hasType(List<Issue> issues, IssueType type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }
}
