package me.go_gradually.voicelive.domain.quality;

public record Issue(IssueType type, Severity severity, String transcript, double confidence, String message) {
    public Issue {
        if (type == null || severity == null) {
            throw new IllegalArgumentException("Issue type and severity are required");
        }
        transcript = transcript == null ? "" : transcript;
        message = message == null ? "" : message;
    }

    public static Issue of(IssueType type, Severity severity) {
        return new Issue(type, severity, "", 0.0, "");
    }
}
