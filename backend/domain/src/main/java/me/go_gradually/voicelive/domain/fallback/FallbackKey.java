package me.go_gradually.voicelive.domain.fallback;

import me.go_gradually.voicelive.domain.quality.IssueType;
import me.go_gradually.voicelive.domain.quality.Severity;
import me.go_gradually.voicelive.domain.session.LocalizedPrompts;

public record FallbackKey(String language, IssueType issueType, Severity severity) {
    public FallbackKey {
        if (issueType == null || severity == null) {
            throw new IllegalArgumentException("issueType and severity are required");
        }
        language = LocalizedPrompts.baseLanguage(language);
    }

    public String asString() {
        return language + ":" + issueType + ":" + severity.code();
    }
}
