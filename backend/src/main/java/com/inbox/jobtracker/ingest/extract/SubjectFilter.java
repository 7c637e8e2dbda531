package com.inbox.jobtracker.ingest.extract;

import com.inbox.jobtracker.config.TrackerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword heuristic deciding whether a subject line looks like job-application mail.
 * A single keyword hit is enough.
 */
@Component
public class SubjectFilter {
    private final List<String> keywords;

    @Autowired
    public SubjectFilter(TrackerProperties properties) {
        this(properties.getFilter().getKeywords());
    }

    SubjectFilter(List<String> keywords) {
        this.keywords = keywords.stream()
            .map(keyword -> keyword.toLowerCase(Locale.ROOT))
            .toList();
    }

    public boolean isJobRelated(String subject) {
        if (subject == null || subject.isEmpty()) {
            return false;
        }
        String lower = subject.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
