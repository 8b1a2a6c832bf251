package com.example.xagent.handler;

import com.example.xagent.model.Priority;
import com.example.xagent.model.RequirementCategory;
import com.example.xagent.model.RequirementDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default cross-cutting requirements shared by every handler that does not define its own.
 */
final class CrossCuttingConcerns {

    private static final Pattern UPTIME = Pattern.compile("(\\d+\\.?\\d*)%\\s*uptime");
    private static final String DEFAULT_UPTIME = "99.9";

    private static final List<String> SECURITY_TERMS =
            List.of("security", "cyber", "encryption", "auth", "secure");
    private static final List<String> RELIABILITY_TERMS =
            List.of("performance", "scalability", "reliability");
    private static final List<String> REAL_TIME_TERMS =
            List.of("real-time", "realtime", "instant", "live");

    private CrossCuttingConcerns() {
    }

    static List<RequirementDraft> detect(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        List<RequirementDraft> requirements = new ArrayList<>();

        if (containsAny(lower, SECURITY_TERMS)) {
            requirements.add(new RequirementDraft(
                    "Comprehensive Cybersecurity Framework and Data Protection",
                    Priority.HIGH, RequirementCategory.NON_FUNCTIONAL));
        }

        Matcher uptime = UPTIME.matcher(lower);
        boolean hasUptime = uptime.find();
        if (hasUptime || containsAny(lower, RELIABILITY_TERMS)) {
            String target = hasUptime ? uptime.group(1) : DEFAULT_UPTIME;
            requirements.add(new RequirementDraft(
                    "System Reliability and Performance (" + target + "% uptime requirement)",
                    Priority.HIGH, RequirementCategory.NON_FUNCTIONAL));
        }

        if (containsAny(lower, REAL_TIME_TERMS)) {
            requirements.add(new RequirementDraft(
                    "Real-Time Data Processing and Event Handling System",
                    Priority.HIGH, RequirementCategory.NON_FUNCTIONAL));
        }
        return requirements;
    }

    static boolean containsAny(String lowerContent, List<String> terms) {
        for (String term : terms) {
            if (term != null && lowerContent.contains(term.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
