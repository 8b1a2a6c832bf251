package com.example.xagent.handler;

import com.example.xagent.model.DomainDefinition;
import com.example.xagent.model.DomainDefinition.RequirementRule;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks a definition must pass before a handler is built from it.
 * Covers the capability set every handler exposes: name, keywords, priority and at
 * least one requirement it can extract.
 */
public final class DomainDefinitionValidator {

    public static final Pattern NAME_PATTERN = Pattern.compile("^[a-z_]+$");
    public static final int MIN_KEYWORDS = 3;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    private DomainDefinitionValidator() {
    }

    /**
     * Validates a definition.
     *
     * @return the list of problems found; empty when the definition is usable
     */
    public static List<String> validate(DomainDefinition definition) {
        List<String> errors = new ArrayList<>();
        if (definition == null) {
            errors.add("Missing definition");
            return errors;
        }

        String name = definition.name();
        if (name == null || name.isBlank()) {
            errors.add("Missing required field: name");
        } else if (!NAME_PATTERN.matcher(name).matches()) {
            errors.add("Domain name must be lowercase with underscores only: " + name);
        } else if (GeneralDomainHandler.NAME.equals(name)) {
            errors.add("Domain name '" + name + "' is reserved");
        }

        List<String> keywords = definition.keywords();
        if (keywords.size() < MIN_KEYWORDS) {
            errors.add("Must have at least " + MIN_KEYWORDS + " keywords");
        }
        if (keywords.stream().anyMatch(k -> k == null || k.isBlank())) {
            errors.add("Keywords must not be blank");
        }

        int priority = definition.priorityScore();
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            errors.add("Priority score must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY
                    + ", was " + priority);
        }

        List<RequirementRule> rules = definition.requirementRules();
        if (rules.isEmpty()) {
            errors.add("Missing required field: requirementRules");
        } else if (rules.stream().anyMatch(r -> r.title() == null || r.title().isBlank())) {
            errors.add("Every requirement rule needs a title");
        }
        return errors;
    }
}
