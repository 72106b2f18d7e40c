package com.ryuqq.tripplan.core.command;

import com.ryuqq.tripplan.core.outcome.Fail;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 필수 입력값 누락 검사.
 *
 * <pre>
 * Optional&lt;Fail&gt; missing = new RequiredFields("flight")
 *     .text("company", company)
 *     .value("departure", departure)
 *     .check();
 * </pre>
 */
final class RequiredFields {

    private final String subject;
    private final List<String> missing = new ArrayList<>();

    RequiredFields(String subject) {
        this.subject = subject;
    }

    RequiredFields text(String field, String value) {
        if (value == null || value.isBlank()) {
            missing.add(field);
        }
        return this;
    }

    RequiredFields value(String field, Object value) {
        if (value == null) {
            missing.add(field);
        }
        return this;
    }

    Optional<Fail> check() {
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Fail.validation(
            "Missing required " + subject + " fields: " + String.join(", ", missing)));
    }
}
