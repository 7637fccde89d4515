package com.company.scheduler.service;

import com.company.scheduler.domain.enums.TargetRule;
import com.company.scheduler.util.LenientNumbers;
import org.springframework.stereotype.Service;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether an actual value misses its target. Unparseable input is
 * never a violation.
 */
@Service
public class ViolationEvaluator {

    // a,b  {a,b}  [a,b]
    private static final Pattern RANGE =
            Pattern.compile("^[{\\[]?\\s*(-?[\\d.]+)\\s*,\\s*(-?[\\d.]+)\\s*[}\\]]?$");

    public boolean isViolation(String rule, String targetText, String actualText) {
        return isViolation(TargetRule.fromCode(rule), targetText, actualText);
    }

    public boolean isViolation(TargetRule rule, String targetText, String actualText) {
        if (isBlank(targetText) || isBlank(actualText)) {
            return false;
        }

        OptionalDouble actual = LenientNumbers.parse(actualText);
        if (actual.isEmpty()) {
            return false;
        }

        TargetRule effective = rule != null ? rule : TargetRule.GTE;
        switch (effective) {
            case GTE: {
                OptionalDouble target = LenientNumbers.parse(targetText);
                return target.isPresent() && actual.getAsDouble() < target.getAsDouble();
            }
            case LTE: {
                OptionalDouble target = LenientNumbers.parse(targetText);
                return target.isPresent() && actual.getAsDouble() > target.getAsDouble();
            }
            case WITHIN_RANGE:
                return outsideRange(targetText, actual.getAsDouble());
            default:
                return false;
        }
    }

    private boolean outsideRange(String targetText, double actual) {
        Matcher matcher = RANGE.matcher(targetText.trim());
        if (!matcher.matches()) {
            return false;
        }
        OptionalDouble min = LenientNumbers.parse(matcher.group(1));
        OptionalDouble max = LenientNumbers.parse(matcher.group(2));
        if (min.isEmpty() || max.isEmpty()) {
            return false;
        }
        return actual < min.getAsDouble() || actual > max.getAsDouble();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
