package com.airline.warehouse.quality;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs every registered {@link QualityRule} against the warehouse.
 *
 * <p>The audit is lazy: a rule's query runs when its finding is pulled from the stream.
 * It is read-only and may be run any number of times. Rules are isolated from each other,
 * a rule that throws becomes an {@link QualitySeverity#ERROR} finding and the remaining
 * rules still run.
 */
@Slf4j
@Service
public class QualityAuditor {

    private final List<QualityRule> rules;
    private final RetryTemplate retryTemplate;

    public QualityAuditor(List<QualityRule> rules, @Qualifier("readRetryTemplate") RetryTemplate retryTemplate) {
        this.rules = List.copyOf(rules);
        this.retryTemplate = retryTemplate;
    }

    public Stream<QualityFinding> audit() {
        return rules.stream().map(this::check);
    }

    public List<String> ruleNames() {
        return rules.stream().map(QualityRule::getRuleName).collect(Collectors.toList());
    }

    private QualityFinding check(QualityRule rule) {
        try {
            long violations = retryTemplate.execute(context -> rule.countViolations());
            QualityFinding finding = QualityFinding.of(rule, violations);
            if (finding.isPassed()) {
                log.info("Quality check {} passed", rule.getRuleName());
            } else {
                log.warn("Quality check {} failed: {} violation(s) [{}]",
                    rule.getRuleName(), violations, rule.getSeverity());
            }
            return finding;
        } catch (RuntimeException e) {
            log.error("Quality check {} could not run", rule.getRuleName(), e);
            return QualityFinding.failedToRun(rule, e);
        }
    }
}
