package com.enterpriseagent.core.hitl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Risk-classified approval checkpoint.
 * <p>
 * Low risk always passes. Other levels pass without asking only when the level,
 * or the wildcard {@code all}, is in the auto-approve list; otherwise the
 * {@link ApprovalPrompt} decides. No lock is held while waiting for the answer.
 */
@Service
public class HitlGate {

    private static final Logger log = LoggerFactory.getLogger(HitlGate.class);

    public static final String LOW = "low";
    public static final String ALL = "all";

    private final Set<String> autoApprove;
    private final ApprovalPrompt prompt;

    @Autowired
    public HitlGate(HitlProperties properties, ApprovalPrompt prompt) {
        this(properties.getAutoApprove(), prompt);
    }

    public HitlGate(List<String> autoApprove, ApprovalPrompt prompt) {
        this.autoApprove = autoApprove == null ? Set.of() : autoApprove.stream()
                .filter(level -> level != null && !level.isBlank())
                .map(level -> level.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.prompt = prompt;
    }

    public boolean approve(String riskLevel, String description) {
        String level = riskLevel == null || riskLevel.isBlank()
                ? LOW
                : riskLevel.trim().toLowerCase(Locale.ROOT);
        if (LOW.equals(level)) {
            log.debug("Auto-approved low risk action: {}", description);
            return true;
        }
        if (autoApprove.contains(ALL) || autoApprove.contains(level)) {
            log.info("Auto-approved {} risk action via allow-list: {}", level, description);
            return true;
        }

        boolean approved = prompt.confirm(String.format("Approve %s (risk=%s)? [y/N]: ", description, level));
        log.info("Approver {} {} risk action: {}", approved ? "approved" : "denied", level, description);
        return approved;
    }
}
