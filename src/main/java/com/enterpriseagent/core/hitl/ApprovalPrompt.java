package com.enterpriseagent.core.hitl;

/**
 * External approver asked a yes/no question. Calls may block for a long time.
 */
@FunctionalInterface
public interface ApprovalPrompt {

    boolean confirm(String question);
}
