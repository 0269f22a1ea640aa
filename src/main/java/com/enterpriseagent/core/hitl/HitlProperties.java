package com.enterpriseagent.core.hitl;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "agent.hitl")
public class HitlProperties {

    /** Risk levels approved without asking; "all" approves everything. */
    private List<String> autoApprove = new ArrayList<>();

    public List<String> getAutoApprove() {
        return autoApprove;
    }

    public void setAutoApprove(List<String> autoApprove) {
        this.autoApprove = autoApprove;
    }
}
