package com.enterpriseagent.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agent.telemetry")
public class TelemetryProperties {

    /** JSON-lines file receiving every published event; blank disables the sink. */
    private String file = "";

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }
}
