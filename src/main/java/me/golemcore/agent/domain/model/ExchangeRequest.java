package me.golemcore.agent.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound exchange: a user message plus optional session identity and
 * per-request overrides. Overrides apply to this exchange only unless
 * {@code persist} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeRequest {

    private String message;
    private String sessionId;
    private Double temperature;
    private List<String> tools;
    private String model;
    private boolean persist;

    public boolean hasOverrides() {
        return temperature != null || tools != null || model != null;
    }
}
