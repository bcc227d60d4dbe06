package me.golemcore.agent.adapter.inbound.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionSummaryDto {
    private String sessionId;
    private String createdAt;
    private String lastInteraction;
    private String model;
    private String memoryKind;
    private int messageCount;
    private boolean hasSummary;
}
