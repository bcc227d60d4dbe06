package me.golemcore.agent.adapter.inbound.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agent.domain.model.LlmUsage;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UsageDto {
    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    public static UsageDto from(LlmUsage usage) {
        if (usage == null) {
            return new UsageDto(0, 0, 0);
        }
        return new UsageDto(usage.getInputTokens(), usage.getOutputTokens(), usage.getTotalTokens());
    }
}
