package me.golemcore.agent.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agent.domain.model.ToolTraceEntry;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolTraceDto {
    private int iteration;
    private String toolCallId;
    private String toolName;
    private Map<String, Object> arguments;
    private boolean success;
    private String output;
    private String error;
    private String failureKind;
    private long durationMs;

    public static ToolTraceDto from(ToolTraceEntry entry) {
        return ToolTraceDto.builder()
                .iteration(entry.getIteration())
                .toolCallId(entry.getToolCallId())
                .toolName(entry.getToolName())
                .arguments(entry.getArguments())
                .success(entry.isSuccess())
                .output(entry.getOutput())
                .error(entry.getError())
                .failureKind(entry.getFailureKind() != null ? entry.getFailureKind().name() : null)
                .durationMs(entry.getDurationMs())
                .build();
    }

    public static List<ToolTraceDto> fromAll(List<ToolTraceEntry> entries) {
        if (entries == null) {
            return List.of();
        }
        return entries.stream().map(ToolTraceDto::from).toList();
    }
}
