package me.golemcore.agent.adapter.inbound.web.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agent.domain.model.SessionConfig;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionConfigDto {
    private String model;
    private double temperature;
    private List<String> tools;
    private String memoryKind;

    public static SessionConfigDto from(SessionConfig config) {
        return SessionConfigDto.builder()
                .model(config.getModel())
                .temperature(config.getTemperature())
                .tools(config.getTools())
                .memoryKind(config.getMemoryKind() != null ? config.getMemoryKind().name() : null)
                .build();
    }
}
