package me.golemcore.agent.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial configuration update. {@code null} fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionConfigUpdate {

    private String model;
    private Double temperature;
    private List<String> tools;
    private MemoryKind memoryKind;

    public boolean isEmpty() {
        return model == null && temperature == null && tools == null && memoryKind == null;
    }
}
