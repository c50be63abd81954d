package com.mcpgateway.registry.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpgateway.registry.common.exception.SearchValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityTypeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Имена типов и сокращения разбираются без учёта регистра")
    void parsesWireNamesAndAliases() {
        assertThat(EntityType.fromWireName("mcp_server")).isEqualTo(EntityType.MCP_SERVER);
        assertThat(EntityType.fromWireName(" Server ")).isEqualTo(EntityType.MCP_SERVER);
        assertThat(EntityType.fromWireName("TOOL")).isEqualTo(EntityType.TOOL);
        assertThat(EntityType.fromWireName("agent")).isEqualTo(EntityType.A2A_AGENT);
    }

    @Test
    @DisplayName("Неизвестный тип отклоняется ошибкой валидации")
    void rejectsUnknownType() {
        assertThatThrownBy(() -> EntityType.fromWireName("prompt"))
                .isInstanceOf(SearchValidationException.class)
                .hasMessageContaining("prompt");
    }

    @Test
    @DisplayName("В JSON тип пишется именем протокола")
    void serializesAsWireName() throws Exception {
        assertThat(objectMapper.writeValueAsString(EntityType.A2A_AGENT)).isEqualTo("\"a2a_agent\"");
        assertThat(objectMapper.readValue("\"server\"", EntityType.class)).isEqualTo(EntityType.MCP_SERVER);
    }
}
