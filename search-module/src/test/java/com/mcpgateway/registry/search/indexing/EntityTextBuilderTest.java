package com.mcpgateway.registry.search.indexing;

import com.mcpgateway.registry.common.model.AgentEntity;
import com.mcpgateway.registry.common.model.AgentSkill;
import com.mcpgateway.registry.common.model.ServerEntity;
import com.mcpgateway.registry.common.model.ToolDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntityTextBuilderTest {

    private final EntityTextBuilder textBuilder = new EntityTextBuilder();

    @Test
    void serverTextIncludesTagsAndToolNames() {
        ServerEntity server = ServerEntity.builder()
                .name("Weather API")
                .description("Current weather data")
                .tags(List.of("weather", "forecast"))
                .tools(List.of(new ToolDefinition("get_forecast", "Forecast", null)))
                .build();

        assertThat(textBuilder.serverText(server))
                .isEqualTo("Weather API Current weather data Tags: weather, forecast Tools: get_forecast");
    }

    @Test
    void toolTextSkipsMissingDescription() {
        assertThat(textBuilder.toolText(new ToolDefinition("get_alerts", null, null))).isEqualTo("get_alerts");
    }

    @Test
    void agentTextIncludesCapabilitiesAndSkills() {
        AgentEntity agent = AgentEntity.builder()
                .name("Travel Planner")
                .description(" Plans trips ")
                .capabilities(List.of("streaming"))
                .skills(List.of(new AgentSkill("booking", "Books hotels")))
                .build();

        assertThat(textBuilder.agentText(agent))
                .isEqualTo("Travel Planner Plans trips Capabilities: streaming booking Books hotels");
    }
}
