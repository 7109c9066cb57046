package com.bko.conductor.api;

import com.bko.conductor.orchestration.model.CooldownInfo;
import com.bko.conductor.orchestration.model.ModelDescriptor;
import com.bko.conductor.orchestration.model.ModelProvider;
import com.bko.conductor.orchestration.service.FailoverRegistry;
import com.bko.conductor.orchestration.service.ModelCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ModelController.class)
class ModelControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ModelCatalog modelCatalog;

    @MockitoBean
    private FailoverRegistry failoverRegistry;

    @Test
    void testListsModelsWithAvailability() throws Exception {
        when(modelCatalog.models()).thenReturn(List.of(
                new ModelDescriptor(ModelCatalog.SONNET, "Sonnet 4.6", ModelProvider.ANTHROPIC)));
        when(failoverRegistry.isAvailable(ModelCatalog.SONNET)).thenReturn(false);
        when(failoverRegistry.remaining(ModelCatalog.SONNET)).thenReturn(Duration.ofSeconds(42));
        when(failoverRegistry.resolve(ModelCatalog.SONNET)).thenReturn(ModelCatalog.GEMINI_3_FLASH);

        mockMvc.perform(get("/api/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(ModelCatalog.SONNET))
                .andExpect(jsonPath("$[0].available").value(false))
                .andExpect(jsonPath("$[0].cooldownRemainingMs").value(42000))
                .andExpect(jsonPath("$[0].resolvedModel").value(ModelCatalog.GEMINI_3_FLASH));
    }

    @Test
    void testCooldowns() throws Exception {
        when(failoverRegistry.activeCooldowns()).thenReturn(List.of(
                new CooldownInfo(ModelCatalog.HAIKU, 60000, 1, "429", ModelCatalog.GEMINI_25_FLASH)));

        mockMvc.perform(get("/api/models/cooldowns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].model").value(ModelCatalog.HAIKU))
                .andExpect(jsonPath("$[0].failures").value(1));

        mockMvc.perform(delete("/api/models/cooldowns"))
                .andExpect(status().isNoContent());
        verify(failoverRegistry).clearAll();
    }
}
