package com.bko.conductor.api;

import com.bko.conductor.orchestration.model.CooldownInfo;
import com.bko.conductor.orchestration.service.FailoverRegistry;
import com.bko.conductor.orchestration.service.ModelCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/models")
public class ModelController {

    private final ModelCatalog modelCatalog;
    private final FailoverRegistry failoverRegistry;

    public ModelController(ModelCatalog modelCatalog, FailoverRegistry failoverRegistry) {
        this.modelCatalog = modelCatalog;
        this.failoverRegistry = failoverRegistry;
    }

    @GetMapping
    public List<ModelStatusResponse> getModels() {
        return modelCatalog.models().stream()
                .map(model -> new ModelStatusResponse(model.id(), model.label(), model.provider(),
                        failoverRegistry.isAvailable(model.id()),
                        failoverRegistry.remaining(model.id()).toMillis(),
                        failoverRegistry.resolve(model.id())))
                .toList();
    }

    @GetMapping("/cooldowns")
    public List<CooldownInfo> getCooldowns() {
        return failoverRegistry.activeCooldowns();
    }

    @DeleteMapping("/cooldowns")
    public ResponseEntity<Void> clearCooldowns() {
        failoverRegistry.clearAll();
        return ResponseEntity.noContent().build();
    }
}
