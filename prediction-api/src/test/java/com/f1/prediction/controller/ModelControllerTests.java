package com.f1.prediction.controller;

import com.f1.prediction.dto.ModelStatus;
import com.f1.prediction.service.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ModelControllerTests {

    ModelRegistry registry;
    ModelController controller;

    private final ModelStatus unavailable = new ModelStatus(false, null, null, "Model directory not found", List.of());

    @BeforeEach
    void setUp() {
        registry = mock(ModelRegistry.class);
        controller = new ModelController(registry);
    }

    @Test
    void reloadWithoutVersion_usesConfiguredVersion() {
        when(registry.reload()).thenReturn(unavailable);

        assertSame(unavailable, controller.reload(null));
        verify(registry, never()).reload(anyString());
    }

    @Test
    void reloadWithVersion_loadsThatVersion() {
        when(registry.reload("1.3.0")).thenReturn(unavailable);

        controller.reload("1.3.0");

        verify(registry).reload("1.3.0");
    }
}
