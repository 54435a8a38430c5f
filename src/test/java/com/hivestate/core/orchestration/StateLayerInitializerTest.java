package com.hivestate.core.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StateLayerInitializerTest {

    @Test
    @DisplayName("initialization is bound to application start")
    void listensForStart() throws NoSuchMethodException {
        EventListener listener = StateLayerInitializer.class
                .getMethod("initializeStateLayer")
                .getAnnotation(EventListener.class);

        assertNotNull(listener);
        assertEquals(List.of(ApplicationStartedEvent.class), List.of(listener.value()));
    }

    @Test
    @DisplayName("initializes the state manager")
    void initializes() {
        StateManager stateManager = mock(StateManager.class);
        when(stateManager.initialize()).thenReturn(true);

        new StateLayerInitializer(stateManager).initializeStateLayer();

        verify(stateManager).initialize();
    }

    @Test
    @DisplayName("a failed initialization does not stop the application")
    void failureIsLogged() {
        StateManager stateManager = mock(StateManager.class);
        when(stateManager.initialize()).thenReturn(false);

        assertDoesNotThrow(() -> new StateLayerInitializer(stateManager).initializeStateLayer());
        verify(stateManager).initialize();
    }
}
