package com.firefly.prdagent.messaging;

import com.firefly.prdagent.compression.GroupContextService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class CompressionQueueListenerTest {

    @Mock
    private GroupContextService groupContextService;

    @InjectMocks
    private CompressionQueueListener listener;

    @Test
    void shouldDelegateToGroupContextService() {
        CompressionRequestPayload payload = CompressionRequestPayload.builder().groupId("g1").runId("run-1").build();

        listener.handle(payload);

        verify(groupContextService).compress(payload);
    }

    @Test
    void shouldIgnorePayloadWithoutGroup() {
        listener.handle(null);
        listener.handle(new CompressionRequestPayload());

        verifyNoInteractions(groupContextService);
    }

    @Test
    void shouldRethrowSoBrokerRejectsMessage() {
        CompressionRequestPayload payload = CompressionRequestPayload.builder().groupId("g1").build();
        doThrow(new IllegalStateException("redis down")).when(groupContextService).compress(payload);

        assertThatThrownBy(() -> listener.handle(payload)).isInstanceOf(IllegalStateException.class);
    }
}
