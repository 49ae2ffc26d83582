package mta.eda.generator.service.sink;

import mta.eda.generator.model.OrderEvent;
import mta.eda.generator.model.TestOrders;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith({MockitoExtension.class, OutputCaptureExtension.class})
class SinkDispatcherTest {

    @Mock
    private EventSink failingSink;

    @Mock
    private EventSink healthySink;

    private final OrderEvent event = OrderEvent.from(TestOrders.pending("ORD-12345678", 0, Duration.ofSeconds(10)));

    @Test
    void failingSinkDoesNotBlockOtherSinks(CapturedOutput output) {
        when(failingSink.name()).thenReturn("kafka:orders");
        when(healthySink.name()).thenReturn("console");
        doThrow(new IllegalStateException("publish timeout")).when(failingSink).publish(any());
        SinkDispatcher dispatcher = new SinkDispatcher(List.of(failingSink, healthySink));

        assertDoesNotThrow(() -> dispatcher.dispatch(event));
        assertDoesNotThrow(() -> dispatcher.dispatch(event));

        verify(healthySink, times(2)).publish(event);
        assertEquals(2, dispatcher.failureCount());
        assertEquals(2, dispatcher.failureCount("kafka:orders"));
        assertEquals(0, dispatcher.failureCount("console"));
        assertTrue(output.getOut().contains("Failed to dispatch orderId=ORD-12345678"));
        assertTrue(output.getOut().contains("sink=kafka:orders"));
    }

    @Test
    void dispatchesToSinksInConfiguredOrder() {
        when(failingSink.name()).thenReturn("first");
        when(healthySink.name()).thenReturn("second");
        SinkDispatcher dispatcher = new SinkDispatcher(List.of(failingSink, healthySink));

        dispatcher.dispatch(event);

        InOrder inOrder = inOrder(failingSink, healthySink);
        inOrder.verify(failingSink).publish(event);
        inOrder.verify(healthySink).publish(event);
        assertEquals(List.of("first", "second"), dispatcher.sinkNames());
    }

    @Test
    void noSinksIsAllowed() {
        SinkDispatcher dispatcher = new SinkDispatcher(List.of());

        assertDoesNotThrow(() -> dispatcher.dispatch(event));
        assertEquals(0, dispatcher.failureCount());
    }

    @Test
    void closesEverySinkExactlyOnce() {
        when(failingSink.name()).thenReturn("kafka:orders");
        when(healthySink.name()).thenReturn("console");
        doThrow(new IllegalStateException("flush failed")).when(failingSink).close();
        SinkDispatcher dispatcher = new SinkDispatcher(List.of(failingSink, healthySink));

        dispatcher.close();
        dispatcher.close();

        assertTrue(dispatcher.isClosed());
        verify(failingSink, times(1)).close();
        verify(healthySink, times(1)).close();
    }
}
