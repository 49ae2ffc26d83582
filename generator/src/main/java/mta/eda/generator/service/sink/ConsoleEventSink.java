package mta.eda.generator.service.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import mta.eda.generator.model.OrderEvent;

import java.io.PrintStream;

/**
 * Prints each event as pretty JSON followed by a blank line.
 */
public class ConsoleEventSink implements EventSink {

    private final ObjectWriter writer;
    private final PrintStream out;

    public ConsoleEventSink(ObjectMapper objectMapper, PrintStream out) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.out = out;
    }

    @Override
    public String name() {
        return "console";
    }

    @Override
    public void publish(OrderEvent event) {
        try {
            out.println(writer.writeValueAsString(event));
            out.println();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event for orderId=" + event.orderId(), e);
        }
    }

    @Override
    public void close() {
        out.flush();
    }
}
