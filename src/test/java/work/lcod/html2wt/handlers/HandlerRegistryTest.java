package work.lcod.html2wt.handlers;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class HandlerRegistryTest {
    @Test
    void defaultRegistryCoversEveryKey() {
        assertTrue(HandlerRegistry.create().missingKeys().isEmpty());
    }

    @Test
    void unregisteredKeyIsRejected() {
        var registry = new HandlerRegistry();
        assertThrows(IllegalStateException.class, () -> registry.get(HandlerKey.TABLE));
    }

    @Test
    void registrationReplacesAHandler() {
        var registry = HandlerRegistry.create();
        registry.register(HandlerKey.HR, NodeHandler.NO_OP);
        assertSame(NodeHandler.NO_OP, registry.get(HandlerKey.HR));
    }
}
