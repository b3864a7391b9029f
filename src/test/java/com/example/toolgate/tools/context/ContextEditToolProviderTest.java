package com.example.toolgate.tools.context;

import com.example.toolgate.host.InMemoryContextStore;
import com.example.toolgate.tools.ToolException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ContextEditToolProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void replacesThenAppendsBaseSystemPrompt() throws Exception {
        InMemoryContextStore store = new InMemoryContextStore();
        ContextEditToolProvider provider = new ContextEditToolProvider(store);

        provider.invoke(ContextEditToolProvider.UPDATE_BASE_SYSTEM_PROMPT,
                mapper.createObjectNode().put("mode", "replace").put("content", "Be brief."));
        String message = provider.invoke(ContextEditToolProvider.UPDATE_BASE_SYSTEM_PROMPT,
                mapper.createObjectNode().put("mode", "append").put("content", "Answer in English.")).content();

        assertEquals("Base system prompt updated (mode=append)", message);
        assertEquals("Be brief.\n\nAnswer in English.", store.readBaseSystemPrompt());
    }

    @Test
    void appendToEmptyPromptDoesNotAddSeparator() throws Exception {
        InMemoryContextStore store = new InMemoryContextStore();

        new ContextEditToolProvider(store).invoke(ContextEditToolProvider.UPDATE_BASE_SYSTEM_PROMPT,
                mapper.createObjectNode().put("mode", "append").put("content", "Hello"));

        assertEquals("Hello", store.readBaseSystemPrompt());
    }

    @Test
    void concurrentAppendsAreAllKept() throws Exception {
        InMemoryContextStore store = new InMemoryContextStore();
        ContextEditToolProvider provider = new ContextEditToolProvider(store);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String line = "rule " + i;
                futures.add(pool.submit(() -> provider.invoke(ContextEditToolProvider.UPDATE_BASE_SYSTEM_PROMPT,
                        mapper.createObjectNode().put("mode", "append").put("content", line))));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(200, store.readBaseSystemPrompt().split("\n\n").length);
    }

    @Test
    void reportsMissingStore() {
        ToolException error = assertThrows(ToolException.class, () -> new ContextEditToolProvider(null)
                .invoke(ContextEditToolProvider.UPDATE_BASE_SYSTEM_PROMPT, mapper.createObjectNode()));

        assertEquals("Context store is not available", error.getMessage());
    }
}
