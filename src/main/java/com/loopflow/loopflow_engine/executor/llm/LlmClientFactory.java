package com.loopflow.loopflow_engine.executor.llm;

import com.loopflow.loopflow_engine.model.llm.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(List<LlmClient> clients) {
        for (LlmClient client : clients) {
            clientMap.put(client.getProvider(), client);
        }
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No LlmClient registered for provider: " + provider);
        }
        return client;
    }
}
