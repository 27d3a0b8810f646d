package com.example.quorum.provider;

import reactor.core.publisher.Flux;

import java.util.List;

/**
 * A language model behind one of the {@link ProviderType} variants.
 * Failures surface as {@link ChatProviderException}.
 */
public interface ChatProvider {

    ProviderType type();

    ChatResult chat(List<ChatMessage> messages, ChatOptions options);

    /**
     * Stream the reply as text deltas in generation order. Nothing is sent
     * until subscription; cancelling aborts the HTTP call.
     */
    Flux<String> chatStream(List<ChatMessage> messages, ChatOptions options);

    /**
     * Round-trip a minimal prompt.
     *
     * @return false when the provider is unreachable or rejects the credentials
     */
    boolean test();
}
