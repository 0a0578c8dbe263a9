package io.github.barebone.llm.gateway.providers.stream;

import io.github.barebone.llm.common.GatewayException;
import io.github.barebone.llm.events.StreamEvent;
import io.github.barebone.llm.events.TurnCompleted;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Feeds raw events through a normalizer and collects what it emits.
 */
final class NormalizerHarness {

    private final StreamNormalizer normalizer;
    private final List<StreamEvent> events = new ArrayList<>();

    NormalizerHarness(StreamNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    NormalizerHarness feed(String event, String data) throws GatewayException {
        normalizer.accept(new SseEvent(event, data), events::add);
        return this;
    }

    NormalizerHarness feed(String data) throws GatewayException {
        return feed(null, data);
    }

    NormalizerHarness finish() throws GatewayException {
        normalizer.finish(events::add);
        return this;
    }

    List<StreamEvent> events() {
        return events;
    }

    <T extends StreamEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    TurnCompleted turn() {
        List<TurnCompleted> turns = eventsOf(TurnCompleted.class);
        if (turns.size() != 1) {
            throw new AssertionError("expected exactly one TurnCompleted but got " + turns.size());
        }
        return turns.get(0);
    }
}
