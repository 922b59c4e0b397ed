package com.arcdispatch.providers;

import com.arcdispatch.models.StreamEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class RecordingSink implements StreamEventSink {

    private final List<StreamEvent> events = new ArrayList<>();

    @Override
    public synchronized void accept(StreamEvent event) {
        events.add(event);
    }

    public synchronized List<StreamEvent> getEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<StreamEvent.Type> types() {
        return events.stream().map(StreamEvent::getType).collect(Collectors.toList());
    }

    public synchronized StreamEvent last() {
        return events.get(events.size() - 1);
    }

    public synchronized String text() {
        return events.stream()
            .filter(e -> e.getType() == StreamEvent.Type.TEXT_DELTA)
            .map(StreamEvent::getText)
            .collect(Collectors.joining());
    }
}
