package com.quakesieve.core.record;

import com.quakesieve.core.model.Event;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of parsing raw records: the accepted events, in input order, and
 * the records that were dropped.
 *
 * @since 1.0.0
 */
public final class ParsedCatalog {

    private final List<String> header;
    private final List<Event> events;
    private final List<InputRejection> rejections;

    public ParsedCatalog(List<String> header, List<Event> events, List<InputRejection> rejections) {
        this.header = Collections.unmodifiableList(header);
        this.events = Collections.unmodifiableList(events);
        this.rejections = Collections.unmodifiableList(rejections);
    }

    /**
     * @return input column names, in input order
     */
    public List<String> getHeader() {
        return header;
    }

    public List<Event> getEvents() {
        return events;
    }

    public List<InputRejection> getRejections() {
        return rejections;
    }

    @Override
    public String toString() {
        return "ParsedCatalog{events=" + events.size() + ", rejections=" + rejections.size() + '}';
    }
}
