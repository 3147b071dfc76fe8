package xyz.firestige.workload.domain.shared.event;

import java.time.LocalDateTime;
import java.util.UUID;

public abstract class DomainEvent {
    private final String eventId;
    private final LocalDateTime timestamp;
    private String message;

    protected DomainEvent() {
        this(UUID.randomUUID().toString(), LocalDateTime.now());
    }

    protected DomainEvent(String eventId, LocalDateTime timestamp) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.message = "";
    }

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    protected void setMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
