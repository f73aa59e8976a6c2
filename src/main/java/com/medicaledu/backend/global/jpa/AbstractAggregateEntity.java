package com.medicaledu.backend.global.jpa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.DomainEvent;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;

import org.springframework.data.domain.AfterDomainEventPublication;
import org.springframework.data.domain.DomainEvents;
import org.springframework.data.domain.Persistable;

/**
 * Aggregate root with an application-assigned UUID, optimistic locking and a list of
 * recorded domain events that Spring Data publishes on {@code save}.
 */
@MappedSuperclass
public abstract class AbstractAggregateEntity extends AbstractTimestampedEntity implements Persistable<UUID> {

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Transient
    private final List<DomainEvent> domainEvents = new ArrayList<>();

    @Transient
    private boolean isNew = true;

    protected void registerEvent(DomainEvent event) {
        domainEvents.add(Objects.requireNonNull(event, "event"));
    }

    @DomainEvents
    public List<DomainEvent> getDomainEvents() {
        return Collections.unmodifiableList(domainEvents);
    }

    @AfterDomainEventPublication
    public void clearDomainEvents() {
        domainEvents.clear();
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostPersist
    @PostLoad
    void markNotNew() {
        this.isNew = false;
    }

    public long getVersion() {
        return version;
    }
}
