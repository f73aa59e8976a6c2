package com.medicaledu.backend.modules.availability.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Bookable time window offered by an instructor for one course. The slot counts as booked
 * once its participants reach capacity.
 */
@Entity
@Table(name = "availability_slot")
public class AvailabilitySlot extends AbstractAggregateEntity {

    public static final int NOTES_MAX_LENGTH = 1000;

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "course_id", nullable = false, columnDefinition = "uuid")
    private UUID courseId;

    @Column(name = "instructor_id", nullable = false, columnDefinition = "uuid")
    private UUID instructorId;

    @Column(name = "start_time_utc", nullable = false)
    private OffsetDateTime startTimeUtc;

    @Column(name = "end_time_utc", nullable = false)
    private OffsetDateTime endTimeUtc;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "price_amount", nullable = false, precision = 12, scale = 2)),
            @AttributeOverride(name = "currency", column = @Column(name = "price_currency", nullable = false, length = 3))
    })
    private Money price;

    @Column(name = "max_participants", nullable = false)
    private int maxParticipants;

    @Column(name = "current_participants", nullable = false)
    private int currentParticipants;

    @Column(name = "is_booked", nullable = false)
    private boolean booked;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "notes", length = NOTES_MAX_LENGTH)
    private String notes;

    @Column(name = "is_recurring", nullable = false)
    private boolean recurring;

    @Column(name = "recurring_pattern", length = 100)
    private String recurringPattern;

    protected AvailabilitySlot() {
    }

    public static AvailabilitySlot create(
            UUID courseId,
            UUID instructorId,
            OffsetDateTime startTimeUtc,
            OffsetDateTime endTimeUtc,
            Money price,
            int maxParticipants,
            String notes,
            OffsetDateTime now
    ) {
        if (courseId == null || instructorId == null) {
            throw new IllegalArgumentException("Course and instructor are required.");
        }
        requireTimeRange(startTimeUtc, endTimeUtc);
        if (maxParticipants <= 0) {
            throw new IllegalArgumentException("Max participants must be positive.");
        }
        if (price == null) {
            throw new IllegalArgumentException("Price is required.");
        }
        AvailabilitySlot slot = new AvailabilitySlot();
        slot.id = UUID.randomUUID();
        slot.courseId = courseId;
        slot.instructorId = instructorId;
        slot.startTimeUtc = startTimeUtc;
        slot.endTimeUtc = endTimeUtc;
        slot.price = price;
        slot.maxParticipants = maxParticipants;
        slot.notes = checkNotes(notes);
        slot.registerEvent(new AvailabilitySlotEvents.Created(slot.id, now, courseId, instructorId));
        return slot;
    }

    public boolean hasCapacity() {
        return currentParticipants < maxParticipants;
    }

    public boolean isAvailable() {
        return active && !booked && hasCapacity();
    }

    public int getRemainingCapacity() {
        return maxParticipants - currentParticipants;
    }

    public void addParticipants(int count, OffsetDateTime now) {
        if (count <= 0) {
            throw new IllegalArgumentException("Participant count must be positive.");
        }
        if (!active) {
            throw new IllegalStateException("Slot is not active.");
        }
        if (currentParticipants + count > maxParticipants) {
            throw new IllegalStateException("Slot is at maximum capacity.");
        }
        currentParticipants += count;
        booked = currentParticipants >= maxParticipants;
        registerEvent(new AvailabilitySlotEvents.ParticipantsChanged(id, now, currentParticipants, maxParticipants));
    }

    public void removeParticipants(int count, OffsetDateTime now) {
        if (count <= 0) {
            throw new IllegalArgumentException("Participant count must be positive.");
        }
        if (currentParticipants - count < 0) {
            throw new IllegalStateException("No participants to remove.");
        }
        currentParticipants -= count;
        booked = currentParticipants >= maxParticipants;
        registerEvent(new AvailabilitySlotEvents.ParticipantsChanged(id, now, currentParticipants, maxParticipants));
    }

    /**
     * Reserves the whole slot for a single participant.
     */
    public void markBooked(OffsetDateTime now) {
        if (booked) {
            throw new IllegalStateException("Slot is already booked.");
        }
        if (!hasCapacity()) {
            throw new IllegalStateException("Slot is at maximum capacity.");
        }
        currentParticipants++;
        booked = true;
        registerEvent(new AvailabilitySlotEvents.ParticipantsChanged(id, now, currentParticipants, maxParticipants));
    }

    public void releaseBooking(OffsetDateTime now) {
        if (currentParticipants <= 0) {
            throw new IllegalStateException("No participants to remove.");
        }
        currentParticipants--;
        booked = false;
        registerEvent(new AvailabilitySlotEvents.ParticipantsChanged(id, now, currentParticipants, maxParticipants));
    }

    public void updateTime(OffsetDateTime newStart, OffsetDateTime newEnd, OffsetDateTime now) {
        requireTimeRange(newStart, newEnd);
        if (currentParticipants > 0) {
            throw new IllegalStateException("Cannot move a slot that already has participants.");
        }
        this.startTimeUtc = newStart;
        this.endTimeUtc = newEnd;
        registerEvent(new AvailabilitySlotEvents.Updated(id, now));
    }

    public void updatePrice(Money newPrice, OffsetDateTime now) {
        if (newPrice == null) {
            throw new IllegalArgumentException("Price is required.");
        }
        this.price = newPrice;
        registerEvent(new AvailabilitySlotEvents.Updated(id, now));
    }

    public void updateMaxParticipants(int newMax, OffsetDateTime now) {
        if (newMax <= 0) {
            throw new IllegalArgumentException("Max participants must be positive.");
        }
        if (newMax < currentParticipants) {
            throw new IllegalStateException("Max participants cannot drop below current participants.");
        }
        this.maxParticipants = newMax;
        this.booked = currentParticipants >= maxParticipants;
        registerEvent(new AvailabilitySlotEvents.Updated(id, now));
    }

    public void updateNotes(String notes, OffsetDateTime now) {
        this.notes = checkNotes(notes);
        registerEvent(new AvailabilitySlotEvents.Updated(id, now));
    }

    public void setRecurring(String pattern, OffsetDateTime now) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Recurring pattern cannot be empty.");
        }
        this.recurring = true;
        this.recurringPattern = pattern.trim();
        registerEvent(new AvailabilitySlotEvents.Updated(id, now));
    }

    public void cancelRecurring(OffsetDateTime now) {
        this.recurring = false;
        this.recurringPattern = null;
        registerEvent(new AvailabilitySlotEvents.Updated(id, now));
    }

    public void activate(OffsetDateTime now) {
        if (active) {
            throw new IllegalStateException("Slot is already active.");
        }
        this.active = true;
        registerEvent(new AvailabilitySlotEvents.Activated(id, now));
    }

    public void deactivate(OffsetDateTime now) {
        if (!active) {
            throw new IllegalStateException("Slot is already inactive.");
        }
        this.active = false;
        registerEvent(new AvailabilitySlotEvents.Deactivated(id, now));
    }

    private static void requireTimeRange(OffsetDateTime start, OffsetDateTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Start and end time are required.");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("End time must be after start time.");
        }
    }

    private static String checkNotes(String notes) {
        if (notes != null && notes.length() > NOTES_MAX_LENGTH) {
            throw new IllegalArgumentException("Notes must not exceed " + NOTES_MAX_LENGTH + " characters.");
        }
        return notes;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getCourseId() {
        return courseId;
    }

    public UUID getInstructorId() {
        return instructorId;
    }

    public OffsetDateTime getStartTimeUtc() {
        return startTimeUtc;
    }

    public OffsetDateTime getEndTimeUtc() {
        return endTimeUtc;
    }

    public Money getPrice() {
        return price;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }

    public int getCurrentParticipants() {
        return currentParticipants;
    }

    public boolean isBooked() {
        return booked;
    }

    public boolean isActive() {
        return active;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isRecurring() {
        return recurring;
    }

    public String getRecurringPattern() {
        return recurringPattern;
    }
}
