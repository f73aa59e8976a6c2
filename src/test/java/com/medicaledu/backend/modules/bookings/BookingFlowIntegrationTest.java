package com.medicaledu.backend.modules.bookings;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Email;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.modules.audit.domain.AuditLog;
import com.medicaledu.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.bookings.application.CreateBookingCommand;
import com.medicaledu.backend.modules.bookings.application.GetBookingByIdQuery;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.notifications.domain.Notification;
import com.medicaledu.backend.modules.notifications.domain.NotificationType;
import com.medicaledu.backend.modules.notifications.infrastructure.persistence.NotificationRepository;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.domain.UserRole;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;

@SpringBootTest
class BookingFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private Mediator mediator;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private CourseRepository courseRepository;

    @Autowired
    private AvailabilitySlotRepository slotRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    private User instructor;
    private Course course;

    @BeforeEach
    void setUp() {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        instructor = userRepository.save(user("instructor", UserRole.INSTRUCTOR, now));
        course = courseRepository.save(Course.create(instructor.getId(), "Suturing Basics", "Hands-on wound closure",
                Money.of(new BigDecimal("120.00"), Currency.USD), 60, 10, null, null, null, null, null, now));
    }

    @Test
    void bookingReservesSeatNotifiesInstructorAndIsAudited() {
        AvailabilitySlot slot = slotRepository.save(slot(2));
        User student = userRepository.save(user("student", UserRole.STUDENT, OffsetDateTime.now(ZoneOffset.UTC)));

        Result<BookingResponse> created = mediator.send(
                new CreateBookingCommand(student.getId(), slot.getId(), null, "looking forward"));

        assertThat(created.isSuccess()).isTrue();
        BookingResponse booking = created.getValue();
        assertThat(booking.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.amount()).isEqualByComparingTo("120.00");
        assertThat(slotRepository.findById(slot.getId()).orElseThrow().getCurrentParticipants()).isEqualTo(1);

        List<Notification> notifications = notificationRepository
                .findForUser(instructor.getId(), false, PageRequest.of(0, 20))
                .getContent();
        assertThat(notifications)
                .anyMatch(notification -> notification.getType() == NotificationType.BOOKING_REQUESTED
                        && booking.id().equals(notification.getRelatedEntityId()));

        List<AuditLog> auditTrail = auditLogRepository.search("Booking", booking.id(), PageRequest.of(0, 20)).getContent();
        assertThat(auditTrail).isNotEmpty();

        Result<BookingResponse> fetched = mediator.send(new GetBookingByIdQuery(booking.id()));
        assertThat(fetched.getValue().studentNotes()).isEqualTo("looking forward");

        Result<BookingResponse> duplicate = mediator.send(
                new CreateBookingCommand(student.getId(), slot.getId(), null, null));
        assertThat(duplicate.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(duplicate.getErrors()).containsExactly("BOOKING_ALREADY_EXISTS");
    }

    @Test
    void concurrentBookingsForLastSeatAdmitOnlyOne() throws Exception {
        AvailabilitySlot slot = slotRepository.save(slot(1));
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        User first = userRepository.save(user("first", UserRole.STUDENT, now));
        User second = userRepository.save(user("second", UserRole.STUDENT, now));

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Result<BookingResponse>>> futures = new ArrayList<>();
            for (User student : List.of(first, second)) {
                Callable<Result<BookingResponse>> attempt = () -> {
                    start.await();
                    return mediator.send(new CreateBookingCommand(student.getId(), slot.getId(), null, null));
                };
                futures.add(executor.submit(attempt));
            }
            start.countDown();

            List<Result<BookingResponse>> results = new ArrayList<>();
            for (Future<Result<BookingResponse>> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(results).filteredOn(Result::isSuccess).hasSize(1);
            assertThat(results).filteredOn(Result::isFailure)
                    .singleElement()
                    .satisfies(result -> assertThat(result.getErrors()).containsExactly("SLOT_FULL"));
        } finally {
            executor.shutdownNow();
        }

        AvailabilitySlot reloaded = slotRepository.findById(slot.getId()).orElseThrow();
        assertThat(reloaded.getCurrentParticipants()).isEqualTo(1);
        assertThat(reloaded.isBooked()).isTrue();
    }

    private AvailabilitySlot slot(int maxParticipants) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        OffsetDateTime start = now.plusDays(3).withNano(0);
        return AvailabilitySlot.create(course.getId(), instructor.getId(), start, start.plusHours(1),
                Money.of(new BigDecimal("120.00"), Currency.USD), maxParticipants, null, now);
    }

    private static User user(String prefix, UserRole role, OffsetDateTime now) {
        String email = prefix + "-" + UUID.randomUUID() + "@example.com";
        return User.register(prefix, Email.of(email), "{noop}not-used", role, null, null, now);
    }
}
