package com.medicaledu.backend.modules.bookings.presentation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.error.RestExceptionHandler;
import com.medicaledu.backend.global.pipeline.Mediator;
import com.medicaledu.backend.global.security.JwtAuthenticationPrincipal;
import com.medicaledu.backend.modules.bookings.application.ConfirmBookingCommand;
import com.medicaledu.backend.modules.bookings.application.CreateBookingCommand;
import com.medicaledu.backend.modules.bookings.application.GetBookingByIdQuery;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BookingControllerTest {

    @Mock
    private Mediator mediator;

    private MockMvc mockMvc;

    private final UUID studentId = UUID.randomUUID();
    private final UUID instructorId = UUID.randomUUID();
    private final UUID slotId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new BookingController(mediator))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("a student books a slot and gets the new booking with its location")
    void createBookingReturnsCreated() throws Exception {
        authenticate(studentId, "STUDENT");
        BookingResponse booking = booking(UUID.randomUUID(), BookingStatus.PENDING);
        when(mediator.send(any(CreateBookingCommand.class))).thenReturn(Result.success(booking));

        mockMvc.perform(post("/api/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(studentId)))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/bookings/" + booking.id()))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.currency").value("USD"));
    }

    @Test
    void bookingForSomeoneElseIsForbidden() throws Exception {
        authenticate(studentId, "STUDENT");

        mockMvc.perform(post("/api/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(UUID.randomUUID())))
                .andExpect(status().isForbidden());

        verify(mediator, never()).send(any());
    }

    @Test
    void fullSlotMapsToConflictProblem() throws Exception {
        authenticate(studentId, "STUDENT");
        when(mediator.send(any(CreateBookingCommand.class))).thenReturn(Result.conflict("SLOT_FULL"));

        mockMvc.perform(post("/api/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(studentId)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("SLOT_FULL"))
                .andExpect(jsonPath("$.instance").value("/api/bookings"));
    }

    @Test
    void onlyTheInstructorConfirms() throws Exception {
        UUID bookingId = UUID.randomUUID();
        authenticate(studentId, "STUDENT");
        when(mediator.send(any(GetBookingByIdQuery.class)))
                .thenReturn(Result.success(booking(bookingId, BookingStatus.PENDING)));

        mockMvc.perform(post("/api/bookings/{id}/confirm", bookingId))
                .andExpect(status().isForbidden());

        verify(mediator, never()).send(any(ConfirmBookingCommand.class));
    }

    @Test
    void instructorConfirmsPendingBooking() throws Exception {
        UUID bookingId = UUID.randomUUID();
        authenticate(instructorId, "INSTRUCTOR");
        when(mediator.send(any(GetBookingByIdQuery.class)))
                .thenReturn(Result.success(booking(bookingId, BookingStatus.PENDING)));
        when(mediator.send(any(ConfirmBookingCommand.class)))
                .thenReturn(Result.success(booking(bookingId, BookingStatus.CONFIRMED)));

        mockMvc.perform(post("/api/bookings/{id}/confirm", bookingId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFIRMED"));
    }

    @Test
    void missingBookingIsNotFound() throws Exception {
        authenticate(instructorId, "INSTRUCTOR");
        when(mediator.send(any(GetBookingByIdQuery.class))).thenReturn(Result.notFound("BOOKING_NOT_FOUND"));

        mockMvc.perform(post("/api/bookings/{id}/complete", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("BOOKING_NOT_FOUND"));
    }

    private void authenticate(UUID userId, String role) {
        JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(userId, "user@example.com", List.of(role));
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + role))));
    }

    private String createBody(UUID forStudent) {
        return """
                {"studentId":"%s","slotId":"%s","promoCode":null,"notes":"first visit"}
                """.formatted(forStudent, slotId);
    }

    private BookingResponse booking(UUID id, BookingStatus status) {
        return new BookingResponse(id, studentId, instructorId, slotId, UUID.randomUUID(), status,
                new BigDecimal("100.00"), "USD", null, "first visit", null, null, null, null,
                null, null, null, null, null, null);
    }
}
