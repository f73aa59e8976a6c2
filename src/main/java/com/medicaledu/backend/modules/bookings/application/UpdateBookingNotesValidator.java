package com.medicaledu.backend.modules.bookings.application;

import java.util.List;

import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.pipeline.RequestValidator;

import org.springframework.stereotype.Component;

@Component
public class UpdateBookingNotesValidator implements RequestValidator<UpdateBookingNotesCommand> {

    @Override
    public List<String> validate(UpdateBookingNotesCommand command) {
        String meetingUrl = command.meetingUrl();
        if (meetingUrl != null && !meetingUrl.isBlank() && !Url.isValid(meetingUrl)) {
            return List.of("meetingUrl: must be a valid http(s) URL");
        }
        return List.of();
    }
}
