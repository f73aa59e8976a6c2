package com.medicaledu.backend.global.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.global.error.RequestValidationException;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ValidationBehaviorTest {

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    record RegisterCommand(@NotBlank String name, @Email String email) implements Command<Result<String>> {
    }

    record PlainQuery(@NotBlank String term) implements Request<String> {
    }

    static class TakenEmailValidator implements RequestValidator<RegisterCommand> {

        final AtomicInteger calls = new AtomicInteger();

        @Override
        public List<String> validate(RegisterCommand request) {
            calls.incrementAndGet();
            return "taken@example.com".equals(request.email()) ? List.of("email: already registered") : List.of();
        }
    }

    private TakenEmailValidator takenEmailValidator;
    private ValidationBehavior behavior;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        takenEmailValidator = new TakenEmailValidator();
        behavior = new ValidationBehavior(validator, List.of(takenEmailValidator));
    }

    @Test
    void validRequestReachesHandler() {
        Result<String> result = behavior.handle(new RegisterCommand("Ana", "ana@example.com"), () -> Result.success("ok"));

        assertThat(result.getValue()).isEqualTo("ok");
        assertThat(takenEmailValidator.calls).hasValue(1);
    }

    @Test
    @DisplayName("constraint violations become a validation result and skip custom validators")
    void constraintViolationsShortCircuit() {
        Result<String> result = behavior.handle(new RegisterCommand(" ", "not-an-email"),
                () -> Result.success("should not run"));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.VALIDATION);
        assertThat(result.getErrors()).hasSize(2)
                .anyMatch(message -> message.startsWith("email: "))
                .anyMatch(message -> message.startsWith("name: "));
        assertThat(takenEmailValidator.calls).hasValue(0);
    }

    @Test
    void customValidatorErrorsAreReported() {
        Result<String> result = behavior.handle(new RegisterCommand("Ana", "taken@example.com"),
                () -> Result.success("should not run"));

        assertThat(result.getErrors()).containsExactly("email: already registered");
    }

    @Test
    @DisplayName("requests without a Result response get an exception instead")
    void throwsForNonResultRequests() {
        assertThatThrownBy(() -> behavior.handle(new PlainQuery(""), () -> "unreachable"))
                .isInstanceOf(RequestValidationException.class)
                .satisfies(ex -> assertThat(((RequestValidationException) ex).getErrors())
                        .singleElement().asString().startsWith("term: "));
    }
}
