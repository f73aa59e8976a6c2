package com.medicaledu.backend.global.common.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResultTest {

    @Test
    void successCarriesValue() {
        Result<String> result = Result.success("ok");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("ok");
        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.NONE);
    }

    @Test
    @DisplayName("each failure factory tags its error type")
    void failureFactoriesTagType() {
        assertThat(Result.notFound().getErrorType()).isEqualTo(ResultErrorType.NOT_FOUND);
        assertThat(Result.notFound().getErrors()).containsExactly("Entity Not Found");
        assertThat(Result.conflict("BOOKING_ALREADY_EXISTS").getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(Result.unauthorized().getErrorType()).isEqualTo(ResultErrorType.UNAUTHORIZED);
        assertThat(Result.validationFailure(List.of("email: invalid")).getErrorType())
                .isEqualTo(ResultErrorType.VALIDATION);
        assertThat(Result.failure("SLOT_FULL").getErrorType()).isEqualTo(ResultErrorType.FAILURE);
    }

    @Test
    @DisplayName("a failure needs at least one non-blank message")
    void failureRequiresMessage() {
        assertThatThrownBy(() -> Result.failure()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Result.failure(" ", null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(Result.validationFailure(Arrays.asList("a: x", null, "")).getErrors()).containsExactly("a: x");
    }

    @Test
    void failedResultHasNoValue() {
        Result<Integer> failed = Result.conflict("NOPE");

        assertThat(failed.tryGetValue()).isEmpty();
        assertThatThrownBy(failed::getValue).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("castFailure keeps errors and type but refuses successes")
    void castFailure() {
        Result<Integer> failed = Result.notFound("SLOT_NOT_FOUND");

        Result<String> recast = failed.castFailure();

        assertThat(recast.getErrors()).containsExactly("SLOT_NOT_FOUND");
        assertThat(recast.getErrorType()).isEqualTo(ResultErrorType.NOT_FOUND);
        assertThatThrownBy(() -> Result.success(1).castFailure()).isInstanceOf(IllegalStateException.class);
    }
}
