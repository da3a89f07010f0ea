package org.javai.pipeline.coordinator;

import org.javai.pipeline.Failure;
import org.javai.pipeline.FailureId;
import org.javai.pipeline.FailureType;
import org.javai.pipeline.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScreenStateTest {

    private static Failure failure(String message) {
        return Failure.of(FailureId.of(FailureType.TRANSPORT, "io_error"), message,
                FailureType.TRANSPORT, "TestOp", null);
    }

    @Test
    void pending_isLoading() {
        assertThat(ScreenState.from(Outcome.pending())).isEqualTo(ScreenState.loading());
    }

    @Test
    void ok_isSuccess() {
        assertThat(ScreenState.from(Outcome.ok(List.of("a", "b"))))
                .isEqualTo(ScreenState.success(List.of("a", "b")));
    }

    @Test
    void okEmptyList_isEmpty() {
        ScreenState<List<String>> state = ScreenState.from(Outcome.ok(List.of()));

        assertThat(state).isInstanceOfSatisfying(ScreenState.Empty.class,
                empty -> assertThat(empty.message()).isEqualTo(ScreenState.DEFAULT_EMPTY_MESSAGE));
    }

    @Test
    void okNonCollection_isSuccessEvenWhenBlank() {
        assertThat(ScreenState.from(Outcome.ok(""))).isEqualTo(ScreenState.success(""));
    }

    @Test
    void fail_isErrorWithMessage() {
        assertThat(ScreenState.from(Outcome.fail(failure("offline"))))
                .isEqualTo(ScreenState.error("offline"));
    }

    @Test
    void failWithoutMessage_usesDefault() {
        assertThat(ScreenState.from(Outcome.fail(failure(null))))
                .isEqualTo(ScreenState.error(ScreenState.DEFAULT_ERROR_MESSAGE));
    }
}
