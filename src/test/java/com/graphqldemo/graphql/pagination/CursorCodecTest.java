package com.graphqldemo.graphql.pagination;

import com.graphqldemo.auth.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CursorCodecTest {

    @Test
    void decodesWhatItEncodes() {
        assertThat(CursorCodec.decode(CursorCodec.encode(0))).isZero();
        assertThat(CursorCodec.decode(CursorCodec.encode(42))).isEqualTo(42);
    }

    @Test
    void cursorIsOpaque() {
        assertThat(CursorCodec.encode(7)).doesNotContain("7");
    }

    @Test
    void rejectsNonBase64() {
        assertThatThrownBy(() -> CursorCodec.decode("%%%"))
                .isInstanceOfSatisfying(ValidationException.class, ex ->
                        assertThat(ex.getErrors()).containsKey("after"));
    }

    @Test
    void rejectsForeignPayload() {
        String foreign = Base64.getUrlEncoder().encodeToString("offset:3".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> CursorCodec.decode(foreign)).isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsNegativeOffset() {
        String negative = Base64.getUrlEncoder().encodeToString("cursor:-1".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> CursorCodec.decode(negative)).isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsLastIntOffsetSoNextPageCannotOverflow() {
        String last = CursorCodec.encode(Integer.MAX_VALUE);

        assertThatThrownBy(() -> CursorCodec.decode(last))
                .isInstanceOfSatisfying(ValidationException.class, ex ->
                        assertThat(ex.getErrors()).containsEntry("after", List.of("Invalid cursor.")));
    }

    @Test
    void rejectsOffsetBeyondIntRange() {
        String huge = Base64.getUrlEncoder().encodeToString("cursor:99999999999".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> CursorCodec.decode(huge)).isInstanceOf(ValidationException.class);
    }
}
