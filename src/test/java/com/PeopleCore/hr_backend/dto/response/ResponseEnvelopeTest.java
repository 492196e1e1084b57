package com.PeopleCore.hr_backend.dto.response;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Response envelopes")
class ResponseEnvelopeTest {

    @Test
    @DisplayName("Middle page reports both neighbours")
    void middlePage() {
        PaginatedResponse<String> page = PaginatedResponse.of(List.of("E-021", "E-022"), 2, 20, 45);

        assertThat(page.getData()).containsExactly("E-021", "E-022");
        assertThat(page.getPagination().getPages()).isEqualTo(3);
        assertThat(page.getPagination().isHasNext()).isTrue();
        assertThat(page.getPagination().isHasPrev()).isTrue();
    }

    @Test
    @DisplayName("No rows means zero pages and no neighbours")
    void emptyResult() {
        PaginatedResponse<String> page = PaginatedResponse.of(List.of(), 1, 20, 0);

        assertThat(page.getData()).isEmpty();
        assertThat(page.getPagination().getPages()).isZero();
        assertThat(page.getPagination().isHasNext()).isFalse();
        assertThat(page.getPagination().isHasPrev()).isFalse();
    }

    @Test
    @DisplayName("Success envelope carries data and message")
    void successEnvelope() {
        ApiResponse<Integer> response = ApiResponse.success(3, "Calendar restriction removed");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isEqualTo(3);
        assertThat(response.getMessage()).isEqualTo("Calendar restriction removed");
        assertThat(ApiResponse.success("x").getMessage()).isEqualTo("Success");
    }
}
