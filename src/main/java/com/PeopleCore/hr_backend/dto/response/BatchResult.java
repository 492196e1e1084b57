package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a period batch: the rows written by this call and how many members were skipped.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult<T> {

    @Builder.Default
    private List<T> processed = new ArrayList<>();

    private int skippedCount;

    public int getProcessedCount() {
        return processed.size();
    }
}
