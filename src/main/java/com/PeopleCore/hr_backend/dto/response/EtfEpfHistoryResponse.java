package com.PeopleCore.hr_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtfEpfHistoryResponse {
    private List<EtfEpfTransactionResponse> transactions;
    private EtfEpfPeriodSummary totals;
}
