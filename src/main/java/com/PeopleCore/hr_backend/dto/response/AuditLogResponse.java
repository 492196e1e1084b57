package com.PeopleCore.hr_backend.dto.response;

import com.PeopleCore.hr_backend.enums.AuditStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogResponse {
    private Long id;
    private Long userId;
    private String actionType;
    private String targetTable;
    private String targetId;
    private String beforeState;
    private String afterState;
    private AuditStatus status;
    private String errorMessage;
    private LocalDateTime actionTime;
}
