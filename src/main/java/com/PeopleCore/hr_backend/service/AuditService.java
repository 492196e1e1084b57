package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.response.AuditLogResponse;
import com.PeopleCore.hr_backend.dto.response.PaginatedResponse;
import com.PeopleCore.hr_backend.enums.AuditStatus;
import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.exception.ValidationException;
import com.PeopleCore.hr_backend.model.AuditLog;
import com.PeopleCore.hr_backend.repository.AuditLogRepository;
import com.PeopleCore.hr_backend.util.Constants;
import com.PeopleCore.hr_backend.util.DateUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes and reads the audit trail. Entries are written inside the caller's transaction so
 * they roll back together with the audited change.
 */
@Service
@Slf4j
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final CurrentUserService currentUserService;
    private final ModelMapper modelMapper;
    private final ObjectMapper objectMapper;

    public AuditService(AuditLogRepository auditLogRepository,
                        CurrentUserService currentUserService,
                        ModelMapper modelMapper) {
        this.auditLogRepository = auditLogRepository;
        this.currentUserService = currentUserService;
        this.modelMapper = modelMapper;
        this.objectMapper = Jackson2ObjectMapperBuilder.json().build();
    }

    @Transactional
    public AuditLog record(String actionType, String targetTable, Object targetId, Object before, Object after) {
        AuditLog entry = AuditLog.builder()
                .userId(currentUserService.currentUserId())
                .actionType(actionType)
                .targetTable(targetTable)
                .targetId(targetId != null ? String.valueOf(targetId) : null)
                .beforeState(toJson(before))
                .afterState(toJson(after))
                .status(AuditStatus.SUCCESS)
                .actionTime(LocalDateTime.now())
                .build();

        return auditLogRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<AuditLogResponse> getAuditLogs(LocalDate startDate, LocalDate endDate, int page, int limit) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new ValidationException("Start date must be on or before end date");
        }
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), Constants.MAX_PAGE_SIZE);
        Pageable pageable = PageRequest.of(safePage - 1, safeLimit, Sort.by("actionTime").descending());

        Page<AuditLog> logs = auditLogRepository.findByActionTimeRange(
                DateUtil.getStartOfDay(startDate),
                DateUtil.getStartOfNextDay(endDate),
                pageable);

        List<AuditLogResponse> responses = logs.getContent()
                .stream()
                .map(this::mapToAuditLogResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(responses, safePage, safeLimit, logs.getTotalElements());
    }

    @Transactional(readOnly = true)
    public AuditLogResponse getAuditLogById(Long id) {
        AuditLog entry = auditLogRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("AuditLog", "id", id));
        return mapToAuditLogResponse(entry);
    }

    private String toJson(Object state) {
        if (state == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit state of type {}: {}", state.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(state);
        }
    }

    private AuditLogResponse mapToAuditLogResponse(AuditLog entry) {
        return modelMapper.map(entry, AuditLogResponse.class);
    }
}
