package com.PeopleCore.hr_backend.service;

import com.PeopleCore.hr_backend.dto.request.EmployeeRequest;
import com.PeopleCore.hr_backend.dto.response.EmployeeResponse;
import com.PeopleCore.hr_backend.dto.response.LookupResponse;
import com.PeopleCore.hr_backend.dto.response.PaginatedResponse;
import com.PeopleCore.hr_backend.enums.EmployeeStatus;
import com.PeopleCore.hr_backend.exception.ApiException;
import com.PeopleCore.hr_backend.exception.ResourceNotFoundException;
import com.PeopleCore.hr_backend.exception.ValidationException;
import com.PeopleCore.hr_backend.model.Department;
import com.PeopleCore.hr_backend.model.Employee;
import com.PeopleCore.hr_backend.model.Grade;
import com.PeopleCore.hr_backend.repository.DepartmentRepository;
import com.PeopleCore.hr_backend.repository.EmployeeRepository;
import com.PeopleCore.hr_backend.repository.GradeRepository;
import com.PeopleCore.hr_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmployeeService {

    private final EmployeeRepository employeeRepository;
    private final DepartmentRepository departmentRepository;
    private final GradeRepository gradeRepository;
    private final ModelMapper modelMapper;

    @Transactional(readOnly = true)
    public EmployeeResponse getEmployeeById(Long id) {
        return toResponse(findEmployee(id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<EmployeeResponse> getAllEmployees(int page, int limit, String search,
                                                               Long departmentId, EmployeeStatus status) {
        int safePage = Math.max(page, 1);
        int safeLimit = Math.min(Math.max(limit, 1), Constants.MAX_PAGE_SIZE);
        Pageable pageable = PageRequest.of(safePage - 1, safeLimit, Sort.by("fullName").ascending());

        Page<Employee> employeesPage = employeeRepository.searchEmployees(
                blankToNull(search), departmentId, status, pageable);

        List<EmployeeResponse> employeeResponses = employeesPage.getContent()
                .stream()
                .map(this::toResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(employeeResponses, safePage, safeLimit, employeesPage.getTotalElements());
    }

    @Transactional(readOnly = true)
    public List<EmployeeResponse> getActiveEmployees() {
        return employeeRepository.findByStatusOrderByFullNameAsc(EmployeeStatus.ACTIVE)
                .stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional
    public EmployeeResponse createEmployee(EmployeeRequest request) {
        if (employeeRepository.existsByEmployeeCode(request.getEmployeeCode())) {
            throw new ApiException("Employee code already exists", HttpStatus.BAD_REQUEST);
        }

        Employee employee = Employee.builder()
                .employeeCode(request.getEmployeeCode())
                .fullName(request.getFullName())
                .email(request.getEmail())
                .phone(request.getPhone())
                .designation(request.getDesignation())
                .department(request.getDepartmentId() != null ? findDepartment(request.getDepartmentId()) : null)
                .grade(request.getGradeId() != null ? findGrade(request.getGradeId()) : null)
                .joiningDate(request.getJoiningDate())
                .epfNo(request.getEpfNo())
                .status(EmployeeStatus.ACTIVE)
                .build();

        Employee savedEmployee = employeeRepository.save(employee);
        log.info("Employee created with ID: {}", savedEmployee.getId());

        return toResponse(savedEmployee);
    }

    @Transactional(readOnly = true)
    public List<LookupResponse> getDepartments() {
        return departmentRepository.findAllByOrderByNameAsc()
                .stream()
                .map(d -> new LookupResponse(d.getId(), d.getName()))
                .collect(Collectors.toList());
    }

    @Transactional
    public LookupResponse createDepartment(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Department name is required");
        }
        Department department = departmentRepository.save(Department.builder().name(name.trim()).build());
        log.info("Department created: {}", department.getName());
        return new LookupResponse(department.getId(), department.getName());
    }

    @Transactional(readOnly = true)
    public List<LookupResponse> getGrades() {
        return gradeRepository.findAllByOrderByNameAsc()
                .stream()
                .map(g -> new LookupResponse(g.getId(), g.getName()))
                .collect(Collectors.toList());
    }

    @Transactional
    public LookupResponse createGrade(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Grade name is required");
        }
        Grade grade = gradeRepository.save(Grade.builder().name(name.trim()).build());
        log.info("Grade created: {}", grade.getName());
        return new LookupResponse(grade.getId(), grade.getName());
    }

    public Employee findEmployee(Long id) {
        return employeeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Employee", "id", id));
    }

    public EmployeeResponse toResponse(Employee employee) {
        EmployeeResponse response = modelMapper.map(employee, EmployeeResponse.class);

        if (employee.getDepartment() != null) {
            response.setDepartmentId(employee.getDepartment().getId());
            response.setDepartmentName(employee.getDepartment().getName());
        }
        if (employee.getGrade() != null) {
            response.setGradeId(employee.getGrade().getId());
            response.setGradeName(employee.getGrade().getName());
        }

        return response;
    }

    private Department findDepartment(Long id) {
        return departmentRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Department", "id", id));
    }

    private Grade findGrade(Long id) {
        return gradeRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Grade", "id", id));
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
