package com.PeopleCore.hr_backend.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "leave_types")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeaveType {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;
}
