package com.example.datarecovery.validation.schema;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Schema of a {@code jobs} record.
 */
@Data
public class JobRecord {

    @NotNull(message = "Job title is required")
    @Size(min = 5, message = "Job title must be at least 5 characters")
    private String title;

    @NotNull(message = "Job description is required")
    @Size(min = 50, message = "Job description must be at least 50 characters")
    private String description;

    @NotNull(message = "Requirements are required")
    @Size(min = 1, message = "At least one requirement is required")
    private List<String> requirements;

    @NotNull(message = "Location is required")
    @Size(min = 2, message = "Location must be at least 2 characters")
    private String location;

    @NotNull(message = "Salary is required")
    @Size(min = 1, message = "Salary is required")
    private String salary;

    @NotNull(message = "Status is required")
    @Pattern(regexp = "active|filled|closed", message = "Unknown job status")
    private String status;
}
