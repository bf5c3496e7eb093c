package com.example.datarecovery.validation.schema;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Schema of a {@code candidates} record.
 */
@Data
public class CandidateRecord {

    @NotNull(message = "First name is required")
    @Size(min = 2, message = "First name must be at least 2 characters")
    private String firstName;

    @NotNull(message = "Last name is required")
    @Size(min = 2, message = "Last name must be at least 2 characters")
    private String lastName;

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    private String email;

    @NotNull(message = "Phone is required")
    @Pattern(regexp = PhonePattern.REGEX, message = "Invalid phone number format")
    private String phone;

    @NotNull(message = "Skills are required")
    @Size(min = 1, message = "At least one skill is required")
    private List<String> skills;

    @NotNull(message = "Experience is required")
    @Size(min = 10, message = "Experience description must be at least 10 characters")
    private String experience;

    @NotNull(message = "Status is required")
    @Pattern(regexp = "applied|interviewed|hired|rejected", message = "Unknown candidate status")
    private String status;
}
