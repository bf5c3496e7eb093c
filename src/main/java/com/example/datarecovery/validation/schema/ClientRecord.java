package com.example.datarecovery.validation.schema;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Schema of a {@code clients} record.
 */
@Data
public class ClientRecord {

    @NotNull(message = "Company name is required")
    @Size(min = 2, message = "Company name must be at least 2 characters")
    private String companyName;

    @NotNull(message = "Contact person is required")
    @Size(min = 2, message = "Contact person name must be at least 2 characters")
    private String contactPerson;

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    private String email;

    @NotNull(message = "Phone is required")
    @Pattern(regexp = PhonePattern.REGEX, message = "Invalid phone number format")
    private String phone;

    @NotNull(message = "Address is required")
    @Size(min = 10, message = "Address must be at least 10 characters")
    private String address;

    @NotNull(message = "Status is required")
    @Pattern(regexp = "active|inactive", message = "Unknown client status")
    private String status;
}
