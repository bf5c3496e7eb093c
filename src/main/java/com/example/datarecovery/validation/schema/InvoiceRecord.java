package com.example.datarecovery.validation.schema;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Schema of an {@code invoices} record.
 * The due date is only required, not required to lie in the future: restored invoices are historical.
 */
@Data
public class InvoiceRecord {

    @NotNull(message = "Client must be selected")
    @Positive(message = "Client must be selected")
    private Long clientId;

    @NotNull(message = "Candidate must be selected")
    @Positive(message = "Candidate must be selected")
    private Long candidateId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    private BigDecimal amount;

    @NotNull(message = "Status is required")
    @Pattern(regexp = "draft|sent|paid", message = "Unknown invoice status")
    private String status;

    @NotNull(message = "Due date is required")
    private Instant dueDate;
}
