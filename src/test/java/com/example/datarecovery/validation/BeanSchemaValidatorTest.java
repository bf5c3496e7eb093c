package com.example.datarecovery.validation;

import com.example.datarecovery.RecordFixtures;
import com.example.datarecovery.store.StoreCollection;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BeanSchemaValidator.
 * Tests the per-collection record schemas and how failures are reported.
 */
class BeanSchemaValidatorTest {

    private static ValidatorFactory validatorFactory;
    private static BeanSchemaValidator validator;

    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = new BeanSchemaValidator(validatorFactory.getValidator(), new ObjectMapper().findAndRegisterModules());
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    @Test
    void testValidRecordsPass() {
        assertTrue(validator.validate(StoreCollection.USERS, RecordFixtures.user("alice")).isSuccess());
        assertTrue(validator.validate(StoreCollection.CANDIDATES, RecordFixtures.candidate("Jane")).isSuccess());
        assertTrue(validator.validate(StoreCollection.JOBS, RecordFixtures.job("Backend Engineer")).isSuccess());
        assertTrue(validator.validate(StoreCollection.CLIENTS, RecordFixtures.client("Acme Corp")).isSuccess());
        assertTrue(validator.validate(StoreCollection.INVOICES, RecordFixtures.invoice(1, 2)).isSuccess());
    }

    @Test
    void testUnknownFieldsAreIgnored() {
        ObjectNode user = RecordFixtures.user("alice");
        user.put("_id", "65f1c0ffee");
        user.put("createdAt", "2024-03-01T10:00:00Z");

        assertTrue(validator.validate(StoreCollection.USERS, user).isSuccess());
    }

    @Test
    void testCollectionsWithoutSchemaAlwaysPass() {
        ObjectNode anything = mapper.createObjectNode().put("whatever", 1);

        assertTrue(validator.validate(StoreCollection.EMPLOYEES, anything).isSuccess());
        assertTrue(validator.validate(StoreCollection.AUDIT_LOGS, mapper.createArrayNode()).isSuccess());
    }

    @Test
    void testShortJobTitleIsReported() {
        SchemaValidationResult result = validator.validate(StoreCollection.JOBS, RecordFixtures.job("Dev"));

        assertFalse(result.isSuccess());
        assertEquals(List.of("title: Job title must be at least 5 characters"), result.getErrors());
    }

    @Test
    void testMultipleViolationsAreSorted() {
        ObjectNode user = RecordFixtures.user("al");
        user.put("email", "not-an-email");
        user.put("role", "Janitor");

        SchemaValidationResult result = validator.validate(StoreCollection.USERS, user);

        assertEquals(List.of(
            "email: Invalid email format",
            "role: Unknown role",
            "username: Username must be at least 3 characters"), result.getErrors());
    }

    @Test
    void testMissingRequiredField() {
        ObjectNode client = RecordFixtures.client("Acme Corp");
        client.remove("address");

        SchemaValidationResult result = validator.validate(StoreCollection.CLIENTS, client);

        assertEquals(List.of("address: Address is required"), result.getErrors());
    }

    @Test
    void testInvalidPhoneNumber() {
        ObjectNode candidate = RecordFixtures.candidate("Jane");
        candidate.put("phone", "12-34");

        SchemaValidationResult result = validator.validate(StoreCollection.CANDIDATES, candidate);

        assertEquals(List.of("phone: Invalid phone number format"), result.getErrors());
    }

    @Test
    void testHistoricalInvoiceDueDateIsAccepted() {
        ObjectNode invoice = RecordFixtures.invoice(1, 2);
        invoice.put("dueDate", "2001-01-01T00:00:00Z");

        assertTrue(validator.validate(StoreCollection.INVOICES, invoice).isSuccess());
    }

    @Test
    void testNonPositiveInvoiceAmount() {
        ObjectNode invoice = RecordFixtures.invoice(1, 2);
        invoice.put("amount", 0);

        SchemaValidationResult result = validator.validate(StoreCollection.INVOICES, invoice);

        assertEquals(List.of("amount: Amount must be greater than 0"), result.getErrors());
    }

    @Test
    void testWrongFieldTypeIsReported() {
        ObjectNode invoice = RecordFixtures.invoice(1, 2);
        invoice.put("clientId", "abc");

        SchemaValidationResult result = validator.validate(StoreCollection.INVOICES, invoice);

        assertEquals(List.of("clientId: invalid value"), result.getErrors());
    }

    @Test
    void testNonObjectRecordIsRejected() {
        SchemaValidationResult result = validator.validate(StoreCollection.USERS, mapper.getNodeFactory().textNode("alice"));

        assertFalse(result.isSuccess());
        assertEquals(List.of("record must be a JSON object"), result.getErrors());
    }
}
