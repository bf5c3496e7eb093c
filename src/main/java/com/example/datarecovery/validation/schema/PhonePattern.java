package com.example.datarecovery.validation.schema;

final class PhonePattern {

    /**
     * Optional leading '+', then at least ten digits, spaces, dashes or parentheses.
     */
    static final String REGEX = "^\\+?[\\d\\s\\-()]{10,}$";

    private PhonePattern() {
    }
}
