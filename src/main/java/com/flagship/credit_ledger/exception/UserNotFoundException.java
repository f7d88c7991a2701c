package com.flagship.credit_ledger.exception;

public class UserNotFoundException extends LedgerException {

    private final String identifier;

    public UserNotFoundException(String identifier) {
        super(LedgerErrorKind.USER_NOT_FOUND, "User not found: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
