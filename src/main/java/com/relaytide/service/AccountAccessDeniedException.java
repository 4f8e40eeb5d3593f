package com.relaytide.service;

public class AccountAccessDeniedException extends RuntimeException {

    public AccountAccessDeniedException(String accountId) {
        super("Caller is not authorized for account " + accountId);
    }
}
