package com.relaytide.service;

/**
 * Capability check for account-scoped endpoints: may this caller act on this account?
 * Identity and sessions live outside this service.
 */
public interface AccountAccessPolicy {

    boolean canAccess(String caller, String accountId);

    default void requireAccess(String caller, String accountId) {
        if (!canAccess(caller, accountId)) {
            throw new AccountAccessDeniedException(accountId);
        }
    }
}
