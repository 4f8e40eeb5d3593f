package com.relaytide.service;

import org.springframework.stereotype.Component;

/**
 * Default policy: the caller is the account id forwarded by the gateway in
 * X-Account-Id, and may only act on that account.
 */
@Component
public class CallerHeaderAccessPolicy implements AccountAccessPolicy {

    @Override
    public boolean canAccess(String caller, String accountId) {
        return caller != null && !caller.isBlank() && caller.equals(accountId);
    }
}
