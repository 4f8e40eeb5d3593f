package com.relaytide.service;

import com.relaytide.client.AccessCredential;

import java.util.Optional;

/**
 * Supplies a usable provider credential for an account.
 * Empty means the account has no valid connection and ingestion must fail fast.
 */
public interface CredentialProvider {

    Optional<AccessCredential> credentialFor(String accountId);
}
