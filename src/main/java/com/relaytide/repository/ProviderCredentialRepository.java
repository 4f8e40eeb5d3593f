package com.relaytide.repository;

import com.relaytide.model.ProviderCredential;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ProviderCredentialRepository extends JpaRepository<ProviderCredential, UUID> {

    Optional<ProviderCredential> findByAccountId(String accountId);

    // Used by the Gmail webhook: notification emailAddress → account
    Optional<ProviderCredential> findFirstByProviderEmailIgnoreCaseAndConnectedTrue(String providerEmail);
}
