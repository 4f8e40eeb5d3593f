package com.relaytide.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.io.Serializable;

@Embeddable
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
@EqualsAndHashCode
public class IngestionClaimKey implements Serializable {

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(nullable = false)
    private String source;

    @Column(name = "external_key", nullable = false)
    private String externalKey;
}
