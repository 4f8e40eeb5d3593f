package com.relaytide.client;

import lombok.*;

/**
 * A parsed mailbox: email is lowercased and trimmed, displayName may be null.
 */
@Getter @AllArgsConstructor @Builder
@EqualsAndHashCode @ToString
public class ContactAddress {

    private final String email;
    private final String displayName;
}
