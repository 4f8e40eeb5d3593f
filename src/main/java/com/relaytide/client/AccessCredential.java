package com.relaytide.client;

import lombok.*;

/**
 * A validated bearer token for one account, plus the mailbox it belongs to.
 * accountEmail lets extraction recognize the account owner among senders/attendees.
 */
@Getter @AllArgsConstructor @Builder
@ToString(exclude = "accessToken")
public class AccessCredential {

    private final String accountId;
    private final String accountEmail;
    private final String accessToken;
}
