package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.ContactAddress;
import com.relaytide.client.MailSnapshot;
import com.relaytide.client.MeetingSnapshot;
import org.springframework.stereotype.Component;

/**
 * Mail addressed directly to the account owner and still unread needs action.
 * Meetings never do.
 */
@Component
public class DirectAddressSignalClassifier implements InteractionSignalClassifier {

    private static final String UNREAD = "UNREAD";

    @Override
    public boolean isActionRequired(MailSnapshot mail, AccessCredential credential) {
        String owner = credential.getAccountEmail();
        if (owner == null || !mail.getLabelIds().contains(UNREAD)) {
            return false;
        }
        return mail.getRecipients().stream()
                .map(ContactAddress::getEmail)
                .anyMatch(owner::equalsIgnoreCase);
    }

    @Override
    public boolean isActionRequired(MeetingSnapshot meeting, AccessCredential credential) {
        return false;
    }
}
