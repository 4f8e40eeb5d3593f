package com.relaytide.service;

import com.relaytide.client.AccessCredential;
import com.relaytide.client.MailSnapshot;
import com.relaytide.client.MeetingSnapshot;

/**
 * Decides whether an observed interaction should be flagged as action-required.
 * Business heuristic, kept out of the extraction handlers so it can be swapped.
 */
public interface InteractionSignalClassifier {

    boolean isActionRequired(MailSnapshot mail, AccessCredential credential);

    boolean isActionRequired(MeetingSnapshot meeting, AccessCredential credential);
}
