package com.relaytide.service;

import com.relaytide.model.InteractionRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RecordedInteraction {

    private final InteractionRecord record;
    // false on a replay: the existing row is returned and statistics are untouched
    private final boolean created;
}
