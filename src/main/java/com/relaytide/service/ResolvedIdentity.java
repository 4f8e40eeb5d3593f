package com.relaytide.service;

import com.relaytide.model.Identity;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ResolvedIdentity {

    private final Identity identity;
    // false when the identity already existed (or a concurrent call created it first)
    private final boolean created;
}
