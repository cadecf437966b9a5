package com.papertrail.core.facts;

public enum OwnershipRole {
    OWNER,
    DIRECTOR
}
