package com.partnerlink.linking;

public enum LinkAction {
    LINK,
    CREATE,
    SKIP
}
