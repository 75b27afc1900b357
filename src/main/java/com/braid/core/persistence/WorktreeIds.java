package com.braid.core.persistence;

import java.util.UUID;

final class WorktreeIds {

    private WorktreeIds() {
    }

    static String next() {
        return "wt-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
