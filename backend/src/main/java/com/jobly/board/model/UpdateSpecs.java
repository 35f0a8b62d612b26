package com.jobly.board.model;

import java.util.Map;

final class UpdateSpecs {
    private UpdateSpecs() {
    }

    static void putIfPresent(Map<String, Object> spec, String field, Object value) {
        if (value != null) {
            spec.put(field, value);
        }
    }
}
