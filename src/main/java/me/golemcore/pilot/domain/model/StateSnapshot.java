package me.golemcore.pilot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Locale;
import java.util.Map;

/**
 * Snapshot of the environment as last confirmed by a state-check action.
 */
public record StateSnapshot(String url, String title, String text) {

    /**
     * A snapshot only confirms a location when its URL points to a real page.
     * Blank browser pages and placeholders do not count.
     */
    public boolean isConfirmedLocation() {
        if (url == null || url.isBlank()) {
            return false;
        }
        String normalized = url.trim().toLowerCase(Locale.ROOT);
        return !normalized.startsWith("about:") && !"current_page".equals(normalized);
    }

    /**
     * Reads a snapshot from a state-check result payload. Accepts the fields at the
     * top level or nested under {@code pageContext}.
     */
    @SuppressWarnings("unchecked")
    public static StateSnapshot fromData(Object data) {
        if (data instanceof StateSnapshot snapshot) {
            return snapshot;
        }
        if (!(data instanceof Map<?, ?> map)) {
            return null;
        }
        Object nested = map.get("pageContext");
        if (nested instanceof Map<?, ?> && !map.containsKey("url")) {
            return fromData(nested);
        }
        Object url = map.get("url");
        if (url == null) {
            return null;
        }
        Object title = map.get("title");
        Object text = map.get("text");
        return new StateSnapshot(String.valueOf(url), title != null ? String.valueOf(title) : null,
                text != null ? String.valueOf(text) : null);
    }
}
