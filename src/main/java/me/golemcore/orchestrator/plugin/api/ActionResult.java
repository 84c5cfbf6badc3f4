package me.golemcore.orchestrator.plugin.api;

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

import me.golemcore.orchestrator.domain.model.ContextItem;

import java.util.List;

/**
 * Outcome of a plugin action: new items to append, or an error description.
 */
public final class ActionResult {

    private final boolean success;
    private final List<ContextItem> items;
    private final String error;

    private ActionResult(boolean success, List<ContextItem> items, String error) {
        this.success = success;
        this.items = items;
        this.error = error;
    }

    public static ActionResult success(List<ContextItem> items) {
        return new ActionResult(true, items != null ? List.copyOf(items) : List.of(), null);
    }

    public static ActionResult success(ContextItem item) {
        return new ActionResult(true, List.of(item), null);
    }

    public static ActionResult empty() {
        return new ActionResult(true, List.of(), null);
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, List.of(), error != null ? error : "Action failed");
    }

    public boolean isSuccess() {
        return success;
    }

    public List<ContextItem> getItems() {
        return items;
    }

    public String getError() {
        return error;
    }
}
