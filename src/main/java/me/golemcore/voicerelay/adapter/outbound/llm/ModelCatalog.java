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

package me.golemcore.voicerelay.adapter.outbound.llm;

import me.golemcore.voicerelay.domain.model.ModelInfo;

import java.util.List;

/**
 * Static model catalogs of the cloud providers. Entries flagged unavailable
 * are listed but cannot be selected.
 */
public final class ModelCatalog {

    public static final List<ModelInfo> OPENAI = List.of(
            new ModelInfo("gpt-4o", "GPT-4o", true, "high"),
            new ModelInfo("gpt-3.5-turbo", "GPT-3.5 Turbo", true, "low"),
            new ModelInfo("o3-mini", "o3-mini", false, "medium"));

    public static final List<ModelInfo> CLAUDE = List.of(
            new ModelInfo("claude-3-5-sonnet-20241022", "Claude 3.5 Sonnet", true, "high"),
            new ModelInfo("claude-3-haiku-20240307", "Claude 3 Haiku", true, "low"),
            new ModelInfo("claude-3-opus-20240229", "Claude 3 Opus", false, "high"));

    public static final List<ModelInfo> XAI = List.of(
            new ModelInfo("grok-2-latest", "Grok 2", true, "high"),
            new ModelInfo("grok-2-mini", "Grok 2 Mini", true, "low"));

    private ModelCatalog() {
    }
}
