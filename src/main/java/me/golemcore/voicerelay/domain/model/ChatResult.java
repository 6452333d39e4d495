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

package me.golemcore.voicerelay.domain.model;

/**
 * Normalized outcome of a routed chat call.
 *
 * @param text
 *            assistant reply, never blank
 * @param provider
 *            provider that produced the reply
 * @param model
 *            model used by that provider
 * @param fallbackUsed
 *            true when the reply came from a provider other than the one
 *            requested
 */
public record ChatResult(String text, String provider, String model, boolean fallbackUsed) {
}
