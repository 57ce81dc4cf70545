package me.golemcore.memory.adapter.outbound.repository;

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
/**
 * Process-local repository. State is lost on restart; used for ephemeral
 * deployments and as the test double of {@link me.golemcore.memory.port.outbound.MemoryRepositoryPort}.
 */
public class InMemoryMemoryRepository extends AbstractMapMemoryRepository {
}
