/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.wirelet;

import org.jspecify.annotations.Nullable;

/**
 * Callback run by the server around its listening lifetime, e.g. to open and close a connection pool held by the
 * application context.
 *
 * @param <C> the application context type
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 * @see Server.Builder#beforeStart(LifecycleHook)
 * @see Server.Builder#afterStop(LifecycleHook)
 */
@FunctionalInterface
public interface LifecycleHook<C> {
	void invoke(@Nullable C context) throws Exception;
}
