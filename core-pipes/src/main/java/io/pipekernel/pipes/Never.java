/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
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
package io.pipekernel.pipes;

import org.jetbrains.annotations.Nullable;

/**
 * A type without values, used to close an interface of a {@link Proxy}.
 * <p>
 * A {@link Source} requests nothing upstream, so its upstream address type is {@code Never};
 * a {@link Sink} sends nothing downstream, so its downstream value type is {@code Never}.
 * A traversal that nevertheless finds such a request or value calls {@link #absurd}.
 */
public final class Never {
	private Never() {
		throw new AssertionError();
	}

	/**
	 * Marks a branch that a well-typed pipeline cannot reach. Always throws.
	 */
	public static <T> T absurd(@Nullable Never never) {
		throw new AssertionError("Unreachable: a closed interface of a pipeline was used");
	}
}
