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

package io.pipekernel.common;

/**
 * Fail-fast argument and state checks.
 */
public final class Preconditions {
	private Preconditions() {
	}

	public static <T> T checkNotNull(T reference) {
		if (reference == null) throw new NullPointerException();
		return reference;
	}

	public static void checkState(boolean expression, Object message) {
		if (!expression) throw new IllegalStateException(String.valueOf(message));
	}

	/**
	 * The message is built with {@link String#format} only when the check fails.
	 */
	public static void checkArgument(boolean expression, String template, Object... args) {
		if (!expression) throw new IllegalArgumentException(String.format(template, args));
	}
}
