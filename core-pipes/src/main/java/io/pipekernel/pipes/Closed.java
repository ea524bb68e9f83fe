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

import io.pipekernel.pipes.Proxy.Action;
import io.pipekernel.pipes.Proxy.Pure;
import io.pipekernel.pipes.Proxy.Request;
import io.pipekernel.pipes.Proxy.Respond;
import org.jetbrains.annotations.NotNull;

import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * A self-contained effectful computation with both interfaces closed,
 * typically a {@link Source} connected to a {@link Sink}.
 */
public final class Closed<R> {
	private final Proxy<Never, Void, Void, Never, R> proxy;

	private Closed(Proxy<Never, Void, Void, Never, R> proxy) {
		this.proxy = proxy;
	}

	public static <R> Closed<R> ofProxy(@NotNull Proxy<Never, Void, Void, Never, R> proxy) {
		return new Closed<>(checkNotNull(proxy));
	}

	public Proxy<Never, Void, Void, Never, R> getProxy() {
		return proxy;
	}

	/**
	 * Performs every effect of this computation in order and returns its result.
	 * An exception thrown by an effect stops the run and is rethrown as is.
	 */
	@SuppressWarnings("unchecked")
	public R run() throws Exception {
		Proxy<Never, Void, Void, Never, R> current = proxy;
		while (true) {
			Proxy<Never, Void, Void, Never, R> step = current.step();
			if (step instanceof Action) {
				current = ((Action<Never, Void, Void, Never, R>) step).perform();
			} else if (step instanceof Pure) {
				return ((Pure<Never, Void, Void, Never, R>) step).getResult();
			} else if (step instanceof Request) {
				return Never.absurd(((Request<Never, Void, Void, Never, R>) step).getAddress());
			} else {
				return Never.absurd(((Respond<Never, Void, Void, Never, R>) step).getValue());
			}
		}
	}
}
