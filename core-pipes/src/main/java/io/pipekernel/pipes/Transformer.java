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

import org.jetbrains.annotations.NotNull;

import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * A one-directional stream stage: it awaits values of type {@code A} from upstream
 * and sends values of type {@code B} downstream.
 *
 * @see Transformers
 * @see Exchanges#generalize
 */
public final class Transformer<A, B, R> {
	private final Proxy<Void, A, Void, B, R> proxy;

	private Transformer(Proxy<Void, A, Void, B, R> proxy) {
		this.proxy = proxy;
	}

	public static <A, B, R> Transformer<A, B, R> ofProxy(@NotNull Proxy<Void, A, Void, B, R> proxy) {
		return new Transformer<>(checkNotNull(proxy));
	}

	public Proxy<Void, A, Void, B, R> getProxy() {
		return proxy;
	}

	public <C> Transformer<A, C, R> pipe(@NotNull Transformer<B, C, R> next) {
		return new Transformer<>(Proxies.connect(proxy, next.proxy));
	}

	public Sink<A, R> into(@NotNull Sink<B, R> sink) {
		return Sink.ofProxy(Proxies.connect(proxy, sink.getProxy()));
	}
}
