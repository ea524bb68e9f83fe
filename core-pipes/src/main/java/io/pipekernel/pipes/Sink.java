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

import io.pipekernel.common.function.ThrowingConsumer;
import org.jetbrains.annotations.NotNull;

import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * A stream stage that only receives values from upstream: its downstream interface is closed.
 */
public final class Sink<A, R> {
	private final Proxy<Void, A, Void, Never, R> proxy;

	private Sink(Proxy<Void, A, Void, Never, R> proxy) {
		this.proxy = proxy;
	}

	public static <A, R> Sink<A, R> ofProxy(@NotNull Proxy<Void, A, Void, Never, R> proxy) {
		return new Sink<>(checkNotNull(proxy));
	}

	/**
	 * Creates a sink that takes a single value and returns it.
	 */
	public static <A> Sink<A, A> await() {
		return new Sink<>(Proxy.await());
	}

	/**
	 * Creates a sink that runs {@code consumer} for every value it receives. It never finishes
	 * on its own, so the pipeline ends when its upstream does.
	 */
	public static <A, R> Sink<A, R> forEach(@NotNull ThrowingConsumer<? super A> consumer) {
		checkNotNull(consumer);
		return new Sink<>(Proxies.forRespond(Proxies.<A, R>cat(),
				value -> Proxy.<Void, A, Void, Never>execute(() -> consumer.accept(value))));
	}

	/**
	 * Creates a sink that discards every value it receives.
	 */
	public static <A, R> Sink<A, R> drain() {
		return new Sink<>(Proxies.forRespond(Proxies.<A, R>cat(), $ -> Proxy.<Void, A, Void, Never, Void>pure(null)));
	}

	public Proxy<Void, A, Void, Never, R> getProxy() {
		return proxy;
	}

	/**
	 * Returns this sink as a proxy with an arbitrary downstream interface.
	 * A value reaching the closed downstream is a contract violation.
	 */
	public <B1, B> Proxy<Void, A, B1, B, R> toProxy() {
		return Proxies.forRespond(proxy, Never::absurd);
	}
}
