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

import io.pipekernel.common.function.ThrowingRunnable;
import io.pipekernel.common.function.ThrowingSupplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Function;
import java.util.function.Supplier;

import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * An immutable, suspended stream computation that may exchange values with both
 * its upstream and its downstream, perform effects, and finally return a result.
 * <p>
 * Type parameters:
 * <ul>
 * <li>{@code A1} - address sent upstream by {@link #request}</li>
 * <li>{@code A} - reply received from upstream</li>
 * <li>{@code B1} - reply received from downstream</li>
 * <li>{@code B} - value sent downstream by {@link #respond}</li>
 * <li>{@code R} - final result</li>
 * </ul>
 * Every proxy, once {@link #step() stepped}, is one of four variants:
 * {@link Request}, {@link Respond}, {@link Action} or {@link Pure}.
 * Sequencing with {@link #then} is recorded lazily and reassociated by {@link #step()}
 * in a loop, so arbitrarily long chains of binds never grow the call stack.
 * <p>
 * Building a proxy performs no effects. Effects belong in {@link Action} nodes
 * (see {@link #defer}, {@link #lift}, {@link #execute}), which run only when a traversal
 * reaches them, exactly once per traversal. Continuations passed to {@link #then}
 * are expected to be free of side effects, since composition operators may invoke
 * them ahead of the traversal.
 *
 * @see Proxies
 */
public abstract class Proxy<A1, A, B1, B, R> {
	Proxy() {
	}

	// region factories
	public static <A1, A, B1, B, R> Proxy<A1, A, B1, B, R> pure(@Nullable R result) {
		return new Pure<>(result);
	}

	/**
	 * Suspends, sending {@code address} upstream, and returns the reply.
	 */
	public static <A1, A, B1, B> Proxy<A1, A, B1, B, A> request(@Nullable A1 address) {
		return new Request<>(address, Proxy::pure);
	}

	/**
	 * Suspends, sending {@code value} downstream, and returns the reply.
	 */
	public static <A1, A, B1, B> Proxy<A1, A, B1, B, B1> respond(@Nullable B value) {
		return new Respond<>(value, Proxy::pure);
	}

	/**
	 * A shortcut for {@link #request} with a unit address, used by stages whose
	 * upstream is a plain one-directional source.
	 */
	public static <A, B1, B> Proxy<Void, A, B1, B, A> await() {
		return request(null);
	}

	/**
	 * Creates an {@link Action} node: the effect runs when a traversal reaches it,
	 * and the proxy it returns is where the traversal continues.
	 */
	public static <A1, A, B1, B, R> Proxy<A1, A, B1, B, R> defer(@NotNull ThrowingSupplier<? extends Proxy<A1, A, B1, B, R>> effect) {
		return new Action<>(checkNotNull(effect));
	}

	/**
	 * Performs one effect and returns its value.
	 */
	public static <A1, A, B1, B, R> Proxy<A1, A, B1, B, R> lift(@NotNull ThrowingSupplier<? extends R> effect) {
		checkNotNull(effect);
		return new Action<>(() -> pure(effect.get()));
	}

	/**
	 * Performs one effect that returns nothing.
	 */
	public static <A1, A, B1, B> Proxy<A1, A, B1, B, Void> execute(@NotNull ThrowingRunnable effect) {
		checkNotNull(effect);
		return new Action<>(() -> {
			effect.run();
			return pure(null);
		});
	}

	/**
	 * Delays building a proxy until it is stepped. Unlike {@link #defer} this adds no
	 * {@link Action} node, so the supplier must not have side effects.
	 */
	public static <A1, A, B1, B, R> Proxy<A1, A, B1, B, R> lazy(@NotNull Supplier<? extends Proxy<A1, A, B1, B, R>> supplier) {
		checkNotNull(supplier);
		return new Bind<A1, A, B1, B, Void, R>(pure(null), $ -> supplier.get());
	}
	// endregion

	// region sequencing
	public final <R2> Proxy<A1, A, B1, B, R2> then(@NotNull Function<? super R, ? extends Proxy<A1, A, B1, B, R2>> next) {
		return new Bind<>(this, checkNotNull(next));
	}

	public final <R2> Proxy<A1, A, B1, B, R2> andThen(@NotNull Proxy<A1, A, B1, B, R2> next) {
		checkNotNull(next);
		return then($ -> next);
	}

	public final <R2> Proxy<A1, A, B1, B, R2> map(@NotNull Function<? super R, ? extends R2> fn) {
		checkNotNull(fn);
		return then(result -> pure(fn.apply(result)));
	}
	// endregion

	/**
	 * Reduces this proxy to its outermost variant: a {@link Request}, a {@link Respond},
	 * an {@link Action} or a {@link Pure}. No effect is performed.
	 */
	@SuppressWarnings("unchecked")
	public final Proxy<A1, A, B1, B, R> step() {
		Proxy<A1, A, B1, B, Object> current = (Proxy<A1, A, B1, B, Object>) this;
		while (current instanceof Bind) {
			Bind<A1, A, B1, B, Object, Object> bind = (Bind<A1, A, B1, B, Object, Object>) current;
			Function<Object, Proxy<A1, A, B1, B, Object>> next = bind.next;
			Proxy<A1, A, B1, B, Object> source = bind.source;
			if (source instanceof Bind) {
				Bind<A1, A, B1, B, Object, Object> inner = (Bind<A1, A, B1, B, Object, Object>) source;
				Function<Object, Proxy<A1, A, B1, B, Object>> innerNext = inner.next;
				current = new Bind<>(inner.source, x -> new Bind<>(innerNext.apply(x), next));
			} else if (source instanceof Pure) {
				current = next.apply(((Pure<A1, A, B1, B, Object>) source).result);
			} else if (source instanceof Request) {
				Request<A1, A, B1, B, Object> request = (Request<A1, A, B1, B, Object>) source;
				return (Proxy<A1, A, B1, B, R>) new Request<A1, A, B1, B, Object>(request.address,
						reply -> new Bind<>(request.resume(reply), next));
			} else if (source instanceof Respond) {
				Respond<A1, A, B1, B, Object> respond = (Respond<A1, A, B1, B, Object>) source;
				return (Proxy<A1, A, B1, B, R>) new Respond<A1, A, B1, B, Object>(respond.value,
						reply -> new Bind<>(respond.resume(reply), next));
			} else {
				Action<A1, A, B1, B, Object> action = (Action<A1, A, B1, B, Object>) source;
				return (Proxy<A1, A, B1, B, R>) new Action<A1, A, B1, B, Object>(
						() -> new Bind<>(action.perform(), next));
			}
		}
		return (Proxy<A1, A, B1, B, R>) current;
	}

	/**
	 * Suspended on a request upstream; {@link #resume} continues with the reply.
	 */
	public static final class Request<A1, A, B1, B, R> extends Proxy<A1, A, B1, B, R> {
		@Nullable
		private final A1 address;
		private final Function<? super A, ? extends Proxy<A1, A, B1, B, R>> continuation;

		Request(@Nullable A1 address, Function<? super A, ? extends Proxy<A1, A, B1, B, R>> continuation) {
			this.address = address;
			this.continuation = continuation;
		}

		@Nullable
		public A1 getAddress() {
			return address;
		}

		public Proxy<A1, A, B1, B, R> resume(@Nullable A reply) {
			return continuation.apply(reply);
		}

		@Override
		public String toString() {
			return "Request{" + address + '}';
		}
	}

	/**
	 * Suspended on a value sent downstream; {@link #resume} continues with the downstream reply.
	 */
	public static final class Respond<A1, A, B1, B, R> extends Proxy<A1, A, B1, B, R> {
		@Nullable
		private final B value;
		private final Function<? super B1, ? extends Proxy<A1, A, B1, B, R>> continuation;

		Respond(@Nullable B value, Function<? super B1, ? extends Proxy<A1, A, B1, B, R>> continuation) {
			this.value = value;
			this.continuation = continuation;
		}

		@Nullable
		public B getValue() {
			return value;
		}

		public Proxy<A1, A, B1, B, R> resume(@Nullable B1 reply) {
			return continuation.apply(reply);
		}

		@Override
		public String toString() {
			return "Respond{" + value + '}';
		}
	}

	/**
	 * One unit of work; {@link #perform} runs it and returns the next proxy.
	 */
	public static final class Action<A1, A, B1, B, R> extends Proxy<A1, A, B1, B, R> {
		private final ThrowingSupplier<? extends Proxy<A1, A, B1, B, R>> effect;

		Action(ThrowingSupplier<? extends Proxy<A1, A, B1, B, R>> effect) {
			this.effect = effect;
		}

		public Proxy<A1, A, B1, B, R> perform() throws Exception {
			return effect.get();
		}

		@Override
		public String toString() {
			return "Action";
		}
	}

	public static final class Pure<A1, A, B1, B, R> extends Proxy<A1, A, B1, B, R> {
		@Nullable
		private final R result;

		Pure(@Nullable R result) {
			this.result = result;
		}

		@Nullable
		public R getResult() {
			return result;
		}

		@Override
		public String toString() {
			return "Pure{" + result + '}';
		}
	}

	static final class Bind<A1, A, B1, B, X, R> extends Proxy<A1, A, B1, B, R> {
		final Proxy<A1, A, B1, B, X> source;
		final Function<X, Proxy<A1, A, B1, B, R>> next;

		@SuppressWarnings("unchecked")
		Bind(Proxy<A1, A, B1, B, X> source, Function<? super X, ? extends Proxy<A1, A, B1, B, R>> next) {
			this.source = source;
			this.next = (Function<X, Proxy<A1, A, B1, B, R>>) next;
		}

		@Override
		public String toString() {
			return "Bind{" + source + '}';
		}
	}
}
