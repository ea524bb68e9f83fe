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

import java.util.function.Function;

import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * Composition operators over {@link Proxy}.
 * <p>
 * There are four categories, each with a composition and an identity:
 * <ul>
 * <li>respond: {@link #composeRespond}, identity {@link Proxy#respond}</li>
 * <li>request: {@link #composeRequest}, identity {@link Proxy#request}</li>
 * <li>push: {@link #composePush}, identity {@link #push}</li>
 * <li>pull: {@link #composePull}, identity {@link #pull}</li>
 * </ul>
 * Each composition is associative and the identities are two-sided.
 * All operators are lazy: nothing is stepped until a traversal reaches the result.
 */
public final class Proxies {
	private Proxies() {
	}

	// region respond category
	/**
	 * Replaces every {@link Respond} of {@code proxy} with a call to {@code handler}.
	 * The handler's result is the reply the proxy gets back. Requests pass through unchanged.
	 */
	public static <X1, X, B1, B, C1, C, R> Proxy<X1, X, C1, C, R> forRespond(@NotNull Proxy<X1, X, B1, B, R> proxy,
			@NotNull Function<? super B, ? extends Proxy<X1, X, C1, C, B1>> handler) {
		checkNotNull(proxy);
		checkNotNull(handler);
		return Proxy.lazy(() -> forRespondStep(proxy, handler));
	}

	@SuppressWarnings("unchecked")
	private static <X1, X, B1, B, C1, C, R> Proxy<X1, X, C1, C, R> forRespondStep(Proxy<X1, X, B1, B, R> proxy,
			Function<? super B, ? extends Proxy<X1, X, C1, C, B1>> handler) {
		Proxy<X1, X, B1, B, R> step = proxy.step();
		if (step instanceof Respond) {
			Respond<X1, X, B1, B, R> respond = (Respond<X1, X, B1, B, R>) step;
			return handler.apply(respond.getValue())
					.then(reply -> forRespondStep(respond.resume(reply), handler));
		}
		if (step instanceof Request) {
			Request<X1, X, B1, B, R> request = (Request<X1, X, B1, B, R>) step;
			return new Request<>(request.getAddress(), reply -> forRespondStep(request.resume(reply), handler));
		}
		if (step instanceof Action) {
			Action<X1, X, B1, B, R> action = (Action<X1, X, B1, B, R>) step;
			return new Action<>(() -> forRespondStep(action.perform(), handler));
		}
		return Proxy.pure(((Pure<X1, X, B1, B, R>) step).getResult());
	}

	public static <X1, X, A, B1, B, C1, C, R> Function<A, Proxy<X1, X, C1, C, R>> composeRespond(
			@NotNull Function<? super A, ? extends Proxy<X1, X, B1, B, R>> first,
			@NotNull Function<? super B, ? extends Proxy<X1, X, C1, C, B1>> second) {
		checkNotNull(first);
		checkNotNull(second);
		return a -> forRespond(first.apply(a), second);
	}
	// endregion

	// region request category
	/**
	 * Replaces every {@link Request} of {@code proxy} with a call to {@code handler}.
	 * The handler's result is the reply the proxy gets back. Responds pass through unchanged.
	 */
	public static <A1, A, B1, B, Y1, Y, R> Proxy<A1, A, Y1, Y, R> forRequest(@NotNull Function<? super B1, ? extends Proxy<A1, A, Y1, Y, B>> handler,
			@NotNull Proxy<B1, B, Y1, Y, R> proxy) {
		checkNotNull(handler);
		checkNotNull(proxy);
		return Proxy.lazy(() -> forRequestStep(handler, proxy));
	}

	@SuppressWarnings("unchecked")
	private static <A1, A, B1, B, Y1, Y, R> Proxy<A1, A, Y1, Y, R> forRequestStep(Function<? super B1, ? extends Proxy<A1, A, Y1, Y, B>> handler,
			Proxy<B1, B, Y1, Y, R> proxy) {
		Proxy<B1, B, Y1, Y, R> step = proxy.step();
		if (step instanceof Request) {
			Request<B1, B, Y1, Y, R> request = (Request<B1, B, Y1, Y, R>) step;
			return handler.apply(request.getAddress())
					.then(reply -> forRequestStep(handler, request.resume(reply)));
		}
		if (step instanceof Respond) {
			Respond<B1, B, Y1, Y, R> respond = (Respond<B1, B, Y1, Y, R>) step;
			return new Respond<>(respond.getValue(), reply -> forRequestStep(handler, respond.resume(reply)));
		}
		if (step instanceof Action) {
			Action<B1, B, Y1, Y, R> action = (Action<B1, B, Y1, Y, R>) step;
			return new Action<>(() -> forRequestStep(handler, action.perform()));
		}
		return Proxy.pure(((Pure<B1, B, Y1, Y, R>) step).getResult());
	}

	public static <A1, A, B1, B, C1, Y1, Y, R> Function<C1, Proxy<A1, A, Y1, Y, R>> composeRequest(
			@NotNull Function<? super B1, ? extends Proxy<A1, A, Y1, Y, B>> first,
			@NotNull Function<? super C1, ? extends Proxy<B1, B, Y1, Y, R>> second) {
		checkNotNull(first);
		checkNotNull(second);
		return c1 -> forRequest(first, second.apply(c1));
	}
	// endregion

	// region push and pull categories
	/**
	 * Connects {@code upstream} to a downstream that is waiting for its first value.
	 * The upstream drives: every value it responds with starts or resumes the downstream.
	 */
	public static <A1, A, B1, B, C1, C, R> Proxy<A1, A, C1, C, R> pushTo(@NotNull Proxy<A1, A, B1, B, R> upstream,
			@NotNull Function<? super B, ? extends Proxy<B1, B, C1, C, R>> downstream) {
		checkNotNull(upstream);
		checkNotNull(downstream);
		return Proxy.lazy(() -> exchange(upstream, downstream, null, null));
	}

	/**
	 * Connects an upstream that is waiting for its first request to {@code downstream}.
	 * The downstream drives: every request it makes starts or resumes the upstream.
	 */
	public static <A1, A, B1, B, C1, C, R> Proxy<A1, A, C1, C, R> pullFrom(@NotNull Function<? super B1, ? extends Proxy<A1, A, B1, B, R>> upstream,
			@NotNull Proxy<B1, B, C1, C, R> downstream) {
		checkNotNull(upstream);
		checkNotNull(downstream);
		return Proxy.lazy(() -> exchange(null, null, upstream, downstream));
	}

	/**
	 * Runs the interaction of two adjacent stages until one of them has to suspend on
	 * its outer interface, performs an effect, or finishes.
	 * <p>
	 * Exactly one side is active: either {@code upstream} with {@code downstreamHandler}
	 * waiting for its value, or {@code downstream} with {@code upstreamHandler} waiting for
	 * its request. Control alternates inside the loop, so a long exchange runs in constant stack.
	 */
	@SuppressWarnings("unchecked")
	private static <A1, A, B1, B, C1, C, R> Proxy<A1, A, C1, C, R> exchange(
			Proxy<A1, A, B1, B, R> upstream, Function<? super B, ? extends Proxy<B1, B, C1, C, R>> downstreamHandler,
			Function<? super B1, ? extends Proxy<A1, A, B1, B, R>> upstreamHandler, Proxy<B1, B, C1, C, R> downstream) {
		while (true) {
			if (upstream != null) {
				Proxy<A1, A, B1, B, R> step = upstream.step();
				if (step instanceof Respond) {
					Respond<A1, A, B1, B, R> respond = (Respond<A1, A, B1, B, R>) step;
					downstream = downstreamHandler.apply(respond.getValue());
					upstreamHandler = respond::resume;
					upstream = null;
					downstreamHandler = null;
					continue;
				}
				Function<? super B, ? extends Proxy<B1, B, C1, C, R>> handler = downstreamHandler;
				if (step instanceof Request) {
					Request<A1, A, B1, B, R> request = (Request<A1, A, B1, B, R>) step;
					return new Request<>(request.getAddress(), reply -> exchange(request.resume(reply), handler, null, null));
				}
				if (step instanceof Action) {
					Action<A1, A, B1, B, R> action = (Action<A1, A, B1, B, R>) step;
					return new Action<>(() -> exchange(action.perform(), handler, null, null));
				}
				return Proxy.pure(((Pure<A1, A, B1, B, R>) step).getResult());
			} else {
				Proxy<B1, B, C1, C, R> step = downstream.step();
				if (step instanceof Request) {
					Request<B1, B, C1, C, R> request = (Request<B1, B, C1, C, R>) step;
					upstream = upstreamHandler.apply(request.getAddress());
					downstreamHandler = request::resume;
					downstream = null;
					upstreamHandler = null;
					continue;
				}
				Function<? super B1, ? extends Proxy<A1, A, B1, B, R>> handler = upstreamHandler;
				if (step instanceof Respond) {
					Respond<B1, B, C1, C, R> respond = (Respond<B1, B, C1, C, R>) step;
					return new Respond<>(respond.getValue(), reply -> exchange(null, null, handler, respond.resume(reply)));
				}
				if (step instanceof Action) {
					Action<B1, B, C1, C, R> action = (Action<B1, B, C1, C, R>) step;
					return new Action<>(() -> exchange(null, null, handler, action.perform()));
				}
				return Proxy.pure(((Pure<B1, B, C1, C, R>) step).getResult());
			}
		}
	}

	public static <A, A1, B1, B, C1, C, R> Function<A, Proxy<A1, A, C1, C, R>> composePush(
			@NotNull Function<? super A, ? extends Proxy<A1, A, B1, B, R>> first,
			@NotNull Function<? super B, ? extends Proxy<B1, B, C1, C, R>> second) {
		checkNotNull(first);
		checkNotNull(second);
		return a -> pushTo(first.apply(a), second);
	}

	public static <A1, A, B1, B, C1, C, R> Function<C1, Proxy<A1, A, C1, C, R>> composePull(
			@NotNull Function<? super B1, ? extends Proxy<A1, A, B1, B, R>> first,
			@NotNull Function<? super C1, ? extends Proxy<B1, B, C1, C, R>> second) {
		checkNotNull(first);
		checkNotNull(second);
		return c1 -> pullFrom(first, second.apply(c1));
	}

	/**
	 * The identity of the push category: forwards {@code value} downstream,
	 * then forwards every reply upstream and every upstream reply downstream, forever.
	 */
	public static <A1, A, R> Proxy<A1, A, A1, A, R> push(A value) {
		return Proxy.<A1, A, A1, A>respond(value)
				.then(address -> Proxy.<A1, A, A1, A>request(address))
				.then(next -> Proxies.<A1, A, R>push(next));
	}

	/**
	 * The identity of the pull category: forwards {@code address} upstream,
	 * then forwards every reply downstream and every downstream reply upstream, forever.
	 */
	public static <A1, A, R> Proxy<A1, A, A1, A, R> pull(A1 address) {
		return Proxy.<A1, A, A1, A>request(address)
				.then(value -> Proxy.<A1, A, A1, A>respond(value))
				.then(next -> Proxies.<A1, A, R>pull(next));
	}

	/**
	 * Forwards every value from upstream to downstream unchanged; the identity of {@link #connect}.
	 */
	public static <A, R> Proxy<Void, A, Void, A, R> cat() {
		return Proxies.<Void, A, R>pull(null);
	}
	// endregion

	// region pipe composition
	/**
	 * Connects two stages so that every {@link Proxy#await} of {@code downstream}
	 * is answered by the next value {@code upstream} responds with.
	 */
	public static <A1, A, B, C1, C, R> Proxy<A1, A, C1, C, R> connect(@NotNull Proxy<A1, A, Void, B, R> upstream,
			@NotNull Proxy<Void, B, C1, C, R> downstream) {
		checkNotNull(upstream);
		return pullFrom($ -> upstream, downstream);
	}

	/**
	 * Answers every {@link Proxy#await} of {@code consumer} by running {@code supplier} afresh.
	 */
	public static <A1, A, B, Y1, Y, R> Proxy<A1, A, Y1, Y, R> feed(@NotNull Proxy<A1, A, Y1, Y, B> supplier,
			@NotNull Proxy<Void, B, Y1, Y, R> consumer) {
		checkNotNull(supplier);
		return forRequest($ -> supplier, consumer);
	}
	// endregion
}
