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

import io.pipekernel.common.Either;
import io.pipekernel.common.ref.Ref;
import io.pipekernel.common.tuple.Tuple2;
import org.jetbrains.annotations.NotNull;

import java.util.function.BiFunction;
import java.util.function.Function;

import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * Combinators that reshape the interfaces of a stage by threading a single slot of state
 * across a composition boundary.
 * <p>
 * The slot is created when a traversal reaches the combined stage, so a pipeline built
 * once may be run any number of times, each run with its own state.
 */
public final class Exchanges {
	private Exchanges() {
	}

	// region tee
	/**
	 * Returns a transformer that feeds every value to {@code sink} and forwards it downstream.
	 * <p>
	 * A value is forwarded once the sink asks for the next one, or once the sink finishes.
	 * The transformer finishes with the result of the sink.
	 */
	public static <A, R> Transformer<A, A, R> tee(@NotNull Sink<A, R> sink) {
		checkNotNull(sink);
		return Transformer.ofProxy(Proxy.defer(() -> {
			Slot<A> slot = new Slot<>();
			Proxy<Void, A, Void, A, R> feeding = Proxies.forRequest($ -> Exchanges.<A>teeUp(slot),
					Proxies.<Void, A, Void, Never, Void, A, R>forRespond(sink.getProxy(), Never::absurd));
			return feeding.then(result -> Exchanges.<A>flush(slot).map($ -> result));
		}));
	}

	private static <A> Proxy<Void, A, Void, A, A> teeUp(Slot<A> slot) {
		return flush(slot)
				.then($ -> Proxy.<A, Void, A>await())
				.then(value -> Proxy.<Void, A, Void, A>execute(() -> slot.hold(value)).map($ -> value));
	}

	private static <A> Proxy<Void, A, Void, A, Void> flush(Slot<A> slot) {
		return Proxy.defer(() -> {
			if (!slot.isHeld()) return Proxy.pure(null);
			return Proxy.<Void, A, Void, A>respond(slot.release());
		});
	}

	private static final class Slot<T> {
		private T value;
		private boolean held;

		boolean isHeld() {
			return held;
		}

		void hold(T value) {
			this.value = value;
			this.held = true;
		}

		T release() {
			T result = value;
			value = null;
			held = false;
			return result;
		}
	}
	// endregion

	// region generalize
	/**
	 * Widens a one-directional transformer into a stage of the pull category.
	 * <p>
	 * The returned function takes the first address to send upstream. Afterwards every
	 * request upstream carries the latest reply received from downstream.
	 * {@code generalize(identity())} behaves like {@link Proxies#pull}, and generalizing
	 * {@code f.pipe(g)} behaves like {@link Proxies#composePull composing} the generalizations.
	 */
	public static <X, A, B, R> Function<X, Proxy<X, A, X, B, R>> generalize(@NotNull Transformer<A, B, R> transformer) {
		checkNotNull(transformer);
		return initial -> Proxy.defer(() -> {
			Ref<X> address = new Ref<>(initial);
			Proxy<Void, A, X, B, R> downstream = Proxies.forRespond(transformer.getProxy(),
					value -> Proxy.<Void, A, X, B>respond(value)
							.then(reply -> Proxy.<Void, A, X, B>execute(() -> address.set(reply))));
			return Proxies.forRequest($ -> Proxy.<X, A, X, B, A>defer(() -> Proxy.<X, A, X, B>request(address.get())),
					downstream);
		});
	}
	// endregion

	// region zip
	/**
	 * Pairs up the values of two sources, pulling the left one first.
	 * Finishes with the result of whichever source finishes first, without pulling the other.
	 */
	public static <A, B, R> Source<Tuple2<A, B>, R> zip(@NotNull Source<A, R> left, @NotNull Source<B, R> right) {
		return Exchanges.<A, B, Tuple2<A, B>, R>zipWith(Tuple2::of, left, right);
	}

	/**
	 * Combines the values of two sources pairwise with {@code fn}.
	 *
	 * @see #zip
	 */
	public static <A, B, C, R> Source<C, R> zipWith(@NotNull BiFunction<? super A, ? super B, ? extends C> fn,
			@NotNull Source<A, R> left, @NotNull Source<B, R> right) {
		checkNotNull(fn);
		checkNotNull(left);
		checkNotNull(right);
		return Source.ofProxy(zipStep(fn, left, right));
	}

	private static <A, B, C, R> Proxy<Never, Void, Void, C, R> zipStep(BiFunction<? super A, ? super B, ? extends C> fn,
			Source<A, R> left, Source<B, R> right) {
		return Proxy.defer(() -> {
			Either<R, Tuple2<A, Source<A, R>>> leftNext = left.next();
			if (leftNext.isLeft()) return Proxy.pure(leftNext.getLeft());
			Either<R, Tuple2<B, Source<B, R>>> rightNext = right.next();
			if (rightNext.isLeft()) return Proxy.pure(rightNext.getLeft());
			Tuple2<A, Source<A, R>> l = leftNext.getRight();
			Tuple2<B, Source<B, R>> r = rightNext.getRight();
			return Proxy.<Never, Void, Void, C>respond(fn.apply(l.getValue1(), r.getValue1()))
					.then($ -> zipStep(fn, l.getValue2(), r.getValue2()));
		});
	}
	// endregion
}
