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
import io.pipekernel.common.function.ThrowingConsumer;
import io.pipekernel.common.function.ThrowingFunction;
import io.pipekernel.common.function.ThrowingSupplier;
import io.pipekernel.common.tuple.Tuple2;
import io.pipekernel.pipes.Proxy.Action;
import io.pipekernel.pipes.Proxy.Pure;
import io.pipekernel.pipes.Proxy.Request;
import io.pipekernel.pipes.Proxy.Respond;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

import static io.pipekernel.common.Preconditions.checkArgument;
import static io.pipekernel.common.Preconditions.checkNotNull;
import static java.util.Arrays.asList;

/**
 * A stream stage that only sends values downstream: its upstream interface is closed.
 * <p>
 * A source emits values of type {@code B} and then returns a result of type {@code R}.
 * It is consumed with {@link Folds}, with {@link #next()}, or by connecting it
 * to a {@link Sink} and {@link Closed#run() running} the result.
 */
public final class Source<B, R> {
	private final Proxy<Never, Void, Void, B, R> proxy;

	private Source(Proxy<Never, Void, Void, B, R> proxy) {
		this.proxy = proxy;
	}

	public static <B, R> Source<B, R> ofProxy(@NotNull Proxy<Never, Void, Void, B, R> proxy) {
		return new Source<>(checkNotNull(proxy));
	}

	/**
	 * Creates a source that emits nothing and returns {@code null}.
	 */
	public static <B> Source<B, Void> empty() {
		return new Source<>(Proxy.pure(null));
	}

	/**
	 * Creates a source that emits a single value.
	 */
	public static <B> Source<B, Void> single(B value) {
		return new Source<>(Proxy.<Never, Void, Void, B>respond(value));
	}

	@SafeVarargs
	public static <B> Source<B, Void> of(B... values) {
		return ofList(asList(values));
	}

	/**
	 * Creates a source that emits the elements of the given list in order.
	 * The list is copied, so later changes to it do not affect the source.
	 */
	public static <B> Source<B, Void> ofList(@NotNull List<? extends B> list) {
		checkNotNull(list);
		return new Source<>(each(new ArrayList<B>(list), 0));
	}

	private static <B> Proxy<Never, Void, Void, B, Void> each(List<? extends B> list, int index) {
		if (index == list.size()) return Proxy.pure(null);
		return Proxy.<Never, Void, Void, B>respond(list.get(index))
				.then($ -> each(list, index + 1));
	}

	/**
	 * Creates a source that emits the elements of a fresh iterator of {@code iterable}
	 * on every traversal.
	 */
	public static <B> Source<B, Void> ofIterable(@NotNull Iterable<? extends B> iterable) {
		checkNotNull(iterable);
		return new Source<>(Proxy.defer(() -> iterate(iterable.iterator())));
	}

	/**
	 * Creates a source that emits the remaining elements of {@code iterator}.
	 * Iterator advances are effects, so such a source can only be traversed once.
	 */
	public static <B> Source<B, Void> ofIterator(@NotNull Iterator<? extends B> iterator) {
		checkNotNull(iterator);
		return new Source<>(iterate(iterator));
	}

	public static <B> Source<B, Void> ofStream(@NotNull Stream<? extends B> stream) {
		checkNotNull(stream);
		return ofIterator(stream.iterator());
	}

	private static <B> Proxy<Never, Void, Void, B, Void> iterate(Iterator<? extends B> iterator) {
		return Proxy.defer(() -> iterator.hasNext() ?
				Proxy.<Never, Void, Void, B>respond(iterator.next()).then($ -> iterate(iterator)) :
				Proxy.pure(null));
	}

	/**
	 * Runs {@code effect} forever, emitting each value it returns.
	 */
	public static <B, R> Source<B, R> repeat(@NotNull ThrowingSupplier<? extends B> effect) {
		checkNotNull(effect);
		return new Source<>(repeatForever(effect));
	}

	private static <B, R> Proxy<Never, Void, Void, B, R> repeatForever(ThrowingSupplier<? extends B> effect) {
		return Proxy.<Never, Void, Void, B, B>lift(effect)
				.then(value -> Proxy.<Never, Void, Void, B>respond(value))
				.then($ -> repeatForever(effect));
	}

	/**
	 * Runs {@code effect} {@code count} times, emitting each value it returns.
	 */
	public static <B> Source<B, Void> replicate(int count, @NotNull ThrowingSupplier<? extends B> effect) {
		checkArgument(count >= 0, "Count must not be negative: %s", count);
		checkNotNull(effect);
		return new Source<>(replicate(count, 0, effect));
	}

	private static <B> Proxy<Never, Void, Void, B, Void> replicate(int count, int done, ThrowingSupplier<? extends B> effect) {
		if (done == count) return Proxy.pure(null);
		return Proxy.<Never, Void, Void, B, B>lift(effect)
				.then(value -> Proxy.<Never, Void, Void, B>respond(value))
				.then($ -> replicate(count, done + 1, effect));
	}

	/**
	 * Unfolds a source from {@code seed}: each call of {@code step} either finishes with
	 * a result (left) or emits a value and yields the next seed (right).
	 */
	public static <S, B, R> Source<B, R> unfold(@NotNull ThrowingFunction<? super S, Either<R, Tuple2<B, S>>> step, S seed) {
		checkNotNull(step);
		return new Source<>(unfoldStep(step, seed));
	}

	private static <S, B, R> Proxy<Never, Void, Void, B, R> unfoldStep(ThrowingFunction<? super S, Either<R, Tuple2<B, S>>> step, S seed) {
		return Proxy.defer(() -> {
			Either<R, Tuple2<B, S>> either = step.apply(seed);
			if (either.isLeft()) return Proxy.pure(either.getLeft());
			Tuple2<B, S> next = either.getRight();
			return Proxy.<Never, Void, Void, B>respond(next.getValue1())
					.then($ -> unfoldStep(step, next.getValue2()));
		});
	}

	public Proxy<Never, Void, Void, B, R> getProxy() {
		return proxy;
	}

	/**
	 * Returns this source as a proxy with an arbitrary upstream interface, so that it can be
	 * placed in front of any stage. A request reaching the closed upstream is a contract violation.
	 */
	public <A1, A> Proxy<A1, A, Void, B, R> toProxy() {
		return Proxies.forRequest(Never::absurd, proxy);
	}

	/**
	 * Passes every value of this source through {@code transformer}.
	 */
	public <C> Source<C, R> pipe(@NotNull Transformer<B, C, R> transformer) {
		return new Source<>(Proxies.connect(proxy, transformer.getProxy()));
	}

	/**
	 * Connects this source to {@code sink}. The pipeline finishes as soon as either side does.
	 */
	public Closed<R> into(@NotNull Sink<B, R> sink) {
		return Closed.ofProxy(Proxies.connect(proxy, sink.getProxy()));
	}

	/**
	 * Replaces every value of this source with the values of the source {@code fn} returns for it.
	 */
	public <C> Source<C, R> flatMap(@NotNull Function<? super B, Source<C, Void>> fn) {
		checkNotNull(fn);
		return new Source<>(Proxies.forRespond(proxy, value -> fn.apply(value).getProxy()));
	}

	/**
	 * Runs {@code consumer} for every value of this source.
	 */
	public Closed<R> forEach(@NotNull ThrowingConsumer<? super B> consumer) {
		checkNotNull(consumer);
		return Closed.ofProxy(Proxies.forRespond(proxy, value -> Proxy.<Never, Void, Void, Never>execute(() -> consumer.accept(value))));
	}

	/**
	 * Runs the effects of this source up to its first value.
	 *
	 * @return either the result, if the source finished without emitting,
	 * or the first value together with the rest of the source
	 */
	@SuppressWarnings("unchecked")
	public Either<R, Tuple2<B, Source<B, R>>> next() throws Exception {
		Proxy<Never, Void, Void, B, R> current = proxy;
		while (true) {
			Proxy<Never, Void, Void, B, R> step = current.step();
			if (step instanceof Respond) {
				Respond<Never, Void, Void, B, R> respond = (Respond<Never, Void, Void, B, R>) step;
				Source<B, R> rest = new Source<>(Proxy.lazy(() -> respond.resume(null)));
				return Either.right(new Tuple2<>(respond.getValue(), rest));
			}
			if (step instanceof Action) {
				current = ((Action<Never, Void, Void, B, R>) step).perform();
			} else if (step instanceof Pure) {
				return Either.left(((Pure<Never, Void, Void, B, R>) step).getResult());
			} else {
				return Never.absurd(((Request<Never, Void, Void, B, R>) step).getAddress());
			}
		}
	}

	/**
	 * A shortcut for {@link Folds#toList}.
	 */
	public List<B> toList() throws Exception {
		return Folds.toList(this);
	}
}
