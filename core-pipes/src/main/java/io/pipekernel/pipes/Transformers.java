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

import io.pipekernel.common.ParserFunction;
import io.pipekernel.common.exception.ParseException;
import io.pipekernel.common.function.ThrowingBiFunction;
import io.pipekernel.common.function.ThrowingConsumer;
import io.pipekernel.common.function.ThrowingFunction;
import io.pipekernel.common.function.ThrowingSupplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import static io.pipekernel.common.Preconditions.checkArgument;
import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * Ready-made {@link Transformer transformers}.
 * <p>
 * Most of them run their function once per value and never finish on their own,
 * which is why their result type is free.
 */
public final class Transformers {
	private static final Logger logger = LoggerFactory.getLogger(Transformers.class);

	private Transformers() {
	}

	private static <A, B, R> Transformer<A, B, R> forEachValue(Function<? super A, ? extends Proxy<Void, A, Void, B, Void>> body) {
		return Transformer.ofProxy(Proxies.forRespond(Proxies.<A, R>cat(), body));
	}

	/**
	 * Forwards every value unchanged.
	 */
	public static <A, R> Transformer<A, A, R> identity() {
		return Transformer.ofProxy(Proxies.cat());
	}

	public static <A, B, R> Transformer<A, B, R> map(@NotNull Function<? super A, ? extends B> fn) {
		checkNotNull(fn);
		return forEachValue(value -> Proxy.<Void, A, Void, B>respond(fn.apply(value)));
	}

	/**
	 * Like {@link #map}, but {@code fn} is an effect run once per value, when the value passes.
	 */
	public static <A, B, R> Transformer<A, B, R> mapM(@NotNull ThrowingFunction<? super A, ? extends B> fn) {
		checkNotNull(fn);
		return forEachValue(value -> Proxy.<Void, A, Void, B, B>lift(() -> fn.apply(value))
				.then(result -> Proxy.<Void, A, Void, B>respond(result)));
	}

	/**
	 * Runs every incoming effect and forwards its value.
	 */
	public static <A, R> Transformer<ThrowingSupplier<? extends A>, A, R> sequence() {
		return Transformers.<ThrowingSupplier<? extends A>, A, R>mapM(ThrowingSupplier::get);
	}

	/**
	 * Forwards every element of the iterable that {@code fn} returns for each value.
	 */
	public static <A, B, R> Transformer<A, B, R> flatMap(@NotNull Function<? super A, ? extends Iterable<? extends B>> fn) {
		checkNotNull(fn);
		return forEachValue(value -> Proxy.defer(() -> Transformers.<A, B>respondEach(fn.apply(value).iterator())));
	}

	private static <A, B> Proxy<Void, A, Void, B, Void> respondEach(Iterator<? extends B> iterator) {
		if (!iterator.hasNext()) return Proxy.pure(null);
		return Proxy.<Void, A, Void, B>respond(iterator.next())
				.then($ -> Proxy.defer(() -> Transformers.<A, B>respondEach(iterator)));
	}

	/**
	 * Flattens incoming iterables.
	 */
	public static <A, R> Transformer<Iterable<? extends A>, A, R> concat() {
		return Transformers.<Iterable<? extends A>, A, R>flatMap(Function.identity());
	}

	/**
	 * Forwards only the values that satisfy {@code predicate}.
	 */
	public static <A, R> Transformer<A, A, R> filter(@NotNull Predicate<? super A> predicate) {
		checkNotNull(predicate);
		return forEachValue(value -> predicate.test(value) ?
				Proxy.<Void, A, Void, A>respond(value) :
				Proxy.<Void, A, Void, A, Void>pure(null));
	}

	/**
	 * Like {@link #filter}, but the predicate is an effect run once per value.
	 */
	public static <A, R> Transformer<A, A, R> filterM(@NotNull ThrowingFunction<? super A, Boolean> predicate) {
		checkNotNull(predicate);
		return forEachValue(value -> Proxy.<Void, A, Void, A, Boolean>lift(() -> predicate.apply(value))
				.then(passes -> passes ?
						Proxy.<Void, A, Void, A>respond(value) :
						Proxy.<Void, A, Void, A, Void>pure(null)));
	}

	/**
	 * Forwards the first {@code count} values, then finishes.
	 */
	public static <A> Transformer<A, A, Void> take(int count) {
		checkArgument(count >= 0, "Count must not be negative: %s", count);
		return Transformer.ofProxy(Transformers.<A>takeStep(count));
	}

	private static <A> Proxy<Void, A, Void, A, Void> takeStep(int remaining) {
		if (remaining == 0) return Proxy.pure(null);
		return Proxy.<A, Void, A>await()
				.then(value -> Proxy.<Void, A, Void, A>respond(value))
				.then($ -> Transformers.<A>takeStep(remaining - 1));
	}

	/**
	 * Forwards values while they satisfy {@code predicate}; finishes on the first one that does not,
	 * without forwarding it.
	 */
	public static <A> Transformer<A, A, Void> takeWhile(@NotNull Predicate<? super A> predicate) {
		checkNotNull(predicate);
		return Transformer.ofProxy(Transformers.<A>takeWhileStep(predicate).map($ -> null));
	}

	/**
	 * Like {@link #takeWhile}, but returns the first value that fails the predicate.
	 */
	public static <A> Transformer<A, A, A> takeWhileWithResult(@NotNull Predicate<? super A> predicate) {
		checkNotNull(predicate);
		return Transformer.ofProxy(Transformers.<A>takeWhileStep(predicate));
	}

	private static <A> Proxy<Void, A, Void, A, A> takeWhileStep(Predicate<? super A> predicate) {
		return Proxy.<A, Void, A>await()
				.then(value -> predicate.test(value) ?
						Proxy.<Void, A, Void, A>respond(value).then($ -> Transformers.<A>takeWhileStep(predicate)) :
						Proxy.<Void, A, Void, A, A>pure(value));
	}

	/**
	 * Discards the first {@code count} values, then forwards the rest.
	 */
	public static <A, R> Transformer<A, A, R> drop(int count) {
		checkArgument(count >= 0, "Count must not be negative: %s", count);
		return Transformer.ofProxy(Transformers.<A, R>dropStep(count));
	}

	private static <A, R> Proxy<Void, A, Void, A, R> dropStep(int remaining) {
		if (remaining == 0) return Proxies.<A, R>cat();
		return Proxy.<A, Void, A>await()
				.then($ -> Transformers.<A, R>dropStep(remaining - 1));
	}

	/**
	 * Discards values while they satisfy {@code predicate}, then forwards the rest,
	 * starting with the first value that failed it.
	 */
	public static <A, R> Transformer<A, A, R> dropWhile(@NotNull Predicate<? super A> predicate) {
		checkNotNull(predicate);
		return Transformer.ofProxy(Transformers.<A, R>dropWhileStep(predicate));
	}

	private static <A, R> Proxy<Void, A, Void, A, R> dropWhileStep(Predicate<? super A> predicate) {
		return Proxy.<A, Void, A>await()
				.then(value -> predicate.test(value) ?
						Transformers.<A, R>dropWhileStep(predicate) :
						Proxy.<Void, A, Void, A>respond(value).then($ -> Proxies.<A, R>cat()));
	}

	/**
	 * Emits the zero-based index of every value equal to {@code element}.
	 */
	public static <A, R> Transformer<A, Long, R> elemIndices(A element) {
		return findIndices(value -> Objects.equals(element, value));
	}

	/**
	 * Emits the zero-based index of every value that satisfies {@code predicate}.
	 */
	public static <A, R> Transformer<A, Long, R> findIndices(@NotNull Predicate<? super A> predicate) {
		checkNotNull(predicate);
		return Transformer.ofProxy(Transformers.<A, R>findIndicesFrom(predicate, 0L));
	}

	static <A, R> Proxy<Void, A, Void, Long, R> findIndicesFrom(Predicate<? super A> predicate, long index) {
		return Proxy.<A, Void, Long>await()
				.then(value -> (predicate.test(value) ?
						Proxy.<Void, A, Void, Long>respond(index) :
						Proxy.<Void, A, Void, Long, Void>pure(null))
						.then($ -> Transformers.<A, R>findIndicesFrom(predicate, index + 1)));
	}

	/**
	 * A strict left scan: emits {@code done} of the accumulator before the first value
	 * and after every value.
	 */
	public static <A, X, B, R> Transformer<A, B, R> scan(@NotNull BiFunction<? super X, ? super A, ? extends X> step, X begin,
			@NotNull Function<? super X, ? extends B> done) {
		checkNotNull(step);
		checkNotNull(done);
		return Transformer.ofProxy(Transformers.<A, X, B, R>scanStep(step, begin, done));
	}

	private static <A, X, B, R> Proxy<Void, A, Void, B, R> scanStep(BiFunction<? super X, ? super A, ? extends X> step, X accumulator,
			Function<? super X, ? extends B> done) {
		return Proxy.<Void, A, Void, B>respond(done.apply(accumulator))
				.then($ -> Proxy.<A, Void, B>await())
				.then(value -> Transformers.<A, X, B, R>scanStep(step, step.apply(accumulator, value), done));
	}

	/**
	 * Like {@link #scan}, but {@code step}, {@code begin} and {@code done} are effects.
	 */
	public static <A, X, B, R> Transformer<A, B, R> scanM(@NotNull ThrowingBiFunction<? super X, ? super A, ? extends X> step,
			@NotNull ThrowingSupplier<? extends X> begin, @NotNull ThrowingFunction<? super X, ? extends B> done) {
		checkNotNull(step);
		checkNotNull(begin);
		checkNotNull(done);
		return Transformer.ofProxy(Proxy.<Void, A, Void, B, X>lift(begin)
				.then(accumulator -> Transformers.<A, X, B, R>scanMStep(step, accumulator, done)));
	}

	private static <A, X, B, R> Proxy<Void, A, Void, B, R> scanMStep(ThrowingBiFunction<? super X, ? super A, ? extends X> step, X accumulator,
			ThrowingFunction<? super X, ? extends B> done) {
		return Proxy.<Void, A, Void, B, B>lift(() -> done.apply(accumulator))
				.then(result -> Proxy.<Void, A, Void, B>respond(result))
				.then($ -> Proxy.<A, Void, B>await())
				.then(value -> Proxy.<Void, A, Void, B, X>lift(() -> step.apply(accumulator, value)))
				.then(next -> Transformers.<A, X, B, R>scanMStep(step, next, done));
	}

	/**
	 * Runs {@code consumer} for every value before forwarding it.
	 */
	public static <A, R> Transformer<A, A, R> peek(@NotNull ThrowingConsumer<? super A> consumer) {
		checkNotNull(consumer);
		return forEachValue(value -> Proxy.<Void, A, Void, A>execute(() -> consumer.accept(value))
				.then($ -> Proxy.<Void, A, Void, A>respond(value)));
	}

	/**
	 * Parses every incoming text with {@code parser}. Texts that fail to parse are dropped.
	 */
	public static <B, R> Transformer<String, B, R> parse(@NotNull ParserFunction<String, ? extends B> parser) {
		checkNotNull(parser);
		return forEachValue(text -> {
			B value;
			try {
				value = parser.parse(text);
			} catch (ParseException e) {
				if (logger.isTraceEnabled()) logger.trace("Dropping '{}': {}", text, e.getMessage());
				return Proxy.<Void, String, Void, B, Void>pure(null);
			}
			return Proxy.<Void, String, Void, B>respond(value);
		});
	}

	/**
	 * Turns every value into its {@link String#valueOf string form}.
	 */
	public static <A, R> Transformer<A, String, R> format() {
		return map(Objects::toString);
	}
}
