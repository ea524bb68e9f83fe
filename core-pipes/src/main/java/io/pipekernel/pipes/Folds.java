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
import io.pipekernel.common.function.ThrowingBiFunction;
import io.pipekernel.common.function.ThrowingFunction;
import io.pipekernel.common.function.ThrowingSupplier;
import io.pipekernel.common.tuple.Tuple2;
import io.pipekernel.pipes.Proxy.Action;
import io.pipekernel.pipes.Proxy.Pure;
import io.pipekernel.pipes.Proxy.Request;
import io.pipekernel.pipes.Proxy.Respond;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import static io.pipekernel.common.Preconditions.checkArgument;
import static io.pipekernel.common.Preconditions.checkNotNull;

/**
 * Strict reductions of a {@link Source} to a single value.
 * <p>
 * Every method here runs the effects of the source in order, on the calling thread, and
 * rethrows whatever an effect throws. The accumulator is updated as each value arrives,
 * so memory use does not depend on the length of the source (except for {@link #toList}).
 * <p>
 * Methods that can know their answer early ({@link #any}, {@link #find}, {@link #head}, ...)
 * stop pulling from the source as soon as they do. Their {@link Optional} results
 * cannot tell a missing value from a {@code null} one, so sources passed to them
 * should not emit {@code null}s.
 */
public final class Folds {
	private Folds() {
	}

	// region folds
	/**
	 * Folds all values of {@code source}: {@code done(step(...step(step(begin, v1), v2)..., vn))}.
	 */
	public static <X, B, T> T fold(@NotNull BiFunction<? super X, ? super B, ? extends X> step, X begin,
			@NotNull Function<? super X, ? extends T> done, @NotNull Source<B, ?> source) throws Exception {
		checkNotNull(step);
		checkNotNull(done);
		return foldMWithResult(step::apply, () -> begin, done::apply, source).getValue1();
	}

	/**
	 * Like {@link #fold}, but also returns the result of {@code source}.
	 */
	public static <X, B, R, T> Tuple2<T, R> foldWithResult(@NotNull BiFunction<? super X, ? super B, ? extends X> step, X begin,
			@NotNull Function<? super X, ? extends T> done, @NotNull Source<B, R> source) throws Exception {
		checkNotNull(step);
		checkNotNull(done);
		return foldMWithResult(step::apply, () -> begin, done::apply, source);
	}

	/**
	 * Like {@link #fold}, but {@code step}, {@code begin} and {@code done} are effects,
	 * run in order with the effects of the source.
	 */
	public static <X, B, T> T foldM(@NotNull ThrowingBiFunction<? super X, ? super B, ? extends X> step,
			@NotNull ThrowingSupplier<? extends X> begin, @NotNull ThrowingFunction<? super X, ? extends T> done,
			@NotNull Source<B, ?> source) throws Exception {
		return foldMWithResult(step, begin, done, source).getValue1();
	}

	/**
	 * The traversal all other folds are built on.
	 */
	@SuppressWarnings("unchecked")
	public static <X, B, R, T> Tuple2<T, R> foldMWithResult(@NotNull ThrowingBiFunction<? super X, ? super B, ? extends X> step,
			@NotNull ThrowingSupplier<? extends X> begin, @NotNull ThrowingFunction<? super X, ? extends T> done,
			@NotNull Source<B, R> source) throws Exception {
		checkNotNull(step);
		checkNotNull(begin);
		checkNotNull(done);
		X accumulator = begin.get();
		Proxy<Never, Void, Void, B, R> current = source.getProxy();
		while (true) {
			Proxy<Never, Void, Void, B, R> proxy = current.step();
			if (proxy instanceof Respond) {
				Respond<Never, Void, Void, B, R> respond = (Respond<Never, Void, Void, B, R>) proxy;
				accumulator = step.apply(accumulator, respond.getValue());
				current = respond.resume(null);
			} else if (proxy instanceof Action) {
				current = ((Action<Never, Void, Void, B, R>) proxy).perform();
			} else if (proxy instanceof Pure) {
				R result = ((Pure<Never, Void, Void, B, R>) proxy).getResult();
				return new Tuple2<>(done.apply(accumulator), result);
			} else {
				return Never.absurd(((Request<Never, Void, Void, B, R>) proxy).getAddress());
			}
		}
	}
	// endregion

	// region early stopping
	/**
	 * Returns the first value of {@code source}, pulling nothing after it.
	 */
	public static <B> Optional<B> head(@NotNull Source<B, ?> source) throws Exception {
		Either<?, ? extends Tuple2<B, ?>> next = source.next();
		return next.isLeft() ? Optional.empty() : Optional.ofNullable(next.getRight().getValue1());
	}

	public static boolean isEmpty(@NotNull Source<?, ?> source) throws Exception {
		return source.next().isLeft();
	}

	/**
	 * Returns the {@code index}-th (zero-based) value of {@code source}.
	 */
	public static <B, R> Optional<B> index(int index, @NotNull Source<B, R> source) throws Exception {
		checkArgument(index >= 0, "Index must not be negative: %s", index);
		return head(source.pipe(Transformers.drop(index)));
	}

	/**
	 * Returns the first value that satisfies {@code predicate}.
	 */
	public static <B, R> Optional<B> find(@NotNull Predicate<? super B> predicate, @NotNull Source<B, R> source) throws Exception {
		return head(source.pipe(Transformers.filter(predicate)));
	}

	/**
	 * Returns the zero-based index of the first value that satisfies {@code predicate}.
	 */
	public static <B, R> Optional<Long> findIndex(@NotNull Predicate<? super B> predicate, @NotNull Source<B, R> source) throws Exception {
		return head(source.pipe(Transformers.findIndices(predicate)));
	}

	public static <B, R> boolean any(@NotNull Predicate<? super B> predicate, @NotNull Source<B, R> source) throws Exception {
		return !isEmpty(source.pipe(Transformers.filter(predicate)));
	}

	public static <B, R> boolean all(@NotNull Predicate<? super B> predicate, @NotNull Source<B, R> source) throws Exception {
		checkNotNull(predicate);
		return isEmpty(source.pipe(Transformers.<B, R>filter(value -> !predicate.test(value))));
	}

	/**
	 * Returns whether every value is {@code true}; {@code true} for an empty source.
	 */
	public static <R> boolean and(@NotNull Source<Boolean, R> source) throws Exception {
		return all(Boolean::booleanValue, source);
	}

	/**
	 * Returns whether any value is {@code true}; {@code false} for an empty source.
	 */
	public static <R> boolean or(@NotNull Source<Boolean, R> source) throws Exception {
		return any(Boolean::booleanValue, source);
	}

	public static <B, R> boolean contains(B element, @NotNull Source<B, R> source) throws Exception {
		return any(value -> Objects.equals(element, value), source);
	}

	public static <B, R> boolean notContains(B element, @NotNull Source<B, R> source) throws Exception {
		return all(value -> !Objects.equals(element, value), source);
	}
	// endregion

	// region total folds
	public static <B> Optional<B> last(@NotNull Source<B, ?> source) throws Exception {
		return Folds.<B, B, Optional<B>>fold((previous, value) -> value, null, Optional::ofNullable, source);
	}

	public static long length(@NotNull Source<?, ?> source) throws Exception {
		return fold((count, $) -> count + 1, 0L, Function.identity(), source);
	}

	public static <B> Optional<B> max(@NotNull Comparator<? super B> comparator, @NotNull Source<B, ?> source) throws Exception {
		checkNotNull(comparator);
		return Folds.<B, B, Optional<B>>fold((max, value) -> max == null || comparator.compare(value, max) > 0 ? value : max,
				null, Optional::ofNullable, source);
	}

	public static <B> Optional<B> min(@NotNull Comparator<? super B> comparator, @NotNull Source<B, ?> source) throws Exception {
		checkNotNull(comparator);
		return Folds.<B, B, Optional<B>>fold((min, value) -> min == null || comparator.compare(value, min) < 0 ? value : min,
				null, Optional::ofNullable, source);
	}

	public static <B extends Comparable<? super B>> Optional<B> max(@NotNull Source<B, ?> source) throws Exception {
		return max(Comparator.naturalOrder(), source);
	}

	public static <B extends Comparable<? super B>> Optional<B> min(@NotNull Source<B, ?> source) throws Exception {
		return min(Comparator.naturalOrder(), source);
	}

	public static int sumInt(@NotNull Source<Integer, ?> source) throws Exception {
		return fold((sum, value) -> sum + value, 0, Function.identity(), source);
	}

	public static long sumLong(@NotNull Source<Long, ?> source) throws Exception {
		return fold((sum, value) -> sum + value, 0L, Function.identity(), source);
	}

	public static double sumDouble(@NotNull Source<Double, ?> source) throws Exception {
		return fold((sum, value) -> sum + value, 0.0, Function.identity(), source);
	}

	public static int productInt(@NotNull Source<Integer, ?> source) throws Exception {
		return fold((product, value) -> product * value, 1, Function.identity(), source);
	}

	public static long productLong(@NotNull Source<Long, ?> source) throws Exception {
		return fold((product, value) -> product * value, 1L, Function.identity(), source);
	}

	public static double productDouble(@NotNull Source<Double, ?> source) throws Exception {
		return fold((product, value) -> product * value, 1.0, Function.identity(), source);
	}
	// endregion

	// region collecting
	/**
	 * Collects every value of {@code source} into a list.
	 * <p>
	 * This holds the whole stream in memory and is meant for tests and small sources;
	 * prefer consuming values as they arrive with a fold or a {@link Sink}.
	 */
	public static <B> List<B> toList(@NotNull Source<B, ?> source) throws Exception {
		return Folds.<List<B>, B, List<B>>fold(Folds::add, new ArrayList<>(), Function.identity(), source);
	}

	/**
	 * Like {@link #toList}, but also returns the result of {@code source}.
	 * The same memory caveat applies.
	 */
	public static <B, R> Tuple2<List<B>, R> toListWithResult(@NotNull Source<B, R> source) throws Exception {
		return Folds.<List<B>, B, R, List<B>>foldWithResult(Folds::add, new ArrayList<>(), Function.identity(), source);
	}

	private static <B> List<B> add(List<B> list, B value) {
		list.add(value);
		return list;
	}
	// endregion
}
