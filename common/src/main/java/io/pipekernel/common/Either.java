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

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

import static io.pipekernel.common.Preconditions.checkState;

public final class Either<L, R> {
	@Nullable
	private final L left;

	@Nullable
	private final R right;

	private final boolean isRight; // so that this either supports nulls

	private Either(@Nullable L left, @Nullable R right, boolean isRight) {
		this.left = left;
		this.right = right;
		this.isRight = isRight;
	}

	public static <L, R> Either<L, R> left(@Nullable L left) {
		return new Either<>(left, null, false);
	}

	public static <L, R> Either<L, R> right(@Nullable R right) {
		return new Either<>(null, right, true);
	}

	public boolean isLeft() {
		return !isRight;
	}

	public boolean isRight() {
		return isRight;
	}

	@Nullable
	public L getLeft() {
		checkState(isLeft(), "Trying to get Left value from Right instance!");
		return left;
	}

	@Nullable
	public R getRight() {
		checkState(isRight(), "Trying to get Right value from Left instance!");
		return right;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Either<?, ?> either = (Either<?, ?>) o;
		return isRight == either.isRight &&
				Objects.equals(left, either.left) &&
				Objects.equals(right, either.right);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, right, isRight);
	}

	@Override
	public String toString() {
		return isRight ? "Right{" + right + '}' : "Left{" + left + '}';
	}
}
