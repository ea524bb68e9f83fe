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

import io.pipekernel.common.exception.ParseException;

@FunctionalInterface
public interface ParserFunction<T, R> {
	R parse(T value) throws ParseException;

	static ParserFunction<String, Integer> ofInt() {
		return value -> {
			try {
				return Integer.parseInt(value);
			} catch (NumberFormatException e) {
				throw new ParseException(ParserFunction.class, "Not an int: '" + value + '\'', e);
			}
		};
	}

	static ParserFunction<String, Long> ofLong() {
		return value -> {
			try {
				return Long.parseLong(value);
			} catch (NumberFormatException e) {
				throw new ParseException(ParserFunction.class, "Not a long: '" + value + '\'', e);
			}
		};
	}

	static ParserFunction<String, Double> ofDouble() {
		return value -> {
			try {
				return Double.parseDouble(value);
			} catch (NumberFormatException e) {
				throw new ParseException(ParserFunction.class, "Not a double: '" + value + '\'', e);
			}
		};
	}
}
