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
import org.jetbrains.annotations.Nullable;

import java.nio.charset.Charset;

/**
 * Per-class settings taken from system properties.
 * <p>
 * A setting {@code name} of class {@code type} is looked up as
 * {@code <fully qualified class name>.name}, then as {@code <simple class name>.name}.
 * Settings are read once, usually into a static field of {@code type}.
 */
public final class ApplicationSettings {
	private ApplicationSettings() {
		throw new AssertionError();
	}

	@Nullable
	public static String getString(Class<?> type, String name, @Nullable String defValue) {
		String value = System.getProperty(type.getName() + "." + name);
		if (value == null) value = System.getProperty(type.getSimpleName() + "." + name);
		return value != null ? value : defValue;
	}

	/**
	 * @throws IllegalArgumentException if the setting is present but {@code parser} rejects it
	 */
	public static <T> T get(ParserFunction<String, ? extends T> parser, Class<?> type, String name, T defValue) {
		String value = getString(type, name, null);
		if (value == null) return defValue;
		try {
			return parser.parse(value);
		} catch (ParseException e) {
			throw new IllegalArgumentException("Invalid setting " + type.getSimpleName() + "." + name + ": " + value, e);
		}
	}

	public static Charset getCharset(Class<?> type, String name, Charset defValue) {
		return get(ApplicationSettings::parseCharset, type, name, defValue);
	}

	private static Charset parseCharset(String value) throws ParseException {
		try {
			return Charset.forName(value);
		} catch (IllegalArgumentException e) {
			throw new ParseException(ApplicationSettings.class, "Unknown charset: " + value, e);
		}
	}
}
