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
package io.pipekernel.common.exception;

/**
 * Signals that a textual value could not be turned into a typed one.
 */
public class ParseException extends Exception {
	public ParseException() {
	}

	public ParseException(String message) {
		super(message);
	}

	public ParseException(String message, Throwable cause) {
		super(message, cause);
	}

	public ParseException(Class<?> component, String message) {
		super(component.getSimpleName() + ": " + message);
	}

	public ParseException(Class<?> component, String message, Throwable cause) {
		super(component.getSimpleName() + ": " + message, cause);
	}
}
