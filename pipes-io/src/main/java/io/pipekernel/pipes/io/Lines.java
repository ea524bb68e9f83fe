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

package io.pipekernel.pipes.io;

import io.pipekernel.common.ApplicationSettings;
import io.pipekernel.common.ParserFunction;
import io.pipekernel.pipes.Never;
import io.pipekernel.pipes.Proxy;
import io.pipekernel.pipes.Sink;
import io.pipekernel.pipes.Source;
import io.pipekernel.pipes.Transformers;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

import static io.pipekernel.common.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Line-oriented sources and sinks over character streams.
 * <p>
 * Each read and each write is an effect: it happens when a traversal reaches it,
 * on the traversing thread. Closing the underlying streams is left to the caller.
 */
public final class Lines {
	private static final Logger logger = LoggerFactory.getLogger(Lines.class);

	public static final Charset CHARSET = ApplicationSettings.getCharset(Lines.class, "charset", UTF_8);

	private Lines() {
	}

	// region sources
	/**
	 * Creates a source that emits the lines of {@code reader} without their terminators
	 * and finishes at end of input.
	 */
	public static Source<String, Void> source(@NotNull BufferedReader reader) {
		checkNotNull(reader);
		return Source.ofProxy(readLines(reader));
	}

	private static Proxy<Never, Void, Void, String, Void> readLines(BufferedReader reader) {
		return Proxy.defer(() -> {
			String line = reader.readLine();
			if (line == null) {
				logger.debug("End of input: {}", reader);
				return Proxy.pure(null);
			}
			return Proxy.<Never, Void, Void, String>respond(line)
					.then($ -> readLines(reader));
		});
	}

	/**
	 * Reads lines from the standard input, decoded with {@link #CHARSET}.
	 */
	public static Source<String, Void> stdin() {
		return source(stdinReader());
	}

	/**
	 * Emits the lines of {@code reader} that {@code parser} accepts, skipping the others.
	 */
	public static <B> Source<B, Void> readLn(@NotNull BufferedReader reader, @NotNull ParserFunction<String, ? extends B> parser) {
		return source(reader).pipe(Transformers.<B, Void>parse(parser));
	}

	/**
	 * Like {@link #readLn(BufferedReader, ParserFunction)}, reading the standard input.
	 */
	public static <B> Source<B, Void> readLn(@NotNull ParserFunction<String, ? extends B> parser) {
		return readLn(stdinReader(), parser);
	}

	private static BufferedReader stdinReader() {
		return new BufferedReader(new InputStreamReader(System.in, CHARSET));
	}
	// endregion

	// region sinks
	/**
	 * Creates a sink that writes every value it receives to {@code writer} as a line
	 * and flushes it.
	 * <p>
	 * If the reader on the other side has gone away (a broken pipe), the sink finishes
	 * normally. Any other write failure is rethrown from the traversal.
	 */
	public static Sink<String, Void> sink(@NotNull Writer writer) {
		checkNotNull(writer);
		return Sink.ofProxy(writeLines(writer));
	}

	private static Proxy<Void, String, Void, Never, Void> writeLines(Writer writer) {
		return Proxy.<String, Void, Never>await()
				.then(line -> Proxy.<Void, String, Void, Never, Boolean>lift(() -> tryWriteLine(writer, line)))
				.then(written -> written ?
						writeLines(writer) :
						Proxy.<Void, String, Void, Never, Void>pure(null));
	}

	private static boolean tryWriteLine(Writer writer, String line) throws IOException {
		try {
			writeLine(writer, line);
			return true;
		} catch (IOException e) {
			if (!isBrokenPipe(e)) throw e;
			logger.debug("Output closed by the reader, stopping: {}", writer, e);
			return false;
		}
	}

	/**
	 * Like {@link #sink}, but never finishes on its own and rethrows every write failure,
	 * a broken pipe included.
	 */
	public static <R> Sink<String, R> strictSink(@NotNull Writer writer) {
		checkNotNull(writer);
		return Sink.forEach(line -> writeLine(writer, line));
	}

	/**
	 * Writes lines to the standard output, encoded with {@link #CHARSET}.
	 */
	public static Sink<String, Void> stdout() {
		return sink(stdoutWriter());
	}

	/**
	 * Writes the {@link Object#toString string form} of every value to {@code writer} as a line,
	 * stopping on a broken pipe like {@link #sink}.
	 */
	public static <A> Sink<A, Void> print(@NotNull Writer writer) {
		return Transformers.<A, Void>format().into(sink(writer));
	}

	/**
	 * Like {@link #print(Writer)}, writing to the standard output.
	 */
	public static <A> Sink<A, Void> print() {
		return print(stdoutWriter());
	}

	private static Writer stdoutWriter() {
		// System.out swallows write errors, so a broken pipe would go unnoticed
		return new BufferedWriter(new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), CHARSET));
	}

	private static void writeLine(Writer writer, String line) throws IOException {
		writer.write(line);
		writer.write(System.lineSeparator());
		writer.flush();
	}
	// endregion

	static boolean isBrokenPipe(Throwable e) {
		Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
		for (Throwable cause = e; cause != null && seen.add(cause); cause = cause.getCause()) {
			if (cause instanceof IOException) {
				String message = cause.getMessage();
				if (message != null && message.contains("Broken pipe")) return true;
			}
		}
		return false;
	}
}
