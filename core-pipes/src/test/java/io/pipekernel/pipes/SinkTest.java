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

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static org.junit.Assert.assertEquals;

public final class SinkTest {
	@Test
	public void testForEach() throws Exception {
		List<Integer> seen = new ArrayList<>();
		Source.of(1, 2, 3).into(Sink.forEach(seen::add)).run();
		assertEquals(asList(1, 2, 3), seen);
	}

	@Test
	public void testAwaitTakesOneValue() throws Exception {
		AtomicInteger counter = new AtomicInteger();
		Closed<Integer> closed = Source.<Integer, Integer>repeat(counter::incrementAndGet).into(Sink.await());
		assertEquals(Integer.valueOf(1), closed.run());
		assertEquals(1, counter.get());
	}

	@Test
	public void testSinkFinishingFirstStopsUpstream() throws Exception {
		AtomicInteger counter = new AtomicInteger();
		Sink<Integer, Integer> sumOfTwo = Sink.ofProxy(Proxy.<Integer, Void, Never>await()
				.then(a -> Proxy.<Integer, Void, Never>await().map(b -> a + b)));
		assertEquals(Integer.valueOf(3), Source.<Integer, Integer>repeat(counter::incrementAndGet).into(sumOfTwo).run());
		assertEquals(2, counter.get());
	}

	@Test
	public void testDrain() throws Exception {
		AtomicInteger counter = new AtomicInteger();
		Source.replicate(5, counter::incrementAndGet).into(Sink.drain()).run();
		assertEquals(5, counter.get());
	}

	@Test
	public void testTransformerInto() throws Exception {
		List<Integer> seen = new ArrayList<>();
		Sink<Integer, Void> sink = Transformers.<Integer, Integer, Void>map(x -> x * 2)
				.pipe(Transformers.filter(x -> x > 2))
				.into(Sink.forEach(seen::add));
		Source.of(1, 2, 3).into(sink).run();
		assertEquals(asList(4, 6), seen);
	}

	@Test
	public void testToProxyIgnoresDownstream() throws Exception {
		List<Integer> seen = new ArrayList<>();
		Proxy<Void, Integer, Void, String, Void> proxy = Sink.<Integer, Void>forEach(seen::add).toProxy();
		assertEquals(emptyList(), Source.of(1, 2).pipe(Transformer.ofProxy(proxy)).toList());
		assertEquals(asList(1, 2), seen);
	}

	@Test(expected = AssertionError.class)
	public void testRespondFromSinkIsUnreachable() throws Exception {
		Sink<Integer, Void> sink = Sink.ofProxy(Proxy.<Void, Integer, Void, Never>respond(null));
		Source.of(1).into(sink).run();
	}
}
