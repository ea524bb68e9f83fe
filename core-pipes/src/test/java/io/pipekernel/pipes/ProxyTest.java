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

import io.pipekernel.pipes.Proxy.Action;
import io.pipekernel.pipes.Proxy.Pure;
import io.pipekernel.pipes.Proxy.Request;
import io.pipekernel.pipes.Proxy.Respond;
import org.junit.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public final class ProxyTest {
	private static final int LONG_CHAIN = 1_000_000;

	@Test
	public void testLeftNestedBinds() throws Exception {
		Proxy<Never, Void, Void, Never, Integer> proxy = Proxy.pure(0);
		for (int i = 0; i < LONG_CHAIN; i++) {
			proxy = proxy.then(x -> Proxy.pure(x + 1));
		}
		assertEquals(Integer.valueOf(LONG_CHAIN), Closed.ofProxy(proxy).run());
	}

	@Test
	public void testRightNestedRecursion() throws Exception {
		assertEquals(Long.valueOf((long) LONG_CHAIN * (LONG_CHAIN + 1) / 2), Closed.ofProxy(sumTo(LONG_CHAIN, 0)).run());
	}

	private static Proxy<Never, Void, Void, Never, Long> sumTo(int n, long acc) {
		if (n == 0) return Proxy.pure(acc);
		return Proxy.<Never, Void, Void, Never, Void>pure(null).then($ -> sumTo(n - 1, acc + n));
	}

	@Test
	public void testLongChainOfEffects() throws Exception {
		AtomicInteger counter = new AtomicInteger();
		Proxy<Never, Void, Void, Never, Void> proxy = Proxy.pure(null);
		for (int i = 0; i < LONG_CHAIN; i++) {
			proxy = proxy.andThen(Proxy.execute(counter::incrementAndGet));
		}
		Closed.ofProxy(proxy).run();
		assertEquals(LONG_CHAIN, counter.get());
	}

	@Test
	public void testEffectsRunOncePerTraversal() throws Exception {
		AtomicInteger counter = new AtomicInteger();
		Closed<Integer> closed = Closed.ofProxy(Proxy.lift(counter::incrementAndGet));
		assertEquals(0, counter.get());

		assertEquals(Integer.valueOf(1), closed.run());
		assertEquals(Integer.valueOf(2), closed.run());
		assertEquals(2, counter.get());
	}

	@Test
	public void testSteppingPerformsNoEffects() {
		AtomicInteger counter = new AtomicInteger();
		Proxy<Never, Void, Void, Never, Void> proxy = Proxy.<Never, Void, Void, Never, Void>pure(null)
				.then($ -> Proxy.execute(counter::incrementAndGet));

		assertTrue(proxy.step() instanceof Action);
		assertTrue(proxy.step() instanceof Action);
		assertEquals(0, counter.get());
	}

	@Test
	public void testStepVariants() {
		assertTrue(Proxy.request(1).step() instanceof Request);
		assertTrue(Proxy.respond(1).step() instanceof Respond);
		assertTrue(Proxy.pure(1).step() instanceof Pure);
		assertTrue(Proxy.defer(() -> Proxy.pure(1)).step() instanceof Action);

		Proxy<Integer, String, Void, Void, String> proxy = Proxy.<Integer, String, Void, Void>request(7).map(String::toUpperCase);
		Request<Integer, String, Void, Void, String> request = (Request<Integer, String, Void, Void, String>) proxy.step();
		assertEquals(Integer.valueOf(7), request.getAddress());
		Pure<Integer, String, Void, Void, String> pure = (Pure<Integer, String, Void, Void, String>) request.resume("reply").step();
		assertEquals("REPLY", pure.getResult());
	}

	@Test
	public void testEffectFailurePropagates() {
		IOException failure = new IOException("disk is gone");
		Closed<Void> closed = Closed.ofProxy(Proxy.<Never, Void, Void, Never, Void>pure(null)
				.andThen(Proxy.execute(() -> {
					throw failure;
				})));
		try {
			closed.run();
			fail();
		} catch (Exception e) {
			assertSame(failure, e);
		}
	}

	@Test
	public void testLeftIdentity() throws Exception {
		Function<Integer, Proxy<Integer, Integer, Integer, Integer, Integer>> fn = ProxyTest::echo;
		assertEquals(observe(fn.apply(3)), observe(Proxy.<Integer, Integer, Integer, Integer, Integer>pure(3).then(fn)));
	}

	@Test
	public void testRightIdentity() throws Exception {
		Proxy<Integer, Integer, Integer, Integer, Integer> proxy = echo(3);
		assertEquals(observe(proxy), observe(proxy.then(x -> Proxy.pure(x))));
	}

	@Test
	public void testAssociativity() throws Exception {
		Proxy<Integer, Integer, Integer, Integer, Integer> proxy = echo(3);
		Function<Integer, Proxy<Integer, Integer, Integer, Integer, Integer>> f = ProxyTest::echo;
		Function<Integer, Proxy<Integer, Integer, Integer, Integer, Integer>> g = x -> Proxy.pure(x * 2);

		List<String> expected = asList("request:3", "respond:31", "request:131", "respond:1311", "pure:2822");
		assertEquals(expected, observe(proxy.then(f).then(g)));
		assertEquals(expected, observe(proxy.then(x -> f.apply(x).then(g))));
	}

	private static Proxy<Integer, Integer, Integer, Integer, Integer> echo(int address) {
		return Proxy.<Integer, Integer, Integer, Integer>request(address)
				.then(reply -> Proxy.<Integer, Integer, Integer, Integer>respond(reply + 1));
	}

	private static List<String> observe(Proxy<Integer, Integer, Integer, Integer, Integer> proxy) throws Exception {
		return new ProxyTrace().run(proxy, x -> x * 10, x -> x + 100);
	}
}
