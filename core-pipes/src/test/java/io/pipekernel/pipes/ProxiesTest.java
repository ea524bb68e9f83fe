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

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static io.pipekernel.pipes.Proxies.*;
import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;

public final class ProxiesTest {
	private interface Stage extends Function<Integer, Proxy<Integer, Integer, Integer, Integer, Integer>> {
	}

	private static final Stage RESPOND = x -> Proxy.respond(x);
	private static final Stage REQUEST = x -> Proxy.request(x);
	private static final Stage PUSH = x -> Proxies.push(x);
	private static final Stage PULL = x -> Proxies.pull(x);

	/**
	 * Requests twice and responds twice, recording every upstream reply as an effect.
	 */
	private static Stage stage(ProxyTrace trace, String name) {
		return x -> loop(trace, name, 2, x);
	}

	private static Proxy<Integer, Integer, Integer, Integer, Integer> loop(ProxyTrace trace, String name, int remaining, int x) {
		if (remaining == 0) return Proxy.pure(x);
		return Proxy.<Integer, Integer, Integer, Integer>request(x)
				.then(a -> Proxy.<Integer, Integer, Integer, Integer>execute(() -> trace.effect(name + a))
						.andThen(Proxy.<Integer, Integer, Integer, Integer>respond(a + 1)))
				.then(b -> loop(trace, name, remaining - 1, b));
	}

	private static List<String> observe(Function<ProxyTrace, Proxy<Integer, Integer, Integer, Integer, Integer>> build) throws Exception {
		ProxyTrace trace = new ProxyTrace();
		return trace.run(build.apply(trace), x -> x * 10, x -> x + 100);
	}

	@Test
	public void testStageTrace() throws Exception {
		assertEquals(asList("request:1", "effect:f10", "respond:11", "request:111", "effect:f1110", "respond:1111", "pure:1211"),
				observe(trace -> stage(trace, "f").apply(1)));
	}

	// region respond category
	@Test
	public void testRespondIdentities() throws Exception {
		List<String> expected = observe(trace -> stage(trace, "f").apply(1));
		assertEquals(expected, observe(trace -> composeRespond(RESPOND, stage(trace, "f")).apply(1)));
		assertEquals(expected, observe(trace -> composeRespond(stage(trace, "f"), RESPOND).apply(1)));
	}

	@Test
	public void testRespondAssociativity() throws Exception {
		List<String> left = observe(trace ->
				composeRespond(composeRespond(stage(trace, "f"), stage(trace, "g")), stage(trace, "h")).apply(1));
		List<String> right = observe(trace ->
				composeRespond(stage(trace, "f"), composeRespond(stage(trace, "g"), stage(trace, "h"))).apply(1));
		assertEquals(left, right);
	}
	// endregion

	// region request category
	@Test
	public void testRequestIdentities() throws Exception {
		List<String> expected = observe(trace -> stage(trace, "f").apply(1));
		assertEquals(expected, observe(trace -> composeRequest(REQUEST, stage(trace, "f")).apply(1)));
		assertEquals(expected, observe(trace -> composeRequest(stage(trace, "f"), REQUEST).apply(1)));
	}

	@Test
	public void testRequestAssociativity() throws Exception {
		List<String> left = observe(trace ->
				composeRequest(composeRequest(stage(trace, "f"), stage(trace, "g")), stage(trace, "h")).apply(1));
		List<String> right = observe(trace ->
				composeRequest(stage(trace, "f"), composeRequest(stage(trace, "g"), stage(trace, "h"))).apply(1));
		assertEquals(left, right);
	}
	// endregion

	// region push category
	@Test
	public void testPushIdentities() throws Exception {
		List<String> expected = observe(trace -> stage(trace, "f").apply(1));
		assertEquals(expected, observe(trace -> composePush(PUSH, stage(trace, "f")).apply(1)));
		assertEquals(expected, observe(trace -> composePush(stage(trace, "f"), PUSH).apply(1)));
	}

	@Test
	public void testPushAssociativity() throws Exception {
		List<String> left = observe(trace ->
				composePush(composePush(stage(trace, "f"), stage(trace, "g")), stage(trace, "h")).apply(1));
		List<String> right = observe(trace ->
				composePush(stage(trace, "f"), composePush(stage(trace, "g"), stage(trace, "h"))).apply(1));
		assertEquals(left, right);
	}
	// endregion

	// region pull category
	@Test
	public void testPullIdentities() throws Exception {
		List<String> expected = observe(trace -> stage(trace, "f").apply(1));
		assertEquals(expected, observe(trace -> composePull(PULL, stage(trace, "f")).apply(1)));
		assertEquals(expected, observe(trace -> composePull(stage(trace, "f"), PULL).apply(1)));
	}

	@Test
	public void testPullAssociativity() throws Exception {
		List<String> left = observe(trace ->
				composePull(composePull(stage(trace, "f"), stage(trace, "g")), stage(trace, "h")).apply(1));
		List<String> right = observe(trace ->
				composePull(stage(trace, "f"), composePull(stage(trace, "g"), stage(trace, "h"))).apply(1));
		assertEquals(left, right);
	}

	@Test
	public void testPullDrivenByDownstream() throws Exception {
		// the downstream stage asks first, so the upstream stage starts with its address
		assertEquals(asList("request:2", "effect:f20", "effect:g21", "respond:22"),
				observe(trace -> pullFrom(stage(trace, "f"), stage(trace, "g").apply(2))).subList(0, 4));
	}
	// endregion

	@Test
	public void testConnectIdentities() throws Exception {
		Source<Integer, Void> source = Source.of(1, 2, 3);
		assertEquals(asList(1, 2, 3), Source.ofProxy(connect(source.getProxy(), Proxies.<Integer, Void>cat())).toList());

		Transformer<Integer, Integer, Void> doubling = Transformers.map(x -> x * 2);
		assertEquals(asList(2, 4, 6), source.pipe(Transformer.ofProxy(connect(Proxies.<Integer, Void>cat(), doubling.getProxy()))).toList());
		assertEquals(asList(2, 4, 6), source.pipe(Transformer.ofProxy(connect(doubling.getProxy(), Proxies.<Integer, Void>cat()))).toList());
	}

	@Test
	public void testFeedRerunsSupplier() throws Exception {
		AtomicInteger counter = new AtomicInteger();
		Proxy<Never, Void, Void, Never, Integer> supplier = Proxy.lift(counter::incrementAndGet);
		Proxy<Void, Integer, Void, Never, Integer> consumer = Proxy.<Integer, Void, Never>await()
				.then(a -> Proxy.<Integer, Void, Never>await().map(b -> a * 10 + b));

		assertEquals(Integer.valueOf(12), Closed.ofProxy(feed(supplier, consumer)).run());
		assertEquals(2, counter.get());
	}

	@Test
	public void testOperatorsAreLazy() {
		AtomicInteger counter = new AtomicInteger();
		Proxy<Never, Void, Void, Integer, Void> source = Proxy.defer(() -> {
			counter.incrementAndGet();
			return Proxy.pure(null);
		});
		forRespond(source, x -> Proxy.<Never, Void, Void, Integer>respond(x));
		connect(source, Proxies.<Integer, Void>cat());
		pullFrom($ -> source, Proxies.<Integer, Void>cat());
		assertEquals(0, counter.get());
	}
}
