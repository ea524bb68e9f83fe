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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs a proxy against scripted upstream and downstream replies and records what it does.
 * Effects of the proxy under test may call {@link #effect} to appear in the same log.
 */
public final class ProxyTrace {
	private final List<String> events = new ArrayList<>();
	private final int maxEvents;

	public ProxyTrace(int maxEvents) {
		this.maxEvents = maxEvents;
	}

	public ProxyTrace() {
		this(1000);
	}

	public void effect(Object event) {
		events.add("effect:" + event);
	}

	public List<String> getEvents() {
		return events;
	}

	/**
	 * Steps {@code proxy} until it finishes or {@code maxEvents} events are recorded.
	 */
	@SuppressWarnings("unchecked")
	public <A1, A, B1, B, R> List<String> run(Proxy<A1, A, B1, B, R> proxy,
			Function<? super A1, ? extends A> upstream, Function<? super B, ? extends B1> downstream) throws Exception {
		Proxy<A1, A, B1, B, R> current = proxy;
		while (events.size() < maxEvents) {
			Proxy<A1, A, B1, B, R> step = current.step();
			if (step instanceof Request) {
				Request<A1, A, B1, B, R> request = (Request<A1, A, B1, B, R>) step;
				events.add("request:" + request.getAddress());
				current = request.resume(upstream.apply(request.getAddress()));
			} else if (step instanceof Respond) {
				Respond<A1, A, B1, B, R> respond = (Respond<A1, A, B1, B, R>) step;
				events.add("respond:" + respond.getValue());
				current = respond.resume(downstream.apply(respond.getValue()));
			} else if (step instanceof Action) {
				current = ((Action<A1, A, B1, B, R>) step).perform();
			} else {
				events.add("pure:" + ((Pure<A1, A, B1, B, R>) step).getResult());
				break;
			}
		}
		return events;
	}
}
