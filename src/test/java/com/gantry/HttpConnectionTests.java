/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.gantry;

import com.gantry.TestSupport.InMemoryTransport;
import com.gantry.TestSupport.QuietLifecycleObserver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.gantry.TestSupport.bytes;

@ThreadSafe
public class HttpConnectionTests {
	@Test
	public void serves_requests_until_the_client_goes_away() {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		InMemoryTransport transport = new InMemoryTransport(bytes("GET /a HTTP/1.1\r\n\r\nGET /b HTTP/1.1\r\n\r\n"));
		ServerCounters serverCounters = new ServerCounters();
		HttpConnection connection = connection(transport, serverCounters, lifecycleObserver);

		connection.run();

		ConnectionSummary connectionSummary = lifecycleObserver.connectionSummaries.get(0);
		Assertions.assertEquals(ConnectionCloseReason.CLIENT_CLOSED, connectionSummary.closeReason());
		Assertions.assertEquals(2, connectionSummary.requestCount());
		Assertions.assertEquals(List.of(200, 200), lifecycleObserver.statusCodes);
		Assertions.assertEquals(ConnectionState.CLOSED, connection.getState());
		Assertions.assertTrue(transport.isClosed());
		Assertions.assertEquals(2, transport.getOutput().split("HTTP/1.1 200 OK").length - 1);

		ServerStatistics statistics = serverCounters.snapshot(null);
		Assertions.assertEquals(2L, statistics.requests());
		Assertions.assertEquals(0, statistics.activeConnections());
		Assertions.assertEquals(connectionSummary.bytesWritten(), statistics.bytesWritten());
	}

	@Test
	public void protocol_errors_answer_and_close() {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		InMemoryTransport transport = new InMemoryTransport(bytes("GET / HTTP/1.1\r\nBad Header\r\n\r\nGET / HTTP/1.1\r\n\r\n"));
		HttpConnection connection = connection(transport, new ServerCounters(), lifecycleObserver);

		connection.run();

		Assertions.assertTrue(transport.getOutput().startsWith("HTTP/1.1 400 Bad Request\r\n"), transport.getOutput());
		Assertions.assertEquals(1, transport.getOutput().split("HTTP/1.1 ").length - 1);
		Assertions.assertEquals(ConnectionCloseReason.PROTOCOL_ERROR, lifecycleObserver.connectionSummaries.get(0).closeReason());
		Assertions.assertEquals(1, connection.getRequestCount());
		Assertions.assertTrue(lifecycleObserver.statusCodes.isEmpty());
	}

	@Test
	public void truncated_body_is_treated_as_client_disconnect() {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		InMemoryTransport transport = new InMemoryTransport(bytes("POST / HTTP/1.1\r\nContent-Length: 10\r\n\r\nabc"));
		Gateway gateway = (request, responseStarter) -> {
			byte[] body = request.getBody().readAllBytes();
			responseStarter.startResponse(200, Headers.empty());
			return ResponseBody.ofBytes(body);
		};
		HttpConnection connection = new HttpConnection(1L, transport, serverConfig(), gateway, null, workerPool(),
				new ServerCounters(), lifecycleObserver);

		connection.run();

		Assertions.assertEquals(ConnectionCloseReason.CLIENT_CLOSED, lifecycleObserver.connectionSummaries.get(0).closeReason());
		Assertions.assertEquals("", transport.getOutput());
		Assertions.assertTrue(lifecycleObserver.logEvents.isEmpty());
	}

	@Test
	public void rejected_connection_gets_503() {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		InMemoryTransport transport = new InMemoryTransport(bytes("GET / HTTP/1.1\r\n\r\n"));
		ServerCounters serverCounters = new ServerCounters();
		HttpConnection connection = connection(transport, serverCounters, lifecycleObserver);

		connection.reject();
		connection.run();

		Assertions.assertTrue(transport.getOutput().startsWith("HTTP/1.1 503 Service Unavailable\r\n"), transport.getOutput());
		Assertions.assertTrue(transport.isClosed());
		Assertions.assertEquals(0, serverCounters.snapshot(null).activeConnections());
		Assertions.assertTrue(lifecycleObserver.statusCodes.isEmpty());
	}

	@Test
	public void aborted_before_running_reports_shutdown() {
		RecordingLifecycleObserver lifecycleObserver = new RecordingLifecycleObserver();
		InMemoryTransport transport = new InMemoryTransport(bytes("GET / HTTP/1.1\r\n\r\n"));
		HttpConnection connection = connection(transport, new ServerCounters(), lifecycleObserver);

		connection.abort();
		connection.run();

		Assertions.assertEquals(1, lifecycleObserver.connectionSummaries.size());
		Assertions.assertEquals(ConnectionCloseReason.SERVER_SHUTDOWN, lifecycleObserver.connectionSummaries.get(0).closeReason());
		Assertions.assertEquals("", transport.getOutput());
	}

	@Test
	public void failing_observer_does_not_break_the_connection() {
		List<LogEvent> logEvents = new ArrayList<>();
		LifecycleObserver lifecycleObserver = new QuietLifecycleObserver() {
			@Override
			public void willStartRequestHandling(Request request) {
				throw new IllegalStateException("observer failure");
			}

			@Override
			public void didReceiveLogEvent(LogEvent logEvent) {
				logEvents.add(logEvent);
			}
		};
		InMemoryTransport transport = new InMemoryTransport(bytes("GET / HTTP/1.1\r\n\r\n"));

		connection(transport, new ServerCounters(), lifecycleObserver).run();

		Assertions.assertTrue(transport.getOutput().startsWith("HTTP/1.1 200 OK\r\n"));
		Assertions.assertEquals(LogEventType.LIFECYCLE_OBSERVER_FAILED, logEvents.get(0).getLogEventType());
	}

	private static HttpConnection connection(InMemoryTransport transport,
																					 ServerCounters serverCounters,
																					 LifecycleObserver lifecycleObserver) {
		Gateway gateway = Gateway.withResponder(request -> Response.withStatusCode(200).body("ok").build());
		return new HttpConnection(1L, transport, serverConfig(), gateway, null, workerPool(), serverCounters, lifecycleObserver);
	}

	private static ServerConfig serverConfig() {
		return ServerConfig.withPort(0).build();
	}

	// Never started; connections only consult its shutdown and saturation state
	private static WorkerPool workerPool() {
		return new WorkerPool(1, 1, Duration.ofSeconds(1), 0, Duration.ofSeconds(1), "unused", logEvent -> {});
	}

	private static final class RecordingLifecycleObserver extends QuietLifecycleObserver {
		private final List<ConnectionSummary> connectionSummaries = new ArrayList<>();
		private final List<Integer> statusCodes = new ArrayList<>();
		private final List<LogEvent> logEvents = new ArrayList<>();

		@Override
		public void didFinishRequestHandling(Request request, Integer statusCode, Duration duration, Throwable throwable) {
			statusCodes.add(statusCode);
		}

		@Override
		public void didCloseConnection(ConnectionSummary connectionSummary) {
			connectionSummaries.add(connectionSummary);
		}

		@Override
		public void didReceiveLogEvent(LogEvent logEvent) {
			logEvents.add(logEvent);
		}
	}
}
