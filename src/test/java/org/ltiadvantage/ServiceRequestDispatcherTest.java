package org.ltiadvantage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

class ServiceRequestDispatcherTest extends AbstractConnectorTest {

	private Connector connector;

	@BeforeEach
	void openConnector() throws Exception {
		connector = connector(claimsWithServices());
	}

	@Test
	void sendsBearerTokenAndNegotiatedHeaders() throws Exception {
		server.enqueue(new MockResponse().setBody(Platform.tokenResponse("token-1", 3600)));
		server.enqueue(new MockResponse().setBody("{\"ok\":true}").addHeader("Content-Type", "application/json"));

		ServiceRequest request = new ServiceRequest("POST", platform.url("/things"), "scope-a").body("{\"name\":\"x\"}");
		try (ServiceResponse response = connector.dispatch(request)) {
			assertThat(response.getStatusCode()).isEqualTo(200);
			assertThat(response.readJson().getAsJsonObject().get("ok").getAsBoolean()).isTrue();
		}

		server.takeRequest();
		RecordedRequest call = server.takeRequest();
		assertThat(call.getMethod()).isEqualTo("POST");
		assertThat(call.getHeader("Authorization")).isEqualTo("Bearer token-1");
		assertThat(call.getHeader("Accept")).isEqualTo(ServiceRequest.JSON);
		assertThat(call.getHeader("Content-Type")).isEqualTo(ServiceRequest.JSON);
		assertThat(call.getBody().readUtf8()).isEqualTo("{\"name\":\"x\"}");
	}

	@Test
	void getCarriesNoContentType() throws Exception {
		server.enqueue(new MockResponse().setBody(Platform.tokenResponse("token-1", 3600)));
		server.enqueue(new MockResponse().setBody("[]"));

		connector.dispatch(new ServiceRequest("GET", platform.url("/things"), "scope-a").accept("application/vnd.example+json")).close();

		server.takeRequest();
		RecordedRequest call = server.takeRequest();
		assertThat(call.getHeader("Accept")).isEqualTo("application/vnd.example+json");
		assertThat(call.getHeader("Content-Type")).isNull();
	}

	@Test
	void unexpectedStatusIsServiceRequestError() throws Exception {
		server.enqueue(new MockResponse().setBody(Platform.tokenResponse("token-1", 3600)));
		server.enqueue(new MockResponse().setResponseCode(403).setBody("forbidden"));

		ServiceRequestException e = catchThrowableOfType(
				() -> connector.dispatch(new ServiceRequest("GET", platform.url("/things"), "scope-a")), ServiceRequestException.class);

		assertThat(e.getStatusCode()).isEqualTo(403);
		assertThat(e.getUri()).isEqualTo(platform.url("/things"));
	}

	@Test
	void acceptsDeclaredStatusOtherThan200() throws Exception {
		server.enqueue(new MockResponse().setBody(Platform.tokenResponse("token-1", 3600)));
		server.enqueue(new MockResponse().setResponseCode(204));

		try (ServiceResponse response = connector.dispatch(new ServiceRequest("DELETE", platform.url("/things/1"), "scope-a").expectStatus(204))) {
			assertThat(response.getStatusCode()).isEqualTo(204);
			assertThat(response.getBody().read()).isEqualTo(-1);
		}
	}

	@Test
	void requestWithoutScopesIsRejectedBeforeAnyCall() {
		assertThatThrownBy(() -> connector.dispatch(new ServiceRequest("GET", platform.url("/things"), List.of())))
				.isInstanceOf(ConnectorException.class);
		assertThat(server.getRequestCount()).isZero();
	}

	@Test
	void slowPlatformTimesOut() throws Exception {
		server.enqueue(new MockResponse().setBody(Platform.tokenResponse("token-1", 3600)));
		server.enqueue(new MockResponse().setBody("[]").setHeadersDelay(2, TimeUnit.SECONDS));

		ConnectorException e = catchThrowableOfType(
				() -> connector.dispatch(new ServiceRequest("GET", platform.url("/slow"), "scope-a").timeout(Duration.ofMillis(200))),
				ConnectorException.class);

		assertThat(e).hasCauseInstanceOf(SocketTimeoutException.class);
	}
}
