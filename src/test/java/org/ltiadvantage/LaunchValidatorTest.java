package org.ltiadvantage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.auth0.jwt.algorithms.Algorithm;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class LaunchValidatorTest {

	private static final String STATE = "state-1234";

	private MockWebServer server;
	private Platform platform;
	private InMemoryStore store;
	private LaunchValidator validator;

	@BeforeEach
	void setUp() throws Exception {
		server = new MockWebServer();
		server.start();
		platform = new Platform(server);
		String jwks = platform.key.toJwks().toString();
		server.setDispatcher(new Dispatcher() {
			@Override
			public MockResponse dispatch(RecordedRequest request) {
				if ("/jwks".equals(request.getPath())) return new MockResponse().setBody(jwks).addHeader("Content-Type", "application/json");
				return new MockResponse().setResponseCode(404);
			}
		});
		store = new InMemoryStore();
		platform.register(store);
		store.storeNonce("nonce-1", Platform.TARGET_LINK_URI);
		validator = new LaunchValidator(Datastores.of(store), Duration.ofSeconds(5));
	}

	@AfterEach
	void tearDown() throws IOException {
		server.shutdown();
	}

	private LaunchException rejection(String idToken) {
		return catchThrowableOfType(() -> validator.validate(idToken, STATE, STATE), LaunchException.class);
	}

	@Test
	void acceptsValidLaunchAndStoresItsClaims() throws Exception {
		String launchId = validator.validate(platform.sign(platform.idToken("nonce-1")), STATE, STATE);

		assertThat(launchId).startsWith(LaunchValidator.LAUNCH_ID_PREFIX);
		LaunchClaims claims = LaunchClaims.parse(store.findLaunchData(launchId));
		assertThat(claims.getIssuer()).isEqualTo(Platform.ISSUER);
		assertThat(claims.getSubject()).isEqualTo(Platform.SUBJECT);
		assertThat(claims.getResourceLink().getId()).isEqualTo("resource-link-1");
		assertThat(claims.getAgsEndpoint().getScopes()).contains(Ags.SCOPE_SCORE);
	}

	@Test
	void rejectsMissingIdToken() {
		LaunchException e = rejection(null);
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.TOKEN);
	}

	@Test
	void rejectsTokenThatIsNotJwt() {
		LaunchException e = rejection("not-a-jwt");
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.TOKEN);
	}

	@Test
	void rejectsUnknownIssuer() {
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1").withIssuer("https://unknown.example.com")));
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.REGISTRATION);
	}

	@Test
	void registrationLookupFailureIsServerError() throws Exception {
		RegistrationStore registrations = mock(RegistrationStore.class);
		when(registrations.findRegistration(anyString(), anyString())).thenThrow(new DatastoreException("database down"));
		validator = new LaunchValidator(new Datastores(registrations, store, store, store), Duration.ofSeconds(5));

		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1")));
		assertThat(e.getStatusCode()).isEqualTo(500);
		assertThat(e.getStep()).isEqualTo(LaunchStep.REGISTRATION);
	}

	@Test
	void rejectsTamperedSignatureBeforeConsumingNonce() throws Exception {
		ToolKey forger = ToolKey.generate();
		String forged = platform.idToken("nonce-1").sign(Algorithm.RSA256(null, forger.getPrivateKey()));

		LaunchException e = rejection(forged);
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.SIGNATURE);
		assertThatCode(() -> store.testAndClearNonce("nonce-1", Platform.TARGET_LINK_URI)).doesNotThrowAnyException();
	}

	@Test
	void rejectsUnknownKeyId() {
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1").withKeyId("some-other-key")));
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.SIGNATURE);
	}

	@Test
	void rejectsExpiredToken() {
		Instant past = Instant.now().minusSeconds(3600);
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1")
				.withIssuedAt(Date.from(past.minusSeconds(60)))
				.withExpiresAt(Date.from(past))));
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.SIGNATURE);
	}

	@Test
	void unreachableKeysetIsServerError() throws Exception {
		store.storeRegistration(new Registration(Platform.ISSUER, Platform.CLIENT_ID,
				platform.url("/token"), platform.url("/auth"), platform.url("/missing-jwks"), Platform.TARGET_LINK_URI));

		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1")));
		assertThat(e.getStatusCode()).isEqualTo(500);
		assertThat(e.getStep()).isEqualTo(LaunchStep.SIGNATURE);
	}

	@Test
	void rejectsMalformedClaims() {
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1").withClaim(LaunchClaims.RESOURCE_LINK, "not-an-object")));
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.SIGNATURE);
	}

	@Test
	void rejectsMissingOrMismatchedStateCookie() {
		String idToken = platform.sign(platform.idToken("nonce-1"));

		LaunchException missing = catchThrowableOfType(() -> validator.validate(idToken, STATE, null), LaunchException.class);
		assertThat(missing.getStep()).isEqualTo(LaunchStep.STATE);
		assertThat(missing.getStatusCode()).isEqualTo(400);

		LaunchException mismatched = catchThrowableOfType(() -> validator.validate(idToken, STATE, "state-other"), LaunchException.class);
		assertThat(mismatched.getStep()).isEqualTo(LaunchStep.STATE);
	}

	@Test
	void rejectsAudienceWithoutClientId() {
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1")
				.withAudience("another-client")
				.withClaim("azp", Platform.CLIENT_ID)));
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.AUDIENCE);
	}

	@Test
	void rejectsSeveralAudiencesWithoutAuthorizedParty() {
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1").withAudience(Platform.CLIENT_ID, "another-client")));
		assertThat(e.getStep()).isEqualTo(LaunchStep.AUDIENCE);
	}

	@Test
	void acceptsSeveralAudiencesWithMatchingAuthorizedParty() {
		assertThatCode(() -> validator.validate(platform.sign(platform.idToken("nonce-1")
				.withAudience(Platform.CLIENT_ID, "another-client")
				.withClaim("azp", Platform.CLIENT_ID)), STATE, STATE)).doesNotThrowAnyException();
	}

	@Test
	void rejectsReplayedNonce() throws Exception {
		String idToken = platform.sign(platform.idToken("nonce-1"));
		validator.validate(idToken, STATE, STATE);

		LaunchException e = rejection(idToken);
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.NONCE);
	}

	@Test
	void rejectsNonceIssuedForAnotherTarget() throws Exception {
		store.storeNonce("nonce-2", "https://tool.example.com/elsewhere");

		LaunchException e = rejection(platform.sign(platform.idToken("nonce-2")));
		assertThat(e.getStep()).isEqualTo(LaunchStep.NONCE);
		assertThat(e.getMessage()).contains("target_link_uri");
	}

	@Test
	void rejectsUnknownDeployment() {
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1").withClaim(LaunchClaims.DEPLOYMENT_ID, "deployment-9")));
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.DEPLOYMENT);
	}

	@Test
	void rejectsUnsupportedVersionWithoutStoringLaunch() throws Exception {
		LaunchDataStore launchData = mock(LaunchDataStore.class);
		validator = new LaunchValidator(new Datastores(store, store, launchData, store), Duration.ofSeconds(5));

		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1")
				.withClaim(LaunchClaims.VERSION, "1.2.0")
				.withClaim(LaunchClaims.RESOURCE_LINK, Map.of("title", "no id"))));
		assertThat(e.getStatusCode()).isEqualTo(400);
		assertThat(e.getStep()).isEqualTo(LaunchStep.VERSION);
		verify(launchData, never()).storeLaunchData(anyString(), anyString());
	}

	@Test
	void rejectsOtherMessageTypes() {
		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1").withClaim(LaunchClaims.MESSAGE_TYPE, "LtiDeepLinkingRequest")));
		assertThat(e.getStep()).isEqualTo(LaunchStep.VERSION);
	}

	@Test
	void rejectsMissingOrOversizedResourceLinkId() throws Exception {
		LaunchException missing = rejection(platform.sign(platform.idToken("nonce-1").withClaim(LaunchClaims.RESOURCE_LINK, Map.of("title", "Quiz 1"))));
		assertThat(missing.getStep()).isEqualTo(LaunchStep.RESOURCE_LINK);

		store.storeNonce("nonce-2", Platform.TARGET_LINK_URI);
		LaunchException oversized = rejection(platform.sign(platform.idToken("nonce-2").withClaim(LaunchClaims.RESOURCE_LINK, Map.of("id", "x".repeat(256)))));
		assertThat(oversized.getStatusCode()).isEqualTo(400);
		assertThat(oversized.getStep()).isEqualTo(LaunchStep.RESOURCE_LINK);
	}

	@Test
	void launchDataFailureIsServerError() throws Exception {
		LaunchDataStore launchData = mock(LaunchDataStore.class);
		doThrow(new DatastoreException("disk full")).when(launchData).storeLaunchData(anyString(), anyString());
		validator = new LaunchValidator(new Datastores(store, store, launchData, store), Duration.ofSeconds(5));

		LaunchException e = rejection(platform.sign(platform.idToken("nonce-1")));
		assertThat(e.getStatusCode()).isEqualTo(500);
		assertThat(e.getStep()).isEqualTo(LaunchStep.LAUNCH_DATA);
	}

	@Test
	void readsLegacyStateCookieFromRequest() throws Exception {
		HttpServletRequest request = mock(HttpServletRequest.class);
		when(request.getParameter("id_token")).thenReturn(platform.sign(platform.idToken("nonce-1")));
		when(request.getParameter("state")).thenReturn(STATE);
		when(request.getCookies()).thenReturn(new Cookie[] {new Cookie(LaunchValidator.LEGACY_STATE_COOKIE, STATE)});

		assertThat(validator.validate(request)).startsWith(LaunchValidator.LAUNCH_ID_PREFIX);
	}

	@Test
	void prefersCurrentStateCookieOverLegacy() {
		HttpServletRequest request = mock(HttpServletRequest.class);
		when(request.getCookies()).thenReturn(new Cookie[] {
				new Cookie(LaunchValidator.LEGACY_STATE_COOKIE, "legacy"),
				new Cookie(LaunchValidator.STATE_COOKIE, "current")});

		assertThat(LaunchValidator.stateCookie(request)).isEqualTo("current");
	}
}
