package org.ltiadvantage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

class AgsTest extends AbstractConnectorTest {

	private static final String[] ALL_SCOPES = {Ags.SCOPE_SCORE, Ags.SCOPE_RESULT_READONLY, Ags.SCOPE_LINEITEM};

	private MockResponse token() {
		return new MockResponse().setBody(Platform.tokenResponse("token-1", 3600));
	}

	private static String result(String userId, double score) {
		return "{\"id\":\"r-" + userId + "\",\"userId\":\"" + userId + "\",\"resultScore\":" + score + ",\"resultMaximum\":10}";
	}

	@Test
	void launchWithoutAgsClaimIsUnsupported() throws Exception {
		Connector connector = connector(Platform.claims(null, null, null));

		assertThatThrownBy(connector::upgradeAgs).isInstanceOf(ServiceUnsupportedException.class);
	}

	@Test
	void claimWithoutLineItemsIsUnsupported() throws Exception {
		JsonObject claims = claimsWithServices(ALL_SCOPES);
		claims.getAsJsonObject(LaunchClaims.AGS_ENDPOINT).remove("lineitems");
		Connector connector = connector(claims);

		assertThatThrownBy(connector::upgradeAgs).isInstanceOf(ServiceUnsupportedException.class);
	}

	@Test
	void ungrantedScopeFailsWithoutRequest() throws Exception {
		Ags ags = connector(claimsWithServices(Ags.SCOPE_LINEITEM_READONLY)).upgradeAgs();

		assertThatThrownBy(() -> ags.putScore(new Score(8.0, 10.0, ActivityProgress.COMPLETED, GradingProgress.FULLY_GRADED)))
				.isInstanceOf(ServiceUnsupportedException.class);
		assertThat(server.getRequestCount()).isZero();
	}

	@Test
	void readWriteScopeCoversReadOnly() throws Exception {
		Ags ags = connector(claimsWithServices(Ags.SCOPE_LINEITEM)).upgradeAgs();

		ags.requireScope(Ags.SCOPE_LINEITEM_READONLY);
		assertThatThrownBy(() -> ags.requireScope(Ags.SCOPE_RESULT_READONLY)).isInstanceOf(ServiceUnsupportedException.class);
	}

	@Test
	void putScorePostsToScoresOfLaunchedLineItem() throws Exception {
		server.enqueue(token());
		server.enqueue(new MockResponse().setResponseCode(200));
		Ags ags = connector(claimsWithServices(ALL_SCOPES)).upgradeAgs();

		Score score = new Score(8.0, 10.0, ActivityProgress.COMPLETED, GradingProgress.FULLY_GRADED);
		score.setComment("Well done");
		ags.putScore(score);

		RecordedRequest tokenRequest = server.takeRequest();
		assertThat(form(tokenRequest.getBody().readUtf8())).containsEntry("scope", Ags.SCOPE_SCORE);
		RecordedRequest post = server.takeRequest();
		assertThat(post.getMethod()).isEqualTo("POST");
		assertThat(post.getPath()).isEqualTo("/lineitems/1/scores?type=x");
		assertThat(post.getHeader("Content-Type")).isEqualTo(Ags.SCORE_TYPE);
		JsonObject body = JsonParser.parseString(post.getBody().readUtf8()).getAsJsonObject();
		assertThat(body.get("userId").getAsString()).isEqualTo(Platform.SUBJECT);
		assertThat(body.get("scoreGiven").getAsDouble()).isEqualTo(8.0);
		assertThat(body.get("scoreMaximum").getAsDouble()).isEqualTo(10.0);
		assertThat(body.get("activityProgress").getAsString()).isEqualTo("Completed");
		assertThat(body.get("gradingProgress").getAsString()).isEqualTo("FullyGraded");
		assertThat(body.get("comment").getAsString()).isEqualTo("Well done");
		assertThat(body.get("timestamp").getAsString()).isEqualTo(clock.instant().toString());
	}

	@Test
	void reusedScoreGoesToEachLaunchingUser() throws Exception {
		server.enqueue(token());
		server.enqueue(new MockResponse().setResponseCode(200));
		server.enqueue(new MockResponse().setResponseCode(200));
		JsonObject alice = claimsWithServices(ALL_SCOPES);
		alice.addProperty("sub", "alice");
		JsonObject bob = claimsWithServices(ALL_SCOPES);
		bob.addProperty("sub", "bob");
		Score score = new Score(8.0, 10.0, ActivityProgress.COMPLETED, GradingProgress.FULLY_GRADED);

		connector(alice).upgradeAgs().putScore(score);
		connector(bob).upgradeAgs().putScore(score);

		assertThat(score.getUserId()).isNull();
		assertThat(score.getTimestamp()).isNull();
		server.takeRequest();
		assertThat(JsonParser.parseString(server.takeRequest().getBody().readUtf8()).getAsJsonObject().get("userId").getAsString()).isEqualTo("alice");
		assertThat(JsonParser.parseString(server.takeRequest().getBody().readUtf8()).getAsJsonObject().get("userId").getAsString()).isEqualTo("bob");
	}

	@Test
	void explicitUserIdIsKept() throws Exception {
		server.enqueue(token());
		server.enqueue(new MockResponse().setResponseCode(200));
		Score score = new Score(5.0, 10.0, ActivityProgress.COMPLETED, GradingProgress.FULLY_GRADED);
		score.setUserId("user-7");
		score.setTimestamp("2024-03-01T12:00:00Z");

		connector(claimsWithServices(ALL_SCOPES)).upgradeAgs().putScore(score);

		server.takeRequest();
		JsonObject body = JsonParser.parseString(server.takeRequest().getBody().readUtf8()).getAsJsonObject();
		assertThat(body.get("userId").getAsString()).isEqualTo("user-7");
		assertThat(body.get("timestamp").getAsString()).isEqualTo("2024-03-01T12:00:00Z");
	}

	@Test
	void relativeNextLinkIsResolvedAgainstCurrentPage() throws Exception {
		server.enqueue(token());
		server.enqueue(new MockResponse().setBody("[" + result("u1", 7) + "]")
				.addHeader("Link", "</lineitems/1/results?page=2&fields=id,score>; rel=\"next\""));
		server.enqueue(new MockResponse().setBody("[" + result("u2", 8) + "]"));
		Ags ags = connector(claimsWithServices(ALL_SCOPES)).upgradeAgs();

		List<Result> results = ags.getResults();

		assertThat(results).extracting(Result::getUserId).containsExactly("u1", "u2");
		server.takeRequest();
		server.takeRequest();
		assertThat(server.takeRequest().getPath()).isEqualTo("/lineitems/1/results?page=2&fields=id,score");
	}

	@Test
	void getResultsFollowsEveryPageInOrder() throws Exception {
		server.enqueue(token());
		server.enqueue(new MockResponse().setBody("[" + result("u1", 7) + "]")
				.addHeader("Link", "<" + platform.url("/lineitems/1/results?page=2") + ">; rel=\"next\""));
		server.enqueue(new MockResponse().setBody("[" + result("u2", 8) + "]")
				.addHeader("Link", "<" + platform.url("/lineitems/1/results?page=3") + ">; rel=\"next\""));
		server.enqueue(new MockResponse().setBody("[" + result("u3", 9) + "]"));
		Ags ags = connector(claimsWithServices(ALL_SCOPES)).upgradeAgs();

		List<Result> results = ags.getResults();

		assertThat(results).extracting(Result::getUserId).containsExactly("u1", "u2", "u3");
		assertThat(results.get(2).getResultScore()).isEqualTo(9.0);
		assertThat(server.getRequestCount()).isEqualTo(4);
		server.takeRequest();
		RecordedRequest first = server.takeRequest();
		assertThat(first.getPath()).isEqualTo("/lineitems/1/results?type=x");
		assertThat(first.getHeader("Accept")).isEqualTo(Ags.RESULT_CONTAINER_TYPE);
		assertThat(server.takeRequest().getPath()).isEqualTo("/lineitems/1/results?page=2");
		assertThat(server.takeRequest().getPath()).isEqualTo("/lineitems/1/results?page=3");
	}

	@Test
	void pagerStopsAfterLastPage() throws Exception {
		server.enqueue(token());
		server.enqueue(new MockResponse().setBody("[" + result("u1", 7) + "]")
				.addHeader("Link", "<" + platform.url("/lineitems/1/results?page=2") + ">; rel=\"next\""));
		server.enqueue(new MockResponse().setBody("[]"));
		Ags ags = connector(claimsWithServices(ALL_SCOPES)).upgradeAgs();

		Pager<List<Result>> pager = ags.getPagedResults(1, "u1");
		assertThat(pager.getNextUri()).isEqualTo(platform.url("/lineitems/1/results?type=x&limit=1&user_id=u1"));
		assertThat(pager.nextPage()).hasSize(1);
		assertThat(pager.hasMorePages()).isTrue();
		assertThat(pager.nextPage()).isEmpty();
		assertThat(pager.hasMorePages()).isFalse();
		assertThat(pager.getPagesRead()).isEqualTo(2);
		assertThatThrownBy(pager::nextPage).isInstanceOf(NoSuchElementException.class);
	}

	@Test
	void negativeLimitIsRejected() throws Exception {
		Ags ags = connector(claimsWithServices(ALL_SCOPES)).upgradeAgs();

		assertThatThrownBy(() -> ags.getPagedResults(-1, null)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void createdLineItemReadsBackWithSameContent() throws Exception {
		AtomicReference<String> created = new AtomicReference<String>();
		server.setDispatcher(new Dispatcher() {
			@Override
			public MockResponse dispatch(RecordedRequest request) {
				String path = request.getPath();
				if (path.equals("/token")) return token();
				if (request.getMethod().equals("POST") && path.equals("/lineitems")) {
					JsonObject item = JsonParser.parseString(request.getBody().readUtf8()).getAsJsonObject();
					item.addProperty("id", platform.url("/lineitems/7"));
					created.set(item.toString());
					return new MockResponse().setBody(created.get());
				}
				if (request.getMethod().equals("GET") && path.equals("/lineitems") && created.get() != null)
					return new MockResponse().setBody("[" + created.get() + "]");
				return new MockResponse().setResponseCode(404);
			}
		});
		Ags ags = connector(claimsWithServices(ALL_SCOPES)).upgradeAgs();

		LineItem item = new LineItem("Chapter 3 quiz", 25.0);
		item.setTag("quiz");
		item.setResourceId("chapter-3");
		LineItem stored = ags.createLineItem(item);

		assertThat(stored.getId()).isEqualTo(platform.url("/lineitems/7"));
		assertThat(stored.sameContent(item)).isTrue();
		List<LineItem> listed = ags.getLineItems();
		assertThat(listed).hasSize(1);
		assertThat(listed.get(0).sameContent(item)).isTrue();
		// lineitem and lineitem.readonly are cached as separate tokens
		assertThat(server.getRequestCount()).isEqualTo(4);
	}

	@Test
	void updateAndDeleteDefaultToLaunchedLineItem() throws Exception {
		server.enqueue(token());
		server.enqueue(new MockResponse().setBody("{\"id\":\"" + platform.url("/lineitems/1") + "\",\"label\":\"Renamed\",\"scoreMaximum\":10}"));
		server.enqueue(new MockResponse().setResponseCode(200));
		Ags ags = connector(claimsWithServices(ALL_SCOPES)).upgradeAgs();

		LineItem updated = ags.updateLineItem(new LineItem("Renamed", 10.0), null);
		ags.deleteLineItem(null);

		assertThat(updated.getLabel()).isEqualTo("Renamed");
		server.takeRequest();
		RecordedRequest put = server.takeRequest();
		assertThat(put.getMethod()).isEqualTo("PUT");
		assertThat(put.getPath()).isEqualTo("/lineitems/1?type=x");
		assertThat(put.getHeader("Content-Type")).isEqualTo(Ags.LINEITEM_TYPE);
		RecordedRequest delete = server.takeRequest();
		assertThat(delete.getMethod()).isEqualTo("DELETE");
		assertThat(delete.getPath()).isEqualTo("/lineitems/1?type=x");
	}

	@Test
	void appendPathKeepsQuery() {
		assertThat(Ags.appendPath("https://lms.example.edu/lineitems/1?type=x", "/scores")).isEqualTo("https://lms.example.edu/lineitems/1/scores?type=x");
		assertThat(Ags.appendPath("https://lms.example.edu/lineitems/1/", "/results")).isEqualTo("https://lms.example.edu/lineitems/1/results");
	}
}
