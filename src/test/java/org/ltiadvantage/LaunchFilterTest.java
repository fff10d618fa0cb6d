package org.ltiadvantage;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import jakarta.servlet.FilterChain;
import jakarta.servlet.FilterConfig;
import jakarta.servlet.ServletContext;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@ExtendWith(MockitoExtension.class)
class LaunchFilterTest {

	@Mock
	private LaunchValidator validator;

	@Mock
	private HttpServletRequest request;

	@Mock
	private HttpServletResponse response;

	@Mock
	private FilterChain chain;

	private LaunchFilter filter;

	@BeforeEach
	void setUp() {
		filter = new LaunchFilter(validator);
	}

	@Test
	void validLaunchContinuesWithLaunchId() throws Exception {
		when(request.getMethod()).thenReturn("POST");
		when(validator.validate(request)).thenReturn("lti1p3-launch-1");

		filter.doFilter(request, response, chain);

		verify(request).setAttribute(LaunchFilter.LAUNCH_ID_ATTRIBUTE, "lti1p3-launch-1");
		verify(chain).doFilter(request, response);
		verify(response, never()).sendError(anyInt(), anyString());
	}

	@Test
	void rejectedLaunchSendsStatusOfFailedStep() throws Exception {
		when(request.getMethod()).thenReturn("POST");
		when(validator.validate(request)).thenThrow(LaunchException.badRequest(LaunchStep.NONCE, "The nonce is unknown, expired or already used."));

		filter.doFilter(request, response, chain);

		verify(response).sendError(400, "The nonce is unknown, expired or already used.");
		verify(chain, never()).doFilter(any(ServletRequest.class), any(ServletResponse.class));
	}

	@Test
	void serverSideFailureSends500() throws Exception {
		when(request.getMethod()).thenReturn("POST");
		when(validator.validate(request)).thenThrow(LaunchException.serverError(LaunchStep.SIGNATURE, "Unable to fetch the platform JWKS", null));

		filter.doFilter(request, response, chain);

		verify(response).sendError(500, "Unable to fetch the platform JWKS");
	}

	@Test
	void getIsNotAllowed() throws Exception {
		when(request.getMethod()).thenReturn("GET");

		filter.doFilter(request, response, chain);

		verify(response).sendError(HttpServletResponse.SC_METHOD_NOT_ALLOWED, "LTI launches must be POSTed.");
		verify(validator, never()).validate(any(HttpServletRequest.class));
	}

	@Test
	void initFailsWithoutValidatorInContext(@Mock FilterConfig config, @Mock ServletContext context) {
		when(config.getServletContext()).thenReturn(context);

		assertThatThrownBy(() -> new LaunchFilter().init(config))
				.isInstanceOf(ServletException.class)
				.hasMessageContaining("LaunchValidator");
		verify(context).getAttribute(contains("validator"));
	}
}
